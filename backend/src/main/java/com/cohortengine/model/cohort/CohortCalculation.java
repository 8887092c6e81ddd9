package com.cohortengine.model.cohort;

import com.cohortengine.model.enums.CalculationStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One materialization attempt of a cohort.
 *
 * Only membership rows whose version has a COMMITTED calculation are visible
 * to readers; rows left behind by failed or superseded attempts are ignored.
 */
@Entity
@Table(name = "cohort_calculation", indexes = {
    @Index(name = "idx_calculation_cohort_version", columnList = "cohort_id, version")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CohortCalculation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "cohort_id", nullable = false)
    private Long cohortId;

    @Column(name = "team_id", nullable = false)
    private Long teamId;

    @Column(name = "version", nullable = false)
    private Integer version;

    /**
     * Committed version the delta was computed against (null for the first calculation).
     */
    @Column(name = "base_version")
    private Integer baseVersion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CalculationStatus status;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "added_count")
    @Builder.Default
    private long addedCount = 0;

    @Column(name = "removed_count")
    @Builder.Default
    private long removedCount = 0;

    @Column(name = "member_count")
    private Long memberCount;

    @Column(columnDefinition = "TEXT")
    private String error;
}
