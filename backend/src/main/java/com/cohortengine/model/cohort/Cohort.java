package com.cohortengine.model.cohort;

import com.cohortengine.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * A named set of persons, either listed explicitly (static) or defined by a
 * predicate over events and person properties (dynamic).
 *
 * The predicate is stored as a JSON blob in {@code filters}. Dynamic membership
 * lives in {@code cohort_membership}; {@code version} is the last committed
 * membership version and {@code pendingVersion} the last one handed out.
 */
@Entity
@Table(name = "cohort", indexes = {
    @Index(name = "idx_cohort_team", columnList = "team_id")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class Cohort extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "team_id", nullable = false)
    private Long teamId;

    @Column(length = 400)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "is_static", nullable = false)
    @Builder.Default
    private boolean isStatic = false;

    /**
     * Cohort definition as JSON: {@code {"groups": [...]}}.
     */
    @Column(name = "filters", columnDefinition = "TEXT")
    private String filters;

    @Column(nullable = false)
    @Builder.Default
    private boolean deleted = false;

    @Column(name = "version")
    private Integer version;

    @Column(name = "pending_version", nullable = false)
    @Builder.Default
    private int pendingVersion = 0;

    @Column(name = "is_calculating", nullable = false)
    @Builder.Default
    private boolean isCalculating = false;

    @Column(name = "last_calculation")
    private Instant lastCalculation;

    @Column(name = "member_count")
    private Long memberCount;

    @Column(name = "errors_calculating", nullable = false)
    @Builder.Default
    private int errorsCalculating = 0;
}
