package com.cohortengine.model.cohort;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * Append-only membership assertion (+1) or retraction (-1) for one person at
 * one cohort version. Net membership is {@code SUM(sign) > 0} over committed versions.
 */
@Entity
@Table(name = "cohort_membership", indexes = {
    @Index(name = "idx_membership_cohort_person", columnList = "cohort_id, person_id, version"),
    @Index(name = "idx_membership_person", columnList = "team_id, person_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CohortMembershipRow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "cohort_id", nullable = false)
    private Long cohortId;

    @Column(name = "team_id", nullable = false)
    private Long teamId;

    @Column(name = "person_id", nullable = false)
    private UUID personId;

    @Column(name = "version", nullable = false)
    private Integer version;

    @Column(name = "sign", nullable = false)
    private Short sign;
}
