package com.cohortengine.model.cohort;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Explicit membership of a person in a static cohort. Presence means membership.
 */
@Entity
@Table(name = "static_cohort_person",
    uniqueConstraints = @UniqueConstraint(name = "uq_static_cohort_person", columnNames = {"cohort_id", "person_id"}),
    indexes = @Index(name = "idx_static_person", columnList = "team_id, person_id"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StaticCohortPerson {

    @Id
    private UUID id;

    @Column(name = "person_id", nullable = false)
    private UUID personId;

    @Column(name = "cohort_id", nullable = false)
    private Long cohortId;

    @Column(name = "team_id", nullable = false)
    private Long teamId;

    @Column(name = "inserted_at", nullable = false)
    private Instant insertedAt;
}
