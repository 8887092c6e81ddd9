package com.cohortengine.model.cohort;

import com.cohortengine.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * Named event matcher referenced by behavioral cohort clauses.
 * Matches an event when any of its steps matches.
 */
@Entity
@Table(name = "action_definition", indexes = {
    @Index(name = "idx_action_team", columnList = "team_id")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class Action extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "team_id", nullable = false)
    private Long teamId;

    @Column(length = 400)
    private String name;

    @Column(nullable = false)
    @Builder.Default
    private boolean deleted = false;

    /**
     * JSON array of action steps.
     */
    @Column(columnDefinition = "TEXT")
    private String steps;
}
