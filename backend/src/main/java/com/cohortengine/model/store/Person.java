package com.cohortengine.model.store;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Person row of the event/person store.
 */
@Entity
@Table(name = "person", indexes = {
    @Index(name = "idx_person_team", columnList = "team_id, id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Person {

    @Id
    private UUID id;

    @Column(name = "team_id", nullable = false)
    private Long teamId;

    @Column(name = "created_at")
    private Instant createdAt;

    @ElementCollection
    @CollectionTable(name = "person_property", joinColumns = @JoinColumn(name = "person_id"))
    @MapKeyColumn(name = "prop_key", length = 400)
    @Column(name = "prop_value", length = 4000)
    @Builder.Default
    private Map<String, String> properties = new HashMap<>();
}
