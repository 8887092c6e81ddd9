package com.cohortengine.model.store;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Captured event of the event/person store.
 */
@Entity
@Table(name = "events", indexes = {
    @Index(name = "idx_events_team_event_time", columnList = "team_id, event, event_time"),
    @Index(name = "idx_events_person", columnList = "person_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    @Id
    private UUID id;

    @Column(name = "team_id", nullable = false)
    private Long teamId;

    @Column(name = "event", nullable = false, length = 400)
    private String event;

    @Column(name = "distinct_id", length = 400)
    private String distinctId;

    @Column(name = "person_id")
    private UUID personId;

    @Column(name = "event_time", nullable = false)
    private Instant timestamp;

    /**
     * Autocapture element chain, e.g. {@code a.nav:href="/pricing"text="Pricing";div.header}.
     */
    @Column(name = "elements_chain", length = 4000)
    private String elementsChain;

    @ElementCollection
    @CollectionTable(name = "event_property", joinColumns = @JoinColumn(name = "event_id"))
    @MapKeyColumn(name = "prop_key", length = 400)
    @Column(name = "prop_value", length = 4000)
    @Builder.Default
    private Map<String, String> properties = new HashMap<>();
}
