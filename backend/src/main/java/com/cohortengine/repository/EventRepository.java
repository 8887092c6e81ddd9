package com.cohortengine.repository;

import com.cohortengine.model.store.Event;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Repository for events of the event/person store.
 */
@Repository
public interface EventRepository extends JpaRepository<Event, UUID> {
}
