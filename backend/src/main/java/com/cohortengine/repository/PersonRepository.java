package com.cohortengine.repository;

import com.cohortengine.model.store.Person;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Repository for persons of the event/person store.
 */
@Repository
public interface PersonRepository extends JpaRepository<Person, UUID> {
}
