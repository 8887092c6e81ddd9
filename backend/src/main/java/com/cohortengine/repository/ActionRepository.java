package com.cohortengine.repository;

import com.cohortengine.model.cohort.Action;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for actions referenced by behavioral clauses.
 */
@Repository
public interface ActionRepository extends JpaRepository<Action, Long> {

    Optional<Action> findByIdAndTeamIdAndDeletedFalse(Long id, Long teamId);
}
