package com.cohortengine.repository;

import com.cohortengine.model.cohort.CohortMembershipRow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for raw membership rows. Net membership is aggregated in SQL
 * by {@code CohortMembershipQueryService}; these finders expose the log itself.
 */
@Repository
public interface CohortMembershipRepository extends JpaRepository<CohortMembershipRow, Long> {

    List<CohortMembershipRow> findByCohortIdAndVersion(Long cohortId, Integer version);

    long countByCohortId(Long cohortId);
}
