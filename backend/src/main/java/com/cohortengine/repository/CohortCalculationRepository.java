package com.cohortengine.repository;

import com.cohortengine.model.cohort.CohortCalculation;
import com.cohortengine.model.enums.CalculationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for cohort calculation history.
 */
@Repository
public interface CohortCalculationRepository extends JpaRepository<CohortCalculation, Long> {

    List<CohortCalculation> findByCohortIdOrderByStartedAtDesc(Long cohortId);

    List<CohortCalculation> findByCohortIdAndStatus(Long cohortId, CalculationStatus status);

    /**
     * Versions whose membership rows are visible to readers.
     */
    @Query("SELECT c.version FROM CohortCalculation c WHERE c.cohortId = :cohortId AND c.status = com.cohortengine.model.enums.CalculationStatus.COMMITTED ORDER BY c.version")
    List<Integer> findCommittedVersions(@Param("cohortId") Long cohortId);
}
