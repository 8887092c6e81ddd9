package com.cohortengine.repository;

import com.cohortengine.model.cohort.Cohort;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for cohort metadata.
 */
@Repository
public interface CohortRepository extends JpaRepository<Cohort, Long> {

    Optional<Cohort> findByIdAndDeletedFalse(Long id);

    /**
     * Find a live cohort of the given team. Used when following cohort references.
     */
    Optional<Cohort> findByIdAndTeamIdAndDeletedFalse(Long id, Long teamId);

    List<Cohort> findByTeamIdAndDeletedFalseOrderById(Long teamId);

    /**
     * Lock the cohort row for the duration of the surrounding transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Cohort c WHERE c.id = :id")
    Optional<Cohort> findByIdForUpdate(@Param("id") Long id);

    /**
     * Hand out the next membership version and flag the cohort as calculating
     * in one statement.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Cohort c SET c.pendingVersion = c.pendingVersion + 1, c.isCalculating = true WHERE c.id = :id")
    int incrementPendingVersion(@Param("id") Long id);

    @Query("SELECT c.pendingVersion FROM Cohort c WHERE c.id = :id")
    int findPendingVersion(@Param("id") Long id);

    /**
     * Drop the calculation marker of cohorts whose definition (or a dependency's) changed.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Cohort c SET c.lastCalculation = null WHERE c.id IN :ids")
    int clearLastCalculation(@Param("ids") List<Long> ids);
}
