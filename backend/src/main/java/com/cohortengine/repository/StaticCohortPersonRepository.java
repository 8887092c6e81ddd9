package com.cohortengine.repository;

import com.cohortengine.model.cohort.StaticCohortPerson;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for explicit static-cohort memberships.
 */
@Repository
public interface StaticCohortPersonRepository extends JpaRepository<StaticCohortPerson, UUID> {

    /**
     * Which of the given persons are already members; used to keep inserts idempotent.
     */
    @Query("SELECT s.personId FROM StaticCohortPerson s WHERE s.cohortId = :cohortId AND s.personId IN :personIds")
    List<UUID> findExistingPersonIds(@Param("cohortId") Long cohortId, @Param("personIds") Collection<UUID> personIds);

    @Query("SELECT COUNT(DISTINCT s.personId) FROM StaticCohortPerson s WHERE s.cohortId = :cohortId AND s.teamId = :teamId")
    long countDistinctMembers(@Param("cohortId") Long cohortId, @Param("teamId") Long teamId);

    boolean existsByCohortIdAndTeamIdAndPersonId(Long cohortId, Long teamId, UUID personId);

    @Modifying
    @Query("DELETE FROM StaticCohortPerson s WHERE s.cohortId = :cohortId AND s.teamId = :teamId AND s.personId = :personId")
    int deleteMember(@Param("cohortId") Long cohortId, @Param("teamId") Long teamId, @Param("personId") UUID personId);
}
