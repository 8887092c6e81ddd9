package com.cohortengine.service;

import com.cohortengine.dto.request.CreateCohortRequest;
import com.cohortengine.dto.request.UpdateCohortRequest;
import com.cohortengine.model.cohort.Cohort;
import com.cohortengine.model.cohort.CohortCalculation;
import com.cohortengine.repository.CohortCalculationRepository;
import com.cohortengine.repository.CohortRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Service for managing cohort definitions.
 *
 * Every definition is resolved before it is stored, so a cyclic or otherwise
 * invalid definition never reaches the database.
 */
@Service
@Slf4j
@Transactional(readOnly = true)
public class CohortService {

    private final CohortRepository cohortRepository;
    private final CohortCalculationRepository calculationRepository;
    private final CohortGraphResolver graphResolver;
    private final CohortDependencyService dependencyService;
    private final StaticMembershipStore staticMembershipStore;
    private final CohortFiltersCodec codec;
    private final Clock clock;

    public CohortService(
            CohortRepository cohortRepository,
            CohortCalculationRepository calculationRepository,
            CohortGraphResolver graphResolver,
            CohortDependencyService dependencyService,
            StaticMembershipStore staticMembershipStore,
            CohortFiltersCodec codec,
            Clock clock) {
        this.cohortRepository = cohortRepository;
        this.calculationRepository = calculationRepository;
        this.graphResolver = graphResolver;
        this.dependencyService = dependencyService;
        this.staticMembershipStore = staticMembershipStore;
        this.codec = codec;
        this.clock = clock;
    }

    // ========================================================================
    // Read Operations
    // ========================================================================

    public Cohort get(long id) {
        return cohortRepository.findByIdAndDeletedFalse(id)
            .orElseThrow(() -> new EntityNotFoundException("Cohort not found: " + id));
    }

    public List<Cohort> listByTeam(long teamId) {
        return cohortRepository.findByTeamIdAndDeletedFalseOrderById(teamId);
    }

    /**
     * Calculation history, newest first.
     */
    public List<CohortCalculation> calculations(long id) {
        get(id);
        return calculationRepository.findByCohortIdOrderByStartedAtDesc(id);
    }

    // ========================================================================
    // Write Operations
    // ========================================================================

    @Transactional
    public Cohort create(CreateCohortRequest request) {
        Cohort cohort = Cohort.builder()
            .teamId(request.teamId())
            .name(request.name())
            .description(request.description())
            .isStatic(request.isStatic())
            .filters(request.isStatic() ? null : codec.write(request.filters()))
            .build();
        Cohort saved = cohortRepository.save(cohort);
        if (!saved.isStatic()) {
            graphResolver.resolve(saved);
        }
        log.info("Created {} cohort {} for team {}", saved.isStatic() ? "static" : "dynamic",
            saved.getId(), saved.getTeamId());

        if (saved.isStatic() && request.personIds() != null && !request.personIds().isEmpty()) {
            insertStaticMembers(saved.getId(), request.personIds());
        }
        return saved;
    }

    /**
     * Update name, description or filters. A filter change invalidates the
     * precalculated membership of this cohort and of every cohort that references it.
     */
    @Transactional
    public Cohort update(long id, UpdateCohortRequest request) {
        Cohort cohort = get(id);
        if (request.name() != null) {
            cohort.setName(request.name());
        }
        if (request.description() != null) {
            cohort.setDescription(request.description());
        }
        if (request.filters() != null) {
            if (cohort.isStatic()) {
                throw new IllegalArgumentException("Static cohort " + id + " has no filters");
            }
            cohort.setFilters(codec.write(request.filters()));
            graphResolver.resolve(cohort);
            cohort.setLastCalculation(null);
            Cohort saved = cohortRepository.saveAndFlush(cohort);
            invalidate(saved);
            return saved;
        }
        return cohortRepository.save(cohort);
    }

    /**
     * Logical delete. Cohorts referencing this one now see an empty set, so
     * their precalculated membership is invalidated.
     */
    @Transactional
    public void delete(long id) {
        Cohort cohort = get(id);
        cohort.setDeleted(true);
        Cohort saved = cohortRepository.saveAndFlush(cohort);
        invalidate(saved);
        log.info("Deleted cohort {}", id);
    }

    // ========================================================================
    // Static Membership
    // ========================================================================

    /**
     * @return number of persons newly added
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public int insertStaticMembers(long id, List<UUID> personIds) {
        Cohort cohort = requireStatic(id);
        int inserted = staticMembershipStore.insertMembers(id, cohort.getTeamId(), personIds);
        refreshStaticCount(cohort);
        return inserted;
    }

    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public boolean removeStaticMember(long id, UUID personId) {
        Cohort cohort = requireStatic(id);
        boolean removed = staticMembershipStore.removeMember(id, cohort.getTeamId(), personId);
        if (removed) {
            refreshStaticCount(cohort);
        }
        return removed;
    }

    /**
     * Store the current size of a static cohort on its row.
     */
    @Transactional
    public Cohort refreshStaticCount(Cohort cohort) {
        Cohort current = get(cohort.getId());
        current.setMemberCount(staticMembershipStore.countMembers(current.getId(), current.getTeamId()));
        current.setLastCalculation(clock.instant());
        return cohortRepository.save(current);
    }

    private Cohort requireStatic(long id) {
        Cohort cohort = get(id);
        if (!cohort.isStatic()) {
            throw new IllegalArgumentException("Cohort " + id + " is not static");
        }
        return cohort;
    }

    private void invalidate(Cohort cohort) {
        List<Long> ids = new ArrayList<>();
        ids.add(cohort.getId());
        ids.addAll(dependencyService.dependents(cohort.getTeamId(), cohort.getId()));
        cohortRepository.clearLastCalculation(ids);
        log.debug("Invalidated precalculated membership of cohorts {}", ids);
    }
}
