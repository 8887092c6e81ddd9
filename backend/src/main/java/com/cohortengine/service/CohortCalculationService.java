package com.cohortengine.service;

import com.cohortengine.exception.CohortValidationException;
import com.cohortengine.model.cohort.Cohort;
import com.cohortengine.model.enums.CalculationStatus;
import com.cohortengine.repository.CohortRepository;
import com.cohortengine.service.CohortGraphResolver.ResolvedCohort;
import com.cohortengine.service.materialize.IncrementalMaterializer;
import com.cohortengine.service.materialize.MembershipSnapshotResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Recalculates cohort membership.
 *
 * Definitions are resolved before anything is written: a cyclic or invalid
 * cohort fails here and keeps its previous membership and calculation state.
 */
@Service
@Slf4j
public class CohortCalculationService {

    private final CohortRepository cohortRepository;
    private final CohortService cohortService;
    private final CohortGraphResolver graphResolver;
    private final CohortDependencyService dependencyService;
    private final IncrementalMaterializer materializer;
    private final TransactionTemplate transactionTemplate;
    private final TaskExecutor taskExecutor;
    private final Clock clock;

    public CohortCalculationService(
            CohortRepository cohortRepository,
            CohortService cohortService,
            CohortGraphResolver graphResolver,
            CohortDependencyService dependencyService,
            IncrementalMaterializer materializer,
            PlatformTransactionManager transactionManager,
            TaskExecutor taskExecutor,
            Clock clock) {
        this.cohortRepository = cohortRepository;
        this.cohortService = cohortService;
        this.graphResolver = graphResolver;
        this.dependencyService = dependencyService;
        this.materializer = materializer;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.taskExecutor = taskExecutor;
        this.clock = clock;
    }

    /**
     * Recalculate synchronously. Static cohorts only get their member count refreshed.
     *
     * @throws com.cohortengine.exception.CyclicCohortException before any write
     */
    public MembershipSnapshotResult recalculate(long cohortId) {
        Cohort cohort = cohortService.get(cohortId);
        if (cohort.isStatic()) {
            return refreshStatic(cohort);
        }

        ResolvedCohort resolved = graphResolver.resolve(cohort);
        Integer pendingVersion = transactionTemplate.execute(status -> {
            cohortRepository.incrementPendingVersion(cohortId);
            return cohortRepository.findPendingVersion(cohortId);
        });
        log.info("Recalculating cohort {} as version {}", cohortId, pendingVersion);
        return materializer.materialize(cohortId, resolved.predicate(), pendingVersion);
    }

    /**
     * Validate now, recalculate in the background.
     */
    public CompletableFuture<MembershipSnapshotResult> recalculateAsync(long cohortId) {
        Cohort cohort = cohortService.get(cohortId);
        if (!cohort.isStatic()) {
            graphResolver.resolve(cohort);
        }
        return CompletableFuture.supplyAsync(() -> recalculate(cohortId), taskExecutor)
            .whenComplete((result, error) -> {
                if (error != null) {
                    log.error("Background recalculation of cohort {} failed", cohortId, error);
                }
            });
    }

    /**
     * Recalculate every live cohort of a team, dependencies first. A cohort
     * that fails does not stop the others.
     */
    public List<MembershipSnapshotResult> recalculateTeam(long teamId) {
        List<Cohort> ordered = dependencyService.sortTopologically(cohortService.listByTeam(teamId));
        List<MembershipSnapshotResult> results = new ArrayList<>();
        for (Cohort cohort : ordered) {
            try {
                results.add(recalculate(cohort.getId()));
            } catch (CohortValidationException e) {
                log.warn("Skipping invalid cohort {}: {}", cohort.getId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Recalculation of cohort {} failed, continuing with team {}", cohort.getId(), teamId, e);
            }
        }
        log.info("Recalculated {} of {} cohorts for team {}", results.size(), ordered.size(), teamId);
        return results;
    }

    private MembershipSnapshotResult refreshStatic(Cohort cohort) {
        Instant startedAt = clock.instant();
        Cohort refreshed = cohortService.refreshStaticCount(cohort);
        int version = refreshed.getVersion() == null ? 0 : refreshed.getVersion();
        return new MembershipSnapshotResult(refreshed.getId(), version, refreshed.getVersion(),
            CalculationStatus.COMMITTED, 0, 0, refreshed.getMemberCount(),
            Duration.between(startedAt, clock.instant()));
    }
}
