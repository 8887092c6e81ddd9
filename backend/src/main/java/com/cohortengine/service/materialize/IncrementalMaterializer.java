package com.cohortengine.service.materialize;

import com.cohortengine.config.MaterializationSettings;
import com.cohortengine.model.cohort.Cohort;
import com.cohortengine.model.cohort.CohortCalculation;
import com.cohortengine.model.enums.CalculationStatus;
import com.cohortengine.repository.CohortCalculationRepository;
import com.cohortengine.repository.CohortRepository;
import com.cohortengine.service.EventStoreQueryExecutor;
import com.cohortengine.service.predicate.PersonPredicate;
import com.cohortengine.service.predicate.SqlFragment;
import com.cohortengine.service.predicate.SqlPredicateRenderer;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Incremental Materializer
 *
 * Writes the membership of a dynamic cohort as a delta against its last
 * committed version: persons who joined get a +1 row, persons who left a -1
 * row, everyone else gets nothing. Rows are never updated or deleted.
 *
 * A run:
 * 1. pages through the team's persons by id, comparing current matches with
 *    previous members page by page, one transaction per page
 * 2. retracts previous members that no longer exist in the person table
 * 3. commits under a row lock on the cohort, unless a newer run committed first
 *
 * Rows written by a run only become visible when its calculation is COMMITTED.
 * Each page write is one transaction, rerun as a whole on transient failures.
 */
@Service
@Slf4j
public class IncrementalMaterializer {

    private static final String PREFIX = "mat";

    private static final String INSERT_ROW =
        "INSERT INTO cohort_membership (cohort_id, team_id, person_id, version, sign) "
            + "VALUES (:cohort_id, :team_id, :person_id, :version, :sign)";

    private final EventStoreQueryExecutor queryExecutor;
    private final SqlPredicateRenderer renderer;
    private final CohortRepository cohortRepository;
    private final CohortCalculationRepository calculationRepository;
    private final MaterializationSettings settings;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public IncrementalMaterializer(
            EventStoreQueryExecutor queryExecutor,
            SqlPredicateRenderer renderer,
            CohortRepository cohortRepository,
            CohortCalculationRepository calculationRepository,
            MaterializationSettings settings,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.queryExecutor = queryExecutor;
        this.renderer = renderer;
        this.cohortRepository = cohortRepository;
        this.calculationRepository = calculationRepository;
        this.settings = settings;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public MembershipSnapshotResult materialize(long cohortId, PersonPredicate predicate, int pendingVersion) {
        return materialize(cohortId, predicate, pendingVersion, settings.batchSize());
    }

    /**
     * Materialize {@code predicate} as version {@code pendingVersion} of the cohort.
     *
     * @return COMMITTED or SUPERSEDED result
     * @throws RuntimeException any store failure, after the run is recorded as FAILED
     */
    public MembershipSnapshotResult materialize(long cohortId, PersonPredicate predicate, int pendingVersion, int batchSize) {
        Instant startedAt = clock.instant();
        Cohort cohort = cohortRepository.findById(cohortId)
            .orElseThrow(() -> new EntityNotFoundException("Cohort not found: " + cohortId));
        Integer baseVersion = cohort.getVersion();

        CohortCalculation calculation = calculationRepository.save(CohortCalculation.builder()
            .cohortId(cohortId)
            .teamId(cohort.getTeamId())
            .version(pendingVersion)
            .baseVersion(baseVersion)
            .status(CalculationStatus.RUNNING)
            .startedAt(startedAt)
            .build());

        if (baseVersion != null && pendingVersion <= baseVersion) {
            return supersede(calculation, startedAt, "version " + baseVersion + " already committed");
        }

        log.info("Materializing cohort {} version {} against base {}", cohortId, pendingVersion, baseVersion);
        Delta delta = new Delta();
        try {
            List<Integer> visibleVersions = calculationRepository.findCommittedVersions(cohortId).stream()
                .filter(version -> baseVersion != null && version <= baseVersion)
                .toList();
            Run run = new Run(cohortId, cohort.getTeamId(), pendingVersion, visibleVersions,
                renderer.render(predicate, "p.id", cohort.getTeamId(), PREFIX));

            writeDelta(run, batchSize, delta);
            retractMissingPersons(run, delta);
            return commit(run, calculation, startedAt, delta);
        } catch (RuntimeException e) {
            recordFailure(cohort, calculation, delta, e);
            throw e;
        }
    }

    // ========================================================================
    // Delta
    // ========================================================================

    private void writeDelta(Run run, int batchSize, Delta delta) {
        UUID after = null;
        while (true) {
            List<UUID> page = nextPersonPage(run.teamId(), after, batchSize);
            if (page.isEmpty()) {
                break;
            }
            Set<UUID> current = new HashSet<>(currentMatches(run, page));
            Set<UUID> previous = new HashSet<>(previousMembers(run, page));

            List<UUID> added = new ArrayList<>();
            List<UUID> removed = new ArrayList<>();
            for (UUID personId : page) {
                boolean now = current.contains(personId);
                boolean before = previous.contains(personId);
                if (now && !before) {
                    added.add(personId);
                } else if (before && !now) {
                    removed.add(personId);
                }
            }
            appendRows(run, added, removed);
            delta.added += added.size();
            delta.removed += removed.size();

            if (page.size() < batchSize) {
                break;
            }
            after = page.get(page.size() - 1);
        }
    }

    private List<UUID> nextPersonPage(long teamId, UUID after, int batchSize) {
        MapSqlParameterSource parameters = new MapSqlParameterSource()
            .addValue("team_id", teamId)
            .addValue("page_size", batchSize);
        StringBuilder sql = new StringBuilder("SELECT p.id FROM person p WHERE p.team_id = :team_id");
        if (after != null) {
            sql.append(" AND p.id > :after");
            parameters.addValue("after", after);
        }
        sql.append(" ORDER BY p.id LIMIT :page_size");
        return queryExecutor.queryForList(sql.toString(), parameters, UUID.class);
    }

    private List<UUID> currentMatches(Run run, List<UUID> page) {
        String sql = "SELECT p.id FROM person p WHERE p.id IN (:page_ids) AND (" + run.fragment().sql() + ")";
        return queryExecutor.queryForList(sql, run.fragment().withParameters(Map.of("page_ids", page)), UUID.class);
    }

    private List<UUID> previousMembers(Run run, List<UUID> page) {
        if (run.visibleVersions().isEmpty()) {
            return List.of();
        }
        String sql = "SELECT m.person_id FROM cohort_membership m"
            + " WHERE m.cohort_id = :cohort_id AND m.person_id IN (:page_ids) AND m.version IN (:versions)"
            + " GROUP BY m.person_id HAVING SUM(m.sign) > 0";
        MapSqlParameterSource parameters = new MapSqlParameterSource()
            .addValue("cohort_id", run.cohortId())
            .addValue("page_ids", page)
            .addValue("versions", run.visibleVersions());
        return queryExecutor.queryForList(sql, parameters, UUID.class);
    }

    private void retractMissingPersons(Run run, Delta delta) {
        if (run.visibleVersions().isEmpty()) {
            return;
        }
        String sql = "SELECT m.person_id FROM cohort_membership m"
            + " WHERE m.cohort_id = :cohort_id AND m.version IN (:versions)"
            + " AND NOT EXISTS (SELECT 1 FROM person p WHERE p.id = m.person_id AND p.team_id = :team_id)"
            + " GROUP BY m.person_id HAVING SUM(m.sign) > 0";
        MapSqlParameterSource parameters = new MapSqlParameterSource()
            .addValue("cohort_id", run.cohortId())
            .addValue("team_id", run.teamId())
            .addValue("versions", run.visibleVersions());
        List<UUID> vanished = queryExecutor.queryForList(sql, parameters, UUID.class);
        if (!vanished.isEmpty()) {
            appendRows(run, List.of(), vanished);
            delta.removed += vanished.size();
        }
    }

    private void appendRows(Run run, List<UUID> added, List<UUID> removed) {
        if (added.isEmpty() && removed.isEmpty()) {
            return;
        }
        List<SqlParameterSource> rows = new ArrayList<>(added.size() + removed.size());
        added.forEach(personId -> rows.add(row(run, personId, 1)));
        removed.forEach(personId -> rows.add(row(run, personId, -1)));
        SqlParameterSource[] batch = rows.toArray(new SqlParameterSource[0]);
        queryExecutor.retrying("appendRows", () ->
            transactionTemplate.execute(status -> queryExecutor.batchUpdate(INSERT_ROW, batch)));
    }

    private static SqlParameterSource row(Run run, UUID personId, int sign) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("cohort_id", run.cohortId());
        values.put("team_id", run.teamId());
        values.put("person_id", personId);
        values.put("version", run.version());
        values.put("sign", sign);
        return new MapSqlParameterSource(values);
    }

    // ========================================================================
    // Commit
    // ========================================================================

    private MembershipSnapshotResult commit(Run run, CohortCalculation calculation, Instant startedAt, Delta delta) {
        return transactionTemplate.execute(status -> {
            Cohort locked = cohortRepository.findByIdForUpdate(run.cohortId())
                .orElseThrow(() -> new EntityNotFoundException("Cohort not found: " + run.cohortId()));
            Integer committed = locked.getVersion();
            if (!Objects.equals(committed, calculation.getBaseVersion())
                    || (committed != null && committed >= run.version())) {
                return supersede(calculation, startedAt, "version " + committed + " committed concurrently");
            }

            List<Integer> versions = new ArrayList<>(run.visibleVersions());
            versions.add(run.version());
            long memberCount = countNetMembers(run.cohortId(), versions);
            Instant finishedAt = clock.instant();

            locked.setVersion(run.version());
            locked.setLastCalculation(finishedAt);
            locked.setMemberCount(memberCount);
            locked.setCalculating(locked.getPendingVersion() > run.version());
            cohortRepository.save(locked);

            calculation.setStatus(CalculationStatus.COMMITTED);
            calculation.setFinishedAt(finishedAt);
            calculation.setAddedCount(delta.added);
            calculation.setRemovedCount(delta.removed);
            calculation.setMemberCount(memberCount);
            calculationRepository.save(calculation);

            Duration elapsed = Duration.between(startedAt, finishedAt);
            log.info("Committed cohort {} version {}: +{} -{} members={} in {} ms",
                run.cohortId(), run.version(), delta.added, delta.removed, memberCount, elapsed.toMillis());
            return new MembershipSnapshotResult(run.cohortId(), run.version(), calculation.getBaseVersion(),
                CalculationStatus.COMMITTED, delta.added, delta.removed, memberCount, elapsed);
        });
    }

    private long countNetMembers(long cohortId, List<Integer> versions) {
        String sql = "SELECT COUNT(*) FROM (SELECT m.person_id FROM cohort_membership m"
            + " WHERE m.cohort_id = :cohort_id AND m.version IN (:versions)"
            + " GROUP BY m.person_id HAVING SUM(m.sign) > 0) net";
        MapSqlParameterSource parameters = new MapSqlParameterSource()
            .addValue("cohort_id", cohortId)
            .addValue("versions", versions);
        Long count = queryExecutor.queryForObject(sql, parameters, Long.class);
        return count == null ? 0L : count;
    }

    /**
     * Record the run as SUPERSEDED and, unless a newer version is pending, clear the
     * calculating flag left set by the run that committed first.
     */
    private MembershipSnapshotResult supersede(CohortCalculation calculation, Instant startedAt, String reason) {
        return transactionTemplate.execute(status -> {
            Instant finishedAt = clock.instant();
            calculation.setStatus(CalculationStatus.SUPERSEDED);
            calculation.setFinishedAt(finishedAt);
            calculationRepository.save(calculation);

            cohortRepository.findByIdForUpdate(calculation.getCohortId()).ifPresent(locked -> {
                if (releaseCalculating(locked, calculation.getVersion())) {
                    cohortRepository.save(locked);
                }
            });
            log.warn("Cohort {} version {} superseded: {}", calculation.getCohortId(), calculation.getVersion(), reason);
            return new MembershipSnapshotResult(calculation.getCohortId(), calculation.getVersion(),
                calculation.getBaseVersion(), CalculationStatus.SUPERSEDED, 0, 0, null,
                Duration.between(startedAt, finishedAt));
        });
    }

    /**
     * Clear the calculating flag unless a version newer than {@code version} is pending.
     *
     * @return whether the flag was cleared
     */
    private static boolean releaseCalculating(Cohort locked, int version) {
        if (locked.getPendingVersion() > version || !locked.isCalculating()) {
            return false;
        }
        locked.setCalculating(false);
        return true;
    }

    private void recordFailure(Cohort cohort, CohortCalculation calculation, Delta delta, RuntimeException cause) {
        log.error("Materialization of cohort {} version {} failed: previous members={}, rows appended={} (+{} -{})",
            cohort.getId(), calculation.getVersion(), cohort.getMemberCount(),
            delta.added + delta.removed, delta.added, delta.removed, cause);
        try {
            transactionTemplate.executeWithoutResult(status -> {
                calculation.setStatus(CalculationStatus.FAILED);
                calculation.setFinishedAt(clock.instant());
                calculation.setAddedCount(delta.added);
                calculation.setRemovedCount(delta.removed);
                calculation.setError(String.valueOf(cause.getMessage()));
                calculationRepository.save(calculation);

                cohortRepository.findByIdForUpdate(cohort.getId()).ifPresent(locked -> {
                    releaseCalculating(locked, calculation.getVersion());
                    locked.setErrorsCalculating(locked.getErrorsCalculating() + 1);
                    cohortRepository.save(locked);
                });
            });
        } catch (RuntimeException bookkeeping) {
            cause.addSuppressed(bookkeeping);
        }
    }

    private record Run(long cohortId, long teamId, int version, List<Integer> visibleVersions, SqlFragment fragment) {}

    private static final class Delta {
        private long added;
        private long removed;
    }
}
