package com.cohortengine.service;

import com.cohortengine.exception.CohortValidationException;
import com.cohortengine.model.cohort.Cohort;
import com.cohortengine.model.enums.CalculationStatus;
import com.cohortengine.repository.CohortRepository;
import com.cohortengine.repository.StaticCohortPersonRepository;
import com.cohortengine.service.predicate.PersonPredicate;
import com.cohortengine.service.predicate.SqlFragment;
import com.cohortengine.service.predicate.SqlPredicateRenderer;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Cohort membership for readers: SQL conditions to embed in analytical
 * queries, plus single-person checks, sizes, member pages and the cohorts of a person.
 *
 * Every reader uses the same source. Static cohorts read the static table;
 * dynamic cohorts read committed membership when the precalculation gate allows
 * it and are evaluated live otherwise.
 */
@Service
@Slf4j
public class CohortMembershipQueryService {

    private static final String STATIC_MEMBERS =
        "SELECT DISTINCT s.person_id FROM static_cohort_person s WHERE s.cohort_id = :cohort_id AND s.team_id = :team_id";

    private static final String NET_MEMBERS =
        "SELECT m.person_id FROM cohort_membership m"
            + " WHERE m.cohort_id = :cohort_id AND m.version IN ("
            + "SELECT cc.version FROM cohort_calculation cc WHERE cc.cohort_id = :cohort_id AND cc.status = :committed)"
            + " GROUP BY m.person_id HAVING SUM(m.sign) > 0";

    private final CohortRepository cohortRepository;
    private final StaticCohortPersonRepository staticCohortPersonRepository;
    private final CohortGraphResolver graphResolver;
    private final PrecalculationGate precalculationGate;
    private final SqlPredicateRenderer renderer;
    private final EventStoreQueryExecutor queryExecutor;

    public CohortMembershipQueryService(
            CohortRepository cohortRepository,
            StaticCohortPersonRepository staticCohortPersonRepository,
            CohortGraphResolver graphResolver,
            PrecalculationGate precalculationGate,
            SqlPredicateRenderer renderer,
            EventStoreQueryExecutor queryExecutor) {
        this.cohortRepository = cohortRepository;
        this.staticCohortPersonRepository = staticCohortPersonRepository;
        this.graphResolver = graphResolver;
        this.precalculationGate = precalculationGate;
        this.renderer = renderer;
        this.queryExecutor = queryExecutor;
    }

    /**
     * Condition that holds when {@code personIdColumn} is a member of the cohort.
     *
     * @param prefix parameter name prefix, distinct per fragment embedded in one query
     */
    public SqlFragment membershipFilter(long cohortId, String personIdColumn, String prefix) {
        Cohort cohort = load(cohortId);
        return renderer.render(membershipPredicate(cohort), personIdColumn, cohort.getTeamId(), prefix);
    }

    /**
     * Membership condition over a {@code person_id} column.
     */
    public SqlFragment resolvePredicateSql(long cohortId) {
        return membershipFilter(cohortId, "person_id", "m");
    }

    public boolean isMember(long cohortId, UUID personId) {
        return isMember(load(cohortId), personId);
    }

    private boolean isMember(Cohort cohort, UUID personId) {
        SqlFragment fragment = renderer.render(membershipPredicate(cohort), "CAST(:member_person_id AS UUID)",
            cohort.getTeamId(), "m");
        String sql = "SELECT CASE WHEN " + fragment.sql() + " THEN TRUE ELSE FALSE END";
        Boolean member = queryExecutor.queryForObject(sql,
            fragment.withParameters(Map.of("member_person_id", personId)), Boolean.class);
        return Boolean.TRUE.equals(member);
    }

    /**
     * Size of the cohort, read from the same source as {@link #isMember(long, UUID)}.
     */
    public long countMembers(long cohortId) {
        Cohort cohort = load(cohortId);
        if (cohort.isStatic()) {
            return staticCohortPersonRepository.countDistinctMembers(cohortId, cohort.getTeamId());
        }
        MemberQuery members = memberQuery(cohort);
        Long count = queryExecutor.queryForObject("SELECT COUNT(*) FROM (" + members.sql() + ") net",
            members.parameters(), Long.class);
        return count == null ? 0L : count;
    }

    /**
     * One page of members ordered by person id.
     */
    public List<UUID> members(long cohortId, int limit, int offset) {
        MemberQuery members = memberQuery(load(cohortId));
        MapSqlParameterSource parameters = members.parameters()
            .addValue("page_limit", limit)
            .addValue("page_offset", offset);
        return queryExecutor.queryForList(
            "SELECT person_id FROM (" + members.sql() + ") page ORDER BY person_id LIMIT :page_limit OFFSET :page_offset",
            parameters, UUID.class);
    }

    /**
     * Live cohorts of the team the person belongs to. Static lists and cohorts with
     * usable precalculated membership are answered in two queries; the remaining
     * dynamic cohorts are evaluated live one by one.
     */
    public List<Long> cohortIdsForPerson(long teamId, UUID personId) {
        String dynamicSql = "SELECT m.cohort_id FROM cohort_membership m"
            + " JOIN cohort_calculation cc ON cc.cohort_id = m.cohort_id AND cc.version = m.version AND cc.status = :committed"
            + " WHERE m.team_id = :team_id AND m.person_id = :person_id"
            + " GROUP BY m.cohort_id HAVING SUM(m.sign) > 0";
        String staticSql = "SELECT DISTINCT s.cohort_id FROM static_cohort_person s"
            + " WHERE s.team_id = :team_id AND s.person_id = :person_id";
        MapSqlParameterSource parameters = new MapSqlParameterSource()
            .addValue("team_id", teamId)
            .addValue("person_id", personId)
            .addValue("committed", CalculationStatus.COMMITTED.name());
        Set<Long> precalculated = new HashSet<>(queryExecutor.queryForList(dynamicSql, parameters, Long.class));
        Set<Long> listed = new HashSet<>(queryExecutor.queryForList(staticSql, parameters, Long.class));

        TreeSet<Long> ids = new TreeSet<>();
        for (Cohort cohort : cohortRepository.findByTeamIdAndDeletedFalseOrderById(teamId)) {
            if (cohort.isStatic()) {
                if (listed.contains(cohort.getId())) {
                    ids.add(cohort.getId());
                }
            } else if (precalculationGate.shouldUsePrecalculated(cohort)) {
                if (precalculated.contains(cohort.getId())) {
                    ids.add(cohort.getId());
                }
            } else if (isMemberLive(cohort, personId)) {
                ids.add(cohort.getId());
            }
        }
        return List.copyOf(ids);
    }

    private PersonPredicate membershipPredicate(Cohort cohort) {
        if (cohort.isStatic()) {
            return new PersonPredicate.StaticCohortMember(cohort.getId());
        }
        if (precalculationGate.shouldUsePrecalculated(cohort)) {
            return new PersonPredicate.PrecalculatedCohortMember(cohort.getId());
        }
        log.debug("Evaluating cohort {} live", cohort.getId());
        return graphResolver.resolve(cohort).predicate();
    }

    private boolean isMemberLive(Cohort cohort, UUID personId) {
        try {
            return isMember(cohort, personId);
        } catch (CohortValidationException e) {
            log.warn("Skipping cohort {} in person lookup, its definition does not resolve: {}",
                cohort.getId(), e.getMessage());
            return false;
        }
    }

    /**
     * Select of the cohort's member ids as {@code person_id}.
     */
    private MemberQuery memberQuery(Cohort cohort) {
        if (cohort.isStatic()) {
            return new MemberQuery(STATIC_MEMBERS, new MapSqlParameterSource()
                .addValue("cohort_id", cohort.getId())
                .addValue("team_id", cohort.getTeamId()));
        }
        if (precalculationGate.shouldUsePrecalculated(cohort)) {
            return new MemberQuery(NET_MEMBERS, netParameters(cohort.getId()));
        }
        log.debug("Listing cohort {} live", cohort.getId());
        SqlFragment live = renderer.render(graphResolver.resolve(cohort).predicate(), "p.id", cohort.getTeamId(), "m");
        return new MemberQuery(
            "SELECT p.id AS person_id FROM person p WHERE p.team_id = :member_team_id AND (" + live.sql() + ")",
            live.withParameters(Map.of("member_team_id", cohort.getTeamId())));
    }

    private record MemberQuery(String sql, MapSqlParameterSource parameters) {}

    private Cohort load(long cohortId) {
        return cohortRepository.findByIdAndDeletedFalse(cohortId)
            .orElseThrow(() -> new EntityNotFoundException("Cohort not found: " + cohortId));
    }

    private static MapSqlParameterSource netParameters(long cohortId) {
        return new MapSqlParameterSource()
            .addValue("cohort_id", cohortId)
            .addValue("committed", CalculationStatus.COMMITTED.name());
    }
}
