package com.cohortengine.service.predicate;

import com.cohortengine.model.enums.CalculationStatus;
import com.cohortengine.service.predicate.PersonPredicate.CountCondition;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders {@link PersonPredicate} trees to SQL over the event/person store.
 *
 * Tables read:
 * - person_property (person_id, prop_key, prop_value)
 * - events (id, team_id, event, person_id, event_time, elements_chain)
 * - event_property (event_id, prop_key, prop_value)
 * - static_cohort_person, cohort_membership, cohort_calculation
 *
 * Every literal taken from a cohort definition is bound as a named parameter.
 * Parameter names carry a caller-chosen prefix so several fragments can be
 * embedded in one statement.
 */
@Component
public class SqlPredicateRenderer {

    static final String NUMERIC_PATTERN = "^-?[0-9]+(\\.[0-9]+)?$";

    /**
     * Render a person predicate.
     *
     * @param predicate       compiled predicate
     * @param personIdColumn  SQL expression holding the person id being tested, e.g. {@code p.id}
     * @param teamId          team whose events are consulted
     * @param prefix          parameter name prefix, letters/digits/underscore only
     */
    public SqlFragment render(PersonPredicate predicate, String personIdColumn, long teamId, String prefix) {
        if (!prefix.matches("[A-Za-z][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("Invalid parameter prefix: " + prefix);
        }
        RenderContext context = new RenderContext(prefix, teamId);
        String sql = context.person(predicate, personIdColumn);
        return new SqlFragment(sql, context.parameters);
    }

    public SqlFragment render(PersonPredicate predicate, String personIdColumn, long teamId) {
        return render(predicate, personIdColumn, teamId, "c");
    }

    // ========================================================================
    // Render state
    // ========================================================================

    private static final class RenderContext {

        private final String prefix;
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private final String teamParameter;
        private int parameterCounter = 0;
        private int aliasCounter = 0;

        private RenderContext(String prefix, long teamId) {
            this.prefix = prefix;
            this.teamParameter = bind(teamId);
        }

        private String bind(Object value) {
            String name = prefix + "_p" + parameterCounter++;
            parameters.put(name, value);
            return ":" + name;
        }

        private String alias(String base) {
            return base + aliasCounter++;
        }

        // --------------------------------------------------------------------
        // Person level
        // --------------------------------------------------------------------

        private String person(PersonPredicate predicate, String column) {
            if (predicate instanceof PersonPredicate.Constant constant) {
                return constant.value() ? "1 = 1" : "1 = 0";
            }
            if (predicate instanceof PersonPredicate.AllOf allOf) {
                return join(allOf.terms(), " AND ", term -> person(term, column));
            }
            if (predicate instanceof PersonPredicate.AnyOf anyOf) {
                return join(anyOf.terms(), " OR ", term -> person(term, column));
            }
            if (predicate instanceof PersonPredicate.Not not) {
                return "NOT (" + person(not.term(), column) + ")";
            }
            if (predicate instanceof PersonPredicate.Property property) {
                String pp = alias("pp");
                return "EXISTS (SELECT 1 FROM person_property " + pp
                    + " WHERE " + pp + ".person_id = " + column
                    + " AND " + pp + ".prop_key = " + bind(property.key())
                    + valueCondition(property.test(), pp + ".prop_value") + ")";
            }
            if (predicate instanceof PersonPredicate.PerformedEvent performed) {
                return performedEvent(performed, column);
            }
            if (predicate instanceof PersonPredicate.StaticCohortMember member) {
                String s = alias("s");
                return column + " IN (SELECT " + s + ".person_id FROM static_cohort_person " + s
                    + " WHERE " + s + ".cohort_id = " + bind(member.cohortId())
                    + " AND " + s + ".team_id = " + teamParameter + ")";
            }
            if (predicate instanceof PersonPredicate.PrecalculatedCohortMember member) {
                return precalculatedMember(member, column);
            }
            throw new IllegalStateException("Unhandled predicate: " + predicate);
        }

        private String performedEvent(PersonPredicate.PerformedEvent performed, String column) {
            String e = alias("e");
            StringBuilder sql = new StringBuilder()
                .append(column).append(" IN (SELECT ").append(e).append(".person_id FROM events ").append(e)
                .append(" WHERE ").append(e).append(".team_id = ").append(teamParameter)
                .append(" AND ").append(e).append(".person_id IS NOT NULL")
                .append(" AND ").append(event(performed.filter(), e));
            CountCondition count = performed.count();
            if (count != null) {
                sql.append(" GROUP BY ").append(e).append(".person_id HAVING COUNT(*) ")
                    .append(count.operator().getSql()).append(' ').append(bind(count.count()));
            }
            return sql.append(')').toString();
        }

        private String precalculatedMember(PersonPredicate.PrecalculatedCohortMember member, String column) {
            String m = alias("m");
            String cc = alias("cc");
            String cohortParameter = bind(member.cohortId());
            return column + " IN (SELECT " + m + ".person_id FROM cohort_membership " + m
                + " WHERE " + m + ".cohort_id = " + cohortParameter
                + " AND " + m + ".version IN (SELECT " + cc + ".version FROM cohort_calculation " + cc
                + " WHERE " + cc + ".cohort_id = " + cohortParameter
                + " AND " + cc + ".status = " + bind(CalculationStatus.COMMITTED.name()) + ")"
                + " GROUP BY " + m + ".person_id HAVING SUM(" + m + ".sign) > 0)";
        }

        // --------------------------------------------------------------------
        // Event level
        // --------------------------------------------------------------------

        private String event(EventPredicate predicate, String e) {
            if (predicate instanceof EventPredicate.Constant constant) {
                return constant.value() ? "1 = 1" : "1 = 0";
            }
            if (predicate instanceof EventPredicate.AllOf allOf) {
                return join(allOf.terms(), " AND ", term -> event(term, e));
            }
            if (predicate instanceof EventPredicate.AnyOf anyOf) {
                return join(anyOf.terms(), " OR ", term -> event(term, e));
            }
            if (predicate instanceof EventPredicate.Not not) {
                return "NOT (" + event(not.term(), e) + ")";
            }
            if (predicate instanceof EventPredicate.NameIs nameIs) {
                return e + ".event = " + bind(nameIs.event());
            }
            if (predicate instanceof EventPredicate.OccurredAtOrAfter after) {
                return e + ".event_time >= " + bind(timestamp(after.from()));
            }
            if (predicate instanceof EventPredicate.OccurredAtOrBefore before) {
                return e + ".event_time <= " + bind(timestamp(before.to()));
            }
            if (predicate instanceof EventPredicate.Property property) {
                String ep = alias("ep");
                return "EXISTS (SELECT 1 FROM event_property " + ep
                    + " WHERE " + ep + ".event_id = " + e + ".id"
                    + " AND " + ep + ".prop_key = " + bind(property.key())
                    + valueCondition(property.test(), ep + ".prop_value") + ")";
            }
            if (predicate instanceof EventPredicate.ElementsChainMatches chain) {
                return "REGEXP_LIKE(COALESCE(" + e + ".elements_chain, ''), " + bind(chain.pattern()) + ")";
            }
            throw new IllegalStateException("Unhandled event predicate: " + predicate);
        }

        // --------------------------------------------------------------------
        // Value tests
        // --------------------------------------------------------------------

        /**
         * Condition on a property value column, prefixed with " AND " or empty for presence tests.
         */
        private String valueCondition(ValueTest test, String valueColumn) {
            if (test instanceof ValueTest.Present) {
                return "";
            }
            if (test instanceof ValueTest.OneOf oneOf) {
                if (oneOf.values().isEmpty()) {
                    return " AND 1 = 0";
                }
                return " AND " + valueColumn + " IN (" + bind(oneOf.values()) + ")";
            }
            if (test instanceof ValueTest.ContainsIgnoreCase contains) {
                return " AND LOCATE(" + bind(contains.needle()) + ", LOWER(" + valueColumn + ")) > 0";
            }
            if (test instanceof ValueTest.Matches matches) {
                return " AND REGEXP_LIKE(" + valueColumn + ", " + bind(matches.pattern()) + ")";
            }
            if (test instanceof ValueTest.NumericCompare compare) {
                return " AND CASE WHEN REGEXP_LIKE(" + valueColumn + ", " + bind(NUMERIC_PATTERN) + ")"
                    + " THEN CAST(" + valueColumn + " AS DOUBLE PRECISION) END "
                    + compare.comparison().sql() + " " + bind(compare.operand());
            }
            throw new IllegalStateException("Unhandled value test: " + test);
        }

        private static OffsetDateTime timestamp(Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }

        private static <T> String join(List<T> terms, String separator, Function<T, String> renderer) {
            return terms.stream()
                .map(renderer)
                .map(sql -> "(" + sql + ")")
                .collect(Collectors.joining(separator, "(", ")"));
        }
    }
}
