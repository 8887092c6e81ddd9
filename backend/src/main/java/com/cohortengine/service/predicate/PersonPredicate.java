package com.cohortengine.service.predicate;

import com.cohortengine.model.enums.CountOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Boolean condition over a person. This is the intermediate form cohort
 * definitions compile to; {@link SqlPredicateRenderer} turns it into a SQL
 * fragment with bound parameters.
 *
 * The static combinators fold constants, so a tree that can never match
 * collapses to {@link #NONE}.
 */
public sealed interface PersonPredicate {

    PersonPredicate ALL = new Constant(true);
    PersonPredicate NONE = new Constant(false);

    record Constant(boolean value) implements PersonPredicate {}

    record AllOf(List<PersonPredicate> terms) implements PersonPredicate {
        public AllOf {
            terms = List.copyOf(terms);
        }
    }

    record AnyOf(List<PersonPredicate> terms) implements PersonPredicate {
        public AnyOf {
            terms = List.copyOf(terms);
        }
    }

    record Not(PersonPredicate term) implements PersonPredicate {}

    record Property(String key, ValueTest test) implements PersonPredicate {}

    /**
     * The person has events matching {@code filter}; with a count condition the
     * number of such events is compared instead of requiring at least one.
     */
    record PerformedEvent(EventPredicate filter, CountCondition count) implements PersonPredicate {}

    record StaticCohortMember(long cohortId) implements PersonPredicate {}

    record PrecalculatedCohortMember(long cohortId) implements PersonPredicate {}

    record CountCondition(CountOperator operator, int count) {}

    static PersonPredicate and(List<PersonPredicate> terms) {
        List<PersonPredicate> kept = new ArrayList<>();
        for (PersonPredicate term : terms) {
            if (term instanceof Constant constant) {
                if (!constant.value()) {
                    return NONE;
                }
                continue;
            }
            kept.add(term);
        }
        if (kept.isEmpty()) {
            return ALL;
        }
        return kept.size() == 1 ? kept.get(0) : new AllOf(kept);
    }

    static PersonPredicate or(List<PersonPredicate> terms) {
        List<PersonPredicate> kept = new ArrayList<>();
        for (PersonPredicate term : terms) {
            if (term instanceof Constant constant) {
                if (constant.value()) {
                    return ALL;
                }
                continue;
            }
            kept.add(term);
        }
        if (kept.isEmpty()) {
            return NONE;
        }
        return kept.size() == 1 ? kept.get(0) : new AnyOf(kept);
    }

    static PersonPredicate not(PersonPredicate term) {
        if (term instanceof Constant constant) {
            return constant.value() ? NONE : ALL;
        }
        if (term instanceof Not not) {
            return not.term();
        }
        return new Not(term);
    }
}
