package com.cohortengine.service.predicate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Boolean condition over a single event row.
 */
public sealed interface EventPredicate {

    EventPredicate ANY = new Constant(true);
    EventPredicate NONE = new Constant(false);

    record Constant(boolean value) implements EventPredicate {}

    record AllOf(List<EventPredicate> terms) implements EventPredicate {
        public AllOf {
            terms = List.copyOf(terms);
        }
    }

    record AnyOf(List<EventPredicate> terms) implements EventPredicate {
        public AnyOf {
            terms = List.copyOf(terms);
        }
    }

    record Not(EventPredicate term) implements EventPredicate {}

    record NameIs(String event) implements EventPredicate {}

    record OccurredAtOrAfter(Instant from) implements EventPredicate {}

    record OccurredAtOrBefore(Instant to) implements EventPredicate {}

    record Property(String key, ValueTest test) implements EventPredicate {}

    /** Regular expression over the autocapture element chain. */
    record ElementsChainMatches(String pattern) implements EventPredicate {}

    static EventPredicate and(List<EventPredicate> terms) {
        List<EventPredicate> kept = new ArrayList<>();
        for (EventPredicate term : terms) {
            if (term instanceof Constant constant) {
                if (!constant.value()) {
                    return NONE;
                }
                continue;
            }
            kept.add(term);
        }
        if (kept.isEmpty()) {
            return ANY;
        }
        return kept.size() == 1 ? kept.get(0) : new AllOf(kept);
    }

    static EventPredicate or(List<EventPredicate> terms) {
        List<EventPredicate> kept = new ArrayList<>();
        for (EventPredicate term : terms) {
            if (term instanceof Constant constant) {
                if (constant.value()) {
                    return ANY;
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

    static EventPredicate not(EventPredicate term) {
        if (term instanceof Constant constant) {
            return constant.value() ? NONE : ANY;
        }
        if (term instanceof Not not) {
            return not.term();
        }
        return new Not(term);
    }
}
