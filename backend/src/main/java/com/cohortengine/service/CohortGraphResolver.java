package com.cohortengine.service;

import com.cohortengine.exception.CyclicCohortException;
import com.cohortengine.exception.InvalidCohortDefinitionException;
import com.cohortengine.model.cohort.Cohort;
import com.cohortengine.model.enums.PropertyType;
import com.cohortengine.model.filter.CohortFilters;
import com.cohortengine.model.filter.CohortGroup;
import com.cohortengine.model.filter.PropertyFilter;
import com.cohortengine.repository.CohortRepository;
import com.cohortengine.service.predicate.PersonPredicate;
import com.cohortengine.service.predicate.PredicateCompiler;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Cohort Graph Resolver
 *
 * Expands a cohort definition into one {@link PersonPredicate}:
 * groups are OR'd, clauses inside a group are AND'd, and cohort references
 * are expanded inline.
 *
 * Reference rules:
 * - a cohort referencing itself directly contributes TRUE
 * - a reference back to any other cohort being expanded is a cycle
 * - a missing or deleted cohort contributes FALSE, negated or not
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CohortGraphResolver {

    private final CohortRepository cohortRepository;
    private final PredicateCompiler predicateCompiler;
    private final CohortFiltersCodec codec;

    /**
     * Outcome of expanding a cohort. Cycles are reported as a value so that
     * the walk can unwind without exceptions; the public methods turn them
     * into {@link CyclicCohortException}.
     */
    public sealed interface Resolution {

        record Ok(PersonPredicate predicate) implements Resolution {}

        record Cyclic(List<Long> path) implements Resolution {}
    }

    public record ResolvedCohort(long cohortId, long teamId, PersonPredicate predicate) {}

    /**
     * Resolve a live cohort by id.
     *
     * @throws EntityNotFoundException when the cohort does not exist or is deleted
     * @throws CyclicCohortException when the reference graph loops back on itself
     */
    public ResolvedCohort resolve(long cohortId) {
        Cohort cohort = cohortRepository.findByIdAndDeletedFalse(cohortId)
            .orElseThrow(() -> new EntityNotFoundException("Cohort not found: " + cohortId));
        return resolve(cohort);
    }

    public ResolvedCohort resolve(Cohort cohort) {
        Resolution resolution = tryResolve(cohort);
        if (resolution instanceof Resolution.Cyclic cyclic) {
            throw new CyclicCohortException(cyclic.path());
        }
        return new ResolvedCohort(cohort.getId(), cohort.getTeamId(), ((Resolution.Ok) resolution).predicate());
    }

    public Resolution tryResolve(Cohort cohort) {
        return expand(cohort, new ArrayDeque<>());
    }

    // ========================================================================
    // Expansion
    // ========================================================================

    private Resolution expand(Cohort cohort, Deque<Long> stack) {
        if (cohort.isStatic()) {
            return new Resolution.Ok(new PersonPredicate.StaticCohortMember(cohort.getId()));
        }
        CohortFilters filters = codec.read(cohort);
        if (filters.isEmpty()) {
            return new Resolution.Ok(PersonPredicate.NONE);
        }

        stack.push(cohort.getId());
        try {
            List<PersonPredicate> groups = new ArrayList<>();
            for (CohortGroup group : filters.groups()) {
                Resolution resolved = expandGroup(group, cohort, stack);
                if (resolved instanceof Resolution.Cyclic) {
                    return resolved;
                }
                groups.add(((Resolution.Ok) resolved).predicate());
            }
            return new Resolution.Ok(PersonPredicate.or(groups));
        } finally {
            stack.pop();
        }
    }

    private Resolution expandGroup(CohortGroup group, Cohort cohort, Deque<Long> stack) {
        if (group.hasDanglingBehavioralFields()) {
            throw new InvalidCohortDefinitionException(
                "Cohort " + cohort.getId() + ": days/count require event_id or action_id");
        }

        List<PersonPredicate> terms = new ArrayList<>();
        if (group.hasBehavioralClause()) {
            terms.add(predicateCompiler.compileBehavioral(group, cohort.getTeamId()));
        }
        for (PropertyFilter property : group.properties()) {
            if (isCohortReference(property)) {
                Resolution reference = expandReference(property, cohort, stack);
                if (reference instanceof Resolution.Cyclic) {
                    return reference;
                }
                terms.add(((Resolution.Ok) reference).predicate());
            } else {
                terms.add(predicateCompiler.compileProperty(property, cohort.getTeamId()));
            }
        }

        if (terms.isEmpty()) {
            log.warn("Cohort {} has a group without criteria, it matches nobody", cohort.getId());
            return new Resolution.Ok(PersonPredicate.NONE);
        }
        return new Resolution.Ok(PersonPredicate.and(terms));
    }

    private Resolution expandReference(PropertyFilter property, Cohort cohort, Deque<Long> stack) {
        Optional<Long> referencedId = predicateCompiler.cohortId(property);
        if (referencedId.isEmpty()) {
            return new Resolution.Ok(PersonPredicate.NONE);
        }
        long id = referencedId.get();
        if (id == cohort.getId()) {
            return new Resolution.Ok(negate(property, PersonPredicate.ALL));
        }
        if (stack.contains(id)) {
            return new Resolution.Cyclic(cyclePath(stack, id));
        }

        Optional<Cohort> referenced = cohortRepository.findByIdAndTeamIdAndDeletedFalse(id, cohort.getTeamId());
        if (referenced.isEmpty()) {
            log.debug("Cohort {} references missing cohort {}", cohort.getId(), id);
            return new Resolution.Ok(PersonPredicate.NONE);
        }
        Resolution resolved = expand(referenced.get(), stack);
        if (resolved instanceof Resolution.Ok ok) {
            return new Resolution.Ok(negate(property, ok.predicate()));
        }
        return resolved;
    }

    private static boolean isCohortReference(PropertyFilter property) {
        try {
            return property.propertyType() == PropertyType.COHORT;
        } catch (IllegalArgumentException e) {
            throw new InvalidCohortDefinitionException(e.getMessage(), e);
        }
    }

    private static PersonPredicate negate(PropertyFilter property, PersonPredicate predicate) {
        return property.isNegated() ? PersonPredicate.not(predicate) : predicate;
    }

    /**
     * Path from the outermost cohort to the repeated one, e.g. [1, 2, 1].
     */
    private static List<Long> cyclePath(Deque<Long> stack, long repeated) {
        List<Long> path = new ArrayList<>();
        Iterator<Long> fromRoot = stack.descendingIterator();
        boolean inCycle = false;
        while (fromRoot.hasNext()) {
            long id = fromRoot.next();
            if (id == repeated) {
                inCycle = true;
            }
            if (inCycle) {
                path.add(id);
            }
        }
        path.add(repeated);
        return path;
    }
}
