package com.cohortengine.service;

import com.cohortengine.exception.CohortValidationException;
import com.cohortengine.model.cohort.Cohort;
import com.cohortengine.model.enums.PropertyType;
import com.cohortengine.model.filter.CohortGroup;
import com.cohortengine.model.filter.PropertyFilter;
import com.cohortengine.repository.CohortRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks the cohort reference graph: what a cohort depends on, what depends on
 * it, and an order in which a team's cohorts can be recalculated.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CohortDependencyService {

    private static final Set<PropertyType> REFERENCE_TYPES =
        EnumSet.of(PropertyType.COHORT, PropertyType.STATIC_COHORT, PropertyType.PRECALCULATED_COHORT);

    private final CohortRepository cohortRepository;
    private final CohortFiltersCodec codec;

    /**
     * Cohort ids referenced directly by a cohort's filters.
     */
    public Set<Long> referencedCohortIds(Cohort cohort) {
        Set<Long> ids = new LinkedHashSet<>();
        if (cohort.isStatic()) {
            return ids;
        }
        for (CohortGroup group : codec.read(cohort).groups()) {
            for (PropertyFilter property : group.properties()) {
                if (isReference(property)) {
                    Long id = parseId(property.firstValue());
                    if (id != null && !id.equals(cohort.getId())) {
                        ids.add(id);
                    }
                }
            }
        }
        return ids;
    }

    /**
     * All cohorts reachable through references, excluding the cohort itself.
     */
    public Set<Long> dependencies(long cohortId) {
        Set<Long> visited = new LinkedHashSet<>();
        Deque<Long> pending = new ArrayDeque<>();
        pending.push(cohortId);
        while (!pending.isEmpty()) {
            long current = pending.pop();
            cohortRepository.findByIdAndDeletedFalse(current).ifPresent(cohort -> {
                for (Long id : safeReferences(cohort)) {
                    if (id != cohortId && visited.add(id)) {
                        pending.push(id);
                    }
                }
            });
        }
        return visited;
    }

    /**
     * All live cohorts of the team that reach {@code cohortId} through references.
     */
    public Set<Long> dependents(long teamId, long cohortId) {
        Map<Long, Set<Long>> reverse = new HashMap<>();
        for (Cohort cohort : cohortRepository.findByTeamIdAndDeletedFalseOrderById(teamId)) {
            for (Long id : safeReferences(cohort)) {
                reverse.computeIfAbsent(id, k -> new LinkedHashSet<>()).add(cohort.getId());
            }
        }

        Set<Long> visited = new LinkedHashSet<>();
        Deque<Long> pending = new ArrayDeque<>();
        pending.push(cohortId);
        while (!pending.isEmpty()) {
            for (Long dependent : reverse.getOrDefault(pending.pop(), Set.of())) {
                if (dependent != cohortId && visited.add(dependent)) {
                    pending.push(dependent);
                }
            }
        }
        return visited;
    }

    /**
     * Orders cohorts so that every cohort comes after the cohorts it references.
     * References outside the list are ignored; cohorts on a cycle keep their
     * relative input order.
     */
    public List<Cohort> sortTopologically(List<Cohort> cohorts) {
        Map<Long, Cohort> byId = new LinkedHashMap<>();
        cohorts.forEach(cohort -> byId.put(cohort.getId(), cohort));

        List<Cohort> sorted = new ArrayList<>(cohorts.size());
        Set<Long> done = new HashSet<>();
        Set<Long> inProgress = new HashSet<>();
        for (Cohort cohort : cohorts) {
            visit(cohort, byId, done, inProgress, sorted);
        }
        return sorted;
    }

    private void visit(Cohort cohort, Map<Long, Cohort> byId, Set<Long> done, Set<Long> inProgress, List<Cohort> sorted) {
        if (done.contains(cohort.getId()) || !inProgress.add(cohort.getId())) {
            return;
        }
        for (Long id : safeReferences(cohort)) {
            Cohort dependency = byId.get(id);
            if (dependency != null) {
                visit(dependency, byId, done, inProgress, sorted);
            }
        }
        inProgress.remove(cohort.getId());
        done.add(cohort.getId());
        sorted.add(cohort);
    }

    private Set<Long> safeReferences(Cohort cohort) {
        try {
            return referencedCohortIds(cohort);
        } catch (CohortValidationException e) {
            log.warn("Skipping references of cohort {}: {}", cohort.getId(), e.getMessage());
            return Set.of();
        }
    }

    private static boolean isReference(PropertyFilter property) {
        try {
            return REFERENCE_TYPES.contains(property.propertyType());
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static Long parseId(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
