package com.cohortengine.model.filter;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Cohort definition: a person matches when any group matches.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CohortFilters(List<CohortGroup> groups) {

    public CohortFilters {
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public static CohortFilters empty() {
        return new CohortFilters(List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
