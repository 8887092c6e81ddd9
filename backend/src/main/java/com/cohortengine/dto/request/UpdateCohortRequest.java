package com.cohortengine.dto.request;

import com.cohortengine.model.filter.CohortFilters;

/**
 * Request DTO for updating a cohort.
 * All fields are optional - only provided fields will be updated.
 */
public record UpdateCohortRequest(
    String name,
    String description,
    CohortFilters filters
) {}
