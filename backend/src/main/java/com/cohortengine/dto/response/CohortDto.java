package com.cohortengine.dto.response;

import com.cohortengine.model.filter.CohortFilters;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Full cohort view including calculation state.
 */
public record CohortDto(
    Long id,
    Long teamId,
    String name,
    String description,
    @JsonProperty("isStatic") boolean isStatic,
    CohortFilters filters,
    Integer version,
    int pendingVersion,
    @JsonProperty("isCalculating") boolean isCalculating,
    Instant lastCalculation,
    Long memberCount,
    int errorsCalculating,
    Instant createdAt,
    Instant updatedAt
) {}
