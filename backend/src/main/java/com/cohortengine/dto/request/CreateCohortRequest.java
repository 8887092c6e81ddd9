package com.cohortengine.dto.request;

import com.cohortengine.model.filter.CohortFilters;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

/**
 * Request DTO for creating a cohort.
 * Static cohorts may be seeded with {@code personIds}; dynamic cohorts carry {@code filters}.
 */
public record CreateCohortRequest(
    @NotNull(message = "Team is required")
    Long teamId,

    @NotBlank(message = "Name is required")
    String name,

    String description,

    @JsonProperty("isStatic") boolean isStatic,

    CohortFilters filters,

    List<UUID> personIds
) {}
