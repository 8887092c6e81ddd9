package com.cohortengine.dto.response;

import java.time.Instant;

/**
 * One entry of a cohort's calculation history.
 */
public record CalculationDto(
    Long id,
    Integer version,
    Integer baseVersion,
    String status,
    Instant startedAt,
    Instant finishedAt,
    long addedCount,
    long removedCount,
    Long memberCount,
    String error
) {}
