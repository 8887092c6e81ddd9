package com.cohortengine.dto.response;

public record RecalculationDto(
    long cohortId,
    int version,
    Integer baseVersion,
    String status,
    long added,
    long removed,
    Long memberCount,
    long elapsedMs
) {}
