package com.cohortengine.dto.response;

import java.util.Map;

/**
 * Membership condition for embedding in other queries: SQL over a
 * {@code person_id} column plus its named parameters.
 */
public record PredicateDto(
    Long cohortId,
    String sql,
    Map<String, Object> parameters
) {}
