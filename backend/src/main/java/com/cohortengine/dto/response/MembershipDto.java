package com.cohortengine.dto.response;

import java.util.UUID;

public record MembershipDto(
    Long cohortId,
    UUID personId,
    boolean member
) {}
