package com.cohortengine.dto.request;

import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

public record InsertStaticMembersRequest(
    @NotNull(message = "personIds is required")
    List<UUID> personIds
) {}
