package com.tinytasks.api.task.dto;

import java.time.OffsetDateTime;

public record TaskResponse(
    String id,
    String title,
    boolean done,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {}
