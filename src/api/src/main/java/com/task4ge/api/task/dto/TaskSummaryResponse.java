package com.task4ge.api.task.dto;

import com.task4ge.api.task.Priority;

import java.time.OffsetDateTime;

public record TaskSummaryResponse(
    String id,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt,
    Priority priority,
    String name,
    String description,
    OffsetDateTime startDate,
    OffsetDateTime endDate,
    boolean completed
) {}
