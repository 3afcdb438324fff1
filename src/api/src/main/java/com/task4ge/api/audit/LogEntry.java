package com.task4ge.api.audit;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Immutable audit record of one mutation. {@code previous} is null for inserts and
 * {@code current} is null for deletes.
 */
public record LogEntry(
    String id,
    LogType type,
    String userId,
    String userIp,
    String model,
    Map<String, Object> previous,
    Map<String, Object> current,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {
}
