package com.task4ge.api.task.dto;

import java.time.OffsetDateTime;
import java.util.List;

public record CreateTaskResponse(String id, OffsetDateTime createdAt, OffsetDateTime updatedAt, List<String> images) {
}
