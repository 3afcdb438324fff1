package com.task4ge.api.task.dto;

import java.time.OffsetDateTime;
import java.util.List;

public record UpdateTaskResponse(String id, OffsetDateTime updatedAt, List<String> images) {
}
