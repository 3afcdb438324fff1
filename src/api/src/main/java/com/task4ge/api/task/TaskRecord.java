package com.task4ge.api.task;

import lombok.Builder;

import java.time.OffsetDateTime;
import java.util.List;

@Builder(toBuilder = true)
public record TaskRecord(
    String id,
    String owner,
    String name,
    String description,
    OffsetDateTime startDate,
    OffsetDateTime endDate,
    Priority priority,
    boolean completed,
    List<String> imageIds,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {

  public TaskRecord {
    imageIds = imageIds == null ? List.of() : List.copyOf(imageIds);
  }
}
