package com.task4ge.api.task;

import java.util.List;
import java.util.Optional;

/**
 * Task storage. Every lookup is scoped by owner so one user never sees another's tasks.
 */
public interface TaskRepository {

  void insert(TaskRecord task);

  void update(TaskRecord task);

  void delete(String owner, String id);

  Optional<TaskRecord> findByOwnerAndId(String owner, String id);

  /** Newest first. */
  List<TaskRecord> findAllByOwner(String owner);

  /** Number of tasks, of any owner, other than {@code excludingTaskId} that reference the image. */
  long countReferences(String imageId, String excludingTaskId);
}
