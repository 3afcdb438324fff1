package com.task4ge.api.task;

import com.task4ge.api.audit.AuditActor;
import com.task4ge.api.audit.AuditLogger;
import com.task4ge.api.audit.LogType;
import com.task4ge.api.auth.AuthPrincipal;
import com.task4ge.api.image.FingerprintedImage;
import com.task4ge.api.image.ImageDiff;
import com.task4ge.api.image.ImageFingerprint;
import com.task4ge.api.image.ImageRecord;
import com.task4ge.api.image.ImageRegistry;
import com.task4ge.api.image.ImageRepository;
import com.task4ge.api.image.ImageUpload;
import com.task4ge.api.image.ResolvedImages;
import com.task4ge.api.infra.tx.TransactionalExecutor;
import com.task4ge.api.infra.tx.UnitOfWork;
import com.task4ge.api.task.dto.CreateTaskResponse;
import com.task4ge.api.task.dto.TaskDetailResponse;
import com.task4ge.api.task.dto.TaskForm;
import com.task4ge.api.task.dto.TaskSummaryResponse;
import com.task4ge.api.task.dto.UpdateTaskResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Lifecycle of a task: validation, image resolution, persistence and audit logging.
 *
 * <p>Each mutation collects its registry, task and log writes in one {@link UnitOfWork}. Blob
 * uploads happen before the commit; blob deletions only after it succeeded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskService {

  public static final String MODEL = "Task";

  private final TaskRepository tasks;
  private final ImageRepository images;
  private final ImageRegistry registry;
  private final AuditLogger audit;
  private final TransactionalExecutor tx;
  private final TaskRequestValidator validator;
  private final Clock clock;

  public TaskDetailResponse get(AuthPrincipal principal, String id) {
    TaskRecord task = tasks.findByOwnerAndId(principal.userId(), id)
        .orElseThrow(TaskNotFoundException::new);
    return new TaskDetailResponse(
        task.id(),
        task.createdAt(),
        task.updatedAt(),
        task.priority(),
        task.name(),
        task.description(),
        task.startDate(),
        task.endDate(),
        imageUrls(task.imageIds()),
        task.completed()
    );
  }

  public List<TaskSummaryResponse> getAll(AuthPrincipal principal) {
    return tasks.findAllByOwner(principal.userId()).stream()
        .map(t -> new TaskSummaryResponse(
            t.id(),
            t.createdAt(),
            t.updatedAt(),
            t.priority(),
            t.name(),
            t.description(),
            t.startDate(),
            t.endDate(),
            t.completed()
        ))
        .toList();
  }

  public CreateTaskResponse create(AuditActor actor, TaskForm form) {
    validator.validateCreate(form);
    List<FingerprintedImage> submitted = ImageFingerprint.distinct(ImageUpload.fromFiles(form.getImages()));

    UnitOfWork uow = tx.begin();
    ResolvedImages resolved = registry.resolve(submitted, actor, uow);

    OffsetDateTime now = OffsetDateTime.now(clock);
    TaskRecord task = TaskRecord.builder()
        .id(UUID.randomUUID().toString())
        .owner(actor.userId())
        .name(form.getName())
        .description(form.getDescription())
        .startDate(form.getStartDate())
        .endDate(form.getEndDate())
        .priority(Priority.parse(form.getPriority()).orElseThrow())
        .completed(false)
        .imageIds(resolved.images().stream().map(ImageRecord::id).toList())
        .createdAt(now)
        .updatedAt(now)
        .build();
    uow.add(() -> tasks.insert(task));
    audit.record(uow, actor, LogType.INSERT, MODEL, null, task);
    commit(uow, resolved);

    log.info("Created task {} for {} with {} image(s), {} uploaded",
        task.id(), actor.userId(), resolved.images().size(), resolved.created().size());
    return new CreateTaskResponse(task.id(), task.createdAt(), task.updatedAt(), resolved.urls());
  }

  public UpdateTaskResponse update(AuditActor actor, TaskForm form) {
    validator.validateUpdate(form);
    TaskRecord existing = tasks.findByOwnerAndId(actor.userId(), form.getId())
        .orElseThrow(TaskNotFoundException::new);

    List<FingerprintedImage> submitted = ImageFingerprint.distinct(ImageUpload.fromFiles(form.getImages()));
    ImageDiff diff = ImageDiff.compute(images.findByIds(existing.imageIds()), submitted);

    UnitOfWork uow = tx.begin();
    ResolvedImages added = registry.resolve(diff.toAdd(), actor, uow);
    for (ImageRecord removed : diff.toDelete()) {
      warnIfShared(removed, existing.id());
      registry.delete(removed, actor, uow);
    }
    List<ImageRecord> finalImages = diff.merge(added.images());

    TaskRecord updated = existing.toBuilder()
        .name(form.getName())
        .description(form.getDescription())
        .startDate(form.getStartDate())
        .endDate(form.getEndDate())
        .priority(Priority.parse(form.getPriority()).orElseThrow())
        .completed(form.getCompleted() != null ? form.getCompleted() : existing.completed())
        .imageIds(finalImages.stream().map(ImageRecord::id).toList())
        .updatedAt(OffsetDateTime.now(clock))
        .build();
    uow.add(() -> tasks.update(updated));
    audit.record(uow, actor, LogType.UPDATE, MODEL, existing, updated);
    commit(uow, added);

    registry.deleteBlobs(diff.toDelete());
    log.info("Updated task {} for {}: {} retained, {} added, {} removed",
        updated.id(), actor.userId(), diff.retained().size(), diff.toAdd().size(), diff.toDelete().size());
    return new UpdateTaskResponse(updated.id(), updated.updatedAt(), finalImages.stream().map(ImageRecord::url).toList());
  }

  public void delete(AuditActor actor, String id) {
    TaskRecord existing = tasks.findByOwnerAndId(actor.userId(), id)
        .orElseThrow(TaskNotFoundException::new);
    List<ImageRecord> owned = images.findByIds(existing.imageIds());

    UnitOfWork uow = tx.begin();
    for (ImageRecord image : owned) {
      warnIfShared(image, existing.id());
      registry.delete(image, actor, uow);
    }
    uow.add(() -> tasks.delete(existing.owner(), existing.id()));
    audit.record(uow, actor, LogType.DELETE, MODEL, existing, null);
    uow.commit();

    registry.deleteBlobs(owned);
    log.info("Deleted task {} for {} with {} image(s)", existing.id(), actor.userId(), owned.size());
  }

  private List<String> imageUrls(List<String> imageIds) {
    Map<String, String> urlById = new HashMap<>();
    images.findByIds(imageIds).forEach(image -> urlById.put(image.id(), image.url()));
    // ids whose image was removed through another task are skipped
    return imageIds.stream()
        .map(urlById::get)
        .filter(Objects::nonNull)
        .toList();
  }

  // Images are deleted globally even when another task still points at them.
  private void warnIfShared(ImageRecord image, String taskId) {
    long others = tasks.countReferences(image.id(), taskId);
    if (others > 0) {
      log.warn("Deleting image {} still referenced by {} other task(s)", image.id(), others);
    }
  }

  private void commit(UnitOfWork uow, ResolvedImages resolved) {
    try {
      uow.commit();
    } catch (RuntimeException e) {
      if (!resolved.created().isEmpty()) {
        log.error("Commit failed after uploading blobs {}; they are orphaned", resolved.createdKeys());
      }
      throw e;
    }
  }
}
