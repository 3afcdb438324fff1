package com.task4ge.api.audit;

import com.task4ge.api.infra.tx.UnitOfWork;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Queues audit entries next to the entity writes they describe, so both commit or fail together.
 */
@Component
@RequiredArgsConstructor
public class AuditLogger {

  private final LogRepository logs;
  private final SnapshotJson snapshots;
  private final Clock clock;

  public LogEntry record(UnitOfWork uow, AuditActor actor, LogType type, String model, Object previous, Object current) {
    OffsetDateTime now = OffsetDateTime.now(clock);
    LogEntry entry = new LogEntry(
        UUID.randomUUID().toString(),
        type,
        actor.userId(),
        actor.ip(),
        model,
        snapshots.toSnapshot(previous),
        snapshots.toSnapshot(current),
        now,
        now
    );
    uow.add(() -> logs.insert(entry));
    return entry;
  }
}
