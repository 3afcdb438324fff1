package com.task4ge.api.audit;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcLogRepository implements LogRepository {

  private final JdbcTemplate jdbc;
  private final SnapshotJson snapshots;

  @Override
  public void insert(LogEntry entry) {
    jdbc.update(
        """
        insert into audit_log(
          id, type, user_id, user_ip, model,
          previous_data, current_data,
          created_at, updated_at
        ) values (?,?,?,?,?, ?::jsonb, ?::jsonb, ?,?)
        """,
        entry.id(),
        entry.type().name(),
        entry.userId(),
        entry.userIp(),
        entry.model(),
        snapshots.toJson(entry.previous()),
        snapshots.toJson(entry.current()),
        entry.createdAt(),
        entry.updatedAt()
    );
  }
}
