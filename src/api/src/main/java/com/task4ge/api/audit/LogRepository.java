package com.task4ge.api.audit;

public interface LogRepository {

  void insert(LogEntry entry);
}
