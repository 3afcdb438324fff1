package com.task4ge.api.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Refuses to finish startup when the database is unreachable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseStartupCheck implements ApplicationRunner {

  private final DatabaseProbe probe;

  @Override
  public void run(ApplicationArguments args) {
    log.info("Checking database connection");
    try {
      probe.ping();
    } catch (DataAccessException e) {
      log.error("Database connection not established: {}", e.getMessage());
      throw new IllegalStateException("Database connection not established", e);
    }
    log.info("Database connection established");
  }
}
