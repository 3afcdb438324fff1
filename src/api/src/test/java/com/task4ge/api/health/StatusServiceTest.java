package com.task4ge.api.health;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class StatusServiceTest {

  private final DatabaseProbe probe = mock(DatabaseProbe.class);
  private final StatusService service = new StatusService(probe, new StatusProperties(1000, 5));

  @Test
  void healthyWhenDatabaseAnswers() {
    StatusReport report = service.check();

    assertThat(report.results()).containsOnlyKeys("gcinfo", "database");
    assertThat(report.results().get("database").status()).isEqualTo(HealthStatus.HEALTHY);
  }

  @Test
  void unhealthyWhenDatabaseIsDown() {
    doThrow(new DataAccessResourceFailureException("connection refused")).when(probe).ping();

    StatusReport report = service.check();

    assertThat(report.status()).isEqualTo(HealthStatus.UNHEALTHY);
    assertThat(report.results().get("database").data()).containsEntry("error", "connection refused");
  }

  @Test
  void gcInfoDegradesAboveThreshold() {
    assertThat(service.gcInfo(999, 2000, 4000, List.of()).status()).isEqualTo(HealthStatus.HEALTHY);

    HealthEntry over = service.gcInfo(1000, 2000, 4000, List.of());
    assertThat(over.status()).isEqualTo(HealthStatus.DEGRADED);
    assertThat(over.data()).containsEntry("allocated", 1000L).containsEntry("max", 4000L);
  }

  @Test
  void worstStatusWins() {
    assertThat(HealthStatus.HEALTHY.worst(HealthStatus.DEGRADED)).isEqualTo(HealthStatus.DEGRADED);
    assertThat(HealthStatus.UNHEALTHY.worst(HealthStatus.DEGRADED)).isEqualTo(HealthStatus.UNHEALTHY);
  }
}
