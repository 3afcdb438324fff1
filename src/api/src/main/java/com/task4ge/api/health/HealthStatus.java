package com.task4ge.api.health;

public enum HealthStatus {
  HEALTHY,
  DEGRADED,
  UNHEALTHY;

  public HealthStatus worst(HealthStatus other) {
    return other.ordinal() > ordinal() ? other : this;
  }
}
