package com.task4ge.api.health;

import java.util.Map;

public record StatusReport(HealthStatus status, Map<String, HealthEntry> results) {
}
