package com.task4ge.api.health;

import java.util.Map;

public record HealthEntry(HealthStatus status, String description, Map<String, Object> data) {
}
