package com.task4ge.api.task;

import java.util.Locale;
import java.util.Optional;

public enum Priority {
  LOW,
  MEDIUM,
  HIGH;

  public static Optional<Priority> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.of(LOW);
    }
    try {
      return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
