package com.task4ge.api.infra;

import java.util.List;
import java.util.Map;

/**
 * Field-level rejection of a request, raised before any side effect.
 */
public class ValidationException extends RuntimeException {

  private final Map<String, List<String>> errors;

  public ValidationException(Map<String, List<String>> errors) {
    super("Validation failed for " + errors.keySet());
    this.errors = Map.copyOf(errors);
  }

  public static ValidationException of(String field, String message) {
    return new ValidationException(Map.of(field, List.of(message)));
  }

  public Map<String, List<String>> errors() {
    return errors;
  }
}
