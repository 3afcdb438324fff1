package com.task4ge.api.infra;

import java.util.List;
import java.util.Map;

public record ValidationErrorResponse(String code, String message, Map<String, List<String>> errors) {

  public static ValidationErrorResponse of(Map<String, List<String>> errors) {
    return new ValidationErrorResponse("VALIDATION_ERROR", "One or more fields are invalid.", errors);
  }
}
