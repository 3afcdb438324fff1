package com.task4ge.api.task;

import com.task4ge.api.infra.ValidationException;
import com.task4ge.api.task.dto.TaskForm;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class TaskRequestValidator {

  private final Clock clock;

  public void validateCreate(TaskForm form) {
    throwIfAny(check(form, false));
  }

  public void validateUpdate(TaskForm form) {
    throwIfAny(check(form, true));
  }

  Map<String, List<String>> check(TaskForm form, boolean update) {
    Map<String, List<String>> errors = new LinkedHashMap<>();
    if (update && isBlank(form.getId())) {
      add(errors, "id", "Invalid ID.");
    }
    if (isBlank(form.getName())) {
      add(errors, "name", "Invalid name.");
    }
    if (isBlank(form.getDescription())) {
      add(errors, "description", "Invalid description.");
    }
    if (Priority.parse(form.getPriority()).isEmpty()) {
      add(errors, "priority", "Invalid priority.");
    }

    OffsetDateTime start = form.getStartDate();
    OffsetDateTime end = form.getEndDate();
    if (end == null) {
      add(errors, "endDate", "End date is required.");
      return errors;
    }
    if (start != null && start.isAfter(end)) {
      add(errors, "startDate", "Start date must be less than or equal to end date.");
    }
    // compared on the date as sent by the client, against today's UTC date
    LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
    if (end.toLocalDate().isBefore(today)) {
      add(errors, "endDate", "End date must be greater than or equal to today.");
    }
    return errors;
  }

  private static void throwIfAny(Map<String, List<String>> errors) {
    if (!errors.isEmpty()) {
      throw new ValidationException(errors);
    }
  }

  private static void add(Map<String, List<String>> errors, String field, String message) {
    errors.computeIfAbsent(field, k -> new ArrayList<>()).add(message);
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
