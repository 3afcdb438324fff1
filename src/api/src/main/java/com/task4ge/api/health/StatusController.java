package com.task4ge.api.health;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatusController {

  private final StatusService statusService;

  @GetMapping("/status")
  public ResponseEntity<StatusReport> status() {
    StatusReport report = statusService.check();
    int code = report.status() == HealthStatus.UNHEALTHY ? 503 : 200;
    return ResponseEntity.status(code).body(report);
  }
}
