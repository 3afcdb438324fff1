package com.task4ge.api.task;

import com.task4ge.api.audit.AuditActor;
import com.task4ge.api.auth.AuthContext;
import com.task4ge.api.auth.AuthPrincipal;
import com.task4ge.api.task.dto.CreateTaskResponse;
import com.task4ge.api.task.dto.TaskDetailResponse;
import com.task4ge.api.task.dto.TaskForm;
import com.task4ge.api.task.dto.TaskSummaryResponse;
import com.task4ge.api.task.dto.UpdateTaskResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/task")
public class TaskController {

  private final TaskService taskService;

  @GetMapping("/{id}")
  public ResponseEntity<TaskDetailResponse> get(@PathVariable String id) {
    AuthPrincipal principal = AuthContext.getRequired();
    return ResponseEntity.ok(taskService.get(principal, id));
  }

  @GetMapping("/getAll")
  public ResponseEntity<List<TaskSummaryResponse>> getAll() {
    AuthPrincipal principal = AuthContext.getRequired();
    return ResponseEntity.ok(taskService.getAll(principal));
  }

  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<CreateTaskResponse> create(@ModelAttribute TaskForm form, HttpServletRequest httpReq) {
    AuthPrincipal principal = AuthContext.getRequired();
    CreateTaskResponse resp = taskService.create(AuditActor.of(principal, httpReq), form);
    return ResponseEntity.created(URI.create("/task/" + resp.id())).body(resp);
  }

  @PutMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<UpdateTaskResponse> update(@ModelAttribute TaskForm form, HttpServletRequest httpReq) {
    AuthPrincipal principal = AuthContext.getRequired();
    return ResponseEntity.ok(taskService.update(AuditActor.of(principal, httpReq), form));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable String id, HttpServletRequest httpReq) {
    AuthPrincipal principal = AuthContext.getRequired();
    taskService.delete(AuditActor.of(principal, httpReq), id);
    return ResponseEntity.noContent().build();
  }
}
