package com.task4ge.api.infra;

import com.task4ge.api.infra.s3.BlobStoreException;
import com.task4ge.api.user.IdentityDirectoryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Order(Ordered.LOWEST_PRECEDENCE)
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<ValidationErrorResponse> validation(ValidationException ex) {
    return ResponseEntity.badRequest().body(ValidationErrorResponse.of(ex.errors()));
  }

  @ExceptionHandler(BindException.class)
  public ResponseEntity<ValidationErrorResponse> binding(BindException ex) {
    Map<String, List<String>> errors = new LinkedHashMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
      errors.computeIfAbsent(fe.getField(), k -> new ArrayList<>()).add("Invalid " + fe.getField() + ".");
    }
    return ResponseEntity.badRequest().body(ValidationErrorResponse.of(errors));
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> tooLarge(MaxUploadSizeExceededException ex) {
    return ResponseEntity.status(413).body(ErrorResponse.of("PAYLOAD_TOO_LARGE", "Uploaded files are too large."));
  }

  @ExceptionHandler({MultipartException.class, UncheckedIOException.class})
  public ResponseEntity<ErrorResponse> badMultipart(Exception ex) {
    return ResponseEntity.badRequest().body(ErrorResponse.of("BAD_REQUEST", "Malformed multipart request.", ex.getMessage()));
  }

  @ExceptionHandler({BlobStoreException.class, IdentityDirectoryException.class, DataAccessException.class})
  public ResponseEntity<ErrorResponse> dependency(RuntimeException ex) {
    log.error("Dependency failure: {}", ex.getMessage(), ex);
    return ResponseEntity.status(500).body(ErrorResponse.of("DEPENDENCY_ERROR", "A backing service failed, please retry later."));
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ErrorResponse> notFound(NoResourceFoundException ex) {
    return ResponseEntity.status(404).body(ErrorResponse.of("NOT_FOUND", "Resource not found."));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> unknown(Exception ex) {
    log.error("Unhandled exception", ex);
    return ResponseEntity.status(500).body(ErrorResponse.of("SERVER_ERROR", "Unexpected server error.", ex.getClass().getName()));
  }
}
