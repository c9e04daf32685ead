package com.tinytasks.api.task;

import com.tinytasks.api.infra.ErrorResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice
public class TaskExceptionHandler {

  @ExceptionHandler(TaskNotFoundException.class)
  public ResponseEntity<ErrorResponse> notFound() {
    return ResponseEntity.status(404).body(ErrorResponse.of("NOT_FOUND", "task not found"));
  }

  @ExceptionHandler(TaskValidationException.class)
  public ResponseEntity<ErrorResponse> validation(TaskValidationException ex) {
    return ResponseEntity.status(ex.httpStatus()).body(ErrorResponse.of(ex.code(), ex.getMessage(), ex.field()));
  }
}
