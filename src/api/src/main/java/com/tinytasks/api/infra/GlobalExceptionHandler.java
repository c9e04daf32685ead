package com.tinytasks.api.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@Slf4j
@Order(Ordered.LOWEST_PRECEDENCE)
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> badJson(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(422).body(ErrorResponse.of("BAD_JSON", "request body is not valid JSON for this endpoint"));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> validation(MethodArgumentNotValidException ex) {
    String field = ex.getBindingResult().getFieldErrors().stream()
        .map(FieldError::getField)
        .findFirst()
        .orElse(null);
    String message = ex.getBindingResult().getFieldErrors().stream()
        .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
        .reduce((a, b) -> a + "; " + b)
        .orElse("request validation failed");
    return ResponseEntity.status(422).body(ErrorResponse.of("VALIDATION_ERROR", message, field));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ErrorResponse> typeMismatch(MethodArgumentTypeMismatchException ex) {
    String expected = ex.getRequiredType() == null ? "value" : ex.getRequiredType().getSimpleName().toLowerCase();
    return ResponseEntity.status(422).body(ErrorResponse.of(
        "VALIDATION_ERROR", ex.getName() + " must be a valid " + expected, ex.getName()));
  }

  @ExceptionHandler({NoHandlerFoundException.class, NoResourceFoundException.class})
  public ResponseEntity<ErrorResponse> notFound(Exception ex) {
    return ResponseEntity.status(404).body(ErrorResponse.of("NOT_FOUND", "resource not found"));
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> methodNotAllowed(HttpRequestMethodNotSupportedException ex) {
    return ResponseEntity.status(405).body(ErrorResponse.of("METHOD_NOT_ALLOWED", ex.getMethod() + " is not supported here"));
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ErrorResponse> unsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
    return ResponseEntity.status(415).body(ErrorResponse.of("UNSUPPORTED_MEDIA_TYPE", "request body must be application/json"));
  }

  @ExceptionHandler({StoreUnavailableException.class, CannotCreateTransactionException.class, DataAccessResourceFailureException.class})
  public ResponseEntity<ErrorResponse> storeUnavailable(Exception ex) {
    log.warn("store unavailable: {}", ex.getMessage(), ex);
    return ResponseEntity.status(503).body(ErrorResponse.of("STORE_UNAVAILABLE", "task store is unavailable, retry later"));
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ErrorResponse> storeFailure(DataAccessException ex) {
    log.error("store operation failed", ex);
    return ResponseEntity.status(500).body(ErrorResponse.of("SERVER_ERROR", "internal server error"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> unknown(Exception ex) {
    log.error("unhandled exception", ex);
    return ResponseEntity.status(500).body(ErrorResponse.of("SERVER_ERROR", "internal server error"));
  }
}
