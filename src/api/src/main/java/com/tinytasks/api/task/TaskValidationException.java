package com.tinytasks.api.task;

public class TaskValidationException extends RuntimeException {

  public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
  public static final String EMPTY_PATCH = "EMPTY_PATCH";

  private final String code;
  private final String field;
  private final int httpStatus;

  public TaskValidationException(String code, String field, String message, int httpStatus) {
    super(message);
    this.code = code;
    this.field = field;
    this.httpStatus = httpStatus;
  }

  public static TaskValidationException invalid(String field, String message) {
    return new TaskValidationException(VALIDATION_ERROR, field, message, 422);
  }

  public static TaskValidationException emptyPatch() {
    return new TaskValidationException(EMPTY_PATCH, null, "at least one of title or done must be provided", 400);
  }

  public String code() {
    return code;
  }

  public String field() {
    return field;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
