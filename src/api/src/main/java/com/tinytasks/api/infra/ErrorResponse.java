package com.tinytasks.api.infra;

/**
 * Error body shared by every failing endpoint.
 * {@code code} is the machine-readable reason; {@code field} names the offending input when there is one.
 */
public record ErrorResponse(String code, String message, String field) {

  public static ErrorResponse of(String code, String message) {
    return new ErrorResponse(code, message, null);
  }

  public static ErrorResponse of(String code, String message, String field) {
    return new ErrorResponse(code, message, field);
  }
}
