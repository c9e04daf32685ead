package com.tinytasks.api.infra;

public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(Throwable cause) {
    super("STORE_UNAVAILABLE", cause);
  }
}
