package com.ospicorp.sustainability.actions.store;

public class ActionStorageException extends RuntimeException {
  private final String location;

  public ActionStorageException(String message, String location, Throwable cause) {
    super(message, cause);
    this.location = location;
  }

  public String location() {
    return location;
  }
}
