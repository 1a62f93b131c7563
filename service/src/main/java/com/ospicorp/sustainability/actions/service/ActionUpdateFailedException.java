package com.ospicorp.sustainability.actions.service;

// The target existed when checked but was gone by the time the store rewrote it.
public class ActionUpdateFailedException extends RuntimeException {
  private final long actionId;

  public ActionUpdateFailedException(long actionId) {
    super("Failed to update action");
    this.actionId = actionId;
  }

  public long actionId() {
    return actionId;
  }
}
