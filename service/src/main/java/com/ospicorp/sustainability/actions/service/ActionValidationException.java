package com.ospicorp.sustainability.actions.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One or more field constraints failed. {@link #errors()} maps each offending field to every
 * message raised for it.
 */
public class ActionValidationException extends RuntimeException {
  private final Map<String, List<String>> errors;

  public ActionValidationException(Map<String, List<String>> errors) {
    super("Invalid action fields: " + errors.keySet());
    Map<String, List<String>> copy = new LinkedHashMap<>();
    errors.forEach((field, messages) -> copy.put(field, List.copyOf(messages)));
    this.errors = Collections.unmodifiableMap(copy);
  }

  public static ActionValidationException forField(String field, String message) {
    return new ActionValidationException(Map.of(field, List.of(message)));
  }

  public Map<String, List<String>> errors() {
    return errors;
  }
}
