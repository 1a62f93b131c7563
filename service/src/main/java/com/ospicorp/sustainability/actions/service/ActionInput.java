package com.ospicorp.sustainability.actions.service;

import com.ospicorp.sustainability.actions.model.ActionPayload;
import java.util.Map;

/**
 * A payload as read from a request body, together with a message for each field whose JSON value
 * could not be converted. A field listed in {@code conversionErrors} is null in the payload.
 */
public record ActionInput(ActionPayload payload, Map<String, String> conversionErrors) {

  /** Key for an error that concerns the body as a whole rather than one field. */
  public static final String NON_FIELD_ERRORS = "non_field_errors";

  public ActionInput {
    conversionErrors = Map.copyOf(conversionErrors);
  }

  public static ActionInput of(ActionPayload payload) {
    return new ActionInput(payload, Map.of());
  }
}
