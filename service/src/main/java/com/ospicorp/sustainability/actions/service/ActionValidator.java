package com.ospicorp.sustainability.actions.service;

import com.ospicorp.sustainability.actions.model.ActionPayload;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.validation.groups.Default;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Runs the payload constraints declared on {@link ActionPayload}. The action label is stripped
 * before checking and the stripped payload is what callers get back. Every violation is
 * collected, together with any conversion errors the input already carries; nothing
 * short-circuits on the first failure.
 */
@Component
public class ActionValidator {
  private static final ActionPayload EMPTY = new ActionPayload(null, null, null);

  private final Validator validator;

  public ActionValidator(Validator validator) {
    this.validator = validator;
  }

  /** Create and replace: every field must be present and valid. */
  public ActionPayload validateComplete(ActionPayload payload) {
    return validateComplete(ActionInput.of(payload));
  }

  public ActionPayload validateComplete(ActionInput input) {
    return validate(input, Default.class, ActionPayload.Complete.class);
  }

  /** Patch: only the supplied fields are checked. */
  public ActionPayload validatePartial(ActionPayload payload) {
    return validatePartial(ActionInput.of(payload));
  }

  public ActionPayload validatePartial(ActionInput input) {
    return validate(input, Default.class);
  }

  private ActionPayload validate(ActionInput input, Class<?>... groups) {
    Map<String, String> unreadable = input.conversionErrors();
    String bodyError = unreadable.get(ActionInput.NON_FIELD_ERRORS);
    if (bodyError != null) {
      throw ActionValidationException.forField(ActionInput.NON_FIELD_ERRORS, bodyError);
    }

    ActionPayload candidate = input.payload() == null ? EMPTY : input.payload().trimmed();
    // field names sort into declaration order: action, date, points
    Map<String, List<String>> errors = new TreeMap<>();
    unreadable.forEach((field, message) -> errors.put(field, new ArrayList<>(List.of(message))));
    for (ConstraintViolation<ActionPayload> violation : validator.validate(candidate, groups)) {
      String field = violation.getPropertyPath().toString();
      // an unconvertible value is null here; its conversion message already covers it
      if (unreadable.containsKey(field)) {
        continue;
      }
      errors.computeIfAbsent(field, key -> new ArrayList<>()).add(violation.getMessage());
    }
    if (errors.isEmpty()) {
      return candidate;
    }
    errors.values().forEach(messages -> messages.sort(null));
    throw new ActionValidationException(errors);
  }
}
