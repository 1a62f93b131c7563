package com.ospicorp.sustainability.actions.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.sustainability.actions.model.ActionPayload;
import com.ospicorp.sustainability.actions.service.ActionInput;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Converts a request body into an {@link ActionInput} one field at a time, so that a badly typed
 * field is reported next to every other problem in the body instead of aborting the read.
 *
 * <p>Conversion is strict: {@code date} must be an ISO {@code YYYY-MM-DD} string and
 * {@code points} must denote a whole number. A string label may also be given as a number.
 */
@Component
public class ActionPayloadReader {
  static final String NOT_A_STRING = "Not a valid string.";
  static final String BAD_DATE =
      "Date has wrong format. Use one of these formats instead: YYYY-MM-DD.";
  static final String NOT_AN_INTEGER = "A valid integer is required.";

  // "12", " 12 ", "12.0" and "12." are whole numbers
  private static final Pattern WHOLE_NUMBER_TEXT = Pattern.compile("\\s*[-+]?\\d+(\\.0*)?\\s*");
  private static final Pattern ZERO_FRACTION = Pattern.compile("\\.0*$");

  public ActionInput read(JsonNode body) {
    if (body == null || body.isNull() || body.isMissingNode()) {
      return ActionInput.of(null);
    }
    if (!body.isObject()) {
      String found = body.getNodeType().name().toLowerCase(Locale.ROOT);
      return new ActionInput(null, Map.of(ActionInput.NON_FIELD_ERRORS,
          "Invalid data. Expected an object, but got " + found + "."));
    }

    Map<String, String> errors = new LinkedHashMap<>();
    String action = readAction(body.get("action"), errors);
    LocalDate date = readDate(body.get("date"), errors);
    Integer points = readPoints(body.get("points"), errors);
    return new ActionInput(new ActionPayload(action, date, points), errors);
  }

  private static String readAction(JsonNode node, Map<String, String> errors) {
    if (absent(node)) {
      return null;
    }
    if (node.isTextual()) {
      return node.textValue();
    }
    if (node.isNumber()) {
      return node.asText();
    }
    errors.put("action", NOT_A_STRING);
    return null;
  }

  private static LocalDate readDate(JsonNode node, Map<String, String> errors) {
    if (absent(node)) {
      return null;
    }
    if (!node.isTextual()) {
      errors.put("date", BAD_DATE);
      return null;
    }
    try {
      return LocalDate.parse(node.textValue());
    } catch (DateTimeParseException ex) {
      errors.put("date", BAD_DATE);
      return null;
    }
  }

  private static Integer readPoints(JsonNode node, Map<String, String> errors) {
    if (absent(node)) {
      return null;
    }
    try {
      if (node.isIntegralNumber() && node.canConvertToInt()) {
        return node.intValue();
      }
      if (node.isFloatingPointNumber()) {
        return node.decimalValue().intValueExact();
      }
      if (node.isTextual() && WHOLE_NUMBER_TEXT.matcher(node.textValue()).matches()) {
        String digits = ZERO_FRACTION.matcher(node.textValue().strip()).replaceFirst("");
        return Integer.parseInt(digits);
      }
    } catch (ArithmeticException | NumberFormatException ex) {
      // fractional or out of range
      errors.put("points", NOT_AN_INTEGER);
      return null;
    }
    errors.put("points", NOT_AN_INTEGER);
    return null;
  }

  private static boolean absent(JsonNode node) {
    return node == null || node.isNull();
  }
}
