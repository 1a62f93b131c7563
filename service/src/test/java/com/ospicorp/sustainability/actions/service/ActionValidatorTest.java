package com.ospicorp.sustainability.actions.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.sustainability.actions.model.ActionPayload;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;

class ActionValidatorTest {

  private static final ValidatorFactory FACTORY = Validation.buildDefaultValidatorFactory();

  private final ActionValidator validator = new ActionValidator(FACTORY.getValidator());

  @AfterAll
  static void closeFactory() {
    FACTORY.close();
  }

  @Test
  void completePayloadPassesAndIsTrimmed() {
    var valid = validator.validateComplete(
        new ActionPayload("  Recycled  ", LocalDate.of(2024, 1, 10), 10));

    assertEquals(new ActionPayload("Recycled", LocalDate.of(2024, 1, 10), 10), valid);
  }

  @Test
  void todayAndZeroPointsAreAccepted() {
    var valid = validator.validateComplete(new ActionPayload("Walked", LocalDate.now(), 0));

    assertEquals(0, valid.points());
  }

  @Test
  void blankActionIsRejected() {
    var ex = assertThrows(ActionValidationException.class,
        () -> validator.validateComplete(new ActionPayload("   ", LocalDate.of(2024, 1, 10), 5)));

    assertEquals(Map.of("action", List.of("Action cannot be empty.")), ex.errors());
  }

  @Test
  void negativePointsAreRejected() {
    var ex = assertThrows(ActionValidationException.class,
        () -> validator.validateComplete(new ActionPayload("Cycled", LocalDate.of(2024, 1, 10), -1)));

    assertEquals(Map.of("points", List.of("Points must be a positive integer.")), ex.errors());
  }

  @Test
  void futureDateIsRejected() {
    var tomorrow = LocalDate.now().plusDays(1);
    var ex = assertThrows(ActionValidationException.class,
        () -> validator.validateComplete(new ActionPayload("Cycled", tomorrow, 1)));

    assertEquals(Map.of("date", List.of("Date cannot be in the future.")), ex.errors());
  }

  @Test
  void overlongActionIsRejected() {
    var label = "x".repeat(ActionPayload.MAX_ACTION_LENGTH + 1);
    var ex = assertThrows(ActionValidationException.class,
        () -> validator.validateComplete(new ActionPayload(label, LocalDate.of(2024, 1, 10), 1)));

    assertEquals(List.of("Ensure this field has no more than 255 characters."),
        ex.errors().get("action"));
  }

  @Test
  void everyViolationIsReportedTogether() {
    var ex = assertThrows(ActionValidationException.class,
        () -> validator.validateComplete(
            new ActionPayload("", LocalDate.now().plusDays(30), -5)));

    assertEquals(List.of("action", "date", "points"), List.copyOf(ex.errors().keySet()));
  }

  @Test
  void missingFieldsAreRequiredForCompletePayloads() {
    var ex = assertThrows(ActionValidationException.class,
        () -> validator.validateComplete(new ActionPayload("Cycled", null, null)));

    assertEquals(Map.of(
        "date", List.of(ActionPayload.REQUIRED),
        "points", List.of(ActionPayload.REQUIRED)), ex.errors());
  }

  @Test
  void nullPayloadReportsEveryFieldAsRequired() {
    var ex = assertThrows(ActionValidationException.class,
        () -> validator.validateComplete((ActionPayload) null));

    assertEquals(3, ex.errors().size());
  }

  @Test
  void partialPayloadOnlyChecksSuppliedFields() {
    var valid = validator.validatePartial(new ActionPayload(null, null, 20));

    assertEquals(new ActionPayload(null, null, 20), valid);
  }

  @Test
  void partialPayloadStillRejectsBadValues() {
    var ex = assertThrows(ActionValidationException.class,
        () -> validator.validatePartial(new ActionPayload(" ", null, -1)));

    assertEquals(List.of("action", "points"), List.copyOf(ex.errors().keySet()));
  }

  @Test
  void conversionErrorsAreMergedWithConstraintViolations() {
    var input = new ActionInput(new ActionPayload("", LocalDate.of(2024, 1, 10), null),
        Map.of("points", "A valid integer is required."));

    var ex = assertThrows(ActionValidationException.class,
        () -> validator.validateComplete(input));

    assertEquals(Map.of(
        "action", List.of("Action cannot be empty."),
        "points", List.of("A valid integer is required.")), ex.errors());
  }

  @Test
  void unconvertedFieldIsNotAlsoReportedAsRequired() {
    var input = new ActionInput(new ActionPayload("Recycled", null, 10),
        Map.of("date", "Date has wrong format. Use one of these formats instead: YYYY-MM-DD."));

    var ex = assertThrows(ActionValidationException.class,
        () -> validator.validateComplete(input));

    assertEquals(List.of("Date has wrong format. Use one of these formats instead: YYYY-MM-DD."),
        ex.errors().get("date"));
  }

  @Test
  void bodyLevelErrorIsReportedAlone() {
    var input = new ActionInput(null,
        Map.of(ActionInput.NON_FIELD_ERRORS, "Invalid data. Expected an object, but got array."));

    var ex = assertThrows(ActionValidationException.class,
        () -> validator.validateComplete(input));

    assertEquals(Map.of(ActionInput.NON_FIELD_ERRORS,
        List.of("Invalid data. Expected an object, but got array.")), ex.errors());
  }

  @Test
  void unicodeWhitespaceIsStrippedFromLabel() {
    var ex = assertThrows(ActionValidationException.class,
        () -> validator.validatePartial(new ActionPayload("\u3000", null, null)));
    var valid = validator.validatePartial(new ActionPayload("\u3000Composted\u2003", null, null));

    assertEquals(List.of("Action cannot be empty."), ex.errors().get("action"));
    assertEquals("Composted", valid.action());
  }
}
