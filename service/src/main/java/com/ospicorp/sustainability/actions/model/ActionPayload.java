package com.ospicorp.sustainability.actions.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;

/**
 * Request body for create, replace and patch. Every field is nullable: a null field was not
 * supplied. The {@link Complete} group adds the presence checks used for create and replace.
 */
public record ActionPayload(
    @NotNull(groups = Complete.class, message = ActionPayload.REQUIRED)
    @Pattern(regexp = "(?sU).*\\S.*", message = "Action cannot be empty.")
    @Size(max = ActionPayload.MAX_ACTION_LENGTH,
        message = "Ensure this field has no more than 255 characters.")
    String action,

    @NotNull(groups = Complete.class, message = ActionPayload.REQUIRED)
    @PastOrPresent(message = "Date cannot be in the future.")
    LocalDate date,

    @NotNull(groups = Complete.class, message = ActionPayload.REQUIRED)
    @PositiveOrZero(message = "Points must be a positive integer.")
    Integer points
) {

  public static final String REQUIRED = "This field is required.";
  public static final int MAX_ACTION_LENGTH = 255;

  /** Validation group for payloads that must carry every field. */
  public interface Complete {}

  public ActionPayload trimmed() {
    return action == null ? this : new ActionPayload(action.strip(), date, points);
  }
}
