package com.ospicorp.sustainability.actions.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDate;

/**
 * A stored sustainability action. Field order matches the persisted JSON layout.
 */
@JsonPropertyOrder({"id", "action", "date", "points"})
public record Action(long id, String action, LocalDate date, int points) {

  /**
   * Builds an action from fully validated payload fields. The id is left unassigned until the
   * store persists it.
   */
  public static Action draft(ActionPayload payload) {
    return new Action(0L, payload.action(), payload.date(), payload.points());
  }

  public Action withId(long newId) {
    return new Action(newId, action, date, points);
  }

  /**
   * Overlays the supplied payload fields onto this action; absent fields keep their current value.
   */
  public Action merge(ActionPayload patch) {
    return new Action(
        id,
        patch.action() != null ? patch.action() : action,
        patch.date() != null ? patch.date() : date,
        patch.points() != null ? patch.points() : points);
  }
}
