package com.ospicorp.sustainability.actions.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class ActionTest {

  private final Action stored = new Action(3L, "Recycled", LocalDate.of(2024, 1, 10), 10);

  @Test
  void mergeOverwritesOnlySuppliedFields() {
    var merged = stored.merge(new ActionPayload(null, null, 5));

    assertEquals(new Action(3L, "Recycled", LocalDate.of(2024, 1, 10), 5), merged);
  }

  @Test
  void mergeWithEmptyPayloadKeepsEverything() {
    assertEquals(stored, stored.merge(new ActionPayload(null, null, null)));
  }

  @Test
  void draftLeavesIdUnassigned() {
    var draft = Action.draft(new ActionPayload("Cycled", LocalDate.of(2024, 2, 1), 4));

    assertEquals(0L, draft.id());
    assertEquals(7L, draft.withId(7L).id());
    assertEquals("Cycled", draft.withId(7L).action());
  }

  @Test
  void trimmedStripsSurroundingWhitespace() {
    var payload = new ActionPayload("  Planted a tree \n", null, null);

    assertEquals("Planted a tree", payload.trimmed().action());
    assertNull(new ActionPayload(null, null, 1).trimmed().action());
  }
}
