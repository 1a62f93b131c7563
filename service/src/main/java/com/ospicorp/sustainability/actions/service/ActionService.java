package com.ospicorp.sustainability.actions.service;

import com.ospicorp.sustainability.actions.model.Action;
import com.ospicorp.sustainability.actions.model.ActionPayload;
import com.ospicorp.sustainability.actions.store.ActionStore;
import java.util.List;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ActionService {
  public static final String NOT_FOUND = "Action not found";

  private static final Logger log = LoggerFactory.getLogger(ActionService.class);

  private final ActionStore store;
  private final ActionValidator validator;

  public ActionService(ActionStore store, ActionValidator validator) {
    this.store = store;
    this.validator = validator;
  }

  public List<Action> list() {
    return store.getAll();
  }

  public Action get(long id) {
    return store.getById(id).orElseThrow(() -> new NoSuchElementException(NOT_FOUND));
  }

  public Action create(ActionPayload input) {
    return create(ActionInput.of(input));
  }

  public Action create(ActionInput input) {
    ActionPayload valid = validator.validateComplete(input);
    Action created = store.create(Action.draft(valid));
    log.info("Created action {} ({} points)", created.id(), created.points());
    return created;
  }

  /**
   * Replaces every field of an existing action. A missing target is reported before the input
   * is validated.
   */
  public Action replace(long id, ActionInput input) {
    get(id);
    ActionPayload valid = validator.validateComplete(input);
    Action updated = store.update(id, Action.draft(valid))
        .orElseThrow(() -> new ActionUpdateFailedException(id));
    log.info("Replaced action {}", id);
    return updated;
  }

  /**
   * Overwrites only the supplied fields of an existing action; the rest keep their stored value.
   */
  public Action patch(long id, ActionInput input) {
    Action existing = get(id);
    ActionPayload valid = validator.validatePartial(input);
    Action updated = store.update(id, existing.merge(valid))
        .orElseThrow(() -> new ActionUpdateFailedException(id));
    log.info("Patched action {}", id);
    return updated;
  }

  public boolean remove(long id) {
    boolean removed = store.delete(id);
    log.info("Deleted action {}", id);
    return removed;
  }
}
