package com.ospicorp.sustainability.actions.store;

import com.ospicorp.sustainability.actions.model.Action;
import java.util.List;
import java.util.Optional;

/**
 * Whole-collection persistence for actions. Every call reads the full collection and mutating
 * calls rewrite it before returning.
 */
public interface ActionStore {

  List<Action> getAll();

  Optional<Action> getById(long id);

  /**
   * Persists {@code draft} under the next free id ({@code max(ids) + 1}, or 1 when empty). The
   * draft's own id is ignored.
   */
  Action create(Action draft);

  /**
   * Replaces the action with {@code id} in place, forcing the stored id to {@code id}.
   *
   * @return the stored action, or empty if no action has that id (storage is left untouched)
   */
  Optional<Action> update(long id, Action data);

  /**
   * Removes every action with {@code id}. Succeeds whether or not a match existed.
   */
  boolean delete(long id);
}
