package com.ospicorp.sustainability.actions.store;

import com.ospicorp.sustainability.actions.model.Action;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Identity assignment and in-place replacement over a {@link #load()}/{@link #save(List)} pair.
 * Operations are serialized on a single lock so read-modify-write cycles in this JVM never
 * interleave.
 */
public abstract class AbstractActionStore implements ActionStore {

  private final ReentrantLock lock = new ReentrantLock();

  /** Returns the persisted collection; never throws for missing or unreadable content. */
  protected abstract List<Action> load();

  protected abstract void save(List<Action> actions);

  @Override
  public List<Action> getAll() {
    return locked(this::load);
  }

  @Override
  public Optional<Action> getById(long id) {
    return locked(() -> load().stream()
        .filter(action -> action.id() == id)
        .findFirst());
  }

  @Override
  public Action create(Action draft) {
    return locked(() -> {
      List<Action> actions = new ArrayList<>(load());
      Action created = draft.withId(nextId(actions));
      actions.add(created);
      save(actions);
      return created;
    });
  }

  @Override
  public Optional<Action> update(long id, Action data) {
    return locked(() -> {
      List<Action> actions = new ArrayList<>(load());
      for (int i = 0; i < actions.size(); i++) {
        if (actions.get(i).id() == id) {
          Action updated = data.withId(id);
          actions.set(i, updated);
          save(actions);
          return Optional.of(updated);
        }
      }
      return Optional.empty();
    });
  }

  @Override
  public boolean delete(long id) {
    return locked(() -> {
      List<Action> remaining = new ArrayList<>(load());
      remaining.removeIf(action -> action.id() == id);
      save(remaining);
      return true;
    });
  }

  static long nextId(List<Action> actions) {
    return actions.stream().mapToLong(Action::id).max().orElse(0L) + 1;
  }

  private <T> T locked(Supplier<T> operation) {
    lock.lock();
    try {
      return operation.get();
    } finally {
      lock.unlock();
    }
  }
}
