package com.ospicorp.sustainability.actions.store;

import com.ospicorp.sustainability.actions.model.Action;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

// Process-local store for tests and throwaway runs; contents are lost on shutdown.
@Repository
@ConditionalOnProperty(name = "actions.store.type", havingValue = "memory")
public class InMemoryActionStore extends AbstractActionStore {

  private List<Action> snapshot = List.of();

  public InMemoryActionStore() {
  }

  public InMemoryActionStore(List<Action> initial) {
    this.snapshot = List.copyOf(initial);
  }

  @Override
  protected List<Action> load() {
    return snapshot;
  }

  @Override
  protected void save(List<Action> actions) {
    snapshot = List.copyOf(actions);
  }
}
