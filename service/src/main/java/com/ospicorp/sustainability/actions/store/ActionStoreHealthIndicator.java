package com.ospicorp.sustainability.actions.store;

import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

// Reports DOWN when the backing file can no longer be read.
@Component("actionStore")
public class ActionStoreHealthIndicator implements HealthIndicator {
  private final ActionStore store;

  public ActionStoreHealthIndicator(ActionStore store) {
    this.store = store;
  }

  @Override
  public Health health() {
    Health.Builder builder = Health.up();
    if (store instanceof JsonFileActionStore fileStore) {
      Path file = fileStore.file();
      builder.withDetail("file", file.toString())
          .withDetail("writable", Files.isWritable(file));
      if (!Files.isReadable(file)) {
        return builder.down().withDetail("error", "store file is not readable").build();
      }
    } else {
      builder.withDetail("type", "memory");
    }
    return builder.withDetail("records", store.getAll().size()).build();
  }
}
