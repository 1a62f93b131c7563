package com.ospicorp.sustainability.config;

import com.ospicorp.sustainability.actions.model.ActionPayload;
import com.ospicorp.sustainability.actions.service.ActionService;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Fills an empty store with a few sample actions when {@code actions.seed.enabled=true}. Dates are
 * relative to startup so the samples always pass validation.
 */
@Component
public class ActionSeeder implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(ActionSeeder.class);

  private final ActionService actionService;
  private final Environment environment;
  private final boolean seedEnabled;

  public ActionSeeder(ActionService actionService,
      Environment environment,
      @Value("${actions.seed.enabled:false}") boolean seedEnabled) {
    this.actionService = actionService;
    this.environment = environment;
    this.seedEnabled = seedEnabled;
  }

  @Override
  public void run(String... args) {
    if (!seedEnabled) {
      log.debug("Action seeding disabled via property actions.seed.enabled=false");
      return;
    }
    if (environment.acceptsProfiles(Profiles.of("prod"))) {
      log.info("Skipping action seeding because active profile includes prod");
      return;
    }
    int existing = actionService.list().size();
    if (existing > 0) {
      log.info("Action store already contains {} actions; skipping seeding", existing);
      return;
    }
    List<ActionPayload> samples = buildSamples(LocalDate.now());
    samples.forEach(actionService::create);
    log.info("Seeded {} sample actions", samples.size());
  }

  static List<ActionPayload> buildSamples(LocalDate today) {
    return List.of(
        new ActionPayload("Recycled household plastics", today.minusDays(6), 10),
        new ActionPayload("Cycled to work", today.minusDays(4), 15),
        new ActionPayload("Composted food scraps", today.minusDays(2), 8),
        new ActionPayload("Switched off standby devices", today.minusDays(1), 3),
        new ActionPayload("Carried a reusable bottle", today, 2));
  }
}
