package com.ospicorp.sustainability.actions.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ospicorp.sustainability.actions.model.Action;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * Keeps the whole collection in one JSON array on disk. A missing or malformed file reads as an
 * empty collection; writes go through a sibling temp file and a move so readers never see a
 * half-written array.
 */
@Repository
@ConditionalOnProperty(name = "actions.store.type", havingValue = "file", matchIfMissing = true)
public class JsonFileActionStore extends AbstractActionStore {

  private static final Logger log = LoggerFactory.getLogger(JsonFileActionStore.class);
  private static final TypeReference<List<Action>> ACTION_LIST = new TypeReference<>() {};

  private final Path file;
  private final ObjectMapper mapper;
  private final ObjectWriter writer;

  public JsonFileActionStore(ObjectMapper mapper,
      @Value("${actions.store.path:actions_data.json}") String path) {
    this.file = Path.of(path).toAbsolutePath();
    this.mapper = mapper.copy().disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    this.writer = this.mapper.writerWithDefaultPrettyPrinter();
    ensureFileExists();
  }

  public Path file() {
    return file;
  }

  @Override
  protected List<Action> load() {
    try (InputStream in = Files.newInputStream(file)) {
      List<Action> actions = mapper.readValue(in, ACTION_LIST);
      if (actions == null) {
        return Collections.emptyList();
      }
      return actions.stream().filter(Objects::nonNull).toList();
    } catch (NoSuchFileException ex) {
      log.warn("Action store {} is missing; treating it as empty", file);
      return Collections.emptyList();
    } catch (IOException ex) {
      log.warn("Action store {} is unreadable; treating it as empty: {}", file, ex.getMessage());
      return Collections.emptyList();
    }
  }

  @Override
  protected void save(List<Action> actions) {
    Path temp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      writer.writeValue(temp.toFile(), actions);
      moveIntoPlace(temp);
    } catch (IOException ex) {
      throw new ActionStorageException("Failed to write action store", file.toString(), ex);
    }
  }

  private void moveIntoPlace(Path temp) throws IOException {
    try {
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private void ensureFileExists() {
    if (Files.exists(file)) {
      log.info("Using action store {}", file);
      return;
    }
    try {
      Path parent = file.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      writer.writeValue(file.toFile(), Collections.emptyList());
      log.info("Created empty action store {}", file);
    } catch (IOException ex) {
      throw new ActionStorageException("Failed to create action store", file.toString(), ex);
    }
  }
}
