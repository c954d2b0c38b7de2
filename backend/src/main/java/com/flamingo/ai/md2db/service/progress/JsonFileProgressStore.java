package com.flamingo.ai.md2db.service.progress;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.md2db.config.IngestionConfig;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link ProgressStore} writing one JSON file per source under {@code
 * ingestion.progress.directory}.
 *
 * <p>Each save goes to a temporary file that is then moved over the previous one, so a crash
 * mid-write leaves the last complete snapshot in place.
 */
@Component
@Slf4j
public class JsonFileProgressStore implements ProgressStore {

  private final Path directory;
  private final ObjectMapper objectMapper;

  public JsonFileProgressStore(IngestionConfig config, ObjectMapper objectMapper) {
    this.directory = Path.of(config.getProgress().getDirectory());
    this.objectMapper = objectMapper;
  }

  @Override
  public List<ChunkProgress> load(String sourceKey) throws IOException {
    Path file = fileFor(sourceKey);
    if (!Files.exists(file)) {
      return List.of();
    }
    ProgressFile saved = objectMapper.readValue(file.toFile(), ProgressFile.class);
    if (!sourceKey.equals(saved.sourceKey())) {
      throw new IOException("Progress file " + file + " belongs to " + saved.sourceKey());
    }
    log.debug("Loaded {} progress entries from {}", saved.chunks().size(), file);
    return saved.chunks();
  }

  @Override
  public void save(String sourceKey, List<ChunkProgress> entries) throws IOException {
    Files.createDirectories(directory);
    Path file = fileFor(sourceKey);
    Path temp = directory.resolve(file.getFileName() + ".tmp");
    objectMapper.writeValue(temp.toFile(), new ProgressFile(sourceKey, entries));
    try {
      Files.move(
          temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  Path fileFor(String sourceKey) {
    return directory.resolve(sourceKey + ".progress.json");
  }

  /** On-disk layout. */
  public record ProgressFile(String sourceKey, List<ChunkProgress> chunks) {}
}
