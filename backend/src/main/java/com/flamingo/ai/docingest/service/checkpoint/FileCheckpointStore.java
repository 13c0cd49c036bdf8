package com.flamingo.ai.docingest.service.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.docingest.config.IngestionConfig;
import com.flamingo.ai.docingest.domain.model.IngestionUnit;
import com.flamingo.ai.docingest.service.state.JsonStateFile;
import java.nio.file.Path;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** {@link CheckpointStore} persisted as JSON with sorted {@code processed} and {@code skipped}. */
@Service
@Slf4j
public class FileCheckpointStore implements CheckpointStore {

  private final JsonStateFile<CheckpointFile> stateFile;

  @Autowired
  public FileCheckpointStore(IngestionConfig config, ObjectMapper objectMapper) {
    this(Path.of(config.getState().getCheckpointFile()), objectMapper);
  }

  public FileCheckpointStore(Path file, ObjectMapper objectMapper) {
    this.stateFile =
        new JsonStateFile<>(file, CheckpointFile.class, CheckpointFile::new, objectMapper);
  }

  @Override
  public boolean isProcessed(String unitId) {
    return stateFile.read().getProcessed().contains(unitId);
  }

  @Override
  public boolean isSkipped(String unitId) {
    return stateFile.read().getSkipped().contains(unitId);
  }

  @Override
  public void mark(String unitId, boolean success) {
    stateFile.update(
        checkpoint -> {
          if (success) {
            checkpoint.getSkipped().remove(unitId);
            checkpoint.getProcessed().add(unitId);
          } else {
            checkpoint.getProcessed().remove(unitId);
            checkpoint.getSkipped().add(unitId);
          }
          return null;
        });
    log.debug("Checkpoint {} -> {}", unitId, success ? "processed" : "skipped");
  }

  @Override
  public int clear(String documentId) {
    int removed =
        stateFile.update(
            checkpoint -> {
              int before = checkpoint.getProcessed().size() + checkpoint.getSkipped().size();
              checkpoint
                  .getProcessed()
                  .removeIf(id -> IngestionUnit.belongsTo(id, documentId));
              checkpoint
                  .getSkipped()
                  .removeIf(id -> IngestionUnit.belongsTo(id, documentId));
              return before - checkpoint.getProcessed().size() - checkpoint.getSkipped().size();
            });
    log.info("Cleared {} checkpoint entries for {}", removed, documentId);
    return removed;
  }

  @Override
  public Set<String> processed() {
    return Set.copyOf(stateFile.read().getProcessed());
  }

  @Override
  public Set<String> skipped() {
    return Set.copyOf(stateFile.read().getSkipped());
  }
}
