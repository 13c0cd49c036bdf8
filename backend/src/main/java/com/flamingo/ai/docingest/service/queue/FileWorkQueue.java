package com.flamingo.ai.docingest.service.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.docingest.config.IngestionConfig;
import com.flamingo.ai.docingest.domain.enums.QueueState;
import com.flamingo.ai.docingest.service.state.JsonStateFile;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** {@link WorkQueue} persisted as a JSON file with {@code pending/processing/completed/failed}. */
@Service
@Slf4j
public class FileWorkQueue implements WorkQueue {

  private final JsonStateFile<QueueFile> stateFile;

  @Autowired
  public FileWorkQueue(IngestionConfig config, ObjectMapper objectMapper) {
    this(Path.of(config.getState().getQueueFile()), objectMapper);
  }

  public FileWorkQueue(Path file, ObjectMapper objectMapper) {
    this.stateFile = new JsonStateFile<>(file, QueueFile.class, QueueFile::new, objectMapper);
  }

  @Override
  public boolean enqueue(String documentId) {
    return stateFile.update(
        queue -> {
          QueueState current = queue.stateOf(documentId);
          if (current != null) {
            log.debug("Enqueue of {} ignored, already {}", documentId, current);
            return false;
          }
          queue.getPending().add(documentId);
          return true;
        });
  }

  @Override
  public Optional<QueueEntry> dequeue() {
    return stateFile.update(
        queue -> {
          if (queue.getPending().isEmpty()) {
            return Optional.<QueueEntry>empty();
          }
          String id = queue.getPending().remove(0);
          queue.detach(id);
          queue.getProcessing().add(id);
          int attempts = queue.attemptsOf(id) + 1;
          queue.getAttempts().put(id, attempts);
          return Optional.of(new QueueEntry(id, QueueState.PROCESSING, attempts));
        });
  }

  @Override
  public void complete(String documentId) {
    moveToTerminal(documentId, QueueState.COMPLETED);
  }

  @Override
  public void fail(String documentId) {
    moveToTerminal(documentId, QueueState.FAILED);
  }

  private void moveToTerminal(String documentId, QueueState target) {
    QueueState previous =
        stateFile.update(
            queue -> {
              QueueState current = queue.stateOf(documentId);
              queue.detach(documentId);
              queue.list(target).add(documentId);
              return current;
            });
    if (previous != QueueState.PROCESSING) {
      log.debug("{} marked {} from state {}", documentId, target, previous);
    }
  }

  @Override
  public void requeue(String documentId) {
    stateFile.update(
        queue -> {
          queue.detach(documentId);
          queue.getPending().add(documentId);
          return null;
        });
  }

  @Override
  public List<String> recoverInFlight() {
    List<String> recovered =
        stateFile.update(
            queue -> {
              List<String> inFlight = new ArrayList<>(queue.getProcessing());
              queue.getProcessing().clear();
              queue.getPending().removeAll(inFlight);
              queue.getPending().addAll(0, inFlight);
              return inFlight;
            });
    if (!recovered.isEmpty()) {
      log.info("Recovered {} in-flight queue entries: {}", recovered.size(), recovered);
    }
    return recovered;
  }

  @Override
  public List<String> retryFailed() {
    return stateFile.update(
        queue -> {
          List<String> failed = new ArrayList<>(queue.getFailed());
          queue.getFailed().clear();
          for (String id : failed) {
            queue.getAttempts().remove(id);
            if (!queue.getPending().contains(id)) {
              queue.getPending().add(id);
            }
          }
          return failed;
        });
  }

  @Override
  public void forceEnqueue(String documentId) {
    stateFile.update(
        queue -> {
          queue.detach(documentId);
          queue.getAttempts().remove(documentId);
          queue.getPending().add(documentId);
          return null;
        });
  }

  @Override
  public void regenerate(
      Collection<String> pending, Collection<String> completed, Collection<String> failed) {
    stateFile.update(
        queue -> {
          LinkedHashSet<String> terminal = new LinkedHashSet<>(completed);
          terminal.addAll(failed);
          queue.setCompleted(new ArrayList<>(new LinkedHashSet<>(completed)));
          List<String> failedOnly = new ArrayList<>();
          for (String id : new LinkedHashSet<>(failed)) {
            if (!completed.contains(id)) {
              failedOnly.add(id);
            }
          }
          queue.setFailed(failedOnly);
          List<String> pendingOnly = new ArrayList<>();
          for (String id : new LinkedHashSet<>(pending)) {
            if (!terminal.contains(id)) {
              pendingOnly.add(id);
            }
          }
          queue.setPending(pendingOnly);
          queue.setProcessing(new ArrayList<>());
          queue.getAttempts().clear();
          return null;
        });
    log.info(
        "Queue regenerated: {} pending, {} completed, {} failed",
        pending.size(),
        completed.size(),
        failed.size());
  }

  @Override
  public Optional<QueueEntry> entry(String documentId) {
    QueueFile queue = stateFile.read();
    QueueState state = queue.stateOf(documentId);
    if (state == null) {
      return Optional.empty();
    }
    return Optional.of(new QueueEntry(documentId, state, queue.attemptsOf(documentId)));
  }

  @Override
  public QueueSnapshot snapshot() {
    QueueFile queue = stateFile.read();
    return new QueueSnapshot(
        queue.getPending(), queue.getProcessing(), queue.getCompleted(), queue.getFailed());
  }
}
