package com.flamingo.ai.docingest.service.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.docingest.exception.StateStoreException;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * A JSON document on disk that is read and rewritten as one locked transaction.
 *
 * <p>Each {@link #update} holds an exclusive lock on a sidecar {@code .lock} file for the whole
 * read-modify-write, then replaces the target by writing a temporary file and moving it over the
 * original atomically. A reader therefore sees either the old or the new state, never a torn file,
 * and two worker processes never interleave their transitions.
 *
 * <p>A missing file reads as the empty state. A file that exists but cannot be parsed is an error:
 * silently resetting it would lose queue or checkpoint history.
 *
 * @param <T> the mutable state model
 */
@Slf4j
public class JsonStateFile<T> {

  private final Path file;
  private final Path lockFile;
  private final Class<T> type;
  private final Supplier<T> emptyState;
  private final ObjectMapper objectMapper;
  private final ReentrantLock localLock = new ReentrantLock();

  public JsonStateFile(
      Path file, Class<T> type, Supplier<T> emptyState, ObjectMapper objectMapper) {
    this.file = file.toAbsolutePath();
    this.lockFile = this.file.resolveSibling(this.file.getFileName() + ".lock");
    this.type = type;
    this.emptyState = emptyState;
    this.objectMapper = objectMapper;
  }

  /** Reads the current state under the lock. */
  public T read() {
    return withLock(this::load);
  }

  /**
   * Applies {@code mutation} to the current state and persists the result.
   *
   * @param mutation changes the state in place and returns a value for the caller
   * @return whatever {@code mutation} returned
   */
  public <R> R update(Function<T, R> mutation) {
    return withLock(
        () -> {
          T state = load();
          R result = mutation.apply(state);
          store(state);
          return result;
        });
  }

  private <R> R withLock(Supplier<R> action) {
    localLock.lock();
    try {
      Files.createDirectories(file.getParent());
      try (FileChannel channel =
              FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
          FileLock ignored = channel.lock()) {
        return action.get();
      }
    } catch (IOException e) {
      throw new StateStoreException(file, "Failed to lock state file " + file, e);
    } finally {
      localLock.unlock();
    }
  }

  private T load() {
    if (!Files.exists(file)) {
      return emptyState.get();
    }
    try {
      byte[] content = Files.readAllBytes(file);
      if (content.length == 0) {
        return emptyState.get();
      }
      return objectMapper.readValue(content, type);
    } catch (IOException e) {
      throw new StateStoreException(file, "Failed to read state file " + file, e);
    }
  }

  private void store(T state) {
    Path tempFile = null;
    try {
      tempFile = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), state);
      try {
        Files.move(
            tempFile,
            file,
            StandardCopyOption.ATOMIC_MOVE,
            StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move not supported for {}, falling back to replace", file);
        Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      deleteQuietly(tempFile);
      throw new StateStoreException(file, "Failed to write state file " + file, e);
    }
  }

  private void deleteQuietly(Path tempFile) {
    if (tempFile == null) {
      return;
    }
    try {
      Files.deleteIfExists(tempFile);
    } catch (IOException e) {
      log.warn("Could not remove temporary state file {}: {}", tempFile, e.getMessage());
    }
  }
}
