package com.flamingo.ai.docingest.domain.model;

import java.nio.file.Path;

/**
 * A source file discovered under the ingestion root.
 *
 * @param id path relative to the ingestion root, {@code /}-separated
 * @param path absolute location of the file
 * @param byteSize size of the file on disk
 */
public record Document(String id, Path path, long byteSize) {

  public Document {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Document id must not be blank");
    }
    if (path == null) {
      throw new IllegalArgumentException("Document path must not be null");
    }
  }
}
