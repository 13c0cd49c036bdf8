package com.flamingo.ai.docingest.service.pipeline;

import com.flamingo.ai.docingest.config.IngestionConfig;
import com.flamingo.ai.docingest.domain.model.Document;
import com.flamingo.ai.docingest.domain.model.IngestionUnit;
import com.flamingo.ai.docingest.exception.DocumentIngestionException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Source documents under the ingestion root. Document ids are paths relative to the root, with
 * {@code /} separators, so they stay stable across machines.
 */
@Component
@Slf4j
public class DocumentSource {

  private final Path root;
  private final String glob;
  private final PathMatcher matcher;
  private final PathMatcher topLevelMatcher;

  @Autowired
  public DocumentSource(IngestionConfig config) {
    this(Path.of(config.getSource().getRoot()), config.getSource().getGlob());
  }

  public DocumentSource(Path root, String glob) {
    this.root = root.toAbsolutePath().normalize();
    this.glob = glob;
    this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
    // "**/" needs at least one directory; also match files directly under the root
    this.topLevelMatcher =
        glob.startsWith("**/")
            ? FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3))
            : matcher;
  }

  /**
   * Lists every matching file under the root, sorted by id.
   *
   * @return discovered documents; empty if the root does not exist
   */
  public List<Document> scan() {
    if (!Files.isDirectory(root)) {
      log.warn("Document root {} does not exist", root);
      return List.of();
    }
    try (Stream<Path> paths = Files.walk(root)) {
      return paths
          .filter(Files::isRegularFile)
          .filter(this::matches)
          .map(this::toDocument)
          .sorted(Comparator.comparing(Document::id))
          .collect(Collectors.toList());
    } catch (IOException | UncheckedIOException e) {
      throw new DocumentIngestionException(
          root.toString(), "Failed to scan document root " + root, e);
    }
  }

  /**
   * Finds a document by id.
   *
   * @throws DocumentIngestionException if the file is missing or outside the root
   */
  public Document resolve(String documentId) {
    Path path = root.resolve(documentId).normalize();
    if (!path.startsWith(root)) {
      throw new DocumentIngestionException(
          documentId, "Document id escapes the document root: " + documentId);
    }
    if (!Files.isRegularFile(path)) {
      throw new DocumentIngestionException(documentId, "Document file not found: " + path);
    }
    return toDocument(path);
  }

  /**
   * Wraps an arbitrary file. Files under the root get their usual id; any other file is identified
   * by its file name.
   */
  public Document fromPath(Path path) {
    Path absolute = path.toAbsolutePath().normalize();
    if (!Files.isRegularFile(absolute)) {
      throw new DocumentIngestionException(path.toString(), "Document file not found: " + path);
    }
    if (absolute.startsWith(root)) {
      return toDocument(absolute);
    }
    return new Document(absolute.getFileName().toString(), absolute, size(absolute));
  }

  /**
   * Reads a document as a level-0 ingestion unit.
   *
   * @throws DocumentIngestionException if the file cannot be read as UTF-8
   */
  public IngestionUnit load(Document document) {
    try {
      String text = Files.readString(document.path(), StandardCharsets.UTF_8);
      return IngestionUnit.ofDocument(document.id(), text);
    } catch (CharacterCodingException e) {
      throw new DocumentIngestionException(
          document.id(), "Document is not valid UTF-8: " + document.path(), e);
    } catch (IOException e) {
      throw new DocumentIngestionException(
          document.id(), "Failed to read document " + document.path(), e);
    }
  }

  private boolean matches(Path path) {
    Path relative = root.relativize(path);
    return matcher.matches(relative) || topLevelMatcher.matches(relative);
  }

  private Document toDocument(Path path) {
    String id = root.relativize(path).toString().replace(path.getFileSystem().getSeparator(), "/");
    return new Document(id, path, size(path));
  }

  private static long size(Path path) {
    try {
      return Files.size(path);
    } catch (IOException e) {
      throw new DocumentIngestionException(path.toString(), "Failed to stat " + path, e);
    }
  }

  @Override
  public String toString() {
    return root + "/" + glob;
  }
}
