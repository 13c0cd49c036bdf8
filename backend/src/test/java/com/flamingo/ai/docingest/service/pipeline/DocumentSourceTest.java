package com.flamingo.ai.docingest.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docingest.domain.model.Document;
import com.flamingo.ai.docingest.domain.model.IngestionUnit;
import com.flamingo.ai.docingest.exception.DocumentIngestionException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DocumentSource Tests")
class DocumentSourceTest {

  @TempDir Path tempDir;

  private DocumentSource source;

  @BeforeEach
  void setUp() throws IOException {
    Files.createDirectories(tempDir.resolve("nested"));
    Files.writeString(tempDir.resolve("top.txt"), "héllo", StandardCharsets.UTF_8);
    Files.writeString(tempDir.resolve("nested/inner.txt"), "inner", StandardCharsets.UTF_8);
    Files.writeString(tempDir.resolve("skip.pdf"), "binary", StandardCharsets.UTF_8);
    source = new DocumentSource(tempDir, "**/*.txt");
  }

  @Test
  @DisplayName("should list matching files at every depth with root-relative ids")
  void shouldScanRecursively() {
    assertThat(source.scan())
        .extracting(Document::id)
        .containsExactly("nested/inner.txt", "top.txt");
  }

  @Test
  @DisplayName("should load a document as a level-0 unit")
  void shouldLoadDocument() {
    IngestionUnit unit = source.load(source.resolve("top.txt"));

    assertThat(unit.id()).isEqualTo("top.txt");
    assertThat(unit.text()).isEqualTo("héllo");
    assertThat(unit.recursionLevel()).isZero();
  }

  @Test
  @DisplayName("should reject ids outside the root and missing files")
  void shouldRejectBadIds() {
    assertThatThrownBy(() -> source.resolve("../outside.txt"))
        .isInstanceOf(DocumentIngestionException.class)
        .hasMessageContaining("escapes");
    assertThatThrownBy(() -> source.resolve("missing.txt"))
        .isInstanceOf(DocumentIngestionException.class);
  }

  @Test
  @DisplayName("should reject content that is not UTF-8")
  void shouldRejectInvalidUtf8() throws IOException {
    Files.write(tempDir.resolve("latin1.txt"), new byte[] {(byte) 0xE9, 'a'});

    assertThatThrownBy(() -> source.load(source.resolve("latin1.txt")))
        .isInstanceOf(DocumentIngestionException.class)
        .hasMessageContaining("UTF-8");
  }

  @Test
  @DisplayName("should return nothing when the root does not exist")
  void shouldHandleMissingRoot() {
    assertThat(new DocumentSource(tempDir.resolve("absent"), "**/*.txt").scan()).isEmpty();
  }
}
