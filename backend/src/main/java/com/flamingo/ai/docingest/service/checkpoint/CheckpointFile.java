package com.flamingo.ai.docingest.service.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.TreeSet;
import lombok.Getter;
import lombok.Setter;

/** Persistent form of the checkpoint ledger. Sets are sorted so the file diffs cleanly. */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
class CheckpointFile {

  private TreeSet<String> processed = new TreeSet<>();
  private TreeSet<String> skipped = new TreeSet<>();
}
