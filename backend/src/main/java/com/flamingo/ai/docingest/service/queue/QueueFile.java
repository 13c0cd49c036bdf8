package com.flamingo.ai.docingest.service.queue;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flamingo.ai.docingest.domain.enums.QueueState;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;

/** Persistent form of the work queue: four named id lists plus per-id attempt counters. */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
class QueueFile {

  private List<String> pending = new ArrayList<>();
  private List<String> processing = new ArrayList<>();
  private List<String> completed = new ArrayList<>();
  private List<String> failed = new ArrayList<>();
  private Map<String, Integer> attempts = new LinkedHashMap<>();

  @JsonIgnore
  List<String> list(QueueState state) {
    return switch (state) {
      case PENDING -> pending;
      case PROCESSING -> processing;
      case COMPLETED -> completed;
      case FAILED -> failed;
    };
  }

  /** State of {@code id}, or {@code null} if the queue has never seen it. */
  @JsonIgnore
  QueueState stateOf(String id) {
    for (QueueState state : QueueState.values()) {
      if (list(state).contains(id)) {
        return state;
      }
    }
    return null;
  }

  /** Removes {@code id} from every list. */
  void detach(String id) {
    for (QueueState state : QueueState.values()) {
      list(state).removeIf(id::equals);
    }
  }

  int attemptsOf(String id) {
    return attempts.getOrDefault(id, 0);
  }
}
