package com.flamingo.ai.docingest.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Timers for the ingestion path. {@code @Timed} methods record {@code ingestion.run}, {@code
 * ingestion.document}, {@code ingestion.worker.ingest}, {@code embedding.embedPassage} and {@code
 * elasticsearch.upsert}. They sit next to the chunk and backend retry counters in the same registry.
 */
@Configuration
public class MetricsConfig {

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
