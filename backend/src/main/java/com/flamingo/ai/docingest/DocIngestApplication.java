package com.flamingo.ai.docingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Command-line entry point for the document ingestion worker.
 *
 * <p>The exit status of the JVM is the exit code chosen by {@link
 * com.flamingo.ai.docingest.cli.IngestionCommandRunner}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class DocIngestApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(DocIngestApplication.class, args)));
  }
}
