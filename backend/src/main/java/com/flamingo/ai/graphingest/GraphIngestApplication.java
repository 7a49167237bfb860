package com.flamingo.ai.graphingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the graph ingestion service. */
@SpringBootApplication
public class GraphIngestApplication {

  public static void main(String[] args) {
    SpringApplication.run(GraphIngestApplication.class, args);
  }
}
