package com.flamingo.ai.graphingest.config;

import com.flamingo.ai.graphingest.domain.model.IngestionReport;
import com.flamingo.ai.graphingest.service.ingest.IngestionPipeline;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Startup bean that ingests the configured input directory once.
 *
 * <p>Enabled with {@code ingestion.input.run-on-startup=true}. A failing run is logged and does
 * not stop the application from starting; failed segments are already in the failure ledger.
 */
@Component
@ConditionalOnProperty(name = "ingestion.input.run-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class IngestionStartupRunner implements CommandLineRunner {

  private final IngestionPipeline ingestionPipeline;
  private final IngestionConfig config;

  @Override
  public void run(String... args) {
    Path directory = Paths.get(config.getInput().getDirectory());
    try {
      log.info("Ingesting normalized documents from {} on startup", directory.toAbsolutePath());
      List<IngestionReport> reports = ingestionPipeline.ingestDirectory(directory);
      int loaded = reports.stream().mapToInt(IngestionReport::succeeded).sum();
      int failed = reports.stream().mapToInt(IngestionReport::failed).sum();
      log.info(
          "Startup ingestion complete: {} documents, {} segments loaded, {} failed",
          reports.size(),
          loaded,
          failed);
    } catch (RuntimeException e) {
      log.error("Startup ingestion failed: {}", e.getMessage(), e);
    }
  }
}
