package com.flamingo.ai.graphingest.service.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.graphingest.config.IngestionConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Set;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Reads failure ledgers back for inspection and redrive. */
@Component
public class FailureLedgerReader {

  private final Path directory;
  private final ObjectMapper objectMapper;

  @Autowired
  public FailureLedgerReader(IngestionConfig config, ObjectMapper objectMapper) {
    this(Paths.get(config.getLedger().getDirectory()), objectMapper);
  }

  public FailureLedgerReader(Path directory, ObjectMapper objectMapper) {
    this.directory = directory;
    this.objectMapper = objectMapper;
  }

  /**
   * Loads the ledger of a document.
   *
   * @param documentId the document id
   * @return the ledger, or empty when the document has no recorded failures
   * @throws UncheckedIOException if the ledger exists but cannot be read or parsed
   */
  public Optional<FailureLedger> read(String documentId) {
    Path file = LedgerFiles.resolve(directory, documentId);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(file.toFile(), FailureLedger.class));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read failure ledger " + file, e);
    }
  }

  /** Keys of every segment with at least one recorded failure. */
  public Set<String> failedSegmentKeys(String documentId) {
    return read(documentId)
        .map(FailureLedger::getFailedSegments)
        .map(segments -> Set.copyOf(segments.keySet()))
        .orElse(Set.of());
  }
}
