package com.flamingo.ai.graphingest.service.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.graphingest.config.IngestionConfig;
import com.flamingo.ai.graphingest.domain.model.Segment;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * {@link FailureRecorder} that keeps one JSON ledger file per document.
 *
 * <p>Each record is a read-modify-write of {@code <dir>/<documentId>.failed.json} executed on the
 * single-threaded {@code failureLedgerExecutor}, so writes for the same document never interleave.
 * The new content is written to a temp file in the same directory and moved over the ledger, so a
 * reader sees either the old or the new file. An unparseable ledger is moved aside to {@code
 * <file>.corrupt-<epochMillis>} and a fresh one is started.
 *
 * <p>Failures of the recorder itself are logged and counted, never propagated to the loader.
 */
@Component
@Slf4j
public class JsonFileFailureRecorder implements FailureRecorder {

  private static final Pattern SEGMENT_FAILURE = Pattern.compile("segment_(\\d+)_failed");

  private final Path directory;
  private final ObjectMapper objectMapper;
  private final Executor executor;
  private final Counter writeFailureCounter;
  private final Clock clock;

  @Autowired
  public JsonFileFailureRecorder(
      IngestionConfig config,
      ObjectMapper objectMapper,
      @Qualifier("failureLedgerExecutor") Executor executor,
      MeterRegistry meterRegistry) {
    this(
        Paths.get(config.getLedger().getDirectory()),
        objectMapper,
        executor,
        meterRegistry,
        Clock.systemUTC());
  }

  public JsonFileFailureRecorder(
      Path directory,
      ObjectMapper objectMapper,
      Executor executor,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.directory = directory;
    this.objectMapper = objectMapper;
    this.executor = executor;
    this.writeFailureCounter = meterRegistry.counter("ingestion.ledger.write.failure");
    this.clock = clock;
  }

  @Override
  public CompletableFuture<Void> record(String documentId, List<Segment> segments, String reason) {
    String timestamp = Instant.now(clock).toString();
    List<Segment> snapshot = segments == null ? List.of() : List.copyOf(segments);
    try {
      return CompletableFuture.runAsync(
              () -> append(documentId, snapshot, reason, timestamp), executor)
          .exceptionally(
              ex -> {
                writeFailureCounter.increment();
                log.error(
                    "Failed to record failure for document {} ({}): {}",
                    documentId,
                    reason,
                    ex.getMessage(),
                    ex);
                return null;
              });
    } catch (RejectedExecutionException e) {
      writeFailureCounter.increment();
      log.error("Failure ledger executor rejected record for document {}: {}", documentId, reason);
      return CompletableFuture.completedFuture(null);
    }
  }

  private void append(String documentId, List<Segment> segments, String reason, String timestamp) {
    try {
      Files.createDirectories(directory);
      Path file = LedgerFiles.resolve(directory, documentId);
      FailureLedger ledger = load(file, documentId);

      Integer failedIndex = failedIndexFrom(reason);
      Segment segment = resolveSegment(segments, failedIndex);
      String key = keyFor(segment, failedIndex);

      ledger.append(
          key, new FailureEntry(reason, segment == null ? null : segment.toSnapshot(), timestamp));
      ledger.setUpdatedAt(timestamp);
      writeAtomically(file, ledger);
      log.debug("Recorded failure {} for document {} in {}", key, documentId, file);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private FailureLedger load(Path file, String documentId) throws IOException {
    FailureLedger ledger = null;
    if (Files.exists(file)) {
      try {
        ledger = objectMapper.readValue(file.toFile(), FailureLedger.class);
      } catch (JsonProcessingException e) {
        Path backup =
            file.resolveSibling(file.getFileName() + ".corrupt-" + clock.instant().toEpochMilli());
        Files.move(file, backup, StandardCopyOption.REPLACE_EXISTING);
        log.warn(
            "Corrupt failure ledger for document {} moved to {}: {}",
            documentId,
            backup,
            e.getOriginalMessage());
      }
    }
    if (ledger == null) {
      ledger = new FailureLedger();
    }
    if (ledger.getDocumentId() == null) {
      ledger.setDocumentId(documentId);
    }
    if (ledger.getFailedSegments() == null) {
      ledger.setFailedSegments(new LinkedHashMap<>());
    }
    return ledger;
  }

  private void writeAtomically(Path file, FailureLedger ledger) throws IOException {
    Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
    try {
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), ledger);
      try {
        Files.move(
            temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private static Integer failedIndexFrom(String reason) {
    if (reason == null) {
      return null;
    }
    Matcher matcher = SEGMENT_FAILURE.matcher(reason);
    return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
  }

  private static Segment resolveSegment(List<Segment> segments, Integer failedIndex) {
    if (failedIndex != null) {
      return segments.stream().filter(s -> s.index() == failedIndex).findFirst().orElse(null);
    }
    return segments.size() == 1 ? segments.get(0) : null;
  }

  private static String keyFor(Segment segment, Integer failedIndex) {
    if (segment != null) {
      return segment.ledgerKey();
    }
    if (failedIndex != null) {
      return "segment_" + failedIndex;
    }
    return "unkeyed_" + UUID.randomUUID();
  }
}
