package com.flamingo.ai.graphingest.service.loader;

import com.flamingo.ai.graphingest.config.IngestionConfig;
import com.flamingo.ai.graphingest.domain.model.Document;
import com.flamingo.ai.graphingest.domain.model.Episode;
import com.flamingo.ai.graphingest.domain.model.IngestionReport;
import com.flamingo.ai.graphingest.domain.model.LoadMode;
import com.flamingo.ai.graphingest.domain.model.Segment;
import com.flamingo.ai.graphingest.service.ledger.FailureRecorder;
import com.flamingo.ai.graphingest.service.resilience.ConsecutiveFailureBreaker;
import com.flamingo.ai.graphingest.service.resilience.IngestionContext;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Loads a document's segments into the graph as episodes.
 *
 * <p>A load cycle first submits a metadata episode, then tries to submit every segment in one bulk
 * call when the graph loader supports it, and falls back to loading segments one by one in index
 * order. Every graph loader call goes through the run's limiter and retry policy. In the
 * sequential path each failure is recorded in the failure ledger and counted by the run's breaker,
 * which pauses loading for the cooldown once the threshold of consecutive failures is reached.
 *
 * <p>A failed segment never aborts the document; the returned report counts it and loading moves
 * on to the next segment.
 */
@Service
@Slf4j
public class EpisodeLoader {

  private final GraphLoader graphLoader;
  private final SupportsBulkLoad bulkLoader;
  private final EpisodeFactory episodeFactory;
  private final FailureRecorder failureRecorder;
  private final MeterRegistry meterRegistry;
  private final boolean bulkEnabled;

  public EpisodeLoader(
      GraphLoader graphLoader,
      EpisodeFactory episodeFactory,
      FailureRecorder failureRecorder,
      IngestionConfig config,
      MeterRegistry meterRegistry) {
    this.graphLoader = graphLoader;
    this.bulkLoader = graphLoader instanceof SupportsBulkLoad bulk ? bulk : null;
    this.episodeFactory = episodeFactory;
    this.failureRecorder = failureRecorder;
    this.meterRegistry = meterRegistry;
    this.bulkEnabled = config.getLoader().isBulkEnabled();
    log.info(
        "Episode loader using {} (bulk {})",
        graphLoader.getClass().getSimpleName(),
        bulkLoader == null ? "unsupported" : bulkEnabled ? "enabled" : "disabled");
  }

  /**
   * Runs a full load cycle for one document.
   *
   * @param document the document
   * @param segments its segments in index order
   * @param context resilience state of the current run
   * @return the outcome; always produced, even if nothing was loaded
   */
  @Timed(value = "ingestion.document", description = "Time to load one document into the graph")
  public IngestionReport load(
      Document document, List<Segment> segments, IngestionContext context) {
    log.info("Loading document {} ({} segments)", document.id(), segments.size());
    List<CompletableFuture<Void>> pendingRecords = new ArrayList<>();

    loadMetadata(document, context, pendingRecords);

    boolean bulkLoaded =
        bulkLoader != null
            && bulkEnabled
            && !segments.isEmpty()
            && loadBulk(document, segments, context, pendingRecords);
    IngestionReport report =
        bulkLoaded
            ? new IngestionReport(
                document.id(), segments.size(), 0, segments.size(), LoadMode.BULK, false)
            : loadSequentially(document, segments, context, LoadMode.SEQUENTIAL, pendingRecords);
    return finish(report, pendingRecords);
  }

  /**
   * Reloads previously failed segments one by one, without the metadata episode or bulk attempt.
   */
  public IngestionReport redrive(
      Document document, List<Segment> segments, IngestionContext context) {
    log.info("Redriving {} failed segments of document {}", segments.size(), document.id());
    List<CompletableFuture<Void>> pendingRecords = new ArrayList<>();
    IngestionReport report =
        loadSequentially(document, segments, context, LoadMode.REDRIVE, pendingRecords);
    return finish(report, pendingRecords);
  }

  public boolean supportsBulk() {
    return bulkLoader != null;
  }

  private void loadMetadata(
      Document document, IngestionContext context, List<CompletableFuture<Void>> pendingRecords) {
    Episode episode = episodeFactory.metadataEpisode(document, Instant.now());
    ConsecutiveFailureBreaker breaker = context.getBreaker();
    try {
      context.execute(episode.name(), () -> submit(episode));
      breaker.recordSuccess();
      log.debug("Metadata episode {} loaded", episode.name());
    } catch (Exception e) {
      breaker.recordFailure(e);
      log.error("Metadata episode failed for document {}: {}", document.id(), describe(e));
      pendingRecords.add(
          failureRecorder.record(
              document.id(), List.of(), "meta_episode_failed: " + describe(e)));
      pauseIfTripped(breaker);
    }
  }

  private boolean loadBulk(
      Document document,
      List<Segment> segments,
      IngestionContext context,
      List<CompletableFuture<Void>> pendingRecords) {
    Instant referenceTime = Instant.now();
    try {
      List<Episode> episodes = new ArrayList<>(segments.size());
      for (Segment segment : segments) {
        episodes.add(episodeFactory.structuredEpisode(document, segment, referenceTime));
      }
      context.execute(
          document.id() + "_bulk",
          () -> {
            bulkLoader.loadBulk(episodes);
            return null;
          });
      meterRegistry.counter("ingestion.bulk.success").increment();
      meterRegistry.counter("ingestion.segments.success").increment(segments.size());
      log.info("Bulk loaded {} segments of document {}", segments.size(), document.id());
      return true;
    } catch (Exception e) {
      meterRegistry.counter("ingestion.bulk.failure").increment();
      log.warn(
          "Bulk load failed for document {}, falling back to sequential: {}",
          document.id(),
          describe(e));
      pendingRecords.add(
          failureRecorder.record(document.id(), segments, "bulk_load_failed: " + describe(e)));
      return false;
    }
  }

  private IngestionReport loadSequentially(
      Document document,
      List<Segment> segments,
      IngestionContext context,
      LoadMode mode,
      List<CompletableFuture<Void>> pendingRecords) {
    ConsecutiveFailureBreaker breaker = context.getBreaker();
    int succeeded = 0;
    int failed = 0;
    boolean interrupted = false;

    for (Segment segment : segments) {
      if (Thread.currentThread().isInterrupted()) {
        log.warn(
            "Interrupted before segment {} of document {}, stopping",
            segment.index(),
            document.id());
        interrupted = true;
        break;
      }

      Episode episode = episodeFactory.textEpisode(document, segment, Instant.now());
      try {
        context.execute(episode.name(), () -> submit(episode));
        succeeded++;
        breaker.recordSuccess();
        meterRegistry.counter("ingestion.segments.success").increment();
        log.debug("Segment {} of document {} loaded", segment.index(), document.id());
      } catch (Exception e) {
        failed++;
        breaker.recordFailure(e);
        meterRegistry.counter("ingestion.segments.failure").increment();
        log.error(
            "Segment {} of document {} failed: {}", segment.index(), document.id(), describe(e));
        pendingRecords.add(
            failureRecorder.record(
                document.id(),
                List.of(segment),
                "segment_" + segment.index() + "_failed: " + describe(e)));
        if (!pauseIfTripped(breaker)) {
          interrupted = true;
          break;
        }
      }
    }

    return new IngestionReport(
        document.id(), succeeded, failed, segments.size(), mode, interrupted);
  }

  /** Returns false when the cooldown was interrupted. */
  private boolean pauseIfTripped(ConsecutiveFailureBreaker breaker) {
    try {
      if (breaker.pauseIfTripped()) {
        meterRegistry.counter("ingestion.circuit.pause").increment();
      }
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted during circuit breaker cooldown, stopping");
      return false;
    }
  }

  private Void submit(Episode episode) {
    graphLoader.load(
        episode.name(),
        episode.body(),
        episode.source(),
        episode.description(),
        episode.referenceTime());
    return null;
  }

  private IngestionReport finish(
      IngestionReport report, List<CompletableFuture<Void>> pendingRecords) {
    CompletableFuture.allOf(pendingRecords.toArray(new CompletableFuture[0])).join();
    log.info(
        "Document {} done: {}/{} segments loaded, {} failed (mode={}{})",
        report.documentId(),
        report.succeeded(),
        report.total(),
        report.failed(),
        report.mode(),
        report.interrupted() ? ", interrupted" : "");
    return report;
  }

  private static String describe(Throwable e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }
}
