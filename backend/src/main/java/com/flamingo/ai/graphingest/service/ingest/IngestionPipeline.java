package com.flamingo.ai.graphingest.service.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.graphingest.config.IngestionConfig;
import com.flamingo.ai.graphingest.domain.model.Document;
import com.flamingo.ai.graphingest.domain.model.IngestionReport;
import com.flamingo.ai.graphingest.domain.model.LoadMode;
import com.flamingo.ai.graphingest.domain.model.MappedDocument;
import com.flamingo.ai.graphingest.domain.model.Segment;
import com.flamingo.ai.graphingest.exception.DocumentMappingException;
import com.flamingo.ai.graphingest.service.chunking.ChunkingOptions;
import com.flamingo.ai.graphingest.service.chunking.TextChunk;
import com.flamingo.ai.graphingest.service.chunking.TextChunker;
import com.flamingo.ai.graphingest.service.ledger.FailureLedgerReader;
import com.flamingo.ai.graphingest.service.loader.EpisodeLoader;
import com.flamingo.ai.graphingest.service.resilience.IngestionContext;
import com.flamingo.ai.graphingest.service.resilience.IngestionContextFactory;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Entry point for ingesting documents: chunks or maps them into segments and hands them to the
 * {@link EpisodeLoader} under a per-run {@link IngestionContext}.
 *
 * <p>Documents of one run share the run's limiter and breaker, so a burst of failures in one
 * document also slows down the next one.
 */
@Service
@Slf4j
public class IngestionPipeline {

  static final String INPUT_SUFFIX = ".normalized.json";
  static final String MAPPED_OUTPUT_DIR = "mapped_outputs";

  private final TextChunker chunker;
  private final ChunkingOptions chunkingOptions;
  private final NormalizedDocumentMapper mapper;
  private final EpisodeLoader episodeLoader;
  private final IngestionContextFactory contextFactory;
  private final FailureLedgerReader ledgerReader;
  private final ObjectMapper objectMapper;
  private final IngestionConfig config;
  private final Executor documentIngestionExecutor;

  public IngestionPipeline(
      TextChunker chunker,
      ChunkingOptions chunkingOptions,
      NormalizedDocumentMapper mapper,
      EpisodeLoader episodeLoader,
      IngestionContextFactory contextFactory,
      FailureLedgerReader ledgerReader,
      ObjectMapper objectMapper,
      IngestionConfig config,
      @Qualifier("documentIngestionExecutor") Executor documentIngestionExecutor) {
    this.chunker = chunker;
    this.chunkingOptions = chunkingOptions;
    this.mapper = mapper;
    this.episodeLoader = episodeLoader;
    this.contextFactory = contextFactory;
    this.ledgerReader = ledgerReader;
    this.objectMapper = objectMapper;
    this.config = config;
    this.documentIngestionExecutor = documentIngestionExecutor;
  }

  /** Chunks the document text and loads it as a run of its own. */
  public IngestionReport ingest(Document document) {
    return ingest(document, segmentsOf(document), contextFactory.newContext());
  }

  public IngestionReport ingest(
      Document document, List<Segment> segments, IngestionContext context) {
    return episodeLoader.load(document, segments, context);
  }

  /** Loads a mapped document on the document ingestion executor as a run of its own. */
  @Async("documentIngestionExecutor")
  public CompletableFuture<IngestionReport> ingestAsync(MappedDocument mapped) {
    return CompletableFuture.completedFuture(
        ingest(mapped.document(), mapped.segments(), contextFactory.newContext()));
  }

  /**
   * Loads several documents concurrently on the document ingestion executor. All of them share one
   * context, so the limiter still bounds the total number of in-flight graph calls.
   */
  public CompletableFuture<List<IngestionReport>> ingestAllAsync(List<MappedDocument> documents) {
    IngestionContext context = contextFactory.newContext();
    List<CompletableFuture<IngestionReport>> futures =
        documents.stream()
            .map(
                mapped ->
                    CompletableFuture.supplyAsync(
                        () -> ingest(mapped.document(), mapped.segments(), context),
                        documentIngestionExecutor))
            .toList();
    return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
        .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
  }

  /**
   * Ingests every {@code *.normalized.json} file in {@code directory} in name order, one document
   * at a time. Files that cannot be read or mapped are logged and skipped.
   *
   * @param directory the input directory
   * @return one report per ingested document
   */
  public List<IngestionReport> ingestDirectory(Path directory) {
    List<Path> files = listInputFiles(directory);
    if (files.isEmpty()) {
      log.warn("No {} files found in {}", INPUT_SUFFIX, directory);
      return List.of();
    }

    log.info("Ingesting {} documents from {}", files.size(), directory);
    IngestionContext context = contextFactory.newContext();
    List<IngestionReport> reports = new ArrayList<>();
    for (Path file : files) {
      if (Thread.currentThread().isInterrupted()) {
        log.warn("Interrupted, skipping remaining files in {}", directory);
        break;
      }

      MappedDocument mapped;
      try {
        mapped = mapper.read(file);
      } catch (DocumentMappingException e) {
        log.error("Skipping {}: {}", file.getFileName(), e.getMessage());
        continue;
      }

      if (config.getInput().isWriteMappedOutputs()) {
        writeMappedOutputs(directory, file, mapped);
      }

      try {
        reports.add(ingest(mapped.document(), mapped.segments(), context));
      } catch (RuntimeException e) {
        log.error("Ingest failed for {}: {}", file.getFileName(), e.getMessage(), e);
      }
    }

    int failed = reports.stream().mapToInt(IngestionReport::failed).sum();
    log.info(
        "Directory ingestion finished: {} of {} documents ingested, {} failed segments",
        reports.size(),
        files.size(),
        failed);
    return reports;
  }

  /**
   * Reloads the segments of {@code document} that have entries in its failure ledger. Ledger
   * entries are kept; a segment that fails again gets an additional entry.
   */
  public IngestionReport redrive(Document document, List<Segment> segments) {
    Set<String> failedKeys = ledgerReader.failedSegmentKeys(document.id());
    List<Segment> toRetry =
        segments.stream().filter(s -> failedKeys.contains(s.ledgerKey())).toList();
    if (toRetry.isEmpty()) {
      log.info("Nothing to redrive for document {}", document.id());
      return IngestionReport.empty(document.id(), LoadMode.REDRIVE);
    }
    return episodeLoader.redrive(document, toRetry, contextFactory.newContext());
  }

  List<Segment> segmentsOf(Document document) {
    List<TextChunk> chunks = chunker.chunk(document.text(), chunkingOptions);
    List<Segment> segments = new ArrayList<>(chunks.size());
    for (TextChunk chunk : chunks) {
      segments.add(Segment.of(document.id(), chunk.index(), chunk.text()));
    }
    return segments;
  }

  private List<Path> listInputFiles(Path directory) {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    try (Stream<Path> entries = Files.list(directory)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(
              p -> {
                String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
                return name.endsWith(INPUT_SUFFIX) && !name.contains(".mapped.");
              })
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list input directory " + directory, e);
    }
  }

  private void writeMappedOutputs(Path directory, Path file, MappedDocument mapped) {
    String fileName = file.getFileName().toString();
    String base = fileName.substring(0, fileName.length() - ".json".length());
    Path outputDir = directory.resolve(MAPPED_OUTPUT_DIR);
    try {
      Files.createDirectories(outputDir);
      objectMapper
          .writerWithDefaultPrettyPrinter()
          .writeValue(outputDir.resolve(base + ".document.json").toFile(), mapped.document());
      List<Object> segments = new ArrayList<>();
      mapped.segments().forEach(s -> segments.add(s.toSnapshot()));
      objectMapper
          .writerWithDefaultPrettyPrinter()
          .writeValue(outputDir.resolve(base + ".segments.json").toFile(), segments);
      log.debug("Wrote mapped outputs for {} to {}", fileName, outputDir);
    } catch (IOException e) {
      log.warn("Could not write mapped outputs for {}: {}", fileName, e.getMessage());
    }
  }
}
