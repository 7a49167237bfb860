package com.flamingo.ai.graphingest.config;

import com.flamingo.ai.graphingest.service.chunking.SizeUnit;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the ingestion pipeline. */
@Configuration
@ConfigurationProperties(prefix = "ingestion")
@Validated
@Getter
@Setter
public class IngestionConfig {

  @Valid private Chunking chunking = new Chunking();
  @Valid private Retry retry = new Retry();
  @Valid private Limiter limiter = new Limiter();
  @Valid private CircuitBreaker circuitBreaker = new CircuitBreaker();
  @Valid private Loader loader = new Loader();
  @Valid private Ledger ledger = new Ledger();
  @Valid private Graphiti graphiti = new Graphiti();
  @Valid private Input input = new Input();

  @Getter
  @Setter
  public static class Chunking {
    /** Target window size, in {@link #unit}s. */
    @Min(1)
    private int targetSize = 3000;

    /** Absolute overlap (>= 1) or a fraction of {@link #targetSize} when in (0, 1). */
    @DecimalMin("0")
    private double overlap = 300;

    @NotNull private SizeUnit unit = SizeUnit.CHARACTERS;

    /** Minimum non-final chunk size; defaults to a quarter of the target when unset. */
    private Integer minChunkSize;

    /** Characters scanned past the cut point for a sentence end or newline. */
    @Min(0)
    private int lookaheadChars = 200;

    /** Characters scanned before the cut point for whitespace when no sentence end is found. */
    @Min(0)
    private int lookbackChars = 40;

    /**
     * OpenAI model name whose tokenizer counts tokens when {@link #unit} is {@code TOKENS}. Blank
     * falls back to whitespace word counting.
     */
    private String tokenizerModel = "";
  }

  @Getter
  @Setter
  public static class Retry {
    /** Total invocations, including the first one. */
    @Min(1)
    private int maxAttempts = 6;

    @NotNull private Duration initialDelay = Duration.ofMillis(500);
    @NotNull private Duration maxDelay = Duration.ofSeconds(30);

    @DecimalMin("1.0")
    private double backoffFactor = 2.0;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterFraction = 0.3;

    /** Case-insensitive substrings that mark an error message as a transient rate limit. */
    private List<String> retryableMarkers =
        new ArrayList<>(
            List.of(
                "rate limit",
                "rate_limited",
                "429",
                "quota",
                "resource_exhausted",
                "resource exhausted",
                "insufficient_quota",
                "too many requests"));
  }

  @Getter
  @Setter
  public static class Limiter {
    /** Maximum simultaneous in-flight graph loader calls. */
    @Min(1)
    private int maxConcurrentCalls = 1;

    /** How long a call may wait for a free slot before failing. */
    @NotNull private Duration maxWait = Duration.ofMinutes(30);
  }

  @Getter
  @Setter
  public static class CircuitBreaker {
    /** Consecutive segment failures that trigger a cooldown pause. */
    @Min(1)
    private int maxConsecutiveFailures = 3;

    @NotNull private Duration cooldown = Duration.ofSeconds(60);
  }

  @Getter
  @Setter
  public static class Loader {
    /** Attempt one bulk call per document when the graph loader supports it. */
    private boolean bulkEnabled = true;

    /** Characters of document text included in the metadata episode. */
    @Min(0)
    private int metadataPreviewChars = 2000;
  }

  @Getter
  @Setter
  public static class Ledger {
    /** Directory holding one {@code <documentId>.failed.json} file per document. */
    @NotNull private String directory = "failed";
  }

  @Getter
  @Setter
  public static class Graphiti {
    private String baseUrl = "http://localhost:8000";
    @NotNull private Duration readTimeout = Duration.ofMinutes(5);
  }

  @Getter
  @Setter
  public static class Input {
    /** Directory scanned for {@code *.normalized.json} records. */
    private String directory = "normalized";

    /** Ingest the input directory once on application startup. */
    private boolean runOnStartup = false;

    /** Write mapped document and segment JSON next to the input for inspection. */
    private boolean writeMappedOutputs = true;
  }
}
