package com.flamingo.ai.graphingest.service.chunking;

import com.flamingo.ai.graphingest.config.IngestionConfig;
import com.flamingo.ai.graphingest.exception.ChunkingException;

/**
 * Immutable chunking parameters.
 *
 * <p>{@code overlap} is either an absolute unit count ({@code >= 1}) or, when strictly between 0
 * and 1, a fraction of {@code targetSize}. {@code minChunkSize} may be null, in which case it
 * defaults to a quarter of the target size.
 */
public record ChunkingOptions(
    int targetSize,
    double overlap,
    SizeUnit unit,
    Integer minChunkSize,
    int lookaheadChars,
    int lookbackChars) {

  public static final int DEFAULT_LOOKAHEAD_CHARS = 200;
  public static final int DEFAULT_LOOKBACK_CHARS = 40;

  public ChunkingOptions {
    if (targetSize < 1) {
      throw new ChunkingException("targetSize must be >= 1, got " + targetSize);
    }
    if (overlap < 0 || Double.isNaN(overlap) || Double.isInfinite(overlap)) {
      throw new ChunkingException("overlap must be a non-negative number, got " + overlap);
    }
    if (unit == null) {
      throw new ChunkingException("unit must not be null");
    }
    if (minChunkSize != null && minChunkSize < 1) {
      throw new ChunkingException("minChunkSize must be >= 1 when set, got " + minChunkSize);
    }
    if (lookaheadChars < 0 || lookbackChars < 0) {
      throw new ChunkingException("lookahead and lookback windows must be non-negative");
    }
  }

  /** Character-sized options with the default boundary windows. */
  public static ChunkingOptions characters(int targetSize, double overlap) {
    return new ChunkingOptions(
        targetSize,
        overlap,
        SizeUnit.CHARACTERS,
        null,
        DEFAULT_LOOKAHEAD_CHARS,
        DEFAULT_LOOKBACK_CHARS);
  }

  public static ChunkingOptions from(IngestionConfig.Chunking config) {
    return new ChunkingOptions(
        config.getTargetSize(),
        config.getOverlap(),
        config.getUnit(),
        config.getMinChunkSize(),
        config.getLookaheadChars(),
        config.getLookbackChars());
  }

  /** Overlap in units, with fractions resolved against the target size. */
  public int resolvedOverlap() {
    if (overlap > 0 && overlap < 1) {
      return (int) Math.floor(overlap * targetSize);
    }
    return (int) Math.floor(overlap);
  }

  public int resolvedMinChunkSize() {
    if (minChunkSize != null) {
      return minChunkSize;
    }
    return Math.max(1, targetSize / 4);
  }
}
