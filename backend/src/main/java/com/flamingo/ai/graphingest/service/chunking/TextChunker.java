package com.flamingo.ai.graphingest.service.chunking;

import java.util.List;

/**
 * Splits normalized document text into ordered, bounded, possibly overlapping chunks.
 *
 * <p>Implementations must be stateless and deterministic: the same input and options always yield
 * the same chunks.
 */
public interface TextChunker {

  /**
   * Chunks the outer-trimmed {@code text}.
   *
   * @param text the document text, may be null or blank
   * @param options window size, overlap and boundary settings
   * @return ordered chunks; empty for null or whitespace-only input
   */
  List<TextChunk> chunk(String text, ChunkingOptions options);
}
