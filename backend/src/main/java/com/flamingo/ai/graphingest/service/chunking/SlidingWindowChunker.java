package com.flamingo.ai.graphingest.service.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link TextChunker} that moves a fixed-size window over the text and steps back by the overlap
 * after each chunk.
 *
 * <p>Cuts are nudged toward natural boundaries: first forward to the next sentence end or newline
 * run within the lookahead, otherwise back to the nearest whitespace within the lookback so words
 * stay whole. A nudged chunk that falls under the minimum size is widened back to the raw window
 * unless it is the last one.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SlidingWindowChunker implements TextChunker {

  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]\\s+|\\n+");

  private final TokenCounter tokenCounter;

  @Override
  public List<TextChunk> chunk(String input, ChunkingOptions options) {
    String text = input == null ? "" : input.strip();
    if (text.isEmpty()) {
      return List.of();
    }

    TextMeasure measure =
        options.unit() == SizeUnit.TOKENS
            ? TextMeasure.tokens(text, tokenCounter)
            : TextMeasure.characters(text);
    int length = text.length();
    int target = options.targetSize();
    int overlap = options.resolvedOverlap();
    int minChunkSize = options.resolvedMinChunkSize();

    List<TextChunk> chunks = new ArrayList<>();
    int start = 0;
    while (start < length) {
      int rawEnd = measure.advance(start, target);
      int end = rawEnd;
      if (rawEnd < length) {
        end = adjustCut(text, start, rawEnd, options);
        if (end < length && measure.size(start, end) < minChunkSize) {
          end = rawEnd;
        }
      }

      String window = text.substring(start, end);
      if (!window.isBlank()) {
        chunks.add(new TextChunk(chunks.size(), start, end, window));
      }
      if (end >= length) {
        break;
      }

      int next = overlap > 0 ? measure.retreat(end, overlap) : end;
      if (next <= start) {
        next = end;
      }
      if (next <= start) {
        throw new IllegalStateException(
            "Chunker failed to advance past offset " + start + " of " + length);
      }
      start = next;
    }

    log.debug(
        "Chunked {} chars into {} chunks (target={} {}, overlap={})",
        length,
        chunks.size(),
        target,
        options.unit(),
        overlap);
    return chunks;
  }

  private int adjustCut(String text, int start, int cut, ChunkingOptions options) {
    if (endsAtSentenceBoundary(text, cut)) {
      return cut;
    }

    int lookaheadEnd = Math.min(cut + options.lookaheadChars(), text.length());
    Matcher matcher = SENTENCE_END.matcher(text).region(cut, lookaheadEnd);
    if (matcher.find()) {
      return matcher.end();
    }

    boolean midWord =
        !Character.isWhitespace(text.charAt(cut)) && !Character.isWhitespace(text.charAt(cut - 1));
    if (midWord) {
      int floor = Math.max(start, cut - options.lookbackChars());
      for (int i = cut - 1; i > floor; i--) {
        if (Character.isWhitespace(text.charAt(i))) {
          return i;
        }
      }
    }
    return cut;
  }

  private static boolean endsAtSentenceBoundary(String text, int cut) {
    char previous = text.charAt(cut - 1);
    if (previous == '\n') {
      return true;
    }
    return Character.isWhitespace(previous)
        && cut >= 2
        && isTerminator(text.charAt(cut - 2))
        && !Character.isWhitespace(text.charAt(cut));
  }

  private static boolean isTerminator(char c) {
    return c == '.' || c == '!' || c == '?';
  }
}
