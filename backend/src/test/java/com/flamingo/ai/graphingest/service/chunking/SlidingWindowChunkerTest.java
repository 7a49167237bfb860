package com.flamingo.ai.graphingest.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.graphingest.exception.ChunkingException;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SlidingWindowChunker Tests")
class SlidingWindowChunkerTest {

  private SlidingWindowChunker chunker;

  @BeforeEach
  void setUp() {
    chunker = new SlidingWindowChunker(new WhitespaceTokenCounter());
  }

  @Test
  @DisplayName("should return no chunks for null, empty or whitespace-only input")
  void shouldReturnEmpty_whenInputIsBlank() {
    ChunkingOptions options = ChunkingOptions.characters(100, 10);

    assertThat(chunker.chunk(null, options)).isEmpty();
    assertThat(chunker.chunk("", options)).isEmpty();
    assertThat(chunker.chunk(" \n\t  \n", options)).isEmpty();
  }

  @Test
  @DisplayName("should return one chunk when text fits in the window")
  void shouldReturnSingleChunk_whenTextFits() {
    List<TextChunk> chunks =
        chunker.chunk("  A short paragraph.  ", ChunkingOptions.characters(100, 10));

    assertThat(chunks).hasSize(1);
    assertThat(chunks.get(0).text()).isEqualTo("A short paragraph.");
    assertThat(chunks.get(0).startOffset()).isZero();
    assertThat(chunks.get(0).endOffset()).isEqualTo("A short paragraph.".length());
  }

  @Test
  @DisplayName("should cover the text without gaps and allow exact reconstruction")
  void shouldCoverTextWithoutGaps() {
    String text = sentences(60);
    int overlap = 40;

    List<TextChunk> chunks = chunker.chunk(text, ChunkingOptions.characters(200, overlap));

    assertThat(chunks).hasSizeGreaterThan(5);
    assertThat(chunks.get(0).startOffset()).isZero();
    assertThat(chunks.get(chunks.size() - 1).endOffset()).isEqualTo(text.length());

    StringBuilder rebuilt = new StringBuilder(chunks.get(0).text());
    for (int i = 0; i < chunks.size(); i++) {
      TextChunk chunk = chunks.get(i);
      assertThat(chunk.index()).isEqualTo(i);
      assertThat(chunk.text()).isEqualTo(text.substring(chunk.startOffset(), chunk.endOffset()));
      if (i > 0) {
        TextChunk previous = chunks.get(i - 1);
        assertThat(chunk.startOffset()).isGreaterThan(previous.startOffset());
        assertThat(chunk.startOffset()).isLessThanOrEqualTo(previous.endOffset());
        assertThat(previous.endOffset() - chunk.startOffset()).isLessThanOrEqualTo(overlap);
        rebuilt.append(chunk.text().substring(previous.endOffset() - chunk.startOffset()));
      }
    }
    assertThat(rebuilt.toString()).isEqualTo(text);
  }

  @Test
  @DisplayName("should produce identical output for identical input")
  void shouldBeDeterministic() {
    String text = sentences(40);
    ChunkingOptions options = ChunkingOptions.characters(150, 0.2);

    assertThat(chunker.chunk(text, options)).isEqualTo(chunker.chunk(text, options));
  }

  @Test
  @DisplayName("should extend a cut forward to the next sentence end and back off mid-word cuts")
  void shouldPreferSentenceAndWordBoundaries() {
    String text = "alpha beta gamma delta. epsilon zeta";
    ChunkingOptions options = new ChunkingOptions(10, 0, SizeUnit.CHARACTERS, null, 200, 40);

    List<TextChunk> chunks = chunker.chunk(text, options);

    assertThat(chunks)
        .extracting(TextChunk::text)
        .containsExactly("alpha beta gamma delta. ", "epsilon", " zeta");
  }

  @Test
  @DisplayName("should widen a too-small non-final chunk back to the raw window")
  void shouldWidenTooSmallChunk() {
    String text = "ab cdefghijklmnop";
    ChunkingOptions options = new ChunkingOptions(10, 0, SizeUnit.CHARACTERS, 5, 0, 40);

    List<TextChunk> chunks = chunker.chunk(text, options);

    assertThat(chunks).extracting(TextChunk::text).containsExactly("ab cdefghi", "jklmnop");
  }

  @Test
  @DisplayName("should resolve a fractional overlap against the target size")
  void shouldResolveFractionalOverlap() {
    ChunkingOptions options = ChunkingOptions.characters(100, 0.1);
    assertThat(options.resolvedOverlap()).isEqualTo(10);

    List<TextChunk> chunks = chunker.chunk(sentences(30), options);

    for (int i = 1; i < chunks.size(); i++) {
      assertThat(chunks.get(i - 1).endOffset() - chunks.get(i).startOffset())
          .isBetween(0, 10);
    }
  }

  @Test
  @DisplayName("should still advance when the overlap is not smaller than the window")
  void shouldAdvance_whenOverlapExceedsTarget() {
    String text = "x".repeat(95);

    List<TextChunk> chunks = chunker.chunk(text, ChunkingOptions.characters(10, 15));

    assertThat(chunks).hasSize(10);
    assertThat(chunks.get(9).endOffset()).isEqualTo(95);
    for (int i = 1; i < chunks.size(); i++) {
      assertThat(chunks.get(i).startOffset()).isEqualTo(chunks.get(i - 1).endOffset());
    }
  }

  @Test
  @DisplayName("should size windows in tokens and overlap by whole tokens")
  void shouldChunkByTokens() {
    String text = IntStream.range(0, 50).mapToObj(i -> "w" + i).collect(Collectors.joining(" "));
    ChunkingOptions options = new ChunkingOptions(10, 2, SizeUnit.TOKENS, null, 200, 40);
    WhitespaceTokenCounter counter = new WhitespaceTokenCounter();

    List<TextChunk> chunks = chunker.chunk(text, options);

    assertThat(chunks).hasSizeGreaterThan(4);
    assertThat(chunks)
        .allSatisfy(c -> assertThat(counter.count(c.text())).isLessThanOrEqualTo(10));
    assertThat(chunks.get(0).text()).startsWith("w0 ").contains("w9");
    assertThat(chunks.get(1).text().strip()).startsWith("w8 ");
    assertThat(chunks.get(chunks.size() - 1).text()).endsWith("w49");
  }

  @Test
  @DisplayName("should tokenize only near each window when sizing long text in tokens")
  void shouldKeepTokenizingLocal_forLongText() {
    String text =
        IntStream.range(0, 40_000).mapToObj(i -> "word" + i).collect(Collectors.joining(" "));
    WhitespaceTokenCounter words = new WhitespaceTokenCounter();
    AtomicLong charsTokenized = new AtomicLong();
    TokenCounter counting =
        s -> {
          charsTokenized.addAndGet(s.length());
          return words.count(s);
        };
    ChunkingOptions options = new ChunkingOptions(200, 20, SizeUnit.TOKENS, null, 200, 40);

    List<TextChunk> chunks = new SlidingWindowChunker(counting).chunk(text, options);

    assertThat(chunks).hasSizeGreaterThan(200);
    assertThat(chunks.get(chunks.size() - 1).text()).endsWith("word39999");
    assertThat(charsTokenized.get()).isLessThan(40L * text.length());
  }

  @Test
  @DisplayName("should reject invalid options")
  void shouldRejectInvalidOptions() {
    assertThatThrownBy(() -> ChunkingOptions.characters(0, 0))
        .isInstanceOf(ChunkingException.class)
        .hasMessageContaining("targetSize");
    assertThatThrownBy(() -> ChunkingOptions.characters(100, -1))
        .isInstanceOf(ChunkingException.class);
    assertThatThrownBy(() -> new ChunkingOptions(100, 10, SizeUnit.CHARACTERS, 0, 200, 40))
        .isInstanceOf(ChunkingException.class);
  }

  @Test
  @DisplayName("should default the minimum chunk size to a quarter of the target")
  void shouldDefaultMinChunkSize() {
    assertThat(ChunkingOptions.characters(3000, 300).resolvedMinChunkSize()).isEqualTo(750);
    assertThat(ChunkingOptions.characters(3, 0).resolvedMinChunkSize()).isEqualTo(1);
  }

  private static String sentences(int count) {
    return IntStream.range(0, count)
        .mapToObj(i -> "Sentence number " + i + " talks about clause " + (i * 7) + " in detail.")
        .collect(Collectors.joining(" "));
  }
}
