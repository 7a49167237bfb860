package com.flamingo.ai.graphingest.service.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.graphingest.domain.model.Document;
import com.flamingo.ai.graphingest.domain.model.MappedDocument;
import com.flamingo.ai.graphingest.domain.model.Segment;
import com.flamingo.ai.graphingest.exception.DocumentMappingException;
import com.flamingo.ai.graphingest.service.chunking.ChunkingOptions;
import com.flamingo.ai.graphingest.service.chunking.TextChunk;
import com.flamingo.ai.graphingest.service.chunking.TextChunker;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps a normalized document record into a {@link Document} and its segments.
 *
 * <p>Expected shape:
 *
 * <pre>
 * {
 *   "metadata": {"title", "filename", "page_count", "normalized_at", "id"?},
 *   "normalized_text" | "full_text": "...",
 *   "segments": [{"text", "page", "type", "format", "id"?}]?,
 *   "chunks": ["..."]?
 * }
 * </pre>
 *
 * <p>Segments are taken from the first available source: structured segments (keeping page and
 * block type, skipping blank ones), then pre-computed chunks, then the chunker over the full text.
 * Indices are renumbered so they stay contiguous after blanks are dropped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NormalizedDocumentMapper {

  private final ObjectMapper objectMapper;
  private final TextChunker chunker;
  private final ChunkingOptions chunkingOptions;

  public MappedDocument read(Path file) {
    String source = file.getFileName().toString();
    JsonNode root;
    try {
      root = objectMapper.readTree(file.toFile());
    } catch (IOException e) {
      throw new DocumentMappingException(
          source, "Failed to read " + source + ": " + e.getMessage(), e);
    }
    return map(root, source);
  }

  public MappedDocument map(JsonNode root, String source) {
    if (root == null || !root.isObject()) {
      throw new DocumentMappingException(
          source, "Expected a JSON object in " + source + ", got " + describe(root));
    }

    JsonNode meta = root.path("metadata");
    String title = text(meta, "title");
    String filename = text(meta, "filename");
    String fullText = firstNonBlank(text(root, "normalized_text"), text(root, "full_text"), "");
    JsonNode segmentNodes = root.path("segments");
    JsonNode chunkNodes = root.path("chunks");

    Map<String, Object> metadata = new LinkedHashMap<>();
    putIfPresent(metadata, "normalized_at", text(meta, "normalized_at"));
    putIfPresent(metadata, "original_filename", filename);
    metadata.put("has_segments", segmentNodes.isArray() && !segmentNodes.isEmpty());
    metadata.put("has_chunks", chunkNodes.isArray() && !chunkNodes.isEmpty());

    String documentId = firstNonBlank(text(meta, "id"), text(root, "id"), null);
    if (documentId == null) {
      String identity = firstNonBlank(filename, title, source) + ":" + fullText;
      documentId = UUID.nameUUIDFromBytes(identity.getBytes(StandardCharsets.UTF_8)).toString();
    }

    Document document =
        new Document(
            documentId,
            title,
            fullText,
            firstNonBlank(filename, source, null),
            meta.path("page_count").isInt() ? meta.path("page_count").asInt() : null,
            metadata);

    List<Segment> segments;
    if (segmentNodes.isArray() && !segmentNodes.isEmpty()) {
      segments = fromStructuredSegments(document, segmentNodes);
      log.debug("Mapped {} structured segments for {}", segments.size(), source);
    } else if (chunkNodes.isArray() && !chunkNodes.isEmpty()) {
      segments = fromChunks(document, chunkNodes);
      log.debug("Mapped {} existing chunks for {}", segments.size(), source);
    } else {
      segments = fromChunker(document);
      log.debug("Chunked {} into {} segments", source, segments.size());
    }
    return new MappedDocument(document, segments);
  }

  private List<Segment> fromStructuredSegments(Document document, JsonNode nodes) {
    List<Segment> segments = new ArrayList<>();
    for (JsonNode node : nodes) {
      String segmentText = text(node, "text");
      if (segmentText == null || segmentText.isBlank()) {
        continue;
      }
      int index = segments.size();
      Map<String, Object> metadata = baseMetadata(document, index);
      putIfPresent(metadata, "format", text(node, "format"));
      putIfPresent(metadata, "markdown_preview", text(node, "markdown_preview"));
      segments.add(
          new Segment(
              text(node, "id"),
              document.id(),
              index,
              segmentText.strip(),
              node.path("page").isInt() ? node.path("page").asInt() : null,
              text(node, "type"),
              metadata));
    }
    return segments;
  }

  private List<Segment> fromChunks(Document document, JsonNode nodes) {
    List<Segment> segments = new ArrayList<>();
    for (JsonNode node : nodes) {
      String chunkText = node.isTextual() ? node.asText().strip() : "";
      if (chunkText.isEmpty()) {
        continue;
      }
      int index = segments.size();
      segments.add(
          new Segment(
              null,
              document.id(),
              index,
              chunkText,
              null,
              "paragraph",
              baseMetadata(document, index)));
    }
    return segments;
  }

  private List<Segment> fromChunker(Document document) {
    List<Segment> segments = new ArrayList<>();
    for (TextChunk chunk : chunker.chunk(document.text(), chunkingOptions)) {
      Map<String, Object> metadata = baseMetadata(document, chunk.index());
      metadata.put("start_offset", chunk.startOffset());
      metadata.put("end_offset", chunk.endOffset());
      segments.add(
          new Segment(
              null, document.id(), chunk.index(), chunk.text(), null, "paragraph", metadata));
    }
    return segments;
  }

  private static Map<String, Object> baseMetadata(Document document, int index) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    putIfPresent(metadata, "source_file", document.sourceFile());
    metadata.put("chunk_index", index);
    return metadata;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    return value.isValueNode() && !value.isNull() ? value.asText() : null;
  }

  private static String firstNonBlank(String first, String second, String fallback) {
    if (first != null && !first.isBlank()) {
      return first;
    }
    if (second != null && !second.isBlank()) {
      return second;
    }
    return fallback;
  }

  private static void putIfPresent(Map<String, Object> map, String key, Object value) {
    if (value != null) {
      map.put(key, value);
    }
  }

  private static String describe(JsonNode node) {
    return node == null ? "nothing" : node.getNodeType().toString().toLowerCase(Locale.ROOT);
  }
}
