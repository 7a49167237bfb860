package com.flamingo.ai.graphingest.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An ordered slice of a {@link Document}'s text. Segments refer to their document by id only.
 *
 * @param id optional own identifier; when absent the failure ledger keys the segment by index
 * @param documentId id of the owning document
 * @param index 0-based, contiguous sequence index defining delivery order
 * @param text segment payload
 * @param page source page, if known
 * @param blockType structural block type (paragraph, table, ...), if known
 * @param metadata additional per-segment metadata
 */
public record Segment(
    String id,
    String documentId,
    int index,
    String text,
    Integer page,
    String blockType,
    Map<String, Object> metadata) {

  public Segment {
    if (index < 0) {
      throw new IllegalArgumentException("Segment index must be >= 0, got " + index);
    }
    text = text == null ? "" : text;
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /** Creates a plain text segment with no structural metadata. */
  public static Segment of(String documentId, int index, String text) {
    return new Segment(null, documentId, index, text, null, null, Map.of());
  }

  /** Key used by the failure ledger: the segment's own id, else {@code segment_<index>}. */
  public String ledgerKey() {
    return id != null && !id.isBlank() ? id : "segment_" + index;
  }

  /** Plain map view used for failure snapshots and structured episode bodies. */
  public Map<String, Object> toSnapshot() {
    Map<String, Object> snapshot = new LinkedHashMap<>();
    if (id != null) {
      snapshot.put("id", id);
    }
    snapshot.put("documentId", documentId);
    snapshot.put("index", index);
    snapshot.put("text", text);
    if (page != null) {
      snapshot.put("page", page);
    }
    if (blockType != null) {
      snapshot.put("blockType", blockType);
    }
    if (!metadata.isEmpty()) {
      snapshot.put("metadata", metadata);
    }
    return snapshot;
  }
}
