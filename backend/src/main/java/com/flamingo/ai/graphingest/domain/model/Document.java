package com.flamingo.ai.graphingest.domain.model;

import java.util.Map;

/**
 * A normalized input document. Immutable once mapped; owned by the ingestion run that created it.
 *
 * @param id stable identity, used as the key for episode names and the failure ledger
 * @param title document title, may be {@code null}
 * @param text full normalized text
 * @param sourceFile original file name the text was extracted from
 * @param pageCount number of pages in the source, may be {@code null}
 * @param metadata free-form provenance metadata (normalization time, original file name, ...)
 */
public record Document(
    String id,
    String title,
    String text,
    String sourceFile,
    Integer pageCount,
    Map<String, Object> metadata) {

  public Document {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Document id must not be blank");
    }
    text = text == null ? "" : text;
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
