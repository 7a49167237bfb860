package com.flamingo.ai.graphingest.domain.model;

/**
 * Per-document outcome of a load cycle. Always produced, even when every segment failed.
 *
 * @param documentId the document
 * @param succeeded segments delivered
 * @param failed segments that exhausted retries or failed fatally
 * @param total segments handed to the loader
 * @param mode path that delivered the segments
 * @param interrupted {@code true} if the run was cancelled before all segments were attempted
 */
public record IngestionReport(
    String documentId,
    int succeeded,
    int failed,
    int total,
    LoadMode mode,
    boolean interrupted) {

  public static IngestionReport empty(String documentId, LoadMode mode) {
    return new IngestionReport(documentId, 0, 0, 0, mode, false);
  }
}
