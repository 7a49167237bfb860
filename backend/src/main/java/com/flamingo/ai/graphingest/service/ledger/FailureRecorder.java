package com.flamingo.ai.graphingest.service.ledger;

import com.flamingo.ai.graphingest.domain.model.Segment;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Durably records segment load failures so they can be inspected and redriven later. */
public interface FailureRecorder {

  /**
   * Records a failure asynchronously.
   *
   * <p>If {@code reason} contains {@code segment_<N>_failed}, the entry is keyed by segment N.
   * Otherwise a single supplied segment is used, and with none the entry gets a unique unkeyed
   * key.
   *
   * @param documentId id of the document the failure belongs to
   * @param segments segments involved in the failed operation, possibly empty
   * @param reason failure reason, including the cause
   * @return a future completed when the write finished; it never completes exceptionally
   */
  CompletableFuture<Void> record(String documentId, List<Segment> segments, String reason);
}
