package com.flamingo.ai.graphingest.service.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Persistent failure history of one document, stored as {@code <documentId>.failed.json}. */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FailureLedger {

  private String documentId;

  @Builder.Default private Map<String, List<FailureEntry>> failedSegments = new LinkedHashMap<>();

  private String updatedAt;

  /** Appends {@code entry} under {@code segmentKey}, keeping earlier entries. */
  public void append(String segmentKey, FailureEntry entry) {
    if (failedSegments == null) {
      failedSegments = new LinkedHashMap<>();
    }
    failedSegments.computeIfAbsent(segmentKey, k -> new ArrayList<>()).add(entry);
  }

  public List<FailureEntry> entriesFor(String segmentKey) {
    if (failedSegments == null) {
      return List.of();
    }
    return failedSegments.getOrDefault(segmentKey, List.of());
  }
}
