package com.flamingo.ai.graphingest.service.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/**
 * One recorded failure of a segment.
 *
 * @param reason failure reason, e.g. {@code segment_3_failed: <cause>}
 * @param failedSegment snapshot of the segment that failed, null when unknown
 * @param timestamp ISO-8601 instant at which the failure was recorded
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FailureEntry(String reason, Map<String, Object> failedSegment, String timestamp) {}
