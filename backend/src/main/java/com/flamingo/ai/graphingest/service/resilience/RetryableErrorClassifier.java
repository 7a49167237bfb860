package com.flamingo.ai.graphingest.service.resilience;

import com.flamingo.ai.graphingest.exception.GraphLoaderException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Decides whether a failure is a transient rate limit worth retrying.
 *
 * <p>Every throwable in the cause chain is inspected. Structured signals win: a {@link
 * GraphLoaderException} carrying HTTP 429 or a rate-limit error code, or a {@link
 * WebClientResponseException} with status 429. Otherwise the message is matched case-insensitively
 * against the configured markers. Anything else is fatal.
 */
public class RetryableErrorClassifier {

  private static final int TOO_MANY_REQUESTS = 429;
  private static final List<String> RATE_LIMIT_CODES =
      List.of("RATE_LIMIT", "RESOURCE_EXHAUSTED", "TOO_MANY_REQUESTS", "INSUFFICIENT_QUOTA");

  private final List<String> markers;

  public RetryableErrorClassifier(List<String> markers) {
    this.markers =
        markers.stream()
            .filter(m -> m != null && !m.isBlank())
            .map(m -> m.toLowerCase(Locale.ROOT))
            .toList();
  }

  public boolean isRetryable(Throwable error) {
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Throwable t = error; t != null && seen.add(t); t = t.getCause()) {
      if (isStructuredRateLimit(t) || matchesMarker(t.getMessage())) {
        return true;
      }
    }
    return false;
  }

  private boolean isStructuredRateLimit(Throwable t) {
    if (t instanceof GraphLoaderException gle) {
      return gle.isRateLimited() || isRateLimitCode(gle.getErrorCode());
    }
    if (t instanceof WebClientResponseException wcre) {
      return wcre.getStatusCode().value() == TOO_MANY_REQUESTS;
    }
    return false;
  }

  private static boolean isRateLimitCode(String errorCode) {
    if (errorCode == null) {
      return false;
    }
    String upper = errorCode.toUpperCase(Locale.ROOT);
    return RATE_LIMIT_CODES.stream().anyMatch(upper::contains);
  }

  private boolean matchesMarker(String text) {
    if (text == null || text.isEmpty()) {
      return false;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    for (String marker : markers) {
      if (lower.contains(marker)) {
        return true;
      }
    }
    return false;
  }
}
