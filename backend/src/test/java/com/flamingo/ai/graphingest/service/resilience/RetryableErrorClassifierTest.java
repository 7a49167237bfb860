package com.flamingo.ai.graphingest.service.resilience;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.graphingest.config.IngestionConfig;
import com.flamingo.ai.graphingest.exception.GraphLoaderException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;

@DisplayName("RetryableErrorClassifier Tests")
class RetryableErrorClassifierTest {

  private final RetryableErrorClassifier classifier =
      new RetryableErrorClassifier(new IngestionConfig.Retry().getRetryableMarkers());

  @Test
  @DisplayName("should treat HTTP 429 from the graph loader as retryable")
  void shouldRetryGraphLoaderRateLimit() {
    assertThat(classifier.isRetryable(new GraphLoaderException(429, null, "slow down"))).isTrue();
  }

  @Test
  @DisplayName("should treat rate-limit error codes as retryable regardless of status")
  void shouldRetryRateLimitErrorCode() {
    assertThat(
            classifier.isRetryable(
                new GraphLoaderException(503, "RESOURCE_EXHAUSTED", "provider busy")))
        .isTrue();
    assertThat(
            classifier.isRetryable(
                new GraphLoaderException(400, "RATE_LIMIT_EXCEEDED", "provider busy")))
        .isTrue();
  }

  @Test
  @DisplayName("should treat a WebClient 429 response as retryable")
  void shouldRetryWebClientTooManyRequests() {
    WebClientResponseException tooMany =
        WebClientResponseException.create(
            HttpStatus.TOO_MANY_REQUESTS,
            "",
            HttpHeaders.EMPTY,
            new byte[0],
            StandardCharsets.UTF_8,
            null);

    assertThat(classifier.isRetryable(tooMany)).isTrue();
  }

  @Test
  @DisplayName("should match configured markers case-insensitively anywhere in the cause chain")
  void shouldMatchMarkersInCauseChain() {
    Exception wrapped =
        new RuntimeException("episode load failed", new IOException("Rate Limit reached for gpt"));

    assertThat(classifier.isRetryable(wrapped)).isTrue();
    assertThat(classifier.isRetryable(new RuntimeException("Insufficient_Quota"))).isTrue();
    assertThat(classifier.isRetryable(new RuntimeException("HTTP 429"))).isTrue();
  }

  @Test
  @DisplayName("should treat everything else as fatal")
  void shouldTreatOtherErrorsAsFatal() {
    assertThat(classifier.isRetryable(new IllegalArgumentException("invalid schema"))).isFalse();
    assertThat(classifier.isRetryable(new GraphLoaderException(400, "INVALID_ARGUMENT", "bad")))
        .isFalse();
    assertThat(classifier.isRetryable(new NullPointerException())).isFalse();
  }

  @Test
  @DisplayName("should use only the configured markers")
  void shouldHonorConfiguredMarkers() {
    RetryableErrorClassifier custom = new RetryableErrorClassifier(List.of("overloaded", " "));

    assertThat(custom.isRetryable(new RuntimeException("Model is OVERLOADED"))).isTrue();
    assertThat(custom.isRetryable(new RuntimeException("quota exceeded"))).isFalse();
  }
}
