package com.flamingo.ai.graphingest.service.resilience;

import java.util.concurrent.Callable;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Shared resilience state for one pipeline run. Every document ingested in the run goes through
 * the same limiter and breaker.
 */
@Getter
@RequiredArgsConstructor
public class IngestionContext {

  private final String runId;
  private final ConcurrencyLimiter limiter;
  private final ConsecutiveFailureBreaker breaker;
  private final RetryPolicy retryPolicy;

  /**
   * Runs {@code call} under the limiter with retries wrapped around it, so backoff waits happen
   * without holding a permit.
   */
  public <T> T execute(String name, Callable<T> call) throws Exception {
    return retryPolicy.withRetry(name, limiter.limit(call)).call();
  }
}
