package com.flamingo.ai.graphingest.service.resilience;

import com.flamingo.ai.graphingest.config.IngestionConfig;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Builds a fresh {@link IngestionContext} per pipeline run from the current configuration. */
@Component
@Slf4j
@RequiredArgsConstructor
public class IngestionContextFactory {

  private final IngestionConfig config;
  private final RetryableErrorClassifier classifier;
  private final Sleeper sleeper;

  public IngestionContext newContext() {
    String runId = "run-" + UUID.randomUUID().toString().substring(0, 8);
    IngestionConfig.Limiter limiterConfig = config.getLimiter();
    IngestionConfig.CircuitBreaker breakerConfig = config.getCircuitBreaker();

    ConcurrencyLimiter limiter =
        new ConcurrencyLimiter(
            runId + "-limiter", limiterConfig.getMaxConcurrentCalls(), limiterConfig.getMaxWait());
    ConsecutiveFailureBreaker breaker =
        new ConsecutiveFailureBreaker(
            runId + "-breaker",
            breakerConfig.getMaxConsecutiveFailures(),
            breakerConfig.getCooldown(),
            sleeper);
    RetryPolicy retryPolicy = new RetryPolicy(config.getRetry(), classifier);

    log.debug(
        "Created ingestion context {} (maxConcurrentCalls={}, breakerThreshold={})",
        runId,
        limiterConfig.getMaxConcurrentCalls(),
        breakerConfig.getMaxConsecutiveFailures());
    return new IngestionContext(runId, limiter, breaker, retryPolicy);
  }
}
