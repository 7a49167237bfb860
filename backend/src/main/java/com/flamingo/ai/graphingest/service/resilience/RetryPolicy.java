package com.flamingo.ai.graphingest.service.resilience;

import com.flamingo.ai.graphingest.config.IngestionConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;
import java.util.function.DoubleSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Wraps fallible operations with classification-based exponential backoff.
 *
 * <p>Retry number {@code k} (1-indexed) waits {@code min(maxDelay, initialDelay * factor^(k-1))}
 * plus or minus {@code jitterFraction} of that base, clamped to {@code [0, maxDelay]}. {@code
 * maxAttempts} counts total invocations, so an operation is retried at most {@code maxAttempts - 1}
 * times. Each decoration builds its own {@link Retry}, so no attempt state is shared between calls.
 */
@Slf4j
public class RetryPolicy {

  private final int maxAttempts;
  private final Duration initialDelay;
  private final Duration maxDelay;
  private final double backoffFactor;
  private final double jitterFraction;
  private final RetryableErrorClassifier classifier;
  private final DoubleSupplier random;

  public RetryPolicy(IngestionConfig.Retry config, RetryableErrorClassifier classifier) {
    this(config, classifier, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * @param random source of uniform values in {@code [0, 1)} used for jitter
   */
  public RetryPolicy(
      IngestionConfig.Retry config, RetryableErrorClassifier classifier, DoubleSupplier random) {
    this.maxAttempts = config.getMaxAttempts();
    this.initialDelay = config.getInitialDelay();
    this.maxDelay = config.getMaxDelay();
    this.backoffFactor = config.getBackoffFactor();
    this.jitterFraction = config.getJitterFraction();
    this.classifier = classifier;
    this.random = random;
  }

  public <T> Callable<T> withRetry(String name, Callable<T> operation) {
    return withRetry(name, operation, wait -> {});
  }

  /**
   * Decorates {@code operation} with retries.
   *
   * @param name label used in log lines
   * @param operation the call to protect
   * @param onBackoff notified with each wait interval just before the policy sleeps
   * @return a callable that retries retryable failures and rethrows fatal ones immediately
   */
  public <T> Callable<T> withRetry(
      String name, Callable<T> operation, Consumer<Duration> onBackoff) {
    Retry retry = Retry.of(name, retryConfig());
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              log.warn(
                  "Retryable failure in {} (attempt {}/{}), backing off {} ms: {}",
                  name,
                  event.getNumberOfRetryAttempts(),
                  maxAttempts,
                  event.getWaitInterval().toMillis(),
                  String.valueOf(event.getLastThrowable()));
              onBackoff.accept(event.getWaitInterval());
            });
    retry
        .getEventPublisher()
        .onError(
            event ->
                log.warn(
                    "{} gave up after {} attempts: {}",
                    name,
                    event.getNumberOfRetryAttempts(),
                    String.valueOf(event.getLastThrowable())));
    return Retry.decorateCallable(retry, operation);
  }

  /**
   * Backoff before retry number {@code retry} (1-indexed), jitter included.
   *
   * @param retry the retry number, starting at 1
   * @return the wait, always within {@code [0, maxDelay]}
   */
  public Duration backoffFor(int retry) {
    double maxMillis = maxDelay.toMillis();
    double exponent = Math.max(0, retry - 1);
    double base = Math.min(maxMillis, initialDelay.toMillis() * Math.pow(backoffFactor, exponent));
    double jitter = (2 * random.getAsDouble() - 1) * jitterFraction * base;
    double wait = Math.max(0, Math.min(maxMillis, base + jitter));
    return Duration.ofMillis(Math.round(wait));
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  private RetryConfig retryConfig() {
    IntervalFunction interval = retry -> backoffFor(retry).toMillis();
    return RetryConfig.custom()
        .maxAttempts(maxAttempts)
        .intervalFunction(interval)
        .retryOnException(classifier::isRetryable)
        .build();
  }
}
