package com.flamingo.ai.graphingest.service.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Trips after a run of consecutive failures and pauses the caller for a cooldown.
 *
 * <p>Backed by a count-based {@link CircuitBreaker} whose window equals the threshold and which
 * opens only at a 100% failure rate, so it opens exactly when the last {@code threshold} recorded
 * outcomes were all failures. A single success keeps it closed for the next {@code threshold}
 * calls, which is the same as resetting a consecutive-failure counter, and closes it if it is
 * open.
 */
@Slf4j
public class ConsecutiveFailureBreaker {

  private final CircuitBreaker circuitBreaker;
  private final int threshold;
  private final Duration cooldown;
  private final Sleeper sleeper;

  public ConsecutiveFailureBreaker(
      String name, int threshold, Duration cooldown, Sleeper sleeper) {
    CircuitBreakerConfig config =
        CircuitBreakerConfig.custom()
            .slidingWindowType(SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(threshold)
            .minimumNumberOfCalls(threshold)
            .failureRateThreshold(100.0f)
            .waitDurationInOpenState(cooldown.isZero() ? Duration.ofMillis(1) : cooldown)
            .build();
    this.circuitBreaker = CircuitBreaker.of(name, config);
    this.threshold = threshold;
    this.cooldown = cooldown;
    this.sleeper = sleeper;
  }

  /**
   * Ends the current failure run. A breaker that tripped without being paused is closed here, as
   * an open {@link CircuitBreaker} ignores successes.
   */
  public synchronized void recordSuccess() {
    if (isTripped()) {
      circuitBreaker.reset();
      return;
    }
    circuitBreaker.onSuccess(0, TimeUnit.NANOSECONDS);
  }

  public synchronized void recordFailure(Throwable cause) {
    circuitBreaker.onError(0, TimeUnit.NANOSECONDS, cause);
  }

  public boolean isTripped() {
    return circuitBreaker.getState() == CircuitBreaker.State.OPEN;
  }

  /**
   * Sleeps for the cooldown and closes the breaker again if it is tripped.
   *
   * @return true when a pause happened
   * @throws InterruptedException if interrupted during the cooldown; the breaker stays open
   */
  public synchronized boolean pauseIfTripped() throws InterruptedException {
    if (!isTripped()) {
      return false;
    }
    log.warn(
        "Circuit breaker '{}' tripped after {} consecutive failures, pausing {} s",
        circuitBreaker.getName(),
        threshold,
        cooldown.toSeconds());
    sleeper.sleep(cooldown);
    circuitBreaker.reset();
    log.info("Circuit breaker '{}' reset, resuming", circuitBreaker.getName());
    return true;
  }

  public int getThreshold() {
    return threshold;
  }
}
