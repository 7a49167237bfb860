package com.flamingo.ai.graphingest.service.resilience;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Caps the number of in-flight graph loader calls with a semaphore bulkhead. A permit is taken
 * before the call and released when it returns or throws.
 */
public class ConcurrencyLimiter {

  private final Bulkhead bulkhead;

  public ConcurrencyLimiter(String name, int maxConcurrentCalls, Duration maxWait) {
    BulkheadConfig config =
        BulkheadConfig.custom()
            .maxConcurrentCalls(maxConcurrentCalls)
            .maxWaitDuration(maxWait)
            .build();
    this.bulkhead = Bulkhead.of(name, config);
  }

  public <T> Callable<T> limit(Callable<T> call) {
    return Bulkhead.decorateCallable(bulkhead, call);
  }

  public int getMaxConcurrentCalls() {
    return bulkhead.getBulkheadConfig().getMaxConcurrentCalls();
  }

  public int getAvailablePermits() {
    return bulkhead.getMetrics().getAvailableConcurrentCalls();
  }
}
