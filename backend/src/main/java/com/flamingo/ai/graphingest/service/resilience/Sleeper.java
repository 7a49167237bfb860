package com.flamingo.ai.graphingest.service.resilience;

import java.time.Duration;

/** Blocks the calling thread for a duration. Swapped out in tests to observe pauses. */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
