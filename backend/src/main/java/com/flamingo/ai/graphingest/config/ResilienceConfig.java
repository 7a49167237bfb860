package com.flamingo.ai.graphingest.config;

import com.flamingo.ai.graphingest.service.resilience.RetryableErrorClassifier;
import com.flamingo.ai.graphingest.service.resilience.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Beans shared by every per-run retry policy and breaker. */
@Configuration
public class ResilienceConfig {

  @Bean
  public RetryableErrorClassifier retryableErrorClassifier(IngestionConfig config) {
    return new RetryableErrorClassifier(config.getRetry().getRetryableMarkers());
  }

  @Bean
  public Sleeper breakerSleeper() {
    return Sleeper.THREAD;
  }
}
