package com.flamingo.ai.graphingest;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.graphingest.config.IngestionConfig;
import com.flamingo.ai.graphingest.config.IngestionStartupRunner;
import com.flamingo.ai.graphingest.service.chunking.ChunkingOptions;
import com.flamingo.ai.graphingest.service.chunking.TokenCounter;
import com.flamingo.ai.graphingest.service.chunking.WhitespaceTokenCounter;
import com.flamingo.ai.graphingest.service.ingest.IngestionPipeline;
import com.flamingo.ai.graphingest.service.ledger.FailureRecorder;
import com.flamingo.ai.graphingest.service.loader.EpisodeLoader;
import com.flamingo.ai.graphingest.service.loader.GraphLoader;
import com.flamingo.ai.graphingest.service.resilience.IngestionContextFactory;
import com.flamingo.ai.graphingest.service.resilience.RetryableErrorClassifier;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads with the default configuration. The graph loader
 * is mocked so no Graphiti service needs to be running.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private GraphLoader graphLoader;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All ingestion beans should be available")
  void ingestionBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(IngestionPipeline.class)).isNotNull();
    assertThat(applicationContext.getBean(EpisodeLoader.class)).isNotNull();
    assertThat(applicationContext.getBean(FailureRecorder.class)).isNotNull();
    assertThat(applicationContext.getBean(IngestionContextFactory.class)).isNotNull();
    assertThat(applicationContext.getBean(RetryableErrorClassifier.class)).isNotNull();
    assertThat(applicationContext.getBean(TokenCounter.class))
        .isInstanceOf(WhitespaceTokenCounter.class);
  }

  @Test
  @DisplayName("Startup ingestion should stay off unless enabled")
  void startupRunnerShouldBeDisabledByDefault() {
    assertThat(applicationContext.getBeansOfType(IngestionStartupRunner.class)).isEmpty();
  }

  @Test
  @DisplayName("Configuration defaults should be bound")
  void configurationDefaultsShouldBeBound() {
    IngestionConfig config = applicationContext.getBean(IngestionConfig.class);

    assertThat(config.getRetry().getMaxAttempts()).isEqualTo(6);
    assertThat(config.getLimiter().getMaxConcurrentCalls()).isEqualTo(1);
    assertThat(config.getCircuitBreaker().getMaxConsecutiveFailures()).isEqualTo(3);
    assertThat(config.getCircuitBreaker().getCooldown()).isEqualTo(Duration.ofSeconds(60));
    ChunkingOptions options = applicationContext.getBean(ChunkingOptions.class);
    assertThat(options.targetSize()).isEqualTo(3000);
    assertThat(options.resolvedOverlap()).isEqualTo(300);
  }
}
