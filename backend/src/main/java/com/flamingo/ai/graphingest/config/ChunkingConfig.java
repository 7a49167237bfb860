package com.flamingo.ai.graphingest.config;

import com.flamingo.ai.graphingest.service.chunking.ChunkingOptions;
import com.flamingo.ai.graphingest.service.chunking.LangChain4jTokenCounter;
import com.flamingo.ai.graphingest.service.chunking.TokenCounter;
import com.flamingo.ai.graphingest.service.chunking.WhitespaceTokenCounter;
import dev.langchain4j.model.openai.OpenAiTokenCountEstimator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the chunker's token counting and default options. */
@Configuration
@Slf4j
public class ChunkingConfig {

  @Bean
  public TokenCounter tokenCounter(IngestionConfig config) {
    String model = config.getChunking().getTokenizerModel();
    if (model == null || model.isBlank()) {
      return new WhitespaceTokenCounter();
    }
    log.info("Counting chunk tokens with the {} tokenizer", model);
    return new LangChain4jTokenCounter(new OpenAiTokenCountEstimator(model));
  }

  @Bean
  public ChunkingOptions chunkingOptions(IngestionConfig config) {
    return ChunkingOptions.from(config.getChunking());
  }
}
