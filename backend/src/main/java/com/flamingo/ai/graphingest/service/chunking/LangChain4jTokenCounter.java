package com.flamingo.ai.graphingest.service.chunking;

import dev.langchain4j.model.TokenCountEstimator;
import lombok.RequiredArgsConstructor;

/** {@link TokenCounter} backed by a LangChain4j model tokenizer. */
@RequiredArgsConstructor
public class LangChain4jTokenCounter implements TokenCounter {

  private final TokenCountEstimator estimator;

  @Override
  public int count(String text) {
    if (text.isEmpty()) {
      return 0;
    }
    return estimator.estimateTokenCountInText(text);
  }
}
