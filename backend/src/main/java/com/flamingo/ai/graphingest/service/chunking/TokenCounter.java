package com.flamingo.ai.graphingest.service.chunking;

/** Counts tokens in a piece of text for token-based chunk sizing. */
@FunctionalInterface
public interface TokenCounter {

  /**
   * Counts the tokens in {@code text}.
   *
   * @param text the text to measure, never null
   * @return the token count, zero for empty text
   */
  int count(String text);
}
