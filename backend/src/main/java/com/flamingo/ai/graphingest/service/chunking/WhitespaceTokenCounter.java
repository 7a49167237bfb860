package com.flamingo.ai.graphingest.service.chunking;

/** Approximates tokens as whitespace-separated words. */
public class WhitespaceTokenCounter implements TokenCounter {

  @Override
  public int count(String text) {
    int words = 0;
    boolean inWord = false;
    for (int i = 0; i < text.length(); i++) {
      if (Character.isWhitespace(text.charAt(i))) {
        inWord = false;
      } else if (!inWord) {
        inWord = true;
        words++;
      }
    }
    return words;
  }
}
