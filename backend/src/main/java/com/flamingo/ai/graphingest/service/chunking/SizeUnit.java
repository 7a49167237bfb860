package com.flamingo.ai.graphingest.service.chunking;

/** Unit in which chunk sizes and overlaps are measured. */
public enum SizeUnit {
  CHARACTERS,
  TOKENS
}
