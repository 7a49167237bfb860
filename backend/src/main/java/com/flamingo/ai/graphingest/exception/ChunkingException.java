package com.flamingo.ai.graphingest.exception;

/** Exception thrown when chunking options are invalid. */
public class ChunkingException extends RuntimeException {

  public ChunkingException(String message) {
    super(message);
  }
}
