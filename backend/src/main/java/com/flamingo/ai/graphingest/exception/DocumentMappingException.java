package com.flamingo.ai.graphingest.exception;

/** Exception thrown when a normalized document record cannot be mapped for ingestion. */
public class DocumentMappingException extends RuntimeException {

  private final String source;

  public DocumentMappingException(String source, String message) {
    super(message);
    this.source = source;
  }

  public DocumentMappingException(String source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
  }

  /** File name or document id the failing record came from. */
  public String getSource() {
    return source;
  }
}
