package com.flamingo.ai.graphingest.exception;

/** Exception thrown when the graph loader rejects or fails an episode load. */
public class GraphLoaderException extends RuntimeException {

  /** Sentinel for failures that did not come with an HTTP status. */
  public static final int NO_STATUS = -1;

  private final int statusCode;
  private final String errorCode;

  public GraphLoaderException(String message) {
    this(NO_STATUS, null, message, null);
  }

  public GraphLoaderException(String message, Throwable cause) {
    this(NO_STATUS, null, message, cause);
  }

  public GraphLoaderException(int statusCode, String errorCode, String message) {
    this(statusCode, errorCode, message, null);
  }

  public GraphLoaderException(int statusCode, String errorCode, String message, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.errorCode = errorCode;
  }

  public int getStatusCode() {
    return statusCode;
  }

  /** Provider error code from the response body (e.g. {@code RESOURCE_EXHAUSTED}), if any. */
  public String getErrorCode() {
    return errorCode;
  }

  public boolean isRateLimited() {
    return statusCode == 429;
  }
}
