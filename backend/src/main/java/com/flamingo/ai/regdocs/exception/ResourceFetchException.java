package com.flamingo.ai.regdocs.exception;

/** Exception thrown when a remote page or document cannot be fetched. */
public class ResourceFetchException extends RuntimeException {

  private final String url;
  private final int statusCode;

  public ResourceFetchException(String url, int statusCode) {
    super("Fetch of " + url + " returned HTTP " + statusCode);
    this.url = url;
    this.statusCode = statusCode;
  }

  public ResourceFetchException(String url, Throwable cause) {
    super("Fetch of " + url + " failed: " + cause.getMessage(), cause);
    this.url = url;
    this.statusCode = -1;
  }

  public String getUrl() {
    return url;
  }

  /** HTTP status of the failed response, or -1 when no response was received. */
  public int getStatusCode() {
    return statusCode;
  }
}
