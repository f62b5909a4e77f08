package dev.seocrawl.fetch;

/**
 * Raised when a URL cannot be fetched at all: malformed URL, connection failure, timeout, or a
 * transport error that persisted after the fallback user agent was tried.
 */
public class FetchException extends Exception {

  public FetchException(String message) {
    super(message);
  }

  public FetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
