package io.burrow.spi;

import java.io.IOException;

/**
 * The transport could not reach the broker or lost it mid-operation.
 *
 * <p>Retryable: the retry policy's default retryable kinds include it.
 */
public class ConnectionFailureException extends IOException {

  public ConnectionFailureException(String message) {
    super(message);
  }

  public ConnectionFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
