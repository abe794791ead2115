package io.burrow.spi;

/**
 * The broker connection is closed. Raised by a transport when the connection shuts down
 * under an active consumer, and by the consumer once reconnection attempts are exhausted.
 */
public class ConnectionClosedException extends ConnectionFailureException {

  public ConnectionClosedException(String message) {
    super(message);
  }

  public ConnectionClosedException(String message, Throwable cause) {
    super(message, cause);
  }
}
