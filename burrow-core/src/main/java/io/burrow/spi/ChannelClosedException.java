package io.burrow.spi;

/**
 * The channel was closed while its connection may still be alive, typically after a
 * channel-level protocol error.
 */
public class ChannelClosedException extends ConnectionFailureException {

  public ChannelClosedException(String message) {
    super(message);
  }

  public ChannelClosedException(String message, Throwable cause) {
    super(message, cause);
  }
}
