package io.burrow;

/**
 * Unchecked wrapper for a checked exception thrown by a message handler, so it can
 * propagate out of the consume loop.
 */
public class MessageHandlingException extends RuntimeException {

  public MessageHandlingException(String message, Throwable cause) {
    super(message, cause);
  }
}
