package io.burrow.serialization;

/**
 * A payload could not be encoded or decoded.
 */
public class SerializationException extends RuntimeException {

  public SerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
