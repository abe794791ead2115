package io.burrow;

/**
 * Application callback for consumed messages.
 *
 * <p>Returning {@code false} leaves the delivery unacknowledged; any other outcome
 * acknowledges it (unless the consumer runs in auto-ack mode). Throwing rejects it.
 */
@FunctionalInterface
public interface MessageCallback {

  /**
   * @param data     the decoded message body
   * @param delivery the raw delivery
   * @return {@code false} to skip the acknowledgement
   */
  boolean onMessage(Object data, Delivery delivery) throws Exception;
}
