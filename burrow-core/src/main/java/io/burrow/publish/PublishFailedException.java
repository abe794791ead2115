package io.burrow.publish;

/**
 * A publish attempt did not reach the broker. Raised inside the resilience stack so that
 * a failed publish counts as a retryable failure.
 */
public class PublishFailedException extends RuntimeException {
  private final String routingKey;

  public PublishFailedException(String routingKey) {
    super("Failed to publish message to " + routingKey);
    this.routingKey = routingKey;
  }

  public String routingKey() {
    return routingKey;
  }
}
