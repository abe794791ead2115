package io.burrow;

import java.util.Objects;

/**
 * A message waiting to be published: routing key, payload, properties and an optional
 * validation schema name.
 *
 * @param routingKey routing key; must be non-empty to be published
 * @param data       payload, serialized by the publisher
 * @param properties caller properties layered over the publisher defaults
 * @param schema     schema to validate {@code data} against before publishing, or {@code null}
 */
public record OutgoingMessage(String routingKey, Object data, MessageProperties properties, String schema) {

  public OutgoingMessage {
    properties = Objects.requireNonNullElse(properties, MessageProperties.EMPTY);
  }

  public static OutgoingMessage of(String routingKey, Object data) {
    return new OutgoingMessage(routingKey, data, MessageProperties.EMPTY, null);
  }

  public static OutgoingMessage of(String routingKey, Object data, MessageProperties properties) {
    return new OutgoingMessage(routingKey, data, properties, null);
  }

  public boolean hasRoutingKey() {
    return routingKey != null && !routingKey.isEmpty();
  }
}
