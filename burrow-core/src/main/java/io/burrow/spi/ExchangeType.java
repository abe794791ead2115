package io.burrow.spi;

import java.util.Locale;

/**
 * AMQP exchange types.
 */
public enum ExchangeType {
  DIRECT("direct"),
  TOPIC("topic"),
  FANOUT("fanout"),
  HEADERS("headers");

  private final String wireName;

  ExchangeType(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Name used in the {@code exchange.declare} method frame.
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Parses a wire name such as {@code "topic"}, ignoring case.
   *
   * @throws IllegalArgumentException if the name is not an AMQP exchange type
   */
  public static ExchangeType of(String name) {
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (ExchangeType type : values()) {
      if (type.wireName.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown exchange type: " + name);
  }
}
