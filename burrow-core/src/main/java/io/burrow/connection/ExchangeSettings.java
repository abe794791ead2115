package io.burrow.connection;

import io.burrow.spi.ExchangeType;

import java.util.Objects;

/**
 * Declaration of the exchange messages are published to.
 *
 * @param name       exchange name
 * @param type       exchange type
 * @param passive    only check that the exchange exists
 * @param durable    survive broker restarts
 * @param autoDelete delete once the last binding is removed
 * @param internal   reject direct publishes from clients
 */
public record ExchangeSettings(String name, ExchangeType type, boolean passive, boolean durable,
                               boolean autoDelete, boolean internal) {

  public static final String DEFAULT_NAME = "booking_events";

  public ExchangeSettings {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  /**
   * Durable, non-passive topic exchange named {@value #DEFAULT_NAME}.
   */
  public static ExchangeSettings defaults() {
    return topic(DEFAULT_NAME);
  }

  /**
   * Durable, non-passive topic exchange.
   */
  public static ExchangeSettings topic(String name) {
    return new ExchangeSettings(name, ExchangeType.TOPIC, false, true, false, false);
  }

  public ExchangeSettings withName(String newName) {
    return new ExchangeSettings(newName, type, passive, durable, autoDelete, internal);
  }
}
