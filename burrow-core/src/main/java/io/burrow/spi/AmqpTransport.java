package io.burrow.spi;

import io.burrow.connection.ConnectionSettings;

import java.io.IOException;

/**
 * Opens broker connections. The single entry point into a concrete AMQP client library.
 *
 * @see io.burrow.connection.ConnectionManager
 */
@FunctionalInterface
public interface AmqpTransport {

  /**
   * Opens a new connection.
   *
   * @param settings endpoint, credentials and tuning
   * @return an open connection
   * @throws ConnectionFailureException if the broker cannot be reached or refuses the login
   */
  BrokerConnection connect(ConnectionSettings settings) throws IOException;
}
