package io.burrow.connection;

import io.burrow.spi.AmqpTransport;
import io.burrow.spi.BrokerChannel;
import io.burrow.spi.BrokerConnection;
import io.burrow.spi.ExchangeType;

import java.io.IOException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the broker connection and the single channel used for publishing and consuming.
 *
 * <p>Both are created lazily on first use and re-created whenever they are found closed.
 * The configured exchange is declared once per channel: a new channel, or a change of
 * exchange name, causes it to be declared again on the next {@link #getChannel()}.
 *
 * <p>Lifecycle methods are synchronized. The channel returned by {@link #getChannel()} is
 * not safe for concurrent use and should back one publish or consume flow at a time.
 */
public final class ConnectionManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectionManager.class.getName());

  private final AmqpTransport transport;
  private final ConnectionSettings settings;
  private final boolean debug;

  private ExchangeSettings exchange;
  private BrokerConnection connection;
  private BrokerChannel channel;
  private boolean exchangeDeclared;

  private ConnectionManager(Builder builder) {
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.settings = builder.settings != null ? builder.settings : ConnectionSettings.defaults();
    this.exchange = builder.exchange != null ? builder.exchange : ExchangeSettings.defaults();
    this.debug = builder.debug;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the current connection, opening a new one if there is none or it is closed.
   *
   * @throws IOException if the transport cannot connect
   */
  public synchronized BrokerConnection getConnection() throws IOException {
    if (connection == null || !connection.isConnected()) {
      connection = createConnection();
    }
    return connection;
  }

  /**
   * Returns an open channel with the exchange declared, re-creating whatever is missing.
   *
   * <p>On failure the connection and channel are closed before the error is rethrown,
   * so the next call starts from scratch.
   *
   * @throws IOException if connecting, opening the channel, or declaring the exchange fails
   */
  public synchronized BrokerChannel getChannel() throws IOException {
    try {
      if (channel == null || !channel.isOpen()) {
        channel = getConnection().openChannel();
        exchangeDeclared = false;
      }
      if (!exchangeDeclared) {
        declareConfiguredExchange();
      }
      return channel;
    } catch (IOException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to get channel, exchange=" + exchange.name(), e);
      closeQuietly();
      throw e;
    }
  }

  public synchronized String getExchangeName() {
    return exchange.name();
  }

  public synchronized ExchangeType getExchangeType() {
    return exchange.type();
  }

  public synchronized ExchangeSettings exchangeSettings() {
    return exchange;
  }

  /**
   * Switches publishing to another exchange; it is declared on the next {@link #getChannel()}.
   */
  public synchronized void setExchangeName(String exchangeName) {
    Objects.requireNonNull(exchangeName, "exchangeName");
    this.exchange = exchange.withName(exchangeName);
    this.exchangeDeclared = false;
  }

  /**
   * Declares an additional exchange on the current channel, e.g. a dead-letter exchange.
   */
  public void declareExchange(String name, ExchangeType type, boolean durable, boolean autoDelete)
      throws IOException {
    BrokerChannel ch = getChannel();
    try {
      ch.exchangeDeclare(name, type, false, durable, autoDelete, false);
      if (debug) {
        logger.fine("Declared exchange " + name + ", type=" + type.wireName());
      }
    } catch (IOException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to declare exchange " + name + ", type=" + type.wireName(), e);
      throw e;
    }
  }

  /**
   * Closes the channel and then the connection. Close failures are logged, never thrown,
   * and both references are cleared regardless.
   */
  public synchronized void closeConnection() {
    try {
      if (channel != null && channel.isOpen()) {
        channel.close();
      }
    } catch (IOException | RuntimeException e) {
      logger.log(Level.WARNING, "Error closing channel", e);
    }
    try {
      if (connection != null && connection.isConnected()) {
        connection.close();
      }
    } catch (IOException | RuntimeException e) {
      logger.log(Level.WARNING, "Error closing connection", e);
    }
    channel = null;
    connection = null;
  }

  /**
   * Drops the current connection and establishes a new one with a fresh channel and
   * exchange declaration.
   *
   * @return {@code true} on success; {@code false} if any step failed, after cleanup
   */
  public synchronized boolean reconnect() {
    try {
      closeConnection();
      connection = createConnection();
      channel = connection.openChannel();
      exchangeDeclared = false;
      declareConfiguredExchange();
      logger.log(Level.INFO, "Reconnected to broker " + settings.host() + ":" + settings.port());
      return true;
    } catch (IOException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to reconnect to broker " + settings.host() + ":" + settings.port()
          + ", error=" + e.getMessage(), e);
      closeConnection();
      return false;
    }
  }

  /**
   * Whether a connection is currently held and reports itself connected.
   */
  public synchronized boolean isConnected() {
    return connection != null && connection.isConnected();
  }

  public ConnectionSettings settings() {
    return settings;
  }

  @Override
  public void close() {
    closeConnection();
  }

  private BrokerConnection createConnection() throws IOException {
    if (debug) {
      logger.fine("Opening connection to " + settings);
    }
    return transport.connect(settings);
  }

  private void declareConfiguredExchange() throws IOException {
    channel.exchangeDeclare(exchange.name(), exchange.type(), exchange.passive(),
        exchange.durable(), exchange.autoDelete(), exchange.internal());
    exchangeDeclared = true;
    if (debug) {
      logger.fine("Declared exchange " + exchange.name() + ", type=" + exchange.type().wireName());
    }
  }

  private void closeQuietly() {
    try {
      closeConnection();
    } catch (RuntimeException cleanup) {
      logger.log(Level.FINE, "Error during connection cleanup", cleanup);
    }
  }

  /**
   * Builder for {@link ConnectionManager}.
   */
  public static final class Builder {
    private AmqpTransport transport;
    private ConnectionSettings settings;
    private ExchangeSettings exchange;
    private boolean debug;

    private Builder() {
    }

    /** Required. Opens broker connections. */
    public Builder transport(AmqpTransport transport) {
      this.transport = transport;
      return this;
    }

    /** Optional. Defaults to {@link ConnectionSettings#defaults()}. */
    public Builder settings(ConnectionSettings settings) {
      this.settings = settings;
      return this;
    }

    /** Optional. Defaults to {@link ExchangeSettings#defaults()}. */
    public Builder exchange(ExchangeSettings exchange) {
      this.exchange = exchange;
      return this;
    }

    /** Optional. Enables FINE-level debug logging. Defaults to {@code false}. */
    public Builder debug(boolean debug) {
      this.debug = debug;
      return this;
    }

    public ConnectionManager build() {
      return new ConnectionManager(this);
    }
  }
}
