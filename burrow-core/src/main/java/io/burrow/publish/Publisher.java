package io.burrow.publish;

import com.github.f4b6a3.ulid.UlidCreator;
import io.burrow.MessageProperties;
import io.burrow.OutgoingMessage;
import io.burrow.connection.ConnectionManager;
import io.burrow.serialization.SerializationFormat;
import io.burrow.serialization.Serializer;
import io.burrow.spi.BrokerChannel;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes messages to the exchange managed by a {@link ConnectionManager}.
 *
 * <p>Every message gets default properties (content type of its serializer, a generated
 * message id, persistent delivery) with the caller's properties layered on top. The
 * serializer is picked from the {@value SerializationFormat#HEADER} header when present,
 * otherwise the publisher's default format is used.
 *
 * <p>Failures are logged and reported as {@code false}; nothing is thrown.
 *
 * <p>With publisher confirms enabled, the channel is switched to confirm mode and each
 * publish waits for the broker's acknowledgement. AMQP does not allow transactions on a
 * confirm-mode channel, so {@link #publishBatch} then waits for confirmation of the whole
 * batch instead of committing a transaction.
 *
 * <p>A channel stays transactional once a batch has selected it, so later single publishes
 * on that channel are committed one by one.
 */
public final class Publisher {
  private static final Logger logger = Logger.getLogger(Publisher.class.getName());

  private static final String MESSAGE_ID_PREFIX = "msg_";

  private final ConnectionManager connectionManager;
  private final SerializationFormat defaultFormat;
  private final boolean confirmSelect;
  private final Duration confirmTimeout;
  private final boolean debug;

  private BrokerChannel confirmChannel;
  private BrokerChannel txChannel;

  private Publisher(Builder builder) {
    this.connectionManager = Objects.requireNonNull(builder.connectionManager, "connectionManager");
    this.defaultFormat = Objects.requireNonNull(builder.serializationFormat, "serializationFormat");
    this.confirmSelect = builder.confirmSelect;
    this.confirmTimeout = Objects.requireNonNull(builder.confirmTimeout, "confirmTimeout");
    this.debug = builder.debug;
  }

  public static Builder builder(ConnectionManager connectionManager) {
    return new Builder(connectionManager);
  }

  /**
   * Publishes one message.
   *
   * @param routingKey routing key
   * @param data       payload
   * @param properties caller properties; may be {@code null}
   * @return {@code true} if the broker accepted the message
   */
  public boolean publish(String routingKey, Object data, MessageProperties properties) {
    String exchange = null;
    BrokerChannel channel = null;
    try {
      channel = connectionManager.getChannel();
      exchange = connectionManager.getExchangeName();
      if (confirmSelect) {
        ensureConfirmMode(channel);
      }
      send(channel, exchange, routingKey, data, properties);
      if (confirmSelect) {
        channel.waitForConfirms(confirmTimeout);
      } else if (isTransactional(channel)) {
        channel.txCommit();
      }
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.SEVERE, "Interrupted while publishing, routingKey=" + routingKey
          + ", exchange=" + exchange);
      return false;
    } catch (IOException | RuntimeException e) {
      if (channel != null && isTransactional(channel)) {
        rollback(channel);
      }
      logger.log(Level.SEVERE, "Failed to publish message, routingKey=" + routingKey
          + ", exchange=" + exchange + ", error=" + e.getMessage(), e);
      return false;
    }
  }

  /**
   * Publishes {@code messages} atomically: in one transaction, or, in confirm mode, as one
   * confirmed batch. A message without a routing key fails the whole batch.
   *
   * @return {@code true} if the whole batch was committed (or confirmed)
   */
  public boolean publishBatch(List<OutgoingMessage> messages) {
    Objects.requireNonNull(messages, "messages");
    BrokerChannel channel = null;
    boolean inTransaction = false;
    try {
      channel = connectionManager.getChannel();
      String exchange = connectionManager.getExchangeName();
      if (confirmSelect) {
        ensureConfirmMode(channel);
      } else {
        ensureTransactional(channel);
        inTransaction = true;
      }
      for (OutgoingMessage message : messages) {
        if (!message.hasRoutingKey()) {
          throw new IllegalArgumentException("Missing routing key for batch message");
        }
        send(channel, exchange, message.routingKey(), message.data(), message.properties());
      }
      if (inTransaction) {
        channel.txCommit();
      } else {
        channel.waitForConfirms(confirmTimeout);
      }
      if (debug) {
        logger.fine("Published batch, messageCount=" + messages.size());
      }
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.SEVERE, "Interrupted while publishing batch, messageCount=" + messages.size());
      return false;
    } catch (IOException | RuntimeException e) {
      if (inTransaction) {
        rollback(channel);
      }
      logger.log(Level.SEVERE, "Failed to publish batch, messageCount=" + messages.size()
          + ", error=" + e.getMessage(), e);
      return false;
    }
  }

  /**
   * Generates a unique, time-ordered message id.
   */
  public String generateMessageId() {
    return MESSAGE_ID_PREFIX + UlidCreator.getMonotonicUlid();
  }

  public SerializationFormat defaultFormat() {
    return defaultFormat;
  }

  /**
   * Default properties for {@code caller}, with the caller's values taking precedence.
   */
  MessageProperties resolveProperties(MessageProperties caller, Serializer serializer) {
    MessageProperties supplied = caller != null ? caller : MessageProperties.EMPTY;
    MessageProperties defaults = MessageProperties.builder()
        .contentType(serializer.contentType())
        .messageId(supplied.messageId() != null ? supplied.messageId() : generateMessageId())
        .deliveryMode(MessageProperties.PERSISTENT)
        .build();
    return defaults.merge(supplied);
  }

  Serializer serializerFor(MessageProperties caller) {
    if (caller != null && caller.header(SerializationFormat.HEADER) != null) {
      return SerializationFormat.fromHeaders(caller.headers()).serializer();
    }
    return defaultFormat.serializer();
  }

  private void send(BrokerChannel channel, String exchange, String routingKey, Object data,
                    MessageProperties caller) throws IOException {
    Serializer serializer = serializerFor(caller);
    MessageProperties properties = resolveProperties(caller, serializer);
    byte[] body = serializer.serialize(data);
    channel.basicPublish(exchange, routingKey, properties, body);
    if (debug) {
      logger.fine("Published message, routingKey=" + routingKey + ", exchange=" + exchange
          + ", messageId=" + properties.messageId());
    }
  }

  private synchronized void ensureConfirmMode(BrokerChannel channel) throws IOException {
    if (confirmChannel != channel) {
      channel.confirmSelect();
      confirmChannel = channel;
    }
  }

  private synchronized void ensureTransactional(BrokerChannel channel) throws IOException {
    if (txChannel != channel) {
      channel.txSelect();
      txChannel = channel;
    }
  }

  private synchronized boolean isTransactional(BrokerChannel channel) {
    return txChannel == channel;
  }

  private void rollback(BrokerChannel channel) {
    if (channel == null || !channel.isOpen()) {
      return;
    }
    try {
      channel.txRollback();
    } catch (IOException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to roll back batch transaction", e);
    }
  }

  /**
   * Builder for {@link Publisher}.
   */
  public static final class Builder {
    private final ConnectionManager connectionManager;
    private SerializationFormat serializationFormat = SerializationFormat.JSON;
    private boolean confirmSelect;
    private Duration confirmTimeout = Duration.ofSeconds(5);
    private boolean debug;

    private Builder(ConnectionManager connectionManager) {
      this.connectionManager = connectionManager;
    }

    /** Optional. Defaults to {@link SerializationFormat#JSON}. */
    public Builder serializationFormat(SerializationFormat serializationFormat) {
      this.serializationFormat = serializationFormat;
      return this;
    }

    /** Optional. Enables publisher confirms. Defaults to {@code false}. */
    public Builder confirmSelect(boolean confirmSelect) {
      this.confirmSelect = confirmSelect;
      return this;
    }

    /** Optional. How long to wait for confirms. Defaults to 5 seconds. */
    public Builder confirmTimeout(Duration confirmTimeout) {
      this.confirmTimeout = confirmTimeout;
      return this;
    }

    /** Optional. Defaults to {@code false}. */
    public Builder debug(boolean debug) {
      this.debug = debug;
      return this;
    }

    public Publisher build() {
      return new Publisher(this);
    }
  }
}
