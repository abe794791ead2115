package io.burrow.consume;

import io.burrow.Delivery;
import io.burrow.MessageCallback;
import io.burrow.connection.ConnectionManager;
import io.burrow.resilience.Sleeper;
import io.burrow.serialization.SerializationFormat;
import io.burrow.spi.BrokerChannel;
import io.burrow.spi.ChannelClosedException;
import io.burrow.spi.ConnectionClosedException;
import io.burrow.spi.ConnectionFailureException;
import io.burrow.spi.DeliveryHandler;
import io.burrow.spi.MetricsExporter;
import io.burrow.validation.MessageValidationException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Declares queues and runs a blocking consume loop that survives connection loss.
 *
 * <p>{@link #consume} blocks the calling thread and invokes the callback on it. When the
 * connection or channel closes underneath the loop, the consumer reconnects through the
 * {@link ConnectionManager}, replays the recorded {@link QueueConfiguration}, re-registers
 * the same handler and resumes. The delay between attempts starts at
 * {@link ConsumerSettings#reconnectDelay()} and doubles after every failed attempt; once
 * {@link ConsumerSettings#reconnectMaxRetries()} attempts have failed, {@code consume}
 * throws {@link ConnectionClosedException}.
 *
 * <p>Other errors inside the loop are logged; with
 * {@link ConsumerSettings#stopOnCriticalError()} the channel is closed and the loop ends.
 * Interrupting the consuming thread also ends the loop.
 *
 * <p>A callback that throws gets its delivery rejected. The delivery is requeued when
 * {@link ConsumerSettings#requeueOnError()} is set, except for a
 * {@link MessageValidationException}, which is never requeued.
 */
public final class Consumer {
  private static final Logger logger = Logger.getLogger(Consumer.class.getName());

  private final ConnectionManager connectionManager;
  private final ConsumerSettings settings;
  private final Sleeper sleeper;
  private final MetricsExporter metrics;
  private final boolean debug;
  private final Map<String, QueueConfiguration> queues = new ConcurrentHashMap<>();

  private Consumer(Builder builder) {
    this.connectionManager = Objects.requireNonNull(builder.connectionManager, "connectionManager");
    this.settings = builder.settings != null ? builder.settings : ConsumerSettings.defaults();
    this.sleeper = Objects.requireNonNull(builder.sleeper, "sleeper");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.debug = builder.debug;
  }

  public static Builder builder(ConnectionManager connectionManager) {
    return new Builder(connectionManager);
  }

  /**
   * Declares a durable queue without bindings.
   */
  public Consumer setupQueue(String queueName) throws IOException {
    return setupQueue(queueName, List.of(), true, false, Map.of());
  }

  /**
   * Declares {@code queueName}, binds it to the configured exchange with each binding key,
   * and records the configuration for replay after a reconnect. A later call for the same
   * queue replaces the recorded configuration.
   *
   * @throws IOException if the declaration or a binding fails
   */
  public Consumer setupQueue(String queueName, List<String> bindingKeys, boolean durable,
                             boolean autoDelete, Map<String, Object> arguments) throws IOException {
    Objects.requireNonNull(queueName, "queueName");
    List<String> keys = bindingKeys == null ? List.of() : bindingKeys;
    Map<String, Object> args = arguments == null ? Map.of() : arguments;
    String exchange = null;
    try {
      BrokerChannel channel = connectionManager.getChannel();
      exchange = connectionManager.getExchangeName();
      channel.queueDeclare(queueName, false, durable, false, autoDelete, args);
      for (String key : keys) {
        channel.queueBind(queueName, exchange, key);
      }
      queues.put(queueName, new QueueConfiguration(keys, durable, autoDelete, args));
      if (debug) {
        logger.fine("Queue set up, queue=" + queueName + ", exchange=" + exchange
            + ", bindingKeys=" + keys + ", durable=" + durable + ", autoDelete=" + autoDelete);
      }
      return this;
    } catch (IOException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to set up queue, queue=" + queueName + ", exchange=" + exchange
          + ", bindingKeys=" + keys + ", durable=" + durable + ", autoDelete=" + autoDelete
          + ", arguments=" + args + ", error=" + e.getMessage(), e);
      throw e;
    }
  }

  /**
   * Consumes {@code queueName} with the default acknowledgement mode and no extra bindings.
   */
  public void consume(String queueName, MessageCallback callback) throws IOException {
    consume(queueName, callback, List.of(), settings.autoAck(), Map.of());
  }

  /**
   * Consumes {@code queueName} until the channel stops consuming, the thread is interrupted,
   * or reconnection is exhausted.
   *
   * <p>The queue is (re)declared first when it has not been set up yet, or when non-empty
   * {@code bindingKeys} differ from the recorded ones.
   *
   * @param queueName   queue to consume
   * @param callback    application callback; return {@code false} to skip the acknowledgement
   * @param bindingKeys binding keys for a first-time or changed setup
   * @param autoAck     let the broker consider deliveries acknowledged on send
   * @param arguments   queue arguments for a first-time or changed setup
   * @throws ConnectionClosedException if the connection was lost and could not be restored
   * @throws IOException               if the queue cannot be set up or consumption cannot start
   */
  public void consume(String queueName, MessageCallback callback, List<String> bindingKeys,
                      boolean autoAck, Map<String, Object> arguments) throws IOException {
    Objects.requireNonNull(queueName, "queueName");
    Objects.requireNonNull(callback, "callback");
    List<String> keys = bindingKeys == null ? List.of() : bindingKeys;
    try {
      QueueConfiguration recorded = queues.get(queueName);
      if (recorded == null || (!keys.isEmpty() && !keys.equals(recorded.bindingKeys()))) {
        setupQueue(queueName, keys, true, false, arguments);
      }
      BrokerChannel channel = connectionManager.getChannel();
      if (settings.prefetchCount() > 0) {
        channel.basicQos(settings.prefetchCount());
      }
      DeliveryHandler handler = wrap(queueName, callback, autoAck);
      channel.basicConsume(queueName, autoAck, handler);
      logger.log(Level.INFO, "Started consuming, queue=" + queueName
          + ", exchange=" + connectionManager.getExchangeName() + ", bindingKeys=" + keys);
      processUntilClosed(channel, queueName, autoAck, handler);
    } catch (IOException | RuntimeException e) {
      logger.log(Level.SEVERE, "Consumer stopped with error, queue=" + queueName
          + ", error=" + e.getMessage(), e);
      throw e;
    }
  }

  /**
   * Fetches a single message without acknowledging it.
   *
   * @return the message, or {@code null} when the queue is empty or the fetch failed
   */
  public Delivery getMessageFromQueue(String queueName) {
    try {
      BrokerChannel channel = connectionManager.getChannel();
      if (!channel.isOpen()) {
        logger.log(Level.WARNING, "Cannot get message: channel is not open, queue=" + queueName);
        return null;
      }
      return channel.basicGet(queueName, false);
    } catch (IOException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to get message, queue=" + queueName
          + ", error=" + e.getMessage(), e);
      return null;
    }
  }

  /**
   * Acknowledges {@code delivery}. Invalid deliveries and broker errors are logged and ignored.
   */
  public void acknowledge(Delivery delivery) {
    if (!canSettle(delivery, "acknowledge")) {
      return;
    }
    try {
      delivery.channel().basicAck(delivery.deliveryTag());
    } catch (IOException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to acknowledge message, deliveryTag=" + delivery.deliveryTag()
          + ", error=" + e.getMessage());
    }
  }

  /**
   * Rejects {@code delivery}. Invalid deliveries and broker errors are logged and ignored.
   */
  public void reject(Delivery delivery, boolean requeue) {
    if (!canSettle(delivery, "reject")) {
      return;
    }
    try {
      delivery.channel().basicReject(delivery.deliveryTag(), requeue);
    } catch (IOException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to reject message, deliveryTag=" + delivery.deliveryTag()
          + ", requeue=" + requeue + ", error=" + e.getMessage());
    }
  }

  public boolean isQueueConfigured(String queueName) {
    return queues.containsKey(queueName);
  }

  /**
   * The recorded configuration of {@code queueName}, or {@code null}.
   */
  public QueueConfiguration queueConfiguration(String queueName) {
    return queues.get(queueName);
  }

  public ConsumerSettings settings() {
    return settings;
  }

  private DeliveryHandler wrap(String queueName, MessageCallback callback, boolean autoAck) {
    return delivery -> {
      try {
        Object data = decode(delivery);
        boolean handled = callback.onMessage(data, delivery);
        if (handled && !autoAck) {
          acknowledge(delivery);
        }
        metrics.incrementConsumeSuccess();
      } catch (Exception e) {
        metrics.incrementConsumeFailure();
        logger.log(Level.SEVERE, "Error processing message, queue=" + queueName
            + ", deliveryTag=" + delivery.deliveryTag() + ", body=" + delivery.bodyAsString(), e);
        if (!autoAck) {
          reject(delivery, requeueOnFailure(e));
        }
        if (settings.throwExceptions()) {
          throw e;
        }
      }
    };
  }

  private boolean requeueOnFailure(Exception error) {
    return !(error instanceof MessageValidationException) && settings.requeueOnError();
  }

  private static Object decode(Delivery delivery) {
    SerializationFormat format = SerializationFormat.fromHeaders(delivery.properties().headers());
    return format.serializer().deserialize(delivery.body());
  }

  private void processUntilClosed(BrokerChannel channel, String queueName, boolean autoAck,
                                  DeliveryHandler handler) throws IOException {
    BrokerChannel current = channel;
    while (current.isConsuming()) {
      try {
        current.waitForDeliveries(settings.waitTimeout());
      } catch (ConnectionClosedException | ChannelClosedException e) {
        current = handleReconnection(queueName, autoAck, handler, e);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.log(Level.INFO, "Consumer interrupted, stopping, queue=" + queueName);
        return;
      } catch (IOException | RuntimeException e) {
        logger.log(Level.SEVERE, "Error while consuming, queue=" + queueName
            + ", error=" + e.getMessage(), e);
        if (settings.stopOnCriticalError()) {
          closeGracefully(current, queueName);
          return;
        }
      }
    }
  }

  private BrokerChannel handleReconnection(String queueName, boolean autoAck, DeliveryHandler handler,
                                           IOException cause) throws IOException {
    logger.log(Level.WARNING, "Connection lost while consuming, attempting to reconnect, queue="
        + queueName + ", error=" + cause.getMessage());
    int maxRetries = settings.reconnectMaxRetries();
    Duration delay = settings.reconnectDelay();
    for (int attempt = 1; attempt <= maxRetries; attempt++) {
      metrics.incrementReconnectAttempts();
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        InterruptedIOException interrupted =
            new InterruptedIOException("Interrupted while reconnecting, queue=" + queueName);
        interrupted.addSuppressed(cause);
        throw interrupted;
      }
      try {
        if (!connectionManager.reconnect()) {
          throw new ConnectionFailureException("Broker refused the reconnect attempt");
        }
        BrokerChannel channel = connectionManager.getChannel();
        QueueConfiguration config = queues.get(queueName);
        if (config != null) {
          setupQueue(queueName, config.bindingKeys(), config.durable(), config.autoDelete(), config.arguments());
        }
        if (settings.prefetchCount() > 0) {
          channel.basicQos(settings.prefetchCount());
        }
        channel.basicConsume(queueName, autoAck, handler);
        logger.log(Level.INFO, "Reconnected and resumed consuming, queue=" + queueName
            + ", attempt=" + attempt);
        return channel;
      } catch (IOException | RuntimeException e) {
        logger.log(Level.SEVERE, "Reconnection attempt failed, queue=" + queueName
            + ", attempt=" + attempt + ", maxRetries=" + maxRetries + ", error=" + e.getMessage());
        delay = delay.multipliedBy(2);
      }
    }
    logger.log(Level.SEVERE, "Failed to reconnect after " + maxRetries + " attempts, queue=" + queueName);
    throw new ConnectionClosedException("Failed to reconnect after " + maxRetries + " attempts", cause);
  }

  private void closeGracefully(BrokerChannel channel, String queueName) {
    try {
      if (channel.isOpen()) {
        channel.close();
      }
      logger.log(Level.INFO, "Stopped consuming after critical error, queue=" + queueName);
    } catch (IOException | RuntimeException e) {
      logger.log(Level.WARNING, "Error closing channel after critical error, queue=" + queueName, e);
    }
  }

  private static boolean canSettle(Delivery delivery, String operation) {
    if (delivery == null) {
      logger.log(Level.WARNING, "Cannot " + operation + " message: no delivery");
      return false;
    }
    BrokerChannel channel = delivery.channel();
    if (channel == null || !channel.isOpen()) {
      logger.log(Level.WARNING, "Cannot " + operation + " message: channel is not open, deliveryTag="
          + delivery.deliveryTag());
      return false;
    }
    if (delivery.deliveryTag() <= 0) {
      logger.log(Level.WARNING, "Cannot " + operation + " message: invalid delivery tag "
          + delivery.deliveryTag());
      return false;
    }
    if (!delivery.markSettled()) {
      logger.log(Level.WARNING, "Cannot " + operation + " message: already acknowledged or rejected, deliveryTag="
          + delivery.deliveryTag());
      return false;
    }
    return true;
  }

  /**
   * Builder for {@link Consumer}.
   */
  public static final class Builder {
    private final ConnectionManager connectionManager;
    private ConsumerSettings settings;
    private Sleeper sleeper = Sleeper.SYSTEM;
    private MetricsExporter metrics;
    private boolean debug;

    private Builder(ConnectionManager connectionManager) {
      this.connectionManager = connectionManager;
    }

    /** Optional. Defaults to {@link ConsumerSettings#defaults()}. */
    public Builder settings(ConsumerSettings settings) {
      this.settings = settings;
      return this;
    }

    /** Optional. Waits between reconnect attempts. Defaults to {@link Sleeper#SYSTEM}. */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to {@code false}. */
    public Builder debug(boolean debug) {
      this.debug = debug;
      return this;
    }

    public Consumer build() {
      return new Consumer(this);
    }
  }
}
