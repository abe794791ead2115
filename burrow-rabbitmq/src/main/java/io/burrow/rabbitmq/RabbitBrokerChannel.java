package io.burrow.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.ShutdownSignalException;
import io.burrow.Delivery;
import io.burrow.MessageHandlingException;
import io.burrow.MessageProperties;
import io.burrow.spi.BrokerChannel;
import io.burrow.spi.ChannelClosedException;
import io.burrow.spi.ConnectionClosedException;
import io.burrow.spi.DeliveryHandler;
import io.burrow.spi.ExchangeType;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BrokerChannel} over a client {@link Channel}.
 *
 * <p>The client delivers on its own dispatch thread; deliveries are queued there and handed
 * to their {@link DeliveryHandler} from {@link #waitForDeliveries} on the caller's thread.
 */
final class RabbitBrokerChannel implements BrokerChannel {
  private static final Logger logger = Logger.getLogger(RabbitBrokerChannel.class.getName());
  private static final long POLL_SLICE_MS = 500;

  private final Channel channel;
  private final BlockingQueue<Object> inbox = new LinkedBlockingQueue<>();
  private final Set<String> activeConsumers = ConcurrentHashMap.newKeySet();

  private record Pending(DeliveryHandler handler, Delivery delivery) {
  }

  RabbitBrokerChannel(Channel channel) {
    this.channel = channel;
  }

  @Override
  public boolean isOpen() {
    return channel.isOpen();
  }

  @Override
  public void exchangeDeclare(String exchange, ExchangeType type, boolean passive, boolean durable,
                              boolean autoDelete, boolean internal) throws IOException {
    call(() -> {
      if (passive) {
        channel.exchangeDeclarePassive(exchange);
      } else {
        channel.exchangeDeclare(exchange, type.wireName(), durable, autoDelete, internal, null);
      }
      return null;
    });
  }

  @Override
  public void queueDeclare(String queue, boolean passive, boolean durable, boolean exclusive,
                           boolean autoDelete, Map<String, Object> arguments) throws IOException {
    call(() -> passive
        ? channel.queueDeclarePassive(queue)
        : channel.queueDeclare(queue, durable, exclusive, autoDelete, arguments));
  }

  @Override
  public void queueBind(String queue, String exchange, String bindingKey) throws IOException {
    call(() -> channel.queueBind(queue, exchange, bindingKey));
  }

  @Override
  public void basicQos(int prefetchCount) throws IOException {
    call(() -> {
      channel.basicQos(prefetchCount);
      return null;
    });
  }

  @Override
  public void basicPublish(String exchange, String routingKey, MessageProperties properties, byte[] body)
      throws IOException {
    AMQP.BasicProperties amqp = AmqpProperties.toAmqp(properties);
    call(() -> {
      channel.basicPublish(exchange, routingKey, amqp, body);
      return null;
    });
  }

  @Override
  public String basicConsume(String queue, boolean autoAck, DeliveryHandler handler) throws IOException {
    String tag = call(() -> channel.basicConsume(queue, autoAck, new QueueingConsumer(handler)));
    activeConsumers.add(tag);
    return tag;
  }

  @Override
  public boolean isConsuming() {
    return !activeConsumers.isEmpty();
  }

  @Override
  public void waitForDeliveries(Duration timeout) throws IOException, InterruptedException {
    long deadline = timeout.isZero() ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();
    Object next = null;
    while (next == null) {
      long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
      if (remainingMs <= 0) {
        return;
      }
      next = inbox.poll(Math.min(POLL_SLICE_MS, remainingMs), TimeUnit.MILLISECONDS);
      if (next == null && (!isConsuming() || !channel.isOpen())) {
        next = inbox.poll();
        if (next == null) {
          checkOpen();
          return;
        }
      }
    }
    do {
      dispatch(next);
      next = inbox.poll();
    } while (next != null);
  }

  private void dispatch(Object next) throws IOException {
    if (next instanceof ShutdownSignalException signal) {
      throw translate(signal);
    }
    Pending pending = (Pending) next;
    try {
      pending.handler().handle(pending.delivery());
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new MessageHandlingException("Delivery handler failed: " + e.getMessage(), e);
    }
  }

  private void checkOpen() throws IOException {
    if (!channel.isOpen()) {
      ShutdownSignalException reason = channel.getCloseReason();
      if (reason != null && !reason.isInitiatedByApplication()) {
        throw translate(reason);
      }
      activeConsumers.clear();
    }
  }

  @Override
  public Delivery basicGet(String queue, boolean autoAck) throws IOException {
    GetResponse response = call(() -> channel.basicGet(queue, autoAck));
    if (response == null) {
      return null;
    }
    Envelope envelope = response.getEnvelope();
    return new Delivery(this, envelope.getDeliveryTag(), envelope.getExchange(), envelope.getRoutingKey(),
        envelope.isRedeliver(), AmqpProperties.fromAmqp(response.getProps()), response.getBody());
  }

  @Override
  public void basicAck(long deliveryTag) throws IOException {
    call(() -> {
      channel.basicAck(deliveryTag, false);
      return null;
    });
  }

  @Override
  public void basicReject(long deliveryTag, boolean requeue) throws IOException {
    call(() -> {
      channel.basicReject(deliveryTag, requeue);
      return null;
    });
  }

  @Override
  public void txSelect() throws IOException {
    call(channel::txSelect);
  }

  @Override
  public void txCommit() throws IOException {
    call(channel::txCommit);
  }

  @Override
  public void txRollback() throws IOException {
    call(channel::txRollback);
  }

  @Override
  public void confirmSelect() throws IOException {
    call(channel::confirmSelect);
  }

  @Override
  public void waitForConfirms(Duration timeout) throws IOException, InterruptedException {
    try {
      channel.waitForConfirmsOrDie(timeout.toMillis());
    } catch (TimeoutException e) {
      throw new IOException("Timed out waiting for publisher confirms after " + timeout.toMillis() + "ms", e);
    } catch (ShutdownSignalException e) {
      throw translate(e);
    }
  }

  @Override
  public void close() throws IOException {
    activeConsumers.clear();
    if (!channel.isOpen()) {
      return;
    }
    try {
      channel.close();
    } catch (TimeoutException e) {
      throw new IOException("Timed out closing channel " + channel.getChannelNumber(), e);
    } catch (ShutdownSignalException e) {
      logger.fine("Channel already closed: " + e.getMessage());
    }
  }

  static IOException translate(ShutdownSignalException signal) {
    if (signal.isHardError()) {
      return new ConnectionClosedException("Connection closed: " + signal.getMessage(), signal);
    }
    return new ChannelClosedException("Channel closed: " + signal.getMessage(), signal);
  }

  private <T> T call(ChannelCall<T> action) throws IOException {
    try {
      return action.call();
    } catch (ShutdownSignalException e) {
      throw translate(e);
    }
  }

  @FunctionalInterface
  private interface ChannelCall<T> {
    T call() throws IOException;
  }

  private final class QueueingConsumer extends DefaultConsumer {
    private final DeliveryHandler handler;

    QueueingConsumer(DeliveryHandler handler) {
      super(channel);
      this.handler = handler;
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties,
                               byte[] body) {
      Delivery delivery = new Delivery(RabbitBrokerChannel.this, envelope.getDeliveryTag(), envelope.getExchange(),
          envelope.getRoutingKey(), envelope.isRedeliver(), AmqpProperties.fromAmqp(properties), body);
      inbox.add(new Pending(handler, delivery));
    }

    @Override
    public void handleCancel(String consumerTag) {
      logger.log(Level.WARNING, "Consumer cancelled by broker, consumerTag=" + consumerTag);
      activeConsumers.remove(consumerTag);
    }

    @Override
    public void handleCancelOk(String consumerTag) {
      activeConsumers.remove(consumerTag);
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException signal) {
      if (signal.isInitiatedByApplication()) {
        activeConsumers.remove(consumerTag);
        return;
      }
      inbox.add(signal);
    }
  }
}
