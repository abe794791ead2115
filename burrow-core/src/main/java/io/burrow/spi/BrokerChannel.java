package io.burrow.spi;

import io.burrow.Delivery;
import io.burrow.MessageProperties;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * A channel multiplexed over a {@link BrokerConnection}, exposing the AMQP methods the
 * library relies on.
 *
 * <p>A channel is not safe for concurrent use. Deliveries for consumers registered with
 * {@link #basicConsume} are dispatched only from inside {@link #waitForDeliveries}, on the
 * calling thread.
 *
 * <p>Implementations report a shutdown of the underlying connection as
 * {@link ConnectionClosedException} and a channel-only shutdown as
 * {@link ChannelClosedException}.
 */
public interface BrokerChannel {

  boolean isOpen();

  void exchangeDeclare(String exchange, ExchangeType type, boolean passive, boolean durable,
                       boolean autoDelete, boolean internal) throws IOException;

  void queueDeclare(String queue, boolean passive, boolean durable, boolean exclusive,
                    boolean autoDelete, Map<String, Object> arguments) throws IOException;

  void queueBind(String queue, String exchange, String bindingKey) throws IOException;

  void basicQos(int prefetchCount) throws IOException;

  void basicPublish(String exchange, String routingKey, MessageProperties properties, byte[] body)
      throws IOException;

  /**
   * Registers a consumer on {@code queue}.
   *
   * @return the consumer tag assigned by the broker
   */
  String basicConsume(String queue, boolean autoAck, DeliveryHandler handler) throws IOException;

  /**
   * Whether at least one consumer registered on this channel is still active.
   * A broker-side shutdown does not clear this flag; it surfaces from
   * {@link #waitForDeliveries} instead.
   */
  boolean isConsuming();

  /**
   * Blocks until deliveries arrive, dispatching them to their handlers, or until
   * {@code timeout} elapses. A zero timeout waits indefinitely. Returning without a
   * delivery is not an error.
   *
   * <p>Exceptions thrown by a handler propagate out of this method; checked ones are
   * wrapped in {@link io.burrow.MessageHandlingException}.
   */
  void waitForDeliveries(Duration timeout) throws IOException, InterruptedException;

  /**
   * Fetches one message synchronously.
   *
   * @return the message, or {@code null} if the queue is empty
   */
  Delivery basicGet(String queue, boolean autoAck) throws IOException;

  void basicAck(long deliveryTag) throws IOException;

  void basicReject(long deliveryTag, boolean requeue) throws IOException;

  void txSelect() throws IOException;

  void txCommit() throws IOException;

  void txRollback() throws IOException;

  /**
   * Puts the channel in publisher-confirm mode. Idempotent.
   */
  void confirmSelect() throws IOException;

  /**
   * Waits until every message published since the last call is confirmed.
   *
   * @throws IOException if any message was nacked or the timeout elapsed
   */
  void waitForConfirms(Duration timeout) throws IOException, InterruptedException;

  void close() throws IOException;
}
