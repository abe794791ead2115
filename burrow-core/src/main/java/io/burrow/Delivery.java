package io.burrow;

import io.burrow.spi.BrokerChannel;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A message received from the broker, by push ({@code basicConsume}) or pull
 * ({@code basicGet}).
 *
 * <p>Remembers the channel it arrived on, since acknowledgements are only valid on that
 * channel, and whether it has already been acknowledged or rejected.
 */
public final class Delivery {
  private final BrokerChannel channel;
  private final long deliveryTag;
  private final String exchange;
  private final String routingKey;
  private final boolean redelivered;
  private final MessageProperties properties;
  private final byte[] body;
  private final AtomicBoolean settled = new AtomicBoolean();

  public Delivery(BrokerChannel channel, long deliveryTag, String exchange, String routingKey,
                  boolean redelivered, MessageProperties properties, byte[] body) {
    this.channel = channel;
    this.deliveryTag = deliveryTag;
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.redelivered = redelivered;
    this.properties = properties != null ? properties : MessageProperties.EMPTY;
    this.body = Objects.requireNonNull(body, "body");
  }

  /**
   * Channel the message arrived on; {@code null} for deliveries built outside a transport.
   */
  public BrokerChannel channel() {
    return channel;
  }

  public long deliveryTag() {
    return deliveryTag;
  }

  public String exchange() {
    return exchange;
  }

  public String routingKey() {
    return routingKey;
  }

  public boolean redelivered() {
    return redelivered;
  }

  public MessageProperties properties() {
    return properties;
  }

  public byte[] body() {
    return body.clone();
  }

  /**
   * Body decoded as UTF-8, for logging.
   */
  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  /**
   * Whether an acknowledge or reject has already been sent for this delivery.
   */
  public boolean isSettled() {
    return settled.get();
  }

  /**
   * Marks this delivery as acknowledged or rejected.
   *
   * @return {@code false} if it was already settled
   */
  public boolean markSettled() {
    return settled.compareAndSet(false, true);
  }

  @Override
  public String toString() {
    return "Delivery{deliveryTag=" + deliveryTag + ", exchange=" + exchange
        + ", routingKey=" + routingKey + ", redelivered=" + redelivered + "}";
  }
}
