package io.burrow.consume;

import io.burrow.Delivery;
import io.burrow.MessageProperties;
import io.burrow.connection.ConnectionManager;
import io.burrow.resilience.Sleeper;
import io.burrow.serialization.SerializationFormat;
import io.burrow.spi.ChannelClosedException;
import io.burrow.spi.ConnectionClosedException;
import io.burrow.testing.FakeChannel;
import io.burrow.testing.FakeTransport;
import io.burrow.testing.RecordingMetricsExporter;
import io.burrow.testing.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConsumerTest {

  private final FakeTransport transport = new FakeTransport();
  private final ConnectionManager connectionManager =
      ConnectionManager.builder().transport(transport).build();
  private final RecordingSleeper sleeper = new RecordingSleeper();
  private final RecordingMetricsExporter metrics = new RecordingMetricsExporter();
  private final List<Object> received = new ArrayList<>();

  private Consumer consumer(ConsumerSettings settings) {
    return Consumer.builder(connectionManager).settings(settings).sleeper(sleeper).metrics(metrics).build();
  }

  private Consumer consumer() {
    return consumer(ConsumerSettings.defaults());
  }

  // ── Queue setup ──

  @Test
  void setupQueueDeclaresBindsAndRecords() throws IOException {
    Consumer consumer = consumer();

    consumer.setupQueue("orders", List.of("order.created", "order.updated"), true, false, Map.of("x-max-length", 10));

    FakeChannel channel = transport.lastChannel();
    FakeChannel.QueueDeclared declared = channel.queues.get(0);
    assertEquals("orders", declared.queue());
    assertTrue(declared.durable());
    assertFalse(declared.autoDelete());
    assertEquals(Map.of("x-max-length", 10), declared.arguments());
    assertEquals(List.of(
        new FakeChannel.Binding("orders", "booking_events", "order.created"),
        new FakeChannel.Binding("orders", "booking_events", "order.updated")), channel.bindings);
    assertEquals(List.of("order.created", "order.updated"), consumer.queueConfiguration("orders").bindingKeys());
  }

  @Test
  void redeclarationOverwritesRecordedConfiguration() throws IOException {
    Consumer consumer = consumer();

    consumer.setupQueue("orders", List.of("a"), true, false, Map.of());
    consumer.setupQueue("orders", List.of("b"), false, true, Map.of());

    QueueConfiguration config = consumer.queueConfiguration("orders");
    assertEquals(List.of("b"), config.bindingKeys());
    assertFalse(config.durable());
    assertTrue(config.autoDelete());
  }

  @Test
  void setupQueueFailureIsRethrownAndNotRecorded() {
    transport.prepare(new FakeChannel().failNext("queueBind", new IOException("NOT_FOUND")));
    Consumer consumer = consumer();

    assertThrows(IOException.class, () -> consumer.setupQueue("orders", List.of("a"), true, false, Map.of()));
    assertFalse(consumer.isQueueConfigured("orders"));
  }

  // ── Consume loop ──

  @Test
  void acknowledgesHandledMessages() throws IOException {
    FakeChannel channel = new FakeChannel()
        .deliver("orders", "{\"id\":1}")
        .deliver("orders", "{\"id\":2}");
    transport.prepare(channel);

    consumer().consume("orders", (data, delivery) -> received.add(data));

    assertEquals(List.of(Map.of("id", 1), Map.of("id", 2)), received);
    assertEquals(List.of(1L, 2L), channel.acks);
    assertEquals(1, channel.prefetch);
    assertEquals(2, metrics.consumeSuccess.get());
    assertEquals(1, channel.queues.size());
  }

  @Test
  void falseResultLeavesMessageUnacknowledged() throws IOException {
    FakeChannel channel = new FakeChannel().deliver("orders", "{}");
    transport.prepare(channel);

    consumer().consume("orders", (data, delivery) -> false);

    assertTrue(channel.acks.isEmpty());
    assertTrue(channel.rejects.isEmpty());
  }

  @Test
  void handlerFailureRejectsWithConfiguredRequeue() throws IOException {
    FakeChannel channel = new FakeChannel().deliver("orders", "{}");
    transport.prepare(channel);
    Consumer consumer = consumer(ConsumerSettings.builder().requeueOnError(true).build());

    consumer.consume("orders", (data, delivery) -> {
      throw new IllegalStateException("handler bug");
    });

    assertEquals(List.of(new FakeChannel.Rejection(1, true)), channel.rejects);
    assertTrue(channel.acks.isEmpty());
    assertEquals(1, metrics.consumeFailure.get());
  }

  @Test
  void invalidJsonIsRejectedWithoutCallingHandler() throws IOException {
    FakeChannel channel = new FakeChannel().deliver("orders", "not json");
    transport.prepare(channel);

    consumer().consume("orders", (data, delivery) -> received.add(data));

    assertTrue(received.isEmpty());
    assertEquals(List.of(new FakeChannel.Rejection(1, false)), channel.rejects);
  }

  @Test
  void decodesMessagePackWhenHeaderSaysSo() throws IOException {
    byte[] body = SerializationFormat.MSGPACK.serializer().serialize(Map.of("id", "x"));
    MessageProperties properties = MessageProperties.builder().header(SerializationFormat.HEADER, "msgpack").build();
    transport.prepare(new FakeChannel().deliver("orders", properties, body));

    consumer().consume("orders", (data, delivery) -> received.add(data));

    assertEquals(List.of(Map.of("id", "x")), received);
  }

  @Test
  void autoAckSkipsAcknowledgement() throws IOException {
    FakeChannel channel = new FakeChannel().deliver("orders", "{}");
    transport.prepare(channel);

    consumer().consume("orders", (data, delivery) -> true, List.of(), true, Map.of());

    assertTrue(channel.acks.isEmpty());
  }

  @Test
  void thrownHandlerErrorsReachLoopButDoNotStopIt() throws IOException {
    FakeChannel channel = new FakeChannel()
        .deliver("orders", "{\"n\":1}")
        .deliver("orders", "{\"n\":2}");
    transport.prepare(channel);
    Consumer consumer = consumer(ConsumerSettings.builder().throwExceptions(true).build());

    consumer.consume("orders", (data, delivery) -> {
      received.add(data);
      if (received.size() == 1) {
        throw new IllegalStateException("first fails");
      }
      return true;
    });

    assertEquals(2, received.size());
    assertEquals(1, channel.rejects.size());
    assertEquals(List.of(2L), channel.acks);
  }

  @Test
  void criticalErrorStopsLoopWhenConfigured() throws IOException {
    FakeChannel channel = new FakeChannel()
        .failWait(new IOException("unexpected frame"))
        .deliver("orders", "{}");
    transport.prepare(channel);
    Consumer consumer = consumer(ConsumerSettings.builder().stopOnCriticalError(true).build());

    consumer.consume("orders", (data, delivery) -> received.add(data));

    assertTrue(received.isEmpty());
    assertEquals(1, channel.closeCalls);
  }

  @Test
  void criticalErrorIsLoggedAndLoopContinuesByDefault() throws IOException {
    FakeChannel channel = new FakeChannel()
        .failWait(new IOException("unexpected frame"))
        .deliver("orders", "{}");
    transport.prepare(channel);

    consumer().consume("orders", (data, delivery) -> received.add(data));

    assertEquals(1, received.size());
  }

  @Test
  void interruptionEndsLoop() throws IOException {
    FakeChannel channel = new FakeChannel()
        .failWait(new InterruptedException())
        .deliver("orders", "{}");
    transport.prepare(channel);

    consumer().consume("orders", (data, delivery) -> received.add(data));

    assertTrue(Thread.interrupted());
    assertTrue(received.isEmpty());
  }

  @Test
  void differingBindingKeysTriggerNewSetup() throws IOException {
    Consumer consumer = consumer();
    consumer.setupQueue("orders", List.of("a"), true, false, Map.of());

    consumer.consume("orders", (data, delivery) -> true, List.of("b"), false, Map.of());

    assertEquals(List.of("b"), consumer.queueConfiguration("orders").bindingKeys());
    assertEquals(2, transport.lastChannel().queues.size());
  }

  @Test
  void configuredQueueWithoutKeysIsNotRedeclared() throws IOException {
    Consumer consumer = consumer();
    consumer.setupQueue("orders", List.of("a"), true, false, Map.of());

    consumer.consume("orders", (data, delivery) -> true);

    assertEquals(1, transport.lastChannel().queues.size());
  }

  // ── Reconnection ──

  @Test
  void reconnectsReplaysQueueSetupAndResumes() throws IOException {
    FakeChannel first = new FakeChannel()
        .deliver("orders", "{\"n\":1}")
        .failWait(new ConnectionClosedException("connection reset"));
    FakeChannel second = new FakeChannel().deliver("orders", "{\"n\":2}");
    transport.prepare(first, second);
    Consumer consumer = consumer(ConsumerSettings.builder().reconnectDelay(Duration.ofSeconds(2)).build());

    consumer.consume("orders", (data, delivery) -> received.add(data), List.of("order.*"), false, Map.of());

    assertEquals(List.of(Map.of("n", 1), Map.of("n", 2)), received);
    assertEquals(List.of(2000L), sleeper.millis());
    assertEquals(List.of(new FakeChannel.Binding("orders", "booking_events", "order.*")), second.bindings);
    assertEquals(1, second.prefetch);
    assertTrue(second.consumers.containsKey("orders"));
    assertEquals(List.of(1L), first.acks);
    assertEquals(List.of(1L), second.acks);
    assertEquals(1, metrics.reconnects.get());
  }

  @Test
  void channelClosureAlsoTriggersReconnection() throws IOException {
    FakeChannel first = new FakeChannel().failWait(new ChannelClosedException("PRECONDITION_FAILED"));
    FakeChannel second = new FakeChannel().deliver("orders", "{}");
    transport.prepare(first, second);

    consumer().consume("orders", (data, delivery) -> received.add(data));

    assertEquals(1, received.size());
    assertEquals(2, transport.connections.size());
  }

  @Test
  void exhaustedReconnectionThrowsAfterDoublingDelays() {
    transport.prepare(new FakeChannel().failWait(new ConnectionClosedException("broker down")));
    List<Long> delays = new ArrayList<>();
    Sleeper refusingSleeper = d -> {
      delays.add(d.toMillis());
      transport.refuseConnections(1);
    };
    Consumer consumer = Consumer.builder(connectionManager)
        .settings(ConsumerSettings.builder().reconnectDelay(Duration.ofSeconds(1)).reconnectMaxRetries(3).build())
        .sleeper(refusingSleeper)
        .build();

    ConnectionClosedException thrown = assertThrows(ConnectionClosedException.class,
        () -> consumer.consume("orders", (data, delivery) -> true));

    assertEquals("Failed to reconnect after 3 attempts", thrown.getMessage());
    assertEquals(List.of(1000L, 2000L, 4000L), delays);
    assertEquals("broker down", thrown.getCause().getMessage());
  }

  // ── Pull, ack, reject ──

  @Test
  void getMessageFromQueueReturnsMessageOrNull() throws IOException {
    FakeChannel channel = new FakeChannel();
    transport.prepare(channel);
    Consumer consumer = consumer();
    Delivery queued = channel.enqueueForGet("{\"id\":7}");

    assertSame(queued, consumer.getMessageFromQueue("orders"));
    assertNull(consumer.getMessageFromQueue("orders"));
  }

  @Test
  void getMessageFromQueueReturnsNullOnError() {
    transport.prepare(new FakeChannel().failNext("basicGet", new IOException("NOT_FOUND")));

    assertNull(consumer().getMessageFromQueue("missing"));
  }

  @Test
  void getMessageFromQueueReturnsNullWhenBrokerUnreachable() {
    transport.refuseConnections(1);

    assertNull(consumer().getMessageFromQueue("orders"));
  }

  @Test
  void acknowledgeIsIgnoredWhenAlreadySettled() throws IOException {
    FakeChannel channel = new FakeChannel();
    transport.prepare(channel);
    Consumer consumer = consumer();
    consumer.setupQueue("orders");
    Delivery delivery = channel.enqueueForGet("{}");

    consumer.acknowledge(delivery);
    consumer.acknowledge(delivery);
    consumer.reject(delivery, true);

    assertEquals(List.of(delivery.deliveryTag()), channel.acks);
    assertTrue(channel.rejects.isEmpty());
  }

  @Test
  void settlingOnClosedChannelIsNoOp() {
    FakeChannel channel = new FakeChannel();
    Delivery delivery = channel.enqueueForGet("{}");
    channel.breakChannel();

    consumer().acknowledge(delivery);
    consumer().reject(delivery, false);

    assertTrue(channel.acks.isEmpty());
    assertTrue(channel.rejects.isEmpty());
    assertFalse(delivery.isSettled());
  }

  @Test
  void settlingInvalidDeliveryTagIsNoOp() {
    FakeChannel channel = new FakeChannel();
    Delivery delivery = new Delivery(channel, 0, "ex", "rk", false, MessageProperties.EMPTY, new byte[0]);

    consumer().acknowledge(delivery);
    consumer().acknowledge(null);

    assertTrue(channel.acks.isEmpty());
  }

  @Test
  void brokerErrorWhileAcknowledgingIsSwallowed() {
    FakeChannel channel = new FakeChannel().failNext("basicAck", new IOException("unknown delivery tag"));
    Delivery delivery = channel.enqueueForGet("{}");

    assertDoesNotThrow(() -> consumer().acknowledge(delivery));
  }
}
