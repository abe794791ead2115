package io.burrow;

import io.burrow.connection.ConnectionManager;
import io.burrow.consume.Consumer;
import io.burrow.consume.ConsumerSettings;
import io.burrow.resilience.CircuitBreaker;
import io.burrow.resilience.CircuitOpenException;
import io.burrow.resilience.CircuitState;
import io.burrow.resilience.RetryPolicy;
import io.burrow.serialization.SerializationFormat;
import io.burrow.spi.ExchangeType;
import io.burrow.testing.FakeChannel;
import io.burrow.testing.FakeTransport;
import io.burrow.testing.RecordingMetricsExporter;
import io.burrow.testing.RecordingSleeper;
import io.burrow.validation.FieldType;
import io.burrow.validation.MessageSchema;
import io.burrow.validation.MessageValidationException;
import io.burrow.validation.SimpleMessageValidator;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessagingServiceTest {

  private final FakeTransport transport = new FakeTransport();
  private final ConnectionManager connectionManager =
      ConnectionManager.builder().transport(transport).build();
  private final RecordingSleeper sleeper = new RecordingSleeper();
  private final RecordingMetricsExporter metrics = new RecordingMetricsExporter();

  private MessagingService.Builder service() {
    return MessagingService.builder()
        .connectionManager(connectionManager)
        .metrics(metrics)
        .retryPolicy(RetryPolicy.builder().maxAttempts(3).sleeper(sleeper).build());
  }

  // ── Builder validation ──

  @Test
  void requiresConnectionManager() {
    assertThrows(NullPointerException.class, () -> MessagingService.builder().build());
  }

  @Test
  void rejectsNonPositiveBatchSize() {
    assertThrows(IllegalArgumentException.class, () -> service().batchSize(0).build());
  }

  @Test
  void defaultCircuitIsNamedAfterPublisher() {
    assertEquals(MessagingService.PUBLISHER_CIRCUIT, service().build().circuitBreaker().name());
  }

  // ── Publishing ──

  @Test
  void publishesThroughResilienceStack() {
    MessagingService messaging = service().build();

    assertTrue(messaging.publish("order.created", Map.of("order_id", "o-1")));

    FakeChannel.Published message = transport.lastChannel().published.get(0);
    assertEquals("order.created", message.routingKey());
    assertEquals("application/json", message.properties().contentType());
    assertEquals(MessageProperties.PERSISTENT, message.properties().deliveryMode());
    assertEquals("json", message.properties().header(SerializationFormat.HEADER));
    assertEquals(1, metrics.publishSuccess.get());
    assertEquals(List.of("publish:success"), metrics.operations);
  }

  @Test
  void retriesTransientPublishFailure() {
    transport.prepare(new FakeChannel().failNext("basicPublish", new IOException("flow control")));
    MessagingService messaging = service().build();

    assertTrue(messaging.publish("order.created", Map.of()));

    assertEquals(1, transport.lastChannel().published.size());
    assertEquals(1, sleeper.sleeps.size());
    assertEquals(CircuitState.CLOSED, messaging.circuitBreaker().state());
  }

  @Test
  void exhaustedRetriesReturnFalseAndCountOneCircuitFailure() {
    transport.refuseConnections(10);
    MessagingService messaging = service().build();

    assertFalse(messaging.publish("order.created", Map.of()));

    assertEquals(3, transport.connectAttempts);
    assertEquals(1, messaging.circuitBreaker().failureCount());
    assertEquals(1, metrics.publishFailure.get());
  }

  @Test
  void openCircuitFailsFastWithCircuitOpenException() {
    transport.refuseConnections(100);
    MessagingService messaging = service()
        .retryPolicy(RetryPolicy.builder().maxAttempts(1).build())
        .circuitBreaker(CircuitBreaker.builder("orders").failureThreshold(2).resetTimeout(Duration.ofMinutes(1)).build())
        .build();

    assertFalse(messaging.publish("order.created", Map.of()));
    assertFalse(messaging.publish("order.created", Map.of()));
    int attemptsBeforeOpen = transport.connectAttempts;

    assertThrows(CircuitOpenException.class, () -> messaging.publish("order.created", Map.of()));
    assertEquals(attemptsBeforeOpen, transport.connectAttempts, "broker not contacted while open");
  }

  @Test
  void invalidPayloadIsNotPublished() {
    SimpleMessageValidator validator = new SimpleMessageValidator();
    validator.registerSchema("order", MessageSchema.builder().required("order_id", FieldType.STRING).build());
    MessagingService messaging = service().validator(validator).build();

    boolean result = messaging.publish(new OutgoingMessage("order.created", Map.of("amount", 5), null, "order"));

    assertFalse(result);
    assertEquals(0, transport.connectAttempts);
  }

  @Test
  void validPayloadPassesSchema() {
    SimpleMessageValidator validator = new SimpleMessageValidator();
    validator.registerSchema("order", MessageSchema.builder().required("order_id", FieldType.STRING).build());
    MessagingService messaging = service().validator(validator).build();

    assertTrue(messaging.publish(new OutgoingMessage("order.created", Map.of("order_id", "o-1"), null, "order")));
  }

  @Test
  void validateMessageThrowsWithFieldErrors() {
    SimpleMessageValidator validator = new SimpleMessageValidator();
    validator.registerSchema("order", MessageSchema.builder().required("order_id", FieldType.STRING).build());
    MessagingService messaging = service().validator(validator).build();

    MessageValidationException thrown = assertThrows(MessageValidationException.class,
        () -> messaging.validateMessage(Map.of(), "order"));

    assertEquals(List.of("The order_id field is required."), thrown.errors().get("order_id"));
  }

  @Test
  void validationIsSkippedWithoutValidator() {
    assertDoesNotThrow(() -> service().build().validateMessage("anything", "order"));
  }

  @Test
  void publishEventWrapsPayloadAndAddsHeaders() {
    MessagingService messaging = service().build();

    assertTrue(messaging.publishEvent("booking.confirmed", Map.of("booking_id", 42)));

    FakeChannel.Published message = transport.lastChannel().published.get(0);
    assertEquals("booking.confirmed", message.routingKey());
    Map<?, ?> body = (Map<?, ?>) SerializationFormat.JSON.serializer().deserialize(message.body());
    assertEquals("booking.confirmed", body.get("event"));
    assertEquals(Map.of("booking_id", 42), body.get("payload"));
    assertNotNull(body.get("timestamp"));
    assertEquals("booking.confirmed", message.properties().header("event_type"));
    assertEquals("application/json", message.properties().header("content_type"));
    assertEquals("json", message.properties().header(SerializationFormat.HEADER));
  }

  @Test
  void switchingFormatChangesEncoding() {
    MessagingService messaging = service().build();
    messaging.setSerializationFormat(SerializationFormat.MSGPACK);

    messaging.publish("order.created", Map.of("id", "x"));

    FakeChannel.Published message = transport.lastChannel().published.get(0);
    assertEquals("application/msgpack", message.properties().contentType());
    assertEquals("msgpack", message.properties().header(SerializationFormat.HEADER));
    assertEquals(Map.of("id", "x"), SerializationFormat.MSGPACK.serializer().deserialize(message.body()));
  }

  // ── Batches ──

  @Test
  void batchCountsInvalidMessagesAsFailures() {
    MessagingService messaging = service().batchSize(2).build();
    List<OutgoingMessage> messages = List.of(
        OutgoingMessage.of("a", Map.of("n", 1)),
        OutgoingMessage.of("b", Map.of("n", 2)),
        OutgoingMessage.of(null, Map.of("n", 3)),
        OutgoingMessage.of("d", null),
        OutgoingMessage.of("e", Map.of("n", 5)));

    assertFalse(messaging.publishBatch(messages));

    List<String> keys = transport.lastChannel().published.stream().map(FakeChannel.Published::routingKey).toList();
    assertEquals(List.of("a", "b", "e"), keys);
  }

  @Test
  void batchSucceedsWhenEveryMessagePublishes() {
    MessagingService messaging = service().batchSize(2).build();
    List<OutgoingMessage> messages = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      messages.add(OutgoingMessage.of("key." + i, Map.of("n", i)));
    }

    assertTrue(messaging.publishBatch(messages));
    assertEquals(5, transport.lastChannel().published.size());
  }

  @Test
  void batchIsTimedAsOneOperation() {
    MessagingService messaging = service().build();

    assertFalse(messaging.publishBatch(List.of(
        OutgoingMessage.of("a", Map.of("n", 1)), OutgoingMessage.of(null, Map.of("n", 2)))));
    assertTrue(messaging.publishBatch(List.of(OutgoingMessage.of("c", Map.of("n", 3)))));

    assertEquals(List.of("publish:success", "publishBatch:failure", "publish:success", "publishBatch:success"),
        metrics.operations);
  }

  @Test
  void emptyBatchSucceeds() {
    assertTrue(service().build().publishBatch(List.of()));
  }

  @Test
  void openCircuitAbortsBatch() {
    transport.refuseConnections(100);
    MessagingService messaging = service()
        .retryPolicy(RetryPolicy.builder().maxAttempts(1).build())
        .circuitBreaker(CircuitBreaker.builder("batch").failureThreshold(1).build())
        .build();

    assertFalse(messaging.publishBatch(List.of(
        OutgoingMessage.of("a", Map.of()), OutgoingMessage.of("b", Map.of()), OutgoingMessage.of("c", Map.of()))));

    assertEquals(1, transport.connectAttempts);
  }

  // ── Queues ──

  @Test
  void setsUpDeadLetterQueue() throws IOException {
    MessagingService messaging = service().build();

    messaging.setupDeadLetterQueue("orders", "orders.dlq", List.of("order.created", "order.updated"));

    FakeChannel channel = transport.lastChannel();
    FakeChannel.Declared dlx = channel.exchanges.get(1);
    assertEquals("orders.dlq.exchange", dlx.name());
    assertEquals(ExchangeType.TOPIC, dlx.type());
    assertTrue(dlx.durable());
    assertTrue(channel.bindings.contains(new FakeChannel.Binding("orders.dlq", "orders.dlq.exchange", "order.created")));
    FakeChannel.QueueDeclared source = channel.queues.get(1);
    assertEquals("orders", source.queue());
    assertEquals("orders.dlq.exchange", source.arguments().get("x-dead-letter-exchange"));
    assertEquals("order.created", source.arguments().get("x-dead-letter-routing-key"));
  }

  @Test
  void deadLetterRoutingKeyFallsBackToSourceName() throws IOException {
    service().build().setupDeadLetterQueue("payments", "payments.dlq", List.of());

    FakeChannel.QueueDeclared source = transport.lastChannel().queues.get(1);
    assertEquals("payments", source.arguments().get("x-dead-letter-routing-key"));
  }

  @Test
  void setsUpPredefinedQueue() throws IOException {
    MessagingService messaging = service()
        .queue("orders", QueueDefinition.of("orders-queue", "order.*"))
        .build();

    messaging.setupPredefinedQueue("orders");

    assertEquals("orders-queue", transport.lastChannel().queues.get(0).queue());
    assertTrue(messaging.consumer().isQueueConfigured("orders-queue"));
  }

  @Test
  void unknownPredefinedQueueIsRejected() {
    MessagingService messaging = service().build();

    IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
        () -> messaging.setupPredefinedQueue("missing"));
    assertEquals("Queue configuration not found: missing", thrown.getMessage());
    assertThrows(IllegalArgumentException.class,
        () -> messaging.consumeFromPredefinedQueue("missing", (d, m) -> true, false, Map.of()));
  }

  // ── Consuming ──

  @Test
  void validationFailureRejectsWithoutRequeue() throws IOException {
    FakeChannel channel = new FakeChannel()
        .deliver("orders", "{\"bad\":true}")
        .deliver("orders", "{\"retry\":true}");
    transport.prepare(channel);
    Consumer consumer = Consumer.builder(connectionManager)
        .settings(ConsumerSettings.builder().requeueOnError(true).build())
        .metrics(metrics)
        .build();
    MessagingService messaging = service().consumer(consumer).build();

    messaging.consume("orders", (data, delivery) -> {
      if (((Map<?, ?>) data).containsKey("bad")) {
        throw new MessageValidationException("invalid", Map.of());
      }
      throw new IllegalStateException("temporary");
    });

    assertEquals(List.of(new FakeChannel.Rejection(1, false), new FakeChannel.Rejection(2, true)), channel.rejects);
    assertTrue(channel.acks.isEmpty());
    assertEquals(List.of("consume:failure", "consume:failure"), metrics.operations);
    assertEquals(0, metrics.consumeSuccess.get());
    assertEquals(2, metrics.consumeFailure.get());
  }

  @Test
  void failedMessageIsRejectedOnceWhenErrorsAreRethrown() throws IOException {
    FakeChannel channel = new FakeChannel()
        .deliver("orders", "{\"n\":1}")
        .deliver("orders", "{\"n\":2}");
    transport.prepare(channel);
    Consumer consumer = Consumer.builder(connectionManager)
        .settings(ConsumerSettings.builder().throwExceptions(true).build())
        .metrics(metrics)
        .build();
    MessagingService messaging = service().consumer(consumer).build();
    List<Object> received = new ArrayList<>();

    messaging.consume("orders", (data, delivery) -> {
      received.add(data);
      if (received.size() == 1) {
        throw new IllegalStateException("first fails");
      }
      return true;
    });

    assertEquals(List.of(new FakeChannel.Rejection(1, false)), channel.rejects);
    assertEquals(List.of(2L), channel.acks);
    assertEquals(1, metrics.consumeSuccess.get());
    assertEquals(1, metrics.consumeFailure.get());
  }

  @Test
  void consumedMessagesAreAcknowledgedAndTimed() throws IOException {
    FakeChannel channel = new FakeChannel().deliver("orders", "{\"id\":1}");
    transport.prepare(channel);
    MessagingService messaging = service().build();
    List<Object> received = new ArrayList<>();

    messaging.consume("orders", (data, delivery) -> received.add(data));

    assertEquals(List.of(Map.of("id", 1)), received);
    assertEquals(List.of(1L), channel.acks);
    assertEquals(List.of("consume:success"), metrics.operations);
  }

  @Test
  void consumesPredefinedQueueWithMergedArguments() throws IOException {
    FakeChannel channel = new FakeChannel();
    transport.prepare(channel);
    MessagingService messaging = service()
        .queue("orders", new QueueDefinition("orders-queue", List.of("order.*"), true, false, Map.of("x-max-length", 100)))
        .build();

    messaging.consumeFromPredefinedQueue("orders", (d, m) -> true, false, Map.of("x-queue-type", "quorum"));

    Map<String, Object> arguments = channel.queues.get(0).arguments();
    assertEquals(100, arguments.get("x-max-length"));
    assertEquals("quorum", arguments.get("x-queue-type"));
    assertTrue(channel.consumers.containsKey("orders-queue"));
  }

  @Test
  void pullAndSettlePassThrough() {
    FakeChannel channel = new FakeChannel();
    transport.prepare(channel);
    MessagingService messaging = service().build();
    channel.enqueueForGet("{}");

    Delivery delivery = messaging.getMessageFromQueue("orders");
    messaging.reject(delivery, true);

    assertEquals(List.of(new FakeChannel.Rejection(delivery.deliveryTag(), true)), channel.rejects);
  }

  @Test
  void closeReleasesConnection() {
    MessagingService messaging = service().build();
    messaging.publish("order.created", Map.of());

    messaging.close();

    assertFalse(connectionManager.isConnected());
  }
}
