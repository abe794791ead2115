package io.burrow;

import io.burrow.connection.ConnectionManager;
import io.burrow.consume.Consumer;
import io.burrow.publish.PublishFailedException;
import io.burrow.publish.Publisher;
import io.burrow.resilience.CircuitBreaker;
import io.burrow.resilience.CircuitOpenException;
import io.burrow.resilience.RetryPolicy;
import io.burrow.serialization.SerializationFormat;
import io.burrow.spi.BrokerChannel;
import io.burrow.spi.ExchangeType;
import io.burrow.spi.MetricsExporter;
import io.burrow.telemetry.Telemetry;
import io.burrow.validation.MessageValidationException;
import io.burrow.validation.MessageValidator;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for publishing and consuming with retries, a circuit breaker, validation
 * and telemetry.
 *
 * <p>Every {@link #publish} runs as
 * {@code circuitBreaker.execute(() -> retryPolicy.execute(() -> publisher.publish(...)))}:
 * the retry policy absorbs transient failures, and only an exhausted retry sequence counts
 * as one failure towards opening the circuit. While the circuit is open, publishes fail
 * fast with {@link CircuitOpenException}; every other failure is reported as {@code false}.
 *
 * <p>Published messages carry a {@value SerializationFormat#HEADER} header naming the current
 * {@link #serializationFormat()} unless the caller set one. Consumed messages are decoded
 * according to their
 * {@value SerializationFormat#HEADER} header and handed to the callback. A callback that
 * throws {@link MessageValidationException} gets its message rejected without requeue;
 * other failures requeue per {@link io.burrow.consume.ConsumerSettings#requeueOnError()}.
 *
 * <pre>{@code
 * MessagingService messaging = MessagingService.builder()
 *     .connectionManager(ConnectionManager.builder().transport(new RabbitTransport()).build())
 *     .build();
 * messaging.publish("order.created", Map.of("order_id", "o-1"));
 * }</pre>
 *
 * @see MessagingService.Builder
 */
public final class MessagingService implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MessagingService.class.getName());

  /** Name of the circuit breaker guarding publishes. */
  public static final String PUBLISHER_CIRCUIT = "burrow-publisher";

  private final ConnectionManager connectionManager;
  private final Publisher publisher;
  private final Consumer consumer;
  private final MessageValidator validator;
  private final RetryPolicy retryPolicy;
  private final CircuitBreaker circuitBreaker;
  private final Telemetry telemetry;
  private final MetricsExporter metrics;
  private final int batchSize;
  private final Map<String, QueueDefinition> queues;
  private volatile SerializationFormat serializationFormat;

  private MessagingService(Builder builder) {
    this.connectionManager = Objects.requireNonNull(builder.connectionManager, "connectionManager");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.serializationFormat = builder.serializationFormat != null
        ? builder.serializationFormat : SerializationFormat.JSON;
    this.publisher = builder.publisher != null
        ? builder.publisher
        : Publisher.builder(connectionManager).serializationFormat(serializationFormat).debug(builder.debug).build();
    this.consumer = builder.consumer != null
        ? builder.consumer
        : Consumer.builder(connectionManager).metrics(metrics).debug(builder.debug).build();
    this.validator = builder.validator;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : RetryPolicy.builder().metrics(metrics).build();
    this.circuitBreaker = builder.circuitBreaker != null
        ? builder.circuitBreaker : CircuitBreaker.builder(PUBLISHER_CIRCUIT).metrics(metrics).build();
    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1, got: " + builder.batchSize);
    }
    this.batchSize = builder.batchSize;
    this.queues = Collections.unmodifiableMap(new LinkedHashMap<>(builder.queues));
    this.telemetry = new Telemetry(metrics);
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Publishing ──

  public boolean publish(String routingKey, Object data) {
    return publish(OutgoingMessage.of(routingKey, data));
  }

  public boolean publish(String routingKey, Object data, MessageProperties properties) {
    return publish(OutgoingMessage.of(routingKey, data, properties));
  }

  /**
   * Validates (when the message names a schema) and publishes one message through the
   * circuit breaker and retry policy.
   *
   * @return {@code true} if the message was published
   * @throws CircuitOpenException if the publisher circuit is open
   */
  public boolean publish(OutgoingMessage message) {
    Objects.requireNonNull(message, "message");
    String routingKey = message.routingKey();
    Map<String, Object> context = context("routingKey", routingKey,
        "exchange", connectionManager.getExchangeName());
    Telemetry.Operation operation = telemetry.start("publish");
    try {
      if (message.schema() != null) {
        validateMessage(message.data(), message.schema());
      }
      MessageProperties properties = withFormatHeader(message.properties());
      circuitBreaker.execute(() -> retryPolicy.execute(() -> {
        if (!publisher.publish(routingKey, message.data(), properties)) {
          throw new PublishFailedException(routingKey);
        }
        return Boolean.TRUE;
      }));
      operation.success(context);
      metrics.incrementPublishSuccess();
      return true;
    } catch (CircuitOpenException e) {
      logger.log(Level.WARNING, "Circuit open, message not published, routingKey=" + routingKey
          + ", circuitState=" + circuitBreaker.state());
      operation.failure(e, context);
      metrics.incrementPublishFailure();
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      operation.failure(e, context);
      metrics.incrementPublishFailure();
      return false;
    } catch (Exception e) {
      logger.log(Level.SEVERE, "Failed to publish message, routingKey=" + routingKey
          + ", error=" + e.getMessage(), e);
      operation.failure(e, context);
      metrics.incrementPublishFailure();
      return false;
    }
  }

  /**
   * Publishes a domain event: the payload is wrapped as {@code {event, timestamp, payload}},
   * the event name is the routing key, and {@code event_type}, {@code content_type} and
   * {@value SerializationFormat#HEADER} headers are added.
   */
  public boolean publishEvent(String eventName, Map<String, ?> payload, MessageProperties properties) {
    Objects.requireNonNull(eventName, "eventName");
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("event", eventName);
    data.put("timestamp", Instant.now().toString());
    data.put("payload", payload);
    SerializationFormat format = serializationFormat;
    MessageProperties eventHeaders = MessageProperties.builder()
        .header("event_type", eventName)
        .header("content_type", format.contentType())
        .header(SerializationFormat.HEADER, format.key())
        .build();
    MessageProperties base = properties != null ? properties : MessageProperties.EMPTY;
    return publish(eventName, data, base.merge(eventHeaders));
  }

  public boolean publishEvent(String eventName, Map<String, ?> payload) {
    return publishEvent(eventName, payload, null);
  }

  /**
   * Publishes {@code messages} one by one, in chunks of the configured batch size.
   * Messages without a routing key or data count as failures and are skipped. An open
   * circuit stops the batch; the remaining messages count as failures.
   *
   * @return {@code true} only if every message was published
   */
  public boolean publishBatch(List<OutgoingMessage> messages) {
    Objects.requireNonNull(messages, "messages");
    Telemetry.Operation operation = telemetry.start("publishBatch");
    int total = messages.size();
    int successCount = 0;
    int failedCount = 0;
    for (int start = 0; start < total; start += batchSize) {
      List<OutgoingMessage> chunk = messages.subList(start, Math.min(start + batchSize, total));
      for (OutgoingMessage message : chunk) {
        if (message == null || !message.hasRoutingKey() || message.data() == null) {
          logger.log(Level.WARNING, "Skipping invalid batch message: routing key and data are required");
          failedCount++;
          continue;
        }
        try {
          if (publish(message)) {
            successCount++;
          } else {
            failedCount++;
          }
        } catch (CircuitOpenException e) {
          logger.log(Level.WARNING, "Circuit open, aborting batch, unpublished="
              + (total - successCount - failedCount));
          operation.failure(e, batchContext(total, successCount, failedCount));
          return false;
        }
      }
      if (total > batchSize) {
        logger.log(Level.INFO, "Batch progress, processed=" + (successCount + failedCount)
            + ", total=" + total + ", successCount=" + successCount + ", failedCount=" + failedCount);
      }
    }
    Map<String, Object> context = batchContext(total, successCount, failedCount);
    if (failedCount == 0) {
      operation.success(context);
      return true;
    }
    operation.failure(null, context);
    return false;
  }

  /**
   * Validates {@code data} against {@code schemaName}. Does nothing when no validator is
   * configured.
   *
   * @throws MessageValidationException                 if the payload is invalid
   * @throws io.burrow.validation.SchemaNotFoundException if the schema is unknown
   */
  public void validateMessage(Object data, String schemaName) {
    if (validator == null) {
      return;
    }
    if (!(data instanceof Map<?, ?> map)) {
      throw new MessageValidationException("Payload must be a map to validate against schema " + schemaName,
          Map.of("payload", List.of("The payload must be an object.")));
    }
    @SuppressWarnings("unchecked")
    Map<String, ?> fields = (Map<String, ?>) map;
    if (!validator.validate(fields, schemaName)) {
      throw new MessageValidationException("Message validation failed for schema " + schemaName,
          validator.errors());
    }
  }

  // ── Queues and consuming ──

  public MessagingService setupQueue(String queueName, List<String> bindingKeys, boolean durable,
                                     boolean autoDelete, Map<String, Object> arguments) throws IOException {
    consumer.setupQueue(queueName, bindingKeys, durable, autoDelete, arguments);
    return this;
  }

  /**
   * Declares a dead-letter exchange {@code <deadLetterQueue>.exchange} (durable topic), a
   * dead-letter queue bound to it, and {@code sourceQueue} with dead-lettering pointed at it.
   * Rejected or expired messages of {@code sourceQueue} are routed with the first binding
   * key, or the source queue name when there are none.
   */
  public MessagingService setupDeadLetterQueue(String sourceQueue, String deadLetterQueue,
                                               List<String> bindingKeys) throws IOException {
    Objects.requireNonNull(sourceQueue, "sourceQueue");
    Objects.requireNonNull(deadLetterQueue, "deadLetterQueue");
    List<String> keys = bindingKeys == null ? List.of() : bindingKeys;
    String deadLetterExchange = deadLetterQueue + ".exchange";
    String deadLetterRoutingKey = keys.isEmpty() ? sourceQueue : keys.get(0);

    connectionManager.declareExchange(deadLetterExchange, ExchangeType.TOPIC, true, false);
    BrokerChannel channel = connectionManager.getChannel();
    channel.queueDeclare(deadLetterQueue, false, true, false, false, Map.of());
    channel.queueBind(deadLetterQueue, deadLetterExchange, deadLetterRoutingKey);

    Map<String, Object> arguments = new LinkedHashMap<>();
    arguments.put("x-dead-letter-exchange", deadLetterExchange);
    arguments.put("x-dead-letter-routing-key", deadLetterRoutingKey);
    consumer.setupQueue(sourceQueue, keys, true, false, arguments);
    logger.log(Level.INFO, "Dead letter queue set up, sourceQueue=" + sourceQueue
        + ", deadLetterQueue=" + deadLetterQueue + ", deadLetterExchange=" + deadLetterExchange);
    return this;
  }

  /**
   * Declares the queue configured under {@code key}.
   *
   * @throws IllegalArgumentException if no queue is configured under {@code key}
   */
  public MessagingService setupPredefinedQueue(String key) throws IOException {
    QueueDefinition definition = queueDefinition(key);
    consumer.setupQueue(definition.name(), definition.bindingKeys(), definition.durable(),
        definition.autoDelete(), definition.arguments());
    return this;
  }

  /**
   * Consumes the queue configured under {@code key}; {@code extraArguments} are added to the
   * configured queue arguments.
   *
   * @throws IllegalArgumentException if no queue is configured under {@code key}
   */
  public void consumeFromPredefinedQueue(String key, MessageCallback callback, boolean autoAck,
                                         Map<String, Object> extraArguments) throws IOException {
    QueueDefinition definition = queueDefinition(key);
    Map<String, Object> arguments = new LinkedHashMap<>(definition.arguments());
    if (extraArguments != null) {
      arguments.putAll(extraArguments);
    }
    consume(definition.name(), callback, definition.bindingKeys(), autoAck, arguments);
  }

  public void consume(String queueName, MessageCallback callback) throws IOException {
    consume(queueName, callback, List.of(), consumer.settings().autoAck(), Map.of());
  }

  /**
   * Consumes {@code queueName}, blocking the calling thread.
   *
   * @see Consumer#consume(String, MessageCallback, List, boolean, Map)
   */
  public void consume(String queueName, MessageCallback callback, List<String> bindingKeys,
                      boolean autoAck, Map<String, Object> arguments) throws IOException {
    Objects.requireNonNull(callback, "callback");
    consumer.consume(queueName, instrument(queueName, callback), bindingKeys, autoAck, arguments);
  }

  public Delivery getMessageFromQueue(String queueName) {
    return consumer.getMessageFromQueue(queueName);
  }

  public void acknowledge(Delivery delivery) {
    consumer.acknowledge(delivery);
  }

  public void reject(Delivery delivery, boolean requeue) {
    consumer.reject(delivery, requeue);
  }

  public void closeConnection() {
    connectionManager.closeConnection();
  }

  @Override
  public void close() {
    closeConnection();
  }

  // ── Accessors ──

  public SerializationFormat serializationFormat() {
    return serializationFormat;
  }

  /**
   * Switches the format used for subsequent publishes.
   */
  public void setSerializationFormat(SerializationFormat serializationFormat) {
    this.serializationFormat = Objects.requireNonNull(serializationFormat, "serializationFormat");
  }

  public ConnectionManager connectionManager() {
    return connectionManager;
  }

  public Publisher publisher() {
    return publisher;
  }

  public Consumer consumer() {
    return consumer;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  public CircuitBreaker circuitBreaker() {
    return circuitBreaker;
  }

  public MessageValidator validator() {
    return validator;
  }

  public Map<String, QueueDefinition> queueDefinitions() {
    return queues;
  }

  private QueueDefinition queueDefinition(String key) {
    QueueDefinition definition = queues.get(key);
    if (definition == null) {
      throw new IllegalArgumentException("Queue configuration not found: " + key);
    }
    return definition;
  }

  private MessageProperties withFormatHeader(MessageProperties properties) {
    SerializationFormat format = serializationFormat;
    if (properties.header(SerializationFormat.HEADER) != null) {
      return properties;
    }
    return properties.toBuilder().header(SerializationFormat.HEADER, format.key()).build();
  }

  /**
   * Times the callback. Settling a failed delivery is left to the consumer, so every
   * message is acknowledged or rejected exactly once.
   */
  private MessageCallback instrument(String queueName, MessageCallback callback) {
    return (data, delivery) -> {
      String messageId = delivery.properties().messageId() != null
          ? delivery.properties().messageId() : publisher.generateMessageId();
      Map<String, Object> context = context("queue", queueName, "messageId", messageId,
          "routingKey", delivery.routingKey());
      Telemetry.Operation operation = telemetry.start("consume");
      try {
        boolean handled = callback.onMessage(data, delivery);
        operation.success(context);
        return handled;
      } catch (Exception e) {
        operation.failure(e, context);
        throw e;
      }
    };
  }

  private static Map<String, Object> batchContext(int total, int successCount, int failedCount) {
    return context("total", total, "processed", successCount + failedCount,
        "successCount", successCount, "failedCount", failedCount);
  }

  private static Map<String, Object> context(Object... keyValues) {
    Map<String, Object> context = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keyValues.length; i += 2) {
      context.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
    }
    return context;
  }

  /**
   * Builder for {@link MessagingService}.
   */
  public static final class Builder {
    private ConnectionManager connectionManager;
    private Publisher publisher;
    private Consumer consumer;
    private MessageValidator validator;
    private RetryPolicy retryPolicy;
    private CircuitBreaker circuitBreaker;
    private MetricsExporter metrics;
    private SerializationFormat serializationFormat;
    private int batchSize = 100;
    private final Map<String, QueueDefinition> queues = new LinkedHashMap<>();
    private boolean debug;

    private Builder() {
    }

    /** Required. */
    public Builder connectionManager(ConnectionManager connectionManager) {
      this.connectionManager = connectionManager;
      return this;
    }

    /** Optional. Defaults to a JSON {@link Publisher} on the connection manager. */
    public Builder publisher(Publisher publisher) {
      this.publisher = publisher;
      return this;
    }

    /** Optional. Defaults to a {@link Consumer} with default settings. */
    public Builder consumer(Consumer consumer) {
      this.consumer = consumer;
      return this;
    }

    /** Optional. Without a validator, schema names are ignored. */
    public Builder validator(MessageValidator validator) {
      this.validator = validator;
      return this;
    }

    /** Optional. Defaults to {@link RetryPolicy#defaults()}. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Optional. Defaults to a breaker named {@value MessagingService#PUBLISHER_CIRCUIT}. */
    public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
      this.circuitBreaker = circuitBreaker;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to {@link SerializationFormat#JSON}. */
    public Builder serializationFormat(SerializationFormat serializationFormat) {
      this.serializationFormat = serializationFormat;
      return this;
    }

    /** Optional. Chunk size for {@link MessagingService#publishBatch}. Defaults to 100. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Optional. Registers a predefined queue under {@code key}. */
    public Builder queue(String key, QueueDefinition definition) {
      this.queues.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(definition, "definition"));
      return this;
    }

    /** Optional. Defaults to {@code false}. */
    public Builder debug(boolean debug) {
      this.debug = debug;
      return this;
    }

    public MessagingService build() {
      return new MessagingService(this);
    }
  }
}
