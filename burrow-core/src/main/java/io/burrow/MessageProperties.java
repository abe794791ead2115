package io.burrow;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable AMQP basic properties of a message, plus its application headers.
 *
 * <p>Every property is optional; {@code null} means "not set". Use {@link #merge} to layer
 * caller-supplied properties over defaults.
 */
public final class MessageProperties {
  /** Delivery mode 1: the broker may keep the message in memory only. */
  public static final int NON_PERSISTENT = 1;
  /** Delivery mode 2: the broker writes the message to disk on durable queues. */
  public static final int PERSISTENT = 2;

  /** Properties with nothing set. */
  public static final MessageProperties EMPTY = builder().build();

  private final String contentType;
  private final String contentEncoding;
  private final String messageId;
  private final Integer deliveryMode;
  private final String correlationId;
  private final String replyTo;
  private final String expiration;
  private final Integer priority;
  private final Instant timestamp;
  private final String type;
  private final String userId;
  private final String appId;
  private final Map<String, Object> headers;

  private MessageProperties(Builder builder) {
    if (builder.deliveryMode != null
        && builder.deliveryMode != NON_PERSISTENT && builder.deliveryMode != PERSISTENT) {
      throw new IllegalArgumentException("deliveryMode must be 1 or 2, got: " + builder.deliveryMode);
    }
    if (builder.priority != null && (builder.priority < 0 || builder.priority > 255)) {
      throw new IllegalArgumentException("priority must be within [0, 255], got: " + builder.priority);
    }
    this.contentType = builder.contentType;
    this.contentEncoding = builder.contentEncoding;
    this.messageId = builder.messageId;
    this.deliveryMode = builder.deliveryMode;
    this.correlationId = builder.correlationId;
    this.replyTo = builder.replyTo;
    this.expiration = builder.expiration;
    this.priority = builder.priority;
    this.timestamp = builder.timestamp;
    this.type = builder.type;
    this.userId = builder.userId;
    this.appId = builder.appId;
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder pre-populated with this instance's values.
   */
  public Builder toBuilder() {
    Builder b = new Builder()
        .contentType(contentType)
        .contentEncoding(contentEncoding)
        .messageId(messageId)
        .deliveryMode(deliveryMode)
        .correlationId(correlationId)
        .replyTo(replyTo)
        .expiration(expiration)
        .priority(priority)
        .timestamp(timestamp)
        .type(type)
        .userId(userId)
        .appId(appId);
    b.headers.putAll(headers);
    return b;
  }

  /**
   * Layers {@code overrides} on top of this instance: every property set in
   * {@code overrides} wins, and headers are merged key by key with the override's value
   * taking precedence.
   */
  public MessageProperties merge(MessageProperties overrides) {
    if (overrides == null) {
      return this;
    }
    Builder b = toBuilder();
    if (overrides.contentType != null) b.contentType(overrides.contentType);
    if (overrides.contentEncoding != null) b.contentEncoding(overrides.contentEncoding);
    if (overrides.messageId != null) b.messageId(overrides.messageId);
    if (overrides.deliveryMode != null) b.deliveryMode(overrides.deliveryMode);
    if (overrides.correlationId != null) b.correlationId(overrides.correlationId);
    if (overrides.replyTo != null) b.replyTo(overrides.replyTo);
    if (overrides.expiration != null) b.expiration(overrides.expiration);
    if (overrides.priority != null) b.priority(overrides.priority);
    if (overrides.timestamp != null) b.timestamp(overrides.timestamp);
    if (overrides.type != null) b.type(overrides.type);
    if (overrides.userId != null) b.userId(overrides.userId);
    if (overrides.appId != null) b.appId(overrides.appId);
    b.headers.putAll(overrides.headers);
    return b.build();
  }

  public String contentType() {
    return contentType;
  }

  public String contentEncoding() {
    return contentEncoding;
  }

  public String messageId() {
    return messageId;
  }

  public Integer deliveryMode() {
    return deliveryMode;
  }

  public String correlationId() {
    return correlationId;
  }

  public String replyTo() {
    return replyTo;
  }

  public String expiration() {
    return expiration;
  }

  public Integer priority() {
    return priority;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public String type() {
    return type;
  }

  public String userId() {
    return userId;
  }

  public String appId() {
    return appId;
  }

  /**
   * Application headers, sent as the AMQP headers table. Never null.
   */
  public Map<String, Object> headers() {
    return headers;
  }

  /**
   * Returns a header value rendered as a string, or {@code null} when absent.
   */
  public String header(String name) {
    Object value = headers.get(name);
    return value == null ? null : value.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof MessageProperties that)) return false;
    return Objects.equals(contentType, that.contentType)
        && Objects.equals(contentEncoding, that.contentEncoding)
        && Objects.equals(messageId, that.messageId)
        && Objects.equals(deliveryMode, that.deliveryMode)
        && Objects.equals(correlationId, that.correlationId)
        && Objects.equals(replyTo, that.replyTo)
        && Objects.equals(expiration, that.expiration)
        && Objects.equals(priority, that.priority)
        && Objects.equals(timestamp, that.timestamp)
        && Objects.equals(type, that.type)
        && Objects.equals(userId, that.userId)
        && Objects.equals(appId, that.appId)
        && headers.equals(that.headers);
  }

  @Override
  public int hashCode() {
    return Objects.hash(contentType, messageId, deliveryMode, correlationId, type, headers);
  }

  @Override
  public String toString() {
    return "MessageProperties{contentType=" + contentType + ", messageId=" + messageId
        + ", deliveryMode=" + deliveryMode + ", headers=" + headers + "}";
  }

  /**
   * Builder for {@link MessageProperties}.
   */
  public static final class Builder {
    private String contentType;
    private String contentEncoding;
    private String messageId;
    private Integer deliveryMode;
    private String correlationId;
    private String replyTo;
    private String expiration;
    private Integer priority;
    private Instant timestamp;
    private String type;
    private String userId;
    private String appId;
    private final Map<String, Object> headers = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder contentType(String contentType) {
      this.contentType = contentType;
      return this;
    }

    public Builder contentEncoding(String contentEncoding) {
      this.contentEncoding = contentEncoding;
      return this;
    }

    public Builder messageId(String messageId) {
      this.messageId = messageId;
      return this;
    }

    /** {@link #PERSISTENT} or {@link #NON_PERSISTENT}. */
    public Builder deliveryMode(Integer deliveryMode) {
      this.deliveryMode = deliveryMode;
      return this;
    }

    public Builder correlationId(String correlationId) {
      this.correlationId = correlationId;
      return this;
    }

    public Builder replyTo(String replyTo) {
      this.replyTo = replyTo;
      return this;
    }

    /** Per-message TTL in milliseconds, as a decimal string. */
    public Builder expiration(String expiration) {
      this.expiration = expiration;
      return this;
    }

    public Builder priority(Integer priority) {
      this.priority = priority;
      return this;
    }

    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder appId(String appId) {
      this.appId = appId;
      return this;
    }

    public Builder header(String name, Object value) {
      this.headers.put(Objects.requireNonNull(name, "name"), value);
      return this;
    }

    public Builder headers(Map<String, ?> headers) {
      if (headers != null) {
        headers.forEach(this::header);
      }
      return this;
    }

    public MessageProperties build() {
      return new MessageProperties(this);
    }
  }
}
