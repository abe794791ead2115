package io.burrow.consume;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for the consume loop and its recovery behavior.
 */
public final class ConsumerSettings {
  private final int prefetchCount;
  private final Duration waitTimeout;
  private final Duration reconnectDelay;
  private final int reconnectMaxRetries;
  private final boolean stopOnCriticalError;
  private final boolean requeueOnError;
  private final boolean throwExceptions;
  private final boolean autoAck;

  private ConsumerSettings(Builder builder) {
    if (builder.prefetchCount < 0) {
      throw new IllegalArgumentException("prefetchCount must be >= 0, got: " + builder.prefetchCount);
    }
    if (builder.reconnectMaxRetries < 0) {
      throw new IllegalArgumentException("reconnectMaxRetries must be >= 0, got: " + builder.reconnectMaxRetries);
    }
    Objects.requireNonNull(builder.waitTimeout, "waitTimeout");
    Objects.requireNonNull(builder.reconnectDelay, "reconnectDelay");
    if (builder.waitTimeout.isNegative() || builder.reconnectDelay.isNegative()) {
      throw new IllegalArgumentException("waitTimeout and reconnectDelay must not be negative");
    }
    this.prefetchCount = builder.prefetchCount;
    this.waitTimeout = builder.waitTimeout;
    this.reconnectDelay = builder.reconnectDelay;
    this.reconnectMaxRetries = builder.reconnectMaxRetries;
    this.stopOnCriticalError = builder.stopOnCriticalError;
    this.requeueOnError = builder.requeueOnError;
    this.throwExceptions = builder.throwExceptions;
    this.autoAck = builder.autoAck;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ConsumerSettings defaults() {
    return builder().build();
  }

  /** Unacknowledged deliveries the broker may push at once; 0 means unlimited. */
  public int prefetchCount() {
    return prefetchCount;
  }

  /** How long one wait for deliveries may block; zero blocks until a delivery arrives. */
  public Duration waitTimeout() {
    return waitTimeout;
  }

  /** Delay before the first reconnect attempt; doubled after each failed attempt. */
  public Duration reconnectDelay() {
    return reconnectDelay;
  }

  public int reconnectMaxRetries() {
    return reconnectMaxRetries;
  }

  public boolean stopOnCriticalError() {
    return stopOnCriticalError;
  }

  public boolean requeueOnError() {
    return requeueOnError;
  }

  public boolean throwExceptions() {
    return throwExceptions;
  }

  public boolean autoAck() {
    return autoAck;
  }

  /**
   * Builder for {@link ConsumerSettings}.
   */
  public static final class Builder {
    private int prefetchCount = 1;
    private Duration waitTimeout = Duration.ZERO;
    private Duration reconnectDelay = Duration.ofSeconds(5);
    private int reconnectMaxRetries = 3;
    private boolean stopOnCriticalError;
    private boolean requeueOnError;
    private boolean throwExceptions;
    private boolean autoAck;

    private Builder() {
    }

    /** Optional. Defaults to 1. */
    public Builder prefetchCount(int prefetchCount) {
      this.prefetchCount = prefetchCount;
      return this;
    }

    /** Optional. Defaults to zero (block indefinitely). */
    public Builder waitTimeout(Duration waitTimeout) {
      this.waitTimeout = waitTimeout;
      return this;
    }

    /** Optional. Defaults to 5 seconds. */
    public Builder reconnectDelay(Duration reconnectDelay) {
      this.reconnectDelay = reconnectDelay;
      return this;
    }

    /** Optional. Defaults to 3. */
    public Builder reconnectMaxRetries(int reconnectMaxRetries) {
      this.reconnectMaxRetries = reconnectMaxRetries;
      return this;
    }

    /** Optional. Close the channel and stop on a non-connection error. Defaults to {@code false}. */
    public Builder stopOnCriticalError(boolean stopOnCriticalError) {
      this.stopOnCriticalError = stopOnCriticalError;
      return this;
    }

    /** Optional. Requeue messages whose handler failed. Defaults to {@code false}. */
    public Builder requeueOnError(boolean requeueOnError) {
      this.requeueOnError = requeueOnError;
      return this;
    }

    /** Optional. Rethrow handler failures into the consume loop. Defaults to {@code false}. */
    public Builder throwExceptions(boolean throwExceptions) {
      this.throwExceptions = throwExceptions;
      return this;
    }

    /** Optional. Default acknowledgement mode for consumers. Defaults to {@code false}. */
    public Builder autoAck(boolean autoAck) {
      this.autoAck = autoAck;
      return this;
    }

    public ConsumerSettings build() {
      return new ConsumerSettings(this);
    }
  }
}
