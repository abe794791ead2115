package io.burrow.resilience;

import io.burrow.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Three-state circuit breaker guarding calls to an unreliable dependency.
 *
 * <p>In {@link CircuitState#CLOSED} every failure increments a counter; reaching
 * {@code failureThreshold} opens the circuit. While {@link CircuitState#OPEN}, calls fail
 * fast with {@link CircuitOpenException} until {@code resetTimeout} has elapsed since the
 * last failure, after which the next call runs as a {@link CircuitState#HALF_OPEN} trial call:
 * success closes the circuit, failure reopens it.
 *
 * <p>State transitions are guarded by this instance's monitor. The operation itself runs
 * outside the lock, so concurrent callers in HALF_OPEN may all be let through.
 */
public final class CircuitBreaker {
  private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

  private final String name;
  private final int failureThreshold;
  private final Duration resetTimeout;
  private final Clock clock;
  private final MetricsExporter metrics;

  private CircuitState state = CircuitState.CLOSED;
  private int failureCount;
  private Instant lastFailureTime;

  private CircuitBreaker(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    if (builder.failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + builder.failureThreshold);
    }
    Objects.requireNonNull(builder.resetTimeout, "resetTimeout");
    if (builder.resetTimeout.isNegative()) {
      throw new IllegalArgumentException("resetTimeout must not be negative");
    }
    this.failureThreshold = builder.failureThreshold;
    this.resetTimeout = builder.resetTimeout;
    this.clock = Objects.requireNonNull(builder.clock, "clock");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Runs {@code operation} if the circuit allows it.
   *
   * @return the operation's result
   * @throws CircuitOpenException if the circuit is open and the reset timeout has not elapsed
   * @throws Exception            the operation's own failure, unchanged
   */
  public <T> T execute(Callable<T> operation) throws Exception {
    Objects.requireNonNull(operation, "operation");
    checkState();
    T result;
    try {
      result = operation.call();
    } catch (Exception e) {
      recordFailure();
      throw e;
    }
    recordSuccess();
    return result;
  }

  /**
   * Forces the circuit back to CLOSED and clears the failure history.
   */
  public synchronized void reset() {
    CircuitState previous = state;
    state = CircuitState.CLOSED;
    failureCount = 0;
    lastFailureTime = null;
    if (previous != CircuitState.CLOSED) {
      logger.log(Level.INFO, "Circuit " + name + " closed");
      metrics.recordCircuitState(name, CircuitState.CLOSED);
    }
  }

  public synchronized CircuitState state() {
    return state;
  }

  public synchronized int failureCount() {
    return failureCount;
  }

  public String name() {
    return name;
  }

  public int failureThreshold() {
    return failureThreshold;
  }

  public Duration resetTimeout() {
    return resetTimeout;
  }

  private synchronized void checkState() {
    if (state != CircuitState.OPEN) {
      return;
    }
    Duration elapsed = Duration.between(lastFailureTime, clock.instant());
    if (elapsed.compareTo(resetTimeout) >= 0) {
      state = CircuitState.HALF_OPEN;
      logger.log(Level.INFO, "Circuit " + name + " transitioning from OPEN to HALF_OPEN");
      metrics.recordCircuitState(name, CircuitState.HALF_OPEN);
      return;
    }
    metrics.incrementCircuitRejections(name);
    throw new CircuitOpenException(name, state);
  }

  private synchronized void recordSuccess() {
    if (state == CircuitState.HALF_OPEN) {
      reset();
    }
  }

  private synchronized void recordFailure() {
    failureCount++;
    lastFailureTime = clock.instant();
    if (state == CircuitState.HALF_OPEN
        || (state == CircuitState.CLOSED && failureCount >= failureThreshold)) {
      state = CircuitState.OPEN;
      logger.log(Level.WARNING, "Circuit " + name + " opened, failureCount=" + failureCount
          + ", threshold=" + failureThreshold);
      metrics.recordCircuitState(name, CircuitState.OPEN);
    }
  }

  /**
   * Builder for {@link CircuitBreaker}.
   */
  public static final class Builder {
    private final String name;
    private int failureThreshold = 5;
    private Duration resetTimeout = Duration.ofSeconds(30);
    private Clock clock = Clock.systemUTC();
    private MetricsExporter metrics;

    private Builder(String name) {
      this.name = name;
    }

    /** Optional. Defaults to 5 consecutive failures. */
    public Builder failureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
      return this;
    }

    /** Optional. Defaults to 30 seconds. */
    public Builder resetTimeout(Duration resetTimeout) {
      this.resetTimeout = resetTimeout;
      return this;
    }

    /** Optional. Defaults to the system UTC clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public CircuitBreaker build() {
      return new CircuitBreaker(this);
    }
  }
}
