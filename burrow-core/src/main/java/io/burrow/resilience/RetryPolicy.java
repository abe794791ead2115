package io.burrow.resilience;

import io.burrow.spi.MetricsExporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs an operation up to {@code maxAttempts} times with exponential backoff and jitter.
 *
 * <p>Delay before retry {@code n}: {@code min(maxDelay, baseDelay * 2^(n-1))}, then
 * shifted by a uniform jitter in {@code [-delay * jitterFactor, +delay * jitterFactor]}
 * and clamped to {@code [0, maxDelay]}.
 *
 * <p>Only failures whose type is assignable to one of the retryable kinds are retried.
 * Any other failure, and the failure of the last attempt, is rethrown unchanged without
 * a delay. The policy keeps no state between invocations and is safe to share.
 *
 * @see CircuitBreaker
 */
public final class RetryPolicy {
  private static final Logger logger = Logger.getLogger(RetryPolicy.class.getName());

  private static final List<Class<? extends Throwable>> DEFAULT_RETRYABLE = List.of(Exception.class);

  private final int maxAttempts;
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitterFactor;
  private final Sleeper sleeper;
  private final MetricsExporter metrics;

  private RetryPolicy(Builder builder) {
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + builder.maxAttempts);
    }
    if (builder.baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + builder.baseDelayMs);
    }
    if (builder.maxDelayMs < builder.baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + builder.maxDelayMs);
    }
    if (builder.jitterFactor < 0.0 || builder.jitterFactor > 1.0) {
      throw new IllegalArgumentException("jitterFactor must be within [0, 1], got: " + builder.jitterFactor);
    }
    this.maxAttempts = builder.maxAttempts;
    this.baseDelayMs = builder.baseDelayMs;
    this.maxDelayMs = builder.maxDelayMs;
    this.jitterFactor = builder.jitterFactor;
    this.sleeper = Objects.requireNonNull(builder.sleeper, "sleeper");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  /**
   * Policy with the default settings: 3 attempts, 100 ms base delay, 5000 ms cap, 0.2 jitter.
   */
  public static RetryPolicy defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs {@code operation}, retrying any {@link Exception}.
   */
  public <T> T execute(Callable<T> operation) throws Exception {
    return execute(operation, DEFAULT_RETRYABLE, RetryListener.NONE);
  }

  /**
   * Runs {@code operation}, retrying failures assignable to one of {@code retryableKinds}.
   *
   * @param operation      the operation to run
   * @param retryableKinds failure types that trigger a retry
   * @param listener       notified before each backoff sleep
   * @return the first successful result
   * @throws Exception the failure of the last attempt, or the first non-retryable failure
   */
  public <T> T execute(Callable<T> operation,
                       List<Class<? extends Throwable>> retryableKinds,
                       RetryListener listener) throws Exception {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(retryableKinds, "retryableKinds");
    RetryListener onRetry = listener != null ? listener : RetryListener.NONE;

    int attempt = 0;
    while (true) {
      attempt++;
      try {
        return operation.call();
      } catch (Exception e) {
        if (!isRetryable(e, retryableKinds) || attempt >= maxAttempts) {
          throw e;
        }
        long delayMs = computeDelayMs(attempt);
        logger.log(Level.WARNING, "Retrying operation after failure, attempt=" + attempt
            + ", maxAttempts=" + maxAttempts + ", delayMs=" + delayMs + ", error=" + e.getMessage());
        metrics.incrementRetryAttempts();
        onRetry.onRetry(attempt, e, delayMs);
        try {
          sleeper.sleep(Duration.ofMillis(delayMs));
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          ie.addSuppressed(e);
          throw ie;
        }
      }
    }
  }

  /**
   * Computes the jittered delay that follows failed attempt {@code attempt}.
   *
   * @param attempt the 1-based attempt number that failed
   * @return delay in milliseconds, within {@code [0, maxDelayMs]}
   */
  public long computeDelayMs(int attempt) {
    if (attempt <= 0) {
      return 0L;
    }
    long expDelay;
    if (attempt >= 63 || baseDelayMs == 0) {
      expDelay = baseDelayMs == 0 ? 0L : Long.MAX_VALUE;
    } else {
      long shift = 1L << (attempt - 1);
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    double spread = capped * jitterFactor;
    double jittered = capped - spread + ThreadLocalRandom.current().nextDouble() * 2 * spread;
    return Math.min(maxDelayMs, Math.max(0L, Math.round(jittered)));
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  public double jitterFactor() {
    return jitterFactor;
  }

  private static boolean isRetryable(Throwable error, List<Class<? extends Throwable>> kinds) {
    for (Class<? extends Throwable> kind : kinds) {
      if (kind.isInstance(error)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Builder for {@link RetryPolicy}.
   */
  public static final class Builder {
    private int maxAttempts = 3;
    private long baseDelayMs = 100;
    private long maxDelayMs = 5000;
    private double jitterFactor = 0.2;
    private Sleeper sleeper = Sleeper.SYSTEM;
    private MetricsExporter metrics;

    private Builder() {
    }

    /** Optional. Defaults to 3. A value of 1 disables retries. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /** Optional. Defaults to 100 ms. */
    public Builder baseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
      return this;
    }

    /** Optional. Defaults to 5000 ms. */
    public Builder maxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
      return this;
    }

    /** Optional. Defaults to 0.2; 0 disables jitter. */
    public Builder jitterFactor(double jitterFactor) {
      this.jitterFactor = jitterFactor;
      return this;
    }

    /** Optional. Defaults to {@link Sleeper#SYSTEM}. */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public RetryPolicy build() {
      return new RetryPolicy(this);
    }
  }
}
