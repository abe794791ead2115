package io.burrow.spi;

import io.burrow.resilience.CircuitState;

/**
 * Observability hook for exporting messaging counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of messages published successfully through the facade.
   */
  void incrementPublishSuccess();

  /**
   * Increments the count of publishes that failed after retries, validation, or circuit checks.
   */
  void incrementPublishFailure();

  /**
   * Increments the count of retry attempts scheduled by a retry policy.
   */
  void incrementRetryAttempts();

  /**
   * Increments the count of calls rejected because a circuit was open.
   *
   * @param circuitName name of the rejecting circuit
   */
  void incrementCircuitRejections(String circuitName);

  /**
   * Records the state a circuit has just entered.
   *
   * @param circuitName name of the circuit
   * @param state       the new state
   */
  void recordCircuitState(String circuitName, CircuitState state);

  /**
   * Increments the count of deliveries handled without error.
   */
  default void incrementConsumeSuccess() {
  }

  /**
   * Increments the count of deliveries whose handler failed.
   */
  default void incrementConsumeFailure() {
  }

  /**
   * Increments the count of consumer reconnection attempts.
   */
  default void incrementReconnectAttempts() {
  }

  /**
   * Records the duration of a telemetry-tracked operation.
   *
   * @param operation  operation name, e.g. {@code "publish"}
   * @param success    whether the operation succeeded
   * @param durationMs elapsed time in milliseconds (always non-negative)
   */
  default void recordOperationDurationMs(String operation, boolean success, long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementPublishSuccess() {
    }

    @Override
    public void incrementPublishFailure() {
    }

    @Override
    public void incrementRetryAttempts() {
    }

    @Override
    public void incrementCircuitRejections(String circuitName) {
    }

    @Override
    public void recordCircuitState(String circuitName, CircuitState state) {
    }
  }
}
