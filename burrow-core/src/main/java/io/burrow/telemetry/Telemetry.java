package io.burrow.telemetry;

import io.burrow.spi.MetricsExporter;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Times messaging operations and reports their outcome to the log and a
 * {@link MetricsExporter}.
 *
 * <p>Each {@link #start} returns its own {@link Operation}, so overlapping operations on
 * different threads never share a start time.
 */
public final class Telemetry {
  private static final Logger logger = Logger.getLogger(Telemetry.class.getName());

  private final MetricsExporter metrics;

  public Telemetry(MetricsExporter metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public static Telemetry noop() {
    return new Telemetry(MetricsExporter.NOOP);
  }

  public Operation start(String operation) {
    return new Operation(Objects.requireNonNull(operation, "operation"), System.nanoTime());
  }

  public MetricsExporter metrics() {
    return metrics;
  }

  static String describe(Map<String, ?> context) {
    if (context == null || context.isEmpty()) {
      return "";
    }
    return context.entrySet().stream()
        .map(e -> e.getKey() + "=" + e.getValue())
        .collect(Collectors.joining(", ", ", ", ""));
  }

  /**
   * A started operation. Report exactly one outcome.
   */
  public final class Operation {
    private final String name;
    private final long startNanos;

    private Operation(String name, long startNanos) {
      this.name = name;
      this.startNanos = startNanos;
    }

    public String name() {
      return name;
    }

    /**
     * Milliseconds elapsed since the operation started.
     */
    public long elapsedMs() {
      return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    public void success(Map<String, ?> context) {
      long durationMs = elapsedMs();
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Operation " + name + " succeeded, durationMs=" + durationMs + describe(context));
      }
      metrics.recordOperationDurationMs(name, true, durationMs);
    }

    public void failure(Throwable error, Map<String, ?> context) {
      long durationMs = elapsedMs();
      logger.log(Level.WARNING, "Operation " + name + " failed, durationMs=" + durationMs
          + ", error=" + (error == null ? "unknown" : error.getMessage()) + describe(context));
      metrics.recordOperationDurationMs(name, false, durationMs);
    }
  }
}
