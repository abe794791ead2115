package io.burrow.micrometer;

import io.burrow.resilience.CircuitState;
import io.burrow.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code burrow.publish.success} / {@code burrow.publish.failure}: facade publish outcomes
 *   <li>{@code burrow.retry.attempts}: retries scheduled by retry policies
 *   <li>{@code burrow.circuit.rejected}: calls rejected by an open circuit, tagged {@code circuit}
 *   <li>{@code burrow.consume.success} / {@code burrow.consume.failure}: handled deliveries
 *   <li>{@code burrow.consume.reconnect}: consumer reconnection attempts
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code burrow.circuit.state}: 0 closed, 1 open, 2 half-open; tagged {@code circuit}
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code burrow.operation.duration}: tagged {@code operation} and {@code outcome}
 * </ul>
 *
 * <p>Per-circuit and per-operation meters are registered the first time they are reported.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final String namePrefix;
    private final Counter publishSuccess;
    private final Counter publishFailure;
    private final Counter retryAttempts;
    private final Counter consumeSuccess;
    private final Counter consumeFailure;
    private final Counter reconnectAttempts;

    private final Map<String, AtomicInteger> circuitStates = new ConcurrentHashMap<>();
    private final Map<String, Counter> circuitRejections = new ConcurrentHashMap<>();
    private final Map<String, Timer> operationTimers = new ConcurrentHashMap<>();
    private final List<Meter> dynamicMeters = new ArrayList<>();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "burrow"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "burrow");
    }

    /**
     * Creates an exporter with a custom metric name prefix.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "orders.messaging"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.namePrefix = namePrefix;
        this.publishSuccess = Counter.builder(namePrefix + ".publish.success")
                .description("Messages published through the messaging service")
                .register(registry);
        this.publishFailure = Counter.builder(namePrefix + ".publish.failure")
                .description("Publishes that failed after retries, validation or circuit checks")
                .register(registry);
        this.retryAttempts = Counter.builder(namePrefix + ".retry.attempts")
                .description("Retry attempts scheduled")
                .register(registry);
        this.consumeSuccess = Counter.builder(namePrefix + ".consume.success")
                .description("Deliveries handled without error")
                .register(registry);
        this.consumeFailure = Counter.builder(namePrefix + ".consume.failure")
                .description("Deliveries whose handler failed")
                .register(registry);
        this.reconnectAttempts = Counter.builder(namePrefix + ".consume.reconnect")
                .description("Consumer reconnection attempts")
                .register(registry);
    }

    @Override
    public void incrementPublishSuccess() {
        if (closed) return;
        publishSuccess.increment();
    }

    @Override
    public void incrementPublishFailure() {
        if (closed) return;
        publishFailure.increment();
    }

    @Override
    public void incrementRetryAttempts() {
        if (closed) return;
        retryAttempts.increment();
    }

    @Override
    public void incrementCircuitRejections(String circuitName) {
        if (closed) return;
        circuitRejections.computeIfAbsent(circuitName, name -> track(
                Counter.builder(namePrefix + ".circuit.rejected")
                        .description("Calls rejected by an open circuit")
                        .tag("circuit", name)
                        .register(registry)))
                .increment();
    }

    @Override
    public void recordCircuitState(String circuitName, CircuitState state) {
        if (closed) return;
        circuitStates.computeIfAbsent(circuitName, name -> {
            AtomicInteger value = new AtomicInteger();
            track(Gauge.builder(namePrefix + ".circuit.state", value, AtomicInteger::get)
                    .description("Circuit state: 0 closed, 1 open, 2 half-open")
                    .tag("circuit", name)
                    .register(registry));
            return value;
        }).set(state.ordinal());
    }

    @Override
    public void incrementConsumeSuccess() {
        if (closed) return;
        consumeSuccess.increment();
    }

    @Override
    public void incrementConsumeFailure() {
        if (closed) return;
        consumeFailure.increment();
    }

    @Override
    public void incrementReconnectAttempts() {
        if (closed) return;
        reconnectAttempts.increment();
    }

    @Override
    public void recordOperationDurationMs(String operation, boolean success, long durationMs) {
        if (closed) return;
        String outcome = success ? "success" : "failure";
        operationTimers.computeIfAbsent(operation + "|" + outcome, key -> track(
                Timer.builder(namePrefix + ".operation.duration")
                        .description("Duration of messaging operations")
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .register(registry)))
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    private <M extends Meter> M track(M meter) {
        synchronized (dynamicMeters) {
            dynamicMeters.add(meter);
        }
        return meter;
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>(List.of(publishSuccess, publishFailure, retryAttempts,
                consumeSuccess, consumeFailure, reconnectAttempts));
        synchronized (dynamicMeters) {
            meters.addAll(dynamicMeters);
        }
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
