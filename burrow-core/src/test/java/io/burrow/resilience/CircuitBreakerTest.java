package io.burrow.resilience;

import io.burrow.testing.MutableClock;
import io.burrow.testing.RecordingMetricsExporter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
  private final RecordingMetricsExporter metrics = new RecordingMetricsExporter();

  private CircuitBreaker breaker(int threshold, Duration resetTimeout) {
    return CircuitBreaker.builder("test")
        .failureThreshold(threshold)
        .resetTimeout(resetTimeout)
        .clock(clock)
        .metrics(metrics)
        .build();
  }

  private static void fail(CircuitBreaker breaker) {
    assertThrows(IOException.class, () -> breaker.execute(() -> {
      throw new IOException("boom");
    }));
  }

  @Test
  void rejectsNonPositiveThreshold() {
    assertThrows(IllegalArgumentException.class,
        () -> CircuitBreaker.builder("x").failureThreshold(0).build());
  }

  @Test
  void startsClosedAndPassesResults() throws Exception {
    CircuitBreaker breaker = breaker(3, Duration.ofSeconds(30));

    assertEquals(CircuitState.CLOSED, breaker.state());
    assertEquals(42, breaker.execute(() -> 42));
  }

  @Test
  void rethrowsOperationFailureUnchanged() {
    CircuitBreaker breaker = breaker(3, Duration.ofSeconds(30));
    IOException original = new IOException("original");

    IOException thrown = assertThrows(IOException.class, () -> breaker.execute(() -> {
      throw original;
    }));

    assertSame(original, thrown);
    assertEquals(1, breaker.failureCount());
  }

  @Test
  void opensOnceThresholdReached() {
    CircuitBreaker breaker = breaker(3, Duration.ofSeconds(30));

    fail(breaker);
    fail(breaker);
    assertEquals(CircuitState.CLOSED, breaker.state());
    fail(breaker);

    assertEquals(CircuitState.OPEN, breaker.state());
    assertEquals(List.of(CircuitState.OPEN), metrics.circuitStates);
  }

  @Test
  void openCircuitFailsFastWithoutInvokingOperation() {
    CircuitBreaker breaker = breaker(1, Duration.ofSeconds(30));
    fail(breaker);
    AtomicInteger calls = new AtomicInteger();

    CircuitOpenException thrown = assertThrows(CircuitOpenException.class,
        () -> breaker.execute(calls::incrementAndGet));

    assertEquals(0, calls.get());
    assertEquals("test", thrown.circuitName());
    assertEquals(CircuitState.OPEN, thrown.state());
    assertEquals("Circuit test is OPEN", thrown.getMessage());
    assertEquals(1, metrics.rejections.get());
  }

  @Test
  void halfOpenSuccessClosesCircuit() throws Exception {
    CircuitBreaker breaker = breaker(2, Duration.ofSeconds(1));
    fail(breaker);
    fail(breaker);
    clock.advance(Duration.ofMillis(1100));

    assertEquals("trial", breaker.execute(() -> "trial"));

    assertEquals(CircuitState.CLOSED, breaker.state());
    assertEquals(0, breaker.failureCount());
    assertEquals(List.of(CircuitState.OPEN, CircuitState.HALF_OPEN, CircuitState.CLOSED), metrics.circuitStates);
  }

  @Test
  void halfOpenFailureReopensImmediately() {
    CircuitBreaker breaker = breaker(2, Duration.ofSeconds(1));
    fail(breaker);
    fail(breaker);
    clock.advance(Duration.ofSeconds(1));

    fail(breaker);

    assertEquals(CircuitState.OPEN, breaker.state());
    assertThrows(CircuitOpenException.class, () -> breaker.execute(() -> "rejected"));
  }

  @Test
  void staysOpenBeforeResetTimeout() {
    CircuitBreaker breaker = breaker(1, Duration.ofSeconds(30));
    fail(breaker);
    clock.advance(Duration.ofSeconds(29));

    assertThrows(CircuitOpenException.class, () -> breaker.execute(() -> "too early"));
    assertEquals(CircuitState.OPEN, breaker.state());
  }

  @Test
  void successWhileClosedKeepsFailureCount() throws Exception {
    CircuitBreaker breaker = breaker(3, Duration.ofSeconds(30));
    fail(breaker);
    fail(breaker);

    breaker.execute(() -> "ok");

    assertEquals(2, breaker.failureCount());
    fail(breaker);
    assertEquals(CircuitState.OPEN, breaker.state());
  }

  @Test
  void resetClosesOpenCircuit() throws Exception {
    CircuitBreaker breaker = breaker(1, Duration.ofMinutes(5));
    fail(breaker);

    breaker.reset();

    assertEquals(CircuitState.CLOSED, breaker.state());
    assertEquals(0, breaker.failureCount());
    assertEquals("ok", breaker.execute(() -> "ok"));
  }

  @Test
  void recoversAfterRealTimeout() throws Exception {
    CircuitBreaker breaker = CircuitBreaker.builder("real")
        .failureThreshold(2)
        .resetTimeout(Duration.ofSeconds(1))
        .build();
    fail(breaker);
    fail(breaker);
    assertThrows(CircuitOpenException.class, () -> breaker.execute(() -> "rejected"));

    Thread.sleep(1100);

    assertEquals("ok", breaker.execute(() -> "ok"));
    assertEquals(CircuitState.CLOSED, breaker.state());
  }
}
