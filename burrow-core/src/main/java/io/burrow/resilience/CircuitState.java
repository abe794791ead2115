package io.burrow.resilience;

/**
 * States of a {@link CircuitBreaker}.
 */
public enum CircuitState {
  /** Calls pass through; failures are counted. */
  CLOSED,
  /** Calls are rejected until the reset timeout elapses. */
  OPEN,
  /** A single trial call decides between CLOSED and OPEN. */
  HALF_OPEN
}
