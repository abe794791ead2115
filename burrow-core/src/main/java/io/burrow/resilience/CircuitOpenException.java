package io.burrow.resilience;

/**
 * Thrown by {@link CircuitBreaker#execute} when the circuit is open and the operation
 * was not invoked.
 */
public class CircuitOpenException extends RuntimeException {
  private final String circuitName;
  private final CircuitState state;

  public CircuitOpenException(String circuitName, CircuitState state) {
    super("Circuit " + circuitName + " is " + state);
    this.circuitName = circuitName;
    this.state = state;
  }

  public String circuitName() {
    return circuitName;
  }

  public CircuitState state() {
    return state;
  }
}
