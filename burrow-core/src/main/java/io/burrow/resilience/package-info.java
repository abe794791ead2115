/**
 * Failure-handling primitives shared by publishing and consuming.
 *
 * <p>{@link io.burrow.resilience.RetryPolicy} retries transient failures with exponential
 * backoff and jitter. {@link io.burrow.resilience.CircuitBreaker} stops calling a failing
 * dependency until it had time to recover. The messaging facade composes them as
 * {@code circuitBreaker.execute(() -> retryPolicy.execute(publish))}, so one circuit
 * failure corresponds to one fully exhausted retry sequence.
 */
package io.burrow.resilience;
