package io.burrow.resilience;

/**
 * Callback invoked by {@link RetryPolicy} before it sleeps ahead of the next attempt.
 */
@FunctionalInterface
public interface RetryListener {

  RetryListener NONE = (attempt, error, delayMs) -> { };

  /**
   * @param attempt the attempt number that just failed (1-based)
   * @param error   the failure of that attempt
   * @param delayMs the delay about to be slept, in milliseconds
   */
  void onRetry(int attempt, Throwable error, long delayMs);
}
