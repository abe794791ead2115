package io.burrow.resilience;

import java.time.Duration;

/**
 * Blocks the calling thread between retry and reconnect attempts.
 *
 * <p>Replaceable so tests can record requested delays instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {

  /**
   * Sleeper backed by {@link Thread#sleep(long)}.
   */
  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
