package io.rerun.backfill;

import java.time.Duration;

/** Blocks the calling thread; replaced by a recording fake in tests. */
@FunctionalInterface
public interface Sleeper {
  /** Sleeps with {@link Thread#sleep(long)}. */
  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  /**
   * Blocks for {@code duration}.
   *
   * @param duration how long to block
   * @throws InterruptedException if the thread is interrupted while blocked
   */
  void sleep(Duration duration) throws InterruptedException;
}
