/*-
 * =================================LICENSE_START==================================
 * nsq-core
 * ====================================SECTION=====================================
 * Copyright (C) 2025 aleph0
 * ====================================SECTION=====================================
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * ==================================LICENSE_END===================================
 */
package io.aleph0.nsq.core.timer;

import static java.util.Objects.requireNonNull;
import java.time.Duration;
import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * A {@link TimerScheduler} driven by a virtual clock. Nothing fires until the owner calls
 * {@link #advance(Duration)}, which runs every due callback on the calling thread, in due-time
 * order, with the clock set to each callback's due time while it runs.
 * 
 * <p>
 * This models a single-threaded cooperative event loop and makes timer behavior deterministic in
 * tests. Instances are not thread-safe and must be driven from one thread. Stopped timers are
 * removed from the schedule immediately.
 */
public class ManualTimerScheduler implements TimerScheduler {
  private final PriorityQueue<ManualTimer> queue = new PriorityQueue<>(
      Comparator.comparingLong((ManualTimer t) -> t.dueNanos).thenComparingLong(t -> t.sequence));

  private long nowNanos = 0L;
  private long nextSequence = 0L;

  @Override
  public Timer schedulePeriodic(Runnable callback, Duration interval) {
    requireNonNull(callback, "callback");
    requireNonNull(interval, "interval");
    if (interval.isNegative() || interval.isZero())
      throw new IllegalArgumentException("interval must be positive");

    final long intervalNanos = interval.toNanos();
    final ManualTimer timer =
        new ManualTimer(callback, intervalNanos, nowNanos + intervalNanos, nextSequence++);
    queue.add(timer);

    return timer;
  }

  /**
   * Moves the clock forward by the given amount, running every callback that comes due.
   * 
   * @param duration how far to move the clock, which must not be negative
   */
  public void advance(Duration duration) {
    requireNonNull(duration, "duration");
    if (duration.isNegative())
      throw new IllegalArgumentException("duration must not be negative");

    final long targetNanos = nowNanos + duration.toNanos();
    for (ManualTimer timer = queue.peek(); timer != null
        && timer.dueNanos <= targetNanos; timer = queue.peek()) {
      queue.poll();

      nowNanos = timer.dueNanos;

      // Re-queue before running, so the callback can stop its own timer.
      timer.dueNanos = timer.dueNanos + timer.intervalNanos;
      timer.sequence = nextSequence++;
      queue.add(timer);

      timer.callback.run();
    }
    nowNanos = targetNanos;
  }

  /**
   * Returns the time elapsed on the virtual clock since this scheduler was created.
   */
  public Duration now() {
    return Duration.ofNanos(nowNanos);
  }

  /**
   * Returns the number of timers that are still running.
   */
  public int runningTimers() {
    return queue.size();
  }

  private class ManualTimer implements Timer {
    private final Runnable callback;
    private final long intervalNanos;
    private long dueNanos;
    private long sequence;
    private boolean running = true;

    public ManualTimer(Runnable callback, long intervalNanos, long dueNanos, long sequence) {
      this.callback = callback;
      this.intervalNanos = intervalNanos;
      this.dueNanos = dueNanos;
      this.sequence = sequence;
    }

    @Override
    public void stop() {
      if (running) {
        running = false;
        queue.remove(this);
      }
    }

    @Override
    public boolean isRunning() {
      return running;
    }
  }
}
