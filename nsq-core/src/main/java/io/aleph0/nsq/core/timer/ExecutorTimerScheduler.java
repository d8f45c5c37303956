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
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link TimerScheduler} backed by a {@link ScheduledExecutorService}. Timers are scheduled at a
 * fixed rate, so firings of the same timer never overlap.
 * 
 * <p>
 * A callback that throws a {@link RuntimeException} is logged and the timer keeps running.
 * 
 * <p>
 * Closing the scheduler shuts down the executor only if the scheduler created it.
 */
public class ExecutorTimerScheduler implements TimerScheduler, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorTimerScheduler.class);

  private final AtomicBoolean closed = new AtomicBoolean(false);

  private final ScheduledExecutorService executor;
  private final boolean ownsExecutor;

  /**
   * Creates a scheduler with its own single daemon thread.
   */
  public ExecutorTimerScheduler() {
    this(Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread thread = new Thread(r, "nsq-timer");
      thread.setDaemon(true);
      return thread;
    }), true);
  }

  /**
   * Creates a scheduler on the given executor. The caller remains responsible for shutting it
   * down.
   */
  public ExecutorTimerScheduler(ScheduledExecutorService executor) {
    this(executor, false);
  }

  private ExecutorTimerScheduler(ScheduledExecutorService executor, boolean ownsExecutor) {
    this.executor = requireNonNull(executor, "executor");
    this.ownsExecutor = ownsExecutor;
  }

  @Override
  public Timer schedulePeriodic(Runnable callback, Duration interval) {
    requireNonNull(callback, "callback");
    requireNonNull(interval, "interval");
    if (interval.isNegative() || interval.isZero())
      throw new IllegalArgumentException("interval must be positive");
    if (closed.get())
      throw new IllegalStateException("closed");

    final long nanos = interval.toNanos();
    final ScheduledFuture<?> future = executor.scheduleAtFixedRate(() -> {
      try {
        callback.run();
      } catch (RuntimeException e) {
        LOGGER.atError().setCause(e).log("Timer callback failed. Continuing...");
      }
    }, nanos, nanos, TimeUnit.NANOSECONDS);

    LOGGER.atTrace().addKeyValue("interval", interval).log("Scheduled periodic timer");

    return new ExecutorTimer(future);
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true) == true && ownsExecutor) {
      executor.shutdownNow();
    }
  }

  private static class ExecutorTimer implements Timer {
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final ScheduledFuture<?> future;

    public ExecutorTimer(ScheduledFuture<?> future) {
      this.future = future;
    }

    @Override
    public void stop() {
      if (running.compareAndSet(true, false) == true)
        future.cancel(false);
    }

    @Override
    public boolean isRunning() {
      return running.get() && !future.isDone();
    }
  }
}
