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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class ExecutorTimerSchedulerTest {
  @Test
  @Timeout(5)
  void givenTimer_whenIntervalsElapse_thenFiresRepeatedly() throws InterruptedException {
    try (ExecutorTimerScheduler scheduler = new ExecutorTimerScheduler()) {
      final CountDownLatch latch = new CountDownLatch(3);
      final Timer timer = scheduler.schedulePeriodic(latch::countDown, Duration.ofMillis(10));

      assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
      assertThat(timer.isRunning()).isTrue();

      timer.stop();
      assertThat(timer.isRunning()).isFalse();
    }
  }

  @Test
  @Timeout(5)
  void givenStoppedTimer_whenIntervalsElapse_thenDoesNotFire() throws InterruptedException {
    try (ExecutorTimerScheduler scheduler = new ExecutorTimerScheduler()) {
      final AtomicInteger fired = new AtomicInteger(0);
      final Timer timer = scheduler.schedulePeriodic(fired::incrementAndGet, Duration.ofMillis(50));

      timer.stop();
      Thread.sleep(200);

      assertThat(fired.get()).isZero();
    }
  }

  @Test
  @Timeout(5)
  void givenThrowingCallback_whenFires_thenTimerKeepsRunning() throws InterruptedException {
    try (ExecutorTimerScheduler scheduler = new ExecutorTimerScheduler()) {
      final CountDownLatch latch = new CountDownLatch(3);
      final Timer timer = scheduler.schedulePeriodic(() -> {
        latch.countDown();
        throw new IllegalStateException("simulated failure");
      }, Duration.ofMillis(10));

      assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
      assertThat(timer.isRunning()).isTrue();
      timer.stop();
    }
  }

  @Test
  void givenClosedScheduler_whenSchedule_thenThrowsIllegalStateException() {
    final ExecutorTimerScheduler scheduler = new ExecutorTimerScheduler();
    scheduler.close();

    assertThatExceptionOfType(IllegalStateException.class)
        .isThrownBy(() -> scheduler.schedulePeriodic(() -> {
        }, Duration.ofSeconds(1))).withMessageContaining("closed");
  }

  @Test
  void givenSuppliedExecutor_whenClose_thenExecutorNotShutDown() {
    final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
    try {
      final ExecutorTimerScheduler scheduler = new ExecutorTimerScheduler(executor);
      scheduler.close();

      assertThat(executor.isShutdown()).isFalse();
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void givenNonPositiveInterval_whenSchedule_thenThrowsIllegalArgumentException() {
    try (ExecutorTimerScheduler scheduler = new ExecutorTimerScheduler()) {
      assertThatExceptionOfType(IllegalArgumentException.class)
          .isThrownBy(() -> scheduler.schedulePeriodic(() -> {
          }, Duration.ZERO)).withMessageContaining("positive");
    }
  }
}
