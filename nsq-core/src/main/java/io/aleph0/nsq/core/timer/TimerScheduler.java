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

import java.time.Duration;

/**
 * A facility that runs callbacks periodically.
 */
@FunctionalInterface
public interface TimerScheduler {
  /**
   * Schedules the given callback to run every {@code interval}, starting one interval from now.
   * Firings of the same timer never overlap.
   * 
   * @param callback the callback to run
   * @param interval the period, which must be positive
   * @return the running timer
   * @throws NullPointerException if callback or interval is null
   * @throws IllegalArgumentException if interval is not positive
   * @throws IllegalStateException if the scheduler no longer accepts timers
   */
  public Timer schedulePeriodic(Runnable callback, Duration interval);
}
