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

/**
 * A handle to a periodic callback created by a {@link TimerScheduler}.
 */
public interface Timer {
  /**
   * Stops the timer. No further firings will start after this method returns. Idempotent.
   */
  public void stop();

  /**
   * Returns {@code true} from the moment the timer is scheduled until it is {@link #stop()
   * stopped}.
   */
  public boolean isRunning();
}
