/*-
 * =================================LICENSE_START==================================
 * nsq-messaging-core
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
package io.aleph0.nsq.messaging.core;

import java.time.Duration;
import io.aleph0.nsq.core.event.Evented;
import io.aleph0.nsq.core.timer.TimerScheduler;

/**
 * The connection that delivered a {@link Message}, as seen by the message. It supplies the
 * client-side message timeout and the scheduler it runs on, and receives
 * {@link MessageEvents#MESSAGE_TIMEOUT} notifications.
 * 
 * <p>
 * Messages only hold a weak reference to their connection.
 */
public interface MessageConnection extends Evented<MessageConnection> {
  /**
   * The client-side message timeout.
   */
  public Duration messageTimeout();

  /**
   * The scheduler message timeouts run on.
   */
  public TimerScheduler scheduler();
}
