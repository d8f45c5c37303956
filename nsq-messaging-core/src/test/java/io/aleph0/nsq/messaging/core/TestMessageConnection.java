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

import static java.util.Objects.requireNonNull;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import io.aleph0.nsq.core.event.EventEmitter;
import io.aleph0.nsq.core.timer.TimerScheduler;

/**
 * A {@link MessageConnection} that records the messages it is told have timed out.
 */
public class TestMessageConnection implements MessageConnection {
  private final EventEmitter<MessageConnection> events = new EventEmitter<>();
  public final List<Message> timedOut = new CopyOnWriteArrayList<>();

  private final Duration messageTimeout;
  private final TimerScheduler scheduler;

  public TestMessageConnection(Duration messageTimeout, TimerScheduler scheduler) {
    this.messageTimeout = requireNonNull(messageTimeout, "messageTimeout");
    this.scheduler = requireNonNull(scheduler, "scheduler");
    on(MessageEvents.MESSAGE_TIMEOUT, (source, context) -> {
      timedOut.add((Message) context.get(MessageEvents.MESSAGE_KEY));
    });
  }

  @Override
  public Duration messageTimeout() {
    return messageTimeout;
  }

  @Override
  public TimerScheduler scheduler() {
    return scheduler;
  }

  @Override
  public EventEmitter<MessageConnection> events() {
    return events;
  }

  @Override
  public MessageConnection self() {
    return this;
  }
}
