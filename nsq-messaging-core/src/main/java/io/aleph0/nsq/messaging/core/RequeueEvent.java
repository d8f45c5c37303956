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
import java.util.Map;
import java.util.OptionalLong;

/**
 * A typed view of the context of a {@link MessageEvents#REQUEUE} event, for connections that
 * translate it into a broker command.
 */
public record RequeueEvent(boolean backoff, int delay, OptionalLong timeMs) {
  public RequeueEvent {
    requireNonNull(timeMs, "timeMs");
  }

  /**
   * Reads a requeue event from the given event context.
   * 
   * @throws IllegalArgumentException if the context is not a requeue context
   */
  public static RequeueEvent of(Map<String, Object> context) {
    requireNonNull(context, "context");
    final Object backoff = context.get(MessageEvents.BACKOFF_KEY);
    final Object delay = context.get(MessageEvents.DELAY_KEY);
    final Object timeMs = context.get(MessageEvents.TIME_MS_KEY);
    if (!(backoff instanceof Boolean b))
      throw new IllegalArgumentException("context has no backoff");
    if (!(delay instanceof Integer d))
      throw new IllegalArgumentException("context has no delay");
    if (timeMs != null && !(timeMs instanceof Long))
      throw new IllegalArgumentException("context has invalid timeMs");
    return new RequeueEvent(b, d,
        timeMs == null ? OptionalLong.empty() : OptionalLong.of((Long) timeMs));
  }

  /**
   * Whether the connection should compute the redelivery delay itself.
   */
  public boolean isComputedDelay() {
    return delay == RequeueOptions.COMPUTED_DELAY;
  }
}
