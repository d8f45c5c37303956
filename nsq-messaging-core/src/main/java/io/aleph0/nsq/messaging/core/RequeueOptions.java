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

import java.util.HashMap;
import java.util.Map;

/**
 * Options for {@link Message#requeue(RequeueOptions)}.
 */
public final class RequeueOptions {
  /**
   * The delay value that asks the connection to compute the delay from the attempt count.
   */
  public static final int COMPUTED_DELAY = -1;

  private static final RequeueOptions DEFAULTS = builder().build();

  public static RequeueOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private boolean backoff = true;
    private int delay = COMPUTED_DELAY;

    /**
     * Whether this requeue should count toward backoff. {@code false} is neutral: the connection
     * must neither increase nor decrease its backoff state. Defaults to {@code true}.
     */
    public Builder backoff(boolean backoff) {
      this.backoff = backoff;
      return this;
    }

    /**
     * The redelivery delay in seconds, or {@link RequeueOptions#COMPUTED_DELAY}. Defaults to
     * {@link RequeueOptions#COMPUTED_DELAY}.
     */
    public Builder delay(int delay) {
      this.delay = delay;
      return this;
    }

    public RequeueOptions build() {
      return new RequeueOptions(backoff, delay);
    }
  }

  private final boolean backoff;
  private final int delay;

  private RequeueOptions(boolean backoff, int delay) {
    if (delay < COMPUTED_DELAY)
      throw new IllegalArgumentException("delay must be at least " + COMPUTED_DELAY);
    this.backoff = backoff;
    this.delay = delay;
  }

  public boolean backoff() {
    return backoff;
  }

  public int delay() {
    return delay;
  }

  /**
   * Returns the context of the corresponding {@link MessageEvents#REQUEUE} event. A positive delay
   * is also given in milliseconds; zero and {@link #COMPUTED_DELAY} are passed through as they are.
   */
  Map<String, Object> toEventContext(Message message) {
    final Map<String, Object> result = new HashMap<>();
    result.put(MessageEvents.MESSAGE_KEY, message);
    result.put(MessageEvents.BACKOFF_KEY, backoff);
    result.put(MessageEvents.DELAY_KEY, delay);
    if (delay > 0)
      result.put(MessageEvents.TIME_MS_KEY, delay * 1000L);
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof RequeueOptions other))
      return false;
    return backoff == other.backoff && delay == other.delay;
  }

  @Override
  public int hashCode() {
    return 31 * Boolean.hashCode(backoff) + delay;
  }

  @Override
  public String toString() {
    return "RequeueOptions[backoff=" + backoff + ", delay=" + delay + "]";
  }
}
