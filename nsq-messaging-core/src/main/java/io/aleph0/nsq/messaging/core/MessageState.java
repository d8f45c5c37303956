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

/**
 * The response state of a {@link Message}. A message starts {@link #PENDING} and moves to
 * {@link #RESPONDED} exactly once, when it is finished or requeued. Touching a message keeps it
 * {@link #PENDING}.
 */
public enum MessageState {
  /**
   * The consumer has not yet finished or requeued the message.
   */
  PENDING {
    @Override
    public MessageState to(MessageState target) {
      return target;
    }
  },

  /**
   * The consumer has finished or requeued the message. Terminal.
   */
  RESPONDED {
    @Override
    public MessageState to(MessageState target) {
      throw new IllegalStateException("message has already responded");
    }
  };

  /**
   * Returns the state reached by moving from this state to the given target.
   * 
   * @throws IllegalStateException if the transition is not allowed
   */
  public abstract MessageState to(MessageState target);
}
