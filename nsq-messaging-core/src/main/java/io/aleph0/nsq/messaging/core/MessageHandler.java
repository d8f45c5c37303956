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
 * Processes messages for a {@link MessageDispatcher}.
 */
@FunctionalInterface
public interface MessageHandler {
  /**
   * Processes the given message. Unless the handler {@link Message#enableAsync() enables async}
   * processing or responds itself, the dispatcher responds on its behalf when it returns.
   * 
   * @param message the message to process
   * @return {@code true} to finish the message, {@code false} to requeue it
   * @throws Exception if processing failed, in which case the message is requeued
   */
  public boolean handle(Message message) throws Exception;
}
