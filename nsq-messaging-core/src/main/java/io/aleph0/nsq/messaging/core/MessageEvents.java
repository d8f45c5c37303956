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
 * Names of the events a {@link Message} and its {@link MessageConnection} trigger, and the keys of
 * the context they carry. Every event carries the message under {@link #MESSAGE_KEY}.
 */
public final class MessageEvents {
  private MessageEvents() {}

  /**
   * Triggered on the message when the consumer processed it successfully.
   */
  public static final String FINISH = "finish";

  /**
   * Triggered on the message when the consumer wants it redelivered. Context also carries
   * {@link #BACKOFF_KEY}, {@link #DELAY_KEY} and, for positive delays, {@link #TIME_MS_KEY}.
   * 
   * @see RequeueEvent
   */
  public static final String REQUEUE = "requeue";

  /**
   * Triggered on the message when the consumer needs more time.
   */
  public static final String TOUCH = "touch";

  /**
   * Triggered on the connection when a message's client-side timeout elapses. The connection is the
   * source.
   */
  public static final String MESSAGE_TIMEOUT = "message_timeout";

  public static final String MESSAGE_KEY = "message";

  public static final String BACKOFF_KEY = "backoff";

  public static final String DELAY_KEY = "delay";

  public static final String TIME_MS_KEY = "timeMs";
}
