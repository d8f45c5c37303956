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
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.nsq.core.Measureable;

/**
 * Hands messages to a {@link MessageHandler} and responds to them when the handler does not.
 * 
 * <p>
 * When the handler returns {@code true}, the message is finished. When it returns {@code false},
 * the message is requeued with backoff. When it throws an {@link Exception}, the failure is logged
 * and the message is requeued with backoff. {@link Error}s propagate without a response.
 * 
 * <p>
 * The dispatcher never responds to a message that the handler already responded to, or that the
 * handler marked for {@link Message#enableAsync() async} processing. Async messages are the
 * handler's to respond to.
 * 
 * <p>
 * This class is thread-safe.
 */
public class MessageDispatcher implements Measureable<DispatcherMetrics> {
  private static final Logger LOGGER = LoggerFactory.getLogger(MessageDispatcher.class);

  private final AtomicLong dispatchedMetric = new AtomicLong(0);
  private final AtomicLong finishedMetric = new AtomicLong(0);
  private final AtomicLong requeuedMetric = new AtomicLong(0);
  private final AtomicLong failedMetric = new AtomicLong(0);
  private final AtomicLong asyncMetric = new AtomicLong(0);

  private final MessageHandler handler;

  public MessageDispatcher(MessageHandler handler) {
    this.handler = requireNonNull(handler, "handler");
  }

  /**
   * Passes the given message to the handler and responds to it if appropriate.
   * 
   * @param message the message to dispatch
   */
  public void dispatch(Message message) {
    requireNonNull(message, "message");

    dispatchedMetric.incrementAndGet();

    boolean success;
    try {
      success = handler.handle(message);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      failedMetric.incrementAndGet();
      LOGGER.atWarn().setCause(e).addKeyValue("id", message.id())
          .log("Interrupted while handling message");
      success = false;
    } catch (Exception e) {
      failedMetric.incrementAndGet();
      LOGGER.atWarn().setCause(e).addKeyValue("id", message.id())
          .log("Message handler failed");
      success = false;
    }

    if (message.isAsync()) {
      asyncMetric.incrementAndGet();
      LOGGER.atDebug().addKeyValue("id", message.id())
          .log("Message is async. Leaving response to handler...");
      return;
    }

    if (message.hasResponded()) {
      LOGGER.atDebug().addKeyValue("id", message.id()).log("Handler already responded to message");
      return;
    }

    if (success) {
      message.finish();
      finishedMetric.incrementAndGet();
    } else {
      LOGGER.atDebug().addKeyValue("id", message.id()).log("Requeueing message for handler");
      message.requeue();
      requeuedMetric.incrementAndGet();
    }
  }

  @Override
  public DispatcherMetrics checkMetrics() {
    final long dispatched = dispatchedMetric.get();
    final long finished = finishedMetric.get();
    final long requeued = requeuedMetric.get();
    final long failed = failedMetric.get();
    final long async = asyncMetric.get();
    return new DispatcherMetrics(dispatched, finished, requeued, failed, async);
  }

  @Override
  public DispatcherMetrics flushMetrics() {
    final DispatcherMetrics metrics = checkMetrics();
    dispatchedMetric.set(0);
    finishedMetric.set(0);
    requeuedMetric.set(0);
    failedMetric.set(0);
    asyncMetric.set(0);
    return metrics;
  }
}
