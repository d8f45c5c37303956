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
import java.lang.ref.WeakReference;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.nsq.core.event.EventEmitter;
import io.aleph0.nsq.core.event.Evented;
import io.aleph0.nsq.core.timer.Timer;
import io.aleph0.nsq.core.timer.TimerScheduler;

/**
 * A message received from {@code nsqd}.
 *
 * <p>
 * The consumer responds to a message exactly once, either by {@link #finish() finishing} it or by
 * {@link #requeue(RequeueOptions) requeueing} it. Any further attempt to respond fails with an
 * {@link IllegalStateException}, even when two threads race to respond. Before responding, the
 * consumer may {@link #touch() touch} the message any number of times to ask for more time.
 *
 * <p>
 * Responses are not sent from here. Instead, the message triggers the following events, which the
 * owning connection listens to with {@link #on(String, io.aleph0.nsq.core.event.EventHandler) on}
 * and translates into broker commands:
 *
 * <ul>
 * <li>{@link MessageEvents#FINISH}</li>
 * <li>{@link MessageEvents#REQUEUE}</li>
 * <li>{@link MessageEvents#TOUCH}</li>
 * </ul>
 *
 * <p>
 * Finishing a message and requeueing it respectively relieve and add to backoff pressure.
 * Requeueing with {@link RequeueOptions.Builder#backoff(boolean) backoff} disabled is neutral.
 *
 * <p>
 * If the connection has a client-side message timeout, it {@link #armTimeout(MessageConnection)
 * arms} the message's timeout right after delivery. When the timeout elapses, the connection
 * receives {@link MessageEvents#MESSAGE_TIMEOUT} once. Touching the message re-arms the timeout.
 *
 * <p>
 * If you want to process a message asynchronously, call {@link #enableAsync()} from the handler,
 * hand the message off, and respond later from wherever processing completes.
 */
public class Message implements Evented<Message> {
  private static final Logger LOGGER = LoggerFactory.getLogger(Message.class);

  private final EventEmitter<Message> events = new EventEmitter<>();
  private final AtomicReference<MessageState> state = new AtomicReference<>(MessageState.PENDING);
  private volatile boolean asyncEnabled = false;

  private final String id;
  private final byte[] body;
  private final long timestamp;
  private final int attempts;

  // Guarded by this
  private Timer timeout;
  private WeakReference<MessageConnection> connection;

  /**
   * @param id the ID of the message
   * @param body the raw message body
   * @param timestamp the time the message was produced, in nanoseconds since the epoch
   * @param attempts the number of times this message was attempted
   */
  public Message(String id, byte[] body, long timestamp, int attempts) {
    this.id = requireNonNull(id, "id");
    this.body = requireNonNull(body, "body").clone();
    this.timestamp = timestamp;
    this.attempts = attempts;
  }

  public String id() {
    return id;
  }

  /**
   * Returns a copy of the raw message body.
   */
  public byte[] body() {
    return body.clone();
  }

  public long timestamp() {
    return timestamp;
  }

  public int attempts() {
    return attempts;
  }

  @Override
  public EventEmitter<Message> events() {
    return events;
  }

  @Override
  public Message self() {
    return this;
  }

  /**
   * Arms this message's client-side timeout using the given connection's timeout and scheduler,
   * replacing any timeout already armed. When the timeout elapses, the connection is notified
   * with {@link MessageEvents#MESSAGE_TIMEOUT} and the timeout stops until it is armed again.
   *
   * @param connection the connection that delivered this message
   */
  public synchronized void armTimeout(MessageConnection connection) {
    requireNonNull(connection, "connection");
    this.connection = new WeakReference<>(connection);
    clearTimeout();
    startTimeout(connection);
  }

  private void startTimeout(MessageConnection connection) {
    final Duration interval = requireNonNull(connection.messageTimeout(), "messageTimeout");
    final TimerScheduler scheduler = requireNonNull(connection.scheduler(), "scheduler");

    // The callback reads the handle under this monitor, so it always sees it set.
    final AtomicReference<Timer> armed = new AtomicReference<>();
    armed.set(scheduler.schedulePeriodic(() -> onTimeout(armed), interval));
    timeout = armed.get();

    LOGGER.atDebug().addKeyValue("id", id).addKeyValue("timeout", interval)
        .log("Armed message timeout");
  }

  private synchronized void clearTimeout() {
    if (timeout != null)
      timeout.stop();
  }

  private void onTimeout(AtomicReference<Timer> armed) {
    final Timer timer;
    final MessageConnection conn;
    synchronized (this) {
      timer = armed.get();
      if (timer == null || timer != timeout || timer.isRunning() == false) {
        LOGGER.atDebug().addKeyValue("id", id).log("Ignoring firing of replaced message timeout");
        return;
      }

      if (hasResponded()) {
        LOGGER.atDebug().addKeyValue("id", id).log("Ignoring timeout of responded message");
        timer.stop();
        return;
      }

      conn = connection.get();
      if (conn == null) {
        LOGGER.atWarn().addKeyValue("id", id)
            .log("Message timed out after its connection was released. Stopping timeout...");
        timer.stop();
        return;
      }
    }

    // Connection handlers run outside this monitor. They may take their own locks and those
    // locks may be held by threads calling into this message.
    try {
      if (hasResponded()) {
        LOGGER.atDebug().addKeyValue("id", id).log("Ignoring timeout of responded message");
        return;
      }
      LOGGER.atDebug().addKeyValue("id", id).log("Message timed out");
      conn.trigger(MessageEvents.MESSAGE_TIMEOUT, Map.of(MessageEvents.MESSAGE_KEY, this));
    } finally {
      timer.stop();
    }
  }

  /**
   * Returns whether this message's client-side timeout is still running, i.e., it has neither
   * elapsed nor been cleared by a response.
   *
   * @throws IllegalStateException if the timeout was never {@link #armTimeout(MessageConnection)
   *         armed}
   */
  public synchronized boolean isAlive() {
    if (timeout == null)
      throw new IllegalStateException(
          "message timeout was never armed; configure a client-side message timeout");
    return timeout.isRunning();
  }

  /**
   * Enables asynchronous processing for this message. The consumer loop will not respond to the
   * message automatically when the handler returns. Idempotent.
   */
  public void enableAsync() {
    asyncEnabled = true;
  }

  public boolean isAsync() {
    return asyncEnabled;
  }

  public boolean hasResponded() {
    return state.get() == MessageState.RESPONDED;
  }

  public MessageState state() {
    return state.get();
  }

  /**
   * Responds to {@code nsqd} that this message was processed successfully, or should be silently
   * discarded.
   *
   * @throws IllegalStateException if this message has already responded
   */
  public void finish() {
    synchronized (this) {
      respond();
      clearTimeout();
    }
    LOGGER.atDebug().addKeyValue("id", id).log("Finishing message");
    trigger(MessageEvents.FINISH, Map.of(MessageEvents.MESSAGE_KEY, this));
  }

  /**
   * Responds to {@code nsqd} that this message failed and should be requeued, with backoff and a
   * computed delay.
   *
   * @throws IllegalStateException if this message has already responded
   */
  public void requeue() {
    requeue(RequeueOptions.defaults());
  }

  /**
   * Responds to {@code nsqd} that this message failed and should be requeued.
   *
   * @param options whether to apply backoff, and how long to delay redelivery
   * @throws IllegalStateException if this message has already responded
   */
  public void requeue(RequeueOptions options) {
    requireNonNull(options, "options");
    synchronized (this) {
      respond();
      clearTimeout();
    }
    LOGGER.atDebug().addKeyValue("id", id).addKeyValue("backoff", options.backoff())
        .addKeyValue("delay", options.delay()).log("Requeueing message");
    trigger(MessageEvents.REQUEUE, options.toEventContext(this));
  }

  /**
   * Responds to {@code nsqd} that more time is needed to process this message. If the timeout was
   * ever armed, it is re-armed from now.
   *
   * <p>
   * A touch that races a finish or requeue from another thread either completes before the
   * response is recorded or fails. Its {@link MessageEvents#TOUCH} notification may still reach
   * listeners concurrently with the response's notification, so listeners that send broker
   * commands should skip a touch for a message that {@link #hasResponded() has responded}.
   *
   * @throws IllegalStateException if this message has already responded
   */
  public void touch() {
    synchronized (this) {
      state.get().to(MessageState.PENDING);
      if (timeout != null) {
        final MessageConnection conn = connection.get();
        clearTimeout();
        if (conn != null) {
          startTimeout(conn);
        } else {
          LOGGER.atWarn().addKeyValue("id", id)
              .log("Touched message after its connection was released. Not re-arming timeout...");
        }
      }
    }

    // Handlers run outside the monitor, so a response may have landed since the check above.
    if (hasResponded())
      throw new IllegalStateException("message responded while being touched");

    LOGGER.atDebug().addKeyValue("id", id).log("Touching message");
    trigger(MessageEvents.TOUCH, Map.of(MessageEvents.MESSAGE_KEY, this));
  }

  private void respond() {
    final MessageState current = state.get();
    final MessageState target = current.to(MessageState.RESPONDED);
    if (state.compareAndSet(current, target) == false)
      throw new IllegalStateException("message has already responded");
  }

  @Override
  public String toString() {
    return "Message[id=" + id + ", attempts=" + attempts + ", state=" + state.get() + "]";
  }
}
