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
package io.aleph0.nsq.core.event;

import static java.util.Collections.emptyList;
import static java.util.Objects.requireNonNull;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A minimal, order-preserving publish/subscribe registry. Entities own one of these and expose it
 * through {@link Evented}.
 * 
 * <p>
 * Handlers are invoked synchronously, on the thread that calls {@link #trigger(String, Object, Map)
 * trigger}, in the order they were registered. If a handler throws, the exception propagates to
 * the caller of {@code trigger} and the remaining handlers are not invoked.
 * 
 * <p>
 * Registration is thread-safe. A trigger iterates over a snapshot of the handlers registered at
 * the moment it starts, so handlers registered during a trigger are not called by that trigger.
 *
 * @param <S> the type of the entity that owns this emitter
 */
public class EventEmitter<S> {
  private final ConcurrentMap<String, List<EventHandler<? super S>>> handlers =
      new ConcurrentHashMap<>();

  /**
   * Registers the given handler for the given event. The same handler may be registered more than
   * once, in which case it is called once per registration.
   */
  public void on(String eventName, EventHandler<? super S> handler) {
    requireNonNull(eventName, "eventName");
    requireNonNull(handler, "handler");
    handlers.computeIfAbsent(eventName, k -> new CopyOnWriteArrayList<>()).add(handler);
  }

  /**
   * Removes the first registration of the given handler for the given event.
   * 
   * @return {@code true} if a registration was removed, {@code false} otherwise
   */
  public boolean off(String eventName, EventHandler<? super S> handler) {
    requireNonNull(eventName, "eventName");
    requireNonNull(handler, "handler");
    final List<EventHandler<? super S>> registered = handlers.get(eventName);
    if (registered == null)
      return false;
    return registered.remove(handler);
  }

  /**
   * Invokes every handler registered for the given event, in registration order.
   * 
   * @param eventName the event to trigger
   * @param source the entity the event is triggered on
   * @param context the event context, which is copied
   */
  public void trigger(String eventName, S source, Map<String, ?> context) {
    requireNonNull(eventName, "eventName");
    requireNonNull(source, "source");
    requireNonNull(context, "context");

    final List<EventHandler<? super S>> registered = handlers.getOrDefault(eventName, emptyList());
    if (registered.isEmpty())
      return;

    final Map<String, Object> snapshot = Map.copyOf(context);
    for (EventHandler<? super S> handler : registered)
      handler.handle(source, snapshot);
  }

  /**
   * Returns the number of handlers currently registered for the given event.
   */
  public int handlerCount(String eventName) {
    final List<EventHandler<? super S>> registered = handlers.get(eventName);
    return registered == null ? 0 : registered.size();
  }
}
