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

import java.util.Map;

/**
 * Gives an entity publish/subscribe capability by delegating to an {@link EventEmitter} it owns.
 * 
 * <p>
 * Implementations only need to supply {@link #events()} and return themselves from
 * {@link #self()}.
 *
 * @param <S> the implementing type
 */
public interface Evented<S extends Evented<S>> {
  /**
   * The emitter owned by this entity.
   */
  public EventEmitter<S> events();

  /**
   * This entity, typed as its own type.
   */
  public S self();

  /**
   * @see EventEmitter#on(String, EventHandler)
   */
  public default void on(String eventName, EventHandler<? super S> handler) {
    events().on(eventName, handler);
  }

  /**
   * Triggers the given event with no context.
   */
  public default void trigger(String eventName) {
    trigger(eventName, Map.of());
  }

  /**
   * @see EventEmitter#trigger(String, Object, Map)
   */
  public default void trigger(String eventName, Map<String, ?> context) {
    events().trigger(eventName, self(), context);
  }
}
