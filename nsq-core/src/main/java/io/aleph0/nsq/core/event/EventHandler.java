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
 * Receives notifications triggered on an {@link Evented} entity.
 *
 * @param <S> the type of the entity that triggers the event
 */
@FunctionalInterface
public interface EventHandler<S> {
  /**
   * Called synchronously on the triggering thread.
   * 
   * @param source the entity the event was triggered on
   * @param context immutable key/value context supplied by the trigger, never {@code null}
   */
  public void handle(S source, Map<String, Object> context);
}
