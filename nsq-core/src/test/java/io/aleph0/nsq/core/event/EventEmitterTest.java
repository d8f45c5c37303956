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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EventEmitterTest {
  static class Widget implements Evented<Widget> {
    private final EventEmitter<Widget> events = new EventEmitter<>();

    @Override
    public EventEmitter<Widget> events() {
      return events;
    }

    @Override
    public Widget self() {
      return this;
    }
  }

  @Test
  void givenMultipleHandlers_whenTrigger_thenHandlersCalledInRegistrationOrder() {
    final Widget widget = new Widget();
    final List<String> calls = new ArrayList<>();

    widget.on("ping", (source, context) -> calls.add("first"));
    widget.on("ping", (source, context) -> calls.add("second"));
    widget.on("ping", (source, context) -> calls.add("third"));

    widget.trigger("ping");

    assertThat(calls).containsExactly("first", "second", "third");
  }

  @Test
  void givenHandler_whenTrigger_thenHandlerReceivesSourceAndContext() {
    final Widget widget = new Widget();
    final List<Object> sources = new ArrayList<>();
    final List<Map<String, Object>> contexts = new ArrayList<>();

    widget.on("ping", (source, context) -> {
      sources.add(source);
      contexts.add(context);
    });

    widget.trigger("ping", Map.of("alpha", 1, "beta", "two"));

    assertThat(sources).containsExactly(widget);
    assertThat(contexts).containsExactly(Map.of("alpha", 1, "beta", "two"));
  }

  @Test
  void givenHandlerForOtherEvent_whenTrigger_thenHandlerNotCalled() {
    final Widget widget = new Widget();
    final List<String> calls = new ArrayList<>();

    widget.on("pong", (source, context) -> calls.add("pong"));

    widget.trigger("ping");

    assertThat(calls).isEmpty();
  }

  @Test
  void givenNoHandlers_whenTrigger_thenNothingHappens() {
    final Widget widget = new Widget();

    widget.trigger("never-registered", Map.of("key", "value"));

    assertThat(widget.events().handlerCount("never-registered")).isZero();
  }

  @Test
  void givenThrowingHandler_whenTrigger_thenExceptionPropagatesAndLaterHandlersSkipped() {
    final Widget widget = new Widget();
    final List<String> calls = new ArrayList<>();

    widget.on("ping", (source, context) -> calls.add("before"));
    widget.on("ping", (source, context) -> {
      throw new IllegalArgumentException("simulated failure");
    });
    widget.on("ping", (source, context) -> calls.add("after"));

    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> widget.trigger("ping")).withMessage("simulated failure");
    assertThat(calls).containsExactly("before");
  }

  @Test
  void givenMutableContext_whenTrigger_thenHandlerSeesImmutableCopy() {
    final Widget widget = new Widget();
    final Map<String, Object> context = new HashMap<>();
    context.put("key", "original");
    final List<Map<String, Object>> seen = new ArrayList<>();

    widget.on("ping", (source, ctx) -> seen.add(ctx));
    widget.trigger("ping", context);
    context.put("key", "changed");

    assertThat(seen.get(0)).containsEntry("key", "original");
    assertThatExceptionOfType(UnsupportedOperationException.class)
        .isThrownBy(() -> seen.get(0).put("key", "mutated"));
  }

  @Test
  void givenHandlerRegisteredTwice_whenTrigger_thenCalledTwice() {
    final Widget widget = new Widget();
    final List<String> calls = new ArrayList<>();
    final EventHandler<Widget> handler = (source, context) -> calls.add("called");

    widget.on("ping", handler);
    widget.on("ping", handler);
    widget.trigger("ping");

    assertThat(calls).hasSize(2);
  }

  @Test
  void givenRegisteredHandler_whenOff_thenNoLongerCalled() {
    final Widget widget = new Widget();
    final List<String> calls = new ArrayList<>();
    final EventHandler<Widget> handler = (source, context) -> calls.add("called");

    widget.on("ping", handler);
    assertThat(widget.events().off("ping", handler)).isTrue();
    assertThat(widget.events().off("ping", handler)).isFalse();
    widget.trigger("ping");

    assertThat(calls).isEmpty();
  }

  @Test
  void givenHandlerRegisteringAnother_whenTrigger_thenNewHandlerWaitsForNextTrigger() {
    final Widget widget = new Widget();
    final List<String> calls = new ArrayList<>();

    widget.on("ping", (source, context) -> {
      calls.add("outer");
      source.on("ping", (s, c) -> calls.add("inner"));
    });

    widget.trigger("ping");
    assertThat(calls).containsExactly("outer");

    calls.clear();
    widget.trigger("ping");
    assertThat(calls).containsExactly("outer", "inner");
  }

  @Test
  void givenNullArguments_whenOn_thenThrowsNullPointerException() {
    final EventEmitter<Widget> emitter = new EventEmitter<>();

    assertThatExceptionOfType(NullPointerException.class)
        .isThrownBy(() -> emitter.on(null, (source, context) -> {
        })).withMessageContaining("eventName");
    assertThatExceptionOfType(NullPointerException.class)
        .isThrownBy(() -> emitter.on("ping", null)).withMessageContaining("handler");
  }
}
