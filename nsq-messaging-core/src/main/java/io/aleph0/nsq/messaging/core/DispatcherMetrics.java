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

public record DispatcherMetrics(
    /**
     * The number of messages given to the handler.
     */
    long dispatched,

    /**
     * The number of messages the dispatcher finished on the handler's behalf.
     */
    long finished,

    /**
     * The number of messages the dispatcher requeued on the handler's behalf.
     */
    long requeued,

    /**
     * The number of times the handler threw.
     */
    long failed,

    /**
     * The number of messages the handler took over by enabling async processing.
     */
    long async) {
}
