/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.eventsource;

/**
 * A single unit of <a href="https://html.spec.whatwg.org/multipage/server-sent-events.html#server-sent-events">Server-Sent Event</a> output which can be published to every connected consumer.
 * <p>
 * There are exactly two kinds of message:
 * <ul>
 *   <li>{@link EventMessage}, which carries optional {@code id}, {@code event} and {@code data} fields</li>
 *   <li>{@link RetryMessage}, which instructs clients how long to wait before reconnecting</li>
 * </ul>
 * <p>
 * Instances are immutable. A published message is encoded exactly once via {@link MessageEncoder#encode(Message)}
 * and the resulting bytes are shared across all consumers.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public sealed interface Message permits EventMessage, RetryMessage {
	// Marker only
}
