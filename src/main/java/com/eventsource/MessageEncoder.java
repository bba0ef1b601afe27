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

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Renders {@link Message} instances to their {@code text/event-stream} wire representation.
 * <p>
 * Encoding is deterministic and side-effect free. Output for an {@link EventMessage} is, in this exact order:
 * <ol>
 *   <li>{@code id: <id>} if {@code id} is non-empty, with every {@code \n} removed</li>
 *   <li>{@code event: <event>} if {@code event} is non-empty, with every {@code \n} removed</li>
 *   <li>one {@code data: <line>} per {@code \n}-separated segment of {@code data} if {@code data} is non-empty.
 *   A trailing newline yields a final empty {@code data: } line.</li>
 *   <li>a blank line</li>
 * </ol>
 * A {@link RetryMessage} is rendered as {@code retry: <milliseconds>} followed by a blank line.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class MessageEncoder {
	private MessageEncoder() {
		// Non-instantiable
	}

	/**
	 * Encodes a message to UTF-8 bytes. A new array is returned on every call.
	 *
	 * @param message the message to encode
	 * @return the wire bytes for the message
	 */
	@NonNull
	public static byte[] encode(@NonNull Message message) {
		requireNonNull(message);
		return encodeToString(message).getBytes(StandardCharsets.UTF_8);
	}

	/**
	 * Encodes a message to its wire representation as a string.
	 *
	 * @param message the message to encode
	 * @return the wire representation of the message
	 */
	@NonNull
	public static String encodeToString(@NonNull Message message) {
		requireNonNull(message);

		if (message instanceof EventMessage eventMessage)
			return encodeEventMessage(eventMessage);

		if (message instanceof RetryMessage retryMessage)
			return format("retry: %d\n\n", retryMessage.getInterval().toMillis());

		// Should never happen
		throw new IllegalArgumentException(format("Unsupported %s type: %s", Message.class.getSimpleName(), message.getClass().getName()));
	}

	@NonNull
	private static String encodeEventMessage(@NonNull EventMessage eventMessage) {
		requireNonNull(eventMessage);

		StringBuilder stringBuilder = new StringBuilder(32 + eventMessage.getData().length());

		if (eventMessage.getId().length() > 0)
			stringBuilder.append("id: ").append(stripNewlines(eventMessage.getId())).append('\n');

		if (eventMessage.getEvent().length() > 0)
			stringBuilder.append("event: ").append(stripNewlines(eventMessage.getEvent())).append('\n');

		if (eventMessage.getData().length() > 0)
			// Limit of -1 keeps trailing empty segments
			for (String line : eventMessage.getData().split("\n", -1))
				stringBuilder.append("data: ").append(line).append('\n');

		return stringBuilder.append('\n').toString();
	}

	@NonNull
	private static String stripNewlines(@NonNull String string) {
		requireNonNull(string);
		return string.replace("\n", "");
	}
}
