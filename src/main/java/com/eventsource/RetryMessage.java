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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A reconnection directive: tells clients how long to wait before reconnecting after the stream is interrupted.
 * <p>
 * Encoded as {@code retry: <milliseconds>} followed by a blank line. Sub-millisecond precision is truncated.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class RetryMessage implements Message {
	@NonNull
	private final Duration interval;

	/**
	 * Acquires a {@link RetryMessage} for the given reconnection interval.
	 *
	 * @param interval how long clients should wait before reconnecting, must be non-negative
	 * @return the retry message
	 */
	@NonNull
	public static RetryMessage withInterval(@NonNull Duration interval) {
		requireNonNull(interval);
		return new RetryMessage(interval);
	}

	private RetryMessage(@NonNull Duration interval) {
		requireNonNull(interval);

		if (interval.isNegative())
			throw new IllegalArgumentException(format("%s interval values must be non-negative. You supplied '%s'",
					RetryMessage.class.getSimpleName(), interval));

		this.interval = interval;
	}

	@NonNull
	public Duration getInterval() {
		return this.interval;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{interval=%s}", getClass().getSimpleName(), getInterval());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RetryMessage retryMessage))
			return false;

		return getInterval().equals(retryMessage.getInterval());
	}

	@Override
	public int hashCode() {
		return getInterval().hashCode();
	}
}
