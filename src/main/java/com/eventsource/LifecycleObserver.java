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

import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only hook methods for observing consumer and broadcaster lifecycle events.
 * <p>
 * Exceptions thrown by any of these methods are caught and surfaced separately via {@link #didReceiveLogEvent(LogEvent)};
 * they never interrupt delivery to consumers.
 * <p>
 * Callbacks for a given consumer are made from that consumer's delivery thread, with the exception of
 * {@link #didEstablishConsumer(Consumer)} and {@link #didFailToEstablishConsumer(Request, Throwable)}, which are made from the thread that called
 * {@link EventSource#accept(Connection, Request)}, and {@link #didDropMessage(Consumer, Message)}, which is made from the publishing thread.
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #defaultInstance()} factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface LifecycleObserver {
	/**
	 * Called after a consumer's handshake was written and it was registered to receive broadcasts.
	 */
	default void didEstablishConsumer(@NonNull Consumer consumer) {
		// No-op by default
	}

	/**
	 * Called if a consumer's handshake could not be written. The connection has already been closed.
	 */
	default void didFailToEstablishConsumer(@NonNull Request request,
																					@NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called before a consumer's connection is closed.
	 */
	default void willTerminateConsumer(@NonNull Consumer consumer,
																		 Consumer.@NonNull TerminationReason terminationReason,
																		 @Nullable Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called after a consumer's connection is closed.
	 */
	default void didTerminateConsumer(@NonNull Consumer consumer,
																		@NonNull Duration connectionDuration,
																		Consumer.@NonNull TerminationReason terminationReason,
																		@Nullable Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called after a message is written to a consumer.
	 */
	default void didWriteMessage(@NonNull Consumer consumer,
															 @NonNull Message message,
															 @NonNull Duration writeDuration) {
		// No-op by default
	}

	/**
	 * Called after a message fails to write to a consumer, whether or not the failure terminates the consumer.
	 */
	default void didFailToWriteMessage(@NonNull Consumer consumer,
																		 @NonNull Message message,
																		 @NonNull Duration writeDuration,
																		 @NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called when a published message is not delivered to a consumer because the consumer's queue is full.
	 */
	default void didDropMessage(@NonNull Consumer consumer,
															@NonNull Message message) {
		// No-op by default
	}

	/**
	 * Called after an {@link EventSource} has shut down and every consumer connection has been closed.
	 */
	default void didShutdown(@NonNull EventSource eventSource) {
		// No-op by default
	}

	/**
	 * Called when the library emits a log event.
	 * <p>
	 * The default implementation writes the event to the {@code com.eventsource} {@link Logger} at {@link Level#WARNING}.
	 */
	default void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		Logger logger = Logger.getLogger(LifecycleObserver.class.getPackageName());
		String message = String.format("[%s] %s", logEvent.getLogEventType().name(), logEvent.getMessage());
		Throwable throwable = logEvent.getThrowable().orElse(null);

		if (throwable == null)
			logger.log(Level.WARNING, message);
		else
			logger.log(Level.WARNING, message, throwable);
	}

	/**
	 * Acquires a threadsafe {@link LifecycleObserver} instance with sensible defaults.
	 *
	 * @return a {@code LifecycleObserver} with default settings
	 */
	@NonNull
	static LifecycleObserver defaultInstance() {
		return DefaultLifecycleObserver.defaultInstance();
	}
}
