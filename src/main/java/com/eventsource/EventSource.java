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

import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Broadcasts {@code text/event-stream} messages to every connected consumer.
 * <p>
 * The host process owns the listener: for each client that should receive events, it hands the raw connection and the request
 * metadata to {@link #accept(Connection, Request)}. From then on the event source owns the connection. Each consumer has a bounded queue;
 * publishing never blocks on a slow consumer, which instead misses messages while its queue is full.
 * <p>
 * For example:
 * <pre>{@code EventSource eventSource = EventSource.withSettings(Settings.withDefaults()
 *     .idleTimeout(Duration.ofMinutes(5))
 *     .build())
 *   .headerDecorator((request) -> List.of("Access-Control-Allow-Origin: *"))
 *   .build();
 *
 * eventSource.accept(connection, request);
 * eventSource.publishEvent("{\"status\":\"ok\"}", "status", "1");}</pre>
 * <p>
 * Implementations are threadsafe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface EventSource extends AutoCloseable {
	/**
	 * Takes ownership of a client connection: writes the handshake response and registers the connection as a consumer.
	 * <p>
	 * If the handshake cannot be written the connection is closed, nothing is registered and the exception is rethrown.
	 *
	 * @param connection the client connection
	 * @param request    the request that initiated the connection
	 * @throws IOException           if the handshake could not be written
	 * @throws IllegalStateException if this event source has been shut down, in which case the connection is closed
	 */
	void accept(@NonNull Connection connection,
							@NonNull Request request) throws IOException;

	/**
	 * Encodes a message once and enqueues it for every live consumer. Never blocks on consumer I/O.
	 * <p>
	 * Has no effect after {@link #shutdown()}.
	 *
	 * @param message the message to broadcast
	 */
	void publish(@NonNull Message message);

	/**
	 * Broadcasts an event. Empty or {@code null} components are omitted from the encoded event.
	 *
	 * @param data  the event data, which may span multiple lines
	 * @param event the event name
	 * @param id    the event ID
	 */
	default void publishEvent(@Nullable String data,
														@Nullable String event,
														@Nullable String id) {
		publish(EventMessage.withData(data)
				.event(event)
				.id(id)
				.build());
	}

	/**
	 * Broadcasts a reconnection-delay hint to clients.
	 *
	 * @param interval the reconnection delay
	 */
	default void publishRetry(@NonNull Duration interval) {
		requireNonNull(interval);
		publish(RetryMessage.withInterval(interval));
	}

	/**
	 * How many consumers are currently registered.
	 *
	 * @return the number of registered consumers
	 */
	@NonNull
	Integer getConsumerCount();

	/**
	 * Closes every consumer connection and stops accepting new ones. Subsequent invocations have no effect.
	 * <p>
	 * Waits up to {@link Settings#getShutdownTimeout()} for delivery loops to finish, then interrupts any that remain.
	 */
	void shutdown();

	/**
	 * Has {@link #shutdown()} been invoked?
	 *
	 * @return {@code true} if this event source has been shut down
	 */
	@NonNull
	Boolean isShutdown();

	@NonNull
	Settings getSettings();

	/**
	 * {@link AutoCloseable}-enabled synonym for {@link #shutdown()}.
	 */
	@Override
	default void close() {
		shutdown();
	}

	/**
	 * Acquires a builder for {@link EventSource} instances.
	 *
	 * @param settings the settings read by every consumer session
	 * @return the builder
	 */
	@NonNull
	static Builder withSettings(@NonNull Settings settings) {
		requireNonNull(settings);
		return new Builder(settings);
	}

	/**
	 * Creates an {@link EventSource} with the given settings and optional header decorator, and defaults for everything else.
	 *
	 * @param settings        the settings read by every consumer session
	 * @param headerDecorator supplies extra handshake header lines, or {@code null} for none
	 * @return the event source
	 */
	@NonNull
	static EventSource create(@NonNull Settings settings,
														@Nullable HeaderDecorator headerDecorator) {
		requireNonNull(settings);
		return withSettings(settings).headerDecorator(headerDecorator).build();
	}

	/**
	 * Builder used to construct a standard implementation of {@link EventSource}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	final class Builder {
		@NonNull
		Settings settings;
		@Nullable
		HeaderDecorator headerDecorator;
		@Nullable
		CompressionPolicy compressionPolicy;
		@Nullable
		LifecycleObserver lifecycleObserver;
		@Nullable
		Supplier<ExecutorService> executorServiceSupplier;

		protected Builder(@NonNull Settings settings) {
			requireNonNull(settings);
			this.settings = settings;
		}

		@NonNull
		public Builder settings(@NonNull Settings settings) {
			requireNonNull(settings);
			this.settings = settings;
			return this;
		}

		@NonNull
		public Builder headerDecorator(@Nullable HeaderDecorator headerDecorator) {
			this.headerDecorator = headerDecorator;
			return this;
		}

		@NonNull
		public Builder compressionPolicy(@Nullable CompressionPolicy compressionPolicy) {
			this.compressionPolicy = compressionPolicy;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		/**
		 * Supplies the executor that runs consumer delivery loops. Each consumer occupies one thread for its lifetime, so the executor must
		 * not bound its thread count below the expected number of consumers.
		 * <p>
		 * The supplier is invoked once, at build time, and ownership of the executor it returns passes to the event source: {@link EventSource#shutdown()}
		 * shuts it down and interrupts whatever it is still running after {@link Settings#getShutdownTimeout()}. Supply a dedicated executor, never a shared one.
		 */
		@NonNull
		public Builder executorServiceSupplier(@Nullable Supplier<ExecutorService> executorServiceSupplier) {
			this.executorServiceSupplier = executorServiceSupplier;
			return this;
		}

		@NonNull
		public EventSource build() {
			return new DefaultEventSource(this);
		}
	}
}
