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
import java.time.Duration;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A minimal HTTP/1.1 listener which hands every {@code GET} request it receives to an {@link EventSource} as a new consumer.
 * <p>
 * There is no routing: any request path is accepted. Malformed requests receive a {@code 400}, non-{@code GET} requests a {@code 405}
 * and oversized request heads a {@code 431}.
 * <p>
 * Stopping the server closes the listening socket but does not shut down the {@link EventSource}, whose consumers stay connected.
 * <p>
 * For example:
 * <pre>{@code EventSourceServer eventSourceServer = EventSourceServer.withEventSource(eventSource)
 *   .port(8080)
 *   .build();
 *
 * eventSourceServer.start();}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface EventSourceServer extends AutoCloseable {
	/**
	 * Binds the listening socket and starts accepting connections.
	 * <p>
	 * If the server is already started, no action is taken.
	 *
	 * @throws java.io.UncheckedIOException if the listening socket could not be bound
	 */
	void start();

	/**
	 * Closes the listening socket. Consumers already handed to the {@link EventSource} are unaffected.
	 * <p>
	 * If the server is already stopped, no action is taken.
	 */
	void stop();

	/**
	 * Is this server started (that is, able to accept connections from clients)?
	 *
	 * @return {@code true} if the server is started, {@code false} otherwise
	 */
	@NonNull
	Boolean isStarted();

	/**
	 * The port the listening socket is bound to, which differs from the configured port if the configured port was {@code 0}.
	 *
	 * @return the bound port, or {@link Optional#empty()} if the server is not started
	 */
	@NonNull
	Optional<Integer> getLocalPort();

	@NonNull
	EventSource getEventSource();

	/**
	 * {@link AutoCloseable}-enabled synonym for {@link #stop()}.
	 */
	@Override
	default void close() {
		stop();
	}

	/**
	 * Acquires a builder for {@link EventSourceServer} instances.
	 *
	 * @param eventSource the event source which accepted connections are handed to
	 * @return the builder
	 */
	@NonNull
	static Builder withEventSource(@NonNull EventSource eventSource) {
		requireNonNull(eventSource);
		return new Builder(eventSource);
	}

	/**
	 * Builder used to construct a standard implementation of {@link EventSourceServer}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	final class Builder {
		@NonNull
		EventSource eventSource;
		@Nullable
		Integer port;
		@Nullable
		String host;
		@Nullable
		Duration requestTimeout;
		@Nullable
		Integer maximumRequestSizeInBytes;
		@Nullable
		Integer requestReadBufferSizeInBytes;
		@Nullable
		LifecycleObserver lifecycleObserver;

		protected Builder(@NonNull EventSource eventSource) {
			requireNonNull(eventSource);
			this.eventSource = eventSource;
		}

		/**
		 * The port to listen on. Defaults to {@code 0}, which picks an ephemeral port; see {@link EventSourceServer#getLocalPort()}.
		 */
		@NonNull
		public Builder port(@Nullable Integer port) {
			this.port = port;
			return this;
		}

		/**
		 * The host to bind to. Defaults to {@code 0.0.0.0}.
		 */
		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		/**
		 * How long a client may take to send its complete request head. Defaults to 60 seconds.
		 */
		@NonNull
		public Builder requestTimeout(@Nullable Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		/**
		 * The largest request head accepted. Defaults to 64 KB.
		 */
		@NonNull
		public Builder maximumRequestSizeInBytes(@Nullable Integer maximumRequestSizeInBytes) {
			this.maximumRequestSizeInBytes = maximumRequestSizeInBytes;
			return this;
		}

		@NonNull
		public Builder requestReadBufferSizeInBytes(@Nullable Integer requestReadBufferSizeInBytes) {
			this.requestReadBufferSizeInBytes = requestReadBufferSizeInBytes;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public EventSourceServer build() {
			return new DefaultEventSourceServer(this);
		}
	}
}
