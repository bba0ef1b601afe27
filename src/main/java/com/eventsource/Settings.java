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
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Immutable per-{@link EventSource} settings, read by every consumer session when it is created.
 * <p>
 * For example:
 * <pre>{@code Settings settings = Settings.withDefaults()
 *   .writeTimeout(Duration.ofSeconds(5))
 *   .closeOnWriteTimeout(false)
 *   .idleTimeout(Duration.ofMinutes(10))
 *   .build();}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Settings {
	@NonNull
	private static final Duration DEFAULT_WRITE_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_IDLE_TIMEOUT;
	@NonNull
	private static final Boolean DEFAULT_CLOSE_ON_WRITE_TIMEOUT;
	@NonNull
	private static final Integer DEFAULT_QUEUE_CAPACITY;
	@NonNull
	private static final Boolean DEFAULT_GZIP;
	@NonNull
	private static final Duration DEFAULT_SHUTDOWN_TIMEOUT;
	@NonNull
	private static final Settings DEFAULT_INSTANCE;

	static {
		DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(2);
		DEFAULT_IDLE_TIMEOUT = Duration.ofMinutes(30);
		DEFAULT_CLOSE_ON_WRITE_TIMEOUT = true;
		DEFAULT_QUEUE_CAPACITY = 10;
		DEFAULT_GZIP = false;
		DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
		DEFAULT_INSTANCE = new Builder().build();
	}

	@NonNull
	private final Duration writeTimeout;
	@NonNull
	private final Duration idleTimeout;
	@NonNull
	private final Boolean closeOnWriteTimeout;
	@NonNull
	private final Integer queueCapacity;
	@NonNull
	private final Boolean gzip;
	@NonNull
	private final Duration shutdownTimeout;

	/**
	 * Acquires a builder for {@link Settings} instances, primed with default values.
	 *
	 * @return the builder
	 */
	@NonNull
	public static Builder withDefaults() {
		return new Builder();
	}

	/**
	 * Acquires a shared {@link Settings} instance with all default values.
	 *
	 * @return the default settings
	 */
	@NonNull
	public static Settings defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	protected Settings(@NonNull Builder builder) {
		requireNonNull(builder);

		this.writeTimeout = builder.writeTimeout != null ? builder.writeTimeout : DEFAULT_WRITE_TIMEOUT;
		this.idleTimeout = builder.idleTimeout != null ? builder.idleTimeout : DEFAULT_IDLE_TIMEOUT;
		this.closeOnWriteTimeout = builder.closeOnWriteTimeout != null ? builder.closeOnWriteTimeout : DEFAULT_CLOSE_ON_WRITE_TIMEOUT;
		this.queueCapacity = builder.queueCapacity != null ? builder.queueCapacity : DEFAULT_QUEUE_CAPACITY;
		this.gzip = builder.gzip != null ? builder.gzip : DEFAULT_GZIP;
		this.shutdownTimeout = builder.shutdownTimeout != null ? builder.shutdownTimeout : DEFAULT_SHUTDOWN_TIMEOUT;

		if (this.writeTimeout.isNegative() || this.writeTimeout.isZero())
			throw new IllegalArgumentException(format("Write timeout must be > 0. You supplied '%s'", this.writeTimeout));

		if (this.idleTimeout.isNegative() || this.idleTimeout.isZero())
			throw new IllegalArgumentException(format("Idle timeout must be > 0. You supplied '%s'", this.idleTimeout));

		if (this.queueCapacity < 1)
			throw new IllegalArgumentException(format("Queue capacity must be > 0. You supplied %d", this.queueCapacity));

		if (this.shutdownTimeout.isNegative())
			throw new IllegalArgumentException(format("Shutdown timeout must be >= 0. You supplied '%s'", this.shutdownTimeout));
	}

	/**
	 * Builder used to construct instances of {@link Settings}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private Duration writeTimeout;
		@Nullable
		private Duration idleTimeout;
		@Nullable
		private Boolean closeOnWriteTimeout;
		@Nullable
		private Integer queueCapacity;
		@Nullable
		private Boolean gzip;
		@Nullable
		private Duration shutdownTimeout;

		protected Builder() {
			// Nothing to do
		}

		@NonNull
		public Builder writeTimeout(@Nullable Duration writeTimeout) {
			this.writeTimeout = writeTimeout;
			return this;
		}

		@NonNull
		public Builder idleTimeout(@Nullable Duration idleTimeout) {
			this.idleTimeout = idleTimeout;
			return this;
		}

		@NonNull
		public Builder closeOnWriteTimeout(@Nullable Boolean closeOnWriteTimeout) {
			this.closeOnWriteTimeout = closeOnWriteTimeout;
			return this;
		}

		@NonNull
		public Builder queueCapacity(@Nullable Integer queueCapacity) {
			this.queueCapacity = queueCapacity;
			return this;
		}

		@NonNull
		public Builder gzip(@Nullable Boolean gzip) {
			this.gzip = gzip;
			return this;
		}

		@NonNull
		public Builder shutdownTimeout(@Nullable Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		@NonNull
		public Settings build() {
			return new Settings(this);
		}
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{writeTimeout=%s, idleTimeout=%s, closeOnWriteTimeout=%s, queueCapacity=%d, gzip=%s, shutdownTimeout=%s}",
				getClass().getSimpleName(), getWriteTimeout(), getIdleTimeout(), getCloseOnWriteTimeout(), getQueueCapacity(),
				getGzip(), getShutdownTimeout());
	}

	/**
	 * How long a single message write may block before it is considered timed out. Defaults to 2 seconds.
	 *
	 * @return the per-write deadline
	 */
	@NonNull
	public Duration getWriteTimeout() {
		return this.writeTimeout;
	}

	/**
	 * How long a consumer may go without receiving any message before its connection is closed. Defaults to 30 minutes.
	 *
	 * @return the idle timeout
	 */
	@NonNull
	public Duration getIdleTimeout() {
		return this.idleTimeout;
	}

	/**
	 * Should a write timeout close the consumer's connection?
	 * <p>
	 * If {@code true} (the default), a timed-out write terminates the consumer and it is the client's responsibility to reconnect.
	 * If {@code false}, the message is dropped for that consumer and delivery continues, which means messages may keep being sent to a dead client
	 * until some other failure or the idle timeout occurs.
	 * <p>
	 * Ignored for gzip-compressed consumers, for which a write timeout is always fatal.
	 *
	 * @return {@code true} if a write timeout is fatal to the consumer
	 */
	@NonNull
	public Boolean getCloseOnWriteTimeout() {
		return this.closeOnWriteTimeout;
	}

	/**
	 * How many encoded messages may be waiting for a single consumer. Messages published while a consumer's queue is full are dropped for that consumer.
	 * Defaults to 10.
	 *
	 * @return the per-consumer queue capacity
	 */
	@NonNull
	public Integer getQueueCapacity() {
		return this.queueCapacity;
	}

	/**
	 * Is gzip compression permitted for consumers whose requests advertise support for it? Defaults to {@code false}.
	 *
	 * @return {@code true} if gzip compression is permitted
	 */
	@NonNull
	public Boolean getGzip() {
		return this.gzip;
	}

	/**
	 * How long {@link EventSource#shutdown()} waits for consumer delivery loops to close their connections before interrupting them. Defaults to 5 seconds.
	 *
	 * @return the shutdown timeout
	 */
	@NonNull
	public Duration getShutdownTimeout() {
		return this.shutdownTimeout;
	}
}
