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

import java.time.Instant;
import java.util.Optional;

/**
 * Read-only view of a client connection that has completed its handshake with an {@link EventSource} and is receiving broadcasts.
 * <p>
 * Instances are exposed via {@link LifecycleObserver}, which enables you to monitor what happens to a consumer over time
 * (established, message written, message dropped, terminated, etc.)
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Consumer {
	/**
	 * The request made by the client which initiated this consumer.
	 *
	 * @return the initiating request
	 */
	@NonNull
	Request getRequest();

	/**
	 * The moment at which the handshake completed.
	 *
	 * @return the moment at which this consumer was established
	 */
	@NonNull
	Instant getEstablishedAt();

	/**
	 * A human-readable description of the remote peer, if the underlying {@link Connection} knows it.
	 *
	 * @return the remote address, or {@link Optional#empty()} if unknown
	 */
	@NonNull
	Optional<String> getRemoteAddress();

	/**
	 * Is this consumer's stream gzip-compressed?
	 *
	 * @return {@code true} if the stream is compressed
	 */
	@NonNull
	Boolean isCompressed();

	/**
	 * Categorizes why a consumer terminated.
	 */
	enum TerminationReason {
		/**
		 * No message was delivered to the consumer within the idle timeout.
		 */
		IDLE_TIMEOUT,
		/**
		 * A write did not complete within the write timeout and write timeouts are configured to be fatal.
		 */
		WRITE_TIMEOUT,
		/**
		 * A write failed, typically because the remote peer went away.
		 */
		WRITE_FAILURE,
		/**
		 * The {@link EventSource} was shut down.
		 */
		SHUTDOWN,
		/**
		 * Consumer ended for an unspecified reason.
		 */
		UNKNOWN
	}
}
