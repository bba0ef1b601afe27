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

import java.io.Closeable;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Optional;

/**
 * A raw, already-established client connection handed to an {@link EventSource}.
 * <p>
 * Once accepted, the connection is owned by a single consumer delivery loop, which is the only caller of {@link #write(byte[], Duration)}.
 * {@link #close()} may be invoked concurrently with an in-flight write and must be idempotent.
 * <p>
 * {@link SocketChannelConnection} is the implementation for socket channels.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Connection extends Closeable {
	/**
	 * Writes all of the given bytes, blocking for at most {@code timeout}.
	 * <p>
	 * If the deadline passes before every byte has been written, a {@link SocketTimeoutException} is thrown; some bytes may already have been written.
	 *
	 * @param bytes   the bytes to write
	 * @param timeout the write deadline
	 * @throws SocketTimeoutException if the write deadline expired
	 * @throws IOException            if the write failed for any other reason, including the connection having been closed
	 */
	void write(@NonNull byte[] bytes,
						 @NonNull Duration timeout) throws IOException;

	/**
	 * Closes the connection. Subsequent invocations have no effect.
	 *
	 * @throws IOException if an error occurred while closing
	 */
	@Override
	void close() throws IOException;

	/**
	 * A human-readable description of the remote peer, for example {@code /127.0.0.1:53824}.
	 *
	 * @return the remote address, or {@link Optional#empty()} if unknown
	 */
	@NonNull
	default Optional<String> getRemoteAddress() {
		return Optional.empty();
	}
}
