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
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.zip.GZIPOutputStream;

import static java.util.Objects.requireNonNull;

/**
 * Wraps a {@link Connection} so everything written through it becomes one continuous gzip stream.
 * <p>
 * Each write is sync-flushed so the client can decompress messages as they arrive. Closing finishes the gzip stream
 * (best-effort, bounded by the finish timeout) and then closes the underlying connection.
 * If {@link #close()} races an in-flight write, the gzip trailer is skipped and the underlying connection is closed immediately.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class CompressingConnection implements Connection {
	@NonNull
	private final Connection connection;
	@NonNull
	private final Duration finishTimeout;
	@NonNull
	private final ByteArrayOutputStream compressedBytes;
	@NonNull
	private final GZIPOutputStream gzipOutputStream;
	@NonNull
	private final AtomicBoolean closed;
	@NonNull
	private final ReentrantLock writeLock;

	CompressingConnection(@NonNull Connection connection,
												@NonNull Duration finishTimeout) throws IOException {
		requireNonNull(connection);
		requireNonNull(finishTimeout);

		this.connection = connection;
		this.finishTimeout = finishTimeout;
		this.compressedBytes = new ByteArrayOutputStream(512);
		// syncFlush=true so flush() emits everything compressed so far
		this.gzipOutputStream = new GZIPOutputStream(this.compressedBytes, true);
		this.closed = new AtomicBoolean(false);
		this.writeLock = new ReentrantLock();
	}

	@Override
	public void write(@NonNull byte[] bytes,
										@NonNull Duration timeout) throws IOException {
		requireNonNull(bytes);
		requireNonNull(timeout);

		getWriteLock().lock();

		try {
			this.gzipOutputStream.write(bytes);
			this.gzipOutputStream.flush();
			getConnection().write(drainCompressedBytes(), timeout);
		} finally {
			getWriteLock().unlock();
		}
	}

	@Override
	public void close() throws IOException {
		if (!this.closed.compareAndSet(false, true))
			return;

		boolean writeLockAcquired = getWriteLock().tryLock();

		try {
			if (writeLockAcquired) {
				this.gzipOutputStream.finish();
				byte[] trailer = drainCompressedBytes();

				if (trailer.length > 0)
					getConnection().write(trailer, this.finishTimeout);
			}
		} catch (IOException ignored) {
			// Peer may already be gone
		} finally {
			try {
				getConnection().close();
			} finally {
				if (writeLockAcquired)
					getWriteLock().unlock();
			}
		}
	}

	@Override
	@NonNull
	public Optional<String> getRemoteAddress() {
		return getConnection().getRemoteAddress();
	}

	@NonNull
	private byte[] drainCompressedBytes() {
		byte[] bytes = this.compressedBytes.toByteArray();
		this.compressedBytes.reset();
		return bytes;
	}

	@NonNull
	private ReentrantLock getWriteLock() {
		return this.writeLock;
	}

	@NonNull
	Connection getConnection() {
		return this.connection;
	}
}
