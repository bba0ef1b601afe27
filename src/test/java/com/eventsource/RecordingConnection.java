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

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link Connection} which records everything written to it.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class RecordingConnection implements Connection {
	@FunctionalInterface
	interface WriteHandler {
		/**
		 * Invoked before each write is recorded. May block, or throw to fail the write.
		 *
		 * @param writeIndex zero-based index of this write
		 */
		void beforeWrite(int writeIndex, byte[] bytes, Duration timeout) throws IOException;
	}

	private final ByteArrayOutputStream output;
	private final AtomicInteger writeCount;
	private final AtomicInteger closeCount;
	private volatile WriteHandler writeHandler;

	RecordingConnection() {
		this((writeIndex, bytes, timeout) -> {});
	}

	RecordingConnection(WriteHandler writeHandler) {
		this.output = new ByteArrayOutputStream();
		this.writeCount = new AtomicInteger(0);
		this.closeCount = new AtomicInteger(0);
		this.writeHandler = writeHandler;
	}

	@Override
	public void write(byte[] bytes, Duration timeout) throws IOException {
		if (this.closeCount.get() > 0)
			throw new ClosedChannelException();

		this.writeHandler.beforeWrite(this.writeCount.getAndIncrement(), bytes, timeout);

		synchronized (this) {
			if (this.closeCount.get() > 0)
				throw new ClosedChannelException();

			this.output.write(bytes);
			notifyAll();
		}
	}

	@Override
	public void close() {
		synchronized (this) {
			this.closeCount.incrementAndGet();
			notifyAll();
		}
	}

	@Override
	public Optional<String> getRemoteAddress() {
		return Optional.of("recording");
	}

	void setWriteHandler(WriteHandler writeHandler) {
		this.writeHandler = writeHandler;
	}

	synchronized byte[] getOutputBytes() {
		return this.output.toByteArray();
	}

	synchronized String getOutput() {
		return this.output.toString(StandardCharsets.UTF_8);
	}

	int getCloseCount() {
		return this.closeCount.get();
	}

	int getWriteCount() {
		return this.writeCount.get();
	}

	synchronized boolean awaitOutputContaining(String expected, Duration timeout) throws InterruptedException {
		long deadline = System.nanoTime() + timeout.toNanos();

		while (!getOutput().contains(expected)) {
			long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;

			if (remainingMillis <= 0)
				return false;

			wait(remainingMillis);
		}

		return true;
	}

	synchronized boolean awaitClosed(Duration timeout) throws InterruptedException {
		long deadline = System.nanoTime() + timeout.toNanos();

		while (this.closeCount.get() == 0) {
			long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;

			if (remainingMillis <= 0)
				return false;

			wait(remainingMillis);
		}

		return true;
	}
}
