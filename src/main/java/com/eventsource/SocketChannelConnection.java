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
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link Connection} backed by a {@link SocketChannel}.
 * <p>
 * The channel is switched to non-blocking mode and writes wait on a private {@link Selector}, which lets every write honor its deadline.
 * Closing the connection while a write is waiting wakes the writer, which then fails with a {@link ClosedChannelException}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class SocketChannelConnection implements Connection {
	@NonNull
	private final SocketChannel socketChannel;
	@NonNull
	private final Selector selector;
	@NonNull
	private final AtomicBoolean closed;
	@Nullable
	private final String remoteAddress;

	/**
	 * Wraps an open socket channel. The channel is placed into non-blocking mode.
	 *
	 * @param socketChannel the connected channel to wrap
	 * @return a connection backed by the channel
	 * @throws IOException if the channel could not be configured, in which case it has been closed
	 */
	@NonNull
	public static SocketChannelConnection fromSocketChannel(@NonNull SocketChannel socketChannel) throws IOException {
		requireNonNull(socketChannel);
		return new SocketChannelConnection(socketChannel);
	}

	private SocketChannelConnection(@NonNull SocketChannel socketChannel) throws IOException {
		requireNonNull(socketChannel);

		this.socketChannel = socketChannel;
		this.closed = new AtomicBoolean(false);

		SocketAddress socketAddress = null;

		try {
			socketAddress = socketChannel.getRemoteAddress();
		} catch (IOException ignored) {
			// Address is informational only
		}

		this.remoteAddress = socketAddress == null ? null : socketAddress.toString();

		Selector selector = null;

		try {
			socketChannel.configureBlocking(false);
			selector = Selector.open();
			socketChannel.register(selector, SelectionKey.OP_WRITE);
		} catch (IOException | RuntimeException e) {
			closeAfterFailedSetup(socketChannel, selector, e);
			throw e;
		}

		this.selector = selector;
	}

	private static void closeAfterFailedSetup(@NonNull SocketChannel socketChannel,
																						@Nullable Selector selector,
																						@NonNull Exception setupException) {
		requireNonNull(socketChannel);
		requireNonNull(setupException);

		if (selector != null) {
			try {
				selector.close();
			} catch (IOException e) {
				setupException.addSuppressed(e);
			}
		}

		try {
			socketChannel.close();
		} catch (IOException e) {
			setupException.addSuppressed(e);
		}
	}

	@Override
	public void write(@NonNull byte[] bytes,
										@NonNull Duration timeout) throws IOException {
		requireNonNull(bytes);
		requireNonNull(timeout);

		if (this.closed.get())
			throw new ClosedChannelException();

		ByteBuffer byteBuffer = ByteBuffer.wrap(bytes);
		long deadlineInNanos = System.nanoTime() + timeout.toNanos();

		try {
			while (byteBuffer.hasRemaining()) {
				if (getSocketChannel().write(byteBuffer) > 0)
					continue;

				// Kernel send buffer is full; wait for the channel to become writable again
				long remainingInNanos = deadlineInNanos - System.nanoTime();

				if (remainingInNanos <= 0)
					throw new SocketTimeoutException(format("Write did not complete within %s (%d of %d bytes written)",
							timeout, byteBuffer.position(), bytes.length));

				getSelector().select(Math.max(1L, TimeUnit.NANOSECONDS.toMillis(remainingInNanos)));
				getSelector().selectedKeys().clear();

				if (this.closed.get())
					throw new ClosedChannelException();

				if (Thread.currentThread().isInterrupted())
					throw new InterruptedIOException("Interrupted while waiting to write");
			}
		} catch (ClosedSelectorException e) {
			// Raced with close()
			throw new ClosedChannelException();
		}
	}

	@Override
	public void close() throws IOException {
		if (!this.closed.compareAndSet(false, true))
			return;

		try {
			// Wakes any writer blocked in select()
			getSelector().close();
		} finally {
			getSocketChannel().close();
		}
	}

	@Override
	@NonNull
	public Optional<String> getRemoteAddress() {
		return Optional.ofNullable(this.remoteAddress);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{remoteAddress=%s, closed=%s}", getClass().getSimpleName(), this.remoteAddress, this.closed.get());
	}

	@NonNull
	private SocketChannel getSocketChannel() {
		return this.socketChannel;
	}

	@NonNull
	private Selector getSelector() {
		return this.selector;
	}
}
