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
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Server-side state for a single consumer: its connection, its bounded queue of encoded messages and its delivery loop.
 * <p>
 * Queue mutation ({@link #offer(QueuedMessage)} and {@link #closeQueue()}) happens only while the owning {@link BroadcastCoordinator}'s lock is held.
 * The connection is written only by {@link #deliver()}, which runs on a dedicated thread.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class ConsumerSession implements Consumer {
	@NonNull
	private static final QueuedMessage CLOSE_SENTINEL;

	static {
		// Compared by identity, never written
		CLOSE_SENTINEL = new QueuedMessage(RetryMessage.withInterval(Duration.ZERO), new byte[0]);
	}

	@NonNull
	private final Request request;
	@NonNull
	private final Connection connection;
	@NonNull
	private final Settings settings;
	@NonNull
	private final BroadcastCoordinator broadcastCoordinator;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final Boolean compressed;
	@NonNull
	private final Instant establishedAt;
	@NonNull
	private final BlockingQueue<QueuedMessage> queue;
	@NonNull
	private final Integer queueCapacity;
	@NonNull
	private final AtomicBoolean stale;
	@NonNull
	private final AtomicBoolean terminated;
	// Guarded by the coordinator's lock
	private boolean queueClosed;

	/**
	 * Writes the handshake response to the connection and, if successful, vends a session ready to be registered.
	 * <p>
	 * If the handshake cannot be written the connection is closed before the exception is rethrown.
	 */
	@NonNull
	static ConsumerSession open(@NonNull Connection connection,
															@NonNull Request request,
															@NonNull Settings settings,
															@NonNull HeaderDecorator headerDecorator,
															@NonNull CompressionPolicy compressionPolicy,
															@NonNull BroadcastCoordinator broadcastCoordinator,
															@NonNull LifecycleObserver lifecycleObserver) throws IOException {
		requireNonNull(connection);
		requireNonNull(request);
		requireNonNull(settings);
		requireNonNull(headerDecorator);
		requireNonNull(compressionPolicy);
		requireNonNull(broadcastCoordinator);
		requireNonNull(lifecycleObserver);

		Connection sessionConnection = connection;
		boolean compressed;

		try {
			compressed = Boolean.TRUE.equals(compressionPolicy.shouldCompress(request, settings));
			byte[] handshake = createHandshake(compressed, headerDecorator.extraHeaderLines(request));

			connection.write(handshake, settings.getWriteTimeout());

			if (compressed)
				sessionConnection = new CompressingConnection(connection, settings.getWriteTimeout());
		} catch (IOException | RuntimeException e) {
			closeQuietly(connection, lifecycleObserver, request);
			throw e;
		}

		return new ConsumerSession(request, sessionConnection, settings, broadcastCoordinator, lifecycleObserver, compressed);
	}

	@NonNull
	static byte[] createHandshake(@NonNull Boolean compressed,
																@NonNull List<@NonNull String> extraHeaderLines) {
		requireNonNull(compressed);
		requireNonNull(extraHeaderLines);

		List<String> headerLines = new ArrayList<>(5 + extraHeaderLines.size());
		headerLines.add("HTTP/1.1 200 OK");
		headerLines.add("Content-Type: text/event-stream");
		headerLines.add("Cache-Control: no-cache");
		headerLines.add("Vary: Accept-Encoding");

		if (compressed)
			headerLines.add("Content-Encoding: gzip");

		for (String extraHeaderLine : extraHeaderLines) {
			requireNonNull(extraHeaderLine);

			if (extraHeaderLine.indexOf('\r') != -1 || extraHeaderLine.indexOf('\n') != -1)
				throw new IllegalArgumentException(format("Illegal header line '%s': line breaks are not permitted",
						Utilities.printableString(extraHeaderLine)));

			headerLines.add(extraHeaderLine);
		}

		return (String.join("\r\n", headerLines) + "\r\n\r\n").getBytes(StandardCharsets.UTF_8);
	}

	private ConsumerSession(@NonNull Request request,
													@NonNull Connection connection,
													@NonNull Settings settings,
													@NonNull BroadcastCoordinator broadcastCoordinator,
													@NonNull LifecycleObserver lifecycleObserver,
													@NonNull Boolean compressed) {
		this.request = request;
		this.connection = connection;
		this.settings = settings;
		this.broadcastCoordinator = broadcastCoordinator;
		this.lifecycleObserver = lifecycleObserver;
		this.compressed = compressed;
		this.establishedAt = Instant.now();
		this.queueCapacity = settings.getQueueCapacity();
		// One slot beyond capacity is reserved for the close sentinel
		this.queue = new ArrayBlockingQueue<>(this.queueCapacity + 1);
		this.stale = new AtomicBoolean(false);
		this.terminated = new AtomicBoolean(false);
		this.queueClosed = false;
	}

	/**
	 * Non-blocking enqueue. Caller must hold the coordinator's lock.
	 *
	 * @return {@code false} if the queue is full or closed
	 */
	@NonNull
	Boolean offer(@NonNull QueuedMessage queuedMessage) {
		requireNonNull(queuedMessage);

		// The slot beyond capacity belongs to the close sentinel
		if (this.queueClosed || this.queue.size() >= this.queueCapacity)
			return false;

		return this.queue.offer(queuedMessage);
	}

	/**
	 * Stops accepting messages. The delivery loop writes whatever is already queued, then exits. Caller must hold the coordinator's lock.
	 */
	void closeQueue() {
		if (this.queueClosed)
			return;

		this.queueClosed = true;
		this.queue.offer(CLOSE_SENTINEL);
	}

	/**
	 * Stops accepting messages and discards anything still queued, so the delivery loop exits without writing again.
	 * Caller must hold the coordinator's lock.
	 */
	void discardQueue() {
		this.queueClosed = true;
		this.queue.clear();
		this.queue.offer(CLOSE_SENTINEL);
	}

	/**
	 * The delivery loop. Runs until the queue is closed, the idle timeout elapses or a write fails fatally, then closes the connection.
	 */
	void deliver() {
		long idleTimeoutInNanos = getSettings().getIdleTimeout().toNanos();
		long idleDeadlineInNanos = System.nanoTime() + idleTimeoutInNanos;
		TerminationReason terminationReason = TerminationReason.UNKNOWN;
		Throwable terminationThrowable = null;

		try {
			while (true) {
				long remainingInNanos = idleDeadlineInNanos - System.nanoTime();
				QueuedMessage queuedMessage = remainingInNanos > 0
						? this.queue.poll(remainingInNanos, TimeUnit.NANOSECONDS)
						: this.queue.poll();

				if (queuedMessage == null) {
					terminationReason = TerminationReason.IDLE_TIMEOUT;
					markStale();
					break;
				}

				if (queuedMessage == CLOSE_SENTINEL) {
					terminationReason = TerminationReason.SHUTDOWN;
					break;
				}

				idleDeadlineInNanos = System.nanoTime() + idleTimeoutInNanos;

				long writeStartedInNanos = System.nanoTime();

				try {
					getConnection().write(queuedMessage.bytes(), getSettings().getWriteTimeout());
					getLifecycleObserver().didWriteMessage(this, queuedMessage.message(), Duration.ofNanos(System.nanoTime() - writeStartedInNanos));
				} catch (SocketTimeoutException e) {
					getLifecycleObserver().didFailToWriteMessage(this, queuedMessage.message(), Duration.ofNanos(System.nanoTime() - writeStartedInNanos), e);

					// A compressed stream that lost bytes mid-write can never be decoded again
					if (getSettings().getCloseOnWriteTimeout() || isCompressed()) {
						terminationReason = TerminationReason.WRITE_TIMEOUT;
						terminationThrowable = e;
						markStale();
						break;
					}
				} catch (IOException e) {
					getLifecycleObserver().didFailToWriteMessage(this, queuedMessage.message(), Duration.ofNanos(System.nanoTime() - writeStartedInNanos), e);

					// A write torn down by shutdown is expected, not a fault
					boolean shuttingDown = getBroadcastCoordinator().isClosed() || Thread.currentThread().isInterrupted();
					terminationReason = shuttingDown ? TerminationReason.SHUTDOWN : TerminationReason.WRITE_FAILURE;
					terminationThrowable = shuttingDown ? null : e;
					markStale();
					break;
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			terminationReason = TerminationReason.SHUTDOWN;
		} catch (Throwable t) {
			terminationReason = TerminationReason.UNKNOWN;
			terminationThrowable = t;
			getLifecycleObserver().didReceiveLogEvent(LogEvent.with(LogEventType.CONSUMER_DELIVERY_FAILED,
							format("Unexpected failure while delivering to consumer %s", this))
					.consumer(this)
					.throwable(t)
					.build());
			markStale();
		} finally {
			terminate(terminationReason, terminationThrowable);
		}
	}

	/**
	 * Closes the connection, notifying the lifecycle observer. Only the first invocation has any effect.
	 */
	void terminate(@NonNull TerminationReason terminationReason,
								 @Nullable Throwable throwable) {
		requireNonNull(terminationReason);

		if (!this.terminated.compareAndSet(false, true))
			return;

		getLifecycleObserver().willTerminateConsumer(this, terminationReason, throwable);
		closeQuietly(getConnection(), getLifecycleObserver(), getRequest());
		getLifecycleObserver().didTerminateConsumer(this, Duration.between(getEstablishedAt(), Instant.now()), terminationReason, throwable);
	}

	/**
	 * Removes this session from broadcasting and closes its connection, for sessions whose delivery loop never ran.
	 */
	void abandon(@NonNull TerminationReason terminationReason,
							 @Nullable Throwable throwable) {
		requireNonNull(terminationReason);

		markStale();
		terminate(terminationReason, throwable);
	}

	private void markStale() {
		// Report at most once
		if (this.stale.compareAndSet(false, true))
			getBroadcastCoordinator().markStale(this);
	}

	private static void closeQuietly(@NonNull Connection connection,
																	 @NonNull LifecycleObserver lifecycleObserver,
																	 @NonNull Request request) {
		try {
			connection.close();
		} catch (IOException | RuntimeException e) {
			lifecycleObserver.didReceiveLogEvent(LogEvent.with(LogEventType.CONSUMER_CLOSE_FAILED, "Unable to close consumer connection")
					.request(request)
					.throwable(e)
					.build());
		}
	}

	@NonNull
	Boolean isStale() {
		return this.stale.get();
	}

	@Override
	@NonNull
	public Request getRequest() {
		return this.request;
	}

	@Override
	@NonNull
	public Instant getEstablishedAt() {
		return this.establishedAt;
	}

	@Override
	@NonNull
	public Optional<String> getRemoteAddress() {
		return getConnection().getRemoteAddress();
	}

	@Override
	@NonNull
	public Boolean isCompressed() {
		return this.compressed;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{request=%s, remoteAddress=%s, compressed=%s, stale=%s}", getClass().getSimpleName(),
				getRequest(), getRemoteAddress().orElse(null), isCompressed(), isStale());
	}

	@NonNull
	Connection getConnection() {
		return this.connection;
	}

	@NonNull
	private Settings getSettings() {
		return this.settings;
	}

	@NonNull
	private BroadcastCoordinator getBroadcastCoordinator() {
		return this.broadcastCoordinator;
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	/**
	 * A published message together with its encoding, shared by every consumer it was offered to.
	 */
	record QueuedMessage(@NonNull Message message,
											 @NonNull byte[] bytes) {
		QueuedMessage {
			requireNonNull(message);
			requireNonNull(bytes);
		}
	}
}
