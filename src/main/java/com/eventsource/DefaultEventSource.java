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
import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultEventSource implements EventSource {
	@NonNull
	private static final String DEFAULT_THREAD_NAME_PREFIX;

	static {
		DEFAULT_THREAD_NAME_PREFIX = "eventsource-consumer";
	}

	@NonNull
	private final Settings settings;
	@NonNull
	private final HeaderDecorator headerDecorator;
	@NonNull
	private final CompressionPolicy compressionPolicy;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final ExecutorService executorService;
	@NonNull
	private final BroadcastCoordinator broadcastCoordinator;
	@NonNull
	private final ReentrantLock shutdownLock;
	// Guarded by shutdownLock
	private boolean shutdownCompleted;

	DefaultEventSource(@NonNull Builder builder) {
		requireNonNull(builder);

		this.settings = builder.settings;
		this.headerDecorator = builder.headerDecorator != null ? builder.headerDecorator : (request) -> List.of();
		this.compressionPolicy = builder.compressionPolicy != null ? builder.compressionPolicy : CompressionPolicy.defaultInstance();
		this.lifecycleObserver = new SafeLifecycleObserver(builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance());

		ExecutorService executorService = builder.executorServiceSupplier != null ? builder.executorServiceSupplier.get() : null;

		if (executorService == null)
			executorService = Executors.newCachedThreadPool(Utilities.createDaemonThreadFactory(DEFAULT_THREAD_NAME_PREFIX));

		this.executorService = executorService;
		this.broadcastCoordinator = new BroadcastCoordinator(this.lifecycleObserver);
		this.shutdownLock = new ReentrantLock();
		this.shutdownCompleted = false;
	}

	@Override
	public void accept(@NonNull Connection connection,
										 @NonNull Request request) throws IOException {
		requireNonNull(connection);
		requireNonNull(request);

		if (getBroadcastCoordinator().isClosed()) {
			try {
				connection.close();
			} catch (IOException e) {
				getLifecycleObserver().didReceiveLogEvent(LogEvent.with(LogEventType.CONSUMER_CLOSE_FAILED, "Unable to close rejected connection")
						.request(request)
						.throwable(e)
						.build());
			}

			throw new IllegalStateException(format("Cannot accept a connection: %s has been shut down", EventSource.class.getSimpleName()));
		}

		ConsumerSession consumerSession;

		try {
			consumerSession = ConsumerSession.open(connection, request, getSettings(), getHeaderDecorator(),
					getCompressionPolicy(), getBroadcastCoordinator(), getLifecycleObserver());
		} catch (IOException e) {
			getLifecycleObserver().didReceiveLogEvent(LogEvent.with(LogEventType.CONSUMER_HANDSHAKE_FAILED,
							format("Unable to write handshake response for %s", request))
					.request(request)
					.throwable(e)
					.build());
			getLifecycleObserver().didFailToEstablishConsumer(request, e);
			throw e;
		} catch (RuntimeException e) {
			getLifecycleObserver().didFailToEstablishConsumer(request, e);
			throw e;
		}

		try {
			getBroadcastCoordinator().register(consumerSession);
		} catch (IllegalStateException e) {
			// Shut down while the handshake was being written
			consumerSession.abandon(Consumer.TerminationReason.SHUTDOWN, null);
			throw e;
		}

		getLifecycleObserver().didEstablishConsumer(consumerSession);

		try {
			getExecutorService().execute(consumerSession::deliver);
		} catch (RejectedExecutionException e) {
			if (getBroadcastCoordinator().isClosed()) {
				consumerSession.abandon(Consumer.TerminationReason.SHUTDOWN, null);
			} else {
				getLifecycleObserver().didReceiveLogEvent(LogEvent.with(LogEventType.CONSUMER_DELIVERY_FAILED,
								"Unable to start consumer delivery loop")
						.consumer(consumerSession)
						.throwable(e)
						.build());
				consumerSession.abandon(Consumer.TerminationReason.UNKNOWN, e);
			}
		}
	}

	@Override
	public void publish(@NonNull Message message) {
		requireNonNull(message);

		if (getBroadcastCoordinator().isClosed())
			return;

		// Encoded exactly once, shared by every consumer
		getBroadcastCoordinator().publish(message, MessageEncoder.encode(message));
	}

	@Override
	@NonNull
	public Integer getConsumerCount() {
		return getBroadcastCoordinator().count();
	}

	@Override
	public void shutdown() {
		getShutdownLock().lock();

		try {
			if (this.shutdownCompleted)
				return;

			this.shutdownCompleted = true;

			List<ConsumerSession> consumerSessions = getBroadcastCoordinator().shutdown();

			// Closed queues tell every delivery loop to close its connection and exit.
			// The executor belongs to this event source, even if it came from a caller-provided supplier.
			getExecutorService().shutdown();

			try {
				long shutdownTimeoutInMillis = getSettings().getShutdownTimeout().toMillis();

				if (!getExecutorService().awaitTermination(shutdownTimeoutInMillis, TimeUnit.MILLISECONDS)) {
					getLifecycleObserver().didReceiveLogEvent(LogEvent.with(LogEventType.EVENT_SOURCE_SHUTDOWN_TIMED_OUT,
							format("Consumer delivery loops did not finish within %d ms, interrupting them", shutdownTimeoutInMillis)).build());
					getExecutorService().shutdownNow();
				}
			} catch (InterruptedException e) {
				getExecutorService().shutdownNow();
				Thread.currentThread().interrupt();
			}

			// No-op for every session whose loop already closed its connection
			for (ConsumerSession consumerSession : consumerSessions)
				consumerSession.terminate(Consumer.TerminationReason.SHUTDOWN, null);

			getLifecycleObserver().didShutdown(this);
		} finally {
			getShutdownLock().unlock();
		}
	}

	@Override
	@NonNull
	public Boolean isShutdown() {
		return getBroadcastCoordinator().isClosed();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{settings=%s, consumerCount=%d, shutdown=%s}", getClass().getSimpleName(),
				getSettings(), getConsumerCount(), isShutdown());
	}

	@Override
	@NonNull
	public Settings getSettings() {
		return this.settings;
	}

	@NonNull
	private HeaderDecorator getHeaderDecorator() {
		return this.headerDecorator;
	}

	@NonNull
	private CompressionPolicy getCompressionPolicy() {
		return this.compressionPolicy;
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	private ExecutorService getExecutorService() {
		return this.executorService;
	}

	@NonNull
	private BroadcastCoordinator getBroadcastCoordinator() {
		return this.broadcastCoordinator;
	}

	@NonNull
	private ReentrantLock getShutdownLock() {
		return this.shutdownLock;
	}
}
