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

import com.eventsource.ConsumerSession.QueuedMessage;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Owns the registry of live consumer sessions and serializes every change to it.
 * <p>
 * Registration, publishing, stale removal and shutdown hold the write lock; {@link #count()} holds the read lock.
 * No connection I/O and no observer callback ever happens while the lock is held.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class BroadcastCoordinator {
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final ReentrantReadWriteLock lock;
	// Guarded by lock; insertion-ordered, each session present at most once
	@NonNull
	private final List<@NonNull ConsumerSession> consumerSessions;
	// Guarded by lock
	@NonNull
	private State state;

	enum State {
		RUNNING,
		CLOSED
	}

	BroadcastCoordinator(@NonNull LifecycleObserver lifecycleObserver) {
		requireNonNull(lifecycleObserver);

		this.lifecycleObserver = lifecycleObserver;
		this.lock = new ReentrantReadWriteLock();
		this.consumerSessions = new ArrayList<>();
		this.state = State.RUNNING;
	}

	/**
	 * Adds a session to the registry.
	 *
	 * @throws IllegalStateException if the coordinator has been shut down
	 */
	void register(@NonNull ConsumerSession consumerSession) {
		requireNonNull(consumerSession);

		this.lock.writeLock().lock();

		try {
			if (this.state == State.CLOSED)
				throw new IllegalStateException(format("Cannot register a consumer: %s has been shut down", EventSource.class.getSimpleName()));

			this.consumerSessions.add(consumerSession);
		} finally {
			this.lock.writeLock().unlock();
		}
	}

	/**
	 * Offers an already-encoded message to every non-stale session without blocking.
	 * Sessions whose queues are full miss the message. Has no effect after shutdown.
	 */
	void publish(@NonNull Message message,
							 @NonNull byte[] bytes) {
		requireNonNull(message);
		requireNonNull(bytes);

		QueuedMessage queuedMessage = new QueuedMessage(message, bytes);
		List<ConsumerSession> droppingConsumerSessions = null;

		this.lock.writeLock().lock();

		try {
			if (this.state == State.CLOSED)
				return;

			for (ConsumerSession consumerSession : this.consumerSessions) {
				if (consumerSession.isStale())
					continue;

				if (!consumerSession.offer(queuedMessage)) {
					if (droppingConsumerSessions == null)
						droppingConsumerSessions = new ArrayList<>();

					droppingConsumerSessions.add(consumerSession);
				}
			}
		} finally {
			this.lock.writeLock().unlock();
		}

		if (droppingConsumerSessions != null)
			for (ConsumerSession droppingConsumerSession : droppingConsumerSessions)
				getLifecycleObserver().didDropMessage(droppingConsumerSession, message);
	}

	/**
	 * Removes a session from the registry and discards its queued messages. Removing a session that is not registered has no effect.
	 *
	 * @return {@code true} if the session was registered
	 */
	@NonNull
	Boolean markStale(@NonNull ConsumerSession consumerSession) {
		requireNonNull(consumerSession);

		this.lock.writeLock().lock();

		try {
			boolean removed = false;

			// Identity, not equality
			for (Iterator<ConsumerSession> iterator = this.consumerSessions.iterator(); iterator.hasNext(); ) {
				if (iterator.next() == consumerSession) {
					iterator.remove();
					removed = true;
					break;
				}
			}

			consumerSession.discardQueue();
			return removed;
		} finally {
			this.lock.writeLock().unlock();
		}
	}

	/**
	 * Closes intake, closes every registered session's queue and clears the registry.
	 * Messages already queued are still written by each session's delivery loop, within the shutdown timeout.
	 * Only the first invocation has any effect.
	 *
	 * @return the sessions that were registered at shutdown, empty on subsequent invocations
	 */
	@NonNull
	List<@NonNull ConsumerSession> shutdown() {
		this.lock.writeLock().lock();

		try {
			if (this.state == State.CLOSED)
				return List.of();

			this.state = State.CLOSED;

			List<ConsumerSession> consumerSessions = List.copyOf(this.consumerSessions);

			for (ConsumerSession consumerSession : consumerSessions)
				consumerSession.closeQueue();

			this.consumerSessions.clear();

			return consumerSessions;
		} finally {
			this.lock.writeLock().unlock();
		}
	}

	@NonNull
	Integer count() {
		this.lock.readLock().lock();

		try {
			return this.consumerSessions.size();
		} finally {
			this.lock.readLock().unlock();
		}
	}

	@NonNull
	Boolean isClosed() {
		this.lock.readLock().lock();

		try {
			return this.state == State.CLOSED;
		} finally {
			this.lock.readLock().unlock();
		}
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}
}
