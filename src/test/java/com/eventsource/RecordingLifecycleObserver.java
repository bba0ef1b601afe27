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
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link LifecycleObserver} which records callbacks so tests can wait on them.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
class RecordingLifecycleObserver implements LifecycleObserver {
	final Semaphore established = new Semaphore(0);
	final Semaphore terminated = new Semaphore(0);
	final Semaphore written = new Semaphore(0);
	final List<Consumer.TerminationReason> terminationReasons = new CopyOnWriteArrayList<>();
	final List<Throwable> establishFailures = new CopyOnWriteArrayList<>();
	final List<Message> droppedMessages = new CopyOnWriteArrayList<>();
	final List<Throwable> writeFailures = new CopyOnWriteArrayList<>();
	final List<LogEvent> logEvents = new CopyOnWriteArrayList<>();
	final AtomicInteger shutdownCount = new AtomicInteger(0);

	@Override
	public void didEstablishConsumer(Consumer consumer) {
		this.established.release();
	}

	@Override
	public void didFailToEstablishConsumer(Request request, Throwable throwable) {
		this.establishFailures.add(throwable);
	}

	@Override
	public void didTerminateConsumer(Consumer consumer, Duration connectionDuration, Consumer.TerminationReason terminationReason, Throwable throwable) {
		this.terminationReasons.add(terminationReason);
		this.terminated.release();
	}

	@Override
	public void didWriteMessage(Consumer consumer, Message message, Duration writeDuration) {
		this.written.release();
	}

	@Override
	public void didFailToWriteMessage(Consumer consumer, Message message, Duration writeDuration, Throwable throwable) {
		this.writeFailures.add(throwable);
	}

	@Override
	public void didDropMessage(Consumer consumer, Message message) {
		this.droppedMessages.add(message);
	}

	@Override
	public void didShutdown(EventSource eventSource) {
		this.shutdownCount.incrementAndGet();
	}

	@Override
	public void didReceiveLogEvent(LogEvent logEvent) {
		this.logEvents.add(logEvent);
	}

	boolean awaitEstablished(int count) throws InterruptedException {
		return this.established.tryAcquire(count, 5, TimeUnit.SECONDS);
	}

	boolean awaitTerminated(int count) throws InterruptedException {
		return this.terminated.tryAcquire(count, 5, TimeUnit.SECONDS);
	}

	boolean awaitWritten(int count) throws InterruptedException {
		return this.written.tryAcquire(count, 5, TimeUnit.SECONDS);
	}
}
