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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class BroadcastCoordinatorTests {
	private static final Request REQUEST = Request.with("GET", "/events").build();

	@Test
	@Timeout(value = 10, unit = SECONDS)
	public void fullQueueDropsMessagesForThatConsumerOnly() throws Exception {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		BroadcastCoordinator broadcastCoordinator = new BroadcastCoordinator(new SafeLifecycleObserver(lifecycleObserver));
		Settings settings = Settings.withDefaults().queueCapacity(2).build();

		// Neither session runs a delivery loop, so nothing drains their queues
		ConsumerSession small = openSession(broadcastCoordinator, settings, lifecycleObserver);
		ConsumerSession large = openSession(broadcastCoordinator, Settings.withDefaults().queueCapacity(5).build(), lifecycleObserver);
		broadcastCoordinator.register(small);
		broadcastCoordinator.register(large);

		for (int i = 1; i <= 4; i++)
			publish(broadcastCoordinator, "m" + i);

		assertEquals(List.of(message("m3"), message("m4")), lifecycleObserver.droppedMessages,
				"Messages beyond the small consumer's capacity should be dropped, in order");
		assertEquals(2, broadcastCoordinator.count(), "Dropping never unregisters a consumer");
	}

	@Test
	@Timeout(value = 10, unit = SECONDS)
	public void slowConsumerMissesMessagesButKeepsOrder() throws Exception {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		CountDownLatch writeBlocked = new CountDownLatch(1);
		CountDownLatch releaseWrite = new CountDownLatch(1);

		try (EventSource eventSource = EventSource.withSettings(Settings.withDefaults().queueCapacity(2).build())
				.lifecycleObserver(lifecycleObserver)
				.build()) {
			RecordingConnection connection = new RecordingConnection((writeIndex, bytes, timeout) -> {
				if (writeIndex != 1)
					return;

				writeBlocked.countDown();

				try {
					releaseWrite.await(5, SECONDS);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new InterruptedIOException("Interrupted while blocked");
				}
			});

			eventSource.accept(connection, REQUEST);

			eventSource.publishEvent("m1", "", "");
			assertTrue(writeBlocked.await(5, SECONDS), "First write should be in progress");

			// m1 is being written; m2 and m3 fill the queue; m4 and m5 are dropped
			for (int i = 2; i <= 5; i++)
				eventSource.publishEvent("m" + i, "", "");

			assertEquals(List.of(message("m4"), message("m5")), lifecycleObserver.droppedMessages);

			releaseWrite.countDown();
			assertTrue(connection.awaitOutputContaining("data: m3\n\n", Duration.ofSeconds(5)));

			eventSource.publishEvent("m6", "", "");
			assertTrue(connection.awaitOutputContaining("data: m6\n\n", Duration.ofSeconds(5)));

			String output = connection.getOutput();
			String body = output.substring(output.indexOf("\r\n\r\n") + 4);

			assertEquals("data: m1\n\ndata: m2\n\ndata: m3\n\ndata: m6\n\n", body, "Delivered messages should be in publish order with no duplicates");
			assertEquals(1, eventSource.getConsumerCount());
		}
	}

	@Test
	public void markStaleIsIdempotentAndStaleSessionsAreNotOfferedMessages() throws Exception {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		BroadcastCoordinator broadcastCoordinator = new BroadcastCoordinator(new SafeLifecycleObserver(lifecycleObserver));
		Settings settings = Settings.withDefaults().queueCapacity(1).build();

		ConsumerSession consumerSession = openSession(broadcastCoordinator, settings, lifecycleObserver);
		broadcastCoordinator.register(consumerSession);

		assertTrue(broadcastCoordinator.markStale(consumerSession));
		assertFalse(broadcastCoordinator.markStale(consumerSession), "Second removal should have no effect");
		assertEquals(0, broadcastCoordinator.count());

		// Would overflow a capacity-1 queue if the session were still offered messages
		publish(broadcastCoordinator, "a");
		publish(broadcastCoordinator, "b");

		assertEquals(0, lifecycleObserver.droppedMessages.size());
	}

	@Test
	@Timeout(value = 30, unit = SECONDS)
	public void countStaysWithinBoundsUnderConcurrentRegistrationAndRemoval() throws Exception {
		int threadCount = 8;
		int iterationsPerThread = 250;

		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		BroadcastCoordinator broadcastCoordinator = new BroadcastCoordinator(new SafeLifecycleObserver(lifecycleObserver));
		Settings settings = Settings.defaultInstance();
		ExecutorService executorService = Executors.newFixedThreadPool(threadCount + 1);
		AtomicBoolean finished = new AtomicBoolean(false);
		AtomicInteger outOfBoundsCount = new AtomicInteger(0);

		try {
			Future<?> reader = executorService.submit(() -> {
				while (!finished.get()) {
					int count = broadcastCoordinator.count();

					if (count < 0 || count > threadCount)
						outOfBoundsCount.incrementAndGet();
				}
			});

			List<Future<?>> writers = new ArrayList<>(threadCount);

			for (int t = 0; t < threadCount; t++) {
				writers.add(executorService.submit(() -> {
					for (int i = 0; i < iterationsPerThread; i++) {
						ConsumerSession consumerSession = openSession(broadcastCoordinator, settings, lifecycleObserver);
						broadcastCoordinator.register(consumerSession);
						publish(broadcastCoordinator, "x");
						broadcastCoordinator.markStale(consumerSession);
					}

					return null;
				}));
			}

			for (Future<?> writer : writers)
				writer.get();

			finished.set(true);
			reader.get();
		} finally {
			executorService.shutdownNow();
		}

		assertEquals(0, outOfBoundsCount.get(), "Each writer holds at most one registration at a time");
		assertEquals(0, broadcastCoordinator.count());
	}

	@Test
	public void shutdownClosesIntakeAndIsIdempotent() throws Exception {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		BroadcastCoordinator broadcastCoordinator = new BroadcastCoordinator(new SafeLifecycleObserver(lifecycleObserver));
		Settings settings = Settings.defaultInstance();

		for (int i = 0; i < 3; i++)
			broadcastCoordinator.register(openSession(broadcastCoordinator, settings, lifecycleObserver));

		assertEquals(3, broadcastCoordinator.shutdown().size());
		assertEquals(0, broadcastCoordinator.count());
		assertTrue(broadcastCoordinator.isClosed());
		assertEquals(0, broadcastCoordinator.shutdown().size(), "Repeated shutdown should have no effect");

		ConsumerSession late = openSession(broadcastCoordinator, settings, lifecycleObserver);
		Assertions.assertThrows(IllegalStateException.class, () -> broadcastCoordinator.register(late));

		// No-op rather than an error
		publish(broadcastCoordinator, "after");
		assertEquals(0, lifecycleObserver.droppedMessages.size());
	}

	@Test
	@Timeout(value = 10, unit = SECONDS)
	public void shutdownLeavesQueuedMessagesForDelivery() throws Exception {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		BroadcastCoordinator broadcastCoordinator = new BroadcastCoordinator(new SafeLifecycleObserver(lifecycleObserver));
		RecordingConnection connection = new RecordingConnection();
		ConsumerSession consumerSession = openSession(broadcastCoordinator, connection,
				Settings.withDefaults().queueCapacity(2).build(), lifecycleObserver);

		broadcastCoordinator.register(consumerSession);
		publish(broadcastCoordinator, "a");
		publish(broadcastCoordinator, "b");
		broadcastCoordinator.shutdown();

		// Runs on this thread: drains the queue, then sees it is closed
		consumerSession.deliver();

		String output = connection.getOutput();

		assertEquals("data: a\n\ndata: b\n\n", output.substring(output.indexOf("\r\n\r\n") + 4));
		assertEquals(List.of(Consumer.TerminationReason.SHUTDOWN), lifecycleObserver.terminationReasons);
		assertEquals(1, connection.getCloseCount());
	}

	@Test
	@Timeout(value = 10, unit = SECONDS)
	public void markStaleDiscardsQueuedMessages() throws Exception {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		BroadcastCoordinator broadcastCoordinator = new BroadcastCoordinator(new SafeLifecycleObserver(lifecycleObserver));
		RecordingConnection connection = new RecordingConnection();
		ConsumerSession consumerSession = openSession(broadcastCoordinator, connection,
				Settings.withDefaults().queueCapacity(2).build(), lifecycleObserver);

		broadcastCoordinator.register(consumerSession);
		publish(broadcastCoordinator, "a");
		publish(broadcastCoordinator, "b");
		broadcastCoordinator.markStale(consumerSession);

		consumerSession.deliver();

		assertEquals(1, connection.getWriteCount(), "Only the handshake should have been written");
		assertEquals(1, connection.getCloseCount());
	}

	private static ConsumerSession openSession(BroadcastCoordinator broadcastCoordinator,
																						 Settings settings,
																						 LifecycleObserver lifecycleObserver) throws IOException {
		return openSession(broadcastCoordinator, new RecordingConnection(), settings, lifecycleObserver);
	}

	private static ConsumerSession openSession(BroadcastCoordinator broadcastCoordinator,
																						 RecordingConnection connection,
																						 Settings settings,
																						 LifecycleObserver lifecycleObserver) throws IOException {
		return ConsumerSession.open(connection, REQUEST, settings, (request) -> List.of(),
				CompressionPolicy.disabledInstance(), broadcastCoordinator, new SafeLifecycleObserver(lifecycleObserver));
	}

	private static void publish(BroadcastCoordinator broadcastCoordinator, String data) {
		EventMessage eventMessage = message(data);
		broadcastCoordinator.publish(eventMessage, MessageEncoder.encode(eventMessage));
	}

	private static EventMessage message(String data) {
		return EventMessage.withData(data).build();
	}
}
