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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import javax.annotation.concurrent.ThreadSafe;
import java.io.InputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static java.lang.String.format;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Exercises {@link EventSourceServer} over loopback sockets.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class EventSourceServerTests {
	private static final String HOST = "127.0.0.1";
	private static final String EVENT_STREAM_REQUEST = "GET /events HTTP/1.1\r\nHost: localhost\r\nAccept: text/event-stream\r\n\r\n";

	@Test
	@Timeout(value = 15, unit = SECONDS)
	public void handshakeThenEvents() throws Exception {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();

		try (EventSource eventSource = EventSource.withSettings(Settings.defaultInstance()).lifecycleObserver(lifecycleObserver).build();
				 EventSourceServer eventSourceServer = startServer(eventSource);
				 Socket socket = connect(eventSourceServer)) {
			TestSupport.writeRequest(socket, EVENT_STREAM_REQUEST);
			assertTrue(lifecycleObserver.awaitEstablished(1));

			InputStream in = socket.getInputStream();
			String handshake = TestSupport.readUntil(in, "\r\n\r\n", 5_000);

			assertTrue(handshake.startsWith("HTTP/1.1 200 OK\r\n"), handshake);
			assertTrue(handshake.contains("Content-Type: text/event-stream\r\n"), handshake);
			assertTrue(handshake.contains("Cache-Control: no-cache\r\n"), handshake);
			assertFalse(handshake.contains("Content-Encoding"), "Compression is disabled by default");

			eventSource.publishEvent("hello", "greeting", "1");
			eventSource.publishEvent("line one\nline two", "", "");

			String events = TestSupport.readUntil(in, "data: line two\n\n", 5_000);

			assertTrue(events.contains("id: 1\nevent: greeting\ndata: hello\n\n"), events);
			assertTrue(events.contains("data: line one\ndata: line two\n\n"), events);
		}
	}

	@Test
	@Timeout(value = 15, unit = SECONDS)
	public void decoratorHeadersAppearInHandshake() throws Exception {
		try (EventSource eventSource = EventSource.create(Settings.defaultInstance(),
				(request) -> List.of("X-Accel-Buffering: no", format("X-Requested-Path: %s", request.getUri())));
				 EventSourceServer eventSourceServer = startServer(eventSource);
				 Socket socket = connect(eventSourceServer)) {
			TestSupport.writeRequest(socket, EVENT_STREAM_REQUEST);

			String handshake = TestSupport.readUntil(socket.getInputStream(), "\r\n\r\n", 5_000);

			assertTrue(handshake.contains("X-Accel-Buffering: no\r\n"), handshake);
			assertTrue(handshake.contains("X-Requested-Path: /events\r\n"), handshake);
		}
	}

	@Test
	@Timeout(value = 20, unit = SECONDS)
	public void disconnectedClientIsRemovedAndOthersKeepReceiving() throws Exception {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();

		try (EventSource eventSource = EventSource.withSettings(Settings.defaultInstance()).lifecycleObserver(lifecycleObserver).build();
				 EventSourceServer eventSourceServer = startServer(eventSource);
				 Socket survivor = connect(eventSourceServer)) {
			Socket departing = connect(eventSourceServer);

			TestSupport.writeRequest(survivor, EVENT_STREAM_REQUEST);
			TestSupport.writeRequest(departing, EVENT_STREAM_REQUEST);
			assertTrue(lifecycleObserver.awaitEstablished(2));
			assertEquals(2, eventSource.getConsumerCount());

			departing.close();

			// Writes to a vanished peer eventually fail, which removes that consumer
			long deadline = System.currentTimeMillis() + 10_000;

			while (eventSource.getConsumerCount() > 1 && System.currentTimeMillis() < deadline) {
				eventSource.publishEvent("ping", "", "");
				Thread.sleep(25);
			}

			assertEquals(1, eventSource.getConsumerCount());
			assertTrue(lifecycleObserver.awaitTerminated(1));

			try (Socket newcomer = connect(eventSourceServer)) {
				TestSupport.writeRequest(newcomer, EVENT_STREAM_REQUEST);
				assertTrue(lifecycleObserver.awaitEstablished(1));
				assertEquals(2, eventSource.getConsumerCount());

				eventSource.publishEvent("test", "", "1\n1");

				String newcomerOutput = TestSupport.readUntil(newcomer.getInputStream(), "data: test\n\n", 5_000);
				String survivorOutput = TestSupport.readUntil(survivor.getInputStream(), "data: test\n\n", 5_000);

				assertTrue(newcomerOutput.endsWith("id: 11\ndata: test\n\n"), newcomerOutput);
				assertFalse(newcomerOutput.contains("ping"), "Consumers only receive messages published after they connect");
				assertTrue(survivorOutput.contains("data: ping\n\n"), survivorOutput);
				assertTrue(survivorOutput.endsWith("id: 11\ndata: test\n\n"), survivorOutput);
			}
		}
	}

	@Test
	@Timeout(value = 15, unit = SECONDS)
	public void idleConsumerIsDisconnected() throws Exception {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		Settings settings = Settings.withDefaults().idleTimeout(Duration.ofMillis(300)).build();

		try (EventSource eventSource = EventSource.withSettings(settings).lifecycleObserver(lifecycleObserver).build();
				 EventSourceServer eventSourceServer = startServer(eventSource);
				 Socket socket = connect(eventSourceServer)) {
			TestSupport.writeRequest(socket, EVENT_STREAM_REQUEST);

			String output = new String(TestSupport.readToEnd(socket.getInputStream(), 5_000), StandardCharsets.UTF_8);

			assertTrue(output.startsWith("HTTP/1.1 200 OK\r\n"), output);
			assertTrue(lifecycleObserver.awaitTerminated(1));
			assertEquals(List.of(Consumer.TerminationReason.IDLE_TIMEOUT), lifecycleObserver.terminationReasons);
			assertEquals(0, eventSource.getConsumerCount());
		}
	}

	@Test
	@Timeout(value = 15, unit = SECONDS)
	public void malformedRequestReceives400() throws Exception {
		try (EventSource eventSource = EventSource.create(Settings.defaultInstance(), (request) -> List.of());
				 EventSourceServer eventSourceServer = startServer(eventSource);
				 Socket socket = connect(eventSourceServer)) {
			TestSupport.writeRequest(socket, "this is not http\r\n\r\n");

			String response = new String(TestSupport.readToEnd(socket.getInputStream(), 5_000), StandardCharsets.UTF_8);

			assertTrue(response.startsWith("HTTP/1.1 400 Bad Request\r\n"), response);
			assertEquals(0, eventSource.getConsumerCount());
		}
	}

	@Test
	@Timeout(value = 15, unit = SECONDS)
	public void nonGetRequestReceives405() throws Exception {
		try (EventSource eventSource = EventSource.create(Settings.defaultInstance(), (request) -> List.of());
				 EventSourceServer eventSourceServer = startServer(eventSource);
				 Socket socket = connect(eventSourceServer)) {
			TestSupport.writeRequest(socket, "POST /events HTTP/1.1\r\nHost: localhost\r\nContent-Length: 0\r\n\r\n");

			String response = new String(TestSupport.readToEnd(socket.getInputStream(), 5_000), StandardCharsets.UTF_8);

			assertTrue(response.startsWith("HTTP/1.1 405 Method Not Allowed\r\n"), response);
			assertTrue(response.contains("Allow: GET\r\n"), response);
			assertEquals(0, eventSource.getConsumerCount());
		}
	}

	@Test
	@Timeout(value = 15, unit = SECONDS)
	public void oversizedRequestReceives431() throws Exception {
		try (EventSource eventSource = EventSource.create(Settings.defaultInstance(), (request) -> List.of());
				 EventSourceServer eventSourceServer = EventSourceServer.withEventSource(eventSource)
						 .host(HOST)
						 .maximumRequestSizeInBytes(256)
						 .build()) {
			eventSourceServer.start();

			try (Socket socket = connect(eventSourceServer)) {
				// No terminating blank line; the head just keeps growing
				TestSupport.writeRequest(socket, "GET /events HTTP/1.1\r\nX-Padding: " + "a".repeat(400) + "\r\n");

				String response = new String(TestSupport.readToEnd(socket.getInputStream(), 5_000), StandardCharsets.UTF_8);

				assertTrue(response.startsWith("HTTP/1.1 431 Request Header Fields Too Large\r\n"), response);
			}
		}
	}

	@Test
	@Timeout(value = 15, unit = SECONDS)
	public void silentClientIsDisconnectedAfterRequestTimeout() throws Exception {
		try (EventSource eventSource = EventSource.create(Settings.defaultInstance(), (request) -> List.of());
				 EventSourceServer eventSourceServer = EventSourceServer.withEventSource(eventSource)
						 .host(HOST)
						 .requestTimeout(Duration.ofMillis(300))
						 .build()) {
			eventSourceServer.start();

			try (Socket socket = connect(eventSourceServer)) {
				byte[] response = TestSupport.readToEnd(socket.getInputStream(), 5_000);

				assertEquals(0, response.length, "Nothing should be written to a client that never sent a request");
			}
		}
	}

	@Test
	@Timeout(value = 15, unit = SECONDS)
	public void shutdownClosesClientSockets() throws Exception {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		EventSource eventSource = EventSource.withSettings(Settings.defaultInstance()).lifecycleObserver(lifecycleObserver).build();

		try (EventSourceServer eventSourceServer = startServer(eventSource);
				 Socket first = connect(eventSourceServer);
				 Socket second = connect(eventSourceServer)) {
			TestSupport.writeRequest(first, EVENT_STREAM_REQUEST);
			TestSupport.writeRequest(second, EVENT_STREAM_REQUEST);
			assertTrue(lifecycleObserver.awaitEstablished(2));

			eventSource.shutdown();

			// Both streams end cleanly
			TestSupport.readToEnd(first.getInputStream(), 5_000);
			TestSupport.readToEnd(second.getInputStream(), 5_000);

			assertTrue(lifecycleObserver.awaitTerminated(2));
			assertEquals(1, lifecycleObserver.shutdownCount.get());
			assertTrue(eventSourceServer.isStarted(), "Stopping the event source leaves the server running");
		}
	}

	@Test
	public void stoppingServerLeavesEventSourceRunning() {
		try (EventSource eventSource = EventSource.create(Settings.defaultInstance(), (request) -> List.of())) {
			EventSourceServer eventSourceServer = startServer(eventSource);

			assertTrue(eventSourceServer.isStarted());
			assertTrue(eventSourceServer.getLocalPort().isPresent());

			eventSourceServer.stop();
			eventSourceServer.stop();

			assertFalse(eventSourceServer.isStarted());
			assertFalse(eventSourceServer.getLocalPort().isPresent());
			assertFalse(eventSource.isShutdown());
		}
	}

	private static EventSourceServer startServer(EventSource eventSource) {
		EventSourceServer eventSourceServer = EventSourceServer.withEventSource(eventSource)
				.host(HOST)
				.port(0)
				.build();

		eventSourceServer.start();
		return eventSourceServer;
	}

	private static Socket connect(EventSourceServer eventSourceServer) throws Exception {
		Socket socket = TestSupport.connectWithRetry(HOST, eventSourceServer.getLocalPort().get(), 2_000);
		socket.setSoTimeout(200);
		return socket;
	}
}
