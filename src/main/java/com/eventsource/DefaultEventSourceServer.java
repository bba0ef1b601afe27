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
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

import static com.eventsource.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultEventSourceServer implements EventSourceServer {
	@NonNull
	private static final Integer DEFAULT_PORT;
	@NonNull
	private static final String DEFAULT_HOST;
	@NonNull
	private static final Duration DEFAULT_REQUEST_TIMEOUT;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
	@NonNull
	private static final Integer DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
	@NonNull
	private static final byte[] FAILSAFE_HTTP_400_RESPONSE;
	@NonNull
	private static final byte[] FAILSAFE_HTTP_405_RESPONSE;
	@NonNull
	private static final byte[] FAILSAFE_HTTP_431_RESPONSE;

	static {
		DEFAULT_PORT = 0;
		DEFAULT_HOST = "0.0.0.0";
		DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);
		DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES = 64 * 1_024;
		DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES = 1_024;

		FAILSAFE_HTTP_400_RESPONSE = createFailsafeHttpResponse(400, "Bad Request", List.of());
		FAILSAFE_HTTP_405_RESPONSE = createFailsafeHttpResponse(405, "Method Not Allowed", List.of("Allow: GET"));
		FAILSAFE_HTTP_431_RESPONSE = createFailsafeHttpResponse(431, "Request Header Fields Too Large", List.of());
	}

	@NonNull
	private final EventSource eventSource;
	@NonNull
	private final Integer port;
	@NonNull
	private final String host;
	@NonNull
	private final Duration requestTimeout;
	@NonNull
	private final Integer maximumRequestSizeInBytes;
	@NonNull
	private final Integer requestReadBufferSizeInBytes;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final ReentrantLock lock;

	// The below fields are guarded by lock
	private boolean started;
	@Nullable
	private ServerSocketChannel serverSocketChannel;
	@Nullable
	private Integer localPort;
	@Nullable
	private Thread acceptorThread;
	@Nullable
	private ExecutorService requestHandlerExecutorService;
	@Nullable
	private ExecutorService requestReaderExecutorService;

	DefaultEventSourceServer(@NonNull Builder builder) {
		requireNonNull(builder);

		this.eventSource = builder.eventSource;
		this.port = builder.port != null ? builder.port : DEFAULT_PORT;
		this.host = builder.host != null ? builder.host : DEFAULT_HOST;
		this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : DEFAULT_REQUEST_TIMEOUT;
		this.maximumRequestSizeInBytes = builder.maximumRequestSizeInBytes != null ? builder.maximumRequestSizeInBytes : DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
		this.requestReadBufferSizeInBytes = builder.requestReadBufferSizeInBytes != null ? builder.requestReadBufferSizeInBytes : DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
		this.lifecycleObserver = new SafeLifecycleObserver(builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance());
		this.lock = new ReentrantLock();

		if (this.port < 0 || this.port > 65_535)
			throw new IllegalArgumentException(format("Port must be in the range [0, 65535]. You supplied %d", this.port));

		if (this.requestTimeout.isNegative() || this.requestTimeout.isZero())
			throw new IllegalArgumentException(format("Request timeout must be > 0. You supplied '%s'", this.requestTimeout));

		if (this.maximumRequestSizeInBytes < 1)
			throw new IllegalArgumentException(format("Maximum request size must be > 0. You supplied %d", this.maximumRequestSizeInBytes));

		if (this.requestReadBufferSizeInBytes < 1)
			throw new IllegalArgumentException(format("Request read buffer size must be > 0. You supplied %d", this.requestReadBufferSizeInBytes));
	}

	@Override
	public void start() {
		getLock().lock();

		try {
			if (this.started)
				return;

			ServerSocketChannel serverSocketChannel;

			try {
				serverSocketChannel = ServerSocketChannel.open();
				serverSocketChannel.bind(new InetSocketAddress(getHost(), getPort()));
			} catch (IOException e) {
				throw new UncheckedIOException(format("Unable to bind to %s:%d", getHost(), getPort()), e);
			}

			this.serverSocketChannel = serverSocketChannel;
			this.localPort = serverSocketChannel.socket().getLocalPort();
			this.requestHandlerExecutorService = Executors.newCachedThreadPool(Utilities.createDaemonThreadFactory("eventsource-server-request-handler"));
			this.requestReaderExecutorService = Executors.newCachedThreadPool(Utilities.createDaemonThreadFactory("eventsource-server-request-reader"));

			ExecutorService requestHandlerExecutorService = this.requestHandlerExecutorService;

			this.acceptorThread = Utilities.createDaemonThreadFactory("eventsource-server-acceptor")
					.newThread(() -> acceptConnections(serverSocketChannel, requestHandlerExecutorService));
			this.acceptorThread.start();

			this.started = true;
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void stop() {
		ServerSocketChannel serverSocketChannelSnapshot;
		Thread acceptorThreadSnapshot;
		ExecutorService requestHandlerExecutorServiceSnapshot;
		ExecutorService requestReaderExecutorServiceSnapshot;

		getLock().lock();

		try {
			if (!this.started)
				return;

			serverSocketChannelSnapshot = this.serverSocketChannel;
			acceptorThreadSnapshot = this.acceptorThread;
			requestHandlerExecutorServiceSnapshot = this.requestHandlerExecutorService;
			requestReaderExecutorServiceSnapshot = this.requestReaderExecutorService;

			this.started = false;
			this.serverSocketChannel = null;
			this.localPort = null;
			this.acceptorThread = null;
			this.requestHandlerExecutorService = null;
			this.requestReaderExecutorService = null;
		} finally {
			getLock().unlock();
		}

		// Close server socket to unblock accept()
		if (serverSocketChannelSnapshot != null) {
			try {
				serverSocketChannelSnapshot.close();
			} catch (IOException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to close server socket channel").throwable(e).build());
			}
		}

		// In-flight request reads are abandoned
		if (requestReaderExecutorServiceSnapshot != null)
			requestReaderExecutorServiceSnapshot.shutdownNow();

		if (requestHandlerExecutorServiceSnapshot != null)
			requestHandlerExecutorServiceSnapshot.shutdown();

		if (acceptorThreadSnapshot != null) {
			try {
				acceptorThreadSnapshot.join(getRequestTimeout().toMillis());
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}
	}

	protected void acceptConnections(@NonNull ServerSocketChannel serverSocketChannel,
																	 @NonNull ExecutorService requestHandlerExecutorService) {
		requireNonNull(serverSocketChannel);
		requireNonNull(requestHandlerExecutorService);

		try {
			while (true) {
				SocketChannel clientSocketChannel = serverSocketChannel.accept();
				clientSocketChannel.socket().setTcpNoDelay(true);

				try {
					requestHandlerExecutorService.execute(() -> handleClientSocketChannel(clientSocketChannel));
				} catch (RejectedExecutionException e) {
					// Stopping; nobody will handle this client
					closeQuietly(clientSocketChannel);
					break;
				}
			}
		} catch (ClosedChannelException ignored) {
			// Expected during stop(), including AsynchronousCloseException
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Acceptor encountered an I/O error and is exiting").throwable(e).build());
		}
	}

	protected void handleClientSocketChannel(@NonNull SocketChannel clientSocketChannel) {
		requireNonNull(clientSocketChannel);

		Request request;

		try {
			request = parseRequest(readRequest(clientSocketChannel));
		} catch (IllegalRequestException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_UNPARSEABLE_REQUEST, "Unable to parse request").throwable(e).build());
			writeFailsafeResponseAndClose(clientSocketChannel, FAILSAFE_HTTP_400_RESPONSE);
			return;
		} catch (RequestTooLargeIOException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_UNPARSEABLE_REQUEST, e.getMessage()).build());
			writeFailsafeResponseAndClose(clientSocketChannel, FAILSAFE_HTTP_431_RESPONSE);
			return;
		} catch (IOException e) {
			// Client went away or took too long to send its request
			safelyLog(LogEvent.with(LogEventType.SERVER_UNPARSEABLE_REQUEST, "Unable to read request").throwable(e).build());
			closeQuietly(clientSocketChannel);
			return;
		}

		if (!"GET".equals(request.getHttpMethod())) {
			writeFailsafeResponseAndClose(clientSocketChannel, FAILSAFE_HTTP_405_RESPONSE);
			return;
		}

		Connection connection;

		try {
			connection = SocketChannelConnection.fromSocketChannel(clientSocketChannel);
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to prepare client connection")
					.request(request)
					.throwable(e)
					.build());
			closeQuietly(clientSocketChannel);
			return;
		}

		try {
			getEventSource().accept(connection, request);
		} catch (IOException | RuntimeException e) {
			// The event source has already closed the connection
			safelyLog(LogEvent.with(LogEventType.SERVER_CONNECTION_REJECTED, format("Unable to hand off %s", request))
					.request(request)
					.throwable(e)
					.build());
		}
	}

	/**
	 * Reads the request head (up to and including the blank line) within the request timeout.
	 * The channel is in blocking mode, so the read runs on a separate thread and is interrupted if it takes too long.
	 */
	@NonNull
	protected String readRequest(@NonNull SocketChannel clientSocketChannel) throws IOException {
		requireNonNull(clientSocketChannel);

		ExecutorService requestReaderExecutorService = getRequestReaderExecutorService().orElse(null);

		if (requestReaderExecutorService == null)
			throw new IOException("Server is stopping");

		long timeoutInMillis = Math.max(1L, getRequestTimeout().toMillis());
		Future<String> readFuture;

		try {
			readFuture = requestReaderExecutorService.submit(() -> readRequestHead(clientSocketChannel));
		} catch (RejectedExecutionException e) {
			throw new IOException("Server is stopping", e);
		}

		try {
			return readFuture.get(timeoutInMillis, TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			// Interrupting a blocked channel read closes the channel
			readFuture.cancel(true);
			throw new SocketTimeoutException(format("Reading request took longer than %d ms", timeoutInMillis));
		} catch (InterruptedException e) {
			readFuture.cancel(true);
			Thread.currentThread().interrupt();
			throw new InterruptedIOException("Interrupted while waiting for request to be read");
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();

			if (cause instanceof IOException ioException)
				throw ioException;

			throw new IOException("Unable to read request", cause);
		}
	}

	@NonNull
	private String readRequestHead(@NonNull SocketChannel clientSocketChannel) throws IOException {
		requireNonNull(clientSocketChannel);

		ByteBuffer buffer = ByteBuffer.allocate(getRequestReadBufferSizeInBytes());
		ByteArrayOutputStream requestBytes = new ByteArrayOutputStream(getRequestReadBufferSizeInBytes());

		while (true) {
			int bytesRead = clientSocketChannel.read(buffer);

			if (bytesRead == -1)
				throw new IOException("Client closed the connection before the request was complete");

			requestBytes.write(buffer.array(), 0, buffer.position());
			buffer.clear();

			// ISO-8859-1 maps header bytes 1:1 to chars
			String request = requestBytes.toString(StandardCharsets.ISO_8859_1);

			// CRLFCRLF preferred, else LFLF. Anything read past the terminator is discarded.
			int crlf = request.indexOf("\r\n\r\n");

			if (crlf != -1 && crlf + 4 <= getMaximumRequestSizeInBytes())
				return request.substring(0, crlf + 4);

			int lf = request.indexOf("\n\n");

			if (lf != -1 && lf + 2 <= getMaximumRequestSizeInBytes())
				return request.substring(0, lf + 2);

			if (requestBytes.size() > getMaximumRequestSizeInBytes())
				throw new RequestTooLargeIOException(format("Request too large (exceeded %d bytes)", getMaximumRequestSizeInBytes()));
		}
	}

	@NonNull
	protected Request parseRequest(@NonNull String rawRequest) {
		requireNonNull(rawRequest);

		rawRequest = trimAggressivelyToNull(rawRequest);

		if (rawRequest == null)
			throw new IllegalRequestException("Request has no data");

		// Example request:
		//
		// GET /events?channel=1 HTTP/1.1
		// Host: localhost:8080
		// Accept: text/event-stream
		// Accept-Encoding: gzip, deflate, br
		String[] lines = rawRequest.split("\r?\n", -1);
		String requestLine = trimAggressivelyToNull(lines[0]);

		if (requestLine == null)
			throw new IllegalRequestException("Request line is blank");

		String[] components = requestLine.split("\\s+");

		if (components.length != 3)
			throw new IllegalRequestException(format("Malformed request line '%s'. Expected '<METHOD> <request-target> HTTP/1.1'",
					Utilities.printableString(requestLine)));

		String httpMethod = components[0].toUpperCase(Locale.ENGLISH);
		String uri = components[1];
		String httpVersion = components[2];

		for (int i = 0; i < httpMethod.length(); i++) {
			char c = httpMethod.charAt(i);

			if (c < 'A' || c > 'Z')
				throw new IllegalRequestException(format("Malformed request line '%s'. Unable to parse HTTP method.",
						Utilities.printableString(requestLine)));
		}

		if (!"HTTP/1.1".equalsIgnoreCase(httpVersion) && !"HTTP/1.0".equalsIgnoreCase(httpVersion))
			throw new IllegalRequestException(format("Unsupported HTTP version '%s'", Utilities.printableString(httpVersion)));

		List<String> headerLines = new ArrayList<>(lines.length);

		for (int i = 1; i < lines.length; i++) {
			String line = lines[i];

			if (line.isEmpty())
				break;

			if (line.charAt(0) == ' ' || line.charAt(0) == '\t')
				throw new IllegalRequestException("Header folding is not supported");

			if (line.indexOf(':') <= 0)
				throw new IllegalRequestException(format("Malformed header line '%s'. Expected 'Header-Name: Value'",
						Utilities.printableString(line)));

			headerLines.add(line);
		}

		return Request.with(httpMethod, uri)
				.headers(Utilities.extractHeadersFromRawHeaderLines(headerLines))
				.build();
	}

	protected void writeFailsafeResponseAndClose(@NonNull SocketChannel clientSocketChannel,
																							 @NonNull byte[] response) {
		requireNonNull(clientSocketChannel);
		requireNonNull(response);

		try {
			ByteBuffer buffer = ByteBuffer.wrap(response);

			while (buffer.hasRemaining())
				clientSocketChannel.write(buffer);
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to write failsafe response").throwable(e).build());
		} finally {
			closeQuietly(clientSocketChannel);
		}
	}

	@NonNull
	private static byte[] createFailsafeHttpResponse(@NonNull Integer statusCode,
																									 @NonNull String reasonPhrase,
																									 @NonNull List<@NonNull String> extraHeaderLines) {
		requireNonNull(statusCode);
		requireNonNull(reasonPhrase);
		requireNonNull(extraHeaderLines);

		byte[] body = format("HTTP %d: %s", statusCode, reasonPhrase).getBytes(StandardCharsets.UTF_8);

		StringBuilder response = new StringBuilder()
				.append(format("HTTP/1.1 %d %s\r\n", statusCode, reasonPhrase))
				.append("Content-Type: text/plain; charset=UTF-8\r\n")
				.append(format("Content-Length: %d\r\n", body.length))
				.append("Connection: close\r\n");

		for (String extraHeaderLine : extraHeaderLines)
			response.append(extraHeaderLine).append("\r\n");

		response.append("\r\n");

		byte[] head = response.toString().getBytes(StandardCharsets.UTF_8);
		byte[] combined = new byte[head.length + body.length];
		System.arraycopy(head, 0, combined, 0, head.length);
		System.arraycopy(body, 0, combined, head.length, body.length);

		return combined;
	}

	private void closeQuietly(@NonNull SocketChannel socketChannel) {
		requireNonNull(socketChannel);

		try {
			socketChannel.close();
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to close client socket channel").throwable(e).build());
		}
	}

	protected void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);
		getLifecycleObserver().didReceiveLogEvent(logEvent);
	}

	@Override
	@NonNull
	public Boolean isStarted() {
		getLock().lock();

		try {
			return this.started;
		} finally {
			getLock().unlock();
		}
	}

	@Override
	@NonNull
	public Optional<Integer> getLocalPort() {
		getLock().lock();

		try {
			return Optional.ofNullable(this.localPort);
		} finally {
			getLock().unlock();
		}
	}

	@Override
	@NonNull
	public EventSource getEventSource() {
		return this.eventSource;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{host=%s, port=%d, started=%s}", getClass().getSimpleName(), getHost(), getPort(), isStarted());
	}

	@NonNull
	private Optional<ExecutorService> getRequestReaderExecutorService() {
		getLock().lock();

		try {
			return Optional.ofNullable(this.requestReaderExecutorService);
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	private Integer getPort() {
		return this.port;
	}

	@NonNull
	private String getHost() {
		return this.host;
	}

	@NonNull
	private Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	@NonNull
	private Integer getMaximumRequestSizeInBytes() {
		return this.maximumRequestSizeInBytes;
	}

	@NonNull
	private Integer getRequestReadBufferSizeInBytes() {
		return this.requestReadBufferSizeInBytes;
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	/**
	 * Thrown when a request head is structurally invalid.
	 */
	static final class IllegalRequestException extends RuntimeException {
		IllegalRequestException(@NonNull String message) {
			super(requireNonNull(message));
		}
	}

	/**
	 * Thrown when a request head exceeds the configured maximum size.
	 */
	static final class RequestTooLargeIOException extends IOException {
		RequestTooLargeIOException(@NonNull String message) {
			super(requireNonNull(message));
		}
	}
}
