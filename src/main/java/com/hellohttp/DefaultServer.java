/*
 * Copyright 2022-2025 Revetware LLC.
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

package com.hellohttp;

import com.hellohttp.internal.microhttp.EventLoop;
import com.hellohttp.internal.microhttp.EventLoopListener;
import com.hellohttp.internal.microhttp.Handler;
import com.hellohttp.internal.microhttp.Header;
import com.hellohttp.internal.microhttp.LogEntry;
import com.hellohttp.internal.microhttp.Logger;
import com.hellohttp.internal.microhttp.MalformedRequestException;
import com.hellohttp.internal.microhttp.MicrohttpRequest;
import com.hellohttp.internal.microhttp.MicrohttpResponse;
import com.hellohttp.internal.microhttp.Options;
import com.hellohttp.internal.microhttp.OptionsBuilder;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link Server} backed by a non-blocking NIO event loop.
 * <p>
 * Requests are parsed, routed and answered on the connection event loop thread. The response for a request is
 * written only after the {@link RequestHandler} finalizes its {@link ResponseSink}; if the handler throws or
 * returns without finalizing, a fail-safe {@code 500} is written instead.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultServer implements Server {
	@NonNull
	private static final String DEFAULT_HOST;
	@NonNull
	private static final Integer DEFAULT_CONCURRENCY;
	@NonNull
	private static final Duration DEFAULT_REQUEST_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_SOCKET_SELECT_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_SHUTDOWN_TIMEOUT;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
	@NonNull
	private static final Integer DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
	@NonNull
	private static final Integer DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_CONNECTIONS;
	@NonNull
	private static final Duration FORCED_STOP_GRACE_PERIOD;

	private static final java.util.logging.@NonNull Logger logger = java.util.logging.Logger.getLogger(DefaultServer.class.getName());
	private static final java.util.logging.@NonNull Logger eventLoopLogger = java.util.logging.Logger.getLogger(EventLoop.class.getName());

	static {
		DEFAULT_HOST = "localhost";
		DEFAULT_CONCURRENCY = 1;
		DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
		DEFAULT_SOCKET_SELECT_TIMEOUT = Duration.ofMillis(100);
		DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);
		DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES = 1_024 * 1_024;
		DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES = 1_024 * 64;
		DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT = 128;
		DEFAULT_MAXIMUM_CONNECTIONS = 0;
		FORCED_STOP_GRACE_PERIOD = Duration.ofSeconds(1);
	}

	@NonNull
	private final Integer port;
	@NonNull
	private final String host;
	@NonNull
	private final Integer concurrency;
	@NonNull
	private final Duration requestTimeout;
	@NonNull
	private final Duration socketSelectTimeout;
	@NonNull
	private final Duration shutdownTimeout;
	@NonNull
	private final Integer maximumRequestSizeInBytes;
	@NonNull
	private final Integer requestReadBufferSizeInBytes;
	@NonNull
	private final Integer socketPendingConnectionLimit;
	@NonNull
	private final Integer maximumConnections;
	@NonNull
	private final ReentrantLock lock;
	@Nullable
	private volatile RequestHandler requestHandler;
	@Nullable
	private volatile LifecycleObserver lifecycleObserver;
	@Nullable
	private volatile EventLoop eventLoop;

	DefaultServer(@NonNull Builder builder) {
		requireNonNull(builder);

		this.lock = new ReentrantLock();

		this.port = builder.port;
		this.host = builder.host != null ? builder.host : DEFAULT_HOST;
		this.concurrency = builder.concurrency != null ? builder.concurrency : DEFAULT_CONCURRENCY;
		this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : DEFAULT_REQUEST_TIMEOUT;
		this.socketSelectTimeout = builder.socketSelectTimeout != null ? builder.socketSelectTimeout : DEFAULT_SOCKET_SELECT_TIMEOUT;
		this.shutdownTimeout = builder.shutdownTimeout != null ? builder.shutdownTimeout : DEFAULT_SHUTDOWN_TIMEOUT;
		this.maximumRequestSizeInBytes = builder.maximumRequestSizeInBytes != null ? builder.maximumRequestSizeInBytes : DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
		this.requestReadBufferSizeInBytes = builder.requestReadBufferSizeInBytes != null ? builder.requestReadBufferSizeInBytes : DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
		this.socketPendingConnectionLimit = builder.socketPendingConnectionLimit != null ? builder.socketPendingConnectionLimit : DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
		this.maximumConnections = builder.maximumConnections != null ? builder.maximumConnections : DEFAULT_MAXIMUM_CONNECTIONS;

		if (this.port < 0 || this.port > 65_535)
			throw new IllegalArgumentException(format("Port must be between 0 and 65535, but was %d", this.port));

		if (this.requestTimeout.isNegative() || this.requestTimeout.isZero())
			throw new IllegalArgumentException("Request timeout must be > 0");

		if (this.shutdownTimeout.isNegative())
			throw new IllegalArgumentException("Shutdown timeout must be >= 0");

		if (this.maximumConnections < 0)
			throw new IllegalArgumentException("Maximum connections must be >= 0");
	}

	@Override
	public void start() {
		getLock().lock();

		try {
			if (isStarted())
				return;

			RequestHandler requestHandler = getRequestHandler().orElse(null);

			if (requestHandler == null)
				throw new IllegalStateException(format("No %s was registered for %s", RequestHandler.class.getSimpleName(), getClass().getSimpleName()));

			Options options = OptionsBuilder.newBuilder()
					.withHost(getHost())
					.withPort(getPort())
					.withConcurrency(getConcurrency())
					.withRequestTimeout(getRequestTimeout())
					.withResolution(getSocketSelectTimeout())
					.withReadBufferSize(getRequestReadBufferSizeInBytes())
					.withMaxRequestSize(getMaximumRequestSizeInBytes())
					.withAcceptLength(getSocketPendingConnectionLimit())
					.withMaxConnections(getMaximumConnections())
					.build();

			Handler handler = (microhttpRequest, microhttpCallback) ->
					handleMicrohttpRequest(requestHandler, microhttpRequest, microhttpCallback);

			EventLoop eventLoop;

			try {
				eventLoop = new EventLoop(options, new JulEventLoopLogger(), handler, new ObservingEventLoopListener());
			} catch (IOException | RuntimeException e) {
				BindFailureReason bindFailureReason = BindFailureReason.fromThrowable(e);
				throw new ServerStartupException(bindFailureReason,
						format("Unable to bind %s:%d (%s): %s", getHost(), getPort(), bindFailureReason.name(), bindFailureReason.getDiagnostic()), e);
			}

			eventLoop.start();
			this.eventLoop = eventLoop;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	@Override
	public Boolean stop() {
		getLock().lock();

		try {
			EventLoop eventLoop = getEventLoop().orElse(null);

			if (eventLoop == null)
				return true;

			boolean drained = false;

			try {
				eventLoop.stop();
				drained = eventLoop.awaitTermination(getShutdownTimeout());

				if (!drained) {
					logger.warning(format("Connections did not drain within %s, closing them", getShutdownTimeout()));
					eventLoop.forceStop();
					eventLoop.awaitTermination(FORCED_STOP_GRACE_PERIOD);
				}
			} catch (InterruptedException e) {
				logger.warning("Interrupted while draining connections, closing them");
				eventLoop.forceStop();
				Thread.currentThread().interrupt();
			}

			return drained;
		} finally {
			this.eventLoop = null;
			getLock().unlock();
		}
	}

	@NonNull
	@Override
	public Boolean isStarted() {
		return getEventLoop().isPresent();
	}

	@NonNull
	@Override
	public Optional<Integer> getBoundPort() {
		EventLoop eventLoop = getEventLoop().orElse(null);

		if (eventLoop == null)
			return Optional.empty();

		try {
			int boundPort = eventLoop.getPort();
			return boundPort == -1 ? Optional.empty() : Optional.of(boundPort);
		} catch (IOException e) {
			logger.log(Level.FINE, "Unable to determine bound port", e);
			return Optional.empty();
		}
	}

	@Override
	public void initialize(@NonNull RequestHandler requestHandler,
												 @NonNull LifecycleObserver lifecycleObserver) {
		requireNonNull(requestHandler);
		requireNonNull(lifecycleObserver);

		this.requestHandler = requestHandler;
		this.lifecycleObserver = lifecycleObserver;
	}

	protected void handleMicrohttpRequest(@NonNull RequestHandler requestHandler,
																				@NonNull MicrohttpRequest microhttpRequest,
																				@NonNull Consumer<MicrohttpResponse> microhttpCallback) {
		requireNonNull(requestHandler);
		requireNonNull(microhttpRequest);
		requireNonNull(microhttpCallback);

		AtomicBoolean responseDelivered = new AtomicBoolean(false);
		ResponseSink responseSink = new DefaultResponseSink(marshaledResponse -> {
			responseDelivered.set(true);
			microhttpCallback.accept(toMicrohttpResponse(marshaledResponse));
		});

		try {
			RequestContext requestContext = RequestContext.withMethodAndUri(microhttpRequest.method(), microhttpRequest.uri())
					.headers(headersFromMicrohttpRequest(microhttpRequest))
					.remoteAddress(microhttpRequest.remoteAddress())
					.build();

			requestHandler.handleRequest(requestContext, responseSink);
		} catch (Throwable t) {
			logger.log(Level.SEVERE, format("Request handler failed for %s %s", microhttpRequest.method(), microhttpRequest.uri()), t);
		}

		if (!responseDelivered.get()) {
			logger.severe(format("No response was produced for %s %s, sending fail-safe 500", microhttpRequest.method(), microhttpRequest.uri()));
			microhttpCallback.accept(provideMicrohttpFailsafeResponse());
		}
	}

	@NonNull
	protected Map<String, String> headersFromMicrohttpRequest(@NonNull MicrohttpRequest microhttpRequest) {
		requireNonNull(microhttpRequest);

		Map<String, String> headers = new LinkedHashMap<>();

		for (Header header : microhttpRequest.headers())
			headers.merge(header.name(), header.value(), (existing, additional) -> existing + ", " + additional);

		return headers;
	}

	@NonNull
	protected MicrohttpResponse toMicrohttpResponse(@NonNull MarshaledResponse marshaledResponse) {
		requireNonNull(marshaledResponse);

		List<Header> headers = new ArrayList<>(marshaledResponse.getHeaders().size());

		for (Entry<String, String> entry : marshaledResponse.getHeaders().entrySet())
			headers.add(new Header(entry.getKey(), entry.getValue()));

		return new MicrohttpResponse(marshaledResponse.getStatusCode(), marshaledResponse.getReasonPhrase(), headers, marshaledResponse.getBody());
	}

	@NonNull
	protected MicrohttpResponse provideMicrohttpFailsafeResponse() {
		byte[] body = ErrorHandlers.INTERNAL_SERVER_ERROR_BODY.getBytes(StandardCharsets.UTF_8);
		List<Header> headers = ResponseWriter.DEFAULT_HEADERS.entrySet().stream()
				.map(entry -> new Header(entry.getKey(), entry.getValue()))
				.collect(Collectors.toList());

		return new MicrohttpResponse(500, StatusCode.HTTP_500.getReasonPhrase(), headers, body);
	}

	protected void safelyNotify(@NonNull Consumer<LifecycleObserver> notification) {
		requireNonNull(notification);

		LifecycleObserver lifecycleObserver = getLifecycleObserver().orElse(null);

		if (lifecycleObserver == null)
			return;

		try {
			notification.accept(lifecycleObserver);
		} catch (Throwable t) {
			logger.log(Level.WARNING, format("%s threw an exception", LifecycleObserver.class.getSimpleName()), t);
		}
	}

	@NonNull
	protected Integer getPort() {
		return this.port;
	}

	@NonNull
	protected String getHost() {
		return this.host;
	}

	@NonNull
	protected Integer getConcurrency() {
		return this.concurrency;
	}

	@NonNull
	protected Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	@NonNull
	protected Duration getSocketSelectTimeout() {
		return this.socketSelectTimeout;
	}

	@NonNull
	protected Duration getShutdownTimeout() {
		return this.shutdownTimeout;
	}

	@NonNull
	protected Integer getMaximumRequestSizeInBytes() {
		return this.maximumRequestSizeInBytes;
	}

	@NonNull
	protected Integer getRequestReadBufferSizeInBytes() {
		return this.requestReadBufferSizeInBytes;
	}

	@NonNull
	protected Integer getSocketPendingConnectionLimit() {
		return this.socketPendingConnectionLimit;
	}

	@NonNull
	protected Integer getMaximumConnections() {
		return this.maximumConnections;
	}

	@NonNull
	protected ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	protected Optional<RequestHandler> getRequestHandler() {
		return Optional.ofNullable(this.requestHandler);
	}

	@NonNull
	protected Optional<LifecycleObserver> getLifecycleObserver() {
		return Optional.ofNullable(this.lifecycleObserver);
	}

	@NonNull
	protected Optional<EventLoop> getEventLoop() {
		return Optional.ofNullable(this.eventLoop);
	}

	/**
	 * Routes event loop diagnostics to JUL at {@code FINE}.
	 */
	@ThreadSafe
	private static final class JulEventLoopLogger implements Logger {
		@Override
		public boolean enabled() {
			return eventLoopLogger.isLoggable(Level.FINE);
		}

		@Override
		public void log(@Nullable LogEntry... logEntries) {
			eventLoopLogger.fine(describe(logEntries));
		}

		@Override
		public void log(@Nullable Exception e,
										@Nullable LogEntry... logEntries) {
			eventLoopLogger.log(Level.FINE, describe(logEntries), e);
		}

		@NonNull
		private static String describe(@Nullable LogEntry... logEntries) {
			if (logEntries == null || logEntries.length == 0)
				return "";

			List<String> pairs = new ArrayList<>(logEntries.length);

			for (LogEntry logEntry : logEntries)
				pairs.add(format("%s=%s", logEntry.key(), logEntry.value()));

			return String.join(" ", pairs);
		}
	}

	@ThreadSafe
	private final class ObservingEventLoopListener implements EventLoopListener {
		@Override
		public void didAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
			logger.info(format("Accepted connection from %s", describe(remoteAddress)));
			safelyNotify(lifecycleObserver -> lifecycleObserver.didAcceptConnection(remoteAddress));
		}

		@Override
		public void didFailToAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
			logger.warning(format("Rejected connection from %s: maximum of %d connections reached", describe(remoteAddress), getMaximumConnections()));
			safelyNotify(lifecycleObserver -> lifecycleObserver.didFailToAcceptConnection(remoteAddress));
		}

		@Override
		public void didReceiveMalformedRequest(@Nullable InetSocketAddress remoteAddress,
																					 @NonNull MalformedRequestException exception) {
			logger.warning(format("Malformed request from %s: %s. Responding 400 and closing the connection", describe(remoteAddress), exception.getMessage()));
			safelyNotify(lifecycleObserver -> lifecycleObserver.didReceiveMalformedRequest(remoteAddress, exception));
		}

		@Override
		public void didTerminateUnexpectedly(@NonNull Throwable throwable) {
			logger.log(Level.SEVERE, "Server event loop terminated unexpectedly", throwable);
			safelyNotify(lifecycleObserver -> lifecycleObserver.didTerminateUnexpectedly(throwable));
		}

		@NonNull
		private String describe(@Nullable InetSocketAddress remoteAddress) {
			return remoteAddress == null ? "unknown address" : remoteAddress.toString();
		}
	}
}
