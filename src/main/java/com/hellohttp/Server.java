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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.time.Duration;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A network server which parses HTTP requests, hands each one to a {@link RequestHandler} and writes the response.
 * <p>
 * A standard threadsafe implementation can be built via the {@link #withPort(Integer)} builder factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Server extends AutoCloseable {
	/**
	 * Binds the listening socket and starts accepting connections.
	 * <p>
	 * If the server is already started, this is a no-op.
	 *
	 * @throws ServerStartupException if the listening socket cannot be bound
	 */
	void start();

	/**
	 * Stops accepting connections, lets in-flight requests complete, then releases all resources.
	 * <p>
	 * If the drain does not finish within the server's shutdown timeout, remaining connections are closed.
	 * If the server is already stopped, this is a no-op that returns {@code true}.
	 *
	 * @return {@code true} if every in-flight request completed within the shutdown timeout
	 */
	@NonNull
	Boolean stop();

	@NonNull
	Boolean isStarted();

	/**
	 * The port the listening socket is bound to, which differs from the configured port when that is {@code 0}.
	 *
	 * @return the bound port, or {@link Optional#empty()} if the server is not started
	 */
	@NonNull
	Optional<Integer> getBoundPort();

	/**
	 * Registers the request handler and observer. Must be called before {@link #start()}.
	 */
	void initialize(@NonNull RequestHandler requestHandler,
									@NonNull LifecycleObserver lifecycleObserver);

	@Override
	default void close() {
		stop();
	}

	/**
	 * Request/response processing contract for {@link Server} implementations.
	 * <p>
	 * The handler must finalize the sink. If it throws or returns without doing so, the server sends a fail-safe
	 * {@code 500} on its behalf.
	 */
	@FunctionalInterface
	interface RequestHandler {
		void handleRequest(@NonNull RequestContext requestContext,
											 @NonNull ResponseSink responseSink);
	}

	/**
	 * Acquires a builder for {@link Server} instances.
	 *
	 * @param port the port to bind, {@code 0} for an ephemeral port
	 * @return the builder
	 */
	@NonNull
	static Builder withPort(@NonNull Integer port) {
		requireNonNull(port);
		return new Builder(port);
	}

	/**
	 * Builder used to construct a standard implementation of {@link Server}.
	 * <p>
	 * Unset options take these defaults: host {@code localhost}, socket backlog {@code 128},
	 * request timeout {@code 30s}, shutdown timeout {@code 10s}, maximum request size {@code 1 MiB},
	 * unlimited connections and a single connection event loop.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	final class Builder {
		@NonNull
		Integer port;
		@Nullable
		String host;
		@Nullable
		Integer concurrency;
		@Nullable
		Duration requestTimeout;
		@Nullable
		Duration socketSelectTimeout;
		@Nullable
		Duration shutdownTimeout;
		@Nullable
		Integer maximumRequestSizeInBytes;
		@Nullable
		Integer requestReadBufferSizeInBytes;
		@Nullable
		Integer socketPendingConnectionLimit;
		@Nullable
		Integer maximumConnections;

		@NonNull
		private Builder(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
		}

		@NonNull
		public Builder port(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
			return this;
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		@NonNull
		public Builder concurrency(@Nullable Integer concurrency) {
			this.concurrency = concurrency;
			return this;
		}

		/**
		 * How long a connection may take to deliver a complete request before it is closed.
		 */
		@NonNull
		public Builder requestTimeout(@Nullable Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		@NonNull
		public Builder socketSelectTimeout(@Nullable Duration socketSelectTimeout) {
			this.socketSelectTimeout = socketSelectTimeout;
			return this;
		}

		/**
		 * How long {@link Server#stop()} waits for in-flight requests before closing connections.
		 */
		@NonNull
		public Builder shutdownTimeout(@Nullable Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		@NonNull
		public Builder maximumRequestSizeInBytes(@Nullable Integer maximumRequestSizeInBytes) {
			this.maximumRequestSizeInBytes = maximumRequestSizeInBytes;
			return this;
		}

		@NonNull
		public Builder requestReadBufferSizeInBytes(@Nullable Integer requestReadBufferSizeInBytes) {
			this.requestReadBufferSizeInBytes = requestReadBufferSizeInBytes;
			return this;
		}

		/**
		 * The listen backlog: connections the OS queues before {@code accept}.
		 */
		@NonNull
		public Builder socketPendingConnectionLimit(@Nullable Integer socketPendingConnectionLimit) {
			this.socketPendingConnectionLimit = socketPendingConnectionLimit;
			return this;
		}

		@NonNull
		public Builder maximumConnections(@Nullable Integer maximumConnections) {
			this.maximumConnections = maximumConnections;
			return this;
		}

		@NonNull
		public Server build() {
			return new DefaultServer(this);
		}
	}
}
