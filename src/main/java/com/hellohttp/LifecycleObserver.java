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

import java.net.InetSocketAddress;

/**
 * Read-only hook methods for observing server lifecycle and connection events.
 * <p>
 * Callbacks run on whichever thread caused the event (often an event loop thread) and must not block.
 * Exceptions thrown from a callback are logged and otherwise ignored.
 * <p>
 * A no-op implementation can be acquired via the {@link #defaultInstance()} factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface LifecycleObserver {
	/**
	 * Acquires a threadsafe observer which does nothing.
	 */
	@NonNull
	static LifecycleObserver defaultInstance() {
		return NoopLifecycleObserver.INSTANCE;
	}

	/**
	 * Called after every state transition, including transitions to {@link ServerState#ERRORED}.
	 */
	default void didChangeState(@NonNull HelloHttp helloHttp,
															@NonNull ServerState previousState,
															@NonNull ServerState currentState) {
		// No-op by default
	}

	/**
	 * Called before the listening socket is bound.
	 */
	default void willStartServer(@NonNull HelloHttp helloHttp) {
		// No-op by default
	}

	/**
	 * Called once the server is listening.
	 */
	default void didStartServer(@NonNull HelloHttp helloHttp) {
		// No-op by default
	}

	/**
	 * Called after a {@link HelloHttp} instance was asked to start, but failed due to an exception.
	 */
	default void didFailToStartServer(@NonNull HelloHttp helloHttp,
																		@NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called when draining begins.
	 */
	default void willStopServer(@NonNull HelloHttp helloHttp,
															@NonNull ShutdownCause shutdownCause) {
		// No-op by default
	}

	/**
	 * Called once the server has reached a terminal state.
	 *
	 * @param exitCode the process exit code implied by how the server stopped
	 */
	default void didStopServer(@NonNull HelloHttp helloHttp,
														 @NonNull Integer exitCode) {
		// No-op by default
	}

	/**
	 * Called when a connection is accepted.
	 *
	 * @param remoteAddress best-effort remote address, or {@code null} if unavailable
	 */
	default void didAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
		// No-op by default
	}

	/**
	 * Called when a connection is refused because the connection limit was reached.
	 *
	 * @param remoteAddress best-effort remote address, or {@code null} if unavailable
	 */
	default void didFailToAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
		// No-op by default
	}

	/**
	 * Called when bytes on a connection could not be parsed as a request.
	 * The connection is answered with {@code 400 Bad Request} and closed.
	 *
	 * @param remoteAddress best-effort remote address, or {@code null} if unavailable
	 */
	default void didReceiveMalformedRequest(@Nullable InetSocketAddress remoteAddress,
																					@NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called when the server's event loop dies from a failure it cannot recover from.
	 */
	default void didTerminateUnexpectedly(@NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Holder for the stateless {@link #defaultInstance()}.
	 */
	final class NoopLifecycleObserver implements LifecycleObserver {
		@NonNull
		private static final NoopLifecycleObserver INSTANCE = new NoopLifecycleObserver();

		private NoopLifecycleObserver() {
			// Use defaultInstance()
		}
	}
}
