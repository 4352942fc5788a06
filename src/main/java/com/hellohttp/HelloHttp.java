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
import javax.annotation.concurrent.ThreadSafe;
import java.lang.Thread.UncaughtExceptionHandler;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Owns the server's process-level lifecycle: binding, signal and fault handling, graceful draining and the exit code.
 * <p>
 * A {@link HelloHttp} instance moves through {@link ServerState}s exactly once:
 * <pre>
 * INITIALIZING -> BINDING -> LISTENING -> DRAINING -> STOPPED
 *                    |           |
 *                    +-----------+------> ERRORED
 * </pre>
 * Shutdown is triggered by {@link #stop()}, by JVM termination ({@code SIGINT}/{@code SIGTERM}, via a shutdown hook),
 * or by an uncaught exception on any thread. Draining stops accepting connections, closes idle keep-alive
 * connections and lets in-flight responses complete.
 * <p>
 * Exit codes: {@code 0} when a signal or {@link #stop()} drained cleanly; {@code 1} for a bind failure,
 * an uncaught exception, an event loop failure or a drain that exceeded the shutdown timeout.
 * <p>
 * Usage:
 * <pre>{@code
 * HelloHttp helloHttp = HelloHttp.withConfiguration(ConfigurationLoader.load()).build();
 * helloHttp.start();
 * System.exit(helloHttp.awaitShutdown());
 * }</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class HelloHttp {
	@NonNull
	private static final Logger logger = Logger.getLogger(HelloHttp.class.getName());

	@NonNull
	private final Configuration configuration;
	@NonNull
	private final Router router;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final Server server;
	@NonNull
	private final Boolean registerProcessHooks;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final AtomicReference<ServerState> state;
	@NonNull
	private final AtomicReference<Integer> exitCode;
	@NonNull
	private final CountDownLatch terminationLatch;
	@Nullable
	private volatile ShutdownCause shutdownCause;
	@Nullable
	private volatile Thread shutdownHook;
	@Nullable
	private volatile UncaughtExceptionHandler previousUncaughtExceptionHandler;
	@Nullable
	private volatile UncaughtExceptionHandler uncaughtExceptionHandler;

	/**
	 * Acquires a builder for {@link HelloHttp} instances.
	 *
	 * @param configuration the validated configuration snapshot, normally from {@link ConfigurationLoader#load()}
	 * @return the builder
	 */
	@NonNull
	public static Builder withConfiguration(@NonNull Configuration configuration) {
		requireNonNull(configuration);
		return new Builder(configuration);
	}

	private HelloHttp(@NonNull Builder builder) {
		requireNonNull(builder);

		this.configuration = builder.configuration;
		this.router = Router.withRouteTable(builder.routeTable != null ? builder.routeTable : RouteTable.defaultInstance());
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.registerProcessHooks = builder.registerProcessHooks != null ? builder.registerProcessHooks : true;
		this.lock = new ReentrantLock();
		this.state = new AtomicReference<>(ServerState.INITIALIZING);
		this.exitCode = new AtomicReference<>();
		this.terminationLatch = new CountDownLatch(1);

		this.server = Server.withPort(this.configuration.getPort())
				.host(this.configuration.getHost())
				.requestTimeout(builder.requestTimeout)
				.shutdownTimeout(builder.shutdownTimeout)
				.build();
	}

	/**
	 * Binds the listening socket and starts serving requests.
	 *
	 * @throws ServerStartupException if the socket cannot be bound; the instance is then {@link ServerState#ERRORED}
	 * @throws IllegalStateException  if this instance has already been started
	 */
	public void start() {
		getLock().lock();

		try {
			if (getState() != ServerState.INITIALIZING)
				throw new IllegalStateException(format("Unable to start: server is %s", getState()));

			safelyNotify(observer -> observer.willStartServer(this));

			transitionTo(ServerState.BINDING);

			Server server = getServer();
			server.initialize(getRouter()::route, new ServerEventObserver());

			try {
				server.start();
			} catch (RuntimeException e) {
				ServerStartupException serverStartupException = e instanceof ServerStartupException
						? (ServerStartupException) e
						: new ServerStartupException(BindFailureReason.fromThrowable(e), format("Unable to start server: %s", e.getMessage()), e);

				logBindFailure(serverStartupException);
				transitionTo(ServerState.ERRORED);
				terminate(1);
				safelyNotify(observer -> observer.didFailToStartServer(this, serverStartupException));
				safelyNotify(observer -> observer.didStopServer(this, 1));

				throw serverStartupException;
			}

			transitionTo(ServerState.LISTENING);
			logStartup();

			if (getRegisterProcessHooks())
				installProcessHooks();

			safelyNotify(observer -> observer.didStartServer(this));
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Gracefully stops the server, blocking until draining finishes or the shutdown timeout elapses.
	 * <p>
	 * A request to stop while already draining or stopped is ignored with a warning.
	 */
	public void stop() {
		shutdown(ShutdownCause.STOP_REQUESTED, null);
	}

	/**
	 * Blocks until this instance reaches {@link ServerState#STOPPED} or {@link ServerState#ERRORED}.
	 *
	 * @return the process exit code
	 * @throws InterruptedException if interrupted while waiting
	 */
	@NonNull
	public Integer awaitShutdown() throws InterruptedException {
		getTerminationLatch().await();
		return getExitCode().orElseThrow();
	}

	/**
	 * Like {@link #awaitShutdown()}, but gives up after {@code timeout}.
	 *
	 * @return the process exit code, or {@link Optional#empty()} if the server had not stopped in time
	 */
	@NonNull
	public Optional<Integer> awaitShutdown(@NonNull Duration timeout) throws InterruptedException {
		requireNonNull(timeout);

		if (!getTerminationLatch().await(timeout.toMillis(), TimeUnit.MILLISECONDS))
			return Optional.empty();

		return getExitCode();
	}

	@NonNull
	public ServerState getState() {
		return this.state.get();
	}

	/**
	 * The exit code, once this instance has reached a terminal state.
	 */
	@NonNull
	public Optional<Integer> getExitCode() {
		return Optional.ofNullable(this.exitCode.get());
	}

	@NonNull
	public Optional<ShutdownCause> getShutdownCause() {
		return Optional.ofNullable(this.shutdownCause);
	}

	/**
	 * The port actually bound, available while listening or draining.
	 */
	@NonNull
	public Optional<Integer> getBoundPort() {
		return getServer().getBoundPort();
	}

	@NonNull
	public Configuration getConfiguration() {
		return this.configuration;
	}

	protected void shutdown(@NonNull ShutdownCause shutdownCause,
													@Nullable Throwable throwable) {
		requireNonNull(shutdownCause);

		getLock().lock();

		try {
			ServerState currentState = getState();

			if (currentState != ServerState.LISTENING) {
				logger.warning(format("Ignoring %s shutdown request: server is %s", shutdownCause.name(), currentState.name()));
				return;
			}

			this.shutdownCause = shutdownCause;
			transitionTo(ServerState.DRAINING);
		} finally {
			getLock().unlock();
		}

		if (throwable == null)
			logger.info(format("Shutting down (%s): no longer accepting connections, draining in-flight requests", shutdownCause.name()));
		else
			logger.severe(format("Shutting down (%s) after %s: no longer accepting connections, draining in-flight requests",
					shutdownCause.name(), throwable.getClass().getName()));

		safelyNotify(observer -> observer.willStopServer(this, shutdownCause));

		boolean drained;

		try {
			drained = getServer().stop();
		} catch (RuntimeException e) {
			logger.log(Level.SEVERE, "Unable to drain server", e);
			drained = false;
		}

		if (!drained)
			logger.severe("In-flight requests did not complete within the shutdown timeout");

		int exitCode = shutdownCause == ShutdownCause.FAULT || !drained ? 1 : 0;

		getLock().lock();

		try {
			transitionTo(ServerState.STOPPED);
		} finally {
			getLock().unlock();
		}

		logger.info(format("Server stopped (exit code %d)", exitCode));

		uninstallProcessHooks();
		terminate(exitCode);
		safelyNotify(observer -> observer.didStopServer(this, exitCode));
	}

	protected void handleEventLoopTermination(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		getLock().lock();

		try {
			if (getState() != ServerState.LISTENING)
				return;

			transitionTo(ServerState.ERRORED);
		} finally {
			getLock().unlock();
		}

		logger.log(Level.SEVERE, "Server listener closed after an unrecoverable event loop failure", throwable);

		// Event loop threads cannot wait on themselves, so release resources elsewhere
		Thread cleanupThread = new Thread(() -> {
			try {
				getServer().stop();
			} finally {
				uninstallProcessHooks();
				terminate(1);
				safelyNotify(observer -> observer.didStopServer(this, 1));
			}
		}, "hellohttp-errored-cleanup");

		cleanupThread.start();
	}

	protected void installProcessHooks() {
		Thread shutdownHook = new Thread(() -> {
			if (getState().isTerminal())
				return;

			shutdown(ShutdownCause.SIGNAL, null);

			try {
				Integer exitCode = awaitShutdown();
				// A JVM terminated by a signal otherwise reports 128 + signal number
				Runtime.getRuntime().halt(exitCode);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}, "hellohttp-shutdown-hook");

		UncaughtExceptionHandler uncaughtExceptionHandler = (thread, throwable) -> {
			logger.log(Level.SEVERE, format("Uncaught exception on thread '%s'", thread.getName()), throwable);
			new Thread(() -> shutdown(ShutdownCause.FAULT, throwable), "hellohttp-fault-shutdown").start();
		};

		Runtime.getRuntime().addShutdownHook(shutdownHook);

		this.shutdownHook = shutdownHook;
		this.previousUncaughtExceptionHandler = Thread.getDefaultUncaughtExceptionHandler();
		this.uncaughtExceptionHandler = uncaughtExceptionHandler;

		Thread.setDefaultUncaughtExceptionHandler(uncaughtExceptionHandler);
	}

	protected void uninstallProcessHooks() {
		Thread shutdownHook = this.shutdownHook;

		if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
			try {
				Runtime.getRuntime().removeShutdownHook(shutdownHook);
			} catch (IllegalStateException e) {
				logger.log(Level.FINE, "JVM is already shutting down, leaving shutdown hook in place", e);
			}
		}

		this.shutdownHook = null;

		UncaughtExceptionHandler uncaughtExceptionHandler = this.uncaughtExceptionHandler;

		if (uncaughtExceptionHandler != null && Thread.getDefaultUncaughtExceptionHandler() == uncaughtExceptionHandler)
			Thread.setDefaultUncaughtExceptionHandler(this.previousUncaughtExceptionHandler);

		this.uncaughtExceptionHandler = null;
		this.previousUncaughtExceptionHandler = null;
	}

	protected void transitionTo(@NonNull ServerState nextState) {
		requireNonNull(nextState);

		ServerState previousState = getState();

		if (!previousState.canTransitionTo(nextState))
			throw new IllegalStateException(format("Illegal server state transition %s -> %s", previousState.name(), nextState.name()));

		this.state.set(nextState);

		logger.fine(format("Server state %s -> %s", previousState.name(), nextState.name()));
		safelyNotify(observer -> observer.didChangeState(this, previousState, nextState));
	}

	protected void terminate(@NonNull Integer exitCode) {
		requireNonNull(exitCode);

		this.exitCode.compareAndSet(null, exitCode);
		getTerminationLatch().countDown();
	}

	protected void safelyNotify(@NonNull Consumer<LifecycleObserver> notification) {
		requireNonNull(notification);

		try {
			notification.accept(getLifecycleObserver());
		} catch (Throwable t) {
			logger.log(Level.WARNING, format("%s threw an exception", LifecycleObserver.class.getSimpleName()), t);
		}
	}

	private void logStartup() {
		Configuration configuration = getConfiguration();
		Integer port = getBoundPort().orElse(configuration.getPort());
		String baseUrl = format("http://%s:%d", configuration.getHost(), port);

		logger.info(format("Server listening on %s:%d (pid %d, environment %s)", configuration.getHost(), port,
				ProcessHandle.current().pid(), configuration.getEnvironment()));
		logger.info(format("Server URL: %s", baseUrl));
		logger.info(format("Hello endpoint: %s/hello", baseUrl));
	}

	private void logBindFailure(@NonNull ServerStartupException e) {
		Configuration configuration = getConfiguration();
		BindFailureReason bindFailureReason = e.getBindFailureReason();

		switch (bindFailureReason) {
			case ADDRESS_IN_USE:
				logger.severe(format("Port %d is already in use on %s. %s", configuration.getPort(), configuration.getHost(), bindFailureReason.getDiagnostic()));
				break;
			case PERMISSION_DENIED:
				logger.severe(format("Permission denied binding %s:%d. %s", configuration.getHost(), configuration.getPort(), bindFailureReason.getDiagnostic()));
				break;
			case ADDRESS_UNAVAILABLE:
				logger.severe(format("Address %s is not available. %s", configuration.getHost(), bindFailureReason.getDiagnostic()));
				break;
			default:
				logger.log(Level.SEVERE, format("Unable to bind %s:%d. %s", configuration.getHost(), configuration.getPort(), bindFailureReason.getDiagnostic()), e);
				break;
		}
	}

	@NonNull
	protected Router getRouter() {
		return this.router;
	}

	@NonNull
	protected LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	protected Server getServer() {
		return this.server;
	}

	@NonNull
	protected Boolean getRegisterProcessHooks() {
		return this.registerProcessHooks;
	}

	@NonNull
	protected ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	protected CountDownLatch getTerminationLatch() {
		return this.terminationLatch;
	}

	/**
	 * Forwards connection events to the application's observer and reacts to event loop death.
	 */
	@ThreadSafe
	private final class ServerEventObserver implements LifecycleObserver {
		@Override
		public void didAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
			safelyNotify(observer -> observer.didAcceptConnection(remoteAddress));
		}

		@Override
		public void didFailToAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
			safelyNotify(observer -> observer.didFailToAcceptConnection(remoteAddress));
		}

		@Override
		public void didReceiveMalformedRequest(@Nullable InetSocketAddress remoteAddress,
																					 @NonNull Throwable throwable) {
			safelyNotify(observer -> observer.didReceiveMalformedRequest(remoteAddress, throwable));
		}

		@Override
		public void didTerminateUnexpectedly(@NonNull Throwable throwable) {
			safelyNotify(observer -> observer.didTerminateUnexpectedly(throwable));
			handleEventLoopTermination(throwable);
		}
	}

	/**
	 * Builder used to construct instances of {@link HelloHttp}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Configuration configuration;
		@Nullable
		private RouteTable routeTable;
		@Nullable
		private LifecycleObserver lifecycleObserver;
		@Nullable
		private Duration requestTimeout;
		@Nullable
		private Duration shutdownTimeout;
		@Nullable
		private Boolean registerProcessHooks;

		private Builder(@NonNull Configuration configuration) {
			requireNonNull(configuration);
			this.configuration = configuration;
		}

		@NonNull
		public Builder routeTable(@Nullable RouteTable routeTable) {
			this.routeTable = routeTable;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public Builder requestTimeout(@Nullable Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		@NonNull
		public Builder shutdownTimeout(@Nullable Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		/**
		 * Whether {@link HelloHttp#start()} installs a JVM shutdown hook and a default uncaught exception handler.
		 * Defaults to {@code true}; tests running several instances in one JVM turn this off.
		 */
		@NonNull
		public Builder registerProcessHooks(@Nullable Boolean registerProcessHooks) {
			this.registerProcessHooks = registerProcessHooks;
			return this;
		}

		@NonNull
		public HelloHttp build() {
			return new HelloHttp(this);
		}
	}
}
