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

import com.hellohttp.TestSupport.RawResponse;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.InputStream;
import java.lang.Thread.UncaughtExceptionHandler;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.hellohttp.TestSupport.LOOPBACK_HOST;
import static com.hellohttp.TestSupport.connectWithRetry;
import static com.hellohttp.TestSupport.exchange;
import static com.hellohttp.TestSupport.findFreePort;
import static com.hellohttp.TestSupport.get;
import static com.hellohttp.TestSupport.readResponse;
import static com.hellohttp.TestSupport.send;
import static com.hellohttp.TestSupport.waitFor;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class HelloHttpTests {
	private static HelloHttp.Builder helloHttpBuilder(int port) {
		return HelloHttp.withConfiguration(new Configuration(port, LOOPBACK_HOST, "test"))
				.registerProcessHooks(false)
				.requestTimeout(Duration.ofSeconds(5))
				.shutdownTimeout(Duration.ofSeconds(5));
	}

	@Test
	public void serves_hello_and_stops_cleanly() throws Exception {
		int port = findFreePort();
		RecordingObserver observer = new RecordingObserver();
		HelloHttp helloHttp = helloHttpBuilder(port).lifecycleObserver(observer).build();

		Assertions.assertEquals(ServerState.INITIALIZING, helloHttp.getState());
		helloHttp.start();
		Assertions.assertEquals(ServerState.LISTENING, helloHttp.getState());
		Assertions.assertEquals(Optional.of(port), helloHttp.getBoundPort());

		RawResponse response = exchange(port, get("/hello"));
		Assertions.assertEquals(200, response.statusCode);
		Assertions.assertEquals("OK", response.reasonPhrase);
		Assertions.assertEquals("Hello world", response.body);
		Assertions.assertEquals("text/plain; charset=utf-8", response.header("Content-Type"));
		Assertions.assertEquals("11", response.header("Content-Length"));

		helloHttp.stop();

		Assertions.assertEquals(ServerState.STOPPED, helloHttp.getState());
		Assertions.assertEquals(0, helloHttp.awaitShutdown());
		Assertions.assertEquals(Optional.of(ShutdownCause.STOP_REQUESTED), helloHttp.getShutdownCause());
		Assertions.assertEquals(List.of(
				"INITIALIZING->BINDING",
				"BINDING->LISTENING",
				"LISTENING->DRAINING",
				"DRAINING->STOPPED"), observer.transitions);
		Assertions.assertEquals(List.of(0), observer.exitCodes);
	}

	@Test
	public void not_found_and_method_not_allowed_on_the_wire() throws Exception {
		int port = findFreePort();
		HelloHttp helloHttp = helloHttpBuilder(port).build();
		helloHttp.start();

		try {
			RawResponse notFound = exchange(port, get("/nope"));
			Assertions.assertEquals(404, notFound.statusCode);
			Assertions.assertEquals("Not Found", notFound.body);

			RawResponse methodNotAllowed = exchange(port,
					"POST /hello HTTP/1.1\r\nHost: localhost\r\nContent-Length: 0\r\nConnection: close\r\n\r\n");
			Assertions.assertEquals(405, methodNotAllowed.statusCode);
			Assertions.assertEquals("Method Not Allowed", methodNotAllowed.body);
			Assertions.assertEquals("GET", methodNotAllowed.header("Allow"));

			RawResponse withQuery = exchange(port, get("/hello/?greeting=hi"));
			Assertions.assertEquals(200, withQuery.statusCode);
		} finally {
			helloHttp.stop();
		}
	}

	@Test
	public void handler_exception_becomes_500_and_server_keeps_serving() throws Exception {
		int port = findFreePort();
		RouteTable routeTable = RouteTable.builder()
				.route("/hello", HttpMethod.GET, HelloHandler.defaultInstance())
				.route("/boom", HttpMethod.GET, (requestContext, responseSink) -> {
					throw new IllegalStateException("do not leak me");
				})
				.build();

		HelloHttp helloHttp = helloHttpBuilder(port).routeTable(routeTable).build();
		helloHttp.start();

		try {
			RawResponse boom = exchange(port, get("/boom"));
			Assertions.assertEquals(500, boom.statusCode);
			Assertions.assertEquals("Internal Server Error", boom.body);

			Assertions.assertEquals(200, exchange(port, get("/hello")).statusCode);
			Assertions.assertEquals(ServerState.LISTENING, helloHttp.getState());
		} finally {
			helloHttp.stop();
		}
	}

	@Test
	public void keep_alive_serves_multiple_requests_per_connection() throws Exception {
		int port = findFreePort();
		HelloHttp helloHttp = helloHttpBuilder(port).build();
		helloHttp.start();

		try (Socket socket = connectWithRetry(LOOPBACK_HOST, port, 2000)) {
			InputStream in = socket.getInputStream();

			for (int i = 0; i < 3; i++) {
				send(socket, "GET /hello HTTP/1.1\r\nHost: localhost\r\n\r\n");
				RawResponse response = readResponse(in);
				Assertions.assertEquals(200, response.statusCode);
				Assertions.assertEquals("keep-alive", response.header("Connection"));
			}
		} finally {
			helloHttp.stop();
		}
	}

	@Test
	public void malformed_request_gets_400_and_server_keeps_serving() throws Exception {
		int port = findFreePort();
		RecordingObserver observer = new RecordingObserver();
		HelloHttp helloHttp = helloHttpBuilder(port).lifecycleObserver(observer).build();
		helloHttp.start();

		try {
			RawResponse badRequest = exchange(port, "GARBAGE\r\n\r\n");
			Assertions.assertEquals(400, badRequest.statusCode);
			Assertions.assertEquals("close", badRequest.header("Connection"));
			Assertions.assertTrue(waitFor(() -> observer.malformedRequests.size() == 1, 2000));

			Assertions.assertEquals(200, exchange(port, get("/hello")).statusCode);
			Assertions.assertEquals(ServerState.LISTENING, helloHttp.getState());
		} finally {
			helloHttp.stop();
		}
	}

	@Test
	public void bind_conflict_errors_with_exit_code_1() throws Exception {
		int port = findFreePort();
		RecordingObserver observer = new RecordingObserver();

		try (ServerSocket ss = new ServerSocket()) {
			ss.bind(new InetSocketAddress(InetAddress.getByName(LOOPBACK_HOST), port));

			HelloHttp helloHttp = helloHttpBuilder(port).lifecycleObserver(observer).build();

			ServerStartupException exception = Assertions.assertThrows(ServerStartupException.class, helloHttp::start);
			Assertions.assertEquals(BindFailureReason.ADDRESS_IN_USE, exception.getBindFailureReason());
			Assertions.assertEquals(ServerState.ERRORED, helloHttp.getState());
			Assertions.assertEquals(Optional.of(1), helloHttp.awaitShutdown(Duration.ofSeconds(1)));
			Assertions.assertEquals(List.of("INITIALIZING->BINDING", "BINDING->ERRORED"), observer.transitions);
			Assertions.assertEquals(1, observer.startupFailures.size());

			// Terminal; stop is a logged no-op and start is refused
			helloHttp.stop();
			Assertions.assertEquals(ServerState.ERRORED, helloHttp.getState());
			Assertions.assertThrows(IllegalStateException.class, helloHttp::start);
		}
	}

	@Test
	public void repeated_stop_and_stop_before_start_are_ignored() throws Exception {
		int port = findFreePort();
		HelloHttp helloHttp = helloHttpBuilder(port).build();

		helloHttp.stop();
		Assertions.assertEquals(ServerState.INITIALIZING, helloHttp.getState());
		Assertions.assertEquals(Optional.empty(), helloHttp.awaitShutdown(Duration.ofMillis(10)));

		helloHttp.start();
		Assertions.assertThrows(IllegalStateException.class, helloHttp::start);

		helloHttp.stop();
		helloHttp.stop();

		Assertions.assertEquals(ServerState.STOPPED, helloHttp.getState());
		Assertions.assertEquals(0, helloHttp.awaitShutdown());
	}

	@Test
	public void drain_lets_in_flight_request_finish() throws Exception {
		int port = findFreePort();
		CountDownLatch handlerEntered = new CountDownLatch(1);
		CountDownLatch releaseHandler = new CountDownLatch(1);

		RouteTable routeTable = RouteTable.builder()
				.route("/slow", HttpMethod.GET, (requestContext, responseSink) -> {
					handlerEntered.countDown();
					try {
						releaseHandler.await(5, TimeUnit.SECONDS);
					} catch (InterruptedException e) {
						Thread.currentThread().interrupt();
					}
					ResponseWriter.sendResponse(responseSink, 200, "slow done");
				})
				.build();

		HelloHttp helloHttp = helloHttpBuilder(port).routeTable(routeTable).build();
		helloHttp.start();

		ExecutorService executorService = Executors.newFixedThreadPool(2);

		try {
			Future<RawResponse> inFlight = executorService.submit(() -> {
				try (Socket socket = connectWithRetry(LOOPBACK_HOST, port, 5000)) {
					send(socket, "GET /slow HTTP/1.1\r\nHost: localhost\r\n\r\n");
					return readResponse(socket.getInputStream());
				}
			});

			Assertions.assertTrue(handlerEntered.await(5, TimeUnit.SECONDS));

			Future<?> stopping = executorService.submit(helloHttp::stop);
			Assertions.assertTrue(waitFor(() -> helloHttp.getState() == ServerState.DRAINING, 2000));

			releaseHandler.countDown();

			RawResponse response = inFlight.get(5, TimeUnit.SECONDS);
			Assertions.assertEquals(200, response.statusCode);
			Assertions.assertEquals("slow done", response.body);
			Assertions.assertEquals("close", response.header("Connection"));

			stopping.get(5, TimeUnit.SECONDS);
			Assertions.assertEquals(ServerState.STOPPED, helloHttp.getState());
			Assertions.assertEquals(0, helloHttp.awaitShutdown());
		} finally {
			releaseHandler.countDown();
			executorService.shutdownNow();
		}
	}

	@Test
	public void drain_closes_idle_keep_alive_connections() throws Exception {
		int port = findFreePort();
		HelloHttp helloHttp = helloHttpBuilder(port).build();
		helloHttp.start();

		try (Socket socket = connectWithRetry(LOOPBACK_HOST, port, 2000)) {
			send(socket, "GET /hello HTTP/1.1\r\nHost: localhost\r\n\r\n");
			Assertions.assertEquals(200, readResponse(socket.getInputStream()).statusCode);

			long stopStarted = System.nanoTime();
			helloHttp.stop();
			long stopMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - stopStarted);

			Assertions.assertTrue(stopMillis < 4000, "Idle connection held up draining for " + stopMillis + "ms");
			Assertions.assertEquals(-1, socket.getInputStream().read());
			Assertions.assertEquals(0, helloHttp.awaitShutdown());
		}
	}

	@Test
	public void drain_timeout_exits_with_1() throws Exception {
		int port = findFreePort();
		CountDownLatch handlerEntered = new CountDownLatch(1);
		CountDownLatch releaseHandler = new CountDownLatch(1);

		RouteTable routeTable = RouteTable.builder()
				.route("/stuck", HttpMethod.GET, (requestContext, responseSink) -> {
					handlerEntered.countDown();
					try {
						releaseHandler.await(10, TimeUnit.SECONDS);
					} catch (InterruptedException e) {
						Thread.currentThread().interrupt();
					}
					ResponseWriter.sendResponse(responseSink, 200, "too late");
				})
				.build();

		HelloHttp helloHttp = helloHttpBuilder(port)
				.routeTable(routeTable)
				.shutdownTimeout(Duration.ofMillis(200))
				.build();
		helloHttp.start();

		try (Socket socket = connectWithRetry(LOOPBACK_HOST, port, 2000)) {
			send(socket, "GET /stuck HTTP/1.1\r\nHost: localhost\r\n\r\n");
			Assertions.assertTrue(handlerEntered.await(5, TimeUnit.SECONDS));

			helloHttp.stop();

			Assertions.assertEquals(ServerState.STOPPED, helloHttp.getState());
			Assertions.assertEquals(1, helloHttp.awaitShutdown());
		} finally {
			releaseHandler.countDown();
		}
	}

	@Test
	public void fault_shutdown_drains_and_exits_with_1() throws Exception {
		int port = findFreePort();
		RecordingObserver observer = new RecordingObserver();
		HelloHttp helloHttp = helloHttpBuilder(port).lifecycleObserver(observer).build();
		helloHttp.start();

		helloHttp.shutdown(ShutdownCause.FAULT, new RuntimeException("simulated fault"));

		Assertions.assertEquals(ServerState.STOPPED, helloHttp.getState());
		Assertions.assertEquals(1, helloHttp.awaitShutdown());
		Assertions.assertEquals(Optional.of(ShutdownCause.FAULT), helloHttp.getShutdownCause());
		Assertions.assertEquals(List.of(1), observer.exitCodes);
	}

	@Test
	public void signal_shutdown_exits_with_0() throws Exception {
		int port = findFreePort();
		HelloHttp helloHttp = helloHttpBuilder(port).build();
		helloHttp.start();

		Assertions.assertEquals(200, exchange(port, get("/hello")).statusCode);

		helloHttp.shutdown(ShutdownCause.SIGNAL, null);

		Assertions.assertEquals(ServerState.STOPPED, helloHttp.getState());
		Assertions.assertEquals(0, helloHttp.awaitShutdown());
		Assertions.assertEquals(Optional.of(ShutdownCause.SIGNAL), helloHttp.getShutdownCause());
	}

	@Test
	public void uncaught_exception_triggers_fault_shutdown() throws Exception {
		int port = findFreePort();
		UncaughtExceptionHandler previousHandler = Thread.getDefaultUncaughtExceptionHandler();
		HelloHttp helloHttp = helloHttpBuilder(port).registerProcessHooks(true).build();

		try {
			helloHttp.start();
			Assertions.assertNotSame(previousHandler, Thread.getDefaultUncaughtExceptionHandler());

			Thread failingThread = new Thread(() -> {
				throw new IllegalStateException("worker crashed");
			}, "failing-worker");
			failingThread.start();
			failingThread.join(5000);

			Assertions.assertEquals(Optional.of(1), helloHttp.awaitShutdown(Duration.ofSeconds(10)));
			Assertions.assertEquals(ServerState.STOPPED, helloHttp.getState());
			Assertions.assertEquals(Optional.of(ShutdownCause.FAULT), helloHttp.getShutdownCause());

			// Hooks are removed once stopped
			Assertions.assertSame(previousHandler, Thread.getDefaultUncaughtExceptionHandler());
		} finally {
			if (!helloHttp.getState().isTerminal())
				helloHttp.stop();

			Thread.setDefaultUncaughtExceptionHandler(previousHandler);
		}
	}

	@ThreadSafe
	private static final class RecordingObserver implements LifecycleObserver {
		final List<String> transitions = new CopyOnWriteArrayList<>();
		final List<Integer> exitCodes = new CopyOnWriteArrayList<>();
		final List<Throwable> startupFailures = new CopyOnWriteArrayList<>();
		final List<Throwable> malformedRequests = new CopyOnWriteArrayList<>();

		@Override
		public void didChangeState(@NonNull HelloHttp helloHttp,
															 @NonNull ServerState previousState,
															 @NonNull ServerState currentState) {
			transitions.add(previousState.name() + "->" + currentState.name());
		}

		@Override
		public void didFailToStartServer(@NonNull HelloHttp helloHttp,
																		 @NonNull Throwable throwable) {
			startupFailures.add(throwable);
		}

		@Override
		public void didStopServer(@NonNull HelloHttp helloHttp,
															@NonNull Integer exitCode) {
			exitCodes.add(exitCode);
		}

		@Override
		public void didReceiveMalformedRequest(@Nullable InetSocketAddress remoteAddress,
																					 @NonNull Throwable throwable) {
			malformedRequests.add(throwable);
		}
	}
}
