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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;

import static com.hellohttp.TestSupport.LOOPBACK_HOST;
import static com.hellohttp.TestSupport.exchange;
import static com.hellohttp.TestSupport.findFreePort;
import static com.hellohttp.TestSupport.get;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ServerTests {
	@Test
	public void start_without_initialize_fails_fast() {
		Server server = Server.withPort(0).host(LOOPBACK_HOST).build();

		IllegalStateException exception = Assertions.assertThrows(IllegalStateException.class, server::start);
		Assertions.assertTrue(exception.getMessage().contains("RequestHandler"));
		Assertions.assertFalse(server.isStarted());
	}

	@Test
	public void ephemeral_port_start_stop() throws Exception {
		Server server = Server.withPort(0).host(LOOPBACK_HOST).build();
		server.initialize((requestContext, responseSink) -> ResponseWriter.sendResponse(responseSink, 200, "ok"),
				LifecycleObserver.defaultInstance());

		try {
			server.start();
			Assertions.assertTrue(server.isStarted());

			int port = server.getBoundPort().orElseThrow();
			Assertions.assertTrue(port > 0);

			RawResponse response = exchange(port, get("/anything"));
			Assertions.assertEquals(200, response.statusCode);
			Assertions.assertEquals("ok", response.body);
		} finally {
			Assertions.assertTrue(server.stop());
		}

		Assertions.assertFalse(server.isStarted());
		Assertions.assertFalse(server.getBoundPort().isPresent());
	}

	@Test
	public void start_port_in_use_reports_address_in_use() throws Exception {
		int port = findFreePort();

		try (ServerSocket ss = new ServerSocket()) {
			ss.bind(new InetSocketAddress(InetAddress.getByName(LOOPBACK_HOST), port));

			Server server = Server.withPort(port).host(LOOPBACK_HOST).build();
			server.initialize((requestContext, responseSink) -> ResponseWriter.sendResponse(responseSink, 200, "ok"),
					LifecycleObserver.defaultInstance());

			ServerStartupException exception = Assertions.assertThrows(ServerStartupException.class, server::start);
			Assertions.assertEquals(BindFailureReason.ADDRESS_IN_USE, exception.getBindFailureReason());
			Assertions.assertFalse(server.isStarted());
		}
	}

	@Test
	public void handler_exception_yields_failsafe_500() throws Exception {
		Server server = Server.withPort(0).host(LOOPBACK_HOST).build();
		server.initialize((requestContext, responseSink) -> {
			throw new IllegalStateException("internal detail");
		}, LifecycleObserver.defaultInstance());

		try {
			server.start();
			RawResponse response = exchange(server.getBoundPort().orElseThrow(), get("/hello"));

			Assertions.assertEquals(500, response.statusCode);
			Assertions.assertEquals("Internal Server Error", response.reasonPhrase);
			Assertions.assertEquals("Internal Server Error", response.body);
			Assertions.assertEquals("text/plain; charset=utf-8", response.header("Content-Type"));
		} finally {
			server.stop();
		}
	}

	@Test
	public void handler_that_never_responds_yields_failsafe_500() throws Exception {
		Server server = Server.withPort(0).host(LOOPBACK_HOST).build();
		server.initialize((requestContext, responseSink) -> responseSink.setStatus(204, null),
				LifecycleObserver.defaultInstance());

		try {
			server.start();
			RawResponse response = exchange(server.getBoundPort().orElseThrow(), get("/hello"));

			Assertions.assertEquals(500, response.statusCode);
		} finally {
			server.stop();
		}
	}

	@Test
	public void invalid_builder_values_are_rejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> Server.withPort(70_000).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> Server.withPort(0).requestTimeout(Duration.ZERO).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> Server.withPort(0).shutdownTimeout(Duration.ofSeconds(-1)).build());
	}
}
