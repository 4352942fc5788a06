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

import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RouteTableTests {
	@Test
	public void defaultRoutes() {
		RouteTable routeTable = RouteTable.defaultInstance();

		assertEquals(List.of("/hello"), List.copyOf(routeTable.getPaths()));
		assertEquals(List.of(HttpMethod.GET), routeTable.allowedMethodsForPath("/hello"));
		assertSame(HelloHandler.defaultInstance(), routeTable.handlersForPath("/hello").orElseThrow().get(HttpMethod.GET));
		assertFalse(routeTable.handlersForPath("/").isPresent());
		assertEquals(List.of(), routeTable.allowedMethodsForPath("/missing"));
	}

	@Test
	public void lookupIsExactAndCaseSensitive() {
		RouteTable routeTable = RouteTable.defaultInstance();

		assertFalse(routeTable.handlersForPath("/Hello").isPresent());
		assertFalse(routeTable.handlersForPath("/hello/").isPresent());
		assertFalse(routeTable.handlersForPath("/hello/world").isPresent());
	}

	@Test
	public void multipleMethodsKeepRegistrationOrder() {
		RouteHandler handler = (requestContext, responseSink) -> ResponseWriter.sendResponse(responseSink, 200, "ok");

		RouteTable routeTable = RouteTable.builder()
				.route("/items", HttpMethod.POST, handler)
				.route("/items", HttpMethod.GET, handler)
				.route("/", HttpMethod.GET, handler)
				.build();

		assertEquals(List.of(HttpMethod.POST, HttpMethod.GET), routeTable.allowedMethodsForPath("/items"));
		assertTrue(routeTable.handlersForPath("/").isPresent());
		assertEquals("RouteTable{routes=[POST /items, GET /items, GET /]}", routeTable.toString());
	}

	@Test
	public void tableIsImmutable() {
		RouteTable routeTable = RouteTable.defaultInstance();
		Map<HttpMethod, RouteHandler> handlers = routeTable.handlersForPath("/hello").orElseThrow();

		assertThrows(UnsupportedOperationException.class, () -> handlers.put(HttpMethod.POST, (requestContext, responseSink) -> {}));
		assertThrows(UnsupportedOperationException.class, () -> routeTable.getPaths().clear());
		assertThrows(UnsupportedOperationException.class, () -> routeTable.allowedMethodsForPath("/hello").add(HttpMethod.PUT));
	}

	@Test
	public void builderChangesDoNotLeakIntoBuiltTable() {
		RouteHandler handler = (requestContext, responseSink) -> {};
		RouteTable.Builder builder = RouteTable.builder().route("/a", HttpMethod.GET, handler);
		RouteTable routeTable = builder.build();

		builder.route("/a", HttpMethod.POST, handler);

		assertEquals(List.of(HttpMethod.GET), routeTable.allowedMethodsForPath("/a"));
	}

	@Test
	public void invalidRegistrations() {
		RouteHandler handler = (requestContext, responseSink) -> {};

		assertThrows(IllegalArgumentException.class, () -> RouteTable.builder()
				.route("/hello", HttpMethod.GET, handler)
				.route("/hello", HttpMethod.GET, handler));
		assertThrows(IllegalArgumentException.class, () -> RouteTable.builder().route("hello", HttpMethod.GET, handler));
		assertThrows(IllegalArgumentException.class, () -> RouteTable.builder().route("/hello/", HttpMethod.GET, handler));
		assertThrows(IllegalArgumentException.class, () -> RouteTable.builder().route("/hello?x=1", HttpMethod.GET, handler));
		assertThrows(IllegalArgumentException.class, () -> RouteTable.builder().routes("/hello", Map.of()));
	}
}
