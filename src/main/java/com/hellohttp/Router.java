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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Matches a request against a {@link RouteTable} and dispatches to the registered {@link RouteHandler},
 * or to {@link ErrorHandlers} for {@code 404} and {@code 405} outcomes.
 * <p>
 * The router performs no I/O. It is the boundary at which handler failures are caught: anything thrown while
 * producing a response is logged and, if the response has not been finalized yet, converted to a generic {@code 500}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Router {
	@NonNull
	private static final Logger logger = Logger.getLogger(Router.class.getName());

	@NonNull
	private final RouteTable routeTable;

	@NonNull
	public static Router withDefaultRoutes() {
		return new Router(RouteTable.defaultInstance());
	}

	@NonNull
	public static Router withRouteTable(@NonNull RouteTable routeTable) {
		requireNonNull(routeTable);
		return new Router(routeTable);
	}

	private Router(@NonNull RouteTable routeTable) {
		requireNonNull(routeTable);
		this.routeTable = routeTable;
	}

	public void route(@NonNull RequestContext requestContext,
										@NonNull ResponseSink responseSink) {
		requireNonNull(requestContext);
		requireNonNull(responseSink);

		String method = requestContext.getMethod();
		String path = requestContext.getPath();

		try {
			logger.info(format("Processing request - Method: %s, Path: %s, Original URL: %s", method, path, requestContext.getRawUri()));

			if (logger.isLoggable(Level.FINE))
				logger.fine(format("Request headers - Host: %s, User-Agent: %s, Accept: %s",
						requestContext.getHeader("Host").orElse("unknown"),
						requestContext.getHeader("User-Agent").orElse("unknown"),
						requestContext.getHeader("Accept").orElse("unknown")));

			Map<HttpMethod, RouteHandler> handlersByMethod = getRouteTable().handlersForPath(path).orElse(null);

			if (handlersByMethod == null) {
				logger.warning(format("Route not found for path: %s", path));
				ErrorHandlers.handleNotFound(requestContext, responseSink);
				return;
			}

			HttpMethod httpMethod = requestContext.getHttpMethod().orElse(null);
			RouteHandler routeHandler = httpMethod == null ? null : handlersByMethod.get(httpMethod);

			if (routeHandler == null) {
				logger.warning(format("Method %s not allowed for path %s - allowed methods: %s", method, path, handlersByMethod.keySet()));
				ErrorHandlers.handleMethodNotAllowed(requestContext, responseSink, handlersByMethod.keySet());
				return;
			}

			logger.info(format("Method %s is supported for path %s - dispatching to handler", method, path));
			routeHandler.handle(requestContext, responseSink);
		} catch (Throwable t) {
			if (responseSink.isFinalized()) {
				logger.log(Level.SEVERE, format("Error during request routing for %s %s after the response was finalized", method, path), t);
			} else {
				// Stack trace is logged by the 500 handler
				logger.severe(format("Error during request routing - Method: %s, URL: %s, Error: %s", method, requestContext.getRawUri(), t.getClass().getName()));
				ErrorHandlers.handleServerError(requestContext, responseSink, t);
			}
		}
	}

	@NonNull
	public RouteTable getRouteTable() {
		return this.routeTable;
	}
}
