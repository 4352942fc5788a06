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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Handlers for the routing outcomes that are not a matched route: {@code 404}, {@code 405} and {@code 500}.
 * <p>
 * Bodies are fixed, generic strings. Error detail is logged server-side and never written to the client.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ErrorHandlers {
	@NonNull
	public static final String METHOD_NOT_ALLOWED_BODY = "Method Not Allowed";
	@NonNull
	public static final String INTERNAL_SERVER_ERROR_BODY = "Internal Server Error";

	@NonNull
	private static final List<HttpMethod> FALLBACK_ALLOWED_METHODS = List.of(HttpMethod.GET);
	@NonNull
	private static final Logger logger = Logger.getLogger(ErrorHandlers.class.getName());

	private ErrorHandlers() {
		// Non-instantiable
	}

	public static void handleNotFound(@NonNull RequestContext requestContext,
																		@NonNull ResponseSink responseSink) {
		requireNonNull(requestContext);
		requireNonNull(responseSink);

		logger.warning(format("404 Not Found - Method: %s, URL: %s", requestContext.getMethod(), requestContext.getRawUri()));
		ResponseWriter.sendNotFound(responseSink);
	}

	/**
	 * Responds {@code 405} with an {@code Allow} header listing {@code allowedMethods} in order.
	 * <p>
	 * A {@code null} or empty list is a caller error: it is logged and {@code Allow: GET} is sent.
	 *
	 * @param requestContext the current request
	 * @param responseSink   the sink to write to
	 * @param allowedMethods the methods registered for the request's path
	 */
	public static void handleMethodNotAllowed(@NonNull RequestContext requestContext,
																						@NonNull ResponseSink responseSink,
																						@Nullable Collection<HttpMethod> allowedMethods) {
		requireNonNull(requestContext);
		requireNonNull(responseSink);

		if (allowedMethods == null || allowedMethods.isEmpty()) {
			logger.warning(format("No allowed methods were provided for %s %s, falling back to %s",
					requestContext.getMethod(), requestContext.getPath(), FALLBACK_ALLOWED_METHODS));
			allowedMethods = FALLBACK_ALLOWED_METHODS;
		}

		String allowHeaderValue = allowedMethods.stream()
				.map(HttpMethod::name)
				.collect(Collectors.joining(", "));

		logger.warning(format("405 Method Not Allowed - Method: %s, URL: %s, Allowed Methods: %s",
				requestContext.getMethod(), requestContext.getRawUri(), allowHeaderValue));

		ResponseWriter.sendResponse(responseSink, 405, METHOD_NOT_ALLOWED_BODY, Map.of("Allow", allowHeaderValue));
	}

	/**
	 * Responds {@code 500} with a generic body. Never throws.
	 * <p>
	 * If the sink has already been finalized, nothing more can be sent; the condition is logged instead.
	 *
	 * @param requestContext the current request
	 * @param responseSink   the sink to write to
	 * @param throwable      the underlying problem, logged server-side only; may be {@code null}
	 */
	public static void handleServerError(@Nullable RequestContext requestContext,
																			 @Nullable ResponseSink responseSink,
																			 @Nullable Throwable throwable) {
		try {
			String method = requestContext == null ? "unknown" : requestContext.getMethod();
			String url = requestContext == null ? "unknown" : requestContext.getRawUri();

			if (throwable == null)
				logger.severe(format("500 Internal Server Error - Method: %s, URL: %s, Error: Unknown error occurred", method, url));
			else
				logger.log(Level.SEVERE, format("500 Internal Server Error - Method: %s, URL: %s", method, url), throwable);

			if (responseSink == null) {
				logger.severe("Unable to send 500 response: no response sink was provided");
				return;
			}

			if (responseSink.isFinalized()) {
				logger.severe(format("Unable to send 500 response for %s %s: response has already been finalized", method, url));
				return;
			}

			// Whatever the failed handler wrote must not reach the client
			responseSink.reset();
			ResponseWriter.sendResponse(responseSink, 500, INTERNAL_SERVER_ERROR_BODY);
		} catch (Throwable t) {
			logger.log(Level.SEVERE, "Critical error while handling a server error", t);
		}
	}
}
