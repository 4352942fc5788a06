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
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Responds {@code 200 OK} with the body {@code Hello world}, regardless of headers or query string.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class HelloHandler implements RouteHandler {
	@NonNull
	private static final HelloHandler DEFAULT_INSTANCE;
	@NonNull
	private static final Logger logger = Logger.getLogger(HelloHandler.class.getName());

	static {
		DEFAULT_INSTANCE = new HelloHandler();
	}

	@NonNull
	public static HelloHandler defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private HelloHandler() {
		// Use defaultInstance()
	}

	@Override
	public void handle(@NonNull RequestContext requestContext,
										 @NonNull ResponseSink responseSink) {
		requireNonNull(requestContext);
		requireNonNull(responseSink);

		logger.info(format("Hello endpoint request received - Method: %s, URL: %s", requestContext.getMethod(), requestContext.getRawUri()));

		ResponseWriter.sendHelloWorld(responseSink);

		logger.info(format("Hello endpoint response delivered - Status: %d", responseSink.getStatusCode()));
	}
}
