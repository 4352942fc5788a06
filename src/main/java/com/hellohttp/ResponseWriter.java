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
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Writes complete plain-text responses onto a {@link ResponseSink}.
 * <p>
 * Every response carries {@link #DEFAULT_HEADERS}, any caller-supplied headers (which win over the defaults),
 * and a {@code Content-Length} equal to the UTF-8 byte length of the body.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ResponseWriter {
	@NonNull
	public static final Map<@NonNull String, @NonNull String> DEFAULT_HEADERS;
	@NonNull
	public static final String UNKNOWN_STATUS_REASON_PHRASE = "Unknown Status";
	@NonNull
	public static final String HELLO_WORLD_BODY = "Hello world";
	@NonNull
	public static final String NOT_FOUND_BODY = "Not Found";

	@NonNull
	private static final Logger logger = Logger.getLogger(ResponseWriter.class.getName());

	static {
		Map<String, String> defaultHeaders = new LinkedHashMap<>();
		defaultHeaders.put("Content-Type", "text/plain; charset=utf-8");
		defaultHeaders.put("Connection", "keep-alive");

		DEFAULT_HEADERS = Collections.unmodifiableMap(defaultHeaders);
	}

	private ResponseWriter() {
		// Non-instantiable
	}

	/**
	 * Writes and finalizes a plain-text response.
	 *
	 * @param responseSink the sink to write to
	 * @param statusCode   the HTTP status code
	 * @param body         the response body, encoded as UTF-8
	 * @param extraHeaders headers merged over {@link #DEFAULT_HEADERS}, may be {@code null}
	 * @throws IllegalStateException if {@code responseSink} has already been finalized
	 */
	public static void sendResponse(@NonNull ResponseSink responseSink,
																	@NonNull Integer statusCode,
																	@NonNull String body,
																	@Nullable Map<@NonNull String, @NonNull String> extraHeaders) {
		requireNonNull(responseSink);
		requireNonNull(statusCode);
		requireNonNull(body);

		if (responseSink.isFinalized())
			throw new IllegalStateException(format("Unable to send %d response: response has already been finalized", statusCode));

		byte[] bodyBytes = body.getBytes(StandardCharsets.UTF_8);

		responseSink.setStatus(statusCode, reasonPhraseFor(statusCode));

		for (Entry<String, String> header : mergeHeaders(extraHeaders).entrySet())
			responseSink.setHeader(header.getKey(), header.getValue());

		responseSink.setHeader("Content-Length", String.valueOf(bodyBytes.length));
		responseSink.write(bodyBytes);
		responseSink.end();

		logger.info(format("HTTP response sent - Status: %d, Bytes: %d", statusCode, bodyBytes.length));
	}

	public static void sendResponse(@NonNull ResponseSink responseSink,
																	@NonNull Integer statusCode,
																	@NonNull String body) {
		sendResponse(responseSink, statusCode, body, null);
	}

	public static void sendNotFound(@NonNull ResponseSink responseSink) {
		sendResponse(responseSink, 404, NOT_FOUND_BODY);
		logger.info("404 Not Found response sent for undefined route");
	}

	public static void sendHelloWorld(@NonNull ResponseSink responseSink) {
		sendResponse(responseSink, 200, HELLO_WORLD_BODY);
		logger.info("Hello world response sent successfully");
	}

	/**
	 * The standard reason phrase for a status code.
	 *
	 * @param statusCode the HTTP status code
	 * @return the reason phrase, or {@value #UNKNOWN_STATUS_REASON_PHRASE} for codes with no standard phrase
	 */
	@NonNull
	public static String reasonPhraseFor(@NonNull Integer statusCode) {
		requireNonNull(statusCode);

		StatusCode knownStatusCode = StatusCode.fromStatusCode(statusCode).orElse(null);

		if (knownStatusCode != null)
			return knownStatusCode.getReasonPhrase();

		logger.warning(format("Unknown HTTP status code: %d", statusCode));
		return UNKNOWN_STATUS_REASON_PHRASE;
	}

	@NonNull
	private static Map<String, String> mergeHeaders(@Nullable Map<String, String> extraHeaders) {
		Map<String, String> mergedHeaders = new LinkedHashMap<>(DEFAULT_HEADERS);

		if (extraHeaders == null)
			return mergedHeaders;

		for (Entry<String, String> extraHeader : extraHeaders.entrySet()) {
			for (Iterator<String> names = mergedHeaders.keySet().iterator(); names.hasNext(); )
				if (names.next().equalsIgnoreCase(extraHeader.getKey()))
					names.remove();

			mergedHeaders.put(extraHeader.getKey(), extraHeader.getValue());
		}

		return mergedHeaders;
	}
}
