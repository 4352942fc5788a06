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
import java.io.ByteArrayOutputStream;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link ResponseSink} which buffers the response in memory and, on {@link #end()}, delivers exactly one
 * {@link MarshaledResponse} to a consumer.
 * <p>
 * The server wires the consumer to the connection; tests can capture the response without a socket:
 * <pre>{@code
 * AtomicReference<MarshaledResponse> response = new AtomicReference<>();
 * router.route(requestContext, new DefaultResponseSink(response::set));
 * }</pre>
 * A sink belongs to a single request and is not safe for concurrent use.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public final class DefaultResponseSink implements ResponseSink {
	@NonNull
	private final Consumer<MarshaledResponse> marshaledResponseConsumer;
	@NonNull
	private final Map<@NonNull String, @NonNull String> headers;
	@NonNull
	private final ByteArrayOutputStream body;
	@NonNull
	private Integer statusCode;
	@Nullable
	private String reasonPhrase;
	private boolean finalized;

	public DefaultResponseSink(@NonNull Consumer<MarshaledResponse> marshaledResponseConsumer) {
		requireNonNull(marshaledResponseConsumer);

		this.marshaledResponseConsumer = marshaledResponseConsumer;
		this.headers = new LinkedHashMap<>();
		this.body = new ByteArrayOutputStream();
		this.statusCode = 200;
	}

	@Override
	public void setStatus(@NonNull Integer statusCode,
												@Nullable String reasonPhrase) {
		requireNonNull(statusCode);
		ensureNotFinalized("set status");

		if (statusCode < 100 || statusCode > 999)
			throw new IllegalArgumentException(format("Illegal status code %d", statusCode));

		this.statusCode = statusCode;
		this.reasonPhrase = reasonPhrase;
	}

	@Override
	public void setHeader(@NonNull String name,
												@NonNull String value) {
		requireNonNull(name);
		requireNonNull(value);
		ensureNotFinalized("set header");
		validateHeader(name, value);

		// Same-case names are replaced in place by put(); a case variant is dropped first
		for (Iterator<Map.Entry<String, String>> iterator = this.headers.entrySet().iterator(); iterator.hasNext(); ) {
			Map.Entry<String, String> entry = iterator.next();

			if (entry.getKey().equalsIgnoreCase(name) && !entry.getKey().equals(name)) {
				iterator.remove();
				break;
			}
		}

		this.headers.put(name, value);
	}

	@Override
	public void write(@NonNull byte[] bytes) {
		requireNonNull(bytes);
		ensureNotFinalized("write body");
		this.body.writeBytes(bytes);
	}

	@Override
	public void reset() {
		ensureNotFinalized("reset response");

		this.statusCode = 200;
		this.reasonPhrase = null;
		this.headers.clear();
		this.body.reset();
	}

	@Override
	public void end() {
		ensureNotFinalized("finalize response");
		this.finalized = true;

		MarshaledResponse marshaledResponse = MarshaledResponse.withStatusCode(this.statusCode)
				.reasonPhrase(this.reasonPhrase)
				.headers(this.headers)
				.body(this.body.toByteArray())
				.build();

		this.marshaledResponseConsumer.accept(marshaledResponse);
	}

	@NonNull
	@Override
	public Boolean isFinalized() {
		return this.finalized;
	}

	@NonNull
	@Override
	public Integer getStatusCode() {
		return this.statusCode;
	}

	private void ensureNotFinalized(@NonNull String action) {
		if (this.finalized)
			throw new IllegalStateException(format("Unable to %s: response has already been finalized", action));
	}

	private static void validateHeader(@NonNull String name,
																		 @NonNull String value) {
		if (name.isEmpty())
			throw new IllegalArgumentException("Header name must not be empty");

		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);

			if (c <= 0x20 || c >= 0x7F || c == ':')
				throw new IllegalArgumentException(format("Illegal character in header name '%s'", name));
		}

		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);

			if (c == '\r' || c == '\n' || c == 0)
				throw new IllegalArgumentException(format("Illegal control character in value of header '%s'", name));
		}
	}
}
