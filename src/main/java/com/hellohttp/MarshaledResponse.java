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
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;

import static com.hellohttp.Utilities.emptyByteArray;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A finalized response, suitable for sending to clients over the wire: status line parts, headers in the order
 * they were set, and body bytes.
 * <p>
 * Instances are produced by {@link DefaultResponseSink#end()}, or directly via the {@link #withStatusCode(Integer)}
 * builder factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class MarshaledResponse {
	@NonNull
	private final Integer statusCode;
	@NonNull
	private final String reasonPhrase;
	@NonNull
	private final Map<@NonNull String, @NonNull String> headers;
	@NonNull
	private final byte[] body;

	/**
	 * Acquires a builder for {@link MarshaledResponse} instances.
	 *
	 * @param statusCode the HTTP status code for this response
	 * @return the builder
	 */
	@NonNull
	public static Builder withStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return new Builder(statusCode);
	}

	protected MarshaledResponse(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statusCode = builder.statusCode;
		this.reasonPhrase = builder.reasonPhrase != null ? builder.reasonPhrase : ResponseWriter.reasonPhraseFor(builder.statusCode);
		this.headers = builder.headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
		this.body = builder.body == null ? emptyByteArray() : builder.body.clone();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{statusCode=%s, reasonPhrase=%s, headers=%s, body=%d bytes}", getClass().getSimpleName(),
				getStatusCode(), getReasonPhrase(), getHeaders(), this.body.length);
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	public String getReasonPhrase() {
		return this.reasonPhrase;
	}

	/**
	 * Headers in the order they were set. Names keep the case they were set with.
	 *
	 * @return an unmodifiable view of the headers
	 */
	@NonNull
	public Map<@NonNull String, @NonNull String> getHeaders() {
		return this.headers;
	}

	/**
	 * Case-insensitive header lookup.
	 *
	 * @param name the header name, e.g. {@code "content-type"}
	 * @return the header value, if set
	 */
	@NonNull
	public Optional<String> getHeader(@NonNull String name) {
		requireNonNull(name);

		for (Entry<String, String> entry : getHeaders().entrySet())
			if (entry.getKey().equalsIgnoreCase(name))
				return Optional.of(entry.getValue());

		return Optional.empty();
	}

	/**
	 * A defensive copy of the body bytes.
	 *
	 * @return the body, empty if none was written
	 */
	@NonNull
	public byte[] getBody() {
		return this.body.clone();
	}

	@NonNull
	public String getBodyAsString() {
		return new String(this.body, StandardCharsets.UTF_8);
	}

	/**
	 * Builder used to construct instances of {@link MarshaledResponse}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Integer statusCode;
		@Nullable
		private String reasonPhrase;
		@Nullable
		private Map<@NonNull String, @NonNull String> headers;
		@Nullable
		private byte[] body;

		protected Builder(@NonNull Integer statusCode) {
			requireNonNull(statusCode);
			this.statusCode = statusCode;
		}

		@NonNull
		public Builder reasonPhrase(@Nullable String reasonPhrase) {
			this.reasonPhrase = reasonPhrase;
			return this;
		}

		@NonNull
		public Builder headers(@Nullable Map<@NonNull String, @NonNull String> headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public Builder body(@Nullable byte[] body) {
			this.body = body;
			return this;
		}

		@NonNull
		public MarshaledResponse build() {
			return new MarshaledResponse(this);
		}
	}
}
