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

import java.nio.charset.StandardCharsets;

import static java.util.Objects.requireNonNull;

/**
 * Incrementally builds one response: status, headers, then body, then {@link #end()}.
 * <p>
 * A sink is finalized exactly once. After {@link #end()} has been called, every mutating method, including a second
 * {@link #end()}, throws {@link IllegalStateException}.
 * <p>
 * A standard implementation which hands the finished {@link MarshaledResponse} to a callback is {@link DefaultResponseSink}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface ResponseSink {
	/**
	 * Sets the status line.
	 *
	 * @param statusCode   the HTTP status code
	 * @param reasonPhrase the reason phrase, or {@code null} to use the standard phrase for {@code statusCode}
	 * @throws IllegalStateException if this sink has been finalized
	 */
	void setStatus(@NonNull Integer statusCode,
								 @Nullable String reasonPhrase);

	/**
	 * Sets a header, replacing any existing header with the same name (compared case-insensitively).
	 *
	 * @param name  the header name
	 * @param value the header value
	 * @throws IllegalStateException    if this sink has been finalized
	 * @throws IllegalArgumentException if the name or value contains characters that are illegal in a header
	 */
	void setHeader(@NonNull String name,
								 @NonNull String value);

	/**
	 * Appends bytes to the body.
	 *
	 * @param bytes the bytes to append
	 * @throws IllegalStateException if this sink has been finalized
	 */
	void write(@NonNull byte[] bytes);

	/**
	 * Appends the UTF-8 encoding of {@code string} to the body.
	 */
	default void write(@NonNull String string) {
		requireNonNull(string);
		write(string.getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * Discards the status, headers and body written so far, returning this sink to its initial {@code 200} state.
	 *
	 * @throws IllegalStateException if this sink has been finalized
	 */
	void reset();

	/**
	 * Finalizes the response, making it available for transmission.
	 *
	 * @throws IllegalStateException if this sink has already been finalized
	 */
	void end();

	@NonNull
	Boolean isFinalized();

	/**
	 * The status code set so far; {@code 200} if none was set.
	 */
	@NonNull
	Integer getStatusCode();
}
