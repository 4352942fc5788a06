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

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static java.util.Locale.ENGLISH;

/**
 * Typesafe representation of <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods">HTTP request methods</a>.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum HttpMethod {
	GET,
	HEAD,
	POST,
	PUT,
	DELETE,
	CONNECT,
	OPTIONS,
	TRACE,
	PATCH;

	@NonNull
	private static final Map<String, HttpMethod> VALUES_BY_NAME;

	static {
		VALUES_BY_NAME = Arrays.stream(HttpMethod.values()).collect(Collectors.toUnmodifiableMap(Enum::name, Function.identity()));
	}

	/**
	 * Case-insensitive lookup of a method by its wire name, e.g. {@code "get"} or {@code "GET"}.
	 *
	 * @param name the method name as sent by the client, may be {@code null}
	 * @return the matching method, or {@link Optional#empty()} for extension or garbage methods
	 */
	@NonNull
	public static Optional<HttpMethod> fromName(@Nullable String name) {
		if (name == null)
			return Optional.empty();

		return Optional.ofNullable(VALUES_BY_NAME.get(name.trim().toUpperCase(ENGLISH)));
	}
}
