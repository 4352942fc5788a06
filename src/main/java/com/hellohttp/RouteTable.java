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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.Set;

import static com.hellohttp.Utilities.normalizedPathForUrl;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Immutable mapping of exact paths to the handlers registered for each {@link HttpMethod}.
 * <p>
 * Paths and methods keep their registration order. Instances are built once via {@link #builder()} and may be
 * shared by any number of threads.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class RouteTable {
	@NonNull
	private static final RouteTable DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = builder()
				.route("/hello", HttpMethod.GET, HelloHandler.defaultInstance())
				.build();
	}

	@NonNull
	private final Map<@NonNull String, @NonNull Map<@NonNull HttpMethod, @NonNull RouteHandler>> handlersByMethodByPath;

	/**
	 * The application's route table: {@code GET /hello}.
	 *
	 * @return the default route table
	 */
	@NonNull
	public static RouteTable defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	private RouteTable(@NonNull Builder builder) {
		requireNonNull(builder);

		Map<String, Map<HttpMethod, RouteHandler>> handlersByMethodByPath = new LinkedHashMap<>();

		for (Entry<String, Map<HttpMethod, RouteHandler>> entry : builder.handlersByMethodByPath.entrySet()) {
			if (entry.getValue().isEmpty())
				throw new IllegalArgumentException(format("No methods were registered for path '%s'", entry.getKey()));

			handlersByMethodByPath.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
		}

		this.handlersByMethodByPath = Collections.unmodifiableMap(handlersByMethodByPath);
	}

	/**
	 * Handlers registered for an exact, normalized path.
	 *
	 * @param path the normalized request path
	 * @return the unmodifiable method-to-handler mapping, or {@link Optional#empty()} if the path is not registered
	 */
	@NonNull
	public Optional<Map<@NonNull HttpMethod, @NonNull RouteHandler>> handlersForPath(@NonNull String path) {
		requireNonNull(path);
		return Optional.ofNullable(this.handlersByMethodByPath.get(path));
	}

	/**
	 * Methods registered for a path, in registration order; empty if the path is not registered.
	 */
	@NonNull
	public List<@NonNull HttpMethod> allowedMethodsForPath(@NonNull String path) {
		requireNonNull(path);

		Map<HttpMethod, RouteHandler> handlersByMethod = this.handlersByMethodByPath.get(path);
		return handlersByMethod == null ? List.of() : List.copyOf(handlersByMethod.keySet());
	}

	@NonNull
	public Set<@NonNull String> getPaths() {
		return this.handlersByMethodByPath.keySet();
	}

	@Override
	@NonNull
	public String toString() {
		List<String> routes = new ArrayList<>();

		for (Entry<String, Map<HttpMethod, RouteHandler>> entry : this.handlersByMethodByPath.entrySet())
			for (HttpMethod httpMethod : entry.getValue().keySet())
				routes.add(format("%s %s", httpMethod.name(), entry.getKey()));

		return format("%s{routes=%s}", getClass().getSimpleName(), routes);
	}

	/**
	 * Builder used to construct instances of {@link RouteTable}.
	 * <p>
	 * Registrations are validated as they are made: paths must be absolute and already normalized,
	 * and a path/method pair may be registered only once.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Map<@NonNull String, @NonNull Map<@NonNull HttpMethod, @NonNull RouteHandler>> handlersByMethodByPath;

		private Builder() {
			this.handlersByMethodByPath = new LinkedHashMap<>();
		}

		@NonNull
		public Builder route(@NonNull String path,
												 @NonNull HttpMethod httpMethod,
												 @NonNull RouteHandler routeHandler) {
			requireNonNull(path);
			requireNonNull(httpMethod);
			requireNonNull(routeHandler);

			validatePath(path);

			Map<HttpMethod, RouteHandler> handlersByMethod = this.handlersByMethodByPath.computeIfAbsent(path, ignored -> new LinkedHashMap<>());

			if (handlersByMethod.containsKey(httpMethod))
				throw new IllegalArgumentException(format("A handler for %s %s is already registered", httpMethod.name(), path));

			handlersByMethod.put(httpMethod, routeHandler);
			return this;
		}

		/**
		 * Registers every handler in {@code handlersByMethod} for {@code path}.
		 *
		 * @throws IllegalArgumentException if {@code handlersByMethod} is empty or any pair is already registered
		 */
		@NonNull
		public Builder routes(@NonNull String path,
													@NonNull Map<@NonNull HttpMethod, @NonNull RouteHandler> handlersByMethod) {
			requireNonNull(path);
			requireNonNull(handlersByMethod);

			if (handlersByMethod.isEmpty())
				throw new IllegalArgumentException(format("No methods were provided for path '%s'", path));

			for (Entry<HttpMethod, RouteHandler> entry : handlersByMethod.entrySet())
				route(path, entry.getKey(), entry.getValue());

			return this;
		}

		@NonNull
		public RouteTable build() {
			return new RouteTable(this);
		}

		private static void validatePath(@NonNull String path) {
			if (!path.startsWith("/"))
				throw new IllegalArgumentException(format("Path '%s' must be absolute", path));

			if (!path.equals(normalizedPathForUrl(path)))
				throw new IllegalArgumentException(format("Path '%s' is not normalized; expected '%s'", path, normalizedPathForUrl(path)));
		}
	}
}
