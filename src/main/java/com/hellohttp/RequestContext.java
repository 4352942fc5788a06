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
import java.net.InetSocketAddress;
import java.util.Collections;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.TreeMap;

import static com.hellohttp.Utilities.normalizedPathForUrl;
import static com.hellohttp.Utilities.trimAggressivelyToEmpty;
import static java.lang.String.format;
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

/**
 * Per-request view handed to the {@link Router} and {@link RouteHandler}s: upper-cased method, normalized path,
 * the raw request target, and case-insensitive headers.
 * <p>
 * Instances can be acquired via the {@link #withMethodAndUri(String, String)} builder factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class RequestContext {
	@NonNull
	private final String method;
	@NonNull
	private final String path;
	@NonNull
	private final String rawUri;
	@NonNull
	private final Map<@NonNull String, @NonNull String> headers;
	@Nullable
	private final InetSocketAddress remoteAddress;

	/**
	 * Acquires a builder for {@link RequestContext} instances.
	 *
	 * @param method the request method as sent, e.g. {@code "get"}
	 * @param uri    the request target as sent, e.g. {@code "/hello/?x=1"}
	 * @return the builder
	 */
	@NonNull
	public static Builder withMethodAndUri(@NonNull String method,
																				 @NonNull String uri) {
		requireNonNull(method);
		requireNonNull(uri);

		return new Builder(method, uri);
	}

	protected RequestContext(@NonNull Builder builder) {
		requireNonNull(builder);

		this.method = trimAggressivelyToEmpty(builder.method).toUpperCase(ENGLISH);
		this.rawUri = builder.uri;
		this.path = normalizedPathForUrl(builder.uri);
		this.remoteAddress = builder.remoteAddress;

		Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		if (builder.headers != null)
			for (Entry<String, String> header : builder.headers.entrySet())
				headers.merge(header.getKey(), header.getValue(), (existing, additional) -> existing + ", " + additional);

		this.headers = Collections.unmodifiableMap(headers);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{method=%s, path=%s, rawUri=%s}", getClass().getSimpleName(), getMethod(), getPath(), getRawUri());
	}

	/**
	 * The request method, upper-cased. Not necessarily one of {@link HttpMethod}.
	 */
	@NonNull
	public String getMethod() {
		return this.method;
	}

	@NonNull
	public Optional<HttpMethod> getHttpMethod() {
		return HttpMethod.fromName(getMethod());
	}

	/**
	 * The path used for routing: query and fragment stripped, single trailing slash removed except for {@code "/"}.
	 */
	@NonNull
	public String getPath() {
		return this.path;
	}

	@NonNull
	public String getRawUri() {
		return this.rawUri;
	}

	/**
	 * Headers keyed case-insensitively. Repeated headers are joined with {@code ", "}.
	 */
	@NonNull
	public Map<@NonNull String, @NonNull String> getHeaders() {
		return this.headers;
	}

	@NonNull
	public Optional<String> getHeader(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(getHeaders().get(name));
	}

	@NonNull
	public Optional<InetSocketAddress> getRemoteAddress() {
		return Optional.ofNullable(this.remoteAddress);
	}

	/**
	 * Builder used to construct instances of {@link RequestContext}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String method;
		@NonNull
		private final String uri;
		@Nullable
		private Map<@NonNull String, @NonNull String> headers;
		@Nullable
		private InetSocketAddress remoteAddress;

		protected Builder(@NonNull String method,
											@NonNull String uri) {
			requireNonNull(method);
			requireNonNull(uri);

			this.method = method;
			this.uri = uri;
		}

		@NonNull
		public Builder headers(@Nullable Map<@NonNull String, @NonNull String> headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public Builder remoteAddress(@Nullable InetSocketAddress remoteAddress) {
			this.remoteAddress = remoteAddress;
			return this;
		}

		@NonNull
		public RequestContext build() {
			return new RequestContext(this);
		}
	}
}
