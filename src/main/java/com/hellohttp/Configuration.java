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
import java.util.Objects;

import static com.hellohttp.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Immutable snapshot of the runtime settings: the port and host to bind, and the environment mode.
 * <p>
 * Instances are normally acquired via {@link ConfigurationLoader#load()}, which never fails.
 * Direct construction validates the same invariants and throws {@link IllegalArgumentException} on violation.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Configuration {
	/**
	 * Lowest port the server may bind. Privileged ports are excluded.
	 */
	public static final int MINIMUM_PORT = 1025;
	public static final int MAXIMUM_PORT = 65535;

	@NonNull
	private final Integer port;
	@NonNull
	private final String host;
	@NonNull
	private final String environment;

	public Configuration(@NonNull Integer port,
											 @NonNull String host,
											 @NonNull String environment) {
		requireNonNull(port);
		requireNonNull(host);
		requireNonNull(environment);

		if (port < MINIMUM_PORT || port > MAXIMUM_PORT)
			throw new IllegalArgumentException(format("Port must be between %d and %d, but was %d", MINIMUM_PORT, MAXIMUM_PORT, port));

		String normalizedHost = trimAggressivelyToNull(host);

		if (normalizedHost == null)
			throw new IllegalArgumentException("Host must not be blank");

		String normalizedEnvironment = trimAggressivelyToNull(environment);

		if (normalizedEnvironment == null)
			throw new IllegalArgumentException("Environment must not be blank");

		this.port = port;
		this.host = normalizedHost;
		this.environment = normalizedEnvironment;
	}

	@NonNull
	public Integer getPort() {
		return this.port;
	}

	@NonNull
	public String getHost() {
		return this.host;
	}

	@NonNull
	public String getEnvironment() {
		return this.environment;
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Configuration configuration))
			return false;

		return Objects.equals(getPort(), configuration.getPort())
				&& Objects.equals(getHost(), configuration.getHost())
				&& Objects.equals(getEnvironment(), configuration.getEnvironment());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getPort(), getHost(), getEnvironment());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{port=%s, host=%s, environment=%s}", getClass().getSimpleName(), getPort(), getHost(), getEnvironment());
	}
}
