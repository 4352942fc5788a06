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
import java.util.Map;
import java.util.logging.Logger;

import static com.hellohttp.Utilities.trimAggressively;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reads {@code PORT}, {@code HOST} and {@code APP_ENV} from the environment and produces a valid {@link Configuration}.
 * <p>
 * Loading is total: missing values fall back to defaults (logged at {@code INFO}), and unusable values fall back
 * to defaults (logged at {@code WARN}). Each variable is validated independently of the others.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ConfigurationLoader {
	@NonNull
	public static final String PORT_ENVIRONMENT_VARIABLE = "PORT";
	@NonNull
	public static final String HOST_ENVIRONMENT_VARIABLE = "HOST";
	@NonNull
	public static final String ENVIRONMENT_MODE_ENVIRONMENT_VARIABLE = "APP_ENV";

	@NonNull
	public static final Integer DEFAULT_PORT = 3000;
	@NonNull
	public static final String DEFAULT_HOST = "localhost";
	@NonNull
	public static final String DEFAULT_ENVIRONMENT = "development";

	@NonNull
	private static final Logger logger = Logger.getLogger(ConfigurationLoader.class.getName());

	private ConfigurationLoader() {
		// Non-instantiable
	}

	/**
	 * Loads configuration from the process environment.
	 *
	 * @return a valid configuration, never {@code null}
	 */
	@NonNull
	public static Configuration load() {
		return load(System.getenv());
	}

	/**
	 * Loads configuration from the given environment mapping.
	 *
	 * @param environment variable names to values, e.g. {@link System#getenv()}
	 * @return a valid configuration, never {@code null}
	 */
	@NonNull
	public static Configuration load(@NonNull Map<String, String> environment) {
		requireNonNull(environment);

		Integer port = resolvePort(environment.get(PORT_ENVIRONMENT_VARIABLE));
		String host = resolveString(HOST_ENVIRONMENT_VARIABLE, environment.get(HOST_ENVIRONMENT_VARIABLE), DEFAULT_HOST);
		String environmentMode = resolveString(ENVIRONMENT_MODE_ENVIRONMENT_VARIABLE,
				environment.get(ENVIRONMENT_MODE_ENVIRONMENT_VARIABLE), DEFAULT_ENVIRONMENT);

		Configuration configuration = new Configuration(port, host, environmentMode);

		logger.info(format("Server configuration loaded - Port: %d, Host: %s, Environment: %s",
				configuration.getPort(), configuration.getHost(), configuration.getEnvironment()));

		return configuration;
	}

	@NonNull
	private static Integer resolvePort(@Nullable String rawPort) {
		if (rawPort == null || rawPort.isEmpty()) {
			logger.info(format("%s environment variable not set, using default port: %d", PORT_ENVIRONMENT_VARIABLE, DEFAULT_PORT));
			return DEFAULT_PORT;
		}

		Integer port;

		try {
			port = Integer.parseInt(trimAggressively(rawPort), 10);
		} catch (NumberFormatException e) {
			port = null;
		}

		if (port == null || port < Configuration.MINIMUM_PORT || port > Configuration.MAXIMUM_PORT) {
			logger.warning(format("Invalid %s environment variable \"%s\". Port must be a number between %d and %d. Using default port: %d",
					PORT_ENVIRONMENT_VARIABLE, rawPort, Configuration.MINIMUM_PORT, Configuration.MAXIMUM_PORT, DEFAULT_PORT));
			return DEFAULT_PORT;
		}

		logger.info(format("Using %s from environment variable: %d", PORT_ENVIRONMENT_VARIABLE, port));
		return port;
	}

	@NonNull
	private static String resolveString(@NonNull String name,
																			@Nullable String rawValue,
																			@NonNull String defaultValue) {
		if (rawValue == null || rawValue.isEmpty()) {
			logger.info(format("%s environment variable not set, using default: %s", name, defaultValue));
			return defaultValue;
		}

		String value = trimAggressively(rawValue);

		if (value.isEmpty()) {
			logger.warning(format("Invalid %s environment variable \"%s\". Value must be a non-empty string. Using default: %s",
					name, rawValue, defaultValue));
			return defaultValue;
		}

		logger.info(format("Using %s from environment variable: %s", name, value));
		return value;
	}
}
