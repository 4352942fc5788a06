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

import com.hellohttp.util.LoggingUtils;
import org.jspecify.annotations.NonNull;

import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.hellohttp.Utilities.trimAggressivelyToNull;

/**
 * Process entry point: configures logging, loads configuration from the environment and runs the server
 * until it is signaled to stop.
 * <p>
 * Set {@code LOGBACK_CONFIG} to the path of a Logback XML file to replace the bundled {@code logback.xml}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public final class Main {
	@NonNull
	public static final String LOGBACK_CONFIG_ENVIRONMENT_VARIABLE = "LOGBACK_CONFIG";

	private Main() {
		// Non-instantiable
	}

	public static void main(String[] args) throws InterruptedException {
		String logbackConfig = trimAggressivelyToNull(System.getenv(LOGBACK_CONFIG_ENVIRONMENT_VARIABLE));

		if (logbackConfig == null)
			LoggingUtils.initializeLogging();
		else
			LoggingUtils.initializeLogback(Path.of(logbackConfig));

		Logger logger = Logger.getLogger(Main.class.getName());
		HelloHttp helloHttp = HelloHttp.withConfiguration(ConfigurationLoader.load()).build();

		try {
			helloHttp.start();
		} catch (ServerStartupException e) {
			logger.log(Level.FINE, "Startup failed", e);
			System.exit(1);
		}

		System.exit(helloHttp.awaitShutdown());
	}
}
