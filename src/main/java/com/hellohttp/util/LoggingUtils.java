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

package com.hellohttp.util;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.bridge.SLF4JBridgeHandler;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Handler;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.LogManager.getLogManager;
import static org.slf4j.LoggerFactory.getILoggerFactory;

/**
 * Utility methods for wiring {@code java.util.logging} into SLF4J/Logback.
 * <p>
 * Application code logs through JUL; once {@link #initializeLogging()} runs, those records are routed to Logback,
 * which writes {@code INFO} to standard output and {@code WARN}/{@code ERROR} to standard error per {@code logback.xml}.
 *
 * @author <a href="http://revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class LoggingUtils {
	@NonNull
	private static final Object LOCK;

	static {
		LOCK = new Object();
	}

	public enum LogbackOption {
		DEBUGGING_ENABLED
	}

	private LoggingUtils() {
		// Non-instantiable
	}

	/**
	 * Bridges JUL to SLF4J using whatever Logback configuration is on the classpath.
	 * <p>
	 * Safe to call more than once.
	 */
	public static void initializeLogging() {
		synchronized (LOCK) {
			installBridge();
		}
	}

	/**
	 * Reconfigures Logback from an explicit file, then bridges JUL to SLF4J.
	 *
	 * @param logbackConfigurationFile the Logback XML file to load
	 * @param logbackOptions           optional behavior flags
	 * @throws IllegalArgumentException if the file does not exist or is not a regular file
	 * @throws IllegalStateException    if Logback rejects the file
	 */
	public static void initializeLogback(@NonNull Path logbackConfigurationFile,
																			 @Nullable LogbackOption... logbackOptions) {
		requireNonNull(logbackConfigurationFile);

		synchronized (LOCK) {
			List<LogbackOption> logbackOptionsAsList = logbackOptions == null ? Collections.emptyList() : Arrays.asList(logbackOptions);

			if (!Files.exists(logbackConfigurationFile))
				throw new IllegalArgumentException(format(
						"Unable to initialize Logback logging. Could not find a configuration file at %s",
						logbackConfigurationFile.toAbsolutePath()));

			if (!Files.isRegularFile(logbackConfigurationFile))
				throw new IllegalArgumentException(format(
						"Unable to initialize Logback logging. The configuration path %s does not appear to be a regular file",
						logbackConfigurationFile.toAbsolutePath()));

			uninstallLogging();

			LoggerContext loggerContext = (LoggerContext) getILoggerFactory();

			try {
				JoranConfigurator configurator = new JoranConfigurator();
				configurator.setContext(loggerContext);
				loggerContext.reset();
				configurator.doConfigure(logbackConfigurationFile.toFile().getAbsolutePath());
			} catch (JoranException e) {
				throw new IllegalStateException("Unable to configure Logback logging", e);
			}

			if (logbackOptionsAsList.contains(LogbackOption.DEBUGGING_ENABLED))
				StatusPrinter.printInCaseOfErrorsOrWarnings(loggerContext);

			installBridge();
		}
	}

	public static void uninstallLogging() {
		synchronized (LOCK) {
			if (SLF4JBridgeHandler.isInstalled())
				SLF4JBridgeHandler.uninstall();
		}
	}

	private static void installBridge() {
		if (SLF4JBridgeHandler.isInstalled())
			return;

		// JUL's default console handler would otherwise print every record a second time
		java.util.logging.Logger rootLogger = getLogManager().getLogger("");
		for (Handler handler : rootLogger.getHandlers())
			rootLogger.removeHandler(handler);

		SLF4JBridgeHandler.install();
	}
}
