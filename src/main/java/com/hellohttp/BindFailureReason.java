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

import java.net.SocketException;
import java.nio.channels.UnresolvedAddressException;
import java.nio.channels.UnsupportedAddressTypeException;
import java.util.Optional;

import static java.util.Locale.ENGLISH;

/**
 * Classification of the reasons a listening socket could not be bound.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum BindFailureReason {
	/**
	 * Another process (or server instance) is already listening on the port.
	 */
	ADDRESS_IN_USE("Port is already in use. Stop the other process or set PORT to a free port"),
	/**
	 * The OS refused to let this process bind the port or address.
	 */
	PERMISSION_DENIED("Permission denied. Use a port above 1024 or run with sufficient privileges"),
	/**
	 * The host does not resolve, or does not name an address of this machine.
	 */
	ADDRESS_UNAVAILABLE("Address not available. Check that HOST resolves to an address of this machine"),
	OTHER("Unable to bind the listening socket");

	@NonNull
	private final String diagnostic;

	BindFailureReason(@NonNull String diagnostic) {
		this.diagnostic = diagnostic;
	}

	/**
	 * Operator-facing advice for this failure class.
	 */
	@NonNull
	public String getDiagnostic() {
		return this.diagnostic;
	}

	/**
	 * Classifies a failure thrown while opening or binding a server socket.
	 *
	 * @param throwable the failure, may be {@code null}
	 * @return the failure class, {@link #OTHER} if none applies
	 */
	@NonNull
	public static BindFailureReason fromThrowable(@Nullable Throwable throwable) {
		// Bounded walk: cause chains can be cyclic
		for (int depth = 0; throwable != null && depth < 10; ++depth) {
			BindFailureReason bindFailureReason = classify(throwable);

			if (bindFailureReason != OTHER)
				return bindFailureReason;

			throwable = throwable.getCause();
		}

		return OTHER;
	}

	@NonNull
	private static BindFailureReason classify(@NonNull Throwable throwable) {
		if (throwable instanceof UnresolvedAddressException || throwable instanceof UnsupportedAddressTypeException)
			return ADDRESS_UNAVAILABLE;

		if (throwable instanceof SecurityException)
			return PERMISSION_DENIED;

		if (throwable instanceof SocketException) {
			String message = Optional.ofNullable(throwable.getMessage()).orElse("").toLowerCase(ENGLISH);

			if (message.contains("in use"))
				return ADDRESS_IN_USE;

			if (message.contains("permission denied") || message.contains("access denied") || message.contains("not permitted"))
				return PERMISSION_DENIED;

			if (message.contains("assign requested address") || message.contains("not available") || message.contains("unresolved"))
				return ADDRESS_UNAVAILABLE;
		}

		return OTHER;
	}
}
