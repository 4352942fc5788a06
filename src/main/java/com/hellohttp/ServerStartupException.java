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

import static java.util.Objects.requireNonNull;

/**
 * Thrown when a server cannot bind its listening socket. Not retried: startup is abandoned.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public class ServerStartupException extends RuntimeException {
	@NonNull
	private final BindFailureReason bindFailureReason;

	public ServerStartupException(@NonNull BindFailureReason bindFailureReason,
																@NonNull String message,
																@Nullable Throwable cause) {
		super(requireNonNull(message), cause);
		this.bindFailureReason = requireNonNull(bindFailureReason);
	}

	@NonNull
	public BindFailureReason getBindFailureReason() {
		return this.bindFailureReason;
	}
}
