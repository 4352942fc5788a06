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

import java.util.EnumSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * States of a {@link HelloHttp} instance.
 * <p>
 * {@code INITIALIZING -> BINDING -> LISTENING -> DRAINING -> STOPPED}, with {@link #ERRORED} reachable from
 * {@link #BINDING} (bind failure) and {@link #LISTENING} (the event loop died).
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum ServerState {
	INITIALIZING,
	BINDING,
	LISTENING,
	DRAINING,
	STOPPED,
	ERRORED;

	@NonNull
	public Boolean isTerminal() {
		return this == STOPPED || this == ERRORED;
	}

	/**
	 * Is moving from this state to {@code nextState} a legal transition?
	 */
	@NonNull
	public Boolean canTransitionTo(@NonNull ServerState nextState) {
		requireNonNull(nextState);
		return successors().contains(nextState);
	}

	@NonNull
	private Set<ServerState> successors() {
		switch (this) {
			case INITIALIZING:
				return EnumSet.of(BINDING);
			case BINDING:
				return EnumSet.of(LISTENING, ERRORED);
			case LISTENING:
				return EnumSet.of(DRAINING, ERRORED);
			case DRAINING:
				return EnumSet.of(STOPPED);
			default:
				return EnumSet.noneOf(ServerState.class);
		}
	}
}
