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

import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.net.BindException;
import java.net.SocketException;
import java.nio.channels.UnresolvedAddressException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ServerStateTests {
	@Test
	public void legalTransitions() {
		assertTrue(ServerState.INITIALIZING.canTransitionTo(ServerState.BINDING));
		assertTrue(ServerState.BINDING.canTransitionTo(ServerState.LISTENING));
		assertTrue(ServerState.BINDING.canTransitionTo(ServerState.ERRORED));
		assertTrue(ServerState.LISTENING.canTransitionTo(ServerState.DRAINING));
		assertTrue(ServerState.LISTENING.canTransitionTo(ServerState.ERRORED));
		assertTrue(ServerState.DRAINING.canTransitionTo(ServerState.STOPPED));
	}

	@Test
	public void illegalTransitions() {
		assertFalse(ServerState.INITIALIZING.canTransitionTo(ServerState.LISTENING));
		assertFalse(ServerState.LISTENING.canTransitionTo(ServerState.BINDING));
		assertFalse(ServerState.DRAINING.canTransitionTo(ServerState.LISTENING));

		for (ServerState nextState : ServerState.values()) {
			assertFalse(ServerState.STOPPED.canTransitionTo(nextState));
			assertFalse(ServerState.ERRORED.canTransitionTo(nextState));
		}
	}

	@Test
	public void terminalStates() {
		assertTrue(ServerState.STOPPED.isTerminal());
		assertTrue(ServerState.ERRORED.isTerminal());
		assertFalse(ServerState.DRAINING.isTerminal());
		assertFalse(ServerState.LISTENING.isTerminal());
	}

	@Test
	public void bindFailureClassification() {
		assertEquals(BindFailureReason.ADDRESS_IN_USE, BindFailureReason.fromThrowable(new BindException("Address already in use")));
		assertEquals(BindFailureReason.PERMISSION_DENIED, BindFailureReason.fromThrowable(new BindException("Permission denied")));
		assertEquals(BindFailureReason.ADDRESS_UNAVAILABLE, BindFailureReason.fromThrowable(new BindException("Cannot assign requested address")));
		assertEquals(BindFailureReason.ADDRESS_UNAVAILABLE, BindFailureReason.fromThrowable(new UnresolvedAddressException()));
		assertEquals(BindFailureReason.OTHER, BindFailureReason.fromThrowable(new IOException("disk on fire")));
		assertEquals(BindFailureReason.OTHER, BindFailureReason.fromThrowable(null));

		// Wrapped causes are examined too
		assertEquals(BindFailureReason.ADDRESS_IN_USE,
				BindFailureReason.fromThrowable(new IllegalStateException("wrapper", new SocketException("Address in use"))));
	}
}
