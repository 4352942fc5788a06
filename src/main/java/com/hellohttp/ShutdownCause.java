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

/**
 * What initiated a graceful shutdown.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum ShutdownCause {
	/**
	 * The JVM is terminating, e.g. {@code SIGINT} or {@code SIGTERM}. Exits {@code 0} if draining completes in time.
	 */
	SIGNAL,
	/**
	 * {@link HelloHttp#stop()} was called. Exits {@code 0} if draining completes in time.
	 */
	STOP_REQUESTED,
	/**
	 * An uncaught exception reached a thread's top level. Always exits {@code 1}.
	 */
	FAULT
}
