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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * A non-instantiable collection of utility methods.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Utilities {
	@NonNull
	private static final byte[] EMPTY_BYTE_ARRAY;
	@NonNull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern TAIL_WHITESPACE_PATTERN;

	static {
		EMPTY_BYTE_ARRAY = new byte[0];

		// \p{Z} covers Unicode separators (NBSP, NNBSP and friends), \s covers ASCII whitespace incl. tabs and newlines
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^[\\p{Z}\\s]+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("[\\p{Z}\\s]+$");
	}

	private Utilities() {
		// Non-instantiable
	}

	/**
	 * A reusable zero-length byte array.
	 *
	 * @return an empty byte array
	 */
	@NonNull
	public static byte[] emptyByteArray() {
		return EMPTY_BYTE_ARRAY;
	}

	/**
	 * A "stronger" version of {@link String#trim()} which discards any kind of whitespace or invisible separator,
	 * for example a {@code U+202F "Narrow No-Break Space"} pasted into an environment variable.
	 *
	 * @param string the string to trim
	 * @return the trimmed string, or {@code null} if the input string is {@code null}
	 */
	@Nullable
	public static String trimAggressively(@Nullable String string) {
		if (string == null)
			return null;

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return string;

		return TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");
	}

	/**
	 * Aggressively trims the given string and returns {@code null} if the result is empty.
	 *
	 * @param string the input string; may be {@code null}
	 * @return a trimmed, non-empty string; or {@code null} if input was {@code null} or trimmed to empty
	 */
	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		if (string == null)
			return null;

		string = trimAggressively(string);
		return string.length() == 0 ? null : string;
	}

	/**
	 * Aggressively trims the given string and returns {@code ""} if the input is {@code null}.
	 *
	 * @param string the input string; may be {@code null}
	 * @return a trimmed string (never {@code null})
	 */
	@NonNull
	public static String trimAggressivelyToEmpty(@Nullable String string) {
		if (string == null)
			return "";

		return trimAggressively(string);
	}

	/**
	 * Normalizes a request target into the path used for route lookup.
	 * <p>
	 * Behavior:
	 * <ul>
	 *   <li>If input starts with {@code http://} or {@code https://}, the path portion is extracted.</li>
	 *   <li>Any query string and fragment are stripped.</li>
	 *   <li>Ensures the result begins with {@code '/'}.</li>
	 *   <li>Resolves {@code "."} and {@code ".."} segments; {@code ".."} never climbs above the root.</li>
	 *   <li>Removes a single trailing {@code '/'}, except for the root path {@code '/'}.</li>
	 * </ul>
	 * No percent-decoding is performed, so {@code "/hello%20"} does not match {@code "/hello"}.
	 *
	 * @param url a request target as it appeared on the request line
	 * @return the normalized path, {@code "/"} for empty input
	 */
	@NonNull
	public static String normalizedPathForUrl(@NonNull String url) {
		requireNonNull(url);

		String path = trimAggressivelyToEmpty(url);

		int fragmentIndex = path.indexOf('#');

		if (fragmentIndex != -1)
			path = path.substring(0, fragmentIndex);

		int queryIndex = path.indexOf('?');

		if (queryIndex != -1)
			path = path.substring(0, queryIndex);

		String lowercasePath = path.toLowerCase(Locale.ENGLISH);

		if (lowercasePath.startsWith("http://") || lowercasePath.startsWith("https://")) {
			int authorityStart = path.indexOf("//") + 2;
			int pathStart = path.indexOf('/', authorityStart);
			path = pathStart == -1 ? "/" : path.substring(pathStart);
		}

		if (!path.startsWith("/"))
			path = "/" + path;

		path = removeDotSegments(path);

		if (path.length() > 1 && path.endsWith("/"))
			path = path.substring(0, path.length() - 1);

		return path;
	}

	@NonNull
	private static String removeDotSegments(@NonNull String path) {
		requireNonNull(path);

		if (!path.contains("/."))
			return path;

		String[] segments = path.split("/", -1);
		Deque<String> resolvedSegments = new ArrayDeque<>(segments.length);
		boolean trailingSlash = false;

		// segments[0] is the empty string before the leading '/'
		for (int i = 1; i < segments.length; ++i) {
			String segment = segments[i];
			boolean lastSegment = i == segments.length - 1;

			if (segment.equals(".")) {
				trailingSlash = lastSegment;
			} else if (segment.equals("..")) {
				resolvedSegments.pollLast();
				trailingSlash = lastSegment;
			} else {
				resolvedSegments.addLast(segment);
			}
		}

		String resolvedPath = "/" + String.join("/", resolvedSegments);

		if (trailingSlash && !resolvedPath.endsWith("/"))
			resolvedPath = resolvedPath + "/";

		return resolvedPath;
	}
}
