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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
final class TestSupport {
	static final String LOOPBACK_HOST = "127.0.0.1";

	private TestSupport() {}

	static int findFreePort() throws IOException {
		try (ServerSocket ss = new ServerSocket(0)) {
			ss.setReuseAddress(true);
			return ss.getLocalPort();
		}
	}

	static Socket connectWithRetry(String host, int port, int timeoutMs) throws IOException, InterruptedException {
		long deadline = System.currentTimeMillis() + timeoutMs;
		IOException last = null;
		while (System.currentTimeMillis() < deadline) {
			try {
				Socket s = new Socket();
				s.connect(new InetSocketAddress(host, port), Math.max(250, timeoutMs / 2));
				s.setSoTimeout(timeoutMs);
				return s;
			} catch (IOException e) {
				last = e;
				Thread.sleep(30);
			}
		}
		throw (last != null ? last : new IOException("Unable to connect to " + host + ":" + port));
	}

	static void send(Socket socket, String rawRequest) throws IOException {
		OutputStream out = socket.getOutputStream();
		out.write(rawRequest.getBytes(StandardCharsets.ISO_8859_1));
		out.flush();
	}

	/**
	 * Reads exactly one response, using Content-Length to find the end of the body.
	 */
	static RawResponse readResponse(InputStream in) throws IOException {
		ByteArrayOutputStream head = new ByteArrayOutputStream();
		int matched = 0;
		while (matched < 4) {
			int b = in.read();
			if (b == -1)
				throw new IOException("Connection closed before response headers were complete");
			head.write(b);
			if (b == '\r')
				matched = matched == 2 ? 3 : 1;
			else if (b == '\n' && (matched == 1 || matched == 3))
				matched++;
			else
				matched = 0;
		}

		String[] lines = head.toString(StandardCharsets.ISO_8859_1).split("\r\n");
		String[] statusLineParts = lines[0].split(" ", 3);
		Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		for (int i = 1; i < lines.length; i++) {
			if (lines[i].isEmpty())
				continue;
			int colon = lines[i].indexOf(':');
			headers.put(lines[i].substring(0, colon).trim(), lines[i].substring(colon + 1).trim());
		}

		int contentLength = Integer.parseInt(headers.getOrDefault("Content-Length", "0"));
		byte[] body = in.readNBytes(contentLength);

		return new RawResponse(Integer.parseInt(statusLineParts[1]), statusLineParts.length > 2 ? statusLineParts[2] : "",
				Collections.unmodifiableMap(headers), new String(body, StandardCharsets.UTF_8));
	}

	static RawResponse exchange(int port, String rawRequest) throws IOException, InterruptedException {
		try (Socket socket = connectWithRetry(LOOPBACK_HOST, port, 2000)) {
			send(socket, rawRequest);
			return readResponse(socket.getInputStream());
		}
	}

	static String get(String path) {
		return "GET " + path + " HTTP/1.1\r\nHost: localhost\r\nConnection: close\r\n\r\n";
	}

	static boolean waitFor(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
		long deadline = System.currentTimeMillis() + timeoutMs;
		while (System.currentTimeMillis() < deadline) {
			if (condition.getAsBoolean())
				return true;
			Thread.sleep(10);
		}
		return condition.getAsBoolean();
	}

	static MarshaledResponse capture(@NonNull Consumer<ResponseSink> action) {
		AtomicReference<MarshaledResponse> captured = new AtomicReference<>();
		DefaultResponseSink responseSink = new DefaultResponseSink(captured::set);
		action.accept(responseSink);
		return captured.get();
	}

	static final class RawResponse {
		final int statusCode;
		final String reasonPhrase;
		final Map<String, String> headers;
		final String body;

		RawResponse(int statusCode, String reasonPhrase, Map<String, String> headers, String body) {
			this.statusCode = statusCode;
			this.reasonPhrase = reasonPhrase;
			this.headers = headers;
			this.body = body;
		}

		String header(String name) {
			return headers.get(name);
		}
	}
}
