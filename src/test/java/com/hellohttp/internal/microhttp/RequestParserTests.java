package com.hellohttp.internal.microhttp;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

public class RequestParserTests {

    private static RequestParser parserFor(ByteTokenizer tokenizer, String... fragments) {
        RequestParser parser = new RequestParser(tokenizer, null);
        for (String fragment : fragments) {
            tokenizer.add(ByteBuffer.wrap(fragment.getBytes(StandardCharsets.ISO_8859_1)));
        }
        return parser;
    }

    @Test
    public void simpleGet() {
        RequestParser parser = parserFor(new ByteTokenizer(),
                "GET /hello?x=1 HTTP/1.1\r\nHost: localhost\r\nUser-Agent:  tests \r\n\r\n");

        Assertions.assertTrue(parser.parse());

        MicrohttpRequest request = parser.request();
        Assertions.assertEquals("GET", request.method());
        Assertions.assertEquals("/hello?x=1", request.uri());
        Assertions.assertEquals("HTTP/1.1", request.version());
        Assertions.assertEquals("localhost", request.header("host"));
        Assertions.assertEquals("tests", request.header("User-Agent"));
        Assertions.assertEquals(0, request.body().length);
    }

    @Test
    public void incrementalInput() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        RequestParser parser = parserFor(tokenizer, "POST /items HT");

        Assertions.assertFalse(parser.parse());
        Assertions.assertTrue(parser.started());

        tokenizer.add(ByteBuffer.wrap("TP/1.1\r\nContent-Length: 5\r\n\r\nab".getBytes(StandardCharsets.US_ASCII)));
        Assertions.assertFalse(parser.parse());

        tokenizer.add(ByteBuffer.wrap("cde".getBytes(StandardCharsets.US_ASCII)));
        Assertions.assertTrue(parser.parse());
        Assertions.assertEquals("abcde", new String(parser.request().body(), StandardCharsets.US_ASCII));
    }

    @Test
    public void chunkedBody() {
        RequestParser parser = parserFor(new ByteTokenizer(),
                "POST /items HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\n",
                "3\r\nabc\r\n2;ext=1\r\nde\r\n0\r\n\r\n");

        Assertions.assertTrue(parser.parse());
        Assertions.assertEquals("abcde", new String(parser.request().body(), StandardCharsets.US_ASCII));
    }

    @Test
    public void notStartedUntilFirstToken() {
        RequestParser parser = parserFor(new ByteTokenizer(), "GE");

        Assertions.assertFalse(parser.parse());
        Assertions.assertFalse(parser.started());
    }

    @Test
    public void malformedRequests() {
        String[] malformed = {
                "GARBAGE\r\n\r\n",
                "GET /hello\r\n\r\n",
                "GET /hello HTTP/2.0\r\n\r\n",
                "G(T /hello HTTP/1.1\r\n\r\n",
                "GET /hello HTTP/1.1\r\nno-colon-here\r\n\r\n",
                "GET /hello HTTP/1.1\r\nContent-Length: abc\r\n\r\n",
                "GET /hello HTTP/1.1\r\nContent-Length: 1\r\nContent-Length: 1\r\n\r\n",
                "POST /hello HTTP/1.1\r\nContent-Length: 1\r\nTransfer-Encoding: chunked\r\n\r\n",
                "POST /hello HTTP/1.1\r\nTransfer-Encoding: gzip\r\n\r\n",
                "POST /hello HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\nzz\r\n"
        };

        for (String request : malformed) {
            RequestParser parser = parserFor(new ByteTokenizer(), request);
            Assertions.assertThrows(MalformedRequestException.class, parser::parse, request);
        }
    }
}
