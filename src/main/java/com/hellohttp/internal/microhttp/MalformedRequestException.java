package com.hellohttp.internal.microhttp;

/**
 * Thrown by {@link RequestParser} when the bytes on a connection cannot form a valid HTTP/1.x request.
 */
public class MalformedRequestException extends RuntimeException {
    MalformedRequestException(String message) {
        super(message);
    }
}
