package io.dmart.sdk.connections;

/**
 * Thrown when a request is in invalid state before anything is sent, e.g. both a JSON and a multipart body are set,
 * or a shortname doesn't match the allowed pattern.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }
    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
