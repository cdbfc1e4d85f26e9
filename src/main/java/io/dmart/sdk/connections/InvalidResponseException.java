package io.dmart.sdk.connections;

/**
 * Thrown when a response breaks HTTP framing (malformed status line, bad Content-Length, overlong header lines)
 */
public class InvalidResponseException extends RuntimeException {
    public InvalidResponseException(String message) {
        super(message);
    }
    public InvalidResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
