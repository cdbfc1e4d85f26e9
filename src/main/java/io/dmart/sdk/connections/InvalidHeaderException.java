package io.dmart.sdk.connections;

/**
 * Thrown when a header can't be sent: the name isn't a valid token, or the value contains a line break
 */
public class InvalidHeaderException extends RuntimeException {
    public InvalidHeaderException(String message) {
        super(message);
    }
}
