package io.dmart.sdk.connections;

/**
 * Thrown if configuration parameters are invalid (e.g. a negative timeout, or a property that isn't a number)
 */
public class InvalidConfigException extends RuntimeException {
    public InvalidConfigException(String message) {
        super(message);
    }
    public InvalidConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
