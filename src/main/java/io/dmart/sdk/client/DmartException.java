package io.dmart.sdk.client;

import io.dmart.sdk.model.DmartError;

/**
 * Thrown when a call to the backend can't complete as a typed success. Carries the {@link ErrorKind}, the HTTP
 * status (0 if no response was received) and an error payload, which is never null.
 */
public class DmartException extends Exception {
    public static final int UNAUTHENTICATED_STATUS = 401;
    public static final int NO_STATUS = 0;

    private final ErrorKind kind;
    private final int statusCode;
    private final DmartError error;

    public DmartException(ErrorKind kind, int statusCode, DmartError error, Throwable cause) {
        super(kind + " (" + statusCode + ") " + error, cause);
        if(kind == null || error == null) throw new IllegalArgumentException("Kind and error are required");
        this.kind = kind;
        this.statusCode = statusCode;
        this.error = error;
    }

    public DmartException(ErrorKind kind, int statusCode, DmartError error) {
        this(kind, statusCode, error, null);
    }

    static DmartException unauthenticated() {
        return new DmartException(ErrorKind.UNAUTHENTICATED, UNAUTHENTICATED_STATUS,
                new DmartError("login", 10, "Not authenticated Dmart user"));
    }

    static DmartException transport(int statusCode, String message, Throwable cause) {
        return new DmartException(ErrorKind.TRANSPORT, statusCode, new DmartError("transport", statusCode, message), cause);
    }

    /**
     * Login failure. Keeps status and error of the underlying failure, if there was one.
     */
    static DmartException connection(String message, DmartException cause) {
        if(cause == null)
            return new DmartException(ErrorKind.CONNECTION, NO_STATUS, new DmartError("connection", 0, message));
        return new DmartException(ErrorKind.CONNECTION, cause.getStatusCode(), cause.getError(), cause);
    }

    static DmartException connection(int statusCode, DmartError error) {
        return new DmartException(ErrorKind.CONNECTION, statusCode, error);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return HTTP status of the response, 401 for calls made without a token, 0 if there was no response
     */
    public int getStatusCode() {
        return statusCode;
    }

    public DmartError getError() {
        return error;
    }
}
