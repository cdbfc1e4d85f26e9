package io.dmart.sdk.client;

/**
 * Why a call didn't return a typed response.
 */
public enum ErrorKind {
    /**
     * An authenticated call was made without a token. Nothing was sent.
     */
    UNAUTHENTICATED,
    /**
     * Login failed: bad credentials, unreachable backend, or a login response without a token.
     */
    CONNECTION,
    /**
     * The backend answered with a status other than 200.
     */
    BACKEND_REJECTED,
    /**
     * There was no usable answer: the request couldn't be sent, or the body couldn't be decoded.
     */
    TRANSPORT
}
