/**
 * Classes meant to be used by the programmer to talk to a dmart backend.
 * <br/>
 * <h3>Overview</h3>
 * {@link io.dmart.sdk.client.DmartService} is the entry point: one instance per backend and user, with one method
 * per operation.
 * <br/>
 * {@link io.dmart.sdk.client.SessionManager} provides the connection pool shared by all services.
 * <br/>
 * {@link io.dmart.sdk.client.AuthTokenManager} keeps the token between {@code connect} and {@code disconnect}.
 * <br/>
 * {@link io.dmart.sdk.client.NetworkRequestBuilder} collects what a call sends, and
 * {@link io.dmart.sdk.client.Network} executes it, mapping every failure to a
 * {@link io.dmart.sdk.client.DmartException} with an {@link io.dmart.sdk.client.ErrorKind}.
 */
package io.dmart.sdk.client;
