/**
 * This package implements low-level communication with the dmart server: plain HTTP/1.1 over pooled sockets.
 * Higher-level (i.e. usable) stuff is located inside the client package.
 *
 * <br/>
 * <h3>Overview</h3>
 * {@link io.dmart.sdk.connections.HttpSocket} sends and receives raw bytes. Doesn't actually implement any HTTP.
 * <br/>
 * {@link io.dmart.sdk.connections.ConnectionPool} (implemented as
 * {@link io.dmart.sdk.connections.ConfigurableConnectionPool}) pools HttpSockets per
 * {@link io.dmart.sdk.connections.Endpoint} and drops the ones the server has closed in the meantime.
 * <br/>
 * {@link io.dmart.sdk.connections.HttpRequest} / {@link io.dmart.sdk.connections.HttpResponse}
 * use the HttpSocket to communicate with server using HTTP. They know the basic structure of each request and
 * response, including chunked and compressed bodies.
 * <br/>
 * {@link io.dmart.sdk.connections.HttpTransaction} makes one request and decides whether its socket can go back
 * to the pool. This is (admittedly, a rather poor) equivalent of HttpURLConnection.
 * <br/>
 * {@link io.dmart.sdk.connections.MultipartBody} builds multipart/form-data bodies for uploads.
 */
package io.dmart.sdk.connections;
