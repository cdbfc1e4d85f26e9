package io.dmart.sdk.connections;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.TimeoutException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * This is used to represent a single transaction over the network, over a {@link HttpSocket} obtained from a
 * {@link ConnectionPool}. It is illegal to use one HttpTransaction object for multiple requests. Always close the
 * transaction: the socket goes back to the pool only if its response was read completely and the server didn't
 * ask for the connection to be closed; otherwise it's closed.
 */
//similar role to HttpURLConnection in standard library, but more configurable
public class HttpTransaction implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(HttpTransaction.class);

    private final ConnectionPool connectionPool;
    private RequestHeaders requestHeaders = RequestHeaders.createDefault();
    private Http.Version httpVersion = Http.Version.HTTP11;
    private HttpRequest request;
    private HttpSocket socket;
    private HttpResponse response;

    private byte[] body;
    private String bodyType;
    private volatile boolean used = false; //this really shouldn't be used from multiple threads
    private boolean closed = false;

    /**
     * Create a new transaction which uses given connection pool to obtain a {@link HttpSocket}.
     * @param connectionPool connection pool used for obtaining sockets
     */
    public HttpTransaction(ConnectionPool connectionPool) {
        this.connectionPool = connectionPool;
    }

    /**
     * Set headers to be used with this request. By default, transaction uses
     * {@link RequestHeaders#createDefault() default} headers.
     * @param headers request headers
     * @return this, to allow chaining
     */
    public HttpTransaction setHeaders(RequestHeaders headers) {
        this.requestHeaders = headers == null ? RequestHeaders.createEmpty() : headers;
        return this;
    }

    public RequestHeaders getHeaders() {
        return requestHeaders;
    }

    public HttpTransaction setHttpVersion(Http.Version version) {
        this.httpVersion = version;
        return this;
    }

    /**
     * Send bytes as request body. This <em>won't</em> open the connection nor write anything to server yet.
     * @param bytes body
     * @param contentType value of the Content-Type header
     * @return this, to allow chaining
     */
    public HttpTransaction sendBytes(byte[] bytes, String contentType) {
        this.body = bytes;
        this.bodyType = contentType;
        return this;
    }

    /**
     * Send string, encoded as UTF-8, as request body.
     * @param str string to send as body
     * @param contentType value of the Content-Type header
     * @return this, to allow chaining
     */
    public HttpTransaction sendString(String str, String contentType) {
        return sendBytes(str.getBytes(UTF_8), contentType);
    }

    private void ensureOpen() {
        if(closed) throw new IllegalStateException("Cannot use closed transaction!");
        if(used) throw new IllegalStateException("Transaction has already been finished!");
    }

    /**
     * Make a new request on this thread. Waiting for a connection from the connection pool blocks the calling thread.
     * This method sends data over the network, parses status line and headers of the response and returns it.
     * Use the returned result to obtain response body.
     * @param method http method
     * @param target url to which the request should be made
     * @return response from the server
     * @throws IOException if I/O exception occurs during transfer
     * @throws TimeoutException if waiting for connection from connection pool times out
     * @throws InvalidRequestException if exception or invalid state occurs while creating the request
     * @throws InvalidResponseException if response is something unexpected and/or breaks HTTP/1.1 rules
     */
    public HttpResponse makeRequest(Http.Verb method, String target) throws IOException, TimeoutException {
        ensureOpen();
        used = true;
        if(body != null && !method.expectsBody())
            throw new InvalidRequestException("Cannot send a body with " + method);
        if(method.expectsBody()) {
            requestHeaders.setContentLength(body == null ? 0 : body.length);
            if(body != null) requestHeaders.setContentType(bodyType);
        }
        request = HttpRequest.create(method, target)
                .setHeaders(requestHeaders)
                .setHttpVersion(httpVersion);
        socket = request.connectNow(connectionPool);
        if(body != null) socket.write(body);
        socket.flush();
        response = HttpResponse.from(socket, request).parseResponse();
        log.trace("{} -> {}", request, response.getStatus());
        return response;
    }

    /**
     * Closes the transaction, signalling the transaction is over. This releases the underlying socket, but does
     * not necessarily close it (unless server signalled to do so, or response wasn't read to the end). After closing
     * the transaction, the socket can be used for other transactions.
     * @throws IOException if closing the socket fails
     */
    @Override
    public void close() throws IOException {
        if(closed) return;
        closed = true;
        if(socket == null) return;
        if(response != null && response.isComplete() && !response.mustClose()) {
            socket.release();
        } else {
            socket.close();
        }
    }
}
