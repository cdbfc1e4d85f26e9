package io.dmart.sdk.connections;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.concurrent.TimeoutException;

/**
 * Represents a HTTP request. Knows what to do with addresses, request methods and headers.
 * It is up to the user to write request body, if desirable.
 */
public class HttpRequest {

    private Http.Version httpVersion = Http.Version.HTTP11;
    private Http.Verb httpVerb;
    private RequestHeaders headers = RequestHeaders.createDefault();
    private URI target;
    private Endpoint endpoint;

    private HttpRequest() {
    }

    /**
     * Create a new HTTP request using a given request method.
     * @param method request method ("http verb")
     * @param target address to where should the request go (absolute http or https URL)
     * @return new HTTP request
     * @throws MalformedURLException if target is invalid
     */
    public static HttpRequest create(Http.Verb method, String target) throws MalformedURLException {
        if(method == null) throw new InvalidRequestException("No request method");
        HttpRequest request = new HttpRequest();
        request.httpVerb = method;
        try {
            request.target = new URI(target);
        } catch (URISyntaxException e) {
            throw new MalformedURLException(e.getMessage());
        }
        request.endpoint = Endpoint.fromUri(request.target);
        return request;
    }

    /**
     * Set HTTP version to be used.
     * @param version protocol version over which this request is made
     * @return this, to allow chaining
     */
    public HttpRequest setHttpVersion(Http.Version version) {
        this.httpVersion = version;
        return this;
    }

    /**
     * Set request headers. If null, sets empty headers. Host header is always set when the request is sent.
     * @param headers headers to be used with this request or null for empty headers
     * @return this, to allow chaining
     */
    public HttpRequest setHeaders(RequestHeaders headers) {
        this.headers = headers == null ? RequestHeaders.createEmpty() : headers;
        return this;
    }

    public Http.Version getHttpVersion() {
        return httpVersion;
    }
    public Http.Verb getVerb() {
        return httpVerb;
    }
    public RequestHeaders getHeaders() {
        return headers;
    }
    public Endpoint getEndpoint() {
        return endpoint;
    }

    /**
     * @return path and query of the target, exactly as they go on the request line
     */
    public String getRequestTarget() {
        String path = target.getRawPath();
        if(path == null || path.isEmpty()) path = "/";
        String query = target.getRawQuery();
        return query == null ? path : path + "?" + query;
    }

    private void verifyRequest() {
        headers.setHost(endpoint.getHostHeader());
        if(httpVerb.expectsBody() && !headers.hasHeader("Content-Length"))
            throw new InvalidRequestException(httpVerb + " request must declare Content-Length");
        if(!httpVerb.expectsBody() && (headers.hasHeader("Content-Length") || headers.hasHeader("Content-Type")))
            throw new InvalidRequestException("Can't provide body with " + httpVerb + ", but content length or type is set!");
    }

    private void writeHead(HttpSocket conn) throws IOException {
        conn.print(httpVerb + " " + getRequestTarget() + " " + httpVersion + "\r\n");
        conn.print(headers.toString());
        conn.print("\r\n");
    }

    /**
     * Obtains a connection from the pool, blocking this thread, and writes the request line and headers. Nothing is
     * flushed yet: write the body (if any) and flush the returned socket.
     * @param connections connection pool used for obtaining a connection
     * @return acquired connection used to communicate with the server
     * @throws IOException if the connection can't be opened or writing fails
     * @throws TimeoutException if no connection becomes available in time
     */
    public HttpSocket connectNow(ConnectionPool connections) throws IOException, TimeoutException {
        verifyRequest();
        HttpSocket conn = connections.getConnectionBlocking(endpoint);
        try {
            writeHead(conn);
        } catch (IOException | RuntimeException e) {
            conn.closeQuietly();
            throw e;
        }
        return conn;
    }

    @Override
    public String toString() {
        return httpVerb + " " + target;
    }
}
