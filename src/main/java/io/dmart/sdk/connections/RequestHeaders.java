package io.dmart.sdk.connections;

/**
 * Headers which are sent with the request. Provides helper functions for setting them.
 * If empty or null is passed to helper functions, header is removed.
 */
public class RequestHeaders extends Headers {

    public static final String JSON = "application/json";

    private RequestHeaders() {
    }

    //there's no great reason to use static factory methods here, except disambiguating 'default' and 'empty' headers
    //and honestly, that's enough for me
    public static RequestHeaders createEmpty() {
        return new RequestHeaders();
    }

    /**
     * Headers every dmart request starts with: JSON responses, compressed if the server wants to, and a User-Agent.
     * @return new default headers
     */
    public static RequestHeaders createDefault() {
        RequestHeaders headers = new RequestHeaders();
        headers.setAccept(JSON);
        headers.setAcceptEncoding("gzip, deflate");
        headers.setUserAgent("dmart-java-client (Java " + System.getProperty("java.version", "?") + ")");
        return headers;
    }

    private void setOrRemove(String header, String value) {
        if(value == null || value.isEmpty()) removeHeader(header);
        else setHeader(header, value);
    }

    public void setAuthorization(String auth) {
        setOrRemove("Authorization", auth);
    }
    public void setBearerToken(String token) {
        setAuthorization(token == null || token.isEmpty() ? null : "Bearer " + token);
    }
    public void setConnection(String connection) {
        setOrRemove("Connection", connection);
    }
    public void setContentLength(long contentLength) {
        if(contentLength < 0) throw new InvalidHeaderException("Negative Content-Length " + contentLength);
        setHeader("Content-Length", String.valueOf(contentLength));
    }
    public void setContentType(String type) {
        setOrRemove("Content-Type", type);
    }
    public void setAcceptEncoding(String encoding) {
        setOrRemove("Accept-Encoding", encoding);
    }
    public void setHost(String host) {
        setOrRemove("Host", host);
    }
    public void setUserAgent(String userAgent) {
        setOrRemove("User-Agent", userAgent);
    }
    public void setAccept(String types) {
        setOrRemove("Accept", types);
    }

    /**
     * @return a copy of these headers, so one default set can be shared between requests
     */
    public RequestHeaders copy() {
        RequestHeaders copy = new RequestHeaders();
        copy.putAll(this);
        return copy;
    }
}
