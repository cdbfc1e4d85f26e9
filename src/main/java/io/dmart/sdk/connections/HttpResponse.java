package io.dmart.sdk.connections;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Represents a HTTP response. Parsing status line, headers and body is done here. The body is read once and kept,
 * so {@link #getBody()} can be called any number of times.
 */
public class HttpResponse {
    private static final Logger log = LoggerFactory.getLogger(HttpResponse.class);
    private static final int MAX_INFORMATIVE_RESPONSES = 5;

    private final HttpSocket socket;
    private final HttpRequest request;
    private Status status;
    private ResponseHeaders headers;

    private boolean parsed = false;
    private byte[] body;
    private boolean readToEof = false;

    private HttpResponse(HttpSocket socket, HttpRequest request) {
        this.socket = socket;
        this.request = request;
    }

    /**
     * Create a new HTTP response, reading from the given socket. This response should be the result of the
     * passed HttpRequest (i.e. request has been previously sent over the same socket).
     * @param socket socket used for reading the data
     * @param request request used for getting this response
     * @return new response
     */
    public static HttpResponse from(HttpSocket socket, HttpRequest request) {
        return new HttpResponse(socket, request);
    }

    private void readHeaders() throws IOException {
        String line;
        while(!(line = socket.readLine()).isEmpty()) {
            headers.appendHeader(line);
        }
    }

    /**
     * Parses status line and response headers, skipping informative (100-class) responses. This method is
     * idempotent: the first invocation parses content, further calls have no effect.
     * @return this response
     * @throws IOException if reading fails or the server closes the connection
     * @throws InvalidResponseException if the status line is malformed or there are too many informative responses
     */
    public HttpResponse parseResponse() throws IOException {
        if(parsed) return this;
        int infoResponses = 0;
        do {
            if(infoResponses > MAX_INFORMATIVE_RESPONSES)
                throw new InvalidResponseException("Too many informative responses!");
            status = new Status(socket.readLine());
            if(!status.httpVersion.startsWith("HTTP/1."))
                log.warn("Unexpected HTTP version returned by {}: {}", request.getEndpoint(), status.httpVersion);
            headers = new ResponseHeaders();
            readHeaders();
            infoResponses++;
        } while (status.responseCode/100 == 1); //informative status lines - ignored

        parsed = true;
        return this;
    }

    /**
     * Get data from Status-Line received in this response.
     * @return status line data
     */
    public Status getStatus() {
        return status;
    }

    /**
     * Get response headers received.
     * @return received headers
     */
    public ResponseHeaders getHeaders() {
        return headers;
    }

    private boolean hasBody() {
        int code = status.responseCode;
        return code != 204 && code != 304 && code/100 != 1;
    }

    /**
     * Reads the body (if it hasn't been read already) and returns it, decoded according to Content-Encoding.
     * Bodies are delimited by chunked transfer, by Content-Length, or by the server closing the connection.
     * @return body bytes, possibly empty
     * @throws IOException if reading fails or the body is cut short
     */
    public byte[] getBody() throws IOException {
        if(!parsed) parseResponse();
        if(body != null) return body;
        byte[] raw;
        if(!hasBody()) {
            raw = new byte[0];
        } else if(headers.isChunked()) {
            raw = socket.readAllChunks();
        } else if(headers.getContentLength() != null) {
            raw = socket.readFully(parseContentLength(headers.getContentLength()));
        } else {
            //neither length nor chunks: body ends when the server closes the connection
            readToEof = true;
            raw = socket.readToEnd();
        }
        body = ContentEncoding.decompress(raw, headers.getContentEncoding());
        return body;
    }

    private static int parseContentLength(String value) {
        //duplicated headers are joined with a comma; they have to agree
        String[] values = value.split(",");
        int len = -1;
        for(String v : values) {
            int current;
            try {
                current = Integer.parseInt(v.trim());
            } catch (NumberFormatException e) {
                throw new InvalidResponseException("Invalid Content-Length: " + value, e);
            }
            if(current < 0 || (len != -1 && len != current))
                throw new InvalidResponseException("Invalid Content-Length: " + value);
            len = current;
        }
        return len;
    }

    /**
     * Reads body and returns it as string. Assumes UTF-8 encoding.
     * @return response body, parsed as string
     * @throws IOException if reading fails
     */
    public String getBodyString() throws IOException {
        return new String(getBody(), UTF_8);
    }

    /**
     * @return whether the whole response has been consumed, so the connection can carry another request
     */
    boolean isComplete() {
        return parsed && body != null;
    }

    /**
     * @return whether the connection can't be reused after this response
     */
    boolean mustClose() {
        return readToEof || headers == null || headers.isConnectionClose()
                || status.httpVersion.equals(Http.Version.HTTP10.toString());
    }

    /**
     * Represents data contained in a Status-Line of the response. Contains HTTP version, response code and a
     * a response phrase.
     */
    public static class Status {
        public final String httpVersion;
        public final int responseCode;
        public final String responsePhrase;

        public Status(String statusLine) {
            String[] tokens = statusLine.split(" ", 3);
            if(tokens.length < 2) throw new InvalidResponseException("Malformed status line: " + statusLine);
            httpVersion = tokens[0];
            try {
                responseCode = Integer.parseInt(tokens[1]);
            } catch (NumberFormatException e) {
                throw new InvalidResponseException("Malformed status code in: " + statusLine, e);
            }
            if(responseCode < 100 || responseCode > 999)
                throw new InvalidResponseException("Malformed status code in: " + statusLine);
            responsePhrase = tokens.length == 3 ? tokens[2] : ""; //HTTP/1.1 allows the phrase to be empty
        }

        /**
         * Does this code represent an error. Unknown codes are treated as errors as well.
         * @return true if this is an error code, false otherwise.
         */
        public boolean isError() {
            return responseCode >= 400;
        }

        @Override
        public String toString() {
            return httpVersion + " " + responseCode + " " + responsePhrase;
        }
    }
}
