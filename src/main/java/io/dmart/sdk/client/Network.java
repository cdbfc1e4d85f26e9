package io.dmart.sdk.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dmart.sdk.connections.*;
import io.dmart.sdk.model.DmartError;
import io.dmart.sdk.model.DmartResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * The one path every call to the backend takes. A {@link Request} attaches the token, sends the body over a
 * pooled transaction and turns whatever comes back into either a decoded response or a {@link DmartException}:
 * <ul>
 *     <li>no response at all (I/O error, timeout, no free connection): {@link ErrorKind#TRANSPORT}, status 0</li>
 *     <li>non-200 with an {@code error} object: {@link ErrorKind#BACKEND_REJECTED} carrying that error</li>
 *     <li>non-200 with other JSON: {@link ErrorKind#BACKEND_REJECTED} with an "http" error made from the status</li>
 *     <li>non-200 which isn't JSON, or 200 which can't be decoded: {@link ErrorKind#TRANSPORT} with the status</li>
 * </ul>
 */
public class Network {
    private static final Logger log = LoggerFactory.getLogger(Network.class);

    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Network() {
    }

    /**
     * @return mapper used for all request and response bodies
     */
    public static ObjectMapper getObjectMapper() {
        return JSON;
    }

    /**
     * Represents one network request: url, verb, headers and where the token comes from. Subclasses say what goes
     * into the body and how a 200 body is decoded.
     */
    protected static abstract class Request<Receive> implements Callable<Receive> {
        private final SessionManager session;
        private final RequestHeaders headers;
        private final String url;
        private final String path;
        private final AuthTokenManager tokens;
        private final Http.Verb httpVerb;

        /**
         * @param tokens token source; null for calls which don't need authentication (i.e. login)
         */
        public Request(SessionManager session, RequestHeaders headers, String baseUrl, String path,
                       AuthTokenManager tokens, Http.Verb httpVerb) {
            this.session = session;
            this.headers = headers;
            this.url = baseUrl + path;
            this.path = path;
            this.tokens = tokens;
            this.httpVerb = httpVerb;
        }

        @Override
        public Receive call() throws DmartException {
            //checked before any socket is touched
            String token = tokens == null ? null : tokens.requireToken();
            int status;
            String phrase;
            byte[] body;
            try (HttpTransaction transaction = session.newTransaction()) {
                RequestHeaders requestHeaders = headers.copy();
                if(token != null) requestHeaders.setBearerToken(token);
                transaction.setHeaders(requestHeaders);
                uploadData(transaction);
                HttpResponse response = transaction.makeRequest(httpVerb, url);
                status = response.getStatus().responseCode;
                phrase = response.getStatus().responsePhrase;
                body = response.getBody();
            } catch (IOException | TimeoutException | InvalidResponseException e) {
                log.debug("{} {} failed: {}", httpVerb, path, e.toString());
                throw DmartException.transport(DmartException.NO_STATUS,
                        "No response from " + httpVerb + " " + path + ": " + e.getMessage(), e);
            }
            log.debug("{} {} -> {}", httpVerb, path, status);
            if(status != Http.OK) throw rejected(status, phrase, body);
            return getData(body);
        }

        private DmartException rejected(int status, String phrase, byte[] body) {
            JsonNode tree;
            try {
                tree = JSON.readTree(body);
            } catch (IOException e) {
                return DmartException.transport(status, "Undecodable body with status " + status, e);
            }
            if(tree == null || tree.isMissingNode())
                return DmartException.transport(status, "Empty body with status " + status, null);
            JsonNode error = tree.get("error");
            if(error != null && error.isObject()) {
                try {
                    return new DmartException(ErrorKind.BACKEND_REJECTED, status, JSON.treeToValue(error, DmartError.class));
                } catch (IOException e) {
                    log.warn("Malformed error object with status {}: {}", status, e.getMessage());
                }
            }
            return new DmartException(ErrorKind.BACKEND_REJECTED, status,
                    new DmartError("http", status, phrase.isEmpty() ? "HTTP " + status : phrase));
        }

        protected String getPath() {
            return path;
        }

        /**
         * Decode the body of a 200 response.
         * @param body response body, already decompressed
         * @return decoded body
         * @throws DmartException of kind {@link ErrorKind#TRANSPORT} if the body can't be decoded
         */
        protected abstract Receive getData(byte[] body) throws DmartException;
        protected abstract void uploadData(HttpTransaction transaction);
    }

    /**
     * Decodes a response envelope, checking its invariants.
     */
    static DmartResponse decodeEnvelope(byte[] body, String path) throws DmartException {
        try {
            return JSON.readValue(body, DmartResponse.class);
        } catch (IOException e) {
            throw DmartException.transport(Http.OK, "Undecodable response envelope from " + path, e);
        }
    }

    /**
     * Decodes any JSON document.
     */
    static JsonNode decodeTree(byte[] body, String path) throws DmartException {
        JsonNode tree;
        try {
            tree = JSON.readTree(body);
        } catch (IOException e) {
            throw DmartException.transport(Http.OK, "Undecodable JSON from " + path, e);
        }
        if(tree == null || tree.isMissingNode())
            throw DmartException.transport(Http.OK, "Empty body from " + path, null);
        return tree;
    }
}
