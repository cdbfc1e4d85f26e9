package io.dmart.sdk.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.dmart.sdk.connections.*;
import io.dmart.sdk.model.DmartResponse;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds a request to the backend and hands it to {@link Network}. A request is either authenticated
 * ({@link #setAuth(AuthTokenManager)}) or explicitly {@link #anonymous()}; it carries at most one body, JSON or
 * multipart.
 * <br/>
 * This provides a way to do both blocking requests, executed on the calling thread, and asynchronous ones, executed
 * on a shared background executor (or the one set with {@link #setExecutor(Executor)}).
 * <br/>
 * All methods allow chaining.
 */
public class NetworkRequestBuilder {
    private static final ExecutorService executor = Executors.newCachedThreadPool(new ThreadFactory() {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "dmart-request-" + count.incrementAndGet());
            thread.setDaemon(true); //executor for background execution of requests; mustn't keep the JVM alive
            return thread;
        }
    });

    private final SessionManager session;
    private final Http.Verb verb;
    private final String baseUrl;
    private final String path;

    private AuthTokenManager tokens;
    private boolean anonymous = false;
    private Object json;
    private MultipartBody multipart;
    private RequestHeaders headers = RequestHeaders.createDefault();
    private Executor executeOn = executor;

    public NetworkRequestBuilder(SessionManager session, Http.Verb verb, String baseUrl, String path) {
        this.session = session;
        this.verb = verb;
        this.baseUrl = baseUrl;
        this.path = path;
    }

    /**
     * Send an object, serialized with {@link Network#getObjectMapper()}, as the body.
     */
    public NetworkRequestBuilder sendJson(Object body) {
        this.json = body;
        return this;
    }

    public NetworkRequestBuilder sendMultipart(MultipartBody body) {
        this.multipart = body;
        return this;
    }

    /**
     * Sets source of the auth token. The request fails with {@link ErrorKind#UNAUTHENTICATED} if there's no token
     * when it's executed.
     */
    public NetworkRequestBuilder setAuth(AuthTokenManager tokens) {
        this.tokens = tokens;
        return this;
    }

    /**
     * Marks the request as one which doesn't need a token. No Authorization header is sent.
     */
    public NetworkRequestBuilder anonymous() {
        this.anonymous = true;
        return this;
    }

    /**
     * Provides specific executor on which asynchronous requests should be made.
     * @param executor custom executor on which to execute this request
     * @return this
     */
    public NetworkRequestBuilder setExecutor(Executor executor) {
        this.executeOn = executor;
        return this;
    }

    /**
     * Adds a header to send to the host.
     * @param header header name
     * @param value header value
     * @return this
     * @throws InvalidHeaderException if the header can't be sent as-is
     */
    public NetworkRequestBuilder addHeader(String header, String value) {
        headers.setHeader(header, value);
        return this;
    }

    private void verifyRequest() {
        if(json != null && multipart != null)
            throw new InvalidRequestException("Too many request options set! Send either JSON or multipart");
        if(anonymous == (tokens != null))
            throw new InvalidRequestException("Request must be either anonymous or authenticated");
    }

    private <T> Network.Request<T> makeRequest(BodyDecoder<T> decoder) {
        verifyRequest();
        byte[] jsonBody;
        try {
            jsonBody = json == null ? null : Network.getObjectMapper().writeValueAsBytes(json);
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("Cannot serialize request body for " + path, e);
        }
        byte[] multipartBody = multipart == null ? null : multipart.build();
        String multipartType = multipart == null ? null : multipart.getContentType();
        return new Network.Request<T>(session, headers, baseUrl, path, anonymous ? null : tokens, verb) {
            @Override
            protected T getData(byte[] body) throws DmartException {
                return decoder.decode(body, getPath());
            }

            @Override
            protected void uploadData(HttpTransaction transaction) {
                if(jsonBody != null) transaction.sendBytes(jsonBody, RequestHeaders.JSON);
                else if(multipartBody != null) transaction.sendBytes(multipartBody, multipartType);
            }
        };
    }

    /**
     * Executes this request on the current thread and decodes the response envelope.
     * @return decoded response
     * @throws DmartException if the request can't complete, see {@link Network}
     */
    public DmartResponse blocking() throws DmartException {
        return makeRequest(Network::decodeEnvelope).call();
    }

    /**
     * Executes this request on the current thread and returns the response as a JSON tree, without expecting
     * an envelope.
     * @return response document
     * @throws DmartException if the request can't complete, see {@link Network}
     */
    public JsonNode blockingRaw() throws DmartException {
        return makeRequest(Network::decodeTree).call();
    }

    /**
     * Executes this request in the background. The future completes exceptionally with a {@link DmartException}
     * if the request can't complete. Misuse ({@link InvalidRequestException}) is thrown right away.
     * @return future response
     */
    public CompletableFuture<DmartResponse> async() {
        Network.Request<DmartResponse> request = makeRequest(Network::decodeEnvelope);
        CompletableFuture<DmartResponse> future = new CompletableFuture<>();
        executeOn.execute(() -> {
            try {
                future.complete(request.call());
            } catch (DmartException | RuntimeException e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    private interface BodyDecoder<T> {
        T decode(byte[] body, String path) throws DmartException;
    }
}
