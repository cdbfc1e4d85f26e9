package io.dmart.sdk.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dmart.sdk.FakeBackend;
import io.dmart.sdk.connections.InvalidRequestException;
import io.dmart.sdk.connections.RawServer;
import io.dmart.sdk.connections.RequestHeaders;
import io.dmart.sdk.model.*;
import io.dmart.sdk.model.Record;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.*;

import static io.dmart.sdk.FakeBackend.*;
import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

public class DmartServiceTest {
    private static final String PROFILE = success("[{\"resource_type\":\"user\",\"shortname\":\"alice\","
            + "\"subpath\":\"users\",\"attributes\":{\"email\":\"alice@example.com\"}}]");

    private final ObjectMapper mapper = new ObjectMapper();
    private FakeBackend backend;
    private SessionManager session;
    private DmartService dmart;

    @BeforeEach
    public void setUp() throws IOException {
        backend = new FakeBackend();
        session = new SessionManager(new ClientConfig());
        dmart = new DmartService(backend.getUrl(), "alice", "secret", session);
        backend.on("POST", "/user/login", json(200, loginSuccess("tok1")));
        backend.on("GET", "/user/profile", json(200, PROFILE));
    }

    @AfterEach
    public void tearDown() {
        backend.close();
    }

    private JsonNode body(FakeBackend.RecordedRequest request) throws IOException {
        return mapper.readTree(request.body);
    }

    private static DmartException assertFails(ErrorKind kind, Executable call) {
        DmartException e = assertThrows(DmartException.class, call);
        assertEquals(kind, e.getKind());
        return e;
    }

    /**
     * Nothing reaches the network before a successful login.
     */
    @Test
    public void operationsNeedConnection() {
        assertFalse(dmart.isConnected());
        assertFails(ErrorKind.UNAUTHENTICATED, dmart::getProfile);
        assertFails(ErrorKind.UNAUTHENTICATED, () -> dmart.create("blog", "posts", Collections.emptyMap()));
        assertFails(ErrorKind.UNAUTHENTICATED, () -> dmart.update("blog", "posts", "p1", Collections.emptyMap()));
        assertFails(ErrorKind.UNAUTHENTICATED, () -> dmart.request(new ActionRequest("blog", RequestType.DELETE,
                new Record(ResourceType.CONTENT, "posts", "p1", Collections.emptyMap()))));
        assertFails(ErrorKind.UNAUTHENTICATED, () -> dmart.delete("blog", "posts", "p1"));
        assertFails(ErrorKind.UNAUTHENTICATED, () -> dmart.read("blog", "posts", "p1"));
        assertFails(ErrorKind.UNAUTHENTICATED, () -> dmart.readJsonPayload("blog", "posts", "p1"));
        assertFails(ErrorKind.UNAUTHENTICATED, () -> dmart.query("blog", "posts"));
        assertFails(ErrorKind.UNAUTHENTICATED, () -> dmart.query(new QueryRequest(QueryType.SEARCH, "blog", "posts")));
        assertFails(ErrorKind.UNAUTHENTICATED, () -> dmart.queryDataAsset("blog", "data", "sales", "csv", "SELECT 1"));
        assertFails(ErrorKind.UNAUTHENTICATED, () -> dmart.progressTicket("blog", "tickets", "t1", "close"));
        assertFails(ErrorKind.UNAUTHENTICATED, () -> dmart.uploadResourceWithPayload("blog",
                Collections.singletonMap("shortname", "f"), new byte[]{1}, "f.png", "image/png"));
        for(CompletableFuture<DmartResponse> future : Arrays.asList(dmart.getProfileAsync(),
                dmart.queryAsync(new QueryRequest(QueryType.SEARCH, "blog", "posts")))) {
            ExecutionException failure = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            assertEquals(ErrorKind.UNAUTHENTICATED, ((DmartException) failure.getCause()).getKind());
        }
        DmartException e = assertFails(ErrorKind.UNAUTHENTICATED, dmart::disconnect);
        assertEquals(401, e.getStatusCode());
        assertEquals("login", e.getError().getType());
        assertEquals(10, e.getError().getCode());
        assertEquals(0, backend.getRequestCount());
    }

    @Test
    public void connectAndGetProfile() throws Exception {
        dmart.connect();
        assertTrue(dmart.isConnected());
        FakeBackend.RecordedRequest login = backend.lastRequest();
        assertNull(login.header("Authorization"));
        assertEquals("{\"shortname\":\"alice\",\"password\":\"secret\"}", login.bodyString());

        DmartResponse profile = dmart.getProfile();
        assertTrue(profile.isSuccess());
        assertEquals("alice@example.com", profile.getRecords().get(0).getAttribute("email"));
        assertEquals("Bearer tok1", backend.lastRequest().header("Authorization"));
    }

    @Test
    public void badCredentials() {
        backend.on("POST", "/user/login", json(401, "{\"status\":\"failed\",\"error\":{\"type\":\"auth\","
                + "\"code\":10,\"message\":\"Invalid username or password\"}}"));
        DmartException e = assertFails(ErrorKind.CONNECTION, dmart::connect);
        assertEquals(401, e.getStatusCode());
        assertEquals("auth", e.getError().getType());
        assertFalse(dmart.isConnected());
        assertFails(ErrorKind.UNAUTHENTICATED, dmart::getProfile);
        assertEquals(1, backend.getRequestCount());
    }

    @Test
    public void loginWithoutToken() {
        backend.on("POST", "/user/login", json(200, success("[]")));
        DmartException e = assertFails(ErrorKind.CONNECTION, dmart::connect);
        assertEquals(200, e.getStatusCode());

        backend.on("POST", "/user/login", json(200, success("[{\"resource_type\":\"user\",\"shortname\":\"alice\","
                + "\"subpath\":\"users\",\"attributes\":{}}]")));
        assertFails(ErrorKind.CONNECTION, dmart::connect);

        backend.on("POST", "/user/login", json(200, "{\"status\":\"failed\",\"error\":{\"type\":\"auth\",\"code\":4,"
                + "\"message\":\"locked\"}}"));
        e = assertFails(ErrorKind.CONNECTION, dmart::connect);
        assertEquals("locked", e.getError().getMessage());
        assertFalse(dmart.isConnected());
    }

    /**
     * A token which can't go into the Authorization header fails the login instead of every later call.
     */
    @Test
    public void loginWithUnusableToken() {
        backend.on("POST", "/user/login", json(200, loginSuccess("abc\\r\\nX-Evil: 1")));
        DmartException e = assertFails(ErrorKind.CONNECTION, dmart::connect);
        assertEquals(200, e.getStatusCode());
        assertEquals("connection", e.getError().getType());
        assertFalse(dmart.isConnected());
        assertFails(ErrorKind.UNAUTHENTICATED, dmart::getProfile);
        assertEquals(1, backend.getRequestCount());
    }

    /**
     * Oversized bodies from a broken server end as a failed login, not as an unchecked exception.
     */
    @Test
    public void loginWithOversizedBody() throws IOException {
        String[] responses = {
                "HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n80000000\r\nhello\r\n0\r\n\r\n",
                "HTTP/1.1 200 OK\r\nContent-Length: 2000000000\r\n\r\nhello"
        };
        for(String raw : responses) {
            try (RawServer server = new RawServer(raw, true)) {
                DmartService broken = new DmartService(server.getUrl(), "alice", "secret", session);
                DmartException e = assertFails(ErrorKind.CONNECTION, broken::connect);
                assertEquals(DmartException.NO_STATUS, e.getStatusCode());
                assertEquals(ErrorKind.TRANSPORT, ((DmartException) e.getCause()).getKind());
                assertFalse(broken.isConnected());
            }
        }
    }

    @Test
    public void unreachableLogin() {
        backend.close();
        DmartException e = assertFails(ErrorKind.CONNECTION, dmart::connect);
        assertEquals(DmartException.NO_STATUS, e.getStatusCode());
        assertTrue(e.getCause() instanceof DmartException);
    }

    @Test
    public void reconnectReplacesToken() throws Exception {
        dmart.connect();
        backend.on("POST", "/user/login", json(200, loginSuccess("tok2")));
        dmart.connect();
        dmart.getProfile();
        assertEquals("Bearer tok2", backend.lastRequest().header("Authorization"));

        backend.on("POST", "/user/login", json(500, "{\"detail\":\"down\"}"));
        assertFails(ErrorKind.CONNECTION, dmart::connect);
        dmart.getProfile();
        assertEquals("Bearer tok2", backend.lastRequest().header("Authorization")); //failed login keeps the old token
    }

    @Test
    public void disconnectClearsToken() throws Exception {
        backend.on("POST", "/user/logout", json(200, success("[]")));
        dmart.connect();
        dmart.disconnect();
        assertFalse(dmart.isConnected());
        assertEquals("/user/logout", backend.lastRequest().rawPath);
        assertEquals("Bearer tok1", backend.lastRequest().header("Authorization"));
        int sent = backend.getRequestCount();
        assertFails(ErrorKind.UNAUTHENTICATED, dmart::getProfile);
        assertEquals(sent, backend.getRequestCount());
    }

    @Test
    public void rejectedDisconnectClearsToken() throws Exception {
        backend.on("POST", "/user/logout", json(401, "{\"status\":\"failed\",\"error\":{\"type\":\"jwtauth\","
                + "\"code\":49,\"message\":\"expired\"}}"));
        dmart.connect();
        DmartException e = assertFails(ErrorKind.BACKEND_REJECTED, dmart::disconnect);
        assertEquals(49, e.getError().getCode());
        assertFalse(dmart.isConnected());
    }

    @Test
    public void unansweredDisconnectKeepsToken() throws Exception {
        dmart.connect();
        backend.close();
        assertFails(ErrorKind.TRANSPORT, dmart::disconnect);
        assertTrue(dmart.isConnected());
    }

    @Test
    public void validationError() throws Exception {
        backend.on("POST", "/managed/request", json(422, "{\"status\":\"failed\",\"error\":{\"type\":\"validation\","
                + "\"code\":12,\"message\":\"bad shortname\"}}"));
        dmart.connect();
        DmartException e = assertFails(ErrorKind.BACKEND_REJECTED,
                () -> dmart.create("blog", "posts", Collections.singletonMap("a", 1)));
        assertEquals(422, e.getStatusCode());
        assertEquals("validation", e.getError().getType());
        assertEquals(12, e.getError().getCode());
        assertEquals("bad shortname", e.getError().getMessage());
    }

    @Test
    public void unexpectedResponses() throws Exception {
        dmart.connect();
        backend.on("GET", "/user/profile", bytes(500, "text/html", "<html>oops</html>".getBytes(UTF_8)));
        DmartException e = assertFails(ErrorKind.TRANSPORT, dmart::getProfile);
        assertEquals(500, e.getStatusCode());

        backend.on("GET", "/user/profile", json(404, "{\"detail\":\"Not Found\"}"));
        e = assertFails(ErrorKind.BACKEND_REJECTED, dmart::getProfile);
        assertEquals(404, e.getStatusCode());
        assertEquals("http", e.getError().getType());
        assertEquals(404, e.getError().getCode());
        assertFalse(e.getError().getMessage().isEmpty());

        backend.on("GET", "/user/profile", bytes(200, "text/plain", "hello".getBytes(UTF_8)));
        e = assertFails(ErrorKind.TRANSPORT, dmart::getProfile);
        assertEquals(200, e.getStatusCode());

        backend.on("GET", "/user/profile", json(200, "{\"status\":\"failed\"}"));
        assertFails(ErrorKind.TRANSPORT, dmart::getProfile);

        backend.on("GET", "/user/profile", json(200, success("[{\"resource_type\":\"user\",\"shortname\":\"no way\","
                + "\"subpath\":\"users\"}]")));
        assertFails(ErrorKind.TRANSPORT, dmart::getProfile);
    }

    @Test
    public void failedEnvelopeWithStatus200() throws Exception {
        dmart.connect();
        backend.on("GET", "/user/profile", json(200, "{\"status\":\"failed\",\"error\":{\"type\":\"db\",\"code\":3,"
                + "\"message\":\"busy\"}}"));
        DmartResponse response = dmart.getProfile();
        assertFalse(response.isSuccess());
        assertEquals("busy", response.getError().getMessage());
    }

    @Test
    public void emptyQuery() throws Exception {
        backend.on("POST", "/managed/query", json(200, success("[]")));
        dmart.connect();
        DmartResponse response = dmart.query("blog", "/posts");
        assertNotNull(response.getRecords());
        assertTrue(response.getRecords().isEmpty());

        JsonNode sent = body(backend.lastRequest());
        assertEquals("search", sent.get("type").asText());
        assertEquals("blog", sent.get("space_name").asText());
        assertEquals("/posts", sent.get("subpath").asText());
        assertTrue(sent.get("retrieve_json_payload").asBoolean());
        assertEquals(0, sent.get("filter_schema_names").size());
        assertEquals("", sent.get("search").asText());
    }

    @Test
    public void queryExtras() throws Exception {
        backend.on("POST", "/managed/query", json(200, success("[]")));
        dmart.connect();
        Map<String, Object> extra = new HashMap<>();
        extra.put("limit", 5);
        extra.put("type", "subpath");
        dmart.query("blog", "posts", "@title:hello", Collections.singletonList("post"), extra);
        JsonNode sent = body(backend.lastRequest());
        assertEquals("subpath", sent.get("type").asText());
        assertEquals(5, sent.get("limit").asInt());
        assertEquals("post", sent.get("filter_schema_names").get(0).asText());
        assertEquals("@title:hello", sent.get("search").asText());

        dmart.query(new QueryRequest(QueryType.HISTORY, "blog", "posts").setFilterShortnames("p1").setLimit(3));
        sent = body(backend.lastRequest());
        assertEquals("history", sent.get("type").asText());
        assertEquals("p1", sent.get("filter_shortnames").get(0).asText());
        assertEquals(3, sent.get("limit").asInt());
    }

    @Test
    public void createUpdateDelete() throws Exception {
        backend.on("POST", "/managed/request", json(200, success("[]")));
        dmart.connect();

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("is_active", true);
        attributes.put("payload", Collections.singletonMap("body", Collections.singletonMap("title", "hi")));
        dmart.create("blog", "/posts/", attributes);
        JsonNode sent = body(backend.lastRequest());
        assertEquals("blog", sent.get("space_name").asText());
        assertEquals("create", sent.get("request_type").asText());
        JsonNode record = sent.get("records").get(0);
        assertEquals("content", record.get("resource_type").asText());
        assertEquals("auto", record.get("shortname").asText());
        assertEquals("posts", record.get("subpath").asText());
        assertEquals("hi", record.get("attributes").get("payload").get("body").get("title").asText());
        assertEquals(RequestHeaders.JSON, backend.lastRequest().header("Content-Type"));

        dmart.update("blog", "posts", "p1", Collections.singletonMap("is_active", false), ResourceType.POST);
        record = body(backend.lastRequest()).get("records").get(0);
        assertEquals("update", body(backend.lastRequest()).get("request_type").asText());
        assertEquals("post", record.get("resource_type").asText());
        assertEquals("p1", record.get("shortname").asText());

        dmart.delete("blog", "posts", "p1");
        sent = body(backend.lastRequest());
        assertEquals("delete", sent.get("request_type").asText());
        assertTrue(sent.get("records").get(0).get("attributes").isObject());
        assertEquals(0, sent.get("records").get(0).get("attributes").size());
    }

    @Test
    public void actionRequestWithSeveralRecords() throws Exception {
        backend.on("POST", "/managed/request", json(200, success("[]")));
        dmart.connect();
        dmart.request(new ActionRequest("blog", RequestType.MOVE,
                new Record(ResourceType.CONTENT, "posts", "p1", Collections.singletonMap("dest_subpath", "archive")),
                new Record(ResourceType.CONTENT, "posts", "p2", Collections.singletonMap("dest_subpath", "archive"))));
        JsonNode sent = body(backend.lastRequest());
        assertEquals("move", sent.get("request_type").asText());
        assertEquals(2, sent.get("records").size());
    }

    @Test
    public void invalidNamesSendNothing() throws Exception {
        dmart.connect();
        int sent = backend.getRequestCount();
        assertThrows(InvalidRequestException.class,
                () -> dmart.create("blog", "posts", Collections.emptyMap(), "bad name", ResourceType.CONTENT));
        assertThrows(InvalidRequestException.class, () -> dmart.read("blog", "a..b", "p1"));
        assertThrows(InvalidRequestException.class, () -> dmart.read("bad space", "posts", "p1"));
        assertThrows(InvalidRequestException.class, () -> dmart.progressTicket("blog", "tickets", "t1", ""));
        assertThrows(InvalidRequestException.class,
                () -> dmart.uploadResourceWithPayload("blog", Collections.emptyMap(), null, "a", "text/plain"));
        assertEquals(sent, backend.getRequestCount());
    }

    @Test
    public void readEncodesPath() throws Exception {
        String encoded = "/managed/entry/content/blog/%D8%B7%D9%84%D8%A8%D8%A7%D8%AA/p1";
        backend.on("GET", encoded, json(200, success("[]")));
        backend.on("GET", "/managed/entry/media/blog/posts/img1", json(200, success("[]")));
        dmart.connect();

        dmart.read("blog", "/طلبات/", "p1");
        assertEquals(encoded, backend.lastRequest().rawPath);
        assertEquals("retrieve_json_payload=true&retrieve_attachments=false", backend.lastRequest().rawQuery);

        dmart.read("blog", "posts", "img1", true, ResourceType.MEDIA);
        assertEquals("retrieve_json_payload=true&retrieve_attachments=true", backend.lastRequest().rawQuery);
        assertNull(backend.lastRequest().header("Content-Type"));
    }

    @Test
    public void readJsonPayload() throws Exception {
        backend.on("GET", "/managed/payload/content/blog/posts/p1.json", json(200, "{\"title\":\"hi\",\"tags\":[1]}"));
        dmart.connect();
        JsonNode payload = dmart.readJsonPayload("blog", "posts", "p1");
        assertEquals("hi", payload.get("title").asText());
        assertEquals(1, payload.get("tags").get(0).asInt());
    }

    @Test
    public void queryDataAsset() throws Exception {
        backend.on("POST", "/managed/data-asset", json(200, success("[]")));
        dmart.connect();
        dmart.queryDataAsset("blog", "data", "sales", "csv", "SELECT * FROM sales");
        JsonNode sent = body(backend.lastRequest());
        assertEquals("blog", sent.get("space_name").asText());
        assertEquals("data", sent.get("subpath").asText());
        assertEquals("content", sent.get("resource_type").asText());
        assertEquals("sales", sent.get("shortname").asText());
        assertTrue(sent.has("schema_shortname"));
        assertTrue(sent.get("schema_shortname").isNull());
        assertEquals("csv", sent.get("data_asset_type").asText());
        assertEquals("SELECT * FROM sales", sent.get("query_string").asText());

        dmart.queryDataAsset("blog", "data", "sales", "parquet", "SELECT 1", "sales_schema", ResourceType.PARQUET);
        sent = body(backend.lastRequest());
        assertEquals("sales_schema", sent.get("schema_shortname").asText());
        assertEquals("parquet", sent.get("resource_type").asText());
    }

    @Test
    public void progressTicket() throws Exception {
        backend.on("PUT", "/managed/progress-ticket/helpdesk/tickets/t1/close", json(200, success("[]")));
        dmart.connect();

        dmart.progressTicket("helpdesk", "tickets", "t1", "close");
        FakeBackend.RecordedRequest request = backend.lastRequest();
        assertEquals("PUT", request.method);
        assertEquals(0, request.body.length);
        assertEquals("0", request.header("Content-Length"));

        dmart.progressTicket("helpdesk", "/tickets/", "t1", "close", "duplicate");
        assertEquals("duplicate", body(backend.lastRequest()).get("resolution").asText());
    }

    @Test
    public void uploadWithPayload() throws Exception {
        backend.on("POST", "/managed/resource_with_payload", json(200, success("[]")));
        dmart.connect();
        Record record = new Record(ResourceType.MEDIA, "posts", "img1", Collections.singletonMap("is_active", true));
        byte[] png = {(byte) 0x89, 'P', 'N', 'G'};
        dmart.uploadResourceWithPayload("blog", record, png, "img1.png", "image/png");

        FakeBackend.RecordedRequest request = backend.lastRequest();
        String contentType = request.header("Content-Type");
        assertTrue(contentType.startsWith("multipart/form-data; boundary="));
        assertEquals("Bearer tok1", request.header("Authorization"));
        String boundary = contentType.substring(contentType.indexOf('=') + 1);
        String sent = new String(request.body, ISO_8859_1);
        int recordPart = sent.indexOf("Content-Disposition: form-data; name=\"request_record\"; filename=\"record.json\"\r\n"
                + "Content-Type: application/json\r\n\r\n{\"resource_type\":\"media\",\"shortname\":\"img1\"");
        int payloadPart = sent.indexOf("Content-Disposition: form-data; name=\"payload_file\"; filename=\"img1.png\"\r\n"
                + "Content-Type: image/png\r\n\r\n\u0089PNG\r\n");
        int spacePart = sent.indexOf("Content-Disposition: form-data; name=\"space_name\"\r\n\r\nblog\r\n");
        assertTrue(recordPart > 0);
        assertTrue(payloadPart > recordPart);
        assertTrue(spacePart > payloadPart);
        assertTrue(sent.startsWith("--" + boundary + "\r\n"));
        assertTrue(sent.endsWith("--" + boundary + "--\r\n"));
    }

    @Test
    public void compressedAndChunkedResponses() throws Exception {
        dmart.connect();
        backend.on("GET", "/user/profile", gzipJson(200, PROFILE));
        assertEquals("alice", dmart.getProfile().getRecords().get(0).getShortname());
        backend.on("GET", "/user/profile", chunkedJson(200, PROFILE));
        assertEquals("alice", dmart.getProfile().getRecords().get(0).getShortname());
    }

    /**
     * Calls made one after another share one keep-alive socket.
     */
    @Test
    public void connectionReuse() throws Exception {
        dmart.connect();
        dmart.getProfile();
        dmart.getProfile();
        List<FakeBackend.RecordedRequest> requests = backend.getRequests();
        assertEquals(3, requests.size());
        assertEquals(requests.get(0).clientPort, requests.get(1).clientPort);
        assertEquals(requests.get(1).clientPort, requests.get(2).clientPort);
        assertEquals(1, session.acquirePool().getPoolSize());
        assertEquals(1, session.getPoolsCreated());
    }

    @Test
    public void concurrentCalls() throws Exception {
        dmart.connect();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Future<DmartResponse>> results = new ArrayList<>();
        for(int i = 0; i < 12; i++) results.add(executor.submit(dmart::getProfile));
        for(Future<DmartResponse> result : results) assertTrue(result.get(10, TimeUnit.SECONDS).isSuccess());
        executor.shutdown();
        assertEquals(13, backend.getRequestCount());
        assertTrue(session.acquirePool().getPoolSize() <= 4);
    }

    @Test
    public void asyncCalls() throws Exception {
        CompletableFuture<DmartResponse> notConnected = dmart.getProfileAsync();
        ExecutionException e = assertThrows(ExecutionException.class, () -> notConnected.get(5, TimeUnit.SECONDS));
        assertEquals(ErrorKind.UNAUTHENTICATED, ((DmartException) e.getCause()).getKind());

        backend.on("POST", "/managed/query", json(200, success("[]")));
        dmart.connect();
        assertTrue(dmart.getProfileAsync().get(5, TimeUnit.SECONDS).isSuccess());
        assertTrue(dmart.queryAsync(new QueryRequest(QueryType.SEARCH, "blog", "posts"))
                .get(5, TimeUnit.SECONDS).getRecords().isEmpty());
    }

    @Test
    public void constructorChecks() {
        assertThrows(InvalidRequestException.class, () -> new DmartService("ftp://example.com", "a", "b", session));
        assertThrows(InvalidRequestException.class, () -> new DmartService("not a url", "a", "b", session));
        assertThrows(InvalidRequestException.class, () -> new DmartService(null, "a", "b", session));
        assertThrows(InvalidRequestException.class, () -> new DmartService(backend.getUrl(), "", "b", session));
        assertThrows(InvalidRequestException.class, () -> new DmartService(backend.getUrl(), "a", null, session));
        assertThrows(InvalidRequestException.class, () -> new DmartService(backend.getUrl(), "a", "b", null));
        assertEquals(backend.getUrl(), new DmartService(backend.getUrl() + "/", "a", "b", session).getBaseUrl());
    }
}
