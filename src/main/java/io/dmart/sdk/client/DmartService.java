package io.dmart.sdk.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.dmart.sdk.connections.Endpoint;
import io.dmart.sdk.connections.Http;
import io.dmart.sdk.connections.InvalidRequestException;
import io.dmart.sdk.connections.MultipartBody;
import io.dmart.sdk.connections.RequestHeaders;
import io.dmart.sdk.model.*;
import io.dmart.sdk.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.MalformedURLException;
import java.util.*;
import java.util.concurrent.CompletableFuture;

/**
 * Client for one dmart backend and one user. {@link #connect()} logs in and keeps the token; every other operation
 * needs it and fails with {@link ErrorKind#UNAUTHENTICATED} without touching the network otherwise.
 * <pre>
 *     DmartService dmart = new DmartService("https://api.example.com", "alice", "secret");
 *     dmart.connect();
 *     DmartResponse created = dmart.create("applications", "requests", Map.of("payload", body));
 *     DmartResponse found = dmart.query(new QueryRequest(QueryType.SEARCH, "applications", "requests").setLimit(5));
 *     dmart.disconnect();
 * </pre>
 * Instances are safe to use from several threads; calls made at the same time aren't ordered in any way.
 */
public class DmartService {
    private static final Logger log = LoggerFactory.getLogger(DmartService.class);
    public static final String AUTO_SHORTNAME = "auto";

    private final String baseUrl;
    private final String username;
    private final String password;
    private final SessionManager session;
    private final AuthTokenManager tokens = new AuthTokenManager();

    /**
     * Create a client which uses the process-wide {@link SessionManager#shared() session}.
     * @param url base URL of the backend, e.g. {@code https://api.example.com}
     * @param username user shortname
     * @param password user password
     * @throws InvalidRequestException if the URL isn't an http(s) URL, or credentials are empty
     */
    public DmartService(String url, String username, String password) {
        this(url, username, password, SessionManager.shared());
    }

    public DmartService(String url, String username, String password, SessionManager session) {
        if(url == null) throw new InvalidRequestException("Backend URL is required");
        try {
            Endpoint.fromUrl(url);
        } catch (MalformedURLException e) {
            throw new InvalidRequestException("Invalid backend URL " + url, e);
        }
        if(username == null || username.isEmpty()) throw new InvalidRequestException("Username is required");
        if(password == null || password.isEmpty()) throw new InvalidRequestException("Password is required");
        if(session == null) throw new InvalidRequestException("Session manager is required");
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.username = username;
        this.password = password;
        this.session = session;
    }

    private NetworkRequestBuilder request(Http.Verb verb, String path) {
        return new NetworkRequestBuilder(session, verb, baseUrl, path).setAuth(tokens);
    }

    /**
     * Logs in and stores the token, replacing the previous one. On failure the previous token is kept as it was,
     * and no new one is stored.
     * @throws DmartException of kind {@link ErrorKind#CONNECTION} if the backend can't be reached, refuses the
     *                        credentials or doesn't send a token
     */
    public void connect() throws DmartException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("shortname", username);
        body.put("password", password);
        DmartResponse response;
        try {
            response = new NetworkRequestBuilder(session, Http.Verb.POST, baseUrl, "/user/login")
                    .anonymous()
                    .sendJson(body)
                    .blocking();
        } catch (DmartException e) {
            log.info("Login to {} as {} failed: {}", baseUrl, username, e.getError());
            throw DmartException.connection("Failed to connect to the Dmart instance", e);
        }
        if(!response.isSuccess() || response.getRecords().isEmpty()) {
            log.info("Login to {} as {} rejected", baseUrl, username);
            throw DmartException.connection(Http.OK, response.getError() != null ? response.getError()
                    : new DmartError("connection", 0, "Failed to connect to the Dmart instance, invalid url or credentials"));
        }
        Object token = response.getRecords().get(0).getAttribute("access_token");
        if(!(token instanceof String) || ((String) token).isEmpty()) {
            throw DmartException.connection(Http.OK, new DmartError("connection", 0, "Login response without access token"));
        }
        if(!AuthTokenManager.isUsable((String) token)) {
            throw DmartException.connection(Http.OK, new DmartError("connection", 0, "Login response with an unusable access token"));
        }
        tokens.setToken((String) token);
        log.info("Connected to {} as {}", baseUrl, username);
    }

    /**
     * Logs out. The token is cleared once the backend has answered, even if the answer is an error; if there was
     * no answer, the token is kept so the call can be repeated.
     * @throws DmartException of kind {@link ErrorKind#UNAUTHENTICATED} if not connected (nothing is sent),
     *                        {@link ErrorKind#BACKEND_REJECTED} if the backend refused (token is cleared anyway),
     *                        {@link ErrorKind#TRANSPORT} if there was no usable answer (token is kept)
     */
    public void disconnect() throws DmartException {
        tokens.requireToken();
        try {
            request(Http.Verb.POST, "/user/logout").blocking();
        } catch (DmartException e) {
            if(e.getKind() == ErrorKind.BACKEND_REJECTED) {
                tokens.clearToken();
                log.info("Logout from {} rejected ({}); token cleared", baseUrl, e.getStatusCode());
            }
            throw e;
        }
        tokens.clearToken();
        log.info("Disconnected from {}", baseUrl);
    }

    /**
     * @return whether a token is present
     */
    public boolean isConnected() {
        return tokens.hasToken();
    }

    public DmartResponse getProfile() throws DmartException {
        return request(Http.Verb.GET, "/user/profile").blocking();
    }

    public CompletableFuture<DmartResponse> getProfileAsync() {
        return request(Http.Verb.GET, "/user/profile").async();
    }

    /**
     * Sends any managed request, e.g. a patch or move of several records at once.
     */
    public DmartResponse request(ActionRequest action) throws DmartException {
        return request(Http.Verb.POST, "/managed/request").sendJson(action).blocking();
    }

    private DmartResponse singleRecordRequest(String spaceName, String subpath, String shortname,
                                              RequestType type, Map<String, Object> attributes,
                                              ResourceType resourceType) throws DmartException {
        return request(new ActionRequest(spaceName, type, new Record(resourceType, subpath, shortname, attributes)));
    }

    /**
     * Create a content entry with a shortname the backend picks.
     */
    public DmartResponse create(String spaceName, String subpath, Map<String, Object> attributes) throws DmartException {
        return create(spaceName, subpath, attributes, AUTO_SHORTNAME, ResourceType.CONTENT);
    }

    public DmartResponse create(String spaceName, String subpath, Map<String, Object> attributes, String shortname,
                                ResourceType resourceType) throws DmartException {
        return singleRecordRequest(spaceName, subpath, shortname, RequestType.CREATE, attributes, resourceType);
    }

    public DmartResponse update(String spaceName, String subpath, String shortname,
                                Map<String, Object> attributes) throws DmartException {
        return update(spaceName, subpath, shortname, attributes, ResourceType.CONTENT);
    }

    public DmartResponse update(String spaceName, String subpath, String shortname, Map<String, Object> attributes,
                                ResourceType resourceType) throws DmartException {
        return singleRecordRequest(spaceName, subpath, shortname, RequestType.UPDATE, attributes, resourceType);
    }

    public DmartResponse delete(String spaceName, String subpath, String shortname) throws DmartException {
        return delete(spaceName, subpath, shortname, ResourceType.CONTENT);
    }

    public DmartResponse delete(String spaceName, String subpath, String shortname,
                                ResourceType resourceType) throws DmartException {
        return singleRecordRequest(spaceName, subpath, shortname, RequestType.DELETE,
                Collections.emptyMap(), resourceType);
    }

    /**
     * Read a content entry with its JSON payload, without attachments.
     */
    public DmartResponse read(String spaceName, String subpath, String shortname) throws DmartException {
        return read(spaceName, subpath, shortname, false, ResourceType.CONTENT);
    }

    public DmartResponse read(String spaceName, String subpath, String shortname, boolean retrieveAttachments,
                              ResourceType resourceType) throws DmartException {
        String path = "/managed/entry/" + resourceType.getValue() + "/" + Paths.space(spaceName) + "/"
                + Paths.subpath(subpath) + "/" + Paths.shortname(shortname)
                + "?retrieve_json_payload=true&retrieve_attachments=" + retrieveAttachments;
        return request(Http.Verb.GET, path).blocking();
    }

    /**
     * Fetch the JSON payload of a content entry. The payload is returned as stored, not wrapped in an envelope.
     */
    public JsonNode readJsonPayload(String spaceName, String subpath, String shortname) throws DmartException {
        String path = "/managed/payload/content/" + Paths.space(spaceName) + "/" + Paths.subpath(subpath) + "/"
                + Paths.shortname(shortname) + ".json";
        return request(Http.Verb.GET, path).blockingRaw();
    }

    public DmartResponse query(String spaceName, String subpath) throws DmartException {
        return query(spaceName, subpath, "", Collections.emptyList(), Collections.emptyMap());
    }

    public DmartResponse query(String spaceName, String subpath, String search,
                               List<String> filterSchemaNames) throws DmartException {
        return query(spaceName, subpath, search, filterSchemaNames, Collections.emptyMap());
    }

    /**
     * Search query with JSON payloads. Entries of {@code extra} are added to the body as they are and override
     * the other fields, e.g. {@code limit}, {@code sort_by} or {@code type}.
     */
    public DmartResponse query(String spaceName, String subpath, String search, List<String> filterSchemaNames,
                               Map<String, ?> extra) throws DmartException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", QueryType.SEARCH);
        body.put("space_name", spaceName);
        body.put("subpath", subpath);
        body.put("retrieve_json_payload", true);
        body.put("filter_schema_names", filterSchemaNames == null ? Collections.emptyList() : filterSchemaNames);
        body.put("search", search == null ? "" : search);
        if(extra != null) body.putAll(extra);
        return request(Http.Verb.POST, "/managed/query").sendJson(body).blocking();
    }

    public DmartResponse query(QueryRequest query) throws DmartException {
        return request(Http.Verb.POST, "/managed/query").sendJson(query).blocking();
    }

    public CompletableFuture<DmartResponse> queryAsync(QueryRequest query) {
        return request(Http.Verb.POST, "/managed/query").sendJson(query).async();
    }

    public DmartResponse queryDataAsset(String spaceName, String subpath, String shortname, String dataAssetType,
                                       String queryString) throws DmartException {
        return queryDataAsset(spaceName, subpath, shortname, dataAssetType, queryString, null, ResourceType.CONTENT);
    }

    /**
     * Runs a query (e.g. SQL) against a data asset, such as a csv or parquet attachment.
     * @param schemaShortname schema of the data, or null
     */
    public DmartResponse queryDataAsset(String spaceName, String subpath, String shortname, String dataAssetType,
                                       String queryString, String schemaShortname,
                                       ResourceType resourceType) throws DmartException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("space_name", spaceName);
        body.put("subpath", subpath);
        body.put("resource_type", resourceType);
        body.put("shortname", shortname);
        body.put("schema_shortname", schemaShortname);
        body.put("data_asset_type", dataAssetType);
        body.put("query_string", queryString);
        return request(Http.Verb.POST, "/managed/data-asset").sendJson(body).blocking();
    }

    public DmartResponse progressTicket(String spaceName, String subpath, String shortname,
                                       String action) throws DmartException {
        return progressTicket(spaceName, subpath, shortname, action, null);
    }

    /**
     * Moves a ticket along its workflow.
     * @param resolution reason sent with the action (e.g. why a ticket is cancelled); nothing is sent if empty
     */
    public DmartResponse progressTicket(String spaceName, String subpath, String shortname, String action,
                                       String resolution) throws DmartException {
        if(action == null || action.isEmpty()) throw new InvalidRequestException("Action is required");
        String path = "/managed/progress-ticket/" + Paths.space(spaceName) + "/" + Paths.subpath(subpath) + "/"
                + Paths.shortname(shortname) + "/" + Paths.encodeSegment(action);
        NetworkRequestBuilder builder = request(Http.Verb.PUT, path);
        if(resolution != null && !resolution.isEmpty()) builder.sendJson(Collections.singletonMap("resolution", resolution));
        return builder.blocking();
    }

    /**
     * Creates an entry together with its payload file in one multipart request.
     * @param record the entry, as the backend expects it in {@code request_record}
     * @param payload file contents
     * @param payloadFileName file name reported to the backend
     * @param payloadMimeType media type of the file
     */
    public DmartResponse uploadResourceWithPayload(String spaceName, Map<String, ?> record, byte[] payload,
                                                   String payloadFileName, String payloadMimeType) throws DmartException {
        return upload(spaceName, toJson(record), payload, payloadFileName, payloadMimeType);
    }

    public DmartResponse uploadResourceWithPayload(String spaceName, Record record, byte[] payload,
                                                   String payloadFileName, String payloadMimeType) throws DmartException {
        return upload(spaceName, toJson(record), payload, payloadFileName, payloadMimeType);
    }

    private static byte[] toJson(Object record) {
        try {
            return Network.getObjectMapper().writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("Cannot serialize request record", e);
        }
    }

    private DmartResponse upload(String spaceName, byte[] recordJson, byte[] payload, String payloadFileName,
                                 String payloadMimeType) throws DmartException {
        if(payload == null) throw new InvalidRequestException("Payload is required");
        MultipartBody body = new MultipartBody()
                .addFile("request_record", "record.json", RequestHeaders.JSON, recordJson)
                .addFile("payload_file", payloadFileName, payloadMimeType, payload)
                .addField("space_name", spaceName);
        return request(Http.Verb.POST, "/managed/resource_with_payload").sendMultipart(body).blocking();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    AuthTokenManager getTokens() {
        return tokens;
    }
}
