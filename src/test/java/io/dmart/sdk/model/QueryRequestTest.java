package io.dmart.sdk.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dmart.sdk.connections.InvalidRequestException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class QueryRequestTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void defaults() {
        JsonNode json = mapper.valueToTree(new QueryRequest(QueryType.SEARCH, "applications", "/requests"));
        assertEquals("search", json.get("type").asText());
        assertEquals("applications", json.get("space_name").asText());
        assertEquals("/requests", json.get("subpath").asText());
        assertEquals("", json.get("search").asText());
        assertEquals("ascending", json.get("sort_type").asText());
        assertTrue(json.get("validate_schema").asBoolean());
        assertFalse(json.get("retrieve_json_payload").asBoolean());
        assertEquals(10, json.get("limit").asInt());
        assertEquals(0, json.get("offset").asInt());
        assertEquals(0, json.get("filter_types").size());
        assertFalse(json.has("sort_by"));
        assertFalse(json.has("jq_filter"));
        assertFalse(json.has("aggregation_data"));
    }

    @Test
    public void customized() {
        AggregationType aggregation = new AggregationType(Collections.singletonList("@shortname"),
                Collections.singletonList("@state"),
                Arrays.asList("count", new AggregationReducer("sum", "total", Collections.singletonList("@amount"))));
        QueryRequest query = new QueryRequest(QueryType.AGGREGATION, "applications", "/")
                .setFilterTypes(ResourceType.TICKET)
                .setFilterSchemaNames("request")
                .setSortBy("created_at").setSortType(SortType.DESCENDING)
                .setLimit(50).setOffset(100)
                .setAggregationData(aggregation);
        JsonNode json = mapper.valueToTree(query);
        assertEquals("aggregation", json.get("type").asText());
        assertEquals("ticket", json.get("filter_types").get(0).asText());
        assertEquals("request", json.get("filter_schema_names").get(0).asText());
        assertEquals("descending", json.get("sort_type").asText());
        assertEquals(50, json.get("limit").asInt());
        JsonNode data = json.get("aggregation_data");
        assertEquals("@state", data.get("group_by").get(0).asText());
        assertEquals("count", data.get("reducers").get(0).asText());
        assertEquals("total", data.get("reducers").get(1).get("alias").asText());
    }

    @Test
    public void invalidArguments() {
        assertThrows(InvalidRequestException.class, () -> new QueryRequest(null, "space", "/"));
        assertThrows(InvalidRequestException.class, () -> new QueryRequest(QueryType.SEARCH, "bad space", "/"));
        QueryRequest query = new QueryRequest(QueryType.SUBPATH, "space", "/");
        assertThrows(InvalidRequestException.class, () -> query.setLimit(-1));
        assertThrows(InvalidRequestException.class, () -> query.setOffset(-5));
        assertThrows(IllegalArgumentException.class,
                () -> new AggregationType(null, null, Collections.singletonList(42)));
    }

    @Test
    public void actionRequestShape() {
        Record record = new Record(ResourceType.CONTENT, "posts", "p1", Collections.singletonMap("is_active", true));
        JsonNode json = mapper.valueToTree(new ActionRequest("blog", RequestType.CREATE, record));
        assertEquals("blog", json.get("space_name").asText());
        assertEquals("create", json.get("request_type").asText());
        assertEquals("p1", json.get("records").get(0).get("shortname").asText());
        assertThrows(InvalidRequestException.class, () -> new ActionRequest("blog", RequestType.CREATE));
        assertThrows(InvalidRequestException.class, () -> new ActionRequest("blog", null, record));
    }
}
