package io.dmart.sdk.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dmart.sdk.connections.InvalidRequestException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Full body of {@code /managed/query}. Defaults match the backend's: ascending sort, schema validation on,
 * 10 results starting at offset 0. All setters return this, to allow chaining.
 * <pre>
 *     QueryRequest query = new QueryRequest(QueryType.SEARCH, "applications", "/requests")
 *             .setFilterSchemaNames("request")
 *             .setSortBy("created_at").setSortType(SortType.DESCENDING)
 *             .setLimit(50);
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryRequest {
    private final QueryType type;
    private final String spaceName;
    private final String subpath;
    private List<ResourceType> filterTypes = new ArrayList<>();
    private List<String> filterSchemaNames = new ArrayList<>();
    private List<String> filterShortnames = new ArrayList<>();
    private String search = "";
    private String fromDate;
    private String toDate;
    private String sortBy;
    private SortType sortType = SortType.ASCENDING;
    private boolean retrieveJsonPayload = false;
    private boolean retrieveAttachments = false;
    private boolean validateSchema = true;
    private String jqFilter;
    private boolean exactSubpath = false;
    private int limit = 10;
    private int offset = 0;
    private AggregationType aggregationData;

    public QueryRequest(QueryType type, String spaceName, String subpath) {
        if(type == null) throw new InvalidRequestException("Query type is required");
        NamePatterns patterns = NamePatterns.defaults();
        this.type = type;
        this.spaceName = patterns.checkShortname(spaceName);
        this.subpath = patterns.checkSubpath(subpath);
    }

    public QueryRequest setFilterTypes(ResourceType... types) {
        this.filterTypes = new ArrayList<>(Arrays.asList(types));
        return this;
    }
    public QueryRequest setFilterSchemaNames(String... names) {
        return setFilterSchemaNames(Arrays.asList(names));
    }
    public QueryRequest setFilterSchemaNames(List<String> names) {
        this.filterSchemaNames = new ArrayList<>(names);
        return this;
    }
    public QueryRequest setFilterShortnames(String... shortnames) {
        this.filterShortnames = new ArrayList<>(Arrays.asList(shortnames));
        return this;
    }
    public QueryRequest setSearch(String search) {
        this.search = search == null ? "" : search;
        return this;
    }
    /**
     * @param fromDate lower bound on creation time, in the backend's ISO-8601 format
     * @return this, to allow chaining
     */
    public QueryRequest setFromDate(String fromDate) {
        this.fromDate = fromDate;
        return this;
    }
    public QueryRequest setToDate(String toDate) {
        this.toDate = toDate;
        return this;
    }
    public QueryRequest setSortBy(String sortBy) {
        this.sortBy = sortBy;
        return this;
    }
    public QueryRequest setSortType(SortType sortType) {
        this.sortType = sortType;
        return this;
    }
    public QueryRequest setRetrieveJsonPayload(boolean retrieveJsonPayload) {
        this.retrieveJsonPayload = retrieveJsonPayload;
        return this;
    }
    public QueryRequest setRetrieveAttachments(boolean retrieveAttachments) {
        this.retrieveAttachments = retrieveAttachments;
        return this;
    }
    public QueryRequest setValidateSchema(boolean validateSchema) {
        this.validateSchema = validateSchema;
        return this;
    }
    public QueryRequest setJqFilter(String jqFilter) {
        this.jqFilter = jqFilter;
        return this;
    }
    public QueryRequest setExactSubpath(boolean exactSubpath) {
        this.exactSubpath = exactSubpath;
        return this;
    }
    public QueryRequest setLimit(int limit) {
        if(limit < 0) throw new InvalidRequestException("Negative limit " + limit);
        this.limit = limit;
        return this;
    }
    public QueryRequest setOffset(int offset) {
        if(offset < 0) throw new InvalidRequestException("Negative offset " + offset);
        this.offset = offset;
        return this;
    }
    public QueryRequest setAggregationData(AggregationType aggregationData) {
        this.aggregationData = aggregationData;
        return this;
    }

    @JsonProperty("type")
    public QueryType getType() {
        return type;
    }
    @JsonProperty("space_name")
    public String getSpaceName() {
        return spaceName;
    }
    @JsonProperty("subpath")
    public String getSubpath() {
        return subpath;
    }
    @JsonProperty("filter_types")
    public List<ResourceType> getFilterTypes() {
        return filterTypes;
    }
    @JsonProperty("filter_schema_names")
    public List<String> getFilterSchemaNames() {
        return filterSchemaNames;
    }
    @JsonProperty("filter_shortnames")
    public List<String> getFilterShortnames() {
        return filterShortnames;
    }
    @JsonProperty("search")
    public String getSearch() {
        return search;
    }
    @JsonProperty("from_date")
    public String getFromDate() {
        return fromDate;
    }
    @JsonProperty("to_date")
    public String getToDate() {
        return toDate;
    }
    @JsonProperty("sort_by")
    public String getSortBy() {
        return sortBy;
    }
    @JsonProperty("sort_type")
    public SortType getSortType() {
        return sortType;
    }
    @JsonProperty("retrieve_json_payload")
    public boolean isRetrieveJsonPayload() {
        return retrieveJsonPayload;
    }
    @JsonProperty("retrieve_attachments")
    public boolean isRetrieveAttachments() {
        return retrieveAttachments;
    }
    @JsonProperty("validate_schema")
    public boolean isValidateSchema() {
        return validateSchema;
    }
    @JsonProperty("jq_filter")
    public String getJqFilter() {
        return jqFilter;
    }
    @JsonProperty("exact_subpath")
    public boolean isExactSubpath() {
        return exactSubpath;
    }
    @JsonProperty("limit")
    public int getLimit() {
        return limit;
    }
    @JsonProperty("offset")
    public int getOffset() {
        return offset;
    }
    @JsonProperty("aggregation_data")
    public AggregationType getAggregationData() {
        return aggregationData;
    }
}
