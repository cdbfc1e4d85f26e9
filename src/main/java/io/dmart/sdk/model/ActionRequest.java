package io.dmart.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.dmart.sdk.connections.InvalidRequestException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Body of {@code /managed/request}: one request type applied to one or more records of a space.
 */
@JsonPropertyOrder({"space_name", "request_type", "records"})
public final class ActionRequest {
    private final String spaceName;
    private final RequestType requestType;
    private final List<Record> records;

    /**
     * @throws InvalidRequestException if space name is invalid, request type is missing or there are no records
     */
    public ActionRequest(String spaceName, RequestType requestType, List<Record> records) {
        NamePatterns.defaults().checkShortname(spaceName);
        if(requestType == null) throw new InvalidRequestException("Request type is required");
        if(records == null || records.isEmpty()) throw new InvalidRequestException("At least one record is required");
        this.spaceName = spaceName;
        this.requestType = requestType;
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    public ActionRequest(String spaceName, RequestType requestType, Record... records) {
        this(spaceName, requestType, Arrays.asList(records));
    }

    @JsonProperty("space_name")
    public String getSpaceName() {
        return spaceName;
    }
    @JsonProperty("request_type")
    public RequestType getRequestType() {
        return requestType;
    }
    @JsonProperty("records")
    public List<Record> getRecords() {
        return records;
    }
}
