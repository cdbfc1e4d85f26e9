package io.dmart.sdk.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response envelope returned by every managed endpoint. A failed envelope always carries an error; records are
 * never null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DmartResponse {
    private final Status status;
    private final DmartError error;
    private final List<Record> records;
    private final Map<String, Object> attributes;

    /**
     * @throws IllegalArgumentException if status is missing, or the envelope failed without saying why
     */
    @JsonCreator
    public DmartResponse(@JsonProperty("status") Status status,
                         @JsonProperty("error") DmartError error,
                         @JsonProperty("records") List<Record> records,
                         @JsonProperty("attributes") Map<String, Object> attributes) {
        if(status == null) throw new IllegalArgumentException("Response without status");
        if(status == Status.FAILED && error == null) throw new IllegalArgumentException("Failed response without error");
        this.status = status;
        this.error = error;
        this.records = records == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(records));
        this.attributes = attributes == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @JsonProperty("status")
    public Status getStatus() {
        return status;
    }
    @JsonProperty("error")
    public DmartError getError() {
        return error;
    }
    @JsonProperty("records")
    public List<Record> getRecords() {
        return records;
    }
    @JsonProperty("attributes")
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    @Override
    public String toString() {
        return "DmartResponse{" + status + (error == null ? "" : ", " + error) + ", " + records.size() + " records}";
    }
}
