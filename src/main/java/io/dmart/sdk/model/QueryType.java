package io.dmart.sdk.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QueryType {
    SEARCH("search"),
    SUBPATH("subpath"),
    EVENTS("events"),
    HISTORY("history"),
    TAGS("tags"),
    SPACES("spaces"),
    COUNTERS("counters"),
    REPORTS("reports"),
    AGGREGATION("aggregation"),
    ATTACHMENTS("attachments"),
    ATTACHMENTS_AGGREGATION("attachments_aggregation");

    private final String value;

    QueryType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
