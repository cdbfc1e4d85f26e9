package io.dmart.sdk.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SortType {
    ASCENDING("ascending"),
    DESCENDING("descending");

    private final String value;

    SortType(String value) {
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
