package io.dmart.sdk.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of change a managed request performs on its records.
 */
public enum RequestType {
    CREATE("create"),
    UPDATE("update"),
    PATCH("patch"),
    UPDATE_ACL("update_acl"),
    ASSIGN("assign"),
    REPLACE("replace"),
    DELETE("delete"),
    MOVE("move");

    private final String value;

    RequestType(String value) {
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
