package io.dmart.sdk.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Types of entries the backend stores. Values are the identifiers used in JSON and in entry paths.
 */
public enum ResourceType {
    USER("user"),
    GROUP("group"),
    FOLDER("folder"),
    SCHEMA("schema"),
    CONTENT("content"),
    ACL("acl"),
    COMMENT("comment"),
    MEDIA("media"),
    DATA_ASSET("data_asset"),
    LOCATOR("locator"),
    RELATIONSHIP("relationship"),
    ALTERATION("alteration"),
    HISTORY("history"),
    SPACE("space"),
    BRANCH("branch"),
    PERMISSION("permission"),
    ROLE("role"),
    TICKET("ticket"),
    JSON("json"),
    LOCK("lock"),
    POST("post"),
    REACTION("reaction"),
    REPLY("reply"),
    SHARE("share"),
    PLUGIN_WRAPPER("plugin_wrapper"),
    NOTIFICATION("notification"),
    CSV("csv"),
    JSONL("jsonl"),
    SQLITE("sqlite"),
    DUCKDB("duckdb"),
    PARQUET("parquet");

    private final String value;

    ResourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ResourceType fromValue(String value) {
        for(ResourceType v : values()) {
            if(v.value.equals(value)) return v;
        }
        throw new IllegalArgumentException("Unknown resource type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
