package io.dmart.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One reducer of an aggregation query, e.g. {@code count} aliased as {@code total}.
 */
public final class AggregationReducer {
    private final String name;
    private final String alias;
    private final List<String> args;

    public AggregationReducer(String name, String alias, List<String> args) {
        this.name = name;
        this.alias = alias;
        this.args = args == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }
    @JsonProperty("alias")
    public String getAlias() {
        return alias;
    }
    @JsonProperty("args")
    public List<String> getArgs() {
        return args;
    }
}
