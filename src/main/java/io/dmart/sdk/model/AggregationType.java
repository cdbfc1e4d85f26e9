package io.dmart.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregation part of a query: fields to load, fields to group by and reducers. Reducers are either
 * {@link AggregationReducer}s or plain reducer expressions.
 */
public final class AggregationType {
    private final List<String> load;
    private final List<String> groupBy;
    private final List<Object> reducers;

    public AggregationType(List<String> load, List<String> groupBy, List<?> reducers) {
        this.load = copy(load);
        this.groupBy = copy(groupBy);
        this.reducers = copy(reducers);
        for(Object reducer : this.reducers) {
            if(!(reducer instanceof AggregationReducer) && !(reducer instanceof String))
                throw new IllegalArgumentException("Reducer must be a String or AggregationReducer: " + reducer);
        }
    }

    private static <T> List<T> copy(List<? extends T> list) {
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(list));
    }

    @JsonProperty("load")
    public List<String> getLoad() {
        return load;
    }
    @JsonProperty("group_by")
    public List<String> getGroupBy() {
        return groupBy;
    }
    @JsonProperty("reducers")
    public List<Object> getReducers() {
        return reducers;
    }
}
