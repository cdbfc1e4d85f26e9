package io.dmart.sdk.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Error payload, either sent by the backend or produced by the client when a call can't complete.
 * Immutable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DmartError {
    private final String type;
    private final int code;
    private final String message;
    private final List<Map<String, Object>> info;

    @JsonCreator
    public DmartError(@JsonProperty("type") String type,
                      @JsonProperty("code") Integer code,
                      @JsonProperty("message") String message,
                      @JsonProperty("info") List<Map<String, Object>> info) {
        this.type = type == null ? "unknown" : type;
        this.code = code == null ? 0 : code;
        this.message = message == null ? "" : message;
        this.info = info == null ? null : Collections.unmodifiableList(new ArrayList<>(info));
    }

    public DmartError(String type, int code, String message) {
        this(type, code, message, null);
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }
    @JsonProperty("code")
    public int getCode() {
        return code;
    }
    @JsonProperty("message")
    public String getMessage() {
        return message;
    }
    /**
     * @return structured detail sent by the backend, or null
     */
    @JsonProperty("info")
    public List<Map<String, Object>> getInfo() {
        return info;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DmartError that = (DmartError) o;
        return code == that.code && type.equals(that.type) && message.equals(that.message)
                && Objects.equals(info, that.info);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, code, message, info);
    }

    @Override
    public String toString() {
        return type + "/" + code + ": " + message;
    }
}
