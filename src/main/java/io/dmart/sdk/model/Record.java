package io.dmart.sdk.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.dmart.sdk.connections.InvalidRequestException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One entry as sent to or received from the backend. Shortname and subpath are checked against
 * {@link NamePatterns#defaults()} when the record is created, and the subpath loses its leading and trailing
 * slashes, unless it is the root path "/".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"resource_type", "uuid", "shortname", "subpath", "attributes", "attachments"})
public final class Record {
    public static final String ROOT = "/";

    private final ResourceType resourceType;
    private final UUID uuid;
    private final String shortname;
    private final String subpath;
    private final Map<String, Object> attributes;
    private final Map<String, List<Object>> attachments;

    /**
     * @throws InvalidRequestException if resource type is missing, or shortname or subpath are invalid
     */
    @JsonCreator
    public Record(@JsonProperty("resource_type") ResourceType resourceType,
                  @JsonProperty("uuid") UUID uuid,
                  @JsonProperty("shortname") String shortname,
                  @JsonProperty("subpath") String subpath,
                  @JsonProperty("attributes") Map<String, Object> attributes,
                  @JsonProperty("attachments") Map<String, List<Object>> attachments) {
        if(resourceType == null) throw new InvalidRequestException("Record needs a resource type");
        NamePatterns patterns = NamePatterns.defaults();
        this.resourceType = resourceType;
        this.uuid = uuid;
        this.shortname = patterns.checkShortname(shortname);
        this.subpath = normalizeSubpath(patterns.checkSubpath(subpath));
        this.attributes = attributes == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.attachments = attachments == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(attachments));
    }

    public Record(ResourceType resourceType, String subpath, String shortname, Map<String, Object> attributes) {
        this(resourceType, null, shortname, subpath, attributes, null);
    }

    /**
     * Strips leading and trailing slashes. The root path stays as it is; so does a path made only of slashes,
     * which is the root as well.
     * @param subpath valid subpath
     * @return normalized subpath
     */
    public static String normalizeSubpath(String subpath) {
        if(subpath.equals(ROOT)) return subpath;
        int start = 0, end = subpath.length();
        while(start < end && subpath.charAt(start) == '/') start++;
        while(end > start && subpath.charAt(end - 1) == '/') end--;
        return start == end ? ROOT : subpath.substring(start, end);
    }

    @JsonProperty("resource_type")
    public ResourceType getResourceType() {
        return resourceType;
    }
    @JsonProperty("uuid")
    public UUID getUuid() {
        return uuid;
    }
    @JsonProperty("shortname")
    public String getShortname() {
        return shortname;
    }
    @JsonProperty("subpath")
    public String getSubpath() {
        return subpath;
    }
    @JsonProperty("attributes")
    public Map<String, Object> getAttributes() {
        return attributes;
    }
    /**
     * @return attachments keyed by resource type value, or null if the backend didn't send any
     */
    @JsonProperty("attachments")
    public Map<String, List<Object>> getAttachments() {
        return attachments;
    }

    /**
     * @param type type of attachments
     * @return attachments of the given type, possibly empty
     */
    public List<Object> getAttachments(ResourceType type) {
        if(attachments == null) return Collections.emptyList();
        List<Object> list = attachments.get(type.getValue());
        return list == null ? Collections.emptyList() : list;
    }

    /**
     * @param name attribute name
     * @return attribute value, or null
     */
    public Object getAttribute(String name) {
        return attributes.get(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Record record = (Record) o;
        return resourceType == record.resourceType && Objects.equals(uuid, record.uuid)
                && shortname.equals(record.shortname) && subpath.equals(record.subpath)
                && attributes.equals(record.attributes) && Objects.equals(attachments, record.attachments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resourceType, uuid, shortname, subpath, attributes, attachments);
    }

    @Override
    public String toString() {
        return resourceType + ":" + subpath + "/" + shortname;
    }
}
