package com.redditads.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One catalog metadata item: a breadcrumb (empty for the stream itself) and its key/value metadata.
 */
public record MetadataEntry(
        @JsonProperty("breadcrumb") List<String> breadcrumb,
        @JsonProperty("metadata") Map<String, Object> metadata
) {

    public MetadataEntry {
        breadcrumb = breadcrumb == null ? List.of() : List.copyOf(breadcrumb);
        metadata = metadata == null ? Map.of() : metadata;
    }

    @JsonIgnore
    public boolean isStreamLevel() {
        return breadcrumb.isEmpty();
    }
}
