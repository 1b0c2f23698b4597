package com.redditads.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.redditads.domain.ReplicationMethod;
import com.redditads.domain.StreamId;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A stream in the catalog: schema, key properties and metadata.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogEntry(
        @JsonProperty("tap_stream_id") String tapStreamId,
        @JsonProperty("stream") String stream,
        @JsonProperty("schema") JsonNode schema,
        @JsonProperty("key_properties") List<String> keyProperties,
        @JsonProperty("metadata") List<MetadataEntry> metadata
) {

    public CatalogEntry {
        keyProperties = keyProperties == null ? List.of() : List.copyOf(keyProperties);
        metadata = metadata == null ? List.of() : List.copyOf(metadata);
    }

    @JsonIgnore
    public Optional<StreamId> streamId() {
        return StreamId.fromId(tapStreamId);
    }

    @JsonIgnore
    public Map<String, Object> streamMetadata() {
        return metadata.stream()
                .filter(MetadataEntry::isStreamLevel)
                .findFirst()
                .map(MetadataEntry::metadata)
                .orElse(Map.of());
    }

    /**
     * Stream is selected when its stream-level metadata carries {@code selected: true}, or when an
     * older catalog marks the schema itself with {@code selected: true}.
     */
    @JsonIgnore
    public boolean isSelected() {
        if (Boolean.TRUE.equals(streamMetadata().get("selected"))) {
            return true;
        }
        return schema != null && schema.path("selected").asBoolean(false);
    }

    /**
     * Replication method from {@code forced-replication-method}, then {@code replication-method},
     * then the stream's built-in method.
     */
    @JsonIgnore
    public ReplicationMethod replicationMethod() {
        Map<String, Object> md = streamMetadata();
        Object forced = md.getOrDefault("forced-replication-method", md.get("replication-method"));
        if (forced != null) {
            return ReplicationMethod.valueOf(forced.toString());
        }
        return streamId()
                .map(StreamId::getReplicationMethod)
                .orElseThrow(() -> new IllegalStateException("No replication method for stream " + tapStreamId));
    }
}
