package com.redditads.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.redditads.domain.ReplicationMethod;
import com.redditads.domain.StreamId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the discovery catalog from the loaded schemas.
 */
@Component
@RequiredArgsConstructor
public class CatalogDiscovery {

    static final String INCLUSION = "inclusion";
    static final String AVAILABLE = "available";
    static final String AUTOMATIC = "automatic";

    private final SchemaRegistry schemaRegistry;

    public Catalog discover() {
        List<CatalogEntry> entries = new ArrayList<>();
        schemaRegistry.all().forEach((streamId, schema) -> entries.add(new CatalogEntry(
                streamId.getId(),
                streamId.getId(),
                schema,
                streamId.getKeyProperties(),
                buildMetadata(streamId, schema))));
        return new Catalog(entries);
    }

    /**
     * Stream-level entry first, then one entry per top-level property. Object properties are
     * described by their child properties instead of the object itself.
     */
    static List<MetadataEntry> buildMetadata(StreamId streamId, JsonNode schema) {
        List<MetadataEntry> metadata = new ArrayList<>();
        Map<String, Object> streamLevel = new LinkedHashMap<>();
        streamLevel.put(INCLUSION, AVAILABLE);
        streamLevel.put("forced-replication-method", streamId.getReplicationMethod().name());
        streamLevel.put("table-key-properties", streamId.getKeyProperties());
        if (streamId.getReplicationMethod() == ReplicationMethod.INCREMENTAL) {
            streamLevel.put("valid-replication-keys", List.of(streamId.getReplicationKey().orElseThrow()));
        }
        metadata.add(new MetadataEntry(List.of(), streamLevel));

        JsonNode properties = schema.path("properties");
        Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode propertySchema = field.getValue();
            if (JsonSchemaTypes.allows(propertySchema, "object")) {
                propertySchema.path("properties").fieldNames().forEachRemaining(child ->
                        metadata.add(new MetadataEntry(
                                List.of("properties", name, "properties", child),
                                Map.of(INCLUSION, AVAILABLE))));
            } else {
                String inclusion = streamId.getKeyProperties().contains(name) ? AUTOMATIC : AVAILABLE;
                metadata.add(new MetadataEntry(List.of("properties", name), Map.of(INCLUSION, inclusion)));
            }
        }
        return metadata;
    }
}
