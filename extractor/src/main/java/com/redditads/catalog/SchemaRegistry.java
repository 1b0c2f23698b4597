package com.redditads.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.redditads.domain.StreamId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stream schemas loaded from {@code classpath:schemas/<stream>.json}.
 */
@Component
@Slf4j
public class SchemaRegistry {

    static final String DEFAULT_LOCATION = "classpath*:schemas/*.json";

    private final Map<StreamId, JsonNode> schemas;

    public SchemaRegistry(ObjectMapper objectMapper) {
        this(objectMapper, new PathMatchingResourcePatternResolver(), DEFAULT_LOCATION);
    }

    SchemaRegistry(ObjectMapper objectMapper, ResourcePatternResolver resolver, String locationPattern) {
        this.schemas = Collections.unmodifiableMap(load(objectMapper, resolver, locationPattern));
    }

    public Optional<JsonNode> find(StreamId streamId) {
        return Optional.ofNullable(schemas.get(streamId));
    }

    /** Loaded schemas in {@link StreamId} declaration order. */
    public Map<StreamId, JsonNode> all() {
        return schemas;
    }

    private static Map<StreamId, JsonNode> load(ObjectMapper objectMapper, ResourcePatternResolver resolver,
                                                String locationPattern) {
        Map<StreamId, JsonNode> loaded = new EnumMap<>(StreamId.class);
        Resource[] resources;
        try {
            resources = resolver.getResources(locationPattern);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot list schemas at " + locationPattern, e);
        }
        for (Resource resource : resources) {
            String filename = resource.getFilename();
            if (filename == null) {
                continue;
            }
            String name = filename.replace(".json", "");
            Optional<StreamId> streamId = StreamId.fromId(name);
            if (streamId.isEmpty()) {
                log.warn("Ignoring schema {}: not a known stream", filename);
                continue;
            }
            try (InputStream in = resource.getInputStream()) {
                loaded.put(streamId.get(), objectMapper.readTree(in));
            } catch (IOException e) {
                throw new IllegalStateException("Malformed schema " + filename, e);
            }
        }
        log.debug("Loaded {} stream schemas", loaded.size());
        return loaded;
    }
}
