package com.redditads.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Resolves the streams to sync: the selected entries of a user catalog, or every discovered
 * stream when no catalog file is given.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CatalogLoader {

    private final ObjectMapper objectMapper;
    private final CatalogDiscovery catalogDiscovery;

    public Catalog read(Path path) {
        try {
            return objectMapper.readValue(path.toFile(), Catalog.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read catalog file " + path, e);
        }
    }

    public List<CatalogEntry> selectedStreams(Path catalogPath) {
        if (catalogPath == null) {
            List<CatalogEntry> all = catalogDiscovery.discover().streams();
            log.info("No catalog given, syncing all {} discovered streams", all.size());
            return all;
        }
        List<CatalogEntry> selected = read(catalogPath).selectedStreams();
        if (selected.isEmpty()) {
            log.warn("Catalog {} selects no streams", catalogPath);
        }
        return selected;
    }
}
