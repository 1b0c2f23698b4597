package com.redditads.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Ordered list of streams, in the same shape {@code --discover} prints and {@code --catalog} reads.
 */
public record Catalog(@JsonProperty("streams") List<CatalogEntry> streams) {

    public Catalog {
        streams = streams == null ? List.of() : List.copyOf(streams);
    }

    /** Selected streams in catalog order. */
    @JsonIgnore
    public List<CatalogEntry> selectedStreams() {
        return streams.stream().filter(CatalogEntry::isSelected).toList();
    }
}
