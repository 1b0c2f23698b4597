package com.redditads.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.redditads.domain.SyncState;

import java.util.List;

/**
 * Downstream sink for extracted data. A stream's schema is always written before its records.
 */
public interface MessageWriter {

    void writeSchema(String stream, JsonNode schema, List<String> keyProperties);

    void writeRecord(String stream, JsonNode record);

    void writeState(SyncState state);
}
