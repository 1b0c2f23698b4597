package com.redditads.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redditads.domain.SyncState;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Writes Singer SCHEMA / RECORD / STATE messages, one compact JSON object per line, flushing each.
 */
public class SingerMessageWriter implements MessageWriter {

    private final ObjectMapper objectMapper;
    private final PrintStream out;

    public SingerMessageWriter(ObjectMapper objectMapper, PrintStream out) {
        this.objectMapper = objectMapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
        this.out = out;
    }

    @Override
    public void writeSchema(String stream, JsonNode schema, List<String> keyProperties) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("type", "SCHEMA");
        message.put("stream", stream);
        message.set("schema", schema);
        message.set("key_properties", objectMapper.valueToTree(keyProperties));
        write(message);
    }

    @Override
    public void writeRecord(String stream, JsonNode record) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("type", "RECORD");
        message.put("stream", stream);
        message.set("record", record);
        write(message);
    }

    @Override
    public void writeState(SyncState state) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("type", "STATE");
        message.set("value", objectMapper.valueToTree(state));
        write(message);
    }

    private void write(ObjectNode message) {
        String line;
        try {
            line = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not serialize " + message.path("type").asText() + " message", e);
        }
        synchronized (out) {
            out.println(line);
            out.flush();
        }
    }
}
