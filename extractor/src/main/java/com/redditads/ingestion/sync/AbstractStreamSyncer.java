package com.redditads.ingestion.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redditads.catalog.CatalogEntry;
import com.redditads.domain.StreamId;
import com.redditads.ingestion.fetch.RateLimitedFetcher;
import com.redditads.output.MessageWriter;
import com.redditads.transform.RecordConformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schema and record emission shared by both strategies.
 */
public abstract class AbstractStreamSyncer implements StreamSyncer {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final RateLimitedFetcher fetcher;
    protected final RecordConformer conformer;
    protected final MessageWriter messageWriter;

    protected AbstractStreamSyncer(RateLimitedFetcher fetcher, RecordConformer conformer, MessageWriter messageWriter) {
        this.fetcher = fetcher;
        this.conformer = conformer;
        this.messageWriter = messageWriter;
    }

    protected static StreamId streamIdOf(CatalogEntry stream) {
        return stream.streamId()
                .orElseThrow(() -> new IllegalStateException("Unknown stream " + stream.tapStreamId()));
    }

    protected void emitSchema(CatalogEntry stream) {
        messageWriter.writeSchema(stream.tapStreamId(), stream.schema(), stream.keyProperties());
    }

    protected void emitRecord(CatalogEntry stream, JsonNode row) {
        messageWriter.writeRecord(stream.tapStreamId(), conformer.conform(stream.schema(), row, stream.metadata()));
    }

    /**
     * Logs the stream's record count as a Singer counter metric line, e.g.
     * {@code METRIC: {"type":"counter","metric":"record_count","value":5,"tags":{"endpoint":"campaigns"}}}.
     */
    protected void logRecordCount(CatalogEntry stream, long count) {
        log.info("METRIC: {}", recordCountMetric(stream.tapStreamId(), count));
    }

    static String recordCountMetric(String streamName, long count) {
        ObjectNode metric = JsonNodeFactory.instance.objectNode();
        metric.put("type", "counter");
        metric.put("metric", "record_count");
        metric.put("value", count);
        metric.putObject("tags").put("endpoint", streamName);
        return metric.toString();
    }
}
