package com.redditads.ingestion.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.redditads.catalog.CatalogEntry;
import com.redditads.config.ExtractorProperties;
import com.redditads.domain.FetchWindow;
import com.redditads.domain.ReplicationMethod;
import com.redditads.domain.StreamId;
import com.redditads.domain.SyncState;
import com.redditads.ingestion.cursor.CursorStep;
import com.redditads.ingestion.cursor.DateWindowCursor;
import com.redditads.ingestion.fetch.RateLimitedFetcher;
import com.redditads.output.MessageWriter;
import com.redditads.transform.RecordConformer;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Date-walk sync for report streams: one request per day from the bookmark (or configured start)
 * up to today, committing the bookmark after every non-empty day.
 */
@Component
public class IncrementalReportSyncer extends AbstractStreamSyncer {

    private final DateWindowCursor cursor;
    private final ExtractorProperties properties;

    public IncrementalReportSyncer(RateLimitedFetcher fetcher, RecordConformer conformer, MessageWriter messageWriter,
                                   DateWindowCursor cursor, ExtractorProperties properties) {
        super(fetcher, conformer, messageWriter);
        this.cursor = cursor;
        this.properties = properties;
    }

    @Override
    public boolean supports(ReplicationMethod replicationMethod) {
        return replicationMethod == ReplicationMethod.INCREMENTAL;
    }

    @Override
    public StreamSyncSummary sync(CatalogEntry stream, SyncSession session) {
        StreamId streamId = streamIdOf(stream);
        String streamName = stream.tapStreamId();
        String replicationKey = streamId.getReplicationKey()
                .orElseThrow(() -> new IllegalStateException("Stream " + streamName + " has no replication key"));
        SyncState state = session.getState();

        emitSchema(stream);

        int conversionWindow = session.getConfig().conversionWindowOr(properties.getDefaultConversionWindowDays());
        LocalDate current = cursor.validStart(seedDate(session, streamName, replicationKey), conversionWindow);
        Map<String, String> headers = new HashMap<>();
        LocalDate runningBookmark = null;
        String committed = null;
        long records = 0;
        int requests = 0;

        while (true) {
            FetchWindow window = FetchWindow.singleDay(current);
            log.info("Querying date {} for stream {}", current, streamName);
            List<JsonNode> rows = fetcher.fetch(session.getCredentials(), streamId.getEndpointPath(),
                    window.toQueryParams(), headers);
            requests++;

            LocalDate bookmark = max(runningBookmark, current);
            for (JsonNode row : rows) {
                emitRecord(stream, row);
                records++;
                bookmark = max(bookmark, replicationValue(row, replicationKey, streamName));
            }
            runningBookmark = bookmark;

            // Empty days are walked past but never bookmarked.
            if (!rows.isEmpty()) {
                committed = bookmark.toString();
                state.writeBookmark(streamName, replicationKey, committed);
                messageWriter.writeState(state);
                log.debug("Stream {}: bookmark {}={} after {} rows", streamName, replicationKey, committed, rows.size());
            }

            CursorStep step = cursor.advance(current, bookmark);
            if (step.done()) {
                break;
            }
            current = step.nextDate();
        }
        log.info("Stream {}: {} records over {} days, bookmark {}", streamName, records, requests, committed);
        logRecordCount(stream, records);
        return new StreamSyncSummary(streamName, records, requests, committed);
    }

    /**
     * Stored bookmark (date part only) when the stream has one, else the configured start date.
     */
    LocalDate seedDate(SyncSession session, String streamName, String replicationKey) {
        SyncState state = session.getState();
        Optional<String> stored = state.hasBookmarks(streamName)
                ? state.getBookmark(streamName, replicationKey)
                : Optional.empty();
        return stored.map(IncrementalReportSyncer::datePart)
                .orElseGet(() -> session.getConfig().startDate());
    }

    private static LocalDate replicationValue(JsonNode row, String replicationKey, String streamName) {
        JsonNode value = row.get(replicationKey);
        if (value == null || !value.isTextual()) {
            throw new IllegalStateException("Row of stream " + streamName + " has no " + replicationKey);
        }
        return datePart(value.asText());
    }

    private static LocalDate datePart(String value) {
        String date = value.split(" ")[0];
        try {
            return LocalDate.parse(date.length() > 10 ? date.substring(0, 10) : date);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Not a date: " + value, e);
        }
    }

    private static LocalDate max(LocalDate a, LocalDate b) {
        if (a == null) {
            return b;
        }
        return a.isAfter(b) ? a : b;
    }
}
