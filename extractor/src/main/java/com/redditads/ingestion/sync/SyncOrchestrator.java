package com.redditads.ingestion.sync;

import com.redditads.catalog.CatalogEntry;
import com.redditads.config.TapConfig;
import com.redditads.domain.ReplicationMethod;
import com.redditads.domain.SyncState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the selected streams one after another in catalog order. Each stream's strategy is
 * resolved up front, so an unsupported replication method fails before any request is made.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SyncOrchestrator {

    private final List<StreamSyncer> syncers;

    public List<StreamSyncSummary> sync(TapConfig config, SyncState state, List<CatalogEntry> selectedStreams) {
        SyncSession session = SyncSession.start(config, state);
        List<PlannedStream> plan = selectedStreams.stream()
                .map(stream -> new PlannedStream(stream, syncerFor(stream.replicationMethod(), stream.tapStreamId())))
                .toList();

        List<StreamSyncSummary> summaries = new ArrayList<>(plan.size());
        for (PlannedStream planned : plan) {
            log.info("Syncing stream: {}", planned.stream().tapStreamId());
            summaries.add(planned.syncer().sync(planned.stream(), session));
        }
        return summaries;
    }

    private StreamSyncer syncerFor(ReplicationMethod method, String streamName) {
        return syncers.stream()
                .filter(s -> s.supports(method))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "No sync strategy for " + method + " (stream " + streamName + ")"));
    }

    private record PlannedStream(CatalogEntry stream, StreamSyncer syncer) {
    }
}
