package com.redditads.ingestion.sync;

import com.redditads.catalog.CatalogEntry;
import com.redditads.domain.ReplicationMethod;

/**
 * Sync strategy for one replication method.
 */
public interface StreamSyncer {

    boolean supports(ReplicationMethod replicationMethod);

    /**
     * Emit the stream's schema, then its records (and bookmarks, for incremental streams).
     */
    StreamSyncSummary sync(CatalogEntry stream, SyncSession session);
}
