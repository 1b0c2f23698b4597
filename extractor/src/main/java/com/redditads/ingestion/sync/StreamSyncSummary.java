package com.redditads.ingestion.sync;

/**
 * Outcome of one stream: records emitted, API requests made and the last committed bookmark (null for full-table).
 */
public record StreamSyncSummary(String stream, long recordsEmitted, int requests, String bookmark) {
}
