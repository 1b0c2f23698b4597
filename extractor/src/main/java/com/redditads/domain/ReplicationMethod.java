package com.redditads.domain;

/**
 * How a stream is replicated: re-fetched in full every run, or walked forward from a bookmark.
 */
public enum ReplicationMethod {
    FULL_TABLE,
    INCREMENTAL
}
