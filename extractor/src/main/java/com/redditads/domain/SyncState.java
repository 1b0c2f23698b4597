package com.redditads.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Persisted extraction state: {@code {"bookmarks": {stream: {replicationKey: value}}}}.
 * Top-level keys other than {@code bookmarks} are carried through unchanged.
 */
public class SyncState {

    private final Map<String, Map<String, String>> bookmarks = new LinkedHashMap<>();

    private final Map<String, Object> other = new LinkedHashMap<>();

    public static SyncState empty() {
        return new SyncState();
    }

    public boolean hasBookmarks(String streamId) {
        Map<String, String> stream = bookmarks.get(streamId);
        return stream != null && !stream.isEmpty();
    }

    public Optional<String> getBookmark(String streamId, String replicationKey) {
        Map<String, String> stream = bookmarks.get(streamId);
        return stream == null ? Optional.empty() : Optional.ofNullable(stream.get(replicationKey));
    }

    public SyncState writeBookmark(String streamId, String replicationKey, String value) {
        bookmarks.computeIfAbsent(streamId, k -> new LinkedHashMap<>()).put(replicationKey, value);
        return this;
    }

    @JsonProperty("bookmarks")
    public Map<String, Map<String, String>> getBookmarks() {
        return bookmarks;
    }

    @JsonProperty("bookmarks")
    public void setBookmarks(Map<String, Map<String, String>> bookmarks) {
        this.bookmarks.clear();
        if (bookmarks != null) {
            bookmarks.forEach((stream, keys) -> this.bookmarks.put(stream,
                    keys == null ? new LinkedHashMap<>() : new LinkedHashMap<>(keys)));
        }
    }

    @JsonAnyGetter
    public Map<String, Object> getOther() {
        return other;
    }

    @JsonAnySetter
    public void setOther(String key, Object value) {
        other.put(key, value);
    }
}
