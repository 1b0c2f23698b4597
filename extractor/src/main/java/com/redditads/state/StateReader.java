package com.redditads.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.redditads.domain.SyncState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Reads the state file passed with {@code --state}. No file means an empty state.
 */
@Component
@RequiredArgsConstructor
public class StateReader {

    private final ObjectMapper objectMapper;

    public SyncState read(Path path) {
        if (path == null) {
            return SyncState.empty();
        }
        try {
            SyncState state = objectMapper.readValue(path.toFile(), SyncState.class);
            return state != null ? state : SyncState.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read state file " + path, e);
        }
    }
}
