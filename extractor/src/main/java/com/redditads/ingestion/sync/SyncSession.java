package com.redditads.ingestion.sync;

import com.redditads.config.TapConfig;
import com.redditads.domain.CredentialStore;
import com.redditads.domain.SyncState;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Per-run context handed to every stream: the tap config, the run's credentials and the
 * bookmark state being built.
 */
@Getter
@RequiredArgsConstructor
public class SyncSession {

    private final TapConfig config;
    private final CredentialStore credentials;
    private final SyncState state;

    public static SyncSession start(TapConfig config, SyncState state) {
        return new SyncSession(config, config.toCredentialStore(), state);
    }
}
