package com.redditads.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Streams exposed by the Reddit Ads API, with the endpoint path relative to the account root.
 * Declaration order is the discovery (and default sync) order.
 */
public enum StreamId {
    ADS_REPORTS("ads_reports", "/reports", ReplicationMethod.INCREMENTAL,
            List.of("date", "account_id", "campaign_id", "ad_group_id", "ad_id"), "date"),
    ADS("ads", "/ads", ReplicationMethod.FULL_TABLE, List.of("id"), null),
    CAMPAIGNS("campaigns", "/campaigns", ReplicationMethod.FULL_TABLE, List.of("id"), null),
    AD_GROUPS("ad_groups", "/ad_groups", ReplicationMethod.FULL_TABLE, List.of("id"), null),
    ACCOUNTS("accounts", "", ReplicationMethod.FULL_TABLE, List.of("id"), null);

    private final String id;
    private final String endpointPath;
    private final ReplicationMethod replicationMethod;
    private final List<String> keyProperties;
    private final String replicationKey;

    StreamId(String id, String endpointPath, ReplicationMethod replicationMethod,
             List<String> keyProperties, String replicationKey) {
        this.id = id;
        this.endpointPath = endpointPath;
        this.replicationMethod = replicationMethod;
        this.keyProperties = keyProperties;
        this.replicationKey = replicationKey;
    }

    public String getId() {
        return id;
    }

    public String getEndpointPath() {
        return endpointPath;
    }

    public ReplicationMethod getReplicationMethod() {
        return replicationMethod;
    }

    public List<String> getKeyProperties() {
        return keyProperties;
    }

    /** Valid replication key for incremental streams; empty for full-table streams. */
    public Optional<String> getReplicationKey() {
        return Optional.ofNullable(replicationKey);
    }

    public static Optional<StreamId> fromId(String id) {
        return Arrays.stream(values())
                .filter(s -> s.id.equals(id))
                .findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
