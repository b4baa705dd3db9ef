package com.xksgroup.signagesync.model.sync;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Event published on the sync stream and relayed to SSE clients under {@link #getType()}.
 */
@Getter
@ToString
@AllArgsConstructor
public class SyncEvent {

    public static final String SYNC_STARTED = "sync-started";
    public static final String DOWNLOAD_PROGRESS = "download-progress";
    public static final String DOWNLOAD_FAILED = "download-failed";
    public static final String CATALOG_READY = "catalog-ready";
    public static final String SYNC_FAILED = "sync-failed";

    private final String type;
    private final Object payload;
    private final Instant timestamp;

    public static SyncEvent of(String type, Object payload) {
        return new SyncEvent(type, payload, Instant.now());
    }
}
