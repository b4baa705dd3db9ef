package com.xksgroup.signagesync.model.sync;

public enum PollOutcome {
    NO_CHANGE,
    SYNCED,
    SYNC_PARTIAL,   // Catalog replaced but some downloads failed, marker kept
    SYNC_FAILED,    // Manifest fetch or parse failed, previous catalog kept
    POLL_FAILED,    // Changelog unreachable, retried on the next tick
    BUSY            // Another poll or sync already running
}
