package com.xksgroup.signagesync.model.sync;

public enum PollerState {
    IDLE,       // Waiting for the next tick
    POLLING,    // Fetching the changelog
    SYNCING     // Manifest + downloads in progress
}
