package com.xksgroup.signagesync.model.sync;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class SyncReport {

    private PollOutcome outcome;
    private String trigger;

    private int playlistCount;
    private int videoCount;
    private int downloadsAttempted;
    private int downloadsCompleted;
    private List<DownloadFailure> failures;

    private String errorMessage;

    private Instant startedAt;
    private Instant finishedAt;

    public boolean isFullSuccess() {
        return outcome == PollOutcome.SYNCED;
    }
}
