package com.xksgroup.signagesync.model.dto;

import com.xksgroup.signagesync.model.ChangelogMarker;
import com.xksgroup.signagesync.model.sync.PollOutcome;
import com.xksgroup.signagesync.model.sync.PollerState;
import com.xksgroup.signagesync.model.sync.SyncReport;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class SyncStatusDto {
    private PollerState state;
    private PollOutcome lastOutcome;
    private Instant lastPollAt;
    private ChangelogMarker marker;
    private SyncReport lastReport;
    private int playlistCount;
    private int videoCount;
    private long downloadedCount;
}
