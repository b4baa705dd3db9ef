package com.xksgroup.signagesync.model.sync;

import java.util.List;

public record DownloadSummary(
        int total,
        int completed,
        List<DownloadFailure> failures
) {

    public static DownloadSummary empty() {
        return new DownloadSummary(0, 0, List.of());
    }

    public boolean isFullSuccess() {
        return failures.isEmpty() && completed == total;
    }
}
