package com.xksgroup.signagesync.model.sync;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Aggregate download progress, emitted after every resolved item of a download session.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class DownloadProgress {

    // Video resolved by this event, null for the empty-session event
    private final String videoId;

    private final int completed;
    private final int failed;
    private final int total;
    private final int percent;
    private final boolean allCompleted;

    public static DownloadProgress of(String videoId, int completed, int failed, int total) {
        int resolved = completed + failed;
        int percent = total > 0 ? (resolved * 100) / total : 100;
        return new DownloadProgress(videoId, completed, failed, total, percent, resolved >= total);
    }
}
