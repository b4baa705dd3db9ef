package com.xksgroup.signagesync.model.sync;

public record DownloadFailure(
        String videoId,
        String url,
        int attempts,
        String message
) {}
