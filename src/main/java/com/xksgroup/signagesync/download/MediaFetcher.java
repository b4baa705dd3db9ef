package com.xksgroup.signagesync.download;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Fetches a remote media file into a local file, continuing from whatever bytes the file already holds.
 */
public interface MediaFetcher {

    interface ProgressListener {
        void onProgress(long bytesRead, long totalBytes);
    }

    void fetch(String url, Path target, ProgressListener listener) throws IOException;
}
