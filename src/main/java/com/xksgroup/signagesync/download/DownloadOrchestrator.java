package com.xksgroup.signagesync.download;

import com.xksgroup.signagesync.model.Video;
import com.xksgroup.signagesync.model.sync.DownloadFailure;
import com.xksgroup.signagesync.store.CatalogStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Fills the gaps between the catalog and the media directory.
 * <p>
 * Every video not yet downloaded becomes one task on a bounded pool. A task retries its fetch
 * with linear backoff, then gives up and reports a {@link DownloadFailure} without blocking the
 * other tasks. Calling {@link #syncDownloads} again on a fully downloaded catalog does no I/O.
 */
@Slf4j
@Service
public class DownloadOrchestrator {

    private final CatalogStore catalogStore;
    private final MediaFetcher mediaFetcher;
    private final MediaStorage mediaStorage;

    private final int poolSize;
    private final int maxRetryAttempts;
    private final long retryDelayMs;

    private ExecutorService executor;

    public DownloadOrchestrator(CatalogStore catalogStore,
                                MediaFetcher mediaFetcher,
                                MediaStorage mediaStorage,
                                @Value("${download.pool-size:2}") int poolSize,
                                @Value("${download.retry.max-attempts:3}") int maxRetryAttempts,
                                @Value("${download.retry.delay-ms:2000}") long retryDelayMs) {
        this.catalogStore = catalogStore;
        this.mediaFetcher = mediaFetcher;
        this.mediaStorage = mediaStorage;
        this.poolSize = Math.max(1, poolSize);
        this.maxRetryAttempts = Math.max(1, maxRetryAttempts);
        this.retryDelayMs = Math.max(0, retryDelayMs);
    }

    /**
     * Start fetching every video whose {@code downloaded} flag is false.
     */
    public DownloadSession syncDownloads(List<Video> videos) {
        Map<String, Video> pending = new LinkedHashMap<>();
        for (Video video : videos) {
            if (!video.isDownloaded()) {
                pending.putIfAbsent(video.getId(), video);
            }
        }

        DownloadSession session = new DownloadSession(pending.size());
        if (pending.isEmpty()) {
            log.info("All {} videos already downloaded, nothing to fetch", videos.size());
            session.finishEmpty();
            return session;
        }

        log.info("Starting download of {} videos with {} workers", pending.size(), poolSize);
        mediaStorage.ensureDirectory();
        ExecutorService pool = initializeExecutor();

        for (Video video : pending.values()) {
            try {
                CompletableFuture.runAsync(() -> downloadVideo(video, session), pool);
            } catch (RejectedExecutionException e) {
                log.warn("Download pool is shut down, skipping video {}", video.getId());
                session.recordFailure(new DownloadFailure(video.getId(), video.getUrl(), 0, "Download pool is shut down"));
            }
        }
        return session;
    }

    private void downloadVideo(Video video, DownloadSession session) {
        String videoId = video.getId();
        try {
            Path target = mediaStorage.pathFor(videoId);

            if (mediaStorage.isComplete(target)) {
                log.info("Video {} already present at {}, skipping fetch", videoId, target);
                catalogStore.markDownloaded(videoId, target.toString());
                session.recordSuccess(videoId);
                return;
            }

            Path part = mediaStorage.partPathFor(videoId);
            Exception lastException = null;
            int attempts = 0;

            for (int attempt = 1; attempt <= maxRetryAttempts; attempt++) {
                attempts = attempt;
                try {
                    mediaFetcher.fetch(video.getUrl(), part, byteProgressLogger(videoId));
                    mediaStorage.promote(part, target);
                    catalogStore.markDownloaded(videoId, target.toString());
                    log.info("Video {} downloaded to {} (attempt {})", videoId, target, attempt);
                    session.recordSuccess(videoId);
                    return;
                } catch (Exception e) {
                    lastException = e;
                    if (isCancellation(e)) {
                        Thread.currentThread().interrupt();
                        log.info("Download of video {} cancelled, keeping partial file {}", videoId, part);
                        break;
                    }
                    log.warn("Download attempt {}/{} failed for video {}: {}", attempt, maxRetryAttempts, videoId, e.getMessage());
                    if (attempt < maxRetryAttempts) {
                        try {
                            Thread.sleep(retryDelayMs * attempt);
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            break;
                        }
                    }
                }
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
            }

            String message = lastException != null ? lastException.getMessage() : "interrupted";
            log.error("Giving up on video {} after {} attempts: {}", videoId, attempts, message);
            session.recordFailure(new DownloadFailure(videoId, video.getUrl(), attempts, message));
        } catch (RuntimeException e) {
            log.error("Unexpected error while downloading video {}", videoId, e);
            session.recordFailure(new DownloadFailure(videoId, video.getUrl(), 0, e.getMessage()));
        }
    }

    /**
     * A socket timeout is an ordinary network failure and gets retried; any other
     * {@link InterruptedIOException}, or a raised interrupt flag, means the pool is stopping.
     */
    static boolean isCancellation(Exception e) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        return e instanceof InterruptedIOException && !(e instanceof SocketTimeoutException);
    }

    private MediaFetcher.ProgressListener byteProgressLogger(String videoId) {
        long[] lastDecile = {-1};
        return (bytesRead, totalBytes) -> {
            long decile = (bytesRead * 10) / totalBytes;
            if (decile != lastDecile[0]) {
                lastDecile[0] = decile;
                log.debug("Video {}: {}% ({} / {} bytes)", videoId, decile * 10, bytesRead, totalBytes);
            }
        };
    }

    private synchronized ExecutorService initializeExecutor() {
        // Never recreated after shutdown, later submissions are rejected
        if (executor == null) {
            executor = Executors.newFixedThreadPool(poolSize);
        }
        return executor;
    }

    /**
     * Interrupts in-flight fetches. Their part files stay on disk for the next run.
     */
    @PreDestroy
    public synchronized void shutdown() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Download workers did not stop within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
