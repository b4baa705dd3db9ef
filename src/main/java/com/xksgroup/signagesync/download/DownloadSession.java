package com.xksgroup.signagesync.download;

import com.xksgroup.signagesync.model.sync.DownloadFailure;
import com.xksgroup.signagesync.model.sync.DownloadProgress;
import com.xksgroup.signagesync.model.sync.DownloadSummary;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on one {@link DownloadOrchestrator#syncDownloads} run.
 * <p>
 * Both streams replay from the start, so a subscriber attaching late still sees every event.
 * The progress stream completes right after the event whose {@code allCompleted} flag is set.
 */
public class DownloadSession {

    private final int total;
    private int completed;
    private int failed;
    private final List<DownloadFailure> failures = new ArrayList<>();

    private final Sinks.Many<DownloadProgress> progressSink = Sinks.many().replay().all();
    private final Sinks.Many<DownloadFailure> failureSink = Sinks.many().replay().all();
    private final CompletableFuture<DownloadSummary> completion = new CompletableFuture<>();

    DownloadSession(int total) {
        this.total = total;
    }

    public int getTotal() {
        return total;
    }

    public Flux<DownloadProgress> progress() {
        return progressSink.asFlux();
    }

    public Flux<DownloadFailure> failures() {
        return failureSink.asFlux();
    }

    public CompletableFuture<DownloadSummary> completion() {
        return completion;
    }

    synchronized void recordSuccess(String videoId) {
        completed++;
        emit(videoId);
    }

    synchronized void recordFailure(DownloadFailure failure) {
        failed++;
        failures.add(failure);
        failureSink.tryEmitNext(failure);
        emit(failure.videoId());
    }

    synchronized void finishEmpty() {
        emit(null);
    }

    private void emit(String videoId) {
        DownloadProgress progress = DownloadProgress.of(videoId, completed, failed, total);
        progressSink.tryEmitNext(progress);
        if (progress.isAllCompleted()) {
            progressSink.tryEmitComplete();
            failureSink.tryEmitComplete();
            completion.complete(new DownloadSummary(total, completed, List.copyOf(failures)));
        }
    }
}
