package com.xksgroup.signagesync.sync;

import com.xksgroup.signagesync.client.ContentApiClient;
import com.xksgroup.signagesync.device.DeviceInfoProvider;
import com.xksgroup.signagesync.download.DownloadOrchestrator;
import com.xksgroup.signagesync.download.DownloadSession;
import com.xksgroup.signagesync.download.MediaStorage;
import com.xksgroup.signagesync.exception.ManifestFormatException;
import com.xksgroup.signagesync.exception.TransportException;
import com.xksgroup.signagesync.manifest.ManifestParser;
import com.xksgroup.signagesync.manifest.ParsedManifest;
import com.xksgroup.signagesync.model.DeviceInfo;
import com.xksgroup.signagesync.model.Video;
import com.xksgroup.signagesync.model.sync.DownloadSummary;
import com.xksgroup.signagesync.model.sync.PollOutcome;
import com.xksgroup.signagesync.model.sync.SyncEvent;
import com.xksgroup.signagesync.model.sync.SyncReport;
import com.xksgroup.signagesync.store.CatalogStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;

/**
 * One full reconciliation: manifest fetch, parse, catalog merge, downloads, orphan cleanup.
 * <p>
 * Callers are responsible for not running two syncs at once; {@link ChangePoller} owns that flag.
 */
@Slf4j
@Service
public class SyncService {

    private final ContentApiClient contentApiClient;
    private final ManifestParser manifestParser;
    private final CatalogStore catalogStore;
    private final DownloadOrchestrator downloadOrchestrator;
    private final MediaStorage mediaStorage;
    private final DeviceInfoProvider deviceInfoProvider;

    private final boolean deviceFilterEnabled;
    private final boolean cleanupOrphans;

    private final Sinks.Many<SyncEvent> events = Sinks.many().multicast().directBestEffort();
    private volatile SyncReport lastReport;

    public SyncService(ContentApiClient contentApiClient,
                       ManifestParser manifestParser,
                       CatalogStore catalogStore,
                       DownloadOrchestrator downloadOrchestrator,
                       MediaStorage mediaStorage,
                       DeviceInfoProvider deviceInfoProvider,
                       @Value("${content.device-filter.enabled:false}") boolean deviceFilterEnabled,
                       @Value("${download.cleanup-orphans:true}") boolean cleanupOrphans) {
        this.contentApiClient = contentApiClient;
        this.manifestParser = manifestParser;
        this.catalogStore = catalogStore;
        this.downloadOrchestrator = downloadOrchestrator;
        this.mediaStorage = mediaStorage;
        this.deviceInfoProvider = deviceInfoProvider;
        this.deviceFilterEnabled = deviceFilterEnabled;
        this.cleanupOrphans = cleanupOrphans;
    }

    /**
     * Stream of sync lifecycle events. Hot: subscribers only see what happens after they subscribe.
     */
    public Flux<SyncEvent> events() {
        return events.asFlux();
    }

    public Optional<SyncReport> getLastReport() {
        return Optional.ofNullable(lastReport);
    }

    /**
     * Run the whole pipeline and block until every pending download has resolved.
     * A manifest that cannot be fetched or parsed leaves the catalog untouched.
     */
    public SyncReport runFullSync(String trigger) {
        Instant startedAt = Instant.now();
        log.info("Sync started (trigger: {})", trigger);
        publish(SyncEvent.SYNC_STARTED, Map.of("trigger", trigger));

        ParsedManifest manifest;
        try {
            String document = contentApiClient.fetchManifest();
            manifest = manifestParser.parse(document, deviceFilter());
        } catch (TransportException | ManifestFormatException e) {
            log.error("Sync aborted, keeping the previous catalog: {}", e.getMessage());
            return finish(SyncReport.builder()
                    .outcome(PollOutcome.SYNC_FAILED)
                    .trigger(trigger)
                    .failures(List.of())
                    .errorMessage(e.getMessage())
                    .startedAt(startedAt)
                    .build());
        }

        catalogStore.merge(manifest.playlists(), manifest.videos());
        List<Video> pending = catalogStore.listUndownloaded();

        DownloadSession session = downloadOrchestrator.syncDownloads(pending);
        session.progress().subscribe(progress -> publish(SyncEvent.DOWNLOAD_PROGRESS, progress));
        session.failures().subscribe(failure -> publish(SyncEvent.DOWNLOAD_FAILED, failure));

        DownloadSummary summary;
        try {
            summary = session.completion().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Sync interrupted while waiting for downloads");
            return finish(SyncReport.builder()
                    .outcome(PollOutcome.SYNC_FAILED)
                    .trigger(trigger)
                    .playlistCount(manifest.playlists().size())
                    .videoCount(manifest.videos().size())
                    .downloadsAttempted(session.getTotal())
                    .failures(List.of())
                    .errorMessage("interrupted")
                    .startedAt(startedAt)
                    .build());
        } catch (ExecutionException | CancellationException e) {
            throw new IllegalStateException("Download session ended abnormally", e);
        }

        if (cleanupOrphans) {
            mediaStorage.removeOrphans(referencedFiles());
        }

        PollOutcome outcome = summary.isFullSuccess() ? PollOutcome.SYNCED : PollOutcome.SYNC_PARTIAL;
        SyncReport report = SyncReport.builder()
                .outcome(outcome)
                .trigger(trigger)
                .playlistCount(manifest.playlists().size())
                .videoCount(manifest.videos().size())
                .downloadsAttempted(summary.total())
                .downloadsCompleted(summary.completed())
                .failures(summary.failures())
                .startedAt(startedAt)
                .build();

        if (outcome == PollOutcome.SYNC_PARTIAL) {
            log.warn("Sync finished with {} failed downloads out of {}", summary.failures().size(), summary.total());
        }
        return finish(report);
    }

    private SyncReport finish(SyncReport report) {
        report.setFinishedAt(Instant.now());
        lastReport = report;
        if (report.getOutcome() == PollOutcome.SYNC_FAILED) {
            publish(SyncEvent.SYNC_FAILED, report);
        } else {
            publish(SyncEvent.CATALOG_READY, report);
        }
        log.info("Sync finished: {} ({} playlists, {}/{} downloads)", report.getOutcome(),
                report.getPlaylistCount(), report.getDownloadsCompleted(), report.getDownloadsAttempted());
        return report;
    }

    private DeviceInfo deviceFilter() {
        if (!deviceFilterEnabled) {
            return null;
        }
        DeviceInfo device = deviceInfoProvider.currentDevice();
        if (device.getDeviceName() == null || device.getDeviceName().isBlank()) {
            log.warn("Device filter enabled but no device name configured, keeping every playlist");
            return null;
        }
        return device;
    }

    private Set<Path> referencedFiles() {
        Set<Path> keep = new HashSet<>();
        for (Video video : catalogStore.getVideos()) {
            keep.add(mediaStorage.pathFor(video.getId()));
            if (video.getLocalPath() != null) {
                keep.add(Paths.get(video.getLocalPath()));
            }
        }
        return keep;
    }

    private synchronized void publish(String type, Object payload) {
        events.tryEmitNext(SyncEvent.of(type, payload));
    }
}
