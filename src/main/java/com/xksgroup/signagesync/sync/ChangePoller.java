package com.xksgroup.signagesync.sync;

import com.xksgroup.signagesync.client.ContentApiClient;
import com.xksgroup.signagesync.exception.ManifestFormatException;
import com.xksgroup.signagesync.exception.TransportException;
import com.xksgroup.signagesync.model.ChangelogEntry;
import com.xksgroup.signagesync.model.ChangelogMarker;
import com.xksgroup.signagesync.model.sync.PollOutcome;
import com.xksgroup.signagesync.model.sync.PollerState;
import com.xksgroup.signagesync.model.sync.SyncReport;
import com.xksgroup.signagesync.store.ChangelogMarkerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decides when to re-sync by comparing the newest remote changelog entry with the last one synced.
 * <p>
 * The state reference doubles as the sync-in-progress flag: a tick or manual request that finds
 * it anything but {@link PollerState#IDLE} is turned away. The marker only moves after a fully
 * successful sync, and an unreachable changelog never counts as "no change".
 */
@Slf4j
@Service
public class ChangePoller {

    static final String TRIGGER_CHANGELOG = "changelog";
    static final String TRIGGER_MANUAL = "manual";
    static final String TRIGGER_STARTUP = "startup";

    private final ContentApiClient contentApiClient;
    private final ChangelogMarkerStore markerStore;
    private final SyncService syncService;
    private final TaskExecutor taskExecutor;

    private final boolean enabled;
    private final AtomicBoolean startupSyncPending;

    private final AtomicReference<PollerState> state = new AtomicReference<>(PollerState.IDLE);
    private volatile PollOutcome lastOutcome;
    private volatile Instant lastPollAt;

    public ChangePoller(ContentApiClient contentApiClient,
                        ChangelogMarkerStore markerStore,
                        SyncService syncService,
                        @Qualifier("taskExecutor") TaskExecutor taskExecutor,
                        @Value("${poller.enabled:true}") boolean enabled,
                        @Value("${poller.sync-on-startup:true}") boolean syncOnStartup) {
        this.contentApiClient = contentApiClient;
        this.markerStore = markerStore;
        this.syncService = syncService;
        this.taskExecutor = taskExecutor;
        this.enabled = enabled;
        this.startupSyncPending = new AtomicBoolean(syncOnStartup);
    }

    @Scheduled(initialDelayString = "${poller.initial-delay-ms:10000}", fixedDelayString = "${poller.interval-ms:1800000}")
    public void tick() {
        if (!enabled) {
            return;
        }
        if (startupSyncPending.get()) {
            if (state.compareAndSet(PollerState.IDLE, PollerState.POLLING)) {
                startupSyncPending.set(false);
                runClaimed(true, TRIGGER_STARTUP);
            }
            return;
        }
        poll(false);
    }

    /**
     * One poll cycle on the calling thread.
     *
     * @param force sync even when the changelog shows nothing new
     */
    public PollOutcome poll(boolean force) {
        if (!state.compareAndSet(PollerState.IDLE, PollerState.POLLING)) {
            log.info("Poll skipped, a sync is already running (state {})", state.get());
            return PollOutcome.BUSY;
        }
        return runClaimed(force, force ? TRIGGER_MANUAL : TRIGGER_CHANGELOG);
    }

    /**
     * Claim the poller and run a forced sync on the task executor.
     *
     * @return false when a poll or sync is already in progress
     */
    public boolean requestManualSync() {
        if (!state.compareAndSet(PollerState.IDLE, PollerState.POLLING)) {
            log.info("Manual sync rejected, state is {}", state.get());
            return false;
        }
        try {
            taskExecutor.execute(() -> runClaimed(true, TRIGGER_MANUAL));
            return true;
        } catch (TaskRejectedException e) {
            log.warn("Manual sync could not be scheduled: {}", e.getMessage());
            state.set(PollerState.IDLE);
            return false;
        }
    }

    public PollerState getState() {
        return state.get();
    }

    public Optional<PollOutcome> getLastOutcome() {
        return Optional.ofNullable(lastOutcome);
    }

    public Optional<Instant> getLastPollAt() {
        return Optional.ofNullable(lastPollAt);
    }

    private PollOutcome runClaimed(boolean force, String trigger) {
        PollOutcome outcome;
        try {
            outcome = pollAndSync(force, trigger);
        } catch (RuntimeException e) {
            log.error("Unexpected error during poll cycle", e);
            outcome = PollOutcome.SYNC_FAILED;
        } finally {
            lastPollAt = Instant.now();
            state.set(PollerState.IDLE);
        }
        lastOutcome = outcome;
        return outcome;
    }

    private PollOutcome pollAndSync(boolean force, String trigger) {
        Optional<ChangelogEntry> latest;
        try {
            latest = contentApiClient.fetchLatestChangelog();
        } catch (TransportException | ManifestFormatException e) {
            if (!force) {
                log.warn("Changelog poll failed, retrying on next tick: {}", e.getMessage());
                return PollOutcome.POLL_FAILED;
            }
            log.warn("Changelog unavailable ({}), syncing anyway without advancing the marker", e.getMessage());
            latest = Optional.empty();
        }

        Optional<ChangelogMarker> marker = markerStore.load();
        if (!force && !hasChanged(latest, marker)) {
            log.debug("No changelog change since {}", marker.map(ChangelogMarker::getChangelogId).orElse("-"));
            return PollOutcome.NO_CHANGE;
        }

        latest.ifPresent(entry -> log.info("Changelog {} ({}) differs from marker {}, syncing",
                entry.getId(), entry.getDateCreated(), marker.map(ChangelogMarker::getChangelogId).orElse("none")));

        state.set(PollerState.SYNCING);
        SyncReport report = syncService.runFullSync(trigger);

        if (report.isFullSuccess() && latest.isPresent()) {
            markerStore.save(ChangelogMarker.of(latest.get(), Instant.now()));
        } else if (!report.isFullSuccess()) {
            log.warn("Sync outcome {}, changelog marker left unchanged", report.getOutcome());
        }
        return report.getOutcome();
    }

    /**
     * An empty changelog never triggers a sync on its own; a missing marker always does.
     */
    static boolean hasChanged(Optional<ChangelogEntry> latest, Optional<ChangelogMarker> marker) {
        if (latest.isEmpty()) {
            return false;
        }
        return marker.map(m -> !m.matches(latest.get())).orElse(true);
    }
}
