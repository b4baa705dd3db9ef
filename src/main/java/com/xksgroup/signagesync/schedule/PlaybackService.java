package com.xksgroup.signagesync.schedule;

import com.xksgroup.signagesync.device.DeviceInfoProvider;
import com.xksgroup.signagesync.model.PlaybackSelection;
import com.xksgroup.signagesync.store.CatalogSnapshot;
import com.xksgroup.signagesync.store.CatalogStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalTime;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlaybackService {

    private final CatalogStore catalogStore;
    private final PlaybackScheduler scheduler;
    private final DeviceInfoProvider deviceInfoProvider;
    private final Clock playbackClock;

    /**
     * What the player should be showing right now, or empty when nothing is scheduled
     * or the device is deactivated.
     */
    public Optional<PlaybackSelection> current() {
        if (!deviceInfoProvider.currentDevice().isActive()) {
            log.debug("Device is inactive, no playback scheduled");
            return Optional.empty();
        }
        CatalogSnapshot snapshot = catalogStore.snapshot();
        return scheduler.selectActive(snapshot.playlists(), snapshot.videosById(), LocalTime.now(playbackClock));
    }
}
