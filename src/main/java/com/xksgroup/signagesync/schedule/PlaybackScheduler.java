package com.xksgroup.signagesync.schedule;

import com.xksgroup.signagesync.model.PlaybackSelection;
import com.xksgroup.signagesync.model.Playlist;
import com.xksgroup.signagesync.model.Video;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the playlist to play at a given time of day and resolves it to local files.
 * <p>
 * When several active playlists cover {@code now}, the lowest {@code order} wins (playlists
 * without an order come last), then the lowest id.
 */
@Slf4j
@Component
public class PlaybackScheduler {

    static final Comparator<Playlist> PRIORITY = Comparator
            .comparing(Playlist::getOrder, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Playlist::getId, PlaybackScheduler::compareIds);

    public Optional<PlaybackSelection> selectActive(List<Playlist> playlists, Map<String, Video> videosById, LocalTime now) {
        LocalTime minute = now.truncatedTo(ChronoUnit.MINUTES);

        Optional<Playlist> selected = playlists.stream()
                .filter(Playlist::isActive)
                .filter(p -> TimeWindow.contains(p.getStartTime(), p.getEndTime(), minute))
                .min(PRIORITY);

        if (selected.isEmpty()) {
            log.debug("No active playlist covers {}", minute);
            return Optional.empty();
        }

        Playlist playlist = selected.get();
        return Optional.of(new PlaybackSelection(playlist.getId(), playlist.isPortrait(), resolveFiles(playlist, videosById)));
    }

    /**
     * Local files of the playlist, in playlist order. Videos not downloaded yet are skipped;
     * ids missing from the catalog are dropped with a warning.
     */
    List<String> resolveFiles(Playlist playlist, Map<String, Video> videosById) {
        List<String> files = new ArrayList<>();
        List<String> videoIds = playlist.getVideoIds() != null ? playlist.getVideoIds() : List.of();

        for (String videoId : videoIds) {
            Video video = videosById.get(videoId);
            if (video == null) {
                log.warn("Playlist {} references unknown video {}, dropping it from playback", playlist.getId(), videoId);
                continue;
            }
            if (!video.isDownloaded() || video.getLocalPath() == null) {
                log.debug("Video {} of playlist {} not downloaded yet, skipping", videoId, playlist.getId());
                continue;
            }
            files.add(video.getLocalPath());
        }
        return files;
    }

    static int compareIds(String a, String b) {
        if (isNumeric(a) && isNumeric(b)) {
            int byLength = Integer.compare(stripLeadingZeros(a).length(), stripLeadingZeros(b).length());
            if (byLength != 0) {
                return byLength;
            }
            return stripLeadingZeros(a).compareTo(stripLeadingZeros(b));
        }
        return a.compareTo(b);
    }

    private static boolean isNumeric(String value) {
        return value != null && !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }

    private static String stripLeadingZeros(String value) {
        String stripped = value.replaceFirst("^0+", "");
        return stripped.isEmpty() ? "0" : stripped;
    }
}
