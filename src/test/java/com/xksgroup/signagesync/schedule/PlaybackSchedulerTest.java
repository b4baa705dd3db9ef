package com.xksgroup.signagesync.schedule;

import com.xksgroup.signagesync.model.PlaybackSelection;
import com.xksgroup.signagesync.model.Playlist;
import com.xksgroup.signagesync.model.Video;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PlaybackSchedulerTest {

    private final PlaybackScheduler scheduler = new PlaybackScheduler();

    private final Map<String, Video> videos = Map.of(
            "a", downloaded("a"),
            "b", downloaded("b"),
            "c", Video.builder().id("c").url("http://x/c.mp4").build()
    );

    @Test
    void picksPlaylistCoveringNow() {
        List<Playlist> playlists = List.of(
                playlist("1", "08:00", "12:00", null, "a"),
                playlist("2", "12:00", "18:00", null, "b"));

        Optional<PlaybackSelection> selection = scheduler.selectActive(playlists, videos, LocalTime.of(12, 0, 30));

        assertThat(selection).isPresent();
        assertThat(selection.get().playlistId()).isEqualTo("2");
        assertThat(selection.get().files()).containsExactly("/media/video_b.mp4");
    }

    @Test
    void lowerOrderWinsOverlap() {
        List<Playlist> playlists = List.of(
                playlist("1", "08:00", "18:00", 5, "a"),
                playlist("2", "09:00", "11:00", 1, "b"),
                playlist("3", "09:00", "11:00", null, "a"));

        assertThat(scheduler.selectActive(playlists, videos, LocalTime.of(10, 0)))
                .map(PlaybackSelection::playlistId)
                .contains("2");
    }

    @Test
    void lowerIdBreaksOrderTie() {
        List<Playlist> playlists = List.of(
                playlist("10", "08:00", "18:00", null, "a"),
                playlist("9", "08:00", "18:00", null, "b"));

        assertThat(scheduler.selectActive(playlists, videos, LocalTime.of(10, 0)))
                .map(PlaybackSelection::playlistId)
                .contains("9");
    }

    @Test
    void inactivePlaylistsAreIgnored() {
        Playlist inactive = playlist("1", "00:00", "23:59", null, "a").toBuilder().active(false).build();

        assertThat(scheduler.selectActive(List.of(inactive), videos, LocalTime.of(10, 0))).isEmpty();
    }

    @Test
    void wrappingPlaylistCoversEarlyMorning() {
        List<Playlist> playlists = List.of(playlist("night", "22:00", "08:00", null, "a"));

        assertThat(scheduler.selectActive(playlists, videos, LocalTime.of(2, 0))).isPresent();
        assertThat(scheduler.selectActive(playlists, videos, LocalTime.of(12, 0))).isEmpty();
    }

    @Test
    void undownloadedAndUnknownVideosAreLeftOut() {
        List<Playlist> playlists = List.of(playlist("1", "08:00", "18:00", null, "c", "a", "ghost", "b"));

        PlaybackSelection selection = scheduler.selectActive(playlists, videos, LocalTime.of(10, 0)).orElseThrow();

        assertThat(selection.files()).containsExactly("/media/video_a.mp4", "/media/video_b.mp4");
    }

    @Test
    void playlistWithNothingDownloadedYieldsEmptySequence() {
        List<Playlist> playlists = List.of(playlist("1", "08:00", "18:00", null, "c"));

        PlaybackSelection selection = scheduler.selectActive(playlists, videos, LocalTime.of(10, 0)).orElseThrow();

        assertThat(selection.playlistId()).isEqualTo("1");
        assertThat(selection.files()).isEmpty();
    }

    @Test
    void numericIdsCompareByValue() {
        assertThat(PlaybackScheduler.compareIds("9", "10")).isNegative();
        assertThat(PlaybackScheduler.compareIds("010", "9")).isPositive();
        assertThat(PlaybackScheduler.compareIds("abc", "abd")).isNegative();
    }

    private static Video downloaded(String id) {
        return Video.builder().id(id).url("http://x/" + id + ".mp4")
                .downloaded(true).localPath("/media/video_" + id + ".mp4").build();
    }

    private static Playlist playlist(String id, String start, String end, Integer order, String... videoIds) {
        return Playlist.builder()
                .id(id)
                .startTime(LocalTime.parse(start))
                .endTime(LocalTime.parse(end))
                .order(order)
                .videoIds(List.of(videoIds))
                .build();
    }
}
