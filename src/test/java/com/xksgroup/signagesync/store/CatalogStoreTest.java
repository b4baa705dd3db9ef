package com.xksgroup.signagesync.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.signagesync.model.Playlist;
import com.xksgroup.signagesync.model.Video;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogStoreTest {

    @TempDir
    Path mediaDir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private InMemoryKeyValueStore keyValueStore;
    private CatalogStore catalogStore;

    @BeforeEach
    void setUp() {
        keyValueStore = new InMemoryKeyValueStore();
        catalogStore = new CatalogStore(keyValueStore, objectMapper);
    }

    @Test
    void mergeKeepsDownloadStateForSurvivingIdsAndDropsTheRest() throws Exception {
        Path file = Files.writeString(mediaDir.resolve("video_1.mp4"), "bytes");
        catalogStore.merge(List.of(playlist("p1", "1", "2")), List.of(video("1", "http://a/1.mp4"), video("2", "http://a/2.mp4")));
        assertThat(catalogStore.markDownloaded("1", file.toString())).isTrue();

        List<Video> merged = catalogStore.merge(List.of(playlist("p2", "1", "3")),
                List.of(video("1", "http://b/1.mp4"), video("3", "http://b/3.mp4")));

        assertThat(merged).extracting(Video::getId).containsExactly("1", "3");
        Video kept = catalogStore.findVideo("1").orElseThrow();
        assertThat(kept.isDownloaded()).isTrue();
        assertThat(kept.getLocalPath()).isEqualTo(file.toString());
        assertThat(kept.getUrl()).isEqualTo("http://b/1.mp4");
        assertThat(catalogStore.findVideo("2")).isEmpty();
        assertThat(catalogStore.findVideo("3").orElseThrow().isDownloaded()).isFalse();
        assertThat(catalogStore.getPlaylists()).extracting(Playlist::getId).containsExactly("p2");
    }

    @Test
    void catalogSurvivesReload() throws Exception {
        Path file = Files.writeString(mediaDir.resolve("video_1.mp4"), "bytes");
        catalogStore.merge(List.of(playlist("p1", "1")), List.of(video("1", "http://a/1.mp4")));
        catalogStore.markDownloaded("1", file.toString());

        CatalogStore reloaded = new CatalogStore(keyValueStore, objectMapper);

        assertThat(reloaded.getPlaylists()).hasSize(1);
        Playlist playlist = reloaded.getPlaylists().get(0);
        assertThat(playlist.getStartTime()).isEqualTo(LocalTime.of(8, 0));
        assertThat(playlist.getVideoIds()).containsExactly("1");
        assertThat(reloaded.findVideo("1").orElseThrow().isDownloaded()).isTrue();
    }

    @Test
    void listUndownloadedClearsFlagWhenFileIsGone() throws Exception {
        Path file = Files.writeString(mediaDir.resolve("video_1.mp4"), "bytes");
        catalogStore.merge(List.of(playlist("p1", "1", "2")), List.of(video("1", "http://a/1.mp4"), video("2", "http://a/2.mp4")));
        catalogStore.markDownloaded("1", file.toString());

        assertThat(catalogStore.listUndownloaded()).extracting(Video::getId).containsExactly("2");

        Files.delete(file);

        assertThat(catalogStore.listUndownloaded()).extracting(Video::getId).containsExactlyInAnyOrder("1", "2");
        assertThat(new CatalogStore(keyValueStore, objectMapper).findVideo("1").orElseThrow().isDownloaded()).isFalse();
    }

    @Test
    void markDownloadedRejectsBlankPathAndUnknownId() {
        catalogStore.merge(List.of(), List.of(video("1", "http://a/1.mp4")));

        assertThatThrownBy(() -> catalogStore.markDownloaded("1", " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(catalogStore.markDownloaded("missing", "/tmp/x.mp4")).isFalse();
        assertThat(catalogStore.findVideo("1").orElseThrow().isDownloaded()).isFalse();
    }

    @Test
    void corruptEntryIsDiscardedAndTreatedAsEmpty() {
        keyValueStore.put(CatalogStore.KEY_CATALOG, "{not json");

        assertThat(catalogStore.getVideos()).isEmpty();
        assertThat(catalogStore.getPlaylists()).isEmpty();
        assertThat(keyValueStore.contains(CatalogStore.KEY_CATALOG)).isFalse();
    }

    @Test
    void failedWriteLeavesPreviousCatalogWhole() {
        FailingKeyValueStore failing = new FailingKeyValueStore();
        CatalogStore store = new CatalogStore(failing, objectMapper);
        store.merge(List.of(playlist("p1", "a")), List.of(video("a", "http://a/a.mp4")));

        failing.failPuts = true;
        assertThatThrownBy(() -> store.merge(List.of(playlist("p2", "b")), List.of(video("b", "http://a/b.mp4"))))
                .isInstanceOf(IllegalStateException.class);

        assertThat(store.getPlaylists()).extracting(Playlist::getId).containsExactly("p1");
        assertThat(store.getVideos()).extracting(Video::getId).containsExactly("a");

        failing.failPuts = false;
        CatalogStore reloaded = new CatalogStore(failing, objectMapper);
        assertThat(reloaded.getPlaylists()).extracting(Playlist::getId).containsExactly("p1");
        assertThat(reloaded.getPlaylists().get(0).getVideoIds()).containsExactly("a");
        assertThat(reloaded.getVideos()).extracting(Video::getId).containsExactly("a");
    }

    @Test
    void playlistsAndVideosAreStoredAsOneValue() {
        catalogStore.merge(List.of(playlist("p1", "a")), List.of(video("a", "http://a/a.mp4")));

        assertThat(keyValueStore.get(CatalogStore.KEY_CATALOG)).hasValueSatisfying(json ->
                assertThat(json).contains("\"playlists\"").contains("\"videos\""));
    }

    @Test
    void returnedRecordsAreCopies() {
        catalogStore.merge(List.of(), List.of(video("1", "http://a/1.mp4")));

        catalogStore.getVideos().get(0).setDownloaded(true);

        assertThat(catalogStore.findVideo("1").orElseThrow().isDownloaded()).isFalse();
    }

    private static class FailingKeyValueStore extends InMemoryKeyValueStore {

        private boolean failPuts;

        @Override
        public void put(String key, String value) {
            if (failPuts) {
                throw new IllegalStateException("store unavailable");
            }
            super.put(key, value);
        }
    }

    private static Video video(String id, String url) {
        return Video.builder().id(id).name("Video " + id).url(url).build();
    }

    private static Playlist playlist(String id, String... videoIds) {
        return Playlist.builder()
                .id(id)
                .title("Playlist " + id)
                .startTime(LocalTime.of(8, 0))
                .endTime(LocalTime.of(18, 0))
                .videoIds(List.of(videoIds))
                .build();
    }
}
