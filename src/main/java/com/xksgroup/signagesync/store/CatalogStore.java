package com.xksgroup.signagesync.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.signagesync.model.Playlist;
import com.xksgroup.signagesync.model.Video;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable catalog of playlists and videos with their download state.
 * <p>
 * Every write re-encodes playlists and videos together as one {@link StoredCatalog} value, so a
 * failed write leaves the previous catalog intact. Writers are serialized on a single lock. Readers get the last committed {@link CatalogSnapshot} without blocking.
 */
@Slf4j
@Service
public class CatalogStore {

    static final String KEY_CATALOG = "catalog";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile CatalogSnapshot snapshot;

    public CatalogStore(KeyValueStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    /**
     * Replace the playlist set and the video set in one write.
     * Videos whose id already exists keep their download state; everything the manifest
     * declares (url, name, order) comes from the new record. Ids missing from the new set are dropped.
     *
     * @return the merged video records
     */
    public List<Video> merge(List<Playlist> newPlaylists, List<Video> newVideos) {
        writeLock.lock();
        try {
            Map<String, Video> existing = snapshot().videosById();
            List<Video> merged = new ArrayList<>(newVideos.size());
            int carried = 0;

            for (Video incoming : newVideos) {
                Video previous = existing.get(incoming.getId());
                Video.VideoBuilder builder = incoming.toBuilder();
                if (previous != null) {
                    builder.downloaded(previous.isDownloaded()).localPath(previous.getLocalPath());
                    if (previous.isDownloaded()) {
                        carried++;
                    }
                } else {
                    builder.downloaded(false).localPath(null);
                }
                merged.add(builder.build());
            }

            int dropped = (int) existing.keySet().stream()
                    .filter(id -> newVideos.stream().noneMatch(v -> id.equals(v.getId())))
                    .count();

            write(newPlaylists, merged);
            log.info("Catalog merged: {} playlists, {} videos ({} already downloaded, {} dropped)",
                    newPlaylists.size(), merged.size(), carried, dropped);
            return copyVideos(merged);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Videos that still need a fetch. A record flagged as downloaded whose file vanished or is
     * empty counts as undownloaded and its flag is cleared.
     */
    public List<Video> listUndownloaded() {
        writeLock.lock();
        try {
            CatalogSnapshot current = snapshot();
            List<Video> videos = copyVideos(current.videosById().values());
            List<Video> pending = new ArrayList<>();
            boolean stale = false;

            for (Video video : videos) {
                if (video.isDownloaded() && !isUsableFile(video.getLocalPath())) {
                    log.warn("Video {} was marked downloaded but {} is missing or empty, scheduling again",
                            video.getId(), video.getLocalPath());
                    video.setDownloaded(false);
                    video.setLocalPath(null);
                    stale = true;
                }
                if (!video.isDownloaded()) {
                    pending.add(video);
                }
            }

            if (stale) {
                write(current.playlists(), videos);
            }
            return copyVideos(pending);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * The only mutation that flags a video as downloaded.
     *
     * @return false when the id is no longer in the catalog
     */
    public boolean markDownloaded(String videoId, String localPath) {
        if (localPath == null || localPath.isBlank()) {
            throw new IllegalArgumentException("localPath is required to mark video " + videoId + " as downloaded");
        }
        writeLock.lock();
        try {
            CatalogSnapshot current = snapshot();
            if (!current.videosById().containsKey(videoId)) {
                log.warn("Video {} finished downloading but is no longer in the catalog", videoId);
                return false;
            }

            List<Video> videos = copyVideos(current.videosById().values());
            for (Video video : videos) {
                if (videoId.equals(video.getId())) {
                    video.setDownloaded(true);
                    video.setLocalPath(localPath);
                }
            }
            write(current.playlists(), videos);
            log.debug("Video {} marked downloaded at {}", videoId, localPath);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    public List<Playlist> getPlaylists() {
        return snapshot().playlists();
    }

    public List<Video> getVideos() {
        return copyVideos(snapshot().videosById().values());
    }

    public Optional<Video> findVideo(String videoId) {
        return Optional.ofNullable(snapshot().videosById().get(videoId)).map(v -> v.toBuilder().build());
    }

    /**
     * Last committed state. Loaded from the durable store on first access.
     */
    public CatalogSnapshot snapshot() {
        CatalogSnapshot current = snapshot;
        if (current == null) {
            writeLock.lock();
            try {
                if (snapshot == null) {
                    StoredCatalog stored = read();
                    snapshot = toSnapshot(stored.playlists(), stored.videos());
                    log.info("Catalog loaded: {} playlists, {} videos",
                            snapshot.playlists().size(), snapshot.videosById().size());
                }
                current = snapshot;
            } finally {
                writeLock.unlock();
            }
        }
        return current;
    }

    /**
     * Single put; the snapshot only moves once the store accepted the value.
     */
    private void write(List<Playlist> playlists, List<Video> videos) {
        String json;
        try {
            json = objectMapper.writeValueAsString(new StoredCatalog(playlists, videos));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode catalog", e);
        }
        store.put(KEY_CATALOG, json);
        snapshot = toSnapshot(playlists, videos);
    }

    private StoredCatalog read() {
        Optional<String> json = store.get(KEY_CATALOG);
        if (json.isEmpty() || json.get().isBlank()) {
            return StoredCatalog.EMPTY;
        }
        try {
            StoredCatalog stored = objectMapper.readValue(json.get(), StoredCatalog.class);
            return stored != null ? stored : StoredCatalog.EMPTY;
        } catch (IOException e) {
            log.error("Stored catalog is corrupt, discarding it: {}", e.getMessage());
            store.remove(KEY_CATALOG);
            return StoredCatalog.EMPTY;
        }
    }

    /**
     * Persisted form of the catalog. Missing collections read back as empty.
     */
    record StoredCatalog(List<Playlist> playlists, List<Video> videos) {

        static final StoredCatalog EMPTY = new StoredCatalog(List.of(), List.of());

        StoredCatalog {
            playlists = playlists != null ? playlists : List.of();
            videos = videos != null ? videos : List.of();
        }
    }

    private static CatalogSnapshot toSnapshot(List<Playlist> playlists, List<Video> videos) {
        List<Playlist> playlistCopies = new ArrayList<>(playlists.size());
        for (Playlist playlist : playlists) {
            playlistCopies.add(playlist.toBuilder()
                    .videoIds(List.copyOf(playlist.getVideoIds() != null ? playlist.getVideoIds() : List.of()))
                    .build());
        }
        Map<String, Video> byId = new LinkedHashMap<>();
        for (Video video : videos) {
            byId.put(video.getId(), video.toBuilder().build());
        }
        return new CatalogSnapshot(Collections.unmodifiableList(playlistCopies), Collections.unmodifiableMap(byId));
    }

    private static List<Video> copyVideos(Iterable<Video> videos) {
        List<Video> copies = new ArrayList<>();
        for (Video video : videos) {
            copies.add(video.toBuilder().build());
        }
        return copies;
    }

    static boolean isUsableFile(String localPath) {
        if (localPath == null || localPath.isBlank()) {
            return false;
        }
        try {
            Path path = Paths.get(localPath);
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException | RuntimeException e) {
            return false;
        }
    }
}
