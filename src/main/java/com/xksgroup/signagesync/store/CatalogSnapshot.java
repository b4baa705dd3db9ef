package com.xksgroup.signagesync.store;

import com.xksgroup.signagesync.model.Playlist;
import com.xksgroup.signagesync.model.Video;

import java.util.List;
import java.util.Map;

/**
 * Last committed catalog state. Both collections are unmodifiable.
 */
public record CatalogSnapshot(
        List<Playlist> playlists,
        Map<String, Video> videosById
) {

    public static CatalogSnapshot empty() {
        return new CatalogSnapshot(List.of(), Map.of());
    }
}
