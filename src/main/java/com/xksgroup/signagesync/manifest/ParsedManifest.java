package com.xksgroup.signagesync.manifest;

import com.xksgroup.signagesync.model.Playlist;
import com.xksgroup.signagesync.model.Video;

import java.util.List;

public record ParsedManifest(
        List<Playlist> playlists,
        List<Video> videos,
        int skippedEntries
) {}
