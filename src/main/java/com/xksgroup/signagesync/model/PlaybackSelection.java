package com.xksgroup.signagesync.model;

import java.util.List;

/**
 * The playlist chosen for "now" and the local files to play, in order.
 */
public record PlaybackSelection(
        String playlistId,
        boolean portrait,
        List<String> files
) {}
