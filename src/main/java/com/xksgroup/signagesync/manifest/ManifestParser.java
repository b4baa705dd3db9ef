package com.xksgroup.signagesync.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.signagesync.exception.ManifestFormatException;
import com.xksgroup.signagesync.model.DeviceInfo;
import com.xksgroup.signagesync.model.Playlist;
import com.xksgroup.signagesync.model.Video;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a remote content manifest into {@link Playlist} and {@link Video} records.
 * <p>
 * Two shapes are accepted: the CMS envelope {@code {"data": [...]}} whose entries carry
 * {@code beginTime/endTime} and nested {@code assets}, and a flat array of playlists carrying
 * {@code startTime/endTime/videoIds} directly. A single malformed asset or playlist is skipped
 * with a warning; an unrecognized top-level shape fails the whole parse.
 */
@Slf4j
@Component
public class ManifestParser {

    static final String UNTITLED_VIDEO = "Untitled Video";
    private static final LocalTime DEFAULT_BEGIN = LocalTime.of(0, 0);
    private static final LocalTime DEFAULT_END = LocalTime.of(23, 59);

    private final ObjectMapper objectMapper;
    private final String assetsBaseUrl;

    public ManifestParser(ObjectMapper objectMapper,
                          @Value("${content.api.assets-base-url:}") String assetsBaseUrl) {
        this.objectMapper = objectMapper;
        this.assetsBaseUrl = assetsBaseUrl;
    }

    public ParsedManifest parse(String json) {
        return parse(json, null);
    }

    /**
     * Parse a manifest, keeping only playlists assigned to {@code deviceFilter} when one is given.
     */
    public ParsedManifest parse(String json, DeviceInfo deviceFilter) {
        JsonNode root = readTree(json);

        if (root.isObject() && root.path("data").isArray()) {
            return parseEnveloped(root.get("data"), deviceFilter);
        }
        if (root.isArray()) {
            return parseFlat(root, deviceFilter);
        }
        throw new ManifestFormatException("Unsupported manifest shape: expected a playlist array or an object with a 'data' array, got "
                + root.getNodeType());
    }

    private JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            throw new ManifestFormatException("Manifest document is empty");
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || root.isMissingNode()) {
                throw new ManifestFormatException("Manifest document is empty");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ManifestFormatException("Manifest is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private ParsedManifest parseEnveloped(JsonNode data, DeviceInfo deviceFilter) {
        List<Playlist> playlists = new ArrayList<>();
        Map<String, Video> videos = new LinkedHashMap<>();
        int skipped = 0;

        for (JsonNode entry : data) {
            if (!entry.isObject()) {
                log.warn("Skipping manifest entry that is not an object: {}", entry);
                skipped++;
                continue;
            }
            String playlistId = text(entry, "id");
            if (playlistId == null) {
                log.warn("Skipping playlist without id");
                skipped++;
                continue;
            }

            String deviceId = text(entry.path("device"), "device_id");
            String deviceName = text(entry.path("device"), "device_name");
            if (!matchesDevice(deviceFilter, deviceId, deviceName)) {
                log.debug("Playlist {} is assigned to another device, skipping", playlistId);
                continue;
            }

            LocalTime begin;
            LocalTime end;
            try {
                begin = parseTime(text(entry, "beginTime"), DEFAULT_BEGIN);
                end = parseTime(text(entry, "endTime"), DEFAULT_END);
            } catch (DateTimeParseException e) {
                log.warn("Skipping playlist {}: unreadable time window ({})", playlistId, e.getParsedString());
                skipped++;
                continue;
            }

            List<String> videoIds = new ArrayList<>();
            for (JsonNode asset : entry.path("assets")) {
                Video video = toVideo(playlistId, asset);
                if (video == null) {
                    skipped++;
                    continue;
                }
                videoIds.add(video.getId());
                videos.putIfAbsent(video.getId(), video);
            }

            Playlist playlist = Playlist.builder()
                    .id(playlistId)
                    .title(text(entry, "title"))
                    .startTime(begin)
                    .endTime(end)
                    .active(entry.path("active").asBoolean(true))
                    .order(integer(entry, "order"))
                    .portrait(entry.path("portrait").asBoolean(true))
                    .deviceId(deviceId)
                    .deviceName(deviceName)
                    .videoIds(videoIds)
                    .build();
            playlists.add(playlist);
            log.debug("Parsed playlist {} {}-{} with {} videos", playlistId, begin, end, videoIds.size());
        }

        log.info("Parsed manifest: {} playlists, {} videos, {} skipped entries",
                playlists.size(), videos.size(), skipped);
        return new ParsedManifest(playlists, new ArrayList<>(videos.values()), skipped);
    }

    private Video toVideo(String playlistId, JsonNode asset) {
        JsonNode media = asset.path("media_assets_id");
        if (!media.isObject()) {
            log.warn("Skipping asset without media in playlist {}", playlistId);
            return null;
        }
        JsonNode file = media.path("file");
        String videoId = text(file, "id");
        if (videoId == null) {
            log.warn("Skipping asset with no file id in playlist {}", playlistId);
            return null;
        }
        String fileName = text(file, "filename_disk");
        if (fileName == null) {
            log.warn("Skipping video {} with no filename in playlist {}", videoId, playlistId);
            return null;
        }
        String baseUrl = text(media, "fileUrl");
        if (baseUrl == null) {
            if (assetsBaseUrl == null || assetsBaseUrl.isBlank()) {
                log.warn("Skipping video {}: no fileUrl and no assets base URL configured", videoId);
                return null;
            }
            baseUrl = assetsBaseUrl;
        }

        String title = text(media, "title");
        return Video.builder()
                .id(videoId)
                .name(title != null ? title : UNTITLED_VIDEO)
                .url(joinUrl(baseUrl, fileName))
                .order(integer(asset, "order"))
                .downloaded(false)
                .build();
    }

    private ParsedManifest parseFlat(JsonNode root, DeviceInfo deviceFilter) {
        List<Playlist> playlists = new ArrayList<>();
        Map<String, Video> videos = new LinkedHashMap<>();
        int skipped = 0;

        for (JsonNode entry : root) {
            String playlistId = entry.isObject() ? text(entry, "id") : null;
            if (playlistId == null) {
                log.warn("Skipping flat manifest entry without id: {}", entry);
                skipped++;
                continue;
            }

            String deviceId = text(entry, "device_id");
            String deviceName = text(entry, "device_name");
            if (!matchesDevice(deviceFilter, deviceId, deviceName)) {
                continue;
            }

            LocalTime start;
            LocalTime end;
            try {
                start = parseTime(text(entry, "startTime"), DEFAULT_BEGIN);
                end = parseTime(text(entry, "endTime"), DEFAULT_END);
            } catch (DateTimeParseException e) {
                log.warn("Skipping playlist {}: unreadable time window ({})", playlistId, e.getParsedString());
                skipped++;
                continue;
            }

            List<String> videoIds = new ArrayList<>();
            for (JsonNode id : entry.path("videoIds")) {
                if (id.isValueNode() && !id.isNull()) {
                    videoIds.add(id.asText());
                } else {
                    skipped++;
                }
            }

            for (JsonNode declared : entry.path("videos")) {
                String videoId = text(declared, "id");
                String url = text(declared, "url");
                if (videoId == null || url == null) {
                    log.warn("Skipping video declaration without id or url in playlist {}", playlistId);
                    skipped++;
                    continue;
                }
                String name = text(declared, "name");
                videos.putIfAbsent(videoId, Video.builder()
                        .id(videoId)
                        .name(name != null ? name : UNTITLED_VIDEO)
                        .url(url)
                        .order(integer(declared, "order"))
                        .build());
            }

            playlists.add(Playlist.builder()
                    .id(playlistId)
                    .title(text(entry, "title"))
                    .startTime(start)
                    .endTime(end)
                    .active(entry.path("active").asBoolean(true))
                    .order(integer(entry, "order"))
                    .portrait(entry.path("portrait").asBoolean(true))
                    .deviceId(deviceId)
                    .deviceName(deviceName)
                    .videoIds(videoIds)
                    .build());
        }

        log.info("Parsed flat manifest: {} playlists, {} videos, {} skipped entries",
                playlists.size(), videos.size(), skipped);
        return new ParsedManifest(playlists, new ArrayList<>(videos.values()), skipped);
    }

    private static boolean matchesDevice(DeviceInfo filter, String deviceId, String deviceName) {
        if (filter == null) {
            return true;
        }
        return deviceName != null
                && Objects.equals(filter.getDeviceId(), deviceId)
                && Objects.equals(filter.getDeviceName(), deviceName);
    }

    /**
     * Accepts {@code HH:MM} or {@code HH:MM:SS}; seconds are dropped.
     */
    static LocalTime parseTime(String value, LocalTime fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String trimmed = value.trim();
        String[] parts = trimmed.split(":");
        if (parts.length < 2) {
            return LocalTime.parse(trimmed);
        }
        String hour = parts[0].length() == 1 ? "0" + parts[0] : parts[0];
        return LocalTime.parse(hour + ":" + parts[1]);
    }

    /**
     * Joins a base URL and a file name with exactly one slash between them.
     */
    static String joinUrl(String baseUrl, String fileName) {
        String base = baseUrl;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String name = fileName;
        while (name.startsWith("/")) {
            name = name.substring(1);
        }
        return base + "/" + name;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.canConvertToInt() ? value.asInt() : null;
    }
}
