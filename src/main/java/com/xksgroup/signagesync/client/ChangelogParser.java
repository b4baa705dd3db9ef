package com.xksgroup.signagesync.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.signagesync.exception.ManifestFormatException;
import com.xksgroup.signagesync.model.ChangelogEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads the newest entry of a {@code {"data": [...]}} changelog response (sorted newest first).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChangelogParser {

    private final ObjectMapper objectMapper;

    public Optional<ChangelogEntry> parseLatest(String json) {
        if (json == null || json.isBlank()) {
            throw new ManifestFormatException("Empty changelog response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ManifestFormatException("Changelog is not valid JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode data = root != null ? root.path("data") : null;
        if (data == null || !data.isArray()) {
            throw new ManifestFormatException("Changelog response has no 'data' array");
        }
        if (data.isEmpty()) {
            log.warn("Changelog is empty, no entries published yet");
            return Optional.empty();
        }

        JsonNode newest = data.get(0);
        ChangelogEntry entry;
        try {
            entry = objectMapper.treeToValue(newest, ChangelogEntry.class);
        } catch (JsonProcessingException e) {
            throw new ManifestFormatException("Unreadable changelog entry: " + e.getOriginalMessage(), e);
        }

        if (isBlank(entry.getId()) && isBlank(entry.getDateCreated())) {
            throw new ManifestFormatException("Newest changelog entry carries neither id nor date_created");
        }
        return Optional.of(entry);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
