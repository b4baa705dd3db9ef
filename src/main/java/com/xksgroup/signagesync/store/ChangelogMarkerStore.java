package com.xksgroup.signagesync.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.signagesync.model.ChangelogMarker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChangelogMarkerStore {

    static final String KEY_MARKER = "changelog.marker";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;

    public Optional<ChangelogMarker> load() {
        Optional<String> json = store.get(KEY_MARKER);
        if (json.isEmpty() || json.get().isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(json.get(), ChangelogMarker.class));
        } catch (JsonProcessingException e) {
            log.error("Stored changelog marker is corrupt, discarding it: {}", e.getMessage());
            store.remove(KEY_MARKER);
            return Optional.empty();
        }
    }

    public void save(ChangelogMarker marker) {
        try {
            store.put(KEY_MARKER, objectMapper.writeValueAsString(marker));
            log.info("Changelog marker advanced to id={} created={}", marker.getChangelogId(), marker.getDateCreated());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode changelog marker", e);
        }
    }
}
