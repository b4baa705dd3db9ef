package com.xksgroup.signagesync.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class MongoKeyValueStore implements KeyValueStore {

    private final KeyValueEntryRepository repository;

    @Override
    public Optional<String> get(String key) {
        return repository.findById(key).map(KeyValueEntry::getValue);
    }

    @Override
    public void put(String key, String value) {
        repository.save(KeyValueEntry.builder()
                .key(key)
                .value(value)
                .updatedAt(Instant.now())
                .build());
        log.debug("Stored key {} ({} chars)", key, value != null ? value.length() : 0);
    }

    @Override
    public void remove(String key) {
        repository.deleteById(key);
    }
}
