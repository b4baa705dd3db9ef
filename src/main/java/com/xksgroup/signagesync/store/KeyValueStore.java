package com.xksgroup.signagesync.store;

import java.util.Optional;

/**
 * Opaque durable string store. Values are whole encoded collections, never partial rows.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void put(String key, String value);

    void remove(String key);
}
