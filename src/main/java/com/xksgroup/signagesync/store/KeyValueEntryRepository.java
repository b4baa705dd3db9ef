package com.xksgroup.signagesync.store;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface KeyValueEntryRepository extends MongoRepository<KeyValueEntry, String> {
}
