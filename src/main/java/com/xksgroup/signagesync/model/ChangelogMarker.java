package com.xksgroup.signagesync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangelogMarker {

    private String changelogId;
    private String dateCreated;
    private Instant syncedAt;

    public static ChangelogMarker of(ChangelogEntry entry, Instant syncedAt) {
        return ChangelogMarker.builder()
                .changelogId(entry.getId())
                .dateCreated(entry.getDateCreated())
                .syncedAt(syncedAt)
                .build();
    }

    /**
     * True when the given entry is the one this marker was recorded from.
     */
    public boolean matches(ChangelogEntry entry) {
        return Objects.equals(changelogId, entry.getId())
                && Objects.equals(dateCreated, entry.getDateCreated());
    }
}
