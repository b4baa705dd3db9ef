package com.xksgroup.signagesync.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.signagesync.exception.ManifestFormatException;
import com.xksgroup.signagesync.model.ChangelogEntry;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChangelogParserTest {

    private final ChangelogParser parser = new ChangelogParser(new ObjectMapper());

    @Test
    void readsNewestEntry() {
        Optional<ChangelogEntry> latest = parser.parseLatest("""
                {"data": [
                  {"id": 23, "date_created": "2024-05-02T09:00:00", "log": "new promo", "user_created": "x"},
                  {"id": 22, "date_created": "2024-05-01T09:00:00"}
                ]}
                """);

        assertThat(latest).isPresent();
        assertThat(latest.get().getId()).isEqualTo("23");
        assertThat(latest.get().getDateCreated()).isEqualTo("2024-05-02T09:00:00");
        assertThat(latest.get().getLog()).isEqualTo("new promo");
    }

    @Test
    void emptyChangelogHasNoLatestEntry() {
        assertThat(parser.parseLatest("{\"data\": []}")).isEmpty();
    }

    @Test
    void rejectsResponsesWithoutDataArray() {
        assertThatThrownBy(() -> parser.parseLatest("{\"errors\": []}")).isInstanceOf(ManifestFormatException.class);
        assertThatThrownBy(() -> parser.parseLatest("<html>")).isInstanceOf(ManifestFormatException.class);
    }

    @Test
    void rejectsEntryWithoutIdOrDate() {
        assertThatThrownBy(() -> parser.parseLatest("{\"data\": [{\"log\": \"?\"}]}"))
                .isInstanceOf(ManifestFormatException.class);
    }
}
