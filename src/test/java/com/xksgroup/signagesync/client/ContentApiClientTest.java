package com.xksgroup.signagesync.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.signagesync.exception.TransportException;
import com.xksgroup.signagesync.model.ChangelogEntry;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentApiClientTest {

    private MockWebServer server;
    private ContentApiClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        client = new ContentApiClient(new OkHttpClient(), new ChangelogParser(new ObjectMapper()),
                server.url("/").toString(), "/items/media_playlist", "items/changelog", "signage-test", "secret");
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void fetchesManifestWithFieldSelection() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"data\": []}"));

        String body = client.fetchManifest();

        assertThat(body).isEqualTo("{\"data\": []}");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/items/media_playlist");
        assertThat(request.getRequestUrl().queryParameter("fields")).isEqualTo(ContentApiClient.MANIFEST_FIELDS);
        assertThat(request.getHeader("User-Agent")).isEqualTo("signage-test");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret");
    }

    @Test
    void asksOnlyForNewestChangelogEntry() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"data\": [{\"id\": 22, \"date_created\": \"2024-05-01T09:00:00\"}]}"));

        Optional<ChangelogEntry> latest = client.fetchLatestChangelog();

        assertThat(latest).map(ChangelogEntry::getId).contains("22");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/items/changelog");
        assertThat(request.getRequestUrl().queryParameter("limit")).isEqualTo("1");
        assertThat(request.getRequestUrl().queryParameter("sort")).isEqualTo("-date_created");
    }

    @Test
    void non2xxBecomesTransportException() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> client.fetchManifest())
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("503");
    }

    @Test
    void connectionFailureBecomesTransportException() throws Exception {
        server.shutdown();

        assertThatThrownBy(() -> client.fetchLatestChangelog()).isInstanceOf(TransportException.class);
    }
}
