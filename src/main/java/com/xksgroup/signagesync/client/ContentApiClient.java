package com.xksgroup.signagesync.client;

import com.xksgroup.signagesync.exception.TransportException;
import com.xksgroup.signagesync.model.ChangelogEntry;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

/**
 * HTTP access to the content management API: playlist manifest and changelog.
 */
@Slf4j
@Service
public class ContentApiClient {

    static final String MANIFEST_FIELDS = "id,title,active,order,beginTime,endTime,portrait,"
            + "device.device_id,device.device_name,"
            + "assets.order,assets.media_assets_id.id,assets.media_assets_id.title,assets.media_assets_id.fileUrl,"
            + "assets.media_assets_id.file.id,assets.media_assets_id.file.filename_disk";

    private final OkHttpClient httpClient;
    private final ChangelogParser changelogParser;

    private final String baseUrl;
    private final String manifestPath;
    private final String changelogPath;
    private final String userAgent;
    private final String accessToken;

    public ContentApiClient(@Qualifier("contentApiHttpClient") OkHttpClient httpClient,
                            ChangelogParser changelogParser,
                            @Value("${content.api.base-url}") String baseUrl,
                            @Value("${content.api.manifest-path:/items/media_playlist}") String manifestPath,
                            @Value("${content.api.changelog-path:/items/changelog}") String changelogPath,
                            @Value("${content.api.user-agent:signage-sync}") String userAgent,
                            @Value("${content.api.token:}") String accessToken) {
        this.httpClient = httpClient;
        this.changelogParser = changelogParser;
        this.baseUrl = baseUrl;
        this.manifestPath = manifestPath;
        this.changelogPath = changelogPath;
        this.userAgent = userAgent;
        this.accessToken = accessToken;
    }

    /**
     * Fetch the raw playlist manifest document.
     */
    public String fetchManifest() {
        HttpUrl url = endpoint(manifestPath).newBuilder()
                .addQueryParameter("fields", MANIFEST_FIELDS)
                .build();
        String body = get(url);
        log.info("Manifest received: {} bytes", body.length());
        return body;
    }

    /**
     * Fetch the newest changelog entry, or empty when nothing was ever published.
     */
    public Optional<ChangelogEntry> fetchLatestChangelog() {
        HttpUrl url = endpoint(changelogPath).newBuilder()
                .addQueryParameter("limit", "1")
                .addQueryParameter("sort", "-date_created")
                .build();
        Optional<ChangelogEntry> latest = changelogParser.parseLatest(get(url));
        latest.ifPresent(entry -> log.debug("Latest changelog: id={} created={}", entry.getId(), entry.getDateCreated()));
        return latest;
    }

    private HttpUrl endpoint(String path) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String suffix = path.startsWith("/") ? path : "/" + path;
        HttpUrl url = HttpUrl.parse(base + suffix);
        if (url == null) {
            throw new IllegalStateException("Invalid content API URL: " + base + suffix);
        }
        return url;
    }

    private String get(HttpUrl url) {
        Request.Builder request = new Request.Builder()
                .url(url)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json");
        if (accessToken != null && !accessToken.isBlank()) {
            request.header("Authorization", "Bearer " + accessToken);
        }

        try (Response response = httpClient.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new TransportException("GET " + url.encodedPath() + " failed with HTTP " + response.code(), response.code());
            }
            ResponseBody body = response.body();
            return body != null ? body.string() : "";
        } catch (IOException e) {
            throw new TransportException("GET " + url.encodedPath() + " failed: " + e.getMessage(), e);
        }
    }
}
