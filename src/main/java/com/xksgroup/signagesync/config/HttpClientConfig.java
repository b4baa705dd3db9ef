package com.xksgroup.signagesync.config;

import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    /**
     * Client for the content API (manifest + changelog). Small payloads, short timeouts.
     */
    @Bean
    public OkHttpClient contentApiHttpClient(
            @Value("${content.api.connect-timeout-ms:30000}") long connectTimeoutMs,
            @Value("${content.api.read-timeout-ms:60000}") long readTimeoutMs
    ) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .readTimeout(Duration.ofMillis(readTimeoutMs))
                .retryOnConnectionFailure(true)
                .build();
    }

    /**
     * Client for media files. Videos are large, so reads get a much longer timeout.
     */
    @Bean
    public OkHttpClient mediaHttpClient(
            @Value("${download.connect-timeout-ms:30000}") long connectTimeoutMs,
            @Value("${download.read-timeout-ms:300000}") long readTimeoutMs
    ) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .readTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
