package com.xksgroup.signagesync.download;

import com.xksgroup.signagesync.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;

@Slf4j
@Component
public class ResumableMediaFetcher implements MediaFetcher {

    private static final int HTTP_PARTIAL_CONTENT = 206;
    private static final int HTTP_RANGE_NOT_SATISFIABLE = 416;

    private final OkHttpClient client;

    public ResumableMediaFetcher(@Qualifier("mediaHttpClient") OkHttpClient client) {
        this.client = client;
    }

    /**
     * Downloads a file from the given URL to the target path, resuming if possible,
     * and reporting progress to the listener.
     */
    @Override
    public void fetch(String url, Path target, ProgressListener listener) throws IOException {
        File file = target.toFile();
        long existingFileSize = file.exists() ? file.length() : 0;

        Request.Builder requestBuilder = new Request.Builder().url(url);
        if (existingFileSize > 0) {
            requestBuilder.addHeader("Range", "bytes=" + existingFileSize + "-");
            log.debug("Resuming {} from byte {}", url, existingFileSize);
        }

        try (Response response = client.newCall(requestBuilder.build()).execute()) {
            if (existingFileSize > 0 && response.code() == HTTP_RANGE_NOT_SATISFIABLE) {
                // The part file already holds the whole resource
                log.debug("Server reports nothing left to fetch for {}", url);
                return;
            }
            if (!response.isSuccessful()) {
                throw new TransportException("Media fetch failed with HTTP " + response.code() + " for " + url, response.code());
            }

            ResponseBody body = response.body();
            if (body == null) {
                throw new TransportException("Empty media response for " + url, response.code());
            }

            long offset = existingFileSize;
            if (offset > 0 && response.code() != HTTP_PARTIAL_CONTENT) {
                log.info("Server ignored range request for {}, restarting from zero", url);
                offset = 0;
            }

            long contentLength = body.contentLength();
            long totalBytes = contentLength > 0 ? contentLength + offset : -1;

            try (InputStream inputStream = body.byteStream();
                 RandomAccessFile savedFile = new RandomAccessFile(file, "rw")) {

                savedFile.setLength(offset);
                savedFile.seek(offset);
                byte[] buffer = new byte[8192];
                int bytesRead;
                long downloaded = offset;
                while ((bytesRead = inputStream.read(buffer)) != -1) {
                    if (Thread.currentThread().isInterrupted()) {
                        throw new InterruptedIOException("Fetch of " + url + " interrupted at byte " + downloaded);
                    }
                    savedFile.write(buffer, 0, bytesRead);
                    downloaded += bytesRead;
                    if (listener != null && totalBytes > 0) {
                        listener.onProgress(downloaded, totalBytes);
                    }
                }

                if (totalBytes > 0 && downloaded < totalBytes) {
                    throw new TransportException("Connection closed after " + downloaded + " of " + totalBytes + " bytes for " + url, response.code());
                }
            }
        }
        log.debug("Fetch complete: {}", target);
    }
}
