package com.xksgroup.signagesync.download;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Layout of the local media directory: one {@code video_<id>.mp4} per video, plus a
 * {@code .part} sibling while its bytes are still arriving.
 */
@Slf4j
@Component
public class MediaStorage {

    static final String PART_SUFFIX = ".part";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9-]+");
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9-]");

    private final Path mediaDir;

    public MediaStorage(@Value("${download.media-dir:media}") String mediaDir) {
        this.mediaDir = Paths.get(mediaDir).toAbsolutePath().normalize();
    }

    public Path getMediaDir() {
        return mediaDir;
    }

    public Path pathFor(String videoId) {
        return mediaDir.resolve("video_" + sanitize(videoId) + ".mp4");
    }

    public Path partPathFor(String videoId) {
        Path target = pathFor(videoId);
        return target.resolveSibling(target.getFileName() + PART_SUFFIX);
    }

    /**
     * True when the file exists and holds at least one byte.
     */
    public boolean isComplete(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    public void ensureDirectory() {
        try {
            Files.createDirectories(mediaDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create media directory " + mediaDir, e);
        }
    }

    /**
     * Move a finished part file over its final name.
     */
    public void promote(Path part, Path target) throws IOException {
        if (!isComplete(part)) {
            throw new IOException("Downloaded file " + part + " is missing or empty");
        }
        try {
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Delete files in the media directory that are not listed in {@code keep}.
     * Part files of kept videos are left alone so an interrupted fetch can resume.
     *
     * @return number of files removed
     */
    public int removeOrphans(Set<Path> keep) {
        if (!Files.isDirectory(mediaDir)) {
            return 0;
        }
        Set<Path> normalized = keep.stream()
                .map(p -> p.toAbsolutePath().normalize())
                .collect(Collectors.toSet());

        int removed = 0;
        try (Stream<Path> files = Files.list(mediaDir)) {
            for (Path file : files.sorted(Comparator.reverseOrder()).toList()) {
                Path normalizedFile = file.toAbsolutePath().normalize();
                if (!Files.isRegularFile(normalizedFile) || normalized.contains(normalizedFile)) {
                    continue;
                }
                String name = normalizedFile.getFileName().toString();
                if (name.endsWith(PART_SUFFIX)) {
                    Path owner = normalizedFile.resolveSibling(name.substring(0, name.length() - PART_SUFFIX.length()));
                    if (normalized.contains(owner)) {
                        continue;
                    }
                }
                if (deleteFile(normalizedFile)) {
                    removed++;
                }
            }
        } catch (IOException e) {
            log.warn("Error listing media directory {}: {}", mediaDir, e.getMessage());
        }
        if (removed > 0) {
            log.info("Removed {} orphaned media files from {}", removed, mediaDir);
        }
        return removed;
    }

    private boolean deleteFile(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Error deleting {}: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * Ids made only of safe characters are used as is. Any other id gets its unsafe characters
     * replaced and a digest of the raw id appended, so two distinct ids never share a file.
     */
    static String sanitize(String videoId) {
        if (SAFE_ID.matcher(videoId).matches()) {
            return videoId;
        }
        String digest = DigestUtils.md5DigestAsHex(videoId.getBytes(StandardCharsets.UTF_8)).substring(0, 10);
        return UNSAFE_CHARS.matcher(videoId).replaceAll("_") + "_" + digest;
    }
}
