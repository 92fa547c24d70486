package com.delta.jobscraper.crawl.cache;

import com.delta.jobscraper.crawl.util.HashUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Flat directory of downloaded items. A file named {@code {source}_{sha256(url)}.txt} exists only once
 * its content has been completely written; entries are never removed here. Writers racing past the
 * existence check each rename a complete file into place and the last rename wins.
 */
public class CacheStore {
    private final Path cacheDir;

    public CacheStore(Path cacheDir) {
        this.cacheDir = cacheDir;
    }

    public static String fileName(String sourceName, String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Cannot generate cache filename: URL is " + (url == null ? "null" : "blank"));
        }
        return sourceName + "_" + HashUtils.sha256Hex(url) + ".txt";
    }

    public Path pathFor(String sourceName, String url) {
        return cacheDir.resolve(fileName(sourceName, url));
    }

    public boolean isCached(String sourceName, String url) {
        return Files.exists(pathFor(sourceName, url));
    }

    public Path write(String sourceName, String url, String text) throws IOException {
        Path target = pathFor(sourceName, url);
        if (Files.exists(target)) {
            return target;
        }
        Files.createDirectories(cacheDir);
        Path temp = Files.createTempFile(cacheDir, "." + sourceName + "-", ".tmp");
        try {
            Files.writeString(temp, url + "\n\n" + (text == null ? "" : text), StandardCharsets.UTF_8);
            if (Files.exists(target)) {
                return target;
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target);
            }
        } catch (FileAlreadyExistsException e) {
            // plain moves refuse an existing target, so the earlier entry stands
            return target;
        } finally {
            Files.deleteIfExists(temp);
        }
        return target;
    }
}
