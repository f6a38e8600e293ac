package com.example.audiobookfinder.application.service;

import com.example.audiobookfinder.common.config.AppLibraryProperties;
import com.example.audiobookfinder.common.exception.BusinessException;
import com.example.audiobookfinder.domain.model.LibraryPaths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Owns the books and download directories. Readers take a snapshot per call; updates
 * replace the whole snapshot so a reader never sees one new and one old directory.
 */
@Service
public class LibraryPathService {

    private static final Logger log = LoggerFactory.getLogger(LibraryPathService.class);

    private final AtomicReference<LibraryPaths> current;

    public LibraryPathService(AppLibraryProperties properties) {
        LibraryPaths initial = new LibraryPaths(
                Paths.get(properties.getBooksDir()),
                Paths.get(properties.getDownloadDir()));
        this.current = new AtomicReference<>(initial);
        try {
            Files.createDirectories(initial.getDownloadDir());
        } catch (IOException e) {
            log.warn("DOWNLOAD_DIR_UNAVAILABLE path={} reason={}", initial.getDownloadDir(), e.getMessage());
        }
        log.info("LIBRARY_PATHS_INITIALIZED booksDir={} downloadDir={}",
                initial.getBooksDir(), initial.getDownloadDir());
    }

    public LibraryPaths current() {
        return current.get();
    }

    /**
     * Validates both directories, creating them when absent, then swaps them in.
     * A null or blank argument keeps the current value.
     */
    public LibraryPaths update(String booksDir, String downloadDir) {
        LibraryPaths before = current.get();
        Path newBooksDir = StringUtils.hasText(booksDir) ? toPath(booksDir, "Books") : before.getBooksDir();
        Path newDownloadDir = StringUtils.hasText(downloadDir) ? toPath(downloadDir, "Download") : before.getDownloadDir();

        ensureDirectory(newBooksDir, "Books");
        ensureDirectory(newDownloadDir, "Download");

        LibraryPaths updated = new LibraryPaths(newBooksDir, newDownloadDir);
        current.set(updated);
        log.info("LIBRARY_PATHS_UPDATED booksDir={} downloadDir={}", newBooksDir, newDownloadDir);
        return updated;
    }

    private Path toPath(String raw, String label) {
        try {
            return Paths.get(raw.trim());
        } catch (InvalidPathException e) {
            throw new BusinessException("400", label + " directory is not a valid path: " + raw);
        }
    }

    private void ensureDirectory(Path directory, String label) {
        if (Files.isDirectory(directory)) {
            return;
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            log.warn("LIBRARY_PATH_REJECTED path={} reason={}", directory, e.getMessage());
        }
        if (!Files.isDirectory(directory)) {
            throw new BusinessException("400",
                    label + " directory does not exist and could not be created: " + directory);
        }
    }
}
