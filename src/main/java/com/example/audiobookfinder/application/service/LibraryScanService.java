package com.example.audiobookfinder.application.service;

import com.example.audiobookfinder.common.config.AppLibraryProperties;
import com.example.audiobookfinder.common.exception.BusinessException;
import com.example.audiobookfinder.common.util.BookNameParser;
import com.example.audiobookfinder.domain.enumtype.BookItemType;
import com.example.audiobookfinder.domain.model.BookItem;
import com.example.audiobookfinder.domain.model.ParsedBookName;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class LibraryScanService {

    private static final Logger log = LoggerFactory.getLogger(LibraryScanService.class);

    private final LibraryPathService libraryPathService;
    private final Set<String> bookExtensions;

    public LibraryScanService(LibraryPathService libraryPathService, AppLibraryProperties properties) {
        this.libraryPathService = libraryPathService;
        this.bookExtensions = properties.normalizedBookExtensions();
    }

    /**
     * Lists the current books directory. Sub-directories and files with a known book extension
     * become items, in directory listing order; everything else is skipped.
     */
    public List<BookItem> scan() {
        Path booksDir = libraryPathService.current().getBooksDir();
        if (!Files.isDirectory(booksDir)) {
            log.warn("BOOKS_DIR_MISSING path={}", booksDir);
            return Collections.emptyList();
        }

        List<BookItem> items = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(booksDir)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (Files.isDirectory(entry)) {
                    items.add(toBookItem(entry, name, BookItemType.FOLDER));
                } else if (Files.isRegularFile(entry) && isBookFile(name)) {
                    items.add(toBookItem(entry, stripExtension(name), BookItemType.FILE));
                }
            }
        } catch (IOException e) {
            throw new BusinessException(HttpStatus.INTERNAL_SERVER_ERROR, "BOOK_SCAN_FAILED",
                    "Error scanning book files and folders: " + e.getMessage(), null);
        }
        log.info("BOOKS_SCANNED path={} items={}", booksDir, items.size());
        return items;
    }

    private BookItem toBookItem(Path entry, String parsedName, BookItemType type) {
        ParsedBookName parsed = BookNameParser.parse(parsedName);
        return new BookItem(
                entry.getFileName().toString(),
                entry.toAbsolutePath().toString(),
                parsed.getAuthor(),
                parsed.getTitle(),
                parsed.toSearchQuery(),
                type);
    }

    private boolean isBookFile(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return false;
        }
        return bookExtensions.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
