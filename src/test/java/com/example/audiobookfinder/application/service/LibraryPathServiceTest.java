package com.example.audiobookfinder.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.audiobookfinder.common.config.AppLibraryProperties;
import com.example.audiobookfinder.common.exception.BusinessException;
import com.example.audiobookfinder.domain.model.LibraryPaths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;

class LibraryPathServiceTest {

    @TempDir
    Path tempDir;

    private LibraryPathService service;

    @BeforeEach
    void setUp() {
        AppLibraryProperties properties = new AppLibraryProperties();
        properties.setBooksDir(tempDir.resolve("books").toString());
        properties.setDownloadDir(tempDir.resolve("downloads").toString());
        service = new LibraryPathService(properties);
    }

    @Test
    void shouldCreateDownloadDirectoryOnStartup() {
        assertTrue(Files.isDirectory(tempDir.resolve("downloads")));
        assertEquals(tempDir.resolve("books"), service.current().getBooksDir());
    }

    @Test
    void shouldCreateMissingDirectoriesOnUpdate() {
        Path newBooks = tempDir.resolve("library/books");
        Path newDownloads = tempDir.resolve("library/mp3");

        LibraryPaths updated = service.update(newBooks.toString(), newDownloads.toString());

        assertEquals(newBooks, updated.getBooksDir());
        assertEquals(newDownloads, updated.getDownloadDir());
        assertTrue(Files.isDirectory(newBooks));
        assertTrue(Files.isDirectory(newDownloads));
        assertEquals(updated, service.current());
    }

    @Test
    void blankValueShouldKeepCurrentDirectory() throws IOException {
        Path newBooks = Files.createDirectories(tempDir.resolve("other-books"));

        LibraryPaths updated = service.update(newBooks.toString(), "  ");

        assertEquals(newBooks, updated.getBooksDir());
        assertEquals(tempDir.resolve("downloads"), updated.getDownloadDir());
    }

    @Test
    void shouldRejectPathThatCannotBeCreatedAndKeepBothValues() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("plain-file"));
        LibraryPaths before = service.current();

        BusinessException ex = assertThrows(BusinessException.class,
                () -> service.update(tempDir.resolve("fresh-books").toString(), blocker.resolve("sub").toString()));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatus());
        assertTrue(ex.getMessage().startsWith("Download directory does not exist"));
        assertEquals(before, service.current());
    }
}
