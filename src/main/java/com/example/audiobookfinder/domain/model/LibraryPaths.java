package com.example.audiobookfinder.domain.model;

import java.nio.file.Path;
import lombok.Data;

/**
 * Immutable snapshot of the runtime directories. Replaced as a whole on every update.
 */
@Data
public class LibraryPaths {

    private final Path booksDir;

    private final Path downloadDir;
}
