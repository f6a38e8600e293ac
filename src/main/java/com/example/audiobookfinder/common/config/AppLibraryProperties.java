package com.example.audiobookfinder.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.library")
public class AppLibraryProperties {

    /**
     * Initial books directory. Can be changed at runtime through the config endpoint.
     */
    private String booksDir = "./books";

    /**
     * Initial download directory for converted MP3 files.
     */
    private String downloadDir = "./downloads";

    private List<String> bookExtensions = new ArrayList<>(Arrays.asList(
            "pdf", "epub", "mobi", "azw", "azw3", "djvu", "fb2", "html",
            "lit", "lrf", "odt", "prc", "rb", "rtf", "txt"));

    public Set<String> normalizedBookExtensions() {
        return bookExtensions.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .map(item -> item.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
