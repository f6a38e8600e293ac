package com.example.audiobookfinder.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ParsedBookName {

    private String author;

    private String title;

    /**
     * Title first, author appended; empty when both parts are empty.
     */
    public String toSearchQuery() {
        return (title + " " + author).trim();
    }
}
