package com.example.audiobookfinder.common.util;

import com.example.audiobookfinder.domain.model.ParsedBookName;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a folder or file name into author and title.
 *
 * <p>Recognized shapes, first match wins:
 * <ul>
 *   <li>{@code Author - Title} (hyphen, en dash or em dash, repeated dashes allowed)</li>
 *   <li>{@code Title by Author} (case-insensitive)</li>
 * </ul>
 * Anything else becomes a title with an empty author.
 */
public final class BookNameParser {

    private static final Pattern DASH_SEPARATED = Pattern.compile("^(.*?)\\s*[-–—]+\\s*(.*)$");

    private static final Pattern BY_SEPARATED = Pattern.compile("^(.*?)\\s+by\\s+(.*)$", Pattern.CASE_INSENSITIVE);

    private BookNameParser() {
    }

    public static ParsedBookName parse(String name) {
        String trimmed = name == null ? "" : name.trim();

        Matcher matcher = DASH_SEPARATED.matcher(trimmed);
        if (matcher.find()) {
            return new ParsedBookName(matcher.group(1).trim(), matcher.group(2).trim());
        }

        matcher = BY_SEPARATED.matcher(trimmed);
        if (matcher.find()) {
            return new ParsedBookName(matcher.group(2).trim(), matcher.group(1).trim());
        }

        return new ParsedBookName("", trimmed);
    }
}
