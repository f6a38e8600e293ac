package com.example.audiobookfinder.common.util;

import java.util.regex.Pattern;

public final class FileNameUtil {

    private static final Pattern RESERVED_CHARS = Pattern.compile("[<>:\"/\\\\|?*]");

    private FileNameUtil() {
    }

    /**
     * Replaces every character that is reserved in Windows or POSIX file names with {@code _}.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return RESERVED_CHARS.matcher(value).replaceAll("_");
    }
}
