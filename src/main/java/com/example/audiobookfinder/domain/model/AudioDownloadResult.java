package com.example.audiobookfinder.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class AudioDownloadResult {

    private boolean success;

    private int exitCode;

    private String message;

    public static AudioDownloadResult success() {
        return new AudioDownloadResult(true, 0, null);
    }

    public static AudioDownloadResult failure(int exitCode, String message) {
        return new AudioDownloadResult(false, exitCode, message);
    }
}
