package com.example.audiobookfinder.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One progress report from the download tool. Byte totals are null when the tool does not know them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProgressEvent {

    public static final String STATUS_DOWNLOADING = "downloading";

    private String status;

    private long downloadedBytes;

    private Long totalBytes;

    private Long totalBytesEstimate;

    public boolean isDownloading() {
        return STATUS_DOWNLOADING.equals(status);
    }
}
