package com.example.audiobookfinder.domain.model;

import lombok.Data;

/**
 * Progress columns written to a history record for a single {@link ProgressEvent}.
 */
@Data
public class ProgressSnapshot {

    private final double progress;

    private final long totalSize;

    private final long downloadedSize;

    public static ProgressSnapshot from(ProgressEvent event) {
        long downloaded = Math.max(0L, event.getDownloadedBytes());
        Long total = event.getTotalBytes();
        if (total != null && total > 0) {
            return new ProgressSnapshot(percent(downloaded, total), total, downloaded);
        }
        Long estimate = event.getTotalBytesEstimate();
        if (estimate != null && estimate > 0) {
            return new ProgressSnapshot(percent(downloaded, estimate), estimate, downloaded);
        }
        return new ProgressSnapshot(0.0D, 0L, downloaded);
    }

    // estimates can undershoot the final size
    private static double percent(long downloaded, long total) {
        return Math.min(100.0D, ((double) downloaded / total) * 100);
    }
}
