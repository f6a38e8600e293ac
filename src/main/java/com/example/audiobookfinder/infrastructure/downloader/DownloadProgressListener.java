package com.example.audiobookfinder.infrastructure.downloader;

import com.example.audiobookfinder.domain.model.ProgressEvent;

@FunctionalInterface
public interface DownloadProgressListener {

    /**
     * Called on the downloading thread, once per progress report, in non-decreasing
     * downloaded-bytes order. Exceptions thrown here abort the download.
     */
    void onProgress(ProgressEvent event);
}
