package com.example.audiobookfinder.infrastructure.downloader;

import com.example.audiobookfinder.domain.model.AudioDownloadResult;
import java.io.IOException;
import java.nio.file.Path;

public interface AudioDownloader {

    /**
     * Downloads the best audio stream of {@code sourceUrl} and transcodes it to an MP3 file at
     * {@code outputPath}. Blocks until the tool finishes.
     *
     * @return success, or a failure carrying the tool's exit code and output tail
     * @throws IOException          when the tool cannot be started or its output cannot be read
     * @throws InterruptedException when the calling thread is interrupted while waiting
     */
    AudioDownloadResult download(String sourceUrl, Path outputPath, DownloadProgressListener listener)
            throws IOException, InterruptedException;
}
