package com.example.audiobookfinder.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.download")
public class AppDownloadProperties {

    /**
     * yt-dlp executable name or absolute path.
     */
    private String ytDlpExecutable = "yt-dlp";

    /**
     * Optional ffmpeg binary or directory passed as --ffmpeg-location. Empty means PATH lookup.
     */
    private String ffmpegLocation;

    private String format = "bestaudio/best";

    private String audioFormat = "mp3";

    private int audioBitrateKbps = 192;

    private int sampleRate = 44100;

    private int channels = 2;

    /**
     * Number of trailing tool output lines kept for the failure summary.
     */
    private int outputTailLines = 20;
}
