package com.example.audiobookfinder.infrastructure.downloader;

import com.example.audiobookfinder.common.config.AppDownloadProperties;
import com.example.audiobookfinder.domain.model.AudioDownloadResult;
import com.example.audiobookfinder.domain.model.ProgressEvent;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Runs yt-dlp as a child process. Progress is requested through {@code --progress-template}
 * so each report arrives as one machine readable stdout line:
 * {@code [progress]status|downloaded_bytes|total_bytes|total_bytes_estimate}, with {@code NA}
 * for unknown values.
 */
@Component
public class YtDlpAudioDownloader implements AudioDownloader {

    private static final Logger log = LoggerFactory.getLogger(YtDlpAudioDownloader.class);

    static final String PROGRESS_PREFIX = "[progress]";

    private static final String PROGRESS_TEMPLATE = "download:" + PROGRESS_PREFIX
            + "%(progress.status)s|%(progress.downloaded_bytes)s|%(progress.total_bytes)s"
            + "|%(progress.total_bytes_estimate)s";

    private final AppDownloadProperties properties;

    public YtDlpAudioDownloader(AppDownloadProperties properties) {
        this.properties = properties;
    }

    @Override
    public AudioDownloadResult download(String sourceUrl, Path outputPath, DownloadProgressListener listener)
            throws IOException, InterruptedException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        List<String> command = buildCommand(sourceUrl, outputPath);
        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectErrorStream(true);
        processBuilder.environment().put("PYTHONIOENCODING", "utf-8");
        processBuilder.environment().put("PYTHONUTF8", "1");

        log.info("YTDLP_START url={} output={}", sourceUrl, outputPath);
        Process process = processBuilder.start();
        Deque<String> outputTail = new ArrayDeque<>();
        try {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    ProgressEvent event = parseProgressLine(line);
                    if (event != null) {
                        if (event.isDownloading()) {
                            listener.onProgress(event);
                        }
                        continue;
                    }
                    log.debug("YTDLP_OUTPUT {}", line);
                    rememberLine(outputTail, line);
                }
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                String summary = String.join("\n", outputTail);
                log.warn("YTDLP_FAILED url={} exitCode={} output={}", sourceUrl, exitCode, summary);
                return AudioDownloadResult.failure(exitCode, summary);
            }
            if (!Files.isRegularFile(outputPath)) {
                log.warn("YTDLP_OUTPUT_MISSING url={} output={}", sourceUrl, outputPath);
                return AudioDownloadResult.failure(exitCode, "Converted file not found: " + outputPath);
            }
            log.info("YTDLP_FINISHED url={} output={}", sourceUrl, outputPath);
            return AudioDownloadResult.success();
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    List<String> buildCommand(String sourceUrl, Path outputPath) {
        String codecArgs = String.format("ffmpeg:-ar %d -ac %d -b:a %dk -vn",
                properties.getSampleRate(), properties.getChannels(), properties.getAudioBitrateKbps());

        List<String> command = new ArrayList<>();
        command.add(properties.getYtDlpExecutable());
        command.add("--newline");
        command.add("--no-playlist");
        command.add("--no-warnings");
        command.add("--encoding");
        command.add("utf-8");
        command.add("-f");
        command.add(properties.getFormat());
        command.add("-x");
        command.add("--audio-format");
        command.add(properties.getAudioFormat());
        command.add("--audio-quality");
        command.add(properties.getAudioBitrateKbps() + "K");
        command.add("--postprocessor-args");
        command.add(codecArgs);
        command.add("--progress-template");
        command.add(PROGRESS_TEMPLATE);
        if (StringUtils.hasText(properties.getFfmpegLocation())) {
            command.add("--ffmpeg-location");
            command.add(properties.getFfmpegLocation().trim());
        }
        command.add("-o");
        command.add(toOutputTemplate(outputPath));
        command.add("--");
        command.add(sourceUrl);
        return command;
    }

    /**
     * yt-dlp picks the extension after audio extraction, so the fixed suffix is swapped for
     * {@code %(ext)s}. Literal percent signs in the path are escaped for the template engine.
     */
    String toOutputTemplate(Path outputPath) {
        String path = outputPath.toString().replace("%", "%%");
        String suffix = "." + properties.getAudioFormat();
        if (path.toLowerCase(Locale.ROOT).endsWith(suffix)) {
            path = path.substring(0, path.length() - suffix.length());
        }
        return path + ".%(ext)s";
    }

    static ProgressEvent parseProgressLine(String line) {
        if (line == null) {
            return null;
        }
        String trimmed = line.trim();
        if (!trimmed.startsWith(PROGRESS_PREFIX)) {
            return null;
        }
        String[] parts = trimmed.substring(PROGRESS_PREFIX.length()).split("\\|", -1);
        if (parts.length < 4) {
            return null;
        }
        Long downloaded = parseBytes(parts[1]);
        return new ProgressEvent(
                parts[0].trim(),
                downloaded == null ? 0L : downloaded,
                parseBytes(parts[2]),
                parseBytes(parts[3]));
    }

    private static Long parseBytes(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (value.isEmpty() || "NA".equalsIgnoreCase(value) || "None".equalsIgnoreCase(value)) {
            return null;
        }
        try {
            return (long) Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void rememberLine(Deque<String> tail, String line) {
        int limit = Math.max(1, properties.getOutputTailLines());
        tail.addLast(line);
        while (tail.size() > limit) {
            tail.removeFirst();
        }
    }
}
