package com.example.audiobookfinder.application.service;

import com.example.audiobookfinder.api.request.CreateDownloadRequest;
import com.example.audiobookfinder.api.response.CreateDownloadResponse;
import com.example.audiobookfinder.common.exception.BusinessException;
import com.example.audiobookfinder.common.util.FileNameUtil;
import com.example.audiobookfinder.domain.model.AudioDownloadResult;
import com.example.audiobookfinder.domain.model.ProgressSnapshot;
import com.example.audiobookfinder.infrastructure.downloader.AudioDownloader;
import com.example.audiobookfinder.infrastructure.persistence.entity.DownloadHistoryEntity;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Starts one background job per download request. The request thread only persists a
 * pending record and returns its id; the job moves the record through
 * downloading to completed or failed and never lets an exception escape.
 */
@Service
public class DownloadJobService {

    private static final Logger log = LoggerFactory.getLogger(DownloadJobService.class);

    static final String UNKNOWN_AUTHOR = "Unknown";
    private static final String OUTPUT_EXTENSION = ".mp3";

    private final DownloadHistoryService downloadHistoryService;
    private final AudioDownloader audioDownloader;
    private final LibraryPathService libraryPathService;
    private final ExecutorService downloadJobExecutor;
    private final MeterRegistry meterRegistry;

    public DownloadJobService(DownloadHistoryService downloadHistoryService,
                              AudioDownloader audioDownloader,
                              LibraryPathService libraryPathService,
                              ExecutorService downloadJobExecutor,
                              ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.downloadHistoryService = downloadHistoryService;
        this.audioDownloader = audioDownloader;
        this.libraryPathService = libraryPathService;
        this.downloadJobExecutor = downloadJobExecutor;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public CreateDownloadResponse createDownload(CreateDownloadRequest request) {
        if (request == null) {
            throw new BusinessException("400", "No JSON data provided");
        }
        requireText(request.getBookTitle(), "book_title");
        requireText(request.getYoutubeUrl(), "youtube_url");
        requireText(request.getYoutubeTitle(), "youtube_title");

        Path outputPath = resolveOutputPath(request.getAuthor(), request.getBookTitle(), request.getYoutubeTitle());
        DownloadHistoryEntity record = downloadHistoryService.createPending(
                request.getBookTitle(),
                request.getAuthor(),
                request.getYoutubeTitle(),
                request.getYoutubeUrl(),
                outputPath.toString());
        Long downloadId = record.getId();

        try {
            downloadJobExecutor.submit(() -> runJob(downloadId, request.getYoutubeUrl(), outputPath));
        } catch (RejectedExecutionException e) {
            downloadHistoryService.markFailedAndResetProgress(downloadId);
            throw new BusinessException(HttpStatus.SERVICE_UNAVAILABLE, "DOWNLOAD_EXECUTOR_REJECTED",
                    "Download could not be scheduled", "Retry later");
        }
        log.info("DOWNLOAD_JOB_SUBMITTED id={} bookTitle={} output={}", downloadId, request.getBookTitle(), outputPath);
        return new CreateDownloadResponse(true, downloadId);
    }

    /**
     * {@code {author or Unknown} - {book title} - {video title}.mp3} inside the current download directory.
     */
    Path resolveOutputPath(String author, String bookTitle, String youtubeTitle) {
        String displayAuthor = StringUtils.hasText(author) ? author : UNKNOWN_AUTHOR;
        String fileName = FileNameUtil.sanitize(displayAuthor + " - " + bookTitle + " - " + youtubeTitle);
        return libraryPathService.current().getDownloadDir().resolve(fileName + OUTPUT_EXTENSION);
    }

    void runJob(Long downloadId, String youtubeUrl, Path outputPath) {
        try {
            if (!downloadHistoryService.markDownloading(downloadId, outputPath.toString())) {
                log.info("DOWNLOAD_JOB_START_SKIPPED id={} reason=record_not_pending", downloadId);
                return;
            }
            recordCounter("audiobook.download.job.started");
            log.info("DOWNLOAD_JOB_STARTED id={} url={}", downloadId, youtubeUrl);

            AudioDownloadResult result = audioDownloader.download(youtubeUrl, outputPath,
                    event -> downloadHistoryService.applyProgress(downloadId, ProgressSnapshot.from(event)));

            if (result.isSuccess()) {
                downloadHistoryService.markCompleted(downloadId);
                recordCounter("audiobook.download.job.finished", "outcome", "completed");
                log.info("DOWNLOAD_JOB_COMPLETED id={} output={}", downloadId, outputPath);
            } else {
                downloadHistoryService.markFailed(downloadId);
                recordCounter("audiobook.download.job.finished", "outcome", "failed");
                log.warn("DOWNLOAD_JOB_FAILED id={} exitCode={} reason={}",
                        downloadId, result.getExitCode(), result.getMessage());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("DOWNLOAD_JOB_INTERRUPTED id={}", downloadId);
            failAndReset(downloadId);
        } catch (Exception e) {
            log.error("Download job failed, id={}, url={}", downloadId, youtubeUrl, e);
            failAndReset(downloadId);
        }
    }

    private void failAndReset(Long downloadId) {
        recordCounter("audiobook.download.job.finished", "outcome", "error");
        try {
            downloadHistoryService.markFailedAndResetProgress(downloadId);
        } catch (Exception e) {
            log.error("Failed to mark download as failed, id={}", downloadId, e);
        }
    }

    private void requireText(String value, String field) {
        if (!StringUtils.hasText(value)) {
            throw new BusinessException("400", "Missing required field: " + field);
        }
    }

    private void recordCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception e) {
            log.debug("Download metric counter failed, name={}", name, e);
        }
    }
}
