package com.example.audiobookfinder.application.service;

import com.example.audiobookfinder.api.response.DownloadProgressResponse;
import com.example.audiobookfinder.api.response.HistoryItemResponse;
import com.example.audiobookfinder.common.exception.BusinessException;
import com.example.audiobookfinder.domain.enumtype.DownloadStatus;
import com.example.audiobookfinder.domain.model.ProgressSnapshot;
import com.example.audiobookfinder.infrastructure.persistence.entity.DownloadHistoryEntity;
import com.example.audiobookfinder.infrastructure.persistence.mapper.DownloadHistoryMapper;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Accessor for download history records. Background jobs hold only a record id and go
 * through this service for every write; state transitions are guarded in SQL by the
 * expected current status.
 */
@Service
public class DownloadHistoryService {

    private static final Logger log = LoggerFactory.getLogger(DownloadHistoryService.class);

    public static final int MAX_LIST_LIMIT = 200;

    private static final DateTimeFormatter ADDED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<String> ACTIVE_STATUSES = Arrays.stream(DownloadStatus.values())
            .filter(status -> !status.isTerminal())
            .map(DownloadStatus::getCode)
            .collect(Collectors.toList());

    private final DownloadHistoryMapper downloadHistoryMapper;

    public DownloadHistoryService(DownloadHistoryMapper downloadHistoryMapper) {
        this.downloadHistoryMapper = downloadHistoryMapper;
    }

    public DownloadHistoryEntity createPending(String bookTitle,
                                               String author,
                                               String youtubeTitle,
                                               String youtubeUrl,
                                               String downloadPath) {
        DownloadHistoryEntity entity = new DownloadHistoryEntity();
        entity.setBookTitle(bookTitle);
        entity.setAuthor(author);
        entity.setYoutubeTitle(youtubeTitle);
        entity.setYoutubeUrl(youtubeUrl);
        entity.setDownloadPath(downloadPath);
        entity.setAddedAt(LocalDateTime.now(ZoneOffset.UTC).format(ADDED_AT_FORMAT));
        entity.setStatus(DownloadStatus.PENDING.getCode());
        entity.setProgress(0.0D);
        entity.setTotalSize(0L);
        entity.setDownloadedSize(0L);
        downloadHistoryMapper.insert(entity);
        log.info("DOWNLOAD_RECORD_CREATED id={} bookTitle={} url={}", entity.getId(), bookTitle, youtubeUrl);
        return entity;
    }

    public DownloadHistoryEntity get(Long id) {
        return downloadHistoryMapper.selectById(id);
    }

    public DownloadProgressResponse getProgress(Long id) {
        DownloadHistoryEntity entity = get(id);
        if (entity == null) {
            throw new BusinessException("404", "Download not found");
        }
        return new DownloadProgressResponse(
                entity.getId(),
                entity.getStatus(),
                nullSafeDouble(entity.getProgress()),
                nullSafeLong(entity.getTotalSize()),
                nullSafeLong(entity.getDownloadedSize()),
                entity.getBookTitle(),
                entity.getAuthor(),
                entity.getYoutubeTitle(),
                entity.getYoutubeUrl());
    }

    /**
     * Newest records first. The limit is clamped to 1..{@value #MAX_LIST_LIMIT}; null means the maximum.
     */
    public List<HistoryItemResponse> listRecent(Integer limit) {
        int safeLimit = limit == null ? MAX_LIST_LIMIT : Math.max(1, Math.min(MAX_LIST_LIMIT, limit));
        List<DownloadHistoryEntity> rows = downloadHistoryMapper.selectLatest(safeLimit);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toHistoryItem).collect(Collectors.toList());
    }

    /**
     * Writes the non-null fields of {@code patch}. Unknown ids are ignored.
     *
     * @return true when a row was changed
     */
    public boolean update(Long id, DownloadHistoryEntity patch) {
        return update(id, patch, Collections.emptyList());
    }

    public boolean markDownloading(Long id, String downloadPath) {
        DownloadHistoryEntity patch = new DownloadHistoryEntity();
        patch.setDownloadPath(downloadPath);
        patch.setStatus(DownloadStatus.DOWNLOADING.getCode());
        patch.setProgress(0.0D);
        patch.setTotalSize(0L);
        patch.setDownloadedSize(0L);
        return update(id, patch, Collections.singletonList(DownloadStatus.PENDING.getCode()));
    }

    /**
     * Progress only lands while the record is downloading, so a report that races with the
     * final status write cannot reopen a finished record.
     */
    public boolean applyProgress(Long id, ProgressSnapshot snapshot) {
        DownloadHistoryEntity patch = new DownloadHistoryEntity();
        patch.setProgress(snapshot.getProgress());
        patch.setTotalSize(snapshot.getTotalSize());
        patch.setDownloadedSize(snapshot.getDownloadedSize());
        return update(id, patch, Collections.singletonList(DownloadStatus.DOWNLOADING.getCode()));
    }

    public boolean markCompleted(Long id) {
        DownloadHistoryEntity patch = new DownloadHistoryEntity();
        patch.setStatus(DownloadStatus.COMPLETED.getCode());
        patch.setProgress(100.0D);
        return update(id, patch, Collections.singletonList(DownloadStatus.DOWNLOADING.getCode()));
    }

    /**
     * Tool reported failure: keep the last observed progress.
     */
    public boolean markFailed(Long id) {
        DownloadHistoryEntity patch = new DownloadHistoryEntity();
        patch.setStatus(DownloadStatus.FAILED.getCode());
        return update(id, patch, ACTIVE_STATUSES);
    }

    /**
     * Unexpected error inside a job: progress goes back to zero.
     */
    public boolean markFailedAndResetProgress(Long id) {
        DownloadHistoryEntity patch = new DownloadHistoryEntity();
        patch.setStatus(DownloadStatus.FAILED.getCode());
        patch.setProgress(0.0D);
        return update(id, patch, ACTIVE_STATUSES);
    }

    /**
     * Idempotent: deleting an unknown id is not an error.
     */
    public void delete(Long id) {
        int affected = downloadHistoryMapper.deleteById(id);
        if (affected > 0) {
            log.info("DOWNLOAD_RECORD_DELETED id={}", id);
        }
    }

    public void resetHistory() {
        downloadHistoryMapper.truncate();
        log.warn("DOWNLOAD_HISTORY_RESET");
    }

    private boolean update(Long id, DownloadHistoryEntity patch, List<String> expectedStatuses) {
        if (id == null || isEmptyPatch(patch)) {
            return false;
        }
        return downloadHistoryMapper.updateSelective(id, patch, expectedStatuses) > 0;
    }

    private boolean isEmptyPatch(DownloadHistoryEntity patch) {
        return patch == null
                || (patch.getBookTitle() == null
                && patch.getAuthor() == null
                && patch.getYoutubeTitle() == null
                && patch.getYoutubeUrl() == null
                && patch.getDownloadPath() == null
                && patch.getStatus() == null
                && patch.getProgress() == null
                && patch.getTotalSize() == null
                && patch.getDownloadedSize() == null);
    }

    private HistoryItemResponse toHistoryItem(DownloadHistoryEntity entity) {
        return new HistoryItemResponse(
                entity.getId(),
                entity.getBookTitle(),
                entity.getAuthor(),
                entity.getYoutubeTitle(),
                entity.getYoutubeUrl(),
                entity.getDownloadPath(),
                entity.getAddedAt(),
                entity.getStatus(),
                nullSafeDouble(entity.getProgress()),
                nullSafeLong(entity.getTotalSize()),
                nullSafeLong(entity.getDownloadedSize()));
    }

    private double nullSafeDouble(Double value) {
        return value == null ? 0.0D : value;
    }

    private long nullSafeLong(Long value) {
        return value == null ? 0L : value;
    }
}
