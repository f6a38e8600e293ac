package com.example.audiobookfinder.infrastructure.persistence.mapper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.audiobookfinder.infrastructure.persistence.entity.DownloadHistoryEntity;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mybatis.spring.boot.test.autoconfigure.MybatisTest;
import org.springframework.beans.factory.annotation.Autowired;

@MybatisTest
class DownloadHistoryMapperTest {

    @Autowired
    private DownloadHistoryMapper mapper;

    @Test
    void insertShouldAssignIdAndRoundTripColumns() {
        DownloadHistoryEntity entity = pending("Dune");
        mapper.insert(entity);

        assertNotNull(entity.getId());
        DownloadHistoryEntity row = mapper.selectById(entity.getId());
        assertEquals("Dune", row.getBookTitle());
        assertEquals("pending", row.getStatus());
        assertEquals(0.0D, row.getProgress(), 0.0D);
        assertEquals("2024-05-01 10:00:00", row.getAddedAt());
    }

    @Test
    void longTextColumnsShouldBeStoredInFull() {
        String longTitle = repeat("Chapter ", 100);
        DownloadHistoryEntity entity = pending("Long");
        entity.setBookTitle(longTitle);
        entity.setAuthor(repeat("A", 600));
        entity.setYoutubeTitle(longTitle);
        entity.setYoutubeUrl("https://www.youtube.com/watch?v=d1&list=" + repeat("x", 600));
        entity.setDownloadPath("/downloads/" + repeat("Author - Book - Video ", 60) + ".mp3");
        mapper.insert(entity);

        DownloadHistoryEntity row = mapper.selectById(entity.getId());
        assertEquals(800, row.getBookTitle().length());
        assertEquals(600, row.getAuthor().length());
        assertEquals(entity.getYoutubeUrl(), row.getYoutubeUrl());
        assertEquals(entity.getDownloadPath(), row.getDownloadPath());
    }

    @Test
    void statusGuardShouldRejectProgressAfterCompletion() {
        DownloadHistoryEntity entity = pending("The Hobbit");
        mapper.insert(entity);
        Long id = entity.getId();

        DownloadHistoryEntity start = new DownloadHistoryEntity();
        start.setStatus("downloading");
        assertEquals(1, mapper.updateSelective(id, start, Collections.singletonList("pending")));

        DownloadHistoryEntity done = new DownloadHistoryEntity();
        done.setStatus("completed");
        done.setProgress(100.0D);
        assertEquals(1, mapper.updateSelective(id, done, Collections.singletonList("downloading")));

        DownloadHistoryEntity lateProgress = new DownloadHistoryEntity();
        lateProgress.setProgress(40.0D);
        lateProgress.setDownloadedSize(40L);
        assertEquals(0, mapper.updateSelective(id, lateProgress, Collections.singletonList("downloading")));

        DownloadHistoryEntity failed = new DownloadHistoryEntity();
        failed.setStatus("failed");
        assertEquals(0, mapper.updateSelective(id, failed, Arrays.asList("pending", "downloading")));

        DownloadHistoryEntity row = mapper.selectById(id);
        assertEquals("completed", row.getStatus());
        assertEquals(100.0D, row.getProgress(), 0.0D);
        assertEquals(0L, row.getDownloadedSize().longValue());
    }

    @Test
    void unguardedUpdateShouldOnlyTouchGivenColumns() {
        DownloadHistoryEntity entity = pending("Emma");
        mapper.insert(entity);

        DownloadHistoryEntity patch = new DownloadHistoryEntity();
        patch.setAuthor("Jane Austen");
        assertEquals(1, mapper.updateSelective(entity.getId(), patch, Collections.emptyList()));
        assertEquals(0, mapper.updateSelective(-1L, patch, Collections.emptyList()));

        DownloadHistoryEntity row = mapper.selectById(entity.getId());
        assertEquals("Jane Austen", row.getAuthor());
        assertEquals("Emma", row.getBookTitle());
        assertEquals("pending", row.getStatus());
    }

    @Test
    void latestShouldBeNewestFirstAndLimited() {
        DownloadHistoryEntity first = pending("First");
        DownloadHistoryEntity second = pending("Second");
        DownloadHistoryEntity third = pending("Third");
        mapper.insert(first);
        mapper.insert(second);
        mapper.insert(third);

        List<DownloadHistoryEntity> rows = mapper.selectLatest(2);

        assertEquals(2, rows.size());
        assertEquals(third.getId(), rows.get(0).getId());
        assertEquals(second.getId(), rows.get(1).getId());
    }

    @Test
    void deleteShouldReportAffectedRows() {
        DownloadHistoryEntity entity = pending("Ulysses");
        mapper.insert(entity);

        assertEquals(1, mapper.deleteById(entity.getId()));
        assertEquals(0, mapper.deleteById(entity.getId()));
        assertNull(mapper.selectById(entity.getId()));
    }

    @Test
    void truncateShouldEmptyTableAndRestartIds() {
        mapper.insert(pending("Old"));

        mapper.truncate();

        assertTrue(mapper.selectLatest(200).isEmpty());
        DownloadHistoryEntity fresh = pending("Fresh");
        mapper.insert(fresh);
        assertEquals(1L, fresh.getId().longValue());
    }

    private String repeat(String value, int times) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < times; i++) {
            builder.append(value);
        }
        return builder.toString();
    }

    private DownloadHistoryEntity pending(String bookTitle) {
        DownloadHistoryEntity entity = new DownloadHistoryEntity();
        entity.setBookTitle(bookTitle);
        entity.setAuthor("");
        entity.setYoutubeTitle(bookTitle + " audiobook");
        entity.setYoutubeUrl("https://www.youtube.com/watch?v=" + bookTitle);
        entity.setDownloadPath("/downloads/" + bookTitle + ".mp3");
        entity.setAddedAt("2024-05-01 10:00:00");
        entity.setStatus("pending");
        entity.setProgress(0.0D);
        entity.setTotalSize(0L);
        entity.setDownloadedSize(0L);
        return entity;
    }
}
