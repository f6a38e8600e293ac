package com.example.audiobookfinder.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class DownloadHistoryEntity {

    private Long id;

    private String bookTitle;

    private String author;

    private String youtubeTitle;

    private String youtubeUrl;

    private String downloadPath;

    private String addedAt;

    private String status;

    private Double progress;

    private Long totalSize;

    private Long downloadedSize;
}
