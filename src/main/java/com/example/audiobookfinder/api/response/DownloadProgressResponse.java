package com.example.audiobookfinder.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DownloadProgressResponse {

    private Long id;

    private String status;

    private double progress;

    private long totalSize;

    private long downloadedSize;

    private String bookTitle;

    private String author;

    private String youtubeTitle;

    private String youtubeUrl;
}
