package com.example.audiobookfinder.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchResult {

    private String id;

    private String title;

    private String channel;

    private String duration;

    private String publishTime;

    private String viewCount;

    private String url;

    private String thumbnail;
}
