package com.example.audiobookfinder.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw result as returned by a search provider. Optional fields are null when the provider
 * did not report them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VideoSearchHit {

    private String id;

    private String title;

    private String channel;

    private String duration;

    private String publishTime;

    private String viewCount;
}
