package com.example.audiobookfinder.infrastructure.search;

import com.example.audiobookfinder.domain.model.VideoSearchHit;
import java.io.IOException;
import java.util.List;

public interface VideoSearchProvider {

    /**
     * Runs a search and returns hits in the provider's ranking order, at most {@code maxResults}.
     *
     * @throws IOException when the provider cannot be reached or its response cannot be parsed
     */
    List<VideoSearchHit> search(String query, int maxResults) throws IOException;
}
