package com.example.audiobookfinder.api.controller;

import com.example.audiobookfinder.api.request.SearchRequest;
import com.example.audiobookfinder.api.response.ApiResponse;
import com.example.audiobookfinder.api.response.SearchResponse;
import com.example.audiobookfinder.application.service.AudiobookSearchService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {

    private final AudiobookSearchService audiobookSearchService;

    public SearchController(AudiobookSearchService audiobookSearchService) {
        this.audiobookSearchService = audiobookSearchService;
    }

    @PostMapping("/search")
    public ApiResponse<SearchResponse> search(@RequestBody SearchRequest request) {
        String query = request.getQuery() == null ? "" : request.getQuery();
        return ApiResponse.success(new SearchResponse(
                audiobookSearchService.search(query, request.getMaxResults()), query));
    }
}
