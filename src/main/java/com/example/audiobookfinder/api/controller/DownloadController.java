package com.example.audiobookfinder.api.controller;

import com.example.audiobookfinder.api.request.CreateDownloadRequest;
import com.example.audiobookfinder.api.response.ApiResponse;
import com.example.audiobookfinder.api.response.CreateDownloadResponse;
import com.example.audiobookfinder.api.response.DownloadProgressResponse;
import com.example.audiobookfinder.application.service.DownloadHistoryService;
import com.example.audiobookfinder.application.service.DownloadJobService;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DownloadController {

    private final DownloadJobService downloadJobService;
    private final DownloadHistoryService downloadHistoryService;

    public DownloadController(DownloadJobService downloadJobService,
                              DownloadHistoryService downloadHistoryService) {
        this.downloadJobService = downloadJobService;
        this.downloadHistoryService = downloadHistoryService;
    }

    @PostMapping("/download")
    public ApiResponse<CreateDownloadResponse> createDownload(@Valid @RequestBody CreateDownloadRequest request) {
        return ApiResponse.success(downloadJobService.createDownload(request));
    }

    @GetMapping("/progress/{id}")
    public ApiResponse<DownloadProgressResponse> getProgress(@PathVariable("id") Long id) {
        return ApiResponse.success(downloadHistoryService.getProgress(id));
    }
}
