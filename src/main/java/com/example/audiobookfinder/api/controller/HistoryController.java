package com.example.audiobookfinder.api.controller;

import com.example.audiobookfinder.api.response.ApiResponse;
import com.example.audiobookfinder.api.response.HistoryListResponse;
import com.example.audiobookfinder.api.response.OperationResponse;
import com.example.audiobookfinder.application.service.DownloadHistoryService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HistoryController {

    private final DownloadHistoryService downloadHistoryService;

    public HistoryController(DownloadHistoryService downloadHistoryService) {
        this.downloadHistoryService = downloadHistoryService;
    }

    @GetMapping("/history")
    public ApiResponse<HistoryListResponse> listHistory(
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ApiResponse.success(new HistoryListResponse(downloadHistoryService.listRecent(limit)));
    }

    @DeleteMapping("/history/{id}")
    public ApiResponse<OperationResponse> deleteHistory(@PathVariable("id") Long id) {
        downloadHistoryService.delete(id);
        return ApiResponse.success(OperationResponse.ok());
    }

    @PostMapping("/init-db")
    public ApiResponse<OperationResponse> resetHistory() {
        downloadHistoryService.resetHistory();
        return ApiResponse.success(new OperationResponse(true, "Database initialized successfully"));
    }
}
