package com.example.audiobookfinder.api.controller;

import com.example.audiobookfinder.api.request.UpdateLibraryPathsRequest;
import com.example.audiobookfinder.api.response.ApiResponse;
import com.example.audiobookfinder.api.response.LibraryPathsResponse;
import com.example.audiobookfinder.application.service.LibraryPathService;
import com.example.audiobookfinder.domain.model.LibraryPaths;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/config")
public class LibraryConfigController {

    private final LibraryPathService libraryPathService;

    public LibraryConfigController(LibraryPathService libraryPathService) {
        this.libraryPathService = libraryPathService;
    }

    @GetMapping
    public ApiResponse<LibraryPathsResponse> getConfig() {
        LibraryPaths paths = libraryPathService.current();
        return ApiResponse.success(new LibraryPathsResponse(null,
                paths.getBooksDir().toString(), paths.getDownloadDir().toString()));
    }

    @PostMapping
    public ApiResponse<LibraryPathsResponse> updateConfig(@RequestBody UpdateLibraryPathsRequest request) {
        LibraryPaths paths = libraryPathService.update(request.getBooksDir(), request.getDownloadDir());
        return ApiResponse.success(new LibraryPathsResponse(true,
                paths.getBooksDir().toString(), paths.getDownloadDir().toString()));
    }
}
