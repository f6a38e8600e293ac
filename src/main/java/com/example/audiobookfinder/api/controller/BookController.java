package com.example.audiobookfinder.api.controller;

import com.example.audiobookfinder.api.response.ApiResponse;
import com.example.audiobookfinder.api.response.BookListResponse;
import com.example.audiobookfinder.application.service.LibraryScanService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class BookController {

    private final LibraryScanService libraryScanService;

    public BookController(LibraryScanService libraryScanService) {
        this.libraryScanService = libraryScanService;
    }

    @GetMapping("/books")
    public ApiResponse<BookListResponse> listBooks() {
        return ApiResponse.success(new BookListResponse(libraryScanService.scan()));
    }
}
