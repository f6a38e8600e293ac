package com.example.audiobookfinder.api.controller;

import com.example.audiobookfinder.api.response.ApiResponse;
import com.example.audiobookfinder.api.response.OperationResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    @GetMapping("/health")
    public ApiResponse<OperationResponse> health() {
        return ApiResponse.success(OperationResponse.ok());
    }
}
