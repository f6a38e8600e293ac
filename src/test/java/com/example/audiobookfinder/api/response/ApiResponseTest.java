package com.example.audiobookfinder.api.response;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.audiobookfinder.common.exception.BusinessException;
import com.example.audiobookfinder.common.logging.AccessLogFilter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

class ApiResponseTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void successShouldCarryDataAndRequestId() {
        MDC.put(AccessLogFilter.MDC_REQUEST_ID, "req-1");

        ApiResponse<String> response = ApiResponse.success("done");

        assertTrue(response.isSuccessful());
        assertEquals("0", response.getCode());
        assertEquals("done", response.getData());
        assertEquals("req-1", response.getTraceId());
    }

    @Test
    void failShouldCopyBusinessError() {
        BusinessException e = new BusinessException(HttpStatus.SERVICE_UNAVAILABLE,
                "DOWNLOAD_EXECUTOR_REJECTED", "Download could not be scheduled", "Retry later");

        ApiResponse<Void> response = ApiResponse.fail(e);

        assertFalse(response.isSuccessful());
        assertEquals("DOWNLOAD_EXECUTOR_REJECTED", response.getCode());
        assertEquals("Download could not be scheduled", response.getMessage());
        assertEquals("Retry later", response.getUserAction());
        assertNull(response.getData());
        assertNull(response.getTraceId());
    }
}
