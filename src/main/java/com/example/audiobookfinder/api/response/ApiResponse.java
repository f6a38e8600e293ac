package com.example.audiobookfinder.api.response;

import com.example.audiobookfinder.common.exception.BusinessException;
import com.example.audiobookfinder.common.logging.AccessLogFilter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;

/**
 * Envelope for every endpoint. {@code code} is {@value #SUCCESS_CODE} on success, otherwise the
 * HTTP status or business error code; {@code trace_id} echoes the request's {@code X-Request-Id}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    public static final String SUCCESS_CODE = "0";
    private static final String SUCCESS_MESSAGE = "OK";

    private String code;
    private String message;
    private T data;
    private String userAction;
    private String traceId;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(SUCCESS_CODE, SUCCESS_MESSAGE, data, null, currentTraceId());
    }

    public static <T> ApiResponse<T> fail(String code, String message) {
        return new ApiResponse<>(code, message, null, null, currentTraceId());
    }

    public static <T> ApiResponse<T> fail(BusinessException e) {
        return new ApiResponse<>(e.getCode(), e.getMessage(), null, e.getUserAction(), currentTraceId());
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return SUCCESS_CODE.equals(code);
    }

    private static String currentTraceId() {
        return MDC.get(AccessLogFilter.MDC_REQUEST_ID);
    }
}
