package com.example.audiobookfinder.common.exception;

import com.example.audiobookfinder.api.response.ApiResponse;
import java.util.Locale;
import javax.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException e) {
        if (e.getStatus().is5xxServerError()) {
            log.error("BUSINESS_ERROR code={} message={}", e.getCode(), e.getMessage(), e);
        } else {
            log.warn("BUSINESS_REJECTED code={} message={}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(e.getStatus())
                .body(ApiResponse.fail(e));
    }

    /**
     * MethodArgumentNotValidException is a BindException subclass.
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ApiResponse<Void>> handleBindException(BindException e) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String message = fieldError == null
                ? "Invalid request parameters"
                : "Missing required field: " + toSnakeCase(fieldError.getField());
        log.warn("REQUEST_REJECTED reason=validation message={}", message);
        return ResponseEntity.badRequest().body(ApiResponse.fail("400", message));
    }

    @ExceptionHandler({ConstraintViolationException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleValidationException(Exception e) {
        return ResponseEntity.badRequest().body(ApiResponse.fail("400", "Invalid request parameters"));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(ApiResponse.fail("400", "No JSON data provided"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        log.error("Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.fail("500", "Internal server error: " + e.getMessage()));
    }

    private String toSnakeCase(String field) {
        return field.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT);
    }
}
