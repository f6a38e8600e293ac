package com.example.audiobookfinder.common.exception;

import org.springframework.http.HttpStatus;

public class BusinessException extends RuntimeException {

    private final HttpStatus status;
    private final String code;
    private final String userAction;

    public BusinessException(String code, String message) {
        this(code, message, null);
    }

    public BusinessException(String code, String message, String userAction) {
        this(resolveStatus(code), code, message, userAction);
    }

    public BusinessException(HttpStatus status, String code, String message, String userAction) {
        super(message);
        this.status = status;
        this.code = code;
        this.userAction = userAction;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }

    private static HttpStatus resolveStatus(String code) {
        if (code != null && code.matches("\\d{3}")) {
            HttpStatus resolved = HttpStatus.resolve(Integer.parseInt(code));
            if (resolved != null) {
                return resolved;
            }
        }
        return HttpStatus.BAD_REQUEST;
    }
}
