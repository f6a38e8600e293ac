package com.example.audiobookfinder.domain.enumtype;

/**
 * Lifecycle of a download record. PENDING and DOWNLOADING can move forward only;
 * COMPLETED and FAILED are terminal. The persisted value is {@link #getCode()}.
 */
public enum DownloadStatus {

    PENDING("pending"),
    DOWNLOADING("downloading"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String code;

    DownloadStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
