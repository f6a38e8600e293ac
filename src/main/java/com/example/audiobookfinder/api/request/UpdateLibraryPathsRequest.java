package com.example.audiobookfinder.api.request;

import lombok.Data;

@Data
public class UpdateLibraryPathsRequest {

    /** Optional; a missing value keeps the current books directory. */
    private String booksDir;

    /** Optional; a missing value keeps the current download directory. */
    private String downloadDir;
}
