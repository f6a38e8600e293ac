package com.example.audiobookfinder.api.request;

import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CreateDownloadRequest {

    @NotBlank
    private String bookTitle;

    /** May be empty; the file name then uses "Unknown". */
    private String author;

    @NotBlank
    private String youtubeUrl;

    @NotBlank
    private String youtubeTitle;
}
