package com.example.audiobookfinder.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LibraryPathsResponse {

    /** Only set on update responses. */
    private Boolean ok;

    private String booksDir;

    private String downloadDir;
}
