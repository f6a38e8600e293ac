package com.example.audiobookfinder.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateDownloadResponse {

    private boolean ok;

    private Long downloadId;
}
