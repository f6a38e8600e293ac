package com.example.audiobookfinder.api.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class SearchRequest {

    private String query;

    @JsonProperty("maxResults")
    private Integer maxResults;
}
