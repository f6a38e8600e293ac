package com.example.audiobookfinder.api.response;

import com.example.audiobookfinder.domain.model.SearchResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

    private List<SearchResult> results;

    private String query;
}
