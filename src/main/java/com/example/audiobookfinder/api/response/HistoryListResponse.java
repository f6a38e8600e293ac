package com.example.audiobookfinder.api.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HistoryListResponse {

    private List<HistoryItemResponse> items;
}
