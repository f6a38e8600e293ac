package com.example.audiobookfinder.api.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.audiobookfinder.application.service.AudiobookSearchService;
import com.example.audiobookfinder.domain.model.SearchResult;
import java.util.Collections;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SearchController.class)
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AudiobookSearchService audiobookSearchService;

    @Test
    void searchReturnsResultsAndEchoesQuery() throws Exception {
        when(audiobookSearchService.search("dune", 3)).thenReturn(Collections.singletonList(
                new SearchResult("d1", "Dune Audiobook", "Reader", "N/A", "N/A", "N/A",
                        "https://www.youtube.com/watch?v=d1", "https://i.ytimg.com/vi/d1/hqdefault.jpg")));

        mockMvc.perform(post("/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"dune\",\"maxResults\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.query").value("dune"))
                .andExpect(jsonPath("$.data.results[0].id").value("d1"))
                .andExpect(jsonPath("$.data.results[0].publish_time").value("N/A"))
                .andExpect(jsonPath("$.data.results[0].view_count").value("N/A"));
    }
}
