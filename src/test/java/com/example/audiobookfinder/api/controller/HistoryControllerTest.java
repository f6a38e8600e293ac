package com.example.audiobookfinder.api.controller;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.audiobookfinder.api.response.HistoryItemResponse;
import com.example.audiobookfinder.application.service.DownloadHistoryService;
import java.util.Collections;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(HistoryController.class)
class HistoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DownloadHistoryService downloadHistoryService;

    @Test
    void historyListsRecordsWithSnakeCaseFields() throws Exception {
        when(downloadHistoryService.listRecent(null)).thenReturn(Collections.singletonList(
                new HistoryItemResponse(9L, "Dune", "Frank Herbert", "Dune Audiobook",
                        "https://www.youtube.com/watch?v=d1", "/downloads/Dune.mp3",
                        "2024-05-01 10:00:00", "completed", 100.0D, 300L, 300L)));

        mockMvc.perform(get("/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.items[0].id").value(9))
                .andExpect(jsonPath("$.data.items[0].book_title").value("Dune"))
                .andExpect(jsonPath("$.data.items[0].added_at").value("2024-05-01 10:00:00"))
                .andExpect(jsonPath("$.data.items[0].status").value("completed"));
    }

    @Test
    void historyPassesLimitThrough() throws Exception {
        when(downloadHistoryService.listRecent(5)).thenReturn(Collections.emptyList());

        mockMvc.perform(get("/history").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.items").isEmpty());

        verify(downloadHistoryService).listRecent(5);
    }

    @Test
    void deleteAlwaysSucceeds() throws Exception {
        mockMvc.perform(delete("/history/12345"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.ok").value(true));

        verify(downloadHistoryService).delete(12345L);
    }

    @Test
    void initDbResetsHistory() throws Exception {
        mockMvc.perform(post("/init-db"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.message").value("Database initialized successfully"));

        verify(downloadHistoryService).resetHistory();
    }
}
