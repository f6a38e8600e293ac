package com.example.audiobookfinder.api.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.audiobookfinder.api.request.CreateDownloadRequest;
import com.example.audiobookfinder.api.response.CreateDownloadResponse;
import com.example.audiobookfinder.api.response.DownloadProgressResponse;
import com.example.audiobookfinder.application.service.DownloadHistoryService;
import com.example.audiobookfinder.application.service.DownloadJobService;
import com.example.audiobookfinder.common.exception.BusinessException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DownloadController.class)
class DownloadControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DownloadJobService downloadJobService;

    @MockBean
    private DownloadHistoryService downloadHistoryService;

    @Test
    void createDownloadReturnsNewId() throws Exception {
        when(downloadJobService.createDownload(any(CreateDownloadRequest.class)))
                .thenReturn(new CreateDownloadResponse(true, 12L));

        mockMvc.perform(post("/download")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"book_title\":\"Dune\",\"author\":\"Frank Herbert\","
                                + "\"youtube_url\":\"https://www.youtube.com/watch?v=d1\","
                                + "\"youtube_title\":\"Dune Audiobook\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0"))
                .andExpect(jsonPath("$.data.ok").value(true))
                .andExpect(jsonPath("$.data.download_id").value(12));
    }

    @Test
    void blankBookTitleIsRejected() throws Exception {
        mockMvc.perform(post("/download")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"book_title\":\"  \","
                                + "\"youtube_url\":\"https://www.youtube.com/watch?v=d1\","
                                + "\"youtube_title\":\"Dune Audiobook\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("400"))
                .andExpect(jsonPath("$.message").value("Missing required field: book_title"));

        verifyNoInteractions(downloadJobService);
    }

    @Test
    void missingBodyIsRejected() throws Exception {
        mockMvc.perform(post("/download").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No JSON data provided"));
    }

    @Test
    void progressReturnsRecordState() throws Exception {
        when(downloadHistoryService.getProgress(3L)).thenReturn(new DownloadProgressResponse(
                3L, "downloading", 25.0D, 200L, 50L, "Dune", "", "Dune Audiobook",
                "https://www.youtube.com/watch?v=d1"));

        mockMvc.perform(get("/progress/3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("downloading"))
                .andExpect(jsonPath("$.data.progress").value(25.0D))
                .andExpect(jsonPath("$.data.total_size").value(200))
                .andExpect(jsonPath("$.data.downloaded_size").value(50));
    }

    @Test
    void progressOfUnknownDownloadIsNotFound() throws Exception {
        when(downloadHistoryService.getProgress(404L))
                .thenThrow(new BusinessException("404", "Download not found"));

        mockMvc.perform(get("/progress/404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("404"))
                .andExpect(jsonPath("$.message").value("Download not found"));
    }
}
