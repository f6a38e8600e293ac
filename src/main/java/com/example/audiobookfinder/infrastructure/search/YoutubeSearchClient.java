package com.example.audiobookfinder.infrastructure.search;

import com.example.audiobookfinder.common.config.AppSearchProperties;
import com.example.audiobookfinder.domain.model.VideoSearchHit;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.PreDestroy;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scrapes the YouTube results page. The page embeds its initial render state as a
 * {@code ytInitialData} JSON object; video entries are {@code videoRenderer} nodes inside
 * the primary section list.
 */
@Component
public class YoutubeSearchClient implements VideoSearchProvider {

    private static final Logger log = LoggerFactory.getLogger(YoutubeSearchClient.class);

    private static final String INITIAL_DATA_MARKER = "ytInitialData";

    private final AppSearchProperties properties;
    private final ObjectMapper objectMapper;
    private final CloseableHttpClient httpClient;

    public YoutubeSearchClient(AppSearchProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(properties.getConnectTimeoutMs())
                .setConnectionRequestTimeout(properties.getConnectTimeoutMs())
                .setSocketTimeout(properties.getSocketTimeoutMs())
                .build();
        this.httpClient = HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .setUserAgent(properties.getUserAgent())
                .build();
    }

    @Override
    public List<VideoSearchHit> search(String query, int maxResults) throws IOException {
        String url = buildSearchUrl(query);
        HttpGet get = new HttpGet(url);
        get.setHeader(HttpHeaders.ACCEPT_LANGUAGE, properties.getAcceptLanguage());
        try (CloseableHttpResponse response = httpClient.execute(get)) {
            int statusCode = response.getStatusLine().getStatusCode();
            String body = response.getEntity() == null
                    ? ""
                    : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
            if (statusCode != HttpStatus.SC_OK) {
                throw new IOException("YouTube search returned HTTP " + statusCode);
            }
            List<VideoSearchHit> hits = parseResults(body, maxResults);
            log.debug("YOUTUBE_SEARCH_FETCHED url={} hits={}", url, hits.size());
            return hits;
        }
    }

    String buildSearchUrl(String query) {
        String baseUrl = properties.getBaseUrl();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl + "/results?search_query=" + URLEncoder.encode(query, StandardCharsets.UTF_8);
    }

    List<VideoSearchHit> parseResults(String html, int maxResults) throws IOException {
        JsonNode initialData = objectMapper.readTree(extractInitialData(html));
        JsonNode sections = initialData.path("contents")
                .path("twoColumnSearchResultsRenderer")
                .path("primaryContents")
                .path("sectionListRenderer")
                .path("contents");

        List<VideoSearchHit> hits = new ArrayList<>();
        for (JsonNode section : sections) {
            for (JsonNode item : section.path("itemSectionRenderer").path("contents")) {
                JsonNode video = item.path("videoRenderer");
                if (video.isMissingNode()) {
                    continue;
                }
                String videoId = textOrNull(video.path("videoId"));
                if (videoId == null) {
                    continue;
                }
                hits.add(new VideoSearchHit(
                        videoId,
                        firstRunText(video.path("title")),
                        firstRunText(video.path("longBylineText")),
                        textOrNull(video.path("lengthText").path("simpleText")),
                        textOrNull(video.path("publishedTimeText").path("simpleText")),
                        textOrNull(video.path("viewCountText").path("simpleText"))));
                if (maxResults > 0 && hits.size() >= maxResults) {
                    return hits;
                }
            }
        }
        return hits;
    }

    private String extractInitialData(String html) throws IOException {
        int markerIndex = html.indexOf(INITIAL_DATA_MARKER);
        if (markerIndex < 0) {
            throw new IOException("ytInitialData not found in search page");
        }
        int start = html.indexOf('{', markerIndex);
        int end = start < 0 ? -1 : html.indexOf("};", start);
        if (start < 0 || end < 0) {
            throw new IOException("ytInitialData is truncated");
        }
        return html.substring(start, end + 1);
    }

    private String firstRunText(JsonNode node) {
        JsonNode runs = node.path("runs");
        if (runs.isArray() && runs.size() > 0) {
            return textOrNull(runs.get(0).path("text"));
        }
        return textOrNull(node.path("simpleText"));
    }

    private String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isEmpty() ? null : text;
    }

    @PreDestroy
    public void close() {
        try {
            httpClient.close();
        } catch (IOException e) {
            log.warn("Failed to close YouTube search http client", e);
        }
    }
}
