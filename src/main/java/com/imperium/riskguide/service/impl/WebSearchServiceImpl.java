package com.imperium.riskguide.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.riskguide.model.dto.search.SearchResult;
import com.imperium.riskguide.service.WebSearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * DuckDuckGo Instant Answer JSON 接口：摘要 + RelatedTopics 拍平为结果列表。
 * 请求头必须带 User-Agent。
 */
@Service
public class WebSearchServiceImpl implements WebSearchService {

    private static final Logger log = LoggerFactory.getLogger(WebSearchServiceImpl.class);

    private static final String USER_AGENT = "RiskGuide/1.0 (equipment schedule risk analysis)";
    private static final int SNIPPET_MAX_CHARS = 500;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String endpoint;
    private final int maxResults;

    @Autowired
    public WebSearchServiceImpl(ObjectMapper objectMapper,
                                @Value("${app.search.endpoint:https://api.duckduckgo.com/}") String endpoint,
                                @Value("${app.search.max-results:5}") int maxResults) {
        this(new RestTemplate(), objectMapper, endpoint, maxResults);
    }

    WebSearchServiceImpl(RestTemplate restTemplate, ObjectMapper objectMapper, String endpoint, int maxResults) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
        this.maxResults = Math.max(1, maxResults);
    }

    @Override
    public List<SearchResult> search(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String url = endpoint + "?q=" + URLEncoder.encode(query.trim(), StandardCharsets.UTF_8)
                + "&format=json&no_html=1&skip_disambig=1";
        HttpHeaders headers = new HttpHeaders();
        headers.set("User-Agent", USER_AGENT);

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    URI.create(url), HttpMethod.GET, new HttpEntity<Void>(headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                return List.of();
            }
            return parse(response.getBody());
        } catch (Exception e) {
            log.warn("Web search failed for '{}': {}", query, e.getMessage());
            return List.of();
        }
    }

    List<SearchResult> parse(String json) {
        List<SearchResult> results = new ArrayList<>();
        try {
            JsonNode root = objectMapper.readTree(json);
            String abstractText = root.path("AbstractText").asText("");
            if (!abstractText.isBlank()) {
                results.add(SearchResult.builder()
                        .title(root.path("Heading").asText(""))
                        .source(root.path("AbstractSource").asText(""))
                        .url(root.path("AbstractURL").asText(""))
                        .snippet(clip(abstractText))
                        .build());
            }
            collectTopics(root.path("RelatedTopics"), results);
        } catch (Exception e) {
            log.warn("Unreadable search response: {}", e.getMessage());
            return List.of();
        }
        return results.size() > maxResults ? List.copyOf(results.subList(0, maxResults)) : results;
    }

    private void collectTopics(JsonNode topics, List<SearchResult> out) {
        if (!topics.isArray()) {
            return;
        }
        for (JsonNode topic : topics) {
            if (out.size() >= maxResults) {
                return;
            }
            // 分组节点：{"Name": ..., "Topics": [...]}
            if (topic.has("Topics")) {
                collectTopics(topic.get("Topics"), out);
                continue;
            }
            String text = topic.path("Text").asText("");
            String firstUrl = topic.path("FirstURL").asText("");
            if (text.isBlank()) continue;

            int dash = text.indexOf(" - ");
            String title = dash > 0 ? text.substring(0, dash) : text;
            out.add(SearchResult.builder()
                    .title(title)
                    .source(hostOf(firstUrl))
                    .url(firstUrl)
                    .snippet(clip(text))
                    .build());
        }
    }

    private static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host : "";
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    private static String clip(String text) {
        return text.length() > SNIPPET_MAX_CHARS ? text.substring(0, SNIPPET_MAX_CHARS) + "..." : text;
    }
}
