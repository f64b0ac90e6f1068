package com.imperium.riskguide.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.riskguide.model.dto.search.SearchResult;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WebSearchServiceImplTest {

    private static final String RESPONSE = """
            {
              "Heading": "Port of Shanghai",
              "AbstractText": "The Port of Shanghai is the world's busiest container port.",
              "AbstractSource": "Wikipedia",
              "AbstractURL": "https://en.wikipedia.org/wiki/Port_of_Shanghai",
              "RelatedTopics": [
                {"Text": "Yangshan Port - deep-water port", "FirstURL": "https://duckduckgo.com/Yangshan_Port"},
                {"Name": "Shipping", "Topics": [
                  {"Text": "Container ship - cargo ship", "FirstURL": "https://duckduckgo.com/Container_ship"},
                  {"Text": "", "FirstURL": "https://duckduckgo.com/empty"}
                ]},
                {"Text": "Port congestion - delays", "FirstURL": "https://duckduckgo.com/Port_congestion"}
              ]
            }
            """;

    private WebSearchServiceImpl service(int maxResults) {
        return new WebSearchServiceImpl(new RestTemplate(), new ObjectMapper(), "https://api.duckduckgo.com/",
                maxResults);
    }

    @Test
    public void shouldFlattenAbstractAndNestedTopics() {
        List<SearchResult> results = service(10).parse(RESPONSE);

        assertEquals(4, results.size());
        assertEquals("Port of Shanghai", results.get(0).getTitle());
        assertEquals("Wikipedia", results.get(0).getSource());
        assertEquals("Yangshan Port", results.get(1).getTitle());
        assertEquals("duckduckgo.com", results.get(1).getSource());
        assertEquals("Container ship", results.get(2).getTitle());
        assertEquals("https://duckduckgo.com/Port_congestion", results.get(3).getUrl());
    }

    @Test
    public void shouldCapResultCount() {
        assertEquals(2, service(2).parse(RESPONSE).size());
    }

    @Test
    public void shouldReturnEmptyListForUnreadableResponse() {
        assertTrue(service(5).parse("<html>blocked</html>").isEmpty());
        assertTrue(service(5).search("  ").isEmpty());
    }
}
