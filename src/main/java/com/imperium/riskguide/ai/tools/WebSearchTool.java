package com.imperium.riskguide.ai.tools;

import com.imperium.riskguide.ai.stage.StageContext;
import com.imperium.riskguide.model.dto.search.SearchResult;
import com.imperium.riskguide.model.dto.search.WebSearchToolResult;
import com.imperium.riskguide.service.WebSearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Spring AI Tool: 网页搜索。每次阶段调用内最多执行 app.search.max-calls-per-stage 次。
 */
@Component
public class WebSearchTool {

    private static final Logger log = LoggerFactory.getLogger(WebSearchTool.class);

    private final WebSearchService webSearchService;
    private final int maxCallsPerStage;

    public WebSearchTool(WebSearchService webSearchService,
                         @Value("${app.search.max-calls-per-stage:2}") int maxCallsPerStage) {
        this.webSearchService = webSearchService;
        this.maxCallsPerStage = Math.max(1, maxCallsPerStage);
    }

    @Tool(name = "web_search",
            description = "Search the web for recent news and public information. Input should be a short English "
                    + "query. Returns a list of results with title, source, url and snippet. "
                    + "Call it once with a well-formed query; repeated calls may be refused.")
    public WebSearchToolResult webSearch(
            @ToolParam(description = "Search query, e.g. \"Germany political risk 2025 manufacturing\"") String query,
            ToolContext toolContext) {
        StageContext ctx = StageContext.from(toolContext);
        if (query == null || query.isBlank()) {
            return WebSearchToolResult.skipped(query, "query is required");
        }
        int call = ctx.incrementSearchCalls();
        if (call > maxCallsPerStage) {
            log.info("{} exceeded search budget ({} calls), query skipped: {}", ctx.getAgentName(), maxCallsPerStage, query);
            return WebSearchToolResult.skipped(query,
                    "Search limit reached for this analysis. Use the results already retrieved.");
        }
        List<SearchResult> results = webSearchService.search(query);
        log.info("{} web_search #{} '{}' -> {} results", ctx.getAgentName(), call, query, results.size());
        return WebSearchToolResult.builder().query(query).results(results).build();
    }
}
