package com.imperium.riskguide.ai.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.riskguide.ai.stage.StageContext;
import com.imperium.riskguide.model.entity.AgentEventLog;
import com.imperium.riskguide.model.political.Citation;
import com.imperium.riskguide.model.political.PoliticalRiskAnalysis;
import com.imperium.riskguide.service.AgentLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Spring AI Tool: 政治风险分析结构化、入库与引用提取。
 * <p>
 * 入库的事件 action 固定为 {@value #POLITICAL_JSON_ACTION}，国家风险热力图函数据此读取。
 */
@Component
public class PoliticalRiskTool {

    private static final Logger log = LoggerFactory.getLogger(PoliticalRiskTool.class);

    public static final String POLITICAL_JSON_ACTION = "Political Risk JSON Data";

    private final PoliticalRiskParser parser;
    private final AgentLogService agentLogService;
    private final ObjectMapper objectMapper;

    public PoliticalRiskTool(PoliticalRiskParser parser, AgentLogService agentLogService, ObjectMapper objectMapper) {
        this.parser = parser;
        this.agentLogService = agentLogService;
        this.objectMapper = objectMapper;
    }

    @Tool(name = "convert_to_json",
            description = "Convert a political risk analysis (markdown with the 9-column risk table) to JSON.")
    public PoliticalRiskAnalysis convertToJson(
            @ToolParam(description = "The full political risk analysis text") String riskAnalysis) {
        return parser.parse(riskAnalysis);
    }

    @Tool(name = "store_political_json_output_agent_event",
            description = "Store the political risk analysis as structured JSON in the agent event log. "
                    + "Call it once with your final analysis, including the risk table.")
    public Map<String, Object> storePoliticalJsonOutput(
            @ToolParam(description = "The full political risk analysis text") String riskAnalysis,
            ToolContext toolContext) {
        StageContext ctx = StageContext.from(toolContext);
        Map<String, Object> result = new LinkedHashMap<>();
        String eventId = storeAnalysisEvent(riskAnalysis, ctx);
        if (eventId != null) {
            result.put("success", true);
            result.put("message", "Political risk JSON data stored in agent event log");
            result.put("event_id", eventId);
        } else {
            result.put("success", false);
            result.put("message", "Failed to store political risk JSON in event log");
        }
        return result;
    }

    @Tool(name = "extract_citations",
            description = "Extract citations (title, source, url, publication date, country, risk type) from the "
                    + "political risk table, de-duplicated by url and title.")
    public Map<String, Object> extractCitations(
            @ToolParam(description = "The full political risk analysis text") String riskAnalysis) {
        List<Citation> citations = parser.extractCitations(riskAnalysis);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("citations", citations);
        result.put("count", citations.size());
        result.put("timestamp", LocalDateTime.now().toString());
        return result;
    }

    /**
     * 解析分析文本并写入事件日志。成功后在上下文中标记，避免同一次阶段调用重复写入。
     *
     * @return 事件 ID；序列化或写入失败时返回 null
     */
    public String storeAnalysisEvent(String riskAnalysis, StageContext ctx) {
        PoliticalRiskAnalysis analysis = parser.parse(riskAnalysis);
        String json;
        try {
            json = objectMapper.writeValueAsString(analysis);
        } catch (JsonProcessingException e) {
            log.warn("Political risk JSON serialization failed: {}", e.getMessage());
            return null;
        }
        String eventId = UUID.randomUUID().toString();
        boolean stored = agentLogService.logEvent(AgentEventLog.builder()
                .eventId(eventId)
                .agentName(ctx.getAgentName())
                .action(POLITICAL_JSON_ACTION)
                .resultSummary("Structured JSON data with " + analysis.getPoliticalRisks().size() + " political risks")
                .agentOutput(json)
                .conversationId(ctx.getConversationId())
                .sessionId(ctx.getSessionId())
                .build());
        if (!stored) {
            return null;
        }
        ctx.markPoliticalJsonStored();
        return eventId;
    }
}
