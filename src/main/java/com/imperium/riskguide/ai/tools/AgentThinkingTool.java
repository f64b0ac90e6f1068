package com.imperium.riskguide.ai.tools;

import com.imperium.riskguide.ai.stage.StageContext;
import com.imperium.riskguide.model.entity.AgentThinkingLog;
import com.imperium.riskguide.service.AgentLogService;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spring AI Tool: 记录智能体思考过程。所有阶段均可调用。
 */
@Component
public class AgentThinkingTool {

    private final AgentLogService agentLogService;

    public AgentThinkingTool(AgentLogService agentLogService) {
        this.agentLogService = agentLogService;
    }

    @Tool(name = "log_agent_thinking",
            description = "Logs your thinking process for audit. Call it at key steps such as analysis_start, "
                    + "data_review, risk_calculation, source_evaluation or final_assessment.")
    public Map<String, Object> logAgentThinking(
            @ToolParam(description = "Current thinking stage, e.g. analysis_start, data_review, risk_calculation")
            String thinkingStage,
            @ToolParam(description = "Your thoughts at this stage") String thoughtContent,
            @ToolParam(description = "Output produced at this stage", required = false) String thinkingStageOutput,
            @ToolParam(description = "success or error, default success", required = false) String status,
            ToolContext toolContext) {
        StageContext ctx = StageContext.from(toolContext);
        boolean stored = agentLogService.logThinking(AgentThinkingLog.builder()
                .agentName(ctx.getAgentName())
                .thinkingStage(thinkingStage != null && !thinkingStage.isBlank() ? thinkingStage : "unspecified")
                .thoughtContent(thoughtContent != null ? thoughtContent : "")
                .thinkingStageOutput(thinkingStageOutput)
                .conversationId(ctx.getConversationId())
                .sessionId(ctx.getSessionId())
                .userQuery(ctx.getUserQuery())
                .status(status != null && !status.isBlank() ? status : null)
                .build());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", stored);
        result.put("conversation_id", ctx.getConversationId());
        return result;
    }
}
