package com.imperium.riskguide.ai.stage;

import com.imperium.riskguide.ai.tools.AgentThinkingTool;
import com.imperium.riskguide.ai.tools.PoliticalRiskTool;
import com.imperium.riskguide.ai.tools.ReportFileTool;
import com.imperium.riskguide.ai.tools.RiskScoringTool;
import com.imperium.riskguide.ai.tools.ScheduleDataTool;
import com.imperium.riskguide.ai.tools.WebSearchTool;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 各阶段可调用的固定工具集合。
 */
@Component
public class StageToolRegistry {

    private final Map<AgentStage, List<ToolCallback>> toolsByStage = new EnumMap<>(AgentStage.class);

    public StageToolRegistry(ScheduleDataTool scheduleDataTool,
                             RiskScoringTool riskScoringTool,
                             AgentThinkingTool agentThinkingTool,
                             WebSearchTool webSearchTool,
                             PoliticalRiskTool politicalRiskTool,
                             ReportFileTool reportFileTool) {
        register(AgentStage.SCHEDULER_AGENT, scheduleDataTool, riskScoringTool, agentThinkingTool);
        register(AgentStage.POLITICAL_RISK_AGENT, webSearchTool, politicalRiskTool, agentThinkingTool);
        register(AgentStage.TARIFF_RISK_AGENT, webSearchTool, agentThinkingTool);
        register(AgentStage.LOGISTICS_RISK_AGENT, webSearchTool, agentThinkingTool);
        register(AgentStage.REPORTING_AGENT, reportFileTool, agentThinkingTool);
        register(AgentStage.ASSISTANT_AGENT, agentThinkingTool);
    }

    public List<ToolCallback> toolsFor(AgentStage stage) {
        return toolsByStage.getOrDefault(stage, List.of());
    }

    private void register(AgentStage stage, Object... toolObjects) {
        ToolCallback[] callbacks = MethodToolCallbackProvider.builder()
                .toolObjects(toolObjects)
                .build()
                .getToolCallbacks();
        toolsByStage.put(stage, Collections.unmodifiableList(Arrays.asList(callbacks)));
    }
}
