package com.imperium.riskguide.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.imperium.riskguide.mapper.AgentEventLogMapper;
import com.imperium.riskguide.mapper.AgentThinkingLogMapper;
import com.imperium.riskguide.model.entity.AgentEventLog;
import com.imperium.riskguide.model.entity.AgentThinkingLog;
import com.imperium.riskguide.policy.StoreRetryPolicy;
import com.imperium.riskguide.policy.TextTruncationPolicy;
import com.imperium.riskguide.service.AgentLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Service
public class AgentLogServiceImpl implements AgentLogService {

    private static final Logger log = LoggerFactory.getLogger(AgentLogServiceImpl.class);

    public static final String STAGE_COMPLETE_RESPONSE = "complete_response";
    public static final String STAGE_ERROR = "error";
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    private static final String THINKING_TABLE = "dim_agent_thinking_log";
    private static final String EVENT_TABLE = "dim_agent_event_log";

    private final AgentThinkingLogMapper thinkingLogMapper;
    private final AgentEventLogMapper eventLogMapper;
    private final StoreRetryPolicy retryPolicy;
    private final int maxTextLength;

    @Value("${spring.ai.openai.chat.options.model:gpt-4o}")
    private String modelName = "gpt-4o";

    public AgentLogServiceImpl(AgentThinkingLogMapper thinkingLogMapper,
                               AgentEventLogMapper eventLogMapper,
                               StoreRetryPolicy retryPolicy,
                               @Value("${app.log.max-text-length:50000}") int maxTextLength) {
        this.thinkingLogMapper = thinkingLogMapper;
        this.eventLogMapper = eventLogMapper;
        this.retryPolicy = retryPolicy;
        this.maxTextLength = maxTextLength;
    }

    @Override
    public boolean logThinking(AgentThinkingLog entry) {
        if (entry.getConversationId() == null || entry.getConversationId().isBlank()) {
            entry.setConversationId(UUID.randomUUID().toString());
        }
        entry.setThoughtContent(TextTruncationPolicy.truncate(entry.getThoughtContent(), maxTextLength));
        entry.setThinkingStageOutput(TextTruncationPolicy.truncate(entry.getThinkingStageOutput(), maxTextLength));
        entry.setAgentOutput(TextTruncationPolicy.truncate(entry.getAgentOutput(), maxTextLength));
        if (entry.getStatus() == null) {
            entry.setStatus(STATUS_SUCCESS);
        }
        if (entry.getModelDeploymentName() == null) {
            entry.setModelDeploymentName(modelName);
        }
        if (entry.getCreatedDate() == null) {
            entry.setCreatedDate(LocalDateTime.now());
        }
        return insert(THINKING_TABLE, () -> thinkingLogMapper.insert(entry));
    }

    @Override
    public boolean logEvent(AgentEventLog event) {
        if (event.getConversationId() == null || event.getConversationId().isBlank()) {
            event.setConversationId(UUID.randomUUID().toString());
        }
        if (event.getEventId() == null) {
            event.setEventId(UUID.randomUUID().toString());
        }
        LocalDateTime now = LocalDateTime.now();
        if (event.getEventTime() == null) {
            event.setEventTime(now);
        }
        if (event.getCreatedDate() == null) {
            event.setCreatedDate(now);
        }
        return insert(EVENT_TABLE, () -> eventLogMapper.insert(event));
    }

    @Override
    public boolean logAgentResponse(String agentName, String responseContent,
                                    String conversationId, String sessionId, String userQuery) {
        return logThinking(AgentThinkingLog.builder()
                .agentName(agentName)
                .thinkingStage(STAGE_COMPLETE_RESPONSE)
                .thoughtContent("Complete response from " + agentName)
                .thinkingStageOutput(responseContent)
                .agentOutput(responseContent)
                .conversationId(conversationId)
                .sessionId(sessionId)
                .userQuery(userQuery)
                .status(STATUS_SUCCESS)
                .build());
    }

    @Override
    public boolean logAgentError(String agentName, String errorType, String errorMessage,
                                 String conversationId, String sessionId, String userQuery) {
        return logThinking(AgentThinkingLog.builder()
                .agentName(agentName)
                .thinkingStage(STAGE_ERROR)
                .thoughtContent("Error type: " + errorType + "\nError message: " + errorMessage)
                .conversationId(conversationId)
                .sessionId(sessionId)
                .userQuery(userQuery)
                .status(STATUS_ERROR)
                .build());
    }

    @Override
    public List<AgentThinkingLog> findThinkingLogs(String conversationId, String sessionId, String agentName, int limit) {
        QueryWrapper<AgentThinkingLog> query = new QueryWrapper<AgentThinkingLog>()
                .eq(conversationId != null && !conversationId.isBlank(), "conversation_id", conversationId)
                .eq(sessionId != null && !sessionId.isBlank(), "session_id", sessionId)
                .eq(agentName != null && !agentName.isBlank(), "agent_name", agentName)
                .orderByDesc("created_date")
                .last("LIMIT " + Math.max(1, limit));
        return thinkingLogMapper.selectList(query);
    }

    @Override
    public List<AgentEventLog> findConversationHistory(String conversationId) {
        QueryWrapper<AgentEventLog> query = new QueryWrapper<AgentEventLog>()
                .eq("conversation_id", conversationId)
                .orderByAsc("event_time");
        return eventLogMapper.selectList(query);
    }

    private boolean insert(String table, Runnable action) {
        try {
            retryPolicy.run("insert " + table, action);
            return true;
        } catch (RuntimeException e) {
            // 日志写入失败不影响阶段输出，只在应用日志中留痕
            log.error("Dropped {} record after retries: {}", table, e.getMessage());
            return false;
        }
    }
}
