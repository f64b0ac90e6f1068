package com.imperium.riskguide.service;

import com.imperium.riskguide.model.entity.AgentEventLog;
import com.imperium.riskguide.model.entity.AgentThinkingLog;

import java.util.List;

/**
 * 智能体审计日志：思考过程日志与事件日志的写入和查询。
 * <p>
 * 写入均为尽力而为：走统一重试策略，重试用尽后记录错误并返回 false，不向调用方抛出，
 * 不影响阶段的主流程输出。
 */
public interface AgentLogService {

    /**
     * 写一条思考日志。大文本字段（thought_content / thinking_stage_output / agent_output）落库前截断。
     * 未给出 conversationId 时生成一个。
     *
     * @return 是否写入成功
     */
    boolean logThinking(AgentThinkingLog entry);

    /**
     * 写一条事件日志，eventId / eventTime 为空时自动补齐。
     *
     * @return 是否写入成功
     */
    boolean logEvent(AgentEventLog event);

    /**
     * 记录阶段的完整回复（thinking_stage = complete_response）。
     */
    boolean logAgentResponse(String agentName, String responseContent,
                             String conversationId, String sessionId, String userQuery);

    /**
     * 记录阶段错误（thinking_stage = error，status = error）。
     */
    boolean logAgentError(String agentName, String errorType, String errorMessage,
                          String conversationId, String sessionId, String userQuery);

    /**
     * 按条件查询思考日志，按 created_date 倒序。各过滤条件为空时不生效。
     */
    List<AgentThinkingLog> findThinkingLogs(String conversationId, String sessionId, String agentName, int limit);

    /**
     * 某次对话的事件日志，按 event_time 正序。
     */
    List<AgentEventLog> findConversationHistory(String conversationId);
}
