package com.imperium.riskguide.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.imperium.riskguide.common.exception.ResourceNotFoundException;
import com.imperium.riskguide.mapper.AgentEventLogMapper;
import com.imperium.riskguide.mapper.AgentThinkingLogMapper;
import com.imperium.riskguide.mapper.RiskAnalyticsMapper;
import com.imperium.riskguide.model.dto.response.AgentThoughtsView;
import com.imperium.riskguide.model.dto.response.ConversationHistoryResponse;
import com.imperium.riskguide.model.dto.response.ConversationView;
import com.imperium.riskguide.model.dto.response.HeatmapEntryDto;
import com.imperium.riskguide.model.dto.response.SessionIdDto;
import com.imperium.riskguide.model.dto.response.SessionMessageDto;
import com.imperium.riskguide.model.dto.response.SessionView;
import com.imperium.riskguide.model.dto.response.ThinkingConversationView;
import com.imperium.riskguide.model.dto.response.ThinkingLogIdDto;
import com.imperium.riskguide.model.dto.response.ThinkingLogSessionView;
import com.imperium.riskguide.model.dto.response.ThoughtDto;
import com.imperium.riskguide.model.entity.AgentEventLog;
import com.imperium.riskguide.model.entity.AgentThinkingLog;
import com.imperium.riskguide.model.row.CountryRiskRow;
import com.imperium.riskguide.model.row.RecentConversationRow;
import com.imperium.riskguide.policy.StoreRetryPolicy;
import com.imperium.riskguide.service.AgentLogService;
import com.imperium.riskguide.service.AuditQueryService;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class AuditQueryServiceImpl implements AuditQueryService {

    /** /api/thinking-logs 读取的最大行数 */
    public static final int THINKING_LOG_LIMIT = 500;

    private static final int RECENT_LIMIT_MAX = 100;

    private final AgentEventLogMapper eventLogMapper;
    private final AgentThinkingLogMapper thinkingLogMapper;
    private final RiskAnalyticsMapper riskAnalyticsMapper;
    private final AgentLogService agentLogService;
    private final StoreRetryPolicy retryPolicy;

    public AuditQueryServiceImpl(AgentEventLogMapper eventLogMapper,
                                 AgentThinkingLogMapper thinkingLogMapper,
                                 RiskAnalyticsMapper riskAnalyticsMapper,
                                 AgentLogService agentLogService,
                                 StoreRetryPolicy retryPolicy) {
        this.eventLogMapper = eventLogMapper;
        this.thinkingLogMapper = thinkingLogMapper;
        this.riskAnalyticsMapper = riskAnalyticsMapper;
        this.agentLogService = agentLogService;
        this.retryPolicy = retryPolicy;
    }

    // ==================== 事件日志视图 ====================

    @Override
    public List<SessionView> listSessions() {
        List<AgentEventLog> rows = eventLogMapper.selectList(
                new QueryWrapper<AgentEventLog>().orderByDesc("created_date"));

        Map<String, Map<String, ConversationView>> sessions = new LinkedHashMap<>();
        for (AgentEventLog row : rows) {
            Map<String, ConversationView> conversations =
                    sessions.computeIfAbsent(row.getSessionId(), k -> new LinkedHashMap<>());
            addEvent(conversations, row, false);
        }

        List<SessionView> result = new ArrayList<>();
        sessions.forEach((sid, convs) -> result.add(SessionView.builder()
                .sessionId(sid)
                .conversations(new ArrayList<>(convs.values()))
                .build()));
        return result;
    }

    @Override
    public SessionView getSession(String sessionId) {
        List<AgentEventLog> rows = eventLogMapper.selectList(new QueryWrapper<AgentEventLog>()
                .eq("session_id", sessionId)
                .orderByAsc("event_time"));
        if (rows.isEmpty()) {
            throw new ResourceNotFoundException("Session", sessionId);
        }
        Map<String, ConversationView> conversations = new LinkedHashMap<>();
        for (AgentEventLog row : rows) {
            addEvent(conversations, row, true);
        }
        return SessionView.builder()
                .sessionId(sessionId)
                .conversations(new ArrayList<>(conversations.values()))
                .build();
    }

    @Override
    public List<SessionIdDto> listSessionIds() {
        List<AgentEventLog> rows = eventLogMapper.selectList(new QueryWrapper<AgentEventLog>()
                .isNotNull("user_query")
                .orderByAsc("event_time"));

        // 正序读入，第一次出现即该会话的首条提问
        Map<String, SessionIdDto> firstBySession = new LinkedHashMap<>();
        for (AgentEventLog row : rows) {
            firstBySession.putIfAbsent(row.getSessionId(), SessionIdDto.builder()
                    .sessionId(row.getSessionId())
                    .userQuery(row.getUserQuery() != null ? row.getUserQuery() : "")
                    .sessionDate(row.getEventTime())
                    .build());
        }
        List<SessionIdDto> result = new ArrayList<>(firstBySession.values());
        result.sort(Comparator.comparing(SessionIdDto::getSessionDate,
                Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder())).reversed());
        return result;
    }

    @Override
    public ConversationHistoryResponse getConversationHistory(String conversationId) {
        List<SessionMessageDto> events = agentLogService.findConversationHistory(conversationId).stream()
                .map(row -> toMessage(row, true))
                .toList();
        return new ConversationHistoryResponse(conversationId, events);
    }

    // ==================== 思考日志视图 ====================

    @Override
    public List<ThinkingLogSessionView> listThinkingLogs() {
        List<AgentThinkingLog> rows = thinkingLogMapper.selectList(new QueryWrapper<AgentThinkingLog>()
                .orderByDesc("created_date")
                .last("LIMIT " + THINKING_LOG_LIMIT));

        Map<String, List<AgentThinkingLog>> bySession = new LinkedHashMap<>();
        for (AgentThinkingLog row : rows) {
            bySession.computeIfAbsent(row.getSessionId(), k -> new ArrayList<>()).add(row);
        }
        List<ThinkingLogSessionView> result = new ArrayList<>();
        bySession.forEach((sid, sessionRows) -> result.add(ThinkingLogSessionView.builder()
                .sessionId(sid)
                .conversations(groupThinking(sessionRows))
                .build()));
        return result;
    }

    @Override
    public List<ThinkingLogIdDto> listThinkingLogIds() {
        List<AgentThinkingLog> rows = thinkingLogMapper.selectList(new QueryWrapper<AgentThinkingLog>()
                .select("session_id", "user_query", "created_date")
                .isNotNull("user_query")
                .orderByDesc("created_date"));
        Map<String, String> firstQuery = new LinkedHashMap<>();
        for (AgentThinkingLog row : rows) {
            firstQuery.putIfAbsent(row.getSessionId(), row.getUserQuery());
        }
        List<ThinkingLogIdDto> result = new ArrayList<>();
        firstQuery.forEach((sid, query) -> result.add(new ThinkingLogIdDto(sid, query)));
        return result;
    }

    @Override
    public ThinkingLogSessionView getThinkingLogsBySession(String sessionId) {
        List<AgentThinkingLog> rows = thinkingLogMapper.selectList(new QueryWrapper<AgentThinkingLog>()
                .eq("session_id", sessionId)
                .orderByAsc("created_date"));
        return ThinkingLogSessionView.builder()
                .sessionId(sessionId)
                .conversations(groupThinking(rows))
                .build();
    }

    // ==================== 数据库函数 ====================

    @Override
    public List<RecentConversationRow> recentConversations(int limit) {
        int rowLimit = Math.min(Math.max(1, limit), RECENT_LIMIT_MAX);
        List<RecentConversationRow> rows = retryPolicy.execute("rpc get_recent_conversations",
                () -> riskAnalyticsMapper.selectRecentConversations(rowLimit));
        return rows != null ? rows : List.of();
    }

    @Override
    public List<HeatmapEntryDto> heatmap(String conversationId, String sessionId) {
        List<CountryRiskRow> rows = retryPolicy.execute("rpc get_country_risk_heatmap_data",
                () -> riskAnalyticsMapper.selectCountryRiskHeatmap(conversationId, sessionId));
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        String stamp = LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        return rows.stream()
                .map(row -> HeatmapEntryDto.builder()
                        .datetimeStamp(stamp)
                        .conversationId(row.getConversationId() != null ? row.getConversationId() : conversationId)
                        .sessionId(row.getSessionId() != null ? row.getSessionId() : sessionId)
                        .country(row.getCountry() != null ? row.getCountry() : "")
                        .averageRisk(roundRisk(row.getAverageRisk()))
                        .breakdown(row.getBreakdown() != null ? row.getBreakdown() : "")
                        .build())
                .toList();
    }

    // ==================== 分组辅助 ====================

    private static void addEvent(Map<String, ConversationView> conversations, AgentEventLog row, boolean withAgent) {
        ConversationView view = conversations.computeIfAbsent(row.getConversationId(), cid -> ConversationView.builder()
                .conversationId(cid)
                .lastInteraction(row.getEventTime())
                .build());
        view.getMessages().add(toMessage(row, withAgent));
        LocalDateTime eventTime = row.getEventTime();
        if (eventTime != null && (view.getLastInteraction() == null || eventTime.isAfter(view.getLastInteraction()))) {
            view.setLastInteraction(eventTime);
        }
    }

    private static SessionMessageDto toMessage(AgentEventLog row, boolean withAgent) {
        return SessionMessageDto.builder()
                .eventTime(row.getEventTime())
                .userQuery(row.getUserQuery())
                .agentOutput(row.getAgentOutput())
                .agentName(withAgent ? row.getAgentName() : null)
                .action(row.getAction())
                .build();
    }

    private static List<ThinkingConversationView> groupThinking(List<AgentThinkingLog> rows) {
        Map<String, String> userQueries = new LinkedHashMap<>();
        Map<String, Map<String, AgentThoughtsView>> byConversation = new LinkedHashMap<>();
        for (AgentThinkingLog row : rows) {
            String cid = row.getConversationId();
            Map<String, AgentThoughtsView> agents = byConversation.computeIfAbsent(cid, k -> new LinkedHashMap<>());
            if (!userQueries.containsKey(cid) || userQueries.get(cid) == null) {
                userQueries.put(cid, row.getUserQuery());
            }
            AgentThoughtsView agent = agents.computeIfAbsent(row.getAgentName(), name -> AgentThoughtsView.builder()
                    .agentName(name)
                    .firstAppearance(row.getCreatedDate())
                    .build());
            agent.getThoughts().add(ThoughtDto.builder()
                    .thoughtContent(row.getThoughtContent())
                    .thinkingStage(row.getThinkingStage())
                    .thinkingStageOutput(row.getThinkingStageOutput())
                    .createdDate(row.getCreatedDate())
                    .build());
        }
        List<ThinkingConversationView> result = new ArrayList<>();
        byConversation.forEach((cid, agents) -> result.add(ThinkingConversationView.builder()
                .conversationId(cid)
                .userQuery(userQueries.get(cid))
                .agents(new ArrayList<>(agents.values()))
                .build()));
        return result;
    }

    private static String roundRisk(BigDecimal averageRisk) {
        if (averageRisk == null) {
            return "0";
        }
        return averageRisk.setScale(0, RoundingMode.HALF_EVEN).toPlainString();
    }
}
