package com.imperium.riskguide.service.impl;

import com.imperium.riskguide.common.exception.ResourceNotFoundException;
import com.imperium.riskguide.mapper.AgentEventLogMapper;
import com.imperium.riskguide.mapper.AgentThinkingLogMapper;
import com.imperium.riskguide.mapper.RiskAnalyticsMapper;
import com.imperium.riskguide.model.dto.response.HeatmapEntryDto;
import com.imperium.riskguide.model.dto.response.SessionIdDto;
import com.imperium.riskguide.model.dto.response.SessionView;
import com.imperium.riskguide.model.dto.response.ThinkingLogSessionView;
import com.imperium.riskguide.model.entity.AgentEventLog;
import com.imperium.riskguide.model.entity.AgentThinkingLog;
import com.imperium.riskguide.model.row.CountryRiskRow;
import com.imperium.riskguide.policy.StoreRetryPolicy;
import com.imperium.riskguide.service.AgentLogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class AuditQueryServiceImplTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 4, 1, 9, 0);

    private AgentEventLogMapper eventLogMapper;
    private AgentThinkingLogMapper thinkingLogMapper;
    private RiskAnalyticsMapper riskAnalyticsMapper;
    private AuditQueryServiceImpl service;

    @BeforeEach
    public void setUp() {
        eventLogMapper = mock(AgentEventLogMapper.class);
        thinkingLogMapper = mock(AgentThinkingLogMapper.class);
        riskAnalyticsMapper = mock(RiskAnalyticsMapper.class);
        service = new AuditQueryServiceImpl(eventLogMapper, thinkingLogMapper, riskAnalyticsMapper,
                mock(AgentLogService.class), new StoreRetryPolicy(3, 0));
    }

    @Test
    public void shouldGroupSessionEventsByConversation() {
        when(eventLogMapper.selectList(any())).thenReturn(List.of(
                event("s-1", "c-1", "USER", "schedule?", T0),
                event("s-1", "c-1", "SCHEDULER_AGENT", null, T0.plusMinutes(1)),
                event("s-1", "c-2", "USER", "hello", T0.plusHours(1))));

        SessionView session = service.getSession("s-1");

        assertEquals(2, session.getConversations().size());
        assertEquals(2, session.getConversations().get(0).getMessages().size());
        assertEquals(T0.plusMinutes(1), session.getConversations().get(0).getLastInteraction());
        assertEquals("SCHEDULER_AGENT", session.getConversations().get(0).getMessages().get(1).getAgentName());
    }

    @Test
    public void shouldReturnNotFoundForUnknownSession() {
        when(eventLogMapper.selectList(any())).thenReturn(List.of());

        assertThrows(ResourceNotFoundException.class, () -> service.getSession("missing"));
    }

    @Test
    public void shouldListSessionIdsNewestFirst() {
        when(eventLogMapper.selectList(any())).thenReturn(List.of(
                event("s-old", "c-1", "USER", "first question", T0),
                event("s-old", "c-1", "USER", "second question", T0.plusMinutes(5)),
                event("s-new", "c-2", "USER", "newer", T0.plusDays(1))));

        List<SessionIdDto> ids = service.listSessionIds();

        assertEquals("s-new", ids.get(0).getSessionId());
        assertEquals("s-old", ids.get(1).getSessionId());
        assertEquals("first question", ids.get(1).getUserQuery());
    }

    @Test
    public void shouldGroupThinkingLogsByConversationAndAgent() {
        when(thinkingLogMapper.selectList(any())).thenReturn(List.of(
                thought("c-1", "SCHEDULER_AGENT", "analysis_start", T0),
                thought("c-1", "SCHEDULER_AGENT", "data_review", T0.plusSeconds(5)),
                thought("c-1", "REPORTING_AGENT", "file_saving", T0.plusSeconds(30))));

        ThinkingLogSessionView view = service.getThinkingLogsBySession("s-1");

        assertEquals(1, view.getConversations().size());
        assertEquals("political?", view.getConversations().get(0).getUserQuery());
        assertEquals(2, view.getConversations().get(0).getAgents().size());
        assertEquals(2, view.getConversations().get(0).getAgents().get(0).getThoughts().size());
        assertEquals(T0, view.getConversations().get(0).getAgents().get(0).getFirstAppearance());
    }

    @Test
    public void shouldRoundHeatmapAverageHalfEven() {
        when(riskAnalyticsMapper.selectCountryRiskHeatmap("c-1", null)).thenReturn(List.of(
                new CountryRiskRow("c-1", "s-1", "China", new BigDecimal("2.5"), "[]"),
                new CountryRiskRow("c-1", "s-1", "Mexico", new BigDecimal("3.5"), null)));

        List<HeatmapEntryDto> entries = service.heatmap("c-1", null);

        assertEquals("2", entries.get(0).getAverageRisk());
        assertEquals("4", entries.get(1).getAverageRisk());
        assertEquals("s-1", entries.get(0).getSessionId());
        assertEquals("", entries.get(1).getBreakdown());
    }

    @Test
    public void shouldClampRecentConversationLimit() {
        when(riskAnalyticsMapper.selectRecentConversations(anyInt())).thenReturn(null);

        assertTrue(service.recentConversations(1_000).isEmpty());
        verify(riskAnalyticsMapper).selectRecentConversations(100);
    }

    private static AgentEventLog event(String sid, String cid, String agent, String query, LocalDateTime at) {
        return AgentEventLog.builder()
                .sessionId(sid)
                .conversationId(cid)
                .agentName(agent)
                .action("USER".equals(agent) ? "User Query" : "Generated schedule analysis")
                .userQuery(query)
                .eventTime(at)
                .build();
    }

    private static AgentThinkingLog thought(String cid, String agent, String stage, LocalDateTime at) {
        return AgentThinkingLog.builder()
                .sessionId("s-1")
                .conversationId(cid)
                .agentName(agent)
                .thinkingStage(stage)
                .thoughtContent(stage + " notes")
                .userQuery("political?")
                .createdDate(at)
                .build();
    }
}
