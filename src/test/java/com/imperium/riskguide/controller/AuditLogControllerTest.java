package com.imperium.riskguide.controller;

import com.imperium.riskguide.common.exception.ResourceNotFoundException;
import com.imperium.riskguide.model.dto.response.HeatmapEntryDto;
import com.imperium.riskguide.model.dto.response.SessionIdDto;
import com.imperium.riskguide.service.AuditQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class AuditLogControllerTest {

    private MockMvc mockMvc;
    private AuditQueryService auditQueryService;

    @BeforeEach
    public void setUp() {
        auditQueryService = mock(AuditQueryService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new AuditLogController(auditQueryService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    public void shouldReturnNotFoundForUnknownSession() throws Exception {
        when(auditQueryService.getSession("missing"))
                .thenThrow(new ResourceNotFoundException("Session", "missing"));

        mockMvc.perform(get("/api/sessions/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("not_found"));
    }

    @Test
    public void shouldListSessionIds() throws Exception {
        when(auditQueryService.listSessionIds()).thenReturn(List.of(SessionIdDto.builder()
                .sessionId("s-1")
                .userQuery("schedule?")
                .build()));

        mockMvc.perform(get("/api/session-ids"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].session_id").value("s-1"))
                .andExpect(jsonPath("$[0].user_query").value("schedule?"));
    }

    @Test
    public void shouldPassHeatmapFilters() throws Exception {
        when(auditQueryService.heatmap("c-1", "s-1")).thenReturn(List.of(HeatmapEntryDto.builder()
                .conversationId("c-1")
                .sessionId("s-1")
                .country("China")
                .averageRisk("4")
                .breakdown("[]")
                .build()));

        mockMvc.perform(get("/api/heatmap")
                        .param("conversation_id", "c-1")
                        .param("session_id", "s-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].country").value("China"))
                .andExpect(jsonPath("$[0].average_risk").value("4"));
    }

    @Test
    public void shouldDefaultRecentConversationLimit() throws Exception {
        when(auditQueryService.recentConversations(10)).thenReturn(List.of());

        mockMvc.perform(get("/api/conversations/recent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());

        verify(auditQueryService).recentConversations(10);
    }
}
