package com.imperium.riskguide.controller;

import com.imperium.riskguide.common.exception.TurnFailedException;
import com.imperium.riskguide.common.exception.TurnTimeoutException;
import com.imperium.riskguide.model.dto.response.ChatResponse;
import com.imperium.riskguide.service.ChatTurnService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ChatControllerTest {

    private MockMvc mockMvc;
    private ChatTurnService chatTurnService;

    @BeforeEach
    public void setUp() {
        chatTurnService = mock(ChatTurnService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new ChatController(chatTurnService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    public void shouldReturnFinalResponseInSnakeCase() throws Exception {
        when(chatTurnService.chat(eq("s-1"), eq("What is the schedule risk?"))).thenReturn(ChatResponse.builder()
                .status("success")
                .response("Report ready")
                .sessionId("s-1")
                .conversationId("c-1")
                .build());

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"s-1\",\"message\":\"What is the schedule risk?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.response").value("Report ready"))
                .andExpect(jsonPath("$.session_id").value("s-1"))
                .andExpect(jsonPath("$.conversation_id").value("c-1"));
    }

    @Test
    public void shouldRejectBlankMessage() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("invalid_argument"))
                .andExpect(jsonPath("$.error.details.field").value("message"));

        verifyNoInteractions(chatTurnService);
    }

    @Test
    public void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("invalid_argument"));
    }

    @Test
    public void shouldMapTurnTimeoutToGatewayTimeout() throws Exception {
        when(chatTurnService.chat(any(), anyString()))
                .thenThrow(new TurnTimeoutException("s-9", Duration.ofSeconds(300)));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"s-9\",\"message\":\"hello\"}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.error.code").value("timeout"))
                .andExpect(jsonPath("$.error.details.session_id").value("s-9"));
    }

    @Test
    public void shouldMapTurnFailureToServerError() throws Exception {
        when(chatTurnService.chat(any(), anyString()))
                .thenThrow(new TurnFailedException("s-2", new IllegalStateException("model down")));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"s-2\",\"message\":\"hello\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error.code").value("turn_failed"))
                .andExpect(jsonPath("$.error.details.session_id").value("s-2"));
    }

    @Test
    public void shouldClearSession() throws Exception {
        mockMvc.perform(delete("/api/chat/sessions/s-3"))
                .andExpect(status().isNoContent());

        verify(chatTurnService).clearSession("s-3");
    }
}
