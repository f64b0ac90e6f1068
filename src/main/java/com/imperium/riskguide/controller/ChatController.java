package com.imperium.riskguide.controller;

import com.imperium.riskguide.model.dto.request.ChatRequest;
import com.imperium.riskguide.model.dto.response.ChatResponse;
import com.imperium.riskguide.service.ChatTurnService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 对话接口：一次请求执行一轮完整流水线，同步返回最终回复。
 */
@RestController
@RequestMapping("/api/chat")
@Tag(name = "Chat", description = "风险分析对话接口")
public class ChatController {

    private final ChatTurnService chatTurnService;

    public ChatController(ChatTurnService chatTurnService) {
        this.chatTurnService = chatTurnService;
    }

    /**
     * 超时返回 504，轮次失败返回 500，两种情况下会话都已销毁。
     */
    @PostMapping
    @Operation(summary = "发送消息", description = "执行一轮路由 → 阶段流水线，返回最终回复；不传 session_id 时生成新会话")
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        return ResponseEntity.ok(chatTurnService.chat(request.getSessionId(), request.getMessage()));
    }

    @DeleteMapping("/sessions/{sessionId}")
    @Operation(summary = "清除会话", description = "丢弃会话令牌对应的对话，下一条消息将开始新的对话")
    public ResponseEntity<Void> clearSession(
            @Parameter(description = "会话令牌", required = true)
            @PathVariable String sessionId) {
        chatTurnService.clearSession(sessionId);
        return ResponseEntity.noContent().build();
    }
}
