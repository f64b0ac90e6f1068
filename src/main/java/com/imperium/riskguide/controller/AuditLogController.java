package com.imperium.riskguide.controller;

import com.imperium.riskguide.model.dto.response.ConversationHistoryResponse;
import com.imperium.riskguide.model.dto.response.HeatmapEntryDto;
import com.imperium.riskguide.model.dto.response.SessionIdDto;
import com.imperium.riskguide.model.dto.response.SessionView;
import com.imperium.riskguide.model.dto.response.ThinkingLogIdDto;
import com.imperium.riskguide.model.dto.response.ThinkingLogSessionView;
import com.imperium.riskguide.model.row.RecentConversationRow;
import com.imperium.riskguide.service.AuditQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 审计日志读接口：会话、思考过程、对话历史、国家风险热力图。全部是日志记录的投影。
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Audit", description = "智能体审计日志查询接口")
public class AuditLogController {

    private final AuditQueryService auditQueryService;

    public AuditLogController(AuditQueryService auditQueryService) {
        this.auditQueryService = auditQueryService;
    }

    @GetMapping("/sessions")
    @Operation(summary = "会话列表", description = "按会话 → 对话分组的全部事件")
    public List<SessionView> listSessions() {
        return auditQueryService.listSessions();
    }

    @GetMapping("/sessions/{sessionId}")
    @Operation(summary = "会话详情", description = "单个会话的全部对话与事件；无事件时 404")
    public SessionView getSession(
            @Parameter(description = "会话令牌", required = true)
            @PathVariable String sessionId) {
        return auditQueryService.getSession(sessionId);
    }

    @GetMapping("/session-ids")
    @Operation(summary = "会话 ID 列表", description = "每个会话的首个提问与日期，按日期倒序")
    public List<SessionIdDto> listSessionIds() {
        return auditQueryService.listSessionIds();
    }

    @GetMapping("/thinking-logs")
    @Operation(summary = "思考日志", description = "最近 500 条思考日志，按会话 → 对话 → 智能体分组")
    public List<ThinkingLogSessionView> listThinkingLogs() {
        return auditQueryService.listThinkingLogs();
    }

    @GetMapping("/thinking-log-ids")
    @Operation(summary = "思考日志会话 ID 列表")
    public List<ThinkingLogIdDto> listThinkingLogIds() {
        return auditQueryService.listThinkingLogIds();
    }

    @GetMapping("/thinking-logs-by-session-id/{sessionId}")
    @Operation(summary = "单个会话的思考日志")
    public ThinkingLogSessionView getThinkingLogsBySession(
            @Parameter(description = "会话令牌", required = true)
            @PathVariable String sessionId) {
        return auditQueryService.getThinkingLogsBySession(sessionId);
    }

    @GetMapping("/conversations/{conversationId}/history")
    @Operation(summary = "对话历史", description = "单个对话的事件日志，按时间正序")
    public ConversationHistoryResponse getConversationHistory(
            @Parameter(description = "对话 ID", required = true)
            @PathVariable String conversationId) {
        return auditQueryService.getConversationHistory(conversationId);
    }

    @GetMapping("/conversations/recent")
    @Operation(summary = "最近对话")
    public List<RecentConversationRow> recentConversations(
            @Parameter(description = "返回数量，默认 10，最大 100")
            @RequestParam(defaultValue = "10") int limit) {
        return auditQueryService.recentConversations(limit);
    }

    @GetMapping("/heatmap")
    @Operation(summary = "国家风险热力图", description = "按国家汇总的政治风险平均可能性，可按对话或会话过滤")
    public List<HeatmapEntryDto> heatmap(
            @Parameter(description = "对话 ID")
            @RequestParam(name = "conversation_id", required = false) String conversationId,
            @Parameter(description = "会话令牌")
            @RequestParam(name = "session_id", required = false) String sessionId) {
        return auditQueryService.heatmap(conversationId, sessionId);
    }
}
