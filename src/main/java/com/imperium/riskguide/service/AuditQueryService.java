package com.imperium.riskguide.service;

import com.imperium.riskguide.model.dto.response.ConversationHistoryResponse;
import com.imperium.riskguide.model.dto.response.HeatmapEntryDto;
import com.imperium.riskguide.model.dto.response.SessionIdDto;
import com.imperium.riskguide.model.dto.response.SessionView;
import com.imperium.riskguide.model.dto.response.ThinkingLogIdDto;
import com.imperium.riskguide.model.dto.response.ThinkingLogSessionView;
import com.imperium.riskguide.model.row.RecentConversationRow;

import java.util.List;

/**
 * 审计读接口：全部由日志库记录重放得到，不持有独立状态。
 */
public interface AuditQueryService {

    /** 全部会话，按 session → conversation 分组，事件按 created_date 倒序读入 */
    List<SessionView> listSessions();

    /**
     * 单个会话，事件按时间正序。
     *
     * @throws com.imperium.riskguide.common.exception.ResourceNotFoundException 无任何事件
     */
    SessionView getSession(String sessionId);

    /** 每个会话的第一条用户提问及最早时间，按时间倒序 */
    List<SessionIdDto> listSessionIds();

    /** 最近 500 条思考日志，按 session → conversation → agent 分组 */
    List<ThinkingLogSessionView> listThinkingLogs();

    List<ThinkingLogIdDto> listThinkingLogIds();

    /** 单个会话的思考日志；无记录时 conversations 为空列表 */
    ThinkingLogSessionView getThinkingLogsBySession(String sessionId);

    ConversationHistoryResponse getConversationHistory(String conversationId);

    List<RecentConversationRow> recentConversations(int limit);

    List<HeatmapEntryDto> heatmap(String conversationId, String sessionId);
}
