package com.imperium.riskguide.service;

import com.imperium.riskguide.model.dto.response.ChatResponse;

/**
 * 对话轮次服务：会话管理 + 墙钟时限 + 流水线执行。
 */
public interface ChatTurnService {

    /**
     * 执行一轮对话。
     *
     * @param sessionId 会话令牌，为空时生成新的
     * @throws com.imperium.riskguide.common.exception.TurnTimeoutException 超时，会话已销毁
     * @throws com.imperium.riskguide.common.exception.TurnFailedException  轮次失败，会话已销毁
     */
    ChatResponse chat(String sessionId, String message);

    /**
     * 显式清除一个会话。
     *
     * @return 会话是否存在
     */
    boolean clearSession(String sessionId);
}
