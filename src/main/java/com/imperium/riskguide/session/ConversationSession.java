package com.imperium.riskguide.session;

import com.imperium.riskguide.model.transcript.Transcript;
import com.imperium.riskguide.model.transcript.TranscriptMessage;

/**
 * 一个会话令牌当前对应的对话：conversationId + 已完成轮次的对话记录。
 * <p>
 * 对话记录只在轮次成功结束后整体替换（由 {@link ConversationSessionManager} 串行化），
 * 进行中的轮次拿到的是开始时的快照。
 */
public final class ConversationSession {

    private final String sessionId;
    private final String conversationId;

    private volatile Transcript transcript = Transcript.empty();

    ConversationSession(String sessionId, String conversationId) {
        this.sessionId = sessionId;
        this.conversationId = conversationId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getConversationId() {
        return conversationId;
    }

    public Transcript getTranscript() {
        return transcript;
    }

    synchronized void append(TranscriptMessage user, TranscriptMessage assistant) {
        transcript = transcript.append(user).append(assistant);
    }
}
