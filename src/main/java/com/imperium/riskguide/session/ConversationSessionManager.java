package com.imperium.riskguide.session;

import com.imperium.riskguide.model.transcript.TranscriptMessage;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 会话令牌 → 当前对话 的进程内映射。
 * <p>
 * 仅在轮次成功后追加记录；超时或失败时整个会话被丢弃，同一令牌的下一条消息得到新的 conversationId。
 * 没有按时间过期，进程关闭时全部清空。
 */
@Component
public class ConversationSessionManager {

    private static final Logger log = LoggerFactory.getLogger(ConversationSessionManager.class);

    private final ConcurrentHashMap<String, ConversationSession> sessions = new ConcurrentHashMap<>();

    public ConversationSession getOrCreate(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        return sessions.computeIfAbsent(sessionId, id -> {
            ConversationSession created = new ConversationSession(id, UUID.randomUUID().toString());
            log.info("New conversation {} for session {}", created.getConversationId(), id);
            return created;
        });
    }

    /** 当前存活的会话；不存在时返回 null */
    public ConversationSession find(String sessionId) {
        return sessionId != null ? sessions.get(sessionId) : null;
    }

    /**
     * 把一轮的用户消息与最终回复追加到会话。
     * 仅当 session 仍是该令牌当前存活的实例时生效，已被丢弃或替换的会话不会被写入。
     *
     * @return 是否已追加
     */
    public boolean appendTurn(String sessionId, ConversationSession session,
                              TranscriptMessage user, TranscriptMessage assistant) {
        boolean[] appended = {false};
        sessions.computeIfPresent(sessionId, (id, live) -> {
            if (live == session) {
                live.append(user, assistant);
                appended[0] = true;
            }
            return live;
        });
        if (!appended[0]) {
            log.warn("Session {} is no longer live, turn result not retained", sessionId);
        }
        return appended[0];
    }

    /**
     * 丢弃指定的会话实例；该令牌已对应其他实例时不做任何事。
     */
    public boolean evict(String sessionId, ConversationSession session) {
        boolean removed = sessionId != null && session != null && sessions.remove(sessionId, session);
        if (removed) {
            log.info("Session {} discarded (conversation {})", sessionId, session.getConversationId());
        }
        return removed;
    }

    /** 显式清除一个会话令牌 */
    public boolean clear(String sessionId) {
        return sessionId != null && sessions.remove(sessionId) != null;
    }

    @PreDestroy
    public void clearAll() {
        int count = sessions.size();
        sessions.clear();
        log.info("Cleared {} session(s)", count);
    }
}
