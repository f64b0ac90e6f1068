package com.imperium.riskguide.service.impl;

import com.imperium.riskguide.ai.orchestrator.RiskPipelineOrchestrator;
import com.imperium.riskguide.ai.orchestrator.TurnResult;
import com.imperium.riskguide.common.exception.TurnFailedException;
import com.imperium.riskguide.common.exception.TurnTimeoutException;
import com.imperium.riskguide.model.dto.response.ChatResponse;
import com.imperium.riskguide.service.ChatTurnService;
import com.imperium.riskguide.session.ConversationSession;
import com.imperium.riskguide.session.ConversationSessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * ChatTurnService 实现。
 * <p>
 * 一轮在 boundedElastic 线程上执行，调用方阻塞等待，超过 app.chat.turn-timeout 即放弃。
 * 超时或失败时销毁会话：同一令牌的下一条消息会得到新的 conversationId，
 * 仍在后台运行的超时轮次结束后也不会写回会话。
 */
@Service
public class ChatTurnServiceImpl implements ChatTurnService {

    private static final Logger log = LoggerFactory.getLogger(ChatTurnServiceImpl.class);

    static final String MDC_SESSION_ID = "sessionId";
    static final String MDC_CONVERSATION_ID = "conversationId";

    private final ConversationSessionManager sessionManager;
    private final RiskPipelineOrchestrator orchestrator;
    private final Duration turnTimeout;

    public ChatTurnServiceImpl(ConversationSessionManager sessionManager,
                               RiskPipelineOrchestrator orchestrator,
                               @Value("${app.chat.turn-timeout:300s}") Duration turnTimeout) {
        this.sessionManager = sessionManager;
        this.orchestrator = orchestrator;
        this.turnTimeout = turnTimeout;
    }

    @Override
    public ChatResponse chat(String sessionId, String message) {
        String sid = (sessionId == null || sessionId.isBlank()) ? UUID.randomUUID().toString() : sessionId.trim();
        ConversationSession session = sessionManager.getOrCreate(sid);
        String conversationId = session.getConversationId();

        TurnResult result;
        try {
            result = Mono.fromCallable(() -> runWithMdc(session, message))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(turnTimeout)
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            sessionManager.evict(sid, session);
            if (cause instanceof TimeoutException) {
                log.warn("Turn timed out after {} (session {}, conversation {})", turnTimeout, sid, conversationId);
                throw new TurnTimeoutException(sid, turnTimeout);
            }
            log.error("Turn failed (session {}, conversation {})", sid, conversationId, cause);
            throw new TurnFailedException(sid, cause);
        }
        if (result == null) {
            sessionManager.evict(sid, session);
            throw new TurnFailedException(sid, new IllegalStateException("Pipeline returned no result"));
        }

        sessionManager.appendTurn(sid, session, result.userMessage(), result.finalMessage());
        return ChatResponse.builder()
                .status("success")
                .response(result.finalResponse())
                .sessionId(sid)
                .conversationId(conversationId)
                .build();
    }

    @Override
    public boolean clearSession(String sessionId) {
        return sessionManager.clear(sessionId);
    }

    private TurnResult runWithMdc(ConversationSession session, String message) {
        MDC.put(MDC_SESSION_ID, session.getSessionId());
        MDC.put(MDC_CONVERSATION_ID, session.getConversationId());
        try {
            return orchestrator.runTurn(session.getSessionId(), session.getConversationId(),
                    session.getTranscript(), message);
        } finally {
            MDC.remove(MDC_SESSION_ID);
            MDC.remove(MDC_CONVERSATION_ID);
        }
    }
}
