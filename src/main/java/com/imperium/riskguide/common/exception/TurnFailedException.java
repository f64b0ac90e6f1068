package com.imperium.riskguide.common.exception;

/**
 * 一轮对话中出现未处理的异常。抛出前会话已被销毁，不保留任何部分对话记录。
 */
public class TurnFailedException extends RuntimeException {

    private final String sessionId;

    public TurnFailedException(String sessionId, Throwable cause) {
        super("Error processing chat request: " + (cause != null ? cause.getMessage() : "unknown"), cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
