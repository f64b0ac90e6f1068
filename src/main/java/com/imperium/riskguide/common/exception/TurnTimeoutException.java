package com.imperium.riskguide.common.exception;

import java.time.Duration;

/**
 * 一轮对话超过墙钟时限。抛出前会话已被销毁。
 */
public class TurnTimeoutException extends RuntimeException {

    private final String sessionId;
    private final Duration timeout;

    public TurnTimeoutException(String sessionId, Duration timeout) {
        super("Request timed out after " + timeout.toSeconds()
                + "s. Please try a simpler request or wait a moment before retrying.");
        this.sessionId = sessionId;
        this.timeout = timeout;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
