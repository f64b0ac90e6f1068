package com.imperium.riskguide.model.transcript;

/**
 * 对话消息角色。
 */
public enum MessageRole {
    USER,
    ASSISTANT
}
