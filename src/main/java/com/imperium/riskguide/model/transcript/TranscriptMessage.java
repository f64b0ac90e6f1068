package com.imperium.riskguide.model.transcript;

import java.util.Objects;

/**
 * 对话记录中的一条消息，追加后不可变。
 * <p>
 * 由阶段产出的 assistant 消息带有 {@code "<AGENT_NAME> > "} 前缀，stage 字段记录来源阶段名；
 * user 消息及未打标签的占位消息 stage 为 null。
 */
public record TranscriptMessage(MessageRole role, String content, String stage) {

    public static final String STAGE_PREFIX_SEPARATOR = " > ";

    public TranscriptMessage {
        Objects.requireNonNull(role, "role");
        content = content != null ? content : "";
    }

    public static TranscriptMessage user(String content) {
        return new TranscriptMessage(MessageRole.USER, content, null);
    }

    /**
     * 阶段输出：内容加上阶段名前缀，便于下游阶段区分来源。
     */
    public static TranscriptMessage fromStage(String stageName, String output) {
        String text = output != null ? output : "";
        return new TranscriptMessage(MessageRole.ASSISTANT, stageName + STAGE_PREFIX_SEPARATOR + text, stageName);
    }

    /** 不带阶段前缀的 assistant 消息（如模型不可用时的占位回复） */
    public static TranscriptMessage assistant(String content) {
        return new TranscriptMessage(MessageRole.ASSISTANT, content, null);
    }

    public boolean isUser() {
        return role == MessageRole.USER;
    }

    public boolean isAssistant() {
        return role == MessageRole.ASSISTANT;
    }
}
