package com.imperium.riskguide.ai.stage;

/**
 * 一次阶段调用的结果。
 *
 * @param text           最终消息文本
 * @param available      模型后端是否可用；不可用时 text 为固定占位文本
 * @param toolIterations 本次调用执行的工具轮数
 */
public record StageOutput(String text, boolean available, int toolIterations) {

    public static final String AGENT_NOT_AVAILABLE = "Agent not available";

    public static StageOutput unavailable() {
        return new StageOutput(AGENT_NOT_AVAILABLE, false, 0);
    }

    public static StageOutput of(String text, int toolIterations) {
        return new StageOutput(text != null ? text : "", true, toolIterations);
    }
}
