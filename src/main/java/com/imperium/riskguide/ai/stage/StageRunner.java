package com.imperium.riskguide.ai.stage;

import com.imperium.riskguide.model.transcript.Transcript;

/**
 * 执行单个分析阶段：读取对话记录，按需调用工具，产出恰好一条消息。
 */
public interface StageRunner {

    /**
     * @param stage      要执行的阶段
     * @param transcript 截至目前的对话记录（只读）
     * @param context    本次调用的上下文，会传给工具
     * @return 阶段输出；模型后端不可用时返回 {@link StageOutput#unavailable()}，不抛异常
     */
    StageOutput run(AgentStage stage, Transcript transcript, StageContext context);
}
