package com.imperium.riskguide.ai.routing;

/**
 * 意图分类。状态机只依赖此接口，关键词匹配可替换为真正的意图模型。
 */
public interface IntentClassifier {

    /**
     * 首轮分类：根据当前消息选择目标状态。
     *
     * @return SCHEDULER / POLITICAL / TARIFF / LOGISTICS / ASSISTANT 之一
     */
    PipelineState classifyEntry(String message);

    /**
     * 排期阶段之后的二次分类：根据最近一条用户消息决定下游阶段。
     *
     * @return POLITICAL / TARIFF / LOGISTICS / REPORTING / DONE 之一
     */
    PipelineState classifyFollowUp(String latestUserMessage);
}
