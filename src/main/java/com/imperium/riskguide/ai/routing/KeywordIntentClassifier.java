package com.imperium.riskguide.ai.routing;

import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 基于关键词包含的意图分类，按固定优先级命中第一个即返回。
 * <p>
 * 首轮："political" → "tariff" → "logistics"/"shipping" → "schedule"/"risk" → 其他走 ASSISTANT。
 * 二次："political" → "tariff" → "logistic"/"shipping" → "report" → 其他结束。
 * "report" 只在二次分类中生效。
 */
@Component
public class KeywordIntentClassifier implements IntentClassifier {

    @Override
    public PipelineState classifyEntry(String message) {
        String text = normalize(message);
        if (text.contains("political")) {
            return PipelineState.POLITICAL;
        }
        if (text.contains("tariff")) {
            return PipelineState.TARIFF;
        }
        if (text.contains("logistics") || text.contains("shipping")) {
            return PipelineState.LOGISTICS;
        }
        if (text.contains("schedule") || text.contains("risk")) {
            return PipelineState.SCHEDULER;
        }
        return PipelineState.ASSISTANT;
    }

    @Override
    public PipelineState classifyFollowUp(String latestUserMessage) {
        String text = normalize(latestUserMessage);
        if (text.contains("political")) {
            return PipelineState.POLITICAL;
        }
        if (text.contains("tariff")) {
            return PipelineState.TARIFF;
        }
        // 二次分类用词根 "logistic"，与首轮的 "logistics" 不同
        if (text.contains("logistic") || text.contains("shipping")) {
            return PipelineState.LOGISTICS;
        }
        if (text.contains("report")) {
            return PipelineState.REPORTING;
        }
        return PipelineState.DONE;
    }

    private static String normalize(String message) {
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }
}
