package com.imperium.riskguide.ai.orchestrator;

import com.imperium.riskguide.ai.routing.PipelineState;
import com.imperium.riskguide.model.transcript.Transcript;
import com.imperium.riskguide.model.transcript.TranscriptMessage;

import java.util.List;

/**
 * 一轮流水线的结果。
 *
 * @param userMessage  本轮用户消息
 * @param finalMessage 本轮的最终回复（对话记录的最后一条）
 * @param transcript   本轮结束时完整的对话记录（含历史）
 * @param visited      本轮依次进入的状态，不含初始 ROUTER，以 DONE 结尾
 */
public record TurnResult(TranscriptMessage userMessage,
                         TranscriptMessage finalMessage,
                         Transcript transcript,
                         List<PipelineState> visited) {

    public String finalResponse() {
        return finalMessage.content();
    }
}
