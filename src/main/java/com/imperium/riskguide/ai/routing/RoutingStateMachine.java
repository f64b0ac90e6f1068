package com.imperium.riskguide.ai.routing;

import com.imperium.riskguide.model.transcript.Transcript;
import com.imperium.riskguide.model.transcript.TranscriptMessage;
import org.springframework.stereotype.Component;

/**
 * 路由状态机：纯转移函数，不执行阶段、不持有状态。
 * <pre>
 * ROUTER    → SCHEDULER（political/tariff/logistics/schedule 类请求）| ASSISTANT
 * SCHEDULER → POLITICAL | TARIFF | LOGISTICS | REPORTING | DONE（按最近用户消息二次分类）
 * POLITICAL / TARIFF / LOGISTICS → REPORTING
 * REPORTING / ASSISTANT → DONE
 * </pre>
 * 任何风险阶段执行前必须先经过 SCHEDULER，风险阶段的输出必须汇总到 REPORTING。
 */
@Component
public class RoutingStateMachine {

    private final IntentClassifier intentClassifier;

    public RoutingStateMachine(IntentClassifier intentClassifier) {
        this.intentClassifier = intentClassifier;
    }

    public PipelineState initialState() {
        return PipelineState.ROUTER;
    }

    /**
     * 计算 current 完成后的下一个状态。
     *
     * @param current    刚完成的状态
     * @param transcript 当前轮次累积的对话记录（含本轮用户消息及已产出的阶段消息）
     */
    public RoutingDecision next(PipelineState current, Transcript transcript) {
        return switch (current) {
            case ROUTER -> route(transcript);
            case SCHEDULER -> RoutingDecision.direct(current,
                    intentClassifier.classifyFollowUp(latestUserText(transcript)));
            case POLITICAL, TARIFF, LOGISTICS -> RoutingDecision.direct(current, PipelineState.REPORTING);
            case REPORTING, ASSISTANT -> RoutingDecision.direct(current, PipelineState.DONE);
            case DONE -> throw new IllegalStateException("Pipeline already reached DONE");
        };
    }

    private RoutingDecision route(Transcript transcript) {
        String current = transcript.last().map(TranscriptMessage::content).orElse("");
        PipelineState requested = intentClassifier.classifyEntry(current);
        if (requested == PipelineState.ASSISTANT) {
            return new RoutingDecision(PipelineState.ROUTER, requested, requested);
        }
        return new RoutingDecision(PipelineState.ROUTER, requested, PipelineState.SCHEDULER);
    }

    private static String latestUserText(Transcript transcript) {
        return transcript.lastUserMessage().map(TranscriptMessage::content).orElse("");
    }
}
