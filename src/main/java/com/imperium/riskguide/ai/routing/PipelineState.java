package com.imperium.riskguide.ai.routing;

import com.imperium.riskguide.ai.stage.AgentStage;

/**
 * 路由状态机的状态。ROUTER 为初始状态，DONE 为终止状态，其余状态各对应一个分析阶段。
 */
public enum PipelineState {

    ROUTER(null),
    SCHEDULER(AgentStage.SCHEDULER_AGENT),
    POLITICAL(AgentStage.POLITICAL_RISK_AGENT),
    TARIFF(AgentStage.TARIFF_RISK_AGENT),
    LOGISTICS(AgentStage.LOGISTICS_RISK_AGENT),
    REPORTING(AgentStage.REPORTING_AGENT),
    ASSISTANT(AgentStage.ASSISTANT_AGENT),
    DONE(null);

    private final AgentStage stage;

    PipelineState(AgentStage stage) {
        this.stage = stage;
    }

    /** 该状态执行的阶段；ROUTER、DONE 不执行阶段，返回 null */
    public AgentStage getStage() {
        return stage;
    }

    public boolean isTerminal() {
        return this == DONE;
    }
}
