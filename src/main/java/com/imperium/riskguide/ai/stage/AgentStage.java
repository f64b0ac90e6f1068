package com.imperium.riskguide.ai.stage;

/**
 * 流水线中的分析阶段。name() 即智能体名称，同时用作输出前缀和日志 agent_name。
 */
public enum AgentStage {

    SCHEDULER_AGENT("scheduler", "Generated schedule analysis"),
    POLITICAL_RISK_AGENT("political-risk", "Generated political risk analysis"),
    TARIFF_RISK_AGENT("tariff-risk", "Generated tariff risk analysis"),
    LOGISTICS_RISK_AGENT("logistics-risk", "Generated logistics risk analysis"),
    REPORTING_AGENT("reporting", "Generated risk report"),
    ASSISTANT_AGENT("assistant", "Generated assistant response");

    /** 指令文件名：classpath:prompts/{promptKey}.md */
    private final String promptKey;

    /** 事件日志中的固定动作标签 */
    private final String actionLabel;

    AgentStage(String promptKey, String actionLabel) {
        this.promptKey = promptKey;
        this.actionLabel = actionLabel;
    }

    public String getPromptKey() {
        return promptKey;
    }

    public String getActionLabel() {
        return actionLabel;
    }
}
