package com.imperium.riskguide.ai.stage;

import com.imperium.riskguide.model.entity.RiskReport;
import org.springframework.ai.chat.model.ToolContext;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 一次阶段调用的上下文，经 {@link ToolContext} 传给工具。
 * <p>
 * 会话标识、智能体名称、用户提问等由这里提供，不依赖模型在工具参数里回填。
 * 每次阶段调用新建一个实例，调用内的计数和"已保存"标记随之重置。
 */
public final class StageContext {

    public static final String TOOL_CONTEXT_KEY = "riskguide.stageContext";

    private final AgentStage stage;
    private final String conversationId;
    private final String sessionId;
    private final String userQuery;

    private final AtomicInteger searchCalls = new AtomicInteger();
    private final AtomicReference<RiskReport> savedReport = new AtomicReference<>();
    private final AtomicBoolean politicalJsonStored = new AtomicBoolean();

    public StageContext(AgentStage stage, String conversationId, String sessionId, String userQuery) {
        this.stage = stage;
        this.conversationId = conversationId;
        this.sessionId = sessionId;
        this.userQuery = userQuery;
    }

    /**
     * 从工具上下文取出阶段上下文。
     *
     * @throws IllegalStateException 工具不是在阶段调用中被执行
     */
    public static StageContext from(ToolContext toolContext) {
        Object value = toolContext != null ? toolContext.getContext().get(TOOL_CONTEXT_KEY) : null;
        if (value instanceof StageContext ctx) {
            return ctx;
        }
        throw new IllegalStateException("Tool invoked outside of a stage run");
    }

    public Map<String, Object> toToolContext() {
        return Map.of(TOOL_CONTEXT_KEY, this);
    }

    public AgentStage getStage() {
        return stage;
    }

    public String getAgentName() {
        return stage.name();
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserQuery() {
        return userQuery;
    }

    /** 记一次搜索调用，返回本次是第几次 */
    public int incrementSearchCalls() {
        return searchCalls.incrementAndGet();
    }

    public int getSearchCalls() {
        return searchCalls.get();
    }

    public RiskReport getSavedReport() {
        return savedReport.get();
    }

    /**
     * 记录本次调用保存的报告；已有记录时保持不变。
     *
     * @return 本次调用最终对应的报告记录
     */
    public RiskReport recordSavedReport(RiskReport report) {
        return savedReport.compareAndSet(null, report) ? report : savedReport.get();
    }

    public boolean isPoliticalJsonStored() {
        return politicalJsonStored.get();
    }

    public void markPoliticalJsonStored() {
        politicalJsonStored.set(true);
    }
}
