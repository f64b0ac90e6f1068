package com.imperium.riskguide.ai.orchestrator;

import com.imperium.riskguide.ai.routing.PipelineState;
import com.imperium.riskguide.ai.routing.RoutingDecision;
import com.imperium.riskguide.ai.routing.RoutingStateMachine;
import com.imperium.riskguide.ai.stage.AgentStage;
import com.imperium.riskguide.ai.stage.StageContext;
import com.imperium.riskguide.ai.stage.StageOutput;
import com.imperium.riskguide.ai.stage.StageRunner;
import com.imperium.riskguide.ai.tools.PoliticalRiskTool;
import com.imperium.riskguide.ai.tools.ReportFileTool;
import com.imperium.riskguide.model.entity.AgentEventLog;
import com.imperium.riskguide.model.entity.RiskReport;
import com.imperium.riskguide.model.transcript.Transcript;
import com.imperium.riskguide.model.transcript.TranscriptMessage;
import com.imperium.riskguide.service.AgentLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 风险分析流水线编排器：驱动一轮对话在各阶段之间流转。
 * <p>
 * 职责：记录用户提问 → 按路由状态机逐个执行阶段 → 阶段输出加前缀并追加到对话记录 →
 * 写事件日志与完整回复日志 → 返回最后一条消息作为本轮回复。
 * <p>
 * 阶段严格串行，一轮内不会并发执行两个阶段。本类不持有会话状态，也不处理超时，
 * 二者由 {@link com.imperium.riskguide.service.ChatTurnService} 负责。
 */
@Service
public class RiskPipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RiskPipelineOrchestrator.class);

    public static final String USER_AGENT_NAME = "USER";
    public static final String USER_QUERY_ACTION = "User Query";

    /** 状态机无环，正常情况下一轮最多 4 次转移 */
    private static final int MAX_TRANSITIONS = PipelineState.values().length;

    private final RoutingStateMachine stateMachine;
    private final StageRunner stageRunner;
    private final AgentLogService agentLogService;
    private final PoliticalRiskTool politicalRiskTool;
    private final ReportFileTool reportFileTool;

    public RiskPipelineOrchestrator(RoutingStateMachine stateMachine,
                                    StageRunner stageRunner,
                                    AgentLogService agentLogService,
                                    PoliticalRiskTool politicalRiskTool,
                                    ReportFileTool reportFileTool) {
        this.stateMachine = stateMachine;
        this.stageRunner = stageRunner;
        this.agentLogService = agentLogService;
        this.politicalRiskTool = politicalRiskTool;
        this.reportFileTool = reportFileTool;
    }

    // ==================== 公开入口 ====================

    /**
     * 执行一轮。
     *
     * @param history 会话中已完成轮次的对话记录（只读）
     * @throws RuntimeException 阶段内模型调用失败等轮次级错误，原样抛出
     */
    public TurnResult runTurn(String sessionId, String conversationId, Transcript history, String message) {
        agentLogService.logEvent(AgentEventLog.builder()
                .agentName(USER_AGENT_NAME)
                .action(USER_QUERY_ACTION)
                .userQuery(message)
                .conversationId(conversationId)
                .sessionId(sessionId)
                .build());

        TranscriptMessage userMessage = TranscriptMessage.user(message);
        Transcript transcript = history.append(userMessage);
        List<PipelineState> visited = new ArrayList<>();

        PipelineState state = stateMachine.initialState();
        for (int i = 0; i < MAX_TRANSITIONS; i++) {
            RoutingDecision decision = stateMachine.next(state, transcript);
            if (decision.redirected()) {
                log.info("Route {} -> {} (requested {})", decision.from(), decision.next(), decision.requested());
            } else {
                log.info("Route {} -> {}", decision.from(), decision.next());
            }
            state = decision.next();
            visited.add(state);
            if (state.isTerminal()) {
                TranscriptMessage last = transcript.last().orElseThrow();
                return new TurnResult(userMessage, last, transcript, List.copyOf(visited));
            }
            StageContext context = new StageContext(state.getStage(), conversationId, sessionId, message);
            transcript = transcript.append(runStage(context, transcript));
        }
        throw new IllegalStateException("Pipeline did not reach DONE after " + MAX_TRANSITIONS + " transitions");
    }

    // ==================== 私有：阶段执行 ====================

    private TranscriptMessage runStage(StageContext ctx, Transcript transcript) {
        AgentStage stage = ctx.getStage();
        StageOutput output;
        try {
            output = stageRunner.run(stage, transcript, ctx);
        } catch (RuntimeException e) {
            log.error("{} failed: {}", stage, e.getMessage());
            agentLogService.logAgentError(stage.name(), e.getClass().getSimpleName(),
                    e.getMessage() != null ? e.getMessage() : "Stage execution failed",
                    ctx.getConversationId(), ctx.getSessionId(), ctx.getUserQuery());
            throw e;
        }

        if (!output.available()) {
            return TranscriptMessage.assistant(output.text());
        }

        String text = output.text() != null ? output.text() : "";
        if (stage == AgentStage.POLITICAL_RISK_AGENT && !ctx.isPoliticalJsonStored()) {
            politicalRiskTool.storeAnalysisEvent(text, ctx);
        }
        if (stage == AgentStage.REPORTING_AGENT && ctx.getSavedReport() == null) {
            text = text + saveReportFooter(text, ctx);
        }

        agentLogService.logEvent(AgentEventLog.builder()
                .agentName(stage.name())
                .action(stage.getActionLabel())
                .agentOutput(text)
                .userQuery(ctx.getUserQuery())
                .conversationId(ctx.getConversationId())
                .sessionId(ctx.getSessionId())
                .build());
        agentLogService.logAgentResponse(stage.name(), text,
                ctx.getConversationId(), ctx.getSessionId(), ctx.getUserQuery());

        return TranscriptMessage.fromStage(stage.name(), text);
    }

    /**
     * 报告阶段未自行保存时由这里保存；保存失败只记日志，报告内容照常返回。
     */
    private String saveReportFooter(String reportText, StageContext ctx) {
        try {
            RiskReport report = reportFileTool.saveOnce(reportText, null, ctx);
            return ReportFileTool.fileFooter(report);
        } catch (RuntimeException e) {
            log.warn("Report auto-save failed for conversation {}: {}", ctx.getConversationId(), e.getMessage());
            return "";
        }
    }
}
