package com.imperium.riskguide.ai.orchestrator;

import com.imperium.riskguide.ai.routing.KeywordIntentClassifier;
import com.imperium.riskguide.ai.routing.PipelineState;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class RiskPipelineOrchestratorTest {

    private AgentLogService agentLogService;
    private PoliticalRiskTool politicalRiskTool;
    private ReportFileTool reportFileTool;
    private RecordingStageRunner stageRunner;
    private RiskPipelineOrchestrator orchestrator;

    @BeforeEach
    public void setUp() {
        agentLogService = mock(AgentLogService.class);
        politicalRiskTool = mock(PoliticalRiskTool.class);
        reportFileTool = mock(ReportFileTool.class);
        stageRunner = new RecordingStageRunner();
        when(agentLogService.logEvent(any())).thenReturn(true);
        when(reportFileTool.saveOnce(anyString(), isNull(), any())).thenReturn(RiskReport.builder()
                .reportId(7L)
                .filename("risk_report_comprehensive_20250101_120000_abcd1234.md")
                .blobUrl("/api/reports/files/risk_report_comprehensive_20250101_120000_abcd1234.md")
                .build());
        orchestrator = new RiskPipelineOrchestrator(
                new RoutingStateMachine(new KeywordIntentClassifier()),
                stageRunner, agentLogService, politicalRiskTool, reportFileTool);
    }

    @Test
    public void shouldRunPoliticalQuestionThroughSchedulerAndReporting() {
        TurnResult result = orchestrator.runTurn("s-1", "c-1", Transcript.empty(),
                "What are the political risks for our equipment?");

        assertEquals(List.of(PipelineState.SCHEDULER, PipelineState.POLITICAL,
                PipelineState.REPORTING, PipelineState.DONE), result.visited());
        assertEquals(List.of(AgentStage.SCHEDULER_AGENT, AgentStage.POLITICAL_RISK_AGENT,
                AgentStage.REPORTING_AGENT), stageRunner.stages);

        List<TranscriptMessage> messages = result.transcript().messages();
        assertEquals(4, messages.size());
        assertEquals(1, messages.stream().filter(TranscriptMessage::isUser).count());
        assertEquals(3, messages.stream().filter(TranscriptMessage::isAssistant).count());
        assertTrue(messages.get(1).content().startsWith("SCHEDULER_AGENT > "));
        assertTrue(messages.get(2).content().startsWith("POLITICAL_RISK_AGENT > "));
        assertTrue(result.finalResponse().startsWith("REPORTING_AGENT > "));
        assertTrue(result.finalResponse().endsWith("(/api/reports/files/risk_report_comprehensive_20250101_120000_abcd1234.md)"));

        verify(politicalRiskTool).storeAnalysisEvent(eq("POLITICAL_RISK_AGENT output"), any(StageContext.class));
        verify(agentLogService, times(3)).logAgentResponse(anyString(), anyString(), eq("c-1"), eq("s-1"), anyString());
    }

    @Test
    public void shouldLogUserQueryThenOneEventPerStage() {
        orchestrator.runTurn("s-1", "c-1", Transcript.empty(), "political outlook");

        ArgumentCaptor<AgentEventLog> events = ArgumentCaptor.forClass(AgentEventLog.class);
        verify(agentLogService, times(4)).logEvent(events.capture());
        List<AgentEventLog> logged = events.getAllValues();
        assertEquals("USER", logged.get(0).getAgentName());
        assertEquals("User Query", logged.get(0).getAction());
        assertEquals("political outlook", logged.get(0).getUserQuery());
        assertEquals("SCHEDULER_AGENT", logged.get(1).getAgentName());
        assertEquals("Generated schedule analysis", logged.get(1).getAction());
        assertEquals("Generated political risk analysis", logged.get(2).getAction());
        assertEquals("REPORTING_AGENT", logged.get(3).getAgentName());
    }

    @Test
    public void shouldAnswerGreetingWithAssistantOnly() {
        TurnResult result = orchestrator.runTurn("s-1", "c-1", Transcript.empty(), "hello");

        assertEquals(List.of(PipelineState.ASSISTANT, PipelineState.DONE), result.visited());
        assertEquals(2, result.transcript().size());
        assertEquals("ASSISTANT_AGENT > ASSISTANT_AGENT output", result.finalResponse());
        verify(reportFileTool, never()).saveOnce(any(), any(), any());
        verify(politicalRiskTool, never()).storeAnalysisEvent(any(), any());
    }

    @Test
    public void shouldStopAfterSchedulerWithoutFollowUpKeyword() {
        TurnResult result = orchestrator.runTurn("s-1", "c-1", Transcript.empty(), "Show the schedule");

        assertEquals(List.of(PipelineState.SCHEDULER, PipelineState.DONE), result.visited());
        assertEquals("SCHEDULER_AGENT > SCHEDULER_AGENT output", result.finalResponse());
    }

    @Test
    public void shouldKeepHistoryInFrontOfNewTurn() {
        Transcript history = Transcript.empty()
                .append(TranscriptMessage.user("hello"))
                .append(TranscriptMessage.fromStage("ASSISTANT_AGENT", "hi"));

        TurnResult result = orchestrator.runTurn("s-1", "c-1", history, "hello again");

        assertEquals(4, result.transcript().size());
        assertEquals(2, history.size());
        assertEquals(3, stageRunner.transcriptSizes.get(0));
    }

    @Test
    public void shouldUsePlaceholderWithoutTagOrEventWhenBackendUnavailable() {
        stageRunner.available = false;

        TurnResult result = orchestrator.runTurn("s-1", "c-1", Transcript.empty(), "hello");

        assertEquals(StageOutput.AGENT_NOT_AVAILABLE, result.finalResponse());
        assertNull(result.finalMessage().stage());
        verify(agentLogService, times(1)).logEvent(any());
        verify(agentLogService, never()).logAgentResponse(any(), any(), any(), any(), any());
    }

    @Test
    public void shouldSkipAutoSaveWhenReportingStageSavedItself() {
        stageRunner.onRun = ctx -> {
            if (ctx.getStage() == AgentStage.REPORTING_AGENT) {
                ctx.recordSavedReport(RiskReport.builder().reportId(1L).filename("f.md").blobUrl("/f.md").build());
            }
            if (ctx.getStage() == AgentStage.POLITICAL_RISK_AGENT) {
                ctx.markPoliticalJsonStored();
            }
        };

        TurnResult result = orchestrator.runTurn("s-1", "c-1", Transcript.empty(), "political risk");

        assertEquals("REPORTING_AGENT > REPORTING_AGENT output", result.finalResponse());
        verify(reportFileTool, never()).saveOnce(any(), any(), any());
        verify(politicalRiskTool, never()).storeAnalysisEvent(any(), any());
    }

    @Test
    public void shouldLogErrorAndRethrowWhenStageFails() {
        stageRunner.failOn = AgentStage.SCHEDULER_AGENT;

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> orchestrator.runTurn("s-1", "c-1", Transcript.empty(), "schedule"));

        assertEquals("model backend error", thrown.getMessage());
        verify(agentLogService).logAgentError(eq("SCHEDULER_AGENT"), eq("IllegalStateException"),
                eq("model backend error"), eq("c-1"), eq("s-1"), eq("schedule"));
        assertFalse(stageRunner.stages.contains(AgentStage.REPORTING_AGENT));
    }

    private static class RecordingStageRunner implements StageRunner {

        final List<AgentStage> stages = new ArrayList<>();
        final List<Integer> transcriptSizes = new ArrayList<>();
        boolean available = true;
        AgentStage failOn;
        java.util.function.Consumer<StageContext> onRun = ctx -> { };

        @Override
        public StageOutput run(AgentStage stage, Transcript transcript, StageContext context) {
            stages.add(stage);
            transcriptSizes.add(transcript.size());
            if (stage == failOn) {
                throw new IllegalStateException("model backend error");
            }
            if (!available) {
                return StageOutput.unavailable();
            }
            onRun.accept(context);
            return StageOutput.of(stage.name() + " output", 0);
        }
    }
}
