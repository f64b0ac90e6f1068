package com.imperium.riskguide.service.impl;

import com.imperium.riskguide.model.dto.response.ChatResponse;
import com.imperium.riskguide.model.dto.response.WorkflowRunResponse;
import com.imperium.riskguide.service.ChatTurnService;
import com.imperium.riskguide.service.ScheduleAnalysisWorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * ScheduleAnalysisWorkflowService 实现。每次运行使用独立的会话 workflow_yyyyMMdd_HHmmss，
 * 运行结束后清除该会话；审计日志与报告记录照常保留。
 */
@Service
public class ScheduleAnalysisWorkflowServiceImpl implements ScheduleAnalysisWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleAnalysisWorkflowServiceImpl.class);

    public static final String WORKFLOW_MESSAGE =
            "Analyze the current equipment schedule and generate a comprehensive risk report.";

    private static final DateTimeFormatter SESSION_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ChatTurnService chatTurnService;
    private final Clock clock;

    @Autowired
    public ScheduleAnalysisWorkflowServiceImpl(ChatTurnService chatTurnService) {
        this(chatTurnService, Clock.systemDefaultZone());
    }

    ScheduleAnalysisWorkflowServiceImpl(ChatTurnService chatTurnService, Clock clock) {
        this.chatTurnService = chatTurnService;
        this.clock = clock;
    }

    @Override
    public WorkflowRunResponse run() {
        String workflowRunId = UUID.randomUUID().toString();
        String sessionId = "workflow_" + LocalDateTime.now(clock).format(SESSION_SUFFIX);
        log.info("Workflow {} started (session {})", workflowRunId, sessionId);
        try {
            ChatResponse response = chatTurnService.chat(sessionId, WORKFLOW_MESSAGE);
            log.info("Workflow {} completed (conversation {})", workflowRunId, response.getConversationId());
            return WorkflowRunResponse.builder()
                    .status("success")
                    .report(response.getResponse())
                    .workflowRunId(workflowRunId)
                    .sessionId(sessionId)
                    .conversationId(response.getConversationId())
                    .timestamp(LocalDateTime.now(clock).toString())
                    .build();
        } catch (RuntimeException e) {
            log.error("Workflow {} failed: {}", workflowRunId, e.getMessage());
            return WorkflowRunResponse.builder()
                    .status("error")
                    .error(e.getMessage() != null ? e.getMessage() : "Unknown error")
                    .workflowRunId(workflowRunId)
                    .build();
        } finally {
            chatTurnService.clearSession(sessionId);
        }
    }
}
