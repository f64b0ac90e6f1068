package com.imperium.riskguide.controller;

import com.imperium.riskguide.model.dto.response.WorkflowRunResponse;
import com.imperium.riskguide.service.ScheduleAnalysisWorkflowService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/workflow")
@Tag(name = "Workflow", description = "自动化排期风险分析")
public class WorkflowController {

    private final ScheduleAnalysisWorkflowService workflowService;

    public WorkflowController(ScheduleAnalysisWorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @PostMapping("/schedule-analysis")
    @Operation(summary = "运行排期分析", description = "以固定提问运行完整流水线并生成综合报告；失败时返回 500 与 status = error")
    public ResponseEntity<WorkflowRunResponse> run() {
        WorkflowRunResponse result = workflowService.run();
        HttpStatus status = "success".equals(result.getStatus()) ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(result);
    }
}
