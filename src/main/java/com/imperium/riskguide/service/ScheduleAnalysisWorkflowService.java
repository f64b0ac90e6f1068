package com.imperium.riskguide.service;

import com.imperium.riskguide.model.dto.response.WorkflowRunResponse;

/**
 * 自动化排期风险分析：以固定提问走一轮完整流水线，产出并保存综合报告。
 */
public interface ScheduleAnalysisWorkflowService {

    /**
     * 运行一次。失败不抛出，返回 status = error 的结果。
     */
    WorkflowRunResponse run();
}
