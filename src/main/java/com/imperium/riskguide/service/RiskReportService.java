package com.imperium.riskguide.service;

import com.imperium.riskguide.model.entity.RiskReport;
import org.springframework.core.io.Resource;

import java.util.List;

/**
 * 汇总报告：落文件 + 写 fact_risk_report 记录。
 */
public interface RiskReportService {

    /**
     * 保存报告文件并写入记录（带重试）。
     *
     * @param content        报告正文（markdown）
     * @param reportType     报告类型，为空时为 comprehensive
     * @return 已写入的记录（含 reportId、filename、blobUrl）
     */
    RiskReport saveReport(String content, String reportType, String sessionId, String conversationId);

    /**
     * 全部报告记录，按 created_date 倒序。
     */
    List<RiskReport> listReports();

    /**
     * 读取报告文件。
     *
     * @throws com.imperium.riskguide.common.exception.ResourceNotFoundException 文件不存在或文件名非法
     */
    Resource loadReportFile(String filename);
}
