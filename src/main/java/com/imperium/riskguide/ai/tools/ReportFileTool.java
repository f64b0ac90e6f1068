package com.imperium.riskguide.ai.tools;

import com.imperium.riskguide.ai.stage.StageContext;
import com.imperium.riskguide.model.entity.RiskReport;
import com.imperium.riskguide.service.RiskReportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spring AI Tool: 保存汇总报告。
 * <p>
 * 一次报告阶段调用只写一条报告记录：重复调用直接返回第一次保存的记录。
 */
@Component
public class ReportFileTool {

    private static final Logger log = LoggerFactory.getLogger(ReportFileTool.class);

    private final RiskReportService riskReportService;

    public ReportFileTool(RiskReportService riskReportService) {
        this.riskReportService = riskReportService;
    }

    @Tool(name = "save_report_to_file",
            description = "Save the final consolidated risk report as a markdown file and register it. "
                    + "Call it once with the complete report. Returns filename, url and report id.")
    public Map<String, Object> saveReportToFile(
            @ToolParam(description = "Complete report content in markdown") String reportContent,
            @ToolParam(description = "Report type, default comprehensive", required = false) String reportType,
            ToolContext toolContext) {
        StageContext ctx = StageContext.from(toolContext);
        Map<String, Object> result = new LinkedHashMap<>();
        try {
            RiskReport report = saveOnce(reportContent, reportType, ctx);
            result.put("success", true);
            result.put("report_id", report.getReportId());
            result.put("filename", report.getFilename());
            result.put("blob_url", report.getBlobUrl());
        } catch (RuntimeException e) {
            log.warn("save_report_to_file failed: {}", e.getMessage());
            result.put("success", false);
            result.put("error", e.getMessage());
        }
        return result;
    }

    /**
     * 本次阶段调用尚未保存时保存报告，否则返回已保存的记录。
     */
    public RiskReport saveOnce(String reportContent, String reportType, StageContext ctx) {
        RiskReport existing = ctx.getSavedReport();
        if (existing != null) {
            return existing;
        }
        RiskReport saved = riskReportService.saveReport(reportContent, reportType,
                ctx.getSessionId(), ctx.getConversationId());
        return ctx.recordSavedReport(saved);
    }

    /** 报告末尾追加的文件信息 */
    public static String fileFooter(RiskReport report) {
        return "\n\n---\nReport saved: " + report.getFilename() + " (" + report.getBlobUrl() + ")";
    }
}
