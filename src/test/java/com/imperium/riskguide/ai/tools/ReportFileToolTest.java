package com.imperium.riskguide.ai.tools;

import com.imperium.riskguide.ai.stage.AgentStage;
import com.imperium.riskguide.ai.stage.StageContext;
import com.imperium.riskguide.common.exception.StoreOperationException;
import com.imperium.riskguide.model.entity.RiskReport;
import com.imperium.riskguide.service.RiskReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ToolContext;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ReportFileToolTest {

    private RiskReportService riskReportService;
    private ReportFileTool tool;
    private StageContext ctx;

    @BeforeEach
    public void setUp() {
        riskReportService = mock(RiskReportService.class);
        tool = new ReportFileTool(riskReportService);
        ctx = new StageContext(AgentStage.REPORTING_AGENT, "c-1", "s-1", "full report");
    }

    @Test
    public void shouldSaveOnlyOncePerStageRun() {
        RiskReport report = RiskReport.builder()
                .reportId(7L)
                .filename("risk_report_comprehensive_x.md")
                .blobUrl("/api/reports/files/risk_report_comprehensive_x.md")
                .build();
        when(riskReportService.saveReport("# Report", null, "s-1", "c-1")).thenReturn(report);

        Map<String, Object> first = tool.saveReportToFile("# Report", null, new ToolContext(ctx.toToolContext()));
        RiskReport second = tool.saveOnce("# Another", "political", ctx);

        assertEquals(true, first.get("success"));
        assertEquals(7L, first.get("report_id"));
        assertSame(report, second);
        verify(riskReportService, times(1)).saveReport(anyString(), any(), anyString(), anyString());
    }

    @Test
    public void shouldReportFailureToModel() {
        when(riskReportService.saveReport(anyString(), any(), anyString(), anyString()))
                .thenThrow(new StoreOperationException("write report file", new IOException("disk full")));

        Map<String, Object> result = tool.saveReportToFile("# Report", null, new ToolContext(ctx.toToolContext()));

        assertEquals(false, result.get("success"));
        assertTrue(result.containsKey("error"));
    }

    @Test
    public void shouldFormatFileFooter() {
        RiskReport report = RiskReport.builder().filename("a.md").blobUrl("/api/reports/files/a.md").build();

        assertEquals("\n\n---\nReport saved: a.md (/api/reports/files/a.md)", ReportFileTool.fileFooter(report));
    }
}
