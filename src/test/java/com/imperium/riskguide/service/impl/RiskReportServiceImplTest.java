package com.imperium.riskguide.service.impl;

import com.imperium.riskguide.common.exception.ResourceNotFoundException;
import com.imperium.riskguide.mapper.RiskReportMapper;
import com.imperium.riskguide.model.entity.RiskReport;
import com.imperium.riskguide.policy.StoreRetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.Resource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class RiskReportServiceImplTest {

    @TempDir
    Path reportDir;

    private RiskReportMapper mapper;
    private RiskReportServiceImpl service;

    @BeforeEach
    public void setUp() {
        mapper = mock(RiskReportMapper.class);
        when(mapper.insert(any(RiskReport.class))).thenReturn(1);
        service = new RiskReportServiceImpl(mapper, new StoreRetryPolicy(3, 0), reportDir.toString(),
                "/api/reports/files/");
    }

    @Test
    public void shouldWriteFileAndInsertRecord() throws Exception {
        RiskReport report = service.saveReport("# Report", null, "s-1", "c-1");

        assertTrue(report.getFilename().matches("risk_report_comprehensive_\\d{8}_\\d{6}_[0-9a-f]{8}\\.md"));
        assertEquals("/api/reports/files/" + report.getFilename(), report.getBlobUrl());
        assertEquals("comprehensive", report.getReportType());
        assertEquals("# Report", Files.readString(reportDir.resolve(report.getFilename()), StandardCharsets.UTF_8));
        verify(mapper).insert(report);
    }

    @Test
    public void shouldSanitizeReportTypeInFilename() {
        RiskReport report = service.saveReport("x", "Political Risk", "s-1", "c-1");

        assertTrue(report.getFilename().startsWith("risk_report_political_risk_"));
        assertEquals("Political Risk", report.getReportType());
    }

    @Test
    public void shouldLoadSavedFile() throws Exception {
        RiskReport report = service.saveReport("content", null, "s-1", "c-1");

        Resource resource = service.loadReportFile(report.getFilename());

        assertEquals("content", new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8));
    }

    @Test
    public void shouldRejectTraversalAndMissingFiles() {
        assertThrows(ResourceNotFoundException.class, () -> service.loadReportFile("../etc/passwd"));
        assertThrows(ResourceNotFoundException.class, () -> service.loadReportFile("missing.md"));
    }
}
