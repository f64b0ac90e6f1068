package com.imperium.riskguide.controller;

import com.imperium.riskguide.model.dto.response.ReportDto;
import com.imperium.riskguide.service.RiskReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/reports")
@Tag(name = "Reports", description = "风险报告接口")
public class ReportController {

    private static final MediaType MARKDOWN = MediaType.parseMediaType("text/markdown;charset=UTF-8");

    private final RiskReportService riskReportService;

    public ReportController(RiskReportService riskReportService) {
        this.riskReportService = riskReportService;
    }

    @GetMapping
    @Operation(summary = "报告列表", description = "全部报告记录，按创建时间倒序")
    public List<ReportDto> listReports() {
        return riskReportService.listReports().stream().map(ReportDto::from).toList();
    }

    @GetMapping("/files/{filename}")
    @Operation(summary = "下载报告文件")
    public ResponseEntity<Resource> download(
            @Parameter(description = "报告文件名", required = true)
            @PathVariable String filename) {
        Resource resource = riskReportService.loadReportFile(filename);
        return ResponseEntity.ok()
                .contentType(MARKDOWN)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename).build().toString())
                .body(resource);
    }
}
