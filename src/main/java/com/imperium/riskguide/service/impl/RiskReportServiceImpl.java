package com.imperium.riskguide.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.imperium.riskguide.common.exception.ResourceNotFoundException;
import com.imperium.riskguide.common.exception.StoreOperationException;
import com.imperium.riskguide.mapper.RiskReportMapper;
import com.imperium.riskguide.model.entity.RiskReport;
import com.imperium.riskguide.policy.StoreRetryPolicy;
import com.imperium.riskguide.service.RiskReportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

@Service
public class RiskReportServiceImpl implements RiskReportService {

    private static final Logger log = LoggerFactory.getLogger(RiskReportServiceImpl.class);

    public static final String DEFAULT_REPORT_TYPE = "comprehensive";

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Pattern SAFE_FILENAME = Pattern.compile("^[A-Za-z0-9._-]+$");

    private final RiskReportMapper riskReportMapper;
    private final StoreRetryPolicy retryPolicy;
    private final Path reportDir;
    private final String publicBaseUrl;

    public RiskReportServiceImpl(RiskReportMapper riskReportMapper,
                                 StoreRetryPolicy retryPolicy,
                                 @Value("${app.reports.dir:./reports}") String reportDir,
                                 @Value("${app.reports.public-base-url:/api/reports/files}") String publicBaseUrl) {
        this.riskReportMapper = riskReportMapper;
        this.retryPolicy = retryPolicy;
        this.reportDir = Paths.get(reportDir).toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl.endsWith("/")
                ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1)
                : publicBaseUrl;
    }

    @Override
    public RiskReport saveReport(String content, String reportType, String sessionId, String conversationId) {
        String type = (reportType == null || reportType.isBlank()) ? DEFAULT_REPORT_TYPE : reportType.trim();
        LocalDateTime now = LocalDateTime.now();
        String filename = "risk_report_" + sanitize(type) + "_" + now.format(FILE_TS) + "_"
                + UUID.randomUUID().toString().replace("-", "").substring(0, 8) + ".md";

        Path target = reportDir.resolve(filename);
        try {
            Files.createDirectories(reportDir);
            Files.writeString(target, content != null ? content : "", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreOperationException("write report file " + filename, e);
        }

        RiskReport report = RiskReport.builder()
                .sessionId(sessionId != null ? sessionId : "")
                .conversationId(conversationId)
                .filename(filename)
                .blobUrl(publicBaseUrl + "/" + filename)
                .reportType(type)
                .createdDate(now)
                .build();
        retryPolicy.run("insert fact_risk_report", () -> riskReportMapper.insert(report));
        log.info("Saved report {} (type={}, conversation={})", filename, type, conversationId);
        return report;
    }

    @Override
    public List<RiskReport> listReports() {
        return riskReportMapper.selectList(new QueryWrapper<RiskReport>().orderByDesc("created_date"));
    }

    @Override
    public Resource loadReportFile(String filename) {
        if (filename == null || !SAFE_FILENAME.matcher(filename).matches()) {
            throw new ResourceNotFoundException("Report file", String.valueOf(filename));
        }
        Path file = reportDir.resolve(filename).normalize();
        if (!file.startsWith(reportDir) || !Files.isRegularFile(file)) {
            throw new ResourceNotFoundException("Report file", filename);
        }
        return new FileSystemResource(file);
    }

    private static String sanitize(String type) {
        String cleaned = type.toLowerCase().replaceAll("[^a-z0-9]+", "_");
        return cleaned.isEmpty() ? DEFAULT_REPORT_TYPE : cleaned;
    }
}
