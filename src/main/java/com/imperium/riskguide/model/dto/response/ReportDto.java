package com.imperium.riskguide.model.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.imperium.riskguide.model.entity.RiskReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReportDto {

    private Long reportId;
    private String sessionId;
    private String conversationId;
    private String blobUrl;
    private String filename;
    private String reportType;
    private LocalDateTime createdDate;

    public static ReportDto from(RiskReport report) {
        return ReportDto.builder()
                .reportId(report.getReportId())
                .sessionId(report.getSessionId())
                .conversationId(report.getConversationId())
                .blobUrl(report.getBlobUrl())
                .filename(report.getFilename())
                .reportType(report.getReportType())
                .createdDate(report.getCreatedDate())
                .build();
    }
}
