package com.imperium.riskguide.model.political;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 政治风险分析的结构化结果，存入事件日志（action = Political Risk JSON Data）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PoliticalRiskAnalysis {

    @Builder.Default
    private List<PoliticalRiskEntry> politicalRisks = new ArrayList<>();
    private String timestamp;
    private String searchQuery;
    private Integer searchResultsCount;
    private String equipmentImpact;
    private String mitigationRecommendations;
    private String analysisDescription;
    /** 解析失败时的错误信息 */
    private String error;
}
