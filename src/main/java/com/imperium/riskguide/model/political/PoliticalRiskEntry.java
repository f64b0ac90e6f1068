package com.imperium.riskguide.model.political;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 政治风险表中的一行。字段名（snake_case）同时是热力图函数读取的 JSON 键。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PoliticalRiskEntry {

    /** 国家；多个国家以 "-" 连接 */
    private String country;
    private String politicalType;
    private String riskInformation;
    /** 可能性 0~5 */
    private int likelihood;
    private String likelihoodReasoning;
    private String publicationDate;
    private String citationTitle;
    private String citationName;
    private String citationUrl;
}
