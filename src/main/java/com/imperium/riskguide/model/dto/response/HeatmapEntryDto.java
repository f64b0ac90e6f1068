package com.imperium.riskguide.model.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 国家政治风险热力图的一个格子。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HeatmapEntryDto {

    private String datetimeStamp;
    private String conversationId;
    private String sessionId;
    private String country;
    /** 平均可能性（0~5），取整后的字符串 */
    private String averageRisk;
    /** 风险明细 JSON 数组文本 */
    private String breakdown;
}
