package com.imperium.riskguide.model.row;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * get_country_risk_heatmap_data() 返回的一行。breakdown 为 jsonb 文本。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CountryRiskRow {

    private String conversationId;
    private String sessionId;
    private String country;
    private BigDecimal averageRisk;
    private String breakdown;
}
