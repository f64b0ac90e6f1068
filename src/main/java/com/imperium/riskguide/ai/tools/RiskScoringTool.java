package com.imperium.riskguide.ai.tools;

import com.imperium.riskguide.model.schedule.RiskCategory;
import com.imperium.riskguide.policy.RiskScoringPolicy;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spring AI Tool: 风险百分比与风险等级。出错时返回哨兵值或 error 字段，不抛异常。
 */
@Component
public class RiskScoringTool {

    @Tool(name = "calculate_risk_percentage",
            description = "Calculates risk percentage based on days variance and time until due date. "
                    + "Returns the percentage with 2 decimals, \"100.0\" when already past due, \"-1\" on error.")
    public String calculateRiskPercentage(
            @ToolParam(description = "Delivery date minus P6 due date, in days (negative = early)") Integer daysVariance,
            @ToolParam(description = "P6 due date minus today, in days") Integer daysUntilDue) {
        if (daysVariance == null || daysUntilDue == null) {
            return RiskScoringPolicy.ERROR_SENTINEL;
        }
        return RiskScoringPolicy.formatPercentage(daysVariance, daysUntilDue);
    }

    @Tool(name = "categorize_risk",
            description = "Categorizes risk based on percentage and returns risk flag and points: "
                    + "< 5 Low Risk (1), 5 to < 15 Medium Risk (3), >= 15 High Risk (5).")
    public Map<String, Object> categorizeRisk(
            @ToolParam(description = "Risk percentage, e.g. 12.5") Double riskPercentage) {
        Map<String, Object> result = new LinkedHashMap<>();
        try {
            RiskCategory category = RiskScoringPolicy.categorize(riskPercentage);
            result.put("risk_flag", category.getFlag());
            result.put("risk_points", category.getPoints());
        } catch (RuntimeException e) {
            result.put("error", riskPercentage == null ? "risk_percentage is required" : e.getMessage());
        }
        return result;
    }
}
