package com.imperium.riskguide.ai.tools;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class RiskScoringToolTest {

    private final RiskScoringTool tool = new RiskScoringTool();

    @Test
    public void shouldFormatPercentageWithTwoDecimals() {
        assertEquals("12.50", tool.calculateRiskPercentage(-10, 80));
        assertEquals("100.0", tool.calculateRiskPercentage(3, 0));
        assertEquals("-1", tool.calculateRiskPercentage(null, 10));
    }

    @Test
    public void shouldCategorizeOnClosedLowerBounds() {
        assertEquals(Map.of("risk_flag", "Low Risk", "risk_points", 1), tool.categorizeRisk(4.99));
        assertEquals(Map.of("risk_flag", "Medium Risk", "risk_points", 3), tool.categorizeRisk(5.0));
        assertEquals(Map.of("risk_flag", "High Risk", "risk_points", 5), tool.categorizeRisk(15.0));
    }

    @Test
    public void shouldReturnErrorForMissingPercentage() {
        assertEquals("risk_percentage is required", tool.categorizeRisk(null).get("error"));
        assertEquals("riskPercentage must be a number", tool.categorizeRisk(Double.NaN).get("error"));
    }
}
