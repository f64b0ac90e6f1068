package com.imperium.riskguide.model.schedule;

/**
 * 进度风险等级：Low / Medium / High，分值 1 / 3 / 5。
 * <p>
 * 阈值：r &lt; 5% 为 Low，5% ≤ r &lt; 15% 为 Medium，r ≥ 15% 为 High（下界闭合）。
 */
public enum RiskCategory {

    LOW("Low Risk", 1, 0.0),
    MEDIUM("Medium Risk", 3, 5.0),
    HIGH("High Risk", 5, 15.0);

    private final String flag;
    private final int points;
    /** 该档位的闭合下界（百分比） */
    private final double lowerBound;

    RiskCategory(String flag, int points, double lowerBound) {
        this.flag = flag;
        this.points = points;
        this.lowerBound = lowerBound;
    }

    public String getFlag() {
        return flag;
    }

    public int getPoints() {
        return points;
    }

    public double getLowerBound() {
        return lowerBound;
    }
}
