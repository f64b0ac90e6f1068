package com.imperium.riskguide.policy;

import com.imperium.riskguide.model.schedule.RiskCategory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * 设备进度风险评分：偏差天数 → 风险百分比 → 风险等级。
 * <p>
 * 偏差符号只区分提前/滞后，风险只取决于绝对值。
 */
public final class RiskScoringPolicy {

    /** 已过 P6 到期日时的风险百分比 */
    public static final double PAST_DUE_RISK = 100.0;

    /** 风险计算出错时工具返回的哨兵值 */
    public static final String ERROR_SENTINEL = "-1";

    /**
     * 计算风险百分比，保留 2 位小数（HALF_EVEN）。
     *
     * @param daysVariance 交付日期 - P6 到期日（天），负数为提前，正数为滞后
     * @param daysUntilDue P6 到期日 - 今天（天）
     * @return 风险百分比；daysUntilDue &lt;= 0 时固定返回 100.0
     */
    public static double riskPercentage(int daysVariance, int daysUntilDue) {
        if (daysUntilDue <= 0) {
            return PAST_DUE_RISK;
        }
        // 对 double 的精确二进制值舍入，恰好落在 .xx5 上时取偶（3.125 -> 3.12）
        double raw = Math.abs((long) daysVariance) * 100.0 / daysUntilDue;
        return new BigDecimal(raw).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * 按百分比归档。负数按 Low 处理，NaN 视为非法输入。
     */
    public static RiskCategory categorize(double riskPercentage) {
        if (Double.isNaN(riskPercentage)) {
            throw new IllegalArgumentException("riskPercentage must be a number");
        }
        if (riskPercentage >= RiskCategory.HIGH.getLowerBound()) {
            return RiskCategory.HIGH;
        }
        if (riskPercentage >= RiskCategory.MEDIUM.getLowerBound()) {
            return RiskCategory.MEDIUM;
        }
        return RiskCategory.LOW;
    }

    /** 工具输出格式：两位小数字符串，过期固定 "100.0" */
    public static String formatPercentage(int daysVariance, int daysUntilDue) {
        if (daysUntilDue <= 0) {
            return String.valueOf(PAST_DUE_RISK);
        }
        return String.format(Locale.ROOT, "%.2f", riskPercentage(daysVariance, daysUntilDue));
    }

    private RiskScoringPolicy() {}
}
