package com.imperium.riskguide.policy;

/**
 * 大文本字段落库前截断，避免单行记录过大。截断不可逆，末尾追加标记。
 */
public final class TextTruncationPolicy {

    public static final int MAX_TEXT_LENGTH = 50_000;

    public static final String TRUNCATION_MARKER = "... [TRUNCATED]";

    /**
     * @param text 原文（可为 null）
     * @return 未超长时原样返回；超长时保留前 {@link #MAX_TEXT_LENGTH} 个字符并追加标记
     */
    public static String truncate(String text) {
        return truncate(text, MAX_TEXT_LENGTH);
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + TRUNCATION_MARKER;
    }

    public static boolean isTruncated(String text) {
        return text != null && text.endsWith(TRUNCATION_MARKER);
    }

    private TextTruncationPolicy() {}
}
