package com.imperium.riskguide.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 启动前加载工作目录下的 .env 文件，将 KEY=VALUE 写入 System.setProperty，
 * 供 application.yaml 中的 ${KEY} 占位符解析（数据库连接、模型 API Key 等）。
 * 已存在的系统属性不会被覆盖。
 */
public final class DotenvLoader {

    private static final Pattern ENV_LINE = Pattern.compile("^(?:export\\s+)?([A-Za-z_][A-Za-z0-9_]*)=(.*)$");

    private static final String OPENAI_BASE_URL_KEY = "OPENAI_BASE_URL";

    private DotenvLoader() {
    }

    public static void load() {
        Path envPath = Paths.get(System.getProperty("user.dir")).resolve(".env");
        if (!Files.isRegularFile(envPath)) {
            System.out.println("[DotenvLoader] .env file not found at: " + envPath);
            return;
        }
        try {
            Map<String, String> values = parse(Files.readAllLines(envPath));
            values.forEach((key, value) -> {
                if (System.getProperty(key) != null) {
                    return;
                }
                System.setProperty(key, value);
                System.out.println("[DotenvLoader] Loaded: " + key + " = " + (isSecret(key) ? "***" : value));
            });
        } catch (IOException e) {
            System.err.println("[DotenvLoader] Failed to load .env: " + e.getMessage());
        }
    }

    /**
     * 解析 .env 内容。空行与 # 注释忽略，值两侧的引号去掉，OPENAI_BASE_URL 去掉末尾的 /v1。
     */
    static Map<String, String> parse(List<String> lines) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            Matcher matcher = ENV_LINE.matcher(trimmed);
            if (!matcher.matches()) {
                continue;
            }
            String key = matcher.group(1);
            String value = unquote(matcher.group(2).trim());
            // Spring AI 的 OpenAI 客户端会自动拼接 /v1，配成 .../v1 会变成 .../v1/v1/... 而 404
            if (OPENAI_BASE_URL_KEY.equals(key)) {
                value = normalizeOpenAiBaseUrl(value);
            }
            values.put(key, value);
        }
        return values;
    }

    static String normalizeOpenAiBaseUrl(String value) {
        if (value == null) {
            return "";
        }
        String v = stripTrailingSlashes(value.trim());
        if (v.endsWith("/v1")) {
            v = v.substring(0, v.length() - 3);
        }
        return stripTrailingSlashes(v);
    }

    private static String stripTrailingSlashes(String v) {
        while (v.endsWith("/")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }

    private static boolean isSecret(String key) {
        return key.contains("KEY") || key.contains("PASSWORD") || key.contains("SECRET");
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'")))) {
            return s.substring(1, s.length() - 1).replace("\\\"", "\"");
        }
        return s;
    }
}
