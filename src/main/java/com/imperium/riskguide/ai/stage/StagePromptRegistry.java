package com.imperium.riskguide.ai.stage;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

/**
 * 各阶段的指令文本，启动时从 classpath:prompts/{promptKey}.md 读取。缺文件时启动失败。
 */
@Component
public class StagePromptRegistry {

    private static final String PROMPT_LOCATION = "classpath:prompts/%s.md";

    private final Map<AgentStage, String> instructions = new EnumMap<>(AgentStage.class);

    public StagePromptRegistry(ResourceLoader resourceLoader) {
        for (AgentStage stage : AgentStage.values()) {
            instructions.put(stage, load(resourceLoader, stage));
        }
    }

    public String instructionsFor(AgentStage stage) {
        return instructions.get(stage);
    }

    private static String load(ResourceLoader resourceLoader, AgentStage stage) {
        String location = String.format(PROMPT_LOCATION, stage.getPromptKey());
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new IllegalStateException("Missing stage instructions: " + location, e);
        }
    }
}
