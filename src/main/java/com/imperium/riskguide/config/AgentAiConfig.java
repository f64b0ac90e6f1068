package com.imperium.riskguide.config;

import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.model.tool.ToolCallingManager;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;

/**
 * 创建 OpenAI {@link ChatModel}。
 * <p>
 * 仅在 spring.ai.openai.api-key 非空时注册；未配置 key 时没有 ChatModel，各阶段返回占位回复。
 * {@link ToolCallingManager} 由 Spring AI 自动配置提供。
 */
@Configuration
public class AgentAiConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentAiConfig.class);

    @Bean
    @Conditional(OpenAiApiKeyCondition.class)
    public OpenAiChatModel openAiChatModel(@Value("${spring.ai.openai.api-key}") String apiKey,
                                           @Value("${spring.ai.openai.base-url:https://api.openai.com}") String baseUrl,
                                           @Value("${spring.ai.openai.chat.options.model:gpt-4o}") String model,
                                           @Value("${spring.ai.openai.chat.options.temperature:0.2}") double temperature,
                                           ToolCallingManager toolCallingManager,
                                           ObjectProvider<ObservationRegistry> observationRegistryProvider) {
        OpenAiApi openAiApi = OpenAiApi.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .build();
        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(model)
                .temperature(temperature)
                .build();
        log.info("OpenAI chat model enabled: model={}, baseUrl={}", model, baseUrl);
        return OpenAiChatModel.builder()
                .openAiApi(openAiApi)
                .defaultOptions(options)
                .toolCallingManager(toolCallingManager)
                .observationRegistry(observationRegistryProvider.getIfAvailable(() -> ObservationRegistry.NOOP))
                .build();
    }
}
