package com.imperium.riskguide.config;

import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.util.StringUtils;

/**
 * spring.ai.openai.api-key 非空白时成立。
 */
public class OpenAiApiKeyCondition implements Condition {

    static final String API_KEY_PROPERTY = "spring.ai.openai.api-key";

    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
        return StringUtils.hasText(context.getEnvironment().getProperty(API_KEY_PROPERTY));
    }
}
