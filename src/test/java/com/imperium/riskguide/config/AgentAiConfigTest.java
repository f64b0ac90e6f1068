package com.imperium.riskguide.config;

import com.imperium.riskguide.ai.stage.AgentStage;
import com.imperium.riskguide.ai.stage.ChatModelStageRunner;
import com.imperium.riskguide.ai.stage.StageContext;
import com.imperium.riskguide.ai.stage.StageOutput;
import com.imperium.riskguide.ai.stage.StagePromptRegistry;
import com.imperium.riskguide.ai.stage.StageToolRegistry;
import com.imperium.riskguide.model.transcript.Transcript;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.model.openai.autoconfigure.OpenAiChatAutoConfiguration;
import org.springframework.ai.model.tool.ToolCallingManager;
import org.springframework.ai.model.tool.autoconfigure.ToolCallingAutoConfiguration;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

public class AgentAiConfigTest {

    private ApplicationContextRunner contextRunner;

    @BeforeEach
    public void setUp() {
        contextRunner = new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(ToolCallingAutoConfiguration.class,
                        OpenAiChatAutoConfiguration.class))
                .withUserConfiguration(AgentAiConfig.class)
                .withPropertyValues("spring.ai.model.chat=none",
                        "spring.ai.openai.base-url=https://api.openai.com",
                        "spring.ai.openai.chat.options.model=gpt-4o");
    }

    @Test
    public void shouldStartWithoutChatModelWhenApiKeyMissing() {
        contextRunner.withPropertyValues("spring.ai.openai.api-key=")
                .run(context -> {
                    assertNull(context.getStartupFailure());
                    assertFalse(context.containsBean("openAiChatModel"));
                    assertTrue(context.getBeansOfType(ChatModel.class).isEmpty());

                    ChatModelStageRunner runner = new ChatModelStageRunner(
                            context.getBeanProvider(ChatModel.class),
                            context.getBean(ToolCallingManager.class),
                            mock(StageToolRegistry.class),
                            mock(StagePromptRegistry.class),
                            8);
                    StageOutput output = runner.run(AgentStage.SCHEDULER_AGENT, Transcript.empty(),
                            new StageContext(AgentStage.SCHEDULER_AGENT, "c-1", "s-1", "schedule"));

                    assertEquals(StageOutput.AGENT_NOT_AVAILABLE, output.text());
                    assertFalse(output.available());
                });
    }

    @Test
    public void shouldTreatBlankApiKeyAsMissing() {
        contextRunner.withPropertyValues("spring.ai.openai.api-key=   ")
                .run(context -> {
                    assertNull(context.getStartupFailure());
                    assertTrue(context.getBeansOfType(ChatModel.class).isEmpty());
                });
    }

    @Test
    public void shouldCreateOpenAiChatModelWhenApiKeyPresent() {
        contextRunner.withPropertyValues("spring.ai.openai.api-key=sk-test")
                .run(context -> {
                    assertNull(context.getStartupFailure());
                    assertEquals(1, context.getBeansOfType(ChatModel.class).size());
                    assertInstanceOf(OpenAiChatModel.class, context.getBean(ChatModel.class));
                    assertEquals(1, context.getBeansOfType(ToolCallingManager.class).size());
                });
    }
}
