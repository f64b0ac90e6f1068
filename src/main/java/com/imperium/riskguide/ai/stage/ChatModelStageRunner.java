package com.imperium.riskguide.ai.stage;

import com.imperium.riskguide.model.transcript.Transcript;
import com.imperium.riskguide.model.transcript.TranscriptMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.model.tool.ToolCallingManager;
import org.springframework.ai.model.tool.ToolExecutionResult;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 Spring AI {@link ChatModel} 的阶段执行器。
 * <p>
 * 工具调用由本类显式驱动（关闭模型内部的工具执行）：
 * 模型返回工具调用 → {@link ToolCallingManager} 执行并把结果追加到消息历史 → 再次调用模型，
 * 直到模型给出最终消息或达到轮数上限（app.agent.max-tool-iterations）。
 */
@Component
public class ChatModelStageRunner implements StageRunner {

    private static final Logger log = LoggerFactory.getLogger(ChatModelStageRunner.class);

    static final String ITERATION_LIMIT_MESSAGE =
            "The analysis stopped after reaching the tool call limit before producing a final answer.";

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final ToolCallingManager toolCallingManager;
    private final StageToolRegistry toolRegistry;
    private final StagePromptRegistry promptRegistry;
    private final int maxToolIterations;

    public ChatModelStageRunner(ObjectProvider<ChatModel> chatModelProvider,
                                ToolCallingManager toolCallingManager,
                                StageToolRegistry toolRegistry,
                                StagePromptRegistry promptRegistry,
                                @Value("${app.agent.max-tool-iterations:8}") int maxToolIterations) {
        this.chatModelProvider = chatModelProvider;
        this.toolCallingManager = toolCallingManager;
        this.toolRegistry = toolRegistry;
        this.promptRegistry = promptRegistry;
        this.maxToolIterations = Math.max(0, maxToolIterations);
    }

    @Override
    public StageOutput run(AgentStage stage, Transcript transcript, StageContext context) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            log.warn("{}: chat model backend unavailable, returning placeholder", stage);
            return StageOutput.unavailable();
        }

        ToolCallingChatOptions options = ToolCallingChatOptions.builder()
                .toolCallbacks(toolRegistry.toolsFor(stage))
                .internalToolExecutionEnabled(false)
                .toolContext(context.toToolContext())
                .build();

        Prompt prompt = new Prompt(toMessages(stage, transcript), options);
        ChatResponse response = chatModel.call(prompt);
        String lastText = textOf(response);

        int iterations = 0;
        while (response != null && response.hasToolCalls()) {
            if (iterations >= maxToolIterations) {
                log.warn("{}: tool call limit ({}) reached, stopping", stage, maxToolIterations);
                String text = lastText != null && !lastText.isBlank() ? lastText : ITERATION_LIMIT_MESSAGE;
                return StageOutput.of(text, iterations);
            }
            ToolExecutionResult toolResult = toolCallingManager.executeToolCalls(prompt, response);
            iterations++;
            log.debug("{}: tool round {} executed", stage, iterations);

            prompt = new Prompt(toolResult.conversationHistory(), options);
            response = chatModel.call(prompt);
            String text = textOf(response);
            if (text != null && !text.isBlank()) {
                lastText = text;
            }
        }

        log.info("{}: completed after {} tool round(s)", stage, iterations);
        return StageOutput.of(lastText, iterations);
    }

    private List<Message> toMessages(AgentStage stage, Transcript transcript) {
        List<Message> messages = new ArrayList<>(transcript.size() + 1);
        messages.add(new SystemMessage(promptRegistry.instructionsFor(stage)));
        for (TranscriptMessage m : transcript.messages()) {
            messages.add(m.isUser() ? new UserMessage(m.content()) : new AssistantMessage(m.content()));
        }
        return messages;
    }

    private static String textOf(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return null;
        }
        return response.getResult().getOutput().getText();
    }
}
