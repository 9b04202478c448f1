package com.crewmind.core.llm;

import com.crewmind.core.model.ModelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link LanguageModel} on top of Spring AI's {@link ChatClient}.
 * The agent's model name, temperature and token limit are passed as per-call options.
 */
public class SpringAiLanguageModel implements LanguageModel {

    private static final Logger log = LoggerFactory.getLogger(SpringAiLanguageModel.class);

    private final String provider;
    private final ChatClient chatClient;
    private final String defaultModel;
    private final Double defaultTemperature;

    public SpringAiLanguageModel(String provider, ChatClient chatClient, String defaultModel, Double defaultTemperature) {
        this.provider = provider;
        this.chatClient = chatClient;
        this.defaultModel = defaultModel;
        this.defaultTemperature = defaultTemperature;
    }

    @Override
    public String provider() {
        return provider;
    }

    @Override
    public String complete(ModelRequest request) {
        var options = toOptions(request.config());
        log.debug("Model call → {} ({} transcript message(s))", options.getModel(), request.transcript().size());
        long start = System.currentTimeMillis();

        String response = chatClient.prompt()
                .system(request.systemPrompt())
                .messages(toMessages(request.transcript()))
                .options(options)
                .call()
                .content();

        long elapsed = System.currentTimeMillis() - start;
        log.debug("Model call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("Model " + options.getModel() + " returned empty content");
        }
        return response;
    }

    ChatOptions toOptions(ModelConfig config) {
        String model = config != null && config.model() != null && !config.model().isBlank()
                ? config.model() : defaultModel;
        Double temperature = config != null && config.temperature() != null
                ? config.temperature() : defaultTemperature;
        var builder = ChatOptions.builder().model(model).temperature(temperature);
        if (config != null && config.maxOutputTokens() != null) {
            builder.maxTokens(config.maxOutputTokens());
        }
        return builder.build();
    }

    private static List<Message> toMessages(List<ChatTurn> transcript) {
        var messages = new ArrayList<Message>(transcript.size());
        for (var turn : transcript) {
            messages.add(turn.role() == ChatTurn.Role.ASSISTANT
                    ? new AssistantMessage(turn.content())
                    : new UserMessage(turn.content()));
        }
        return messages;
    }
}
