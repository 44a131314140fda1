package io.llmcouncil.langchain4j;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.llmcouncil.core.gateway.ModelClient;
import io.llmcouncil.core.gateway.ModelClientConfig;
import io.llmcouncil.core.gateway.ModelReply;
import io.llmcouncil.core.message.Message;
import io.llmcouncil.core.usage.TokenUsage;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link ModelClient}.
///
/// Maps council messages onto LangChain4j chat messages, calls the wrapped {@link ChatModel}
/// and converts the response, token usage included, into a {@link ModelReply}. Provider
/// exceptions become {@link ModelReply.Error} values.
///
/// @implNote Thread-safe as long as the wrapped model is; LangChain4j chat models are.
///
/// @see LangChain4jModelProvider for client creation
public class LangChain4jModelClient implements ModelClient {

    private static final Logger logger = Logger.getLogger(LangChain4jModelClient.class.getName());

    private final ModelClientConfig config;
    private final ChatModel model;

    /// @param config client configuration, not null
    /// @param model the LangChain4j chat model to delegate to, not null
    public LangChain4jModelClient(ModelClientConfig config, ChatModel model) {
        this.config = config;
        this.model = model;
    }

    @Override
    public ModelReply chat(List<Message> messages) {
        Instant startTime = Instant.now();
        try {
            ChatResponse response = model.chat(toChatMessages(messages));
            if (response == null || response.aiMessage() == null) {
                return ModelReply.Error.of("No response from model");
            }

            String text = response.aiMessage().text();
            return ModelReply.Text.of(
                    text != null ? text : "",
                    usageOf(response),
                    buildMetadata(response, startTime));
        } catch (Exception e) {
            logger.warning("Model '" + config.getModelId() + "' call failed: " + e.getMessage());
            return new ModelReply.Error(
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                    classify(e),
                    e,
                    Instant.now());
        }
    }

    @Override
    public ModelClientConfig getConfig() {
        return config;
    }

    static List<ChatMessage> toChatMessages(List<Message> messages) {
        List<ChatMessage> chatMessages = new ArrayList<>(messages.size());
        for (Message message : messages) {
            switch (message.role()) {
                case SYSTEM -> chatMessages.add(SystemMessage.from(message.content()));
                case ASSISTANT -> chatMessages.add(AiMessage.from(message.content()));
                case USER -> chatMessages.add(UserMessage.from(message.content()));
            }
        }
        return chatMessages;
    }

    private static TokenUsage usageOf(ChatResponse response) {
        if (response.metadata() == null || response.metadata().tokenUsage() == null) {
            return TokenUsage.ZERO;
        }
        var tokenUsage = response.metadata().tokenUsage();
        return TokenUsage.of(
                tokenUsage.inputTokenCount(),
                tokenUsage.outputTokenCount(),
                tokenUsage.totalTokenCount());
    }

    private Map<String, Object> buildMetadata(ChatResponse response, Instant startTime) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("model", config.getModelId());
        metadata.put("duration_ms", Duration.between(startTime, Instant.now()).toMillis());
        if (response.metadata() != null && response.metadata().finishReason() != null) {
            metadata.put("finish_reason", response.metadata().finishReason().toString());
        }
        return metadata;
    }

    static ModelReply.Error.ErrorType classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return ModelReply.Error.ErrorType.TIMEOUT;
            }
            String message = t.getMessage() != null ? t.getMessage().toLowerCase(Locale.ROOT) : "";
            if (message.contains("429") || message.contains("rate limit")) {
                return ModelReply.Error.ErrorType.RATE_LIMITED;
            }
            if (message.contains("timed out") || message.contains("timeout")) {
                return ModelReply.Error.ErrorType.TIMEOUT;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return ModelReply.Error.ErrorType.UNKNOWN;
    }
}
