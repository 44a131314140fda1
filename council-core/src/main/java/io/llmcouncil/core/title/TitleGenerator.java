package io.llmcouncil.core.title;

import io.llmcouncil.core.gateway.GatewayResult;
import io.llmcouncil.core.gateway.ModelGateway;
import io.llmcouncil.core.message.Message;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Generates a short conversation title from the first user message.
///
/// The auxiliary model is asked for 3-5 words. Surrounding quotes are stripped and titles
/// longer than 50 characters are cut to 47 characters plus `"..."`. Any failure yields
/// {@link #DEFAULT_TITLE}.
public class TitleGenerator {

    private static final Logger logger = Logger.getLogger(TitleGenerator.class.getName());

    public static final String DEFAULT_TITLE = "New Conversation";
    static final int MAX_LENGTH = 50;

    private final ModelGateway gateway;
    private final String titleModel;
    private final Duration timeout;

    /// @param gateway gateway used for the title call, not null
    /// @param titleModel auxiliary model id, not null
    /// @param timeout title call timeout, not null
    public TitleGenerator(ModelGateway gateway, String titleModel, Duration timeout) {
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.titleModel = Objects.requireNonNull(titleModel, "titleModel must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /// @param userQuery first user message, not null
    /// @return title, never null or blank
    public String generate(String userQuery) {
        GatewayResult result =
                gateway.call(titleModel, List.of(Message.user(buildPrompt(userQuery))), timeout);

        if (!(result instanceof GatewayResult.Success success)) {
            logger.warning("Title generation via " + titleModel + " failed, using default title");
            return DEFAULT_TITLE;
        }
        return clean(success.answerText());
    }

    /// Strips whitespace and surrounding quotes, then truncates.
    static String clean(String raw) {
        String title = stripQuotes(raw.strip());
        if (title.isEmpty()) {
            return DEFAULT_TITLE;
        }
        if (title.length() > MAX_LENGTH) {
            title = title.substring(0, MAX_LENGTH - 3) + "...";
        }
        return title;
    }

    private static String stripQuotes(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isQuote(text.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }

    static String buildPrompt(String userQuery) {
        return """
                Generate a very short title (3-5 words maximum) that summarizes the following question.
                The title should be concise and descriptive. Do not use quotes or punctuation in the title.

                Question: %s

                Title:"""
                .formatted(userQuery);
    }
}
