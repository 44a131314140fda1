package io.llmcouncil.core.council;

import io.llmcouncil.core.gateway.GatewayResult;
import io.llmcouncil.core.gateway.ModelGateway;
import io.llmcouncil.core.message.Message;
import io.llmcouncil.core.usage.TokenUsage;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;

/// In-memory gateway answering from a script and recording every call.
public class ScriptedGateway implements ModelGateway {

    public record Call(String modelId, List<Message> messages) {

        public String lastContent() {
            return messages.get(messages.size() - 1).content();
        }
    }

    public static final TokenUsage USAGE = new TokenUsage(100, 50, 150);

    private final BiFunction<String, List<Message>, GatewayResult> script;
    private final List<Call> calls = new CopyOnWriteArrayList<>();

    public ScriptedGateway(BiFunction<String, List<Message>, GatewayResult> script) {
        this.script = script;
    }

    public static GatewayResult success(String modelId, String text) {
        return new GatewayResult.Success(modelId, text, "", false, USAGE);
    }

    @Override
    public GatewayResult call(String modelId, List<Message> messages, Duration timeout) {
        calls.add(new Call(modelId, List.copyOf(messages)));
        return script.apply(modelId, messages);
    }

    public List<Call> calls() {
        return List.copyOf(calls);
    }

    public List<Call> callsContaining(String text) {
        return calls.stream().filter(c -> c.lastContent().contains(text)).toList();
    }
}
