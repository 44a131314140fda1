package io.llmcouncil.core.gateway;

import io.llmcouncil.core.exception.ModelProviderNotFoundException;
import io.llmcouncil.core.message.Message;
import io.llmcouncil.core.reasoning.ReasoningModels;
import io.llmcouncil.core.reasoning.ReasoningSplit;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// {@link ModelGateway} backed by {@link ModelClient}s from a {@link ModelClientFactory}.
///
/// Each call runs on an internal worker so that the per-model timeout is enforced here,
/// independently of whatever timeout the underlying client honors. Reasoning models get
/// the longer reasoning timeout and have their thinking segment split from the answer.
///
/// ### Failure mapping
/// | Condition | Result |
/// |-----------|--------|
/// | no provider supports the model | {@link GatewayResult.Failure} |
/// | client returned {@link ModelReply.Error} | {@link GatewayResult.Failure} |
/// | client threw | {@link GatewayResult.Failure} |
/// | timeout expired | {@link GatewayResult.Failure}, the call is cancelled |
/// | client returned null | {@link GatewayResult.NoResponse} |
///
/// @implNote Thread-safe. Clients are cached per {@link ModelClientConfig}.
public class DefaultModelGateway implements ModelGateway, AutoCloseable {

    private static final Logger logger = Logger.getLogger(DefaultModelGateway.class.getName());

    private final ModelClientFactory clientFactory;
    private final Duration standardTimeout;
    private final Duration reasoningTimeout;
    private final ExecutorService executor;
    private final Map<ModelClientConfig, ModelClient> clients = new ConcurrentHashMap<>();

    /// Creates a gateway.
    ///
    /// @param clientFactory factory resolving model ids to clients, not null
    /// @param standardTimeout default timeout for standard models, not null
    /// @param reasoningTimeout default timeout for extended-reasoning models, not null
    public DefaultModelGateway(
            ModelClientFactory clientFactory, Duration standardTimeout, Duration reasoningTimeout) {
        this.clientFactory =
                Objects.requireNonNull(clientFactory, "clientFactory must not be null");
        this.standardTimeout =
                Objects.requireNonNull(standardTimeout, "standardTimeout must not be null");
        this.reasoningTimeout =
                Objects.requireNonNull(reasoningTimeout, "reasoningTimeout must not be null");
        this.executor =
                Executors.newCachedThreadPool(
                        runnable -> {
                            Thread thread = new Thread(runnable, "council-gateway");
                            thread.setDaemon(true);
                            return thread;
                        });
    }

    @Override
    public GatewayResult call(String modelId, List<Message> messages, Duration timeout) {
        Objects.requireNonNull(modelId, "modelId must not be null");
        Objects.requireNonNull(messages, "messages must not be null");

        boolean reasoning = ReasoningModels.isReasoningModel(modelId);
        Duration effective = timeout != null ? timeout : defaultTimeout(modelId);

        ModelClient client;
        try {
            client =
                    clients.computeIfAbsent(
                            ModelClientConfig.of(modelId, effective), clientFactory::createClient);
        } catch (ModelProviderNotFoundException e) {
            logger.warning("No provider for model " + modelId);
            return GatewayResult.Failure.of(modelId, e.getMessage(), reasoning);
        } catch (RuntimeException e) {
            logger.warning("Failed to create client for " + modelId + ": " + e.getMessage());
            return GatewayResult.Failure.of(modelId, describe(e), reasoning);
        }

        List<Message> request = List.copyOf(messages);
        Future<ModelReply> future = executor.submit(() -> client.chat(request));

        ModelReply reply;
        try {
            reply = future.get(effective.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warning("Model " + modelId + " timed out after " + effective.toSeconds() + "s");
            return GatewayResult.Failure.of(
                    modelId, "Request timed out after " + effective.toSeconds() + "s", reasoning);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warning("Model " + modelId + " failed: " + cause.getMessage());
            return GatewayResult.Failure.of(modelId, describe(cause), reasoning);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return GatewayResult.Failure.of(modelId, "Interrupted", reasoning);
        }

        if (reply == null) {
            logger.warning("Model " + modelId + " returned no response");
            return new GatewayResult.NoResponse(modelId);
        }
        if (reply instanceof ModelReply.Error error) {
            logger.warning(
                    "Model " + modelId + " returned " + error.errorType() + ": " + error.message());
            return GatewayResult.Failure.of(modelId, error.message(), reasoning);
        }

        ModelReply.Text text = (ModelReply.Text) reply;
        String answer = text.content();
        String thinking = "";
        if (reasoning) {
            ReasoningSplit split = ReasoningModels.split(answer);
            answer = split.answer();
            thinking = split.thinking();
        }

        logger.fine(
                "Model "
                        + modelId
                        + " answered ("
                        + answer.length()
                        + " chars, "
                        + text.usage().totalTokens()
                        + " tokens)");
        return new GatewayResult.Success(modelId, answer, thinking, reasoning, text.usage());
    }

    /// Returns the timeout applied when a caller passes none.
    ///
    /// @param modelId model identifier, not null
    /// @return reasoning timeout for reasoning models, standard timeout otherwise
    public Duration defaultTimeout(String modelId) {
        return ReasoningModels.isReasoningModel(modelId) ? reasoningTimeout : standardTimeout;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        clients.clear();
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
