package io.llmcouncil.core.council;

import static org.assertj.core.api.Assertions.assertThat;

import io.llmcouncil.core.CouncilConfig;
import io.llmcouncil.core.gateway.GatewayResult;
import io.llmcouncil.core.message.Message;
import io.llmcouncil.core.pricing.CostCalculator;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IndependentGenerationStageTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldKeepFailuresAndDropMissingResponses() {
        // GIVEN
        ScriptedGateway gateway =
                new ScriptedGateway(
                        (model, messages) ->
                                switch (model) {
                                    case "model-a" -> ScriptedGateway.success(model, "hello");
                                    case "model-b" -> GatewayResult.Failure.of(
                                            model, "HTTP 429", false);
                                    default -> new GatewayResult.NoResponse(model);
                                });
        IndependentGenerationStage stage =
                new IndependentGenerationStage(
                        gateway,
                        new StageDispatcher(executor),
                        new CostCalculator(),
                        CouncilConfig.defaults());

        // WHEN
        List<ModelAnswer> answers =
                stage.run(
                        List.of(Message.user("hi")),
                        RunConfiguration.of(List.of("model-a", "model-b", "model-c"), "chair"));

        // THEN
        assertThat(answers).extracting(ModelAnswer::modelId).containsExactly("model-a", "model-b");
        assertThat(answers.get(0).hasError()).isFalse();
        assertThat(answers.get(0).cost()).isPositive();
        assertThat(answers.get(1).error()).isEqualTo("HTTP 429");
        assertThat(answers.get(1).answerText()).isEqualTo("Error: HTTP 429");
        assertThat(answers.get(1).cost()).isZero();
    }

    @Test
    void shouldAnswerEveryModelWhenRosterOutnumbersWorkers() {
        // GIVEN - two workers, three models, each call well inside its own timeout
        ExecutorService narrow = Executors.newFixedThreadPool(2);
        ScriptedGateway gateway =
                new ScriptedGateway(
                        (model, messages) -> {
                            pause(600);
                            return ScriptedGateway.success(model, "answer from " + model);
                        });
        CouncilConfig config =
                CouncilConfig.defaults().toBuilder()
                        .standardTimeout(Duration.ofSeconds(1))
                        .dispatchGrace(Duration.ofMillis(100))
                        .build();
        IndependentGenerationStage stage =
                new IndependentGenerationStage(
                        gateway, new StageDispatcher(narrow), new CostCalculator(), config);

        try {
            // WHEN
            List<ModelAnswer> answers =
                    stage.run(
                            List.of(Message.user("hi")),
                            RunConfiguration.of(List.of("m-a", "m-b", "m-c"), "chair"));

            // THEN
            assertThat(answers)
                    .extracting(ModelAnswer::modelId)
                    .containsExactly("m-a", "m-b", "m-c");
            assertThat(answers).noneMatch(ModelAnswer::hasError);
        } finally {
            narrow.shutdownNow();
        }
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
