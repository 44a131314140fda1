package io.llmcouncil.core.council;

import static io.llmcouncil.core.council.AggregateRankerTest.answer;
import static org.assertj.core.api.Assertions.assertThat;

import io.llmcouncil.core.CouncilConfig;
import io.llmcouncil.core.gateway.GatewayResult;
import io.llmcouncil.core.pricing.CostCalculator;
import io.llmcouncil.core.usage.TokenUsage;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChairmanSynthesisStageTest {

    @Test
    void shouldIncludeAnswersAndVerdictsInPrompt() {
        ScriptedGateway gateway =
                new ScriptedGateway((model, messages) -> ScriptedGateway.success(model, "final"));
        RankingVerdict verdict =
                new RankingVerdict(
                        "model-b",
                        "FINAL RANKING:\n1. Response A",
                        "",
                        false,
                        List.of("Response A"),
                        TokenUsage.ZERO,
                        0,
                        null);

        ChairmanResult result =
                stage(gateway).run("question", List.of(answer("model-a")), List.of(verdict), "c");

        assertThat(result.answerText()).isEqualTo("final");
        assertThat(result.hasError()).isFalse();
        assertThat(gateway.calls().get(0).lastContent())
                .contains("Original Question: question")
                .contains("Model: model-a")
                .contains("Response: answer from model-a")
                .contains("Model: model-b\nRanking: FINAL RANKING:");
    }

    @Test
    void shouldReturnSentinelOnFailure() {
        ScriptedGateway gateway =
                new ScriptedGateway(
                        (model, messages) -> GatewayResult.Failure.of(model, "HTTP 503", false));

        ChairmanResult result = stage(gateway).run("question", List.of(), List.of(), "c");

        assertThat(result.answerText()).isEqualTo(ChairmanResult.SYNTHESIS_FAILED_TEXT);
        assertThat(result.error()).isEqualTo("HTTP 503");
        assertThat(result.usage()).isEqualTo(TokenUsage.ZERO);
        assertThat(result.cost()).isZero();
    }

    @Test
    void shouldReturnSentinelOnNoResponse() {
        ScriptedGateway gateway =
                new ScriptedGateway((model, messages) -> new GatewayResult.NoResponse(model));

        ChairmanResult result = stage(gateway).run("question", List.of(), List.of(), "c");

        assertThat(result.answerText()).isEqualTo(ChairmanResult.SYNTHESIS_FAILED_TEXT);
        assertThat(result.hasError()).isTrue();
    }

    private static ChairmanSynthesisStage stage(ScriptedGateway gateway) {
        return new ChairmanSynthesisStage(gateway, new CostCalculator(), CouncilConfig.defaults());
    }
}
