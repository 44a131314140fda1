package io.llmcouncil.core.title;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import io.llmcouncil.core.gateway.GatewayResult;
import io.llmcouncil.core.gateway.ModelGateway;
import io.llmcouncil.core.usage.TokenUsage;
import java.time.Duration;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

class TitleGeneratorTest {

    @Nested
    class Clean {

        @Test
        void shouldStripSurroundingQuotesAndWhitespace() {
            assertThat(TitleGenerator.clean("  \"CAP Theorem Basics\"\n"))
                    .isEqualTo("CAP Theorem Basics");
            assertThat(TitleGenerator.clean("'Quoted'")).isEqualTo("Quoted");
        }

        @Test
        void shouldTruncateLongTitles() {
            String title = TitleGenerator.clean("a".repeat(60));

            assertThat(title).hasSize(50).endsWith("...");
            assertThat(title).startsWith("a".repeat(47));
        }

        @Test
        void shouldKeepTitleOfExactlyMaxLength() {
            assertThat(TitleGenerator.clean("b".repeat(50))).isEqualTo("b".repeat(50));
        }

        @Test
        void shouldFallBackToDefaultForBlankTitle() {
            assertThat(TitleGenerator.clean(" \"\" ")).isEqualTo(TitleGenerator.DEFAULT_TITLE);
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    class Generate {

        private static final String MODEL = "google/gemini-2.5-flash";
        private static final Duration TIMEOUT = Duration.ofSeconds(30);

        @Mock private ModelGateway gateway;

        @Test
        void shouldCleanModelReply() {
            when(gateway.call(eq(MODEL), anyList(), eq(TIMEOUT)))
                    .thenReturn(
                            new GatewayResult.Success(
                                    MODEL, "\"Index Tuning\"", "", false, TokenUsage.ZERO));

            assertThat(new TitleGenerator(gateway, MODEL, TIMEOUT).generate("How to index?"))
                    .isEqualTo("Index Tuning");
        }

        @Test
        void shouldReturnDefaultTitleOnFailure() {
            when(gateway.call(eq(MODEL), anyList(), eq(TIMEOUT)))
                    .thenReturn(GatewayResult.Failure.of(MODEL, "timeout", false));

            assertThat(new TitleGenerator(gateway, MODEL, TIMEOUT).generate("How to index?"))
                    .isEqualTo(TitleGenerator.DEFAULT_TITLE);
        }
    }
}
