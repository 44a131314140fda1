package io.llmcouncil.core.council;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StageDispatcherTest {

    private ExecutorService executor;
    private StageDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        dispatcher = new StageDispatcher(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldReturnResultsInInputOrderRegardlessOfCompletionOrder() {
        // GIVEN - the first input finishes last
        List<Integer> inputs = List.of(60, 30, 0);

        // WHEN
        List<String> results =
                dispatcher.dispatch(
                        "test",
                        inputs,
                        delay -> {
                            sleep(delay);
                            return Optional.of("done-" + delay);
                        },
                        (delay, error) -> "failed-" + delay,
                        Duration.ofSeconds(5));

        // THEN
        assertThat(results).containsExactly("done-60", "done-30", "done-0");
    }

    @Test
    void shouldMapThrowingTaskToFailureWithoutAffectingSiblings() {
        List<String> results =
                dispatcher.dispatch(
                        "test",
                        List.of("ok", "boom", "fine"),
                        input -> {
                            if (input.equals("boom")) {
                                throw new IllegalStateException("exploded");
                            }
                            return Optional.of(input);
                        },
                        (input, error) -> input + ":" + error,
                        Duration.ofSeconds(5));

        assertThat(results).containsExactly("ok", "boom:exploded", "fine");
    }

    @Test
    void shouldDropEmptyResults() {
        List<String> results =
                dispatcher.dispatch(
                        "test",
                        List.of("keep", "drop"),
                        input -> input.equals("drop") ? Optional.empty() : Optional.of(input),
                        (input, error) -> "failed",
                        Duration.ofSeconds(5));

        assertThat(results).containsExactly("keep");
    }

    @Test
    void shouldMapTasksExceedingCeilingToTimeoutFailure() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);

        List<String> results =
                dispatcher.dispatch(
                        "test",
                        List.of("slow", "fast"),
                        input -> {
                            if (input.equals("slow")) {
                                await(release);
                            }
                            return Optional.of(input);
                        },
                        (input, error) -> input + ":" + error,
                        Duration.ofMillis(200));

        release.countDown();
        assertThat(results).hasSize(2);
        assertThat(results.get(0)).startsWith("slow:Request timed out");
        assertThat(results.get(1)).isEqualTo("fast");
    }

    @Test
    void shouldNotCountQueuedTimeAgainstCeilingWhenPoolIsSmallerThanInputs() {
        // GIVEN - two workers for three tasks, so the third waits for a free worker
        ExecutorService narrow = Executors.newFixedThreadPool(2);
        StageDispatcher narrowDispatcher = new StageDispatcher(narrow);

        try {
            // WHEN - each task fits its own ceiling but not the ceiling plus the queue wait
            List<String> results =
                    narrowDispatcher.dispatch(
                            "test",
                            List.of("m-a", "m-b", "m-c"),
                            input -> {
                                sleep(600);
                                return Optional.of(input);
                            },
                            (input, error) -> input + ":" + error,
                            Duration.ofMillis(1100));

            // THEN
            assertThat(results).containsExactly("m-a", "m-b", "m-c");
        } finally {
            narrow.shutdownNow();
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
