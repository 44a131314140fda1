package io.llmcouncil.core.council;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.logging.Logger;

/// Fans one stage's per-model work out to a worker pool and joins it.
///
/// Every task settles independently: a task that throws or outlives the stage ceiling
/// yields the record produced by the failure mapper, and its siblings keep running.
/// The ceiling is measured per task from the moment a worker picks it up, so time spent
/// queued behind a busy pool never counts against it.
/// Results are returned in input order regardless of completion order. A task returning
/// {@link Optional#empty()} contributes nothing.
///
/// @implNote The executor is owned by the caller and is not shut down here.
public class StageDispatcher {

    private static final Logger logger = Logger.getLogger(StageDispatcher.class.getName());
    private static final long NOT_STARTED = Long.MIN_VALUE;

    private final ExecutorService executor;

    /// @param executor worker pool for stage tasks, not null
    public StageDispatcher(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /// Runs `task` for every input concurrently and waits for all of them.
    ///
    /// @param stage stage name for logging, not null
    /// @param inputs inputs in the order results must follow, not null
    /// @param task per-input work; empty result means "no record", not null
    /// @param onFailure maps an input and error message to a failure record, not null
    /// @param ceiling maximum running time of each task, counted from its start, not null
    /// @param <T> input type
    /// @param <R> record type
    /// @return records in input order, never null
    public <T, R> List<R> dispatch(
            String stage,
            List<T> inputs,
            Function<T, Optional<R>> task,
            BiFunction<T, String, R> onFailure,
            Duration ceiling) {
        logger.fine("Dispatching " + stage + " to " + inputs.size() + " workers");

        AtomicLongArray startedAt = new AtomicLongArray(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            startedAt.set(i, NOT_STARTED);
        }
        List<Future<Optional<R>>> futures = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            int index = i;
            T input = inputs.get(i);
            futures.add(
                    executor.submit(
                            () -> {
                                startedAt.set(index, System.nanoTime());
                                return task.apply(input);
                            }));
        }

        List<R> results = new ArrayList<>(inputs.size());
        List<String> failed = new ArrayList<>();

        for (int i = 0; i < futures.size(); i++) {
            Future<Optional<R>> future = futures.get(i);
            T input = inputs.get(i);

            try {
                awaitStarted(future, startedAt, i, ceiling).ifPresent(results::add);
            } catch (TimeoutException e) {
                future.cancel(true);
                String message = "Request timed out after " + ceiling.toSeconds() + "s";
                logger.warning(stage + " task for " + input + ": " + message);
                failed.add(input + " (timeout)");
                results.add(onFailure.apply(input, message));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.warning(stage + " task failed: " + input + " - " + cause.getMessage());
                failed.add(input + " (" + cause.getClass().getSimpleName() + ")");
                results.add(
                        onFailure.apply(
                                input,
                                cause.getMessage() != null
                                        ? cause.getMessage()
                                        : cause.getClass().getSimpleName()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                failed.add(input + " (interrupted)");
                results.add(onFailure.apply(input, "Interrupted"));
            }
        }

        if (!failed.isEmpty()) {
            logger.warning("Partial failures in " + stage + ": " + failed);
        }
        return results;
    }

    /// Waits for a task until `ceiling` has elapsed since it started running. While the task
    /// is still queued the wait is repeated, as its clock has not begun.
    private <R> Optional<R> awaitStarted(
            Future<Optional<R>> future, AtomicLongArray startedAt, int index, Duration ceiling)
            throws InterruptedException, ExecutionException, TimeoutException {
        while (true) {
            long started = startedAt.get(index);
            if (started != NOT_STARTED) {
                long remaining = Math.max(0L, started + ceiling.toNanos() - System.nanoTime());
                return future.get(remaining, TimeUnit.NANOSECONDS);
            }
            try {
                return future.get(ceiling.toNanos(), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                // a pool shut down with the task still queued will never start it
                if (startedAt.get(index) == NOT_STARTED && executor.isShutdown()) {
                    throw e;
                }
            }
        }
    }
}
