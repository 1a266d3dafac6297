package com.driveplot.engine.fetch;

import com.driveplot.core.bus.EventBus;
import com.driveplot.core.events.AlertRaised;
import com.driveplot.core.events.FetchRoundCompleted;
import com.driveplot.core.events.FetchRoundStarted;
import com.driveplot.core.events.TaskFetched;
import com.driveplot.core.model.FetchOutcome;
import com.driveplot.core.model.FetchTask;
import com.driveplot.core.util.Minutes;
import com.driveplot.engine.api.RemoteCallException;
import com.driveplot.engine.api.RoutingClient;
import com.driveplot.engine.config.EngineSettings;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fetches every task in rounds. Each round runs on a fresh fixed-size pool and finishes completely
 * before the next one starts; only tasks that failed all of their local attempts are carried into the
 * next round, which runs on the smaller retry pool. Tasks still failing after the last round are
 * dropped and reported in {@link FetchReport#unsatisfied()}.
 */
public class BatchFetchEngine {
    private static final Logger LOGGER = Logger.getLogger(BatchFetchEngine.class.getName());
    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("HH:mm");

    private final EngineSettings settings;
    private final EventBus eventBus;
    private final Clock clock;
    private final BackoffSleeper sleeper;

    public BatchFetchEngine(EngineSettings settings, EventBus eventBus, Clock clock) {
        this(settings, eventBus, clock, BackoffSleeper.threadSleep());
    }

    public BatchFetchEngine(EngineSettings settings, EventBus eventBus, Clock clock, BackoffSleeper sleeper) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
    }

    public FetchReport run(Collection<FetchTask> tasks, RoutingClient client) {
        Objects.requireNonNull(tasks, "tasks are required");
        Objects.requireNonNull(client, "client is required");

        ResultTable table = new ResultTable();
        List<FetchTask> pending = List.copyOf(new LinkedHashSet<>(tasks));
        int round = 0;
        while (!pending.isEmpty() && round < settings.maxRounds()) {
            RoundResult result = runRound(round, pending, client, table);
            pending = result.failed();
            round++;
            if (result.interrupted()) {
                break;
            }
            if (!pending.isEmpty() && round < settings.maxRounds()) {
                LOGGER.info(pending.size() + " queries still failing after round " + round + ", retrying");
            }
        }

        if (!pending.isEmpty()) {
            String message = pending.size() + " queries failed after " + round + " rounds of retries";
            LOGGER.warning(message);
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "fetch",
                    message,
                    Map.of("failed", pending.size(), "rounds", round)
            ));
        }
        return new FetchReport(table, pending, round);
    }

    private RoundResult runRound(int round, List<FetchTask> pending, RoutingClient client, ResultTable table) {
        int workers = settings.workersForRound(round);
        Instant startedAt = clock.instant();
        eventBus.publish(new FetchRoundStarted(startedAt, round, pending.size(), workers));

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, pending.size()), workerThreads(round));
        CompletionService<FetchOutcome> completion = new ExecutorCompletionService<>(pool);
        Map<Future<FetchOutcome>, FetchTask> inFlight = new HashMap<>();
        Set<FetchTask> unresolved = new LinkedHashSet<>(pending);
        List<FetchTask> failed = new ArrayList<>();
        int succeeded = 0;
        boolean interrupted = false;
        try {
            for (FetchTask task : pending) {
                inFlight.put(completion.submit(() -> fetchWithRetries(round, task, client)), task);
            }
            for (int i = 0; i < pending.size(); i++) {
                Future<FetchOutcome> done = completion.take();
                FetchTask task = inFlight.get(done);
                unresolved.remove(task);
                FetchOutcome outcome = done.get();
                if (outcome.succeeded()) {
                    table.record(task.departure(), task.model(), outcome.minutes());
                    succeeded++;
                } else {
                    failed.add(task);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interrupted = true;
            failed.addAll(unresolved);
            pool.shutdownNow();
        } catch (ExecutionException e) {
            pool.shutdownNow();
            throw new IllegalStateException("Fetch worker failed unexpectedly in round " + round, e.getCause());
        } finally {
            pool.shutdown();
        }

        long durationMillis = Duration.between(startedAt, clock.instant()).toMillis();
        eventBus.publish(new FetchRoundCompleted(clock.instant(), round, succeeded, failed.size(), durationMillis));
        LOGGER.fine(() -> "Round " + round + " on " + workers + " workers: " + failed.size() + " of "
                + pending.size() + " queries failed");
        return new RoundResult(List.copyOf(failed), interrupted);
    }

    private FetchOutcome fetchWithRetries(int round, FetchTask task, RoutingClient client) {
        int attempts = settings.perTaskRetries();
        String lastError = null;
        int made = 0;
        while (made < attempts) {
            int attemptIndex = made;
            made++;
            try {
                long seconds = client.fetchDurationSeconds(
                        task.origin(),
                        task.destination(),
                        task.departureEpochSeconds(),
                        task.model()
                );
                if (seconds < 0) {
                    throw new RemoteCallException("Routing service returned a negative duration: " + seconds);
                }
                eventBus.publish(new TaskFetched(clock.instant(), round, task.departure(), task.model(), true, made));
                return FetchOutcome.success(task, Minutes.fromSeconds(seconds));
            } catch (RuntimeException e) {
                lastError = rootMessage(e);
                int attempt = made;
                LOGGER.log(Level.FINE, e, () -> "Attempt " + attempt + " failed for " + describe(task));
            }
            if (made < attempts && !backoff(attemptIndex)) {
                break;
            }
        }

        eventBus.publish(new TaskFetched(clock.instant(), round, task.departure(), task.model(), false, made));
        eventBus.publish(new AlertRaised(
                clock.instant(),
                "fetch",
                "Failed to fetch " + describe(task) + " after " + made + " attempts: " + lastError,
                Map.of("round", round, "model", task.model().apiValue(), "departure", task.departure().toString())
        ));
        return FetchOutcome.failure(task, lastError);
    }

    private boolean backoff(int attemptIndex) {
        try {
            sleeper.sleep(settings.backoffAfterAttempt(attemptIndex));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ThreadFactory workerThreads(int round) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "fetch-round-" + round + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static String describe(FetchTask task) {
        return task.model().apiValue() + " for " + task.departure().format(CLOCK);
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    private record RoundResult(List<FetchTask> failed, boolean interrupted) {
    }
}
