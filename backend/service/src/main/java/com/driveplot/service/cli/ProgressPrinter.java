package com.driveplot.service.cli;

import com.driveplot.core.bus.EventBus;
import com.driveplot.core.events.AlertRaised;
import com.driveplot.core.events.FetchRoundCompleted;
import com.driveplot.core.events.FetchRoundStarted;
import com.driveplot.core.events.TaskFetched;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicInteger;

// Handlers are called from fetch worker threads; PrintStream.println is synchronized.
final class ProgressPrinter {
    private static final int STEPS = 4;

    private final PrintStream out;
    private final AtomicInteger roundSize = new AtomicInteger();
    private final AtomicInteger completed = new AtomicInteger();

    private ProgressPrinter(PrintStream out) {
        this.out = out;
    }

    static ProgressPrinter attach(EventBus bus, PrintStream out) {
        ProgressPrinter printer = new ProgressPrinter(out);
        bus.subscribe(FetchRoundStarted.class, printer::onRoundStarted);
        bus.subscribe(TaskFetched.class, printer::onTaskFetched);
        bus.subscribe(FetchRoundCompleted.class, printer::onRoundCompleted);
        bus.subscribe(AlertRaised.class, printer::onAlert);
        return printer;
    }

    private void onRoundStarted(FetchRoundStarted event) {
        roundSize.set(event.taskCount());
        completed.set(0);
        if (event.round() == 0) {
            out.println("Querying Google Maps API... (" + event.taskCount() + " queries, "
                    + event.workers() + " workers)");
        } else {
            out.println("Retry round " + event.round() + ": retrying " + event.taskCount()
                    + " failed queries on " + event.workers() + " workers...");
        }
    }

    private void onTaskFetched(TaskFetched event) {
        int total = roundSize.get();
        int done = completed.incrementAndGet();
        if (total >= STEPS && done < total && done % (total / STEPS) == 0) {
            out.println("  " + done + "/" + total + " queries done");
        }
    }

    private void onRoundCompleted(FetchRoundCompleted event) {
        out.println("  round " + event.round() + " finished: " + event.succeeded() + " succeeded, "
                + event.failed() + " failed (" + event.durationMillis() + " ms)");
    }

    private void onAlert(AlertRaised event) {
        out.println("Warning: " + event.message());
    }
}
