package com.driveplot.engine.fetch;

import java.time.Duration;

@FunctionalInterface
public interface BackoffSleeper {
    void sleep(Duration duration) throws InterruptedException;

    static BackoffSleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
