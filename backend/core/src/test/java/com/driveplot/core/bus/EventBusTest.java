package com.driveplot.core.bus;

import com.driveplot.core.events.FetchRoundCompleted;
import com.driveplot.core.events.FetchRoundStarted;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    @Test
    void publishNotifiesMultipleSubscribersForSameType() {
        EventBus bus = new EventBus();
        AtomicInteger hitsA = new AtomicInteger();
        AtomicInteger hitsB = new AtomicInteger();

        bus.subscribe(FetchRoundStarted.class, event -> hitsA.incrementAndGet());
        bus.subscribe(FetchRoundStarted.class, event -> hitsB.incrementAndGet());

        bus.publish(new FetchRoundStarted(Instant.parse("2026-03-10T15:00:00Z"), 0, 8, 4));

        assertEquals(1, hitsA.get());
        assertEquals(1, hitsB.get());
    }

    @Test
    void publishRoutesToCorrectEventType() {
        EventBus bus = new EventBus();
        AtomicInteger startedHits = new AtomicInteger();
        AtomicInteger completedHits = new AtomicInteger();

        bus.subscribe(FetchRoundStarted.class, event -> startedHits.incrementAndGet());
        bus.subscribe(FetchRoundCompleted.class, event -> completedHits.incrementAndGet());

        bus.publish(new FetchRoundStarted(Instant.parse("2026-03-10T15:00:00Z"), 0, 8, 4));
        bus.publish(new FetchRoundCompleted(Instant.parse("2026-03-10T15:00:01Z"), 0, 7, 1, 1000));
        bus.publish(new FetchRoundCompleted(Instant.parse("2026-03-10T15:00:02Z"), 1, 1, 0, 800));

        assertEquals(1, startedHits.get());
        assertEquals(2, completedHits.get());
    }

    @Test
    void publishWithoutSubscribersIsANoOp() {
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("No handler is registered", error);
        });

        bus.publish(new FetchRoundStarted(Instant.parse("2026-03-10T15:00:00Z"), 0, 8, 4));
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> capturedError.set(error));
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(FetchRoundStarted.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(FetchRoundStarted.class, event -> safeHits.incrementAndGet());

        bus.publish(new FetchRoundStarted(Instant.parse("2026-03-10T15:00:00Z"), 1, 2, 2));

        assertEquals(1, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
    }
}
