package com.driveplot.core.bus;

import com.driveplot.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous typed event dispatch. Handlers run on the publishing thread, so fetch workers
 * publishing concurrently may invoke the same handler concurrently.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Consumer<? extends Event>>> handlersByType = new ConcurrentHashMap<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Handler failed for " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        handlersByType.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void publish(Event event) {
        List<Consumer<? extends Event>> handlers = handlersByType.get(event.getClass());
        if (handlers == null) {
            return;
        }
        for (Consumer<? extends Event> handler : handlers) {
            dispatch(handler, event);
        }
    }

    @SuppressWarnings("unchecked")
    private <T extends Event> void dispatch(Consumer<? extends Event> handler, Event event) {
        try {
            ((Consumer<T>) handler).accept((T) event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }
}
