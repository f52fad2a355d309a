package com.webmon.core.bus;

import com.webmon.core.events.Event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final List<Registration<?>> registrations = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Event handler failed for type " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> Subscription subscribe(Class<T> type, Consumer<? super T> handler) {
        Registration<T> registration = new Registration<>(type, handler);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    public void publish(Event event) {
        for (Registration<?> registration : registrations) {
            if (registration.accepts(event)) {
                try {
                    registration.deliver(event);
                } catch (Exception ex) {
                    onHandlerError.accept(event, ex);
                }
            }
        }
    }

    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private static final class Registration<T extends Event> {
        private final Class<T> type;
        private final Consumer<? super T> handler;

        private Registration(Class<T> type, Consumer<? super T> handler) {
            this.type = type;
            this.handler = handler;
        }

        boolean accepts(Event event) {
            return type.isInstance(event);
        }

        void deliver(Event event) {
            handler.accept(type.cast(event));
        }
    }
}
