package io.github.eutro.varrec.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Something recovery events can be listened to on.
 *
 * @param <S> The type of events that can be listened to.
 */
public interface EventDispatcher<S> {
    /**
     * Listen to the given event type.
     * <p>
     * A listener only sees events whose dispatched type is exactly {@code eventClass}.
     *
     * @param eventClass The event class.
     * @param listener   The listener.
     * @param <T>        The event type.
     */
    <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener);

    /**
     * Listen to the given event type, recording every event.
     *
     * @param eventClass The event class.
     * @param <T>        The event type.
     * @return A live list the events are appended to, in dispatch order.
     */
    default <T extends S> List<T> collect(Class<T> eventClass) {
        List<T> events = new CopyOnWriteArrayList<>();
        listen(eventClass, events::add);
        return events;
    }
}
