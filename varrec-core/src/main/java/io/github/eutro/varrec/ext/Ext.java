package io.github.eutro.varrec.ext;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key, under which a value of type {@code T} can be attached
 * to an {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation, which is only stable within one execution.
 *
 * @param <T> The type of the value.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final int id = ID_COUNTER.getAndIncrement();
    private final Class<?> type;
    private final String name;

    private Ext(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * Classes can't carry type arguments, so {@code R} may be more specific
     * than {@code type}; the class is only kept for debugging.
     *
     * @param type The erased type of the value.
     * @param name The name of the ext.
     * @param <T>  The erased type.
     * @param <R>  The type of the value.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getName();
    }
}
