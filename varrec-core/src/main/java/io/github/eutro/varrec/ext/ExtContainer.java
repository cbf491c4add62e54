package io.github.eutro.varrec.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something {@link Ext}s can be attached to.
 */
public interface ExtContainer {
    /**
     * Attach {@code value} under {@code ext}, replacing any previous value.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the value.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value under {@code ext}, if any.
     *
     * @param ext The ext.
     * @param <T> The type of the value.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value under {@code ext}, or null.
     *
     * @param ext The ext.
     * @param <T> The type of the value.
     * @return The value, or null if none is attached.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value under {@code ext}, throwing if none is attached.
     *
     * @param ext The ext.
     * @param <T> The type of the value.
     * @return The value.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T nullable = getNullable(ext);
        if (nullable != null) return nullable;
        throw new IllegalStateException(String.format("ext %s not present on %s", ext.getName(), this));
    }
}
