package io.github.eutro.varrec.conf;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Frame and calling convention metadata for the architecture a function was lifted from.
 * <p>
 * Instances are immutable, and shared between all the functions of a batch.
 */
public final class FrameLayout {
    @NotNull
    public final String name;
    /**
     * The register whose value at function entry is the frame base.
     */
    @NotNull
    public final String stackPointer;
    @Nullable
    public final String framePointer;
    /**
     * The width of a register, and of a stack argument slot, in bytes.
     */
    public final int wordSize;
    /**
     * Registers carrying the first arguments of a call, in order.
     */
    public final List<String> argumentRegisters;
    @NotNull
    public final String returnRegister;
    /**
     * Registers a call may clobber. The return register is always clobbered.
     */
    public final Set<String> callerSaved;
    /**
     * Offset from the stack pointer, at a call statement, of the first stack-passed argument.
     */
    public final long stackArgumentOffset;

    public FrameLayout(
            @NotNull String name,
            @NotNull String stackPointer,
            @Nullable String framePointer,
            int wordSize,
            List<String> argumentRegisters,
            @NotNull String returnRegister,
            Set<String> callerSaved,
            long stackArgumentOffset
    ) {
        if (wordSize <= 0) {
            throw new IllegalArgumentException("word size must be positive: " + wordSize);
        }
        this.name = Objects.requireNonNull(name);
        this.stackPointer = Objects.requireNonNull(stackPointer);
        this.framePointer = framePointer;
        this.wordSize = wordSize;
        this.argumentRegisters = Collections.unmodifiableList(argumentRegisters);
        this.returnRegister = Objects.requireNonNull(returnRegister);
        this.callerSaved = Collections.unmodifiableSet(new LinkedHashSet<>(callerSaved));
        this.stackArgumentOffset = stackArgumentOffset;
    }

    @Override
    public String toString() {
        return name;
    }
}
