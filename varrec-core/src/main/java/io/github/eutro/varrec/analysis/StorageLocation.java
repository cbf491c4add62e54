package io.github.eutro.varrec.analysis;

import com.google.common.collect.Range;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Where a value lives: a register, a frame-relative stack slot, or a block-local temporary.
 * <p>
 * Stack slots are keyed by both offset and size, so two accesses at the same offset
 * with different widths are different locations.
 */
public abstract class StorageLocation {
    private StorageLocation() {
    }

    public abstract VariableKind kind();

    public static Register register(String name) {
        return new Register(name);
    }

    public static Stack stack(long offset, int size) {
        return new Stack(offset, size);
    }

    public static Temp temp(int block, int id) {
        return new Temp(block, id);
    }

    public static final class Register extends StorageLocation {
        @NotNull
        public final String name;

        private Register(@NotNull String name) {
            this.name = Objects.requireNonNull(name);
        }

        @Override
        public VariableKind kind() {
            return VariableKind.REGISTER;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Register && name.equals(((Register) o).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return "reg:" + name;
        }
    }

    public static final class Stack extends StorageLocation {
        /**
         * Offset from the frame base, i.e. the value of the stack pointer at function entry.
         */
        public final long offset;
        public final int size;

        private Stack(long offset, int size) {
            if (size <= 0) {
                throw new IllegalArgumentException("size must be positive: " + size);
            }
            if (!fits(offset, size)) {
                throw new IllegalArgumentException(String.format("window %d/%d overflows the frame", offset, size));
            }
            this.offset = offset;
            this.size = size;
        }

        /**
         * Whether a slot of the given size at the given offset ends at a representable offset.
         *
         * @param offset The offset of the first byte.
         * @param size   The size of the slot.
         * @return Whether {@code offset + size} does not overflow.
         */
        public static boolean fits(long offset, int size) {
            return size > 0 && offset <= Long.MAX_VALUE - size;
        }

        /**
         * Get the offset one past the last byte of this slot.
         *
         * @return The end offset.
         */
        public long end() {
            return offset + size;
        }

        /**
         * Get the bytes covered by this slot, as a half-open range.
         *
         * @return The window.
         */
        public Range<Long> window() {
            return Range.closedOpen(offset, end());
        }

        public static Stack ofWindow(Range<Long> window) {
            long lo = window.lowerEndpoint();
            return new Stack(lo, (int) (window.upperEndpoint() - lo));
        }

        @Override
        public VariableKind kind() {
            return VariableKind.STACK;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Stack)) return false;
            Stack stack = (Stack) o;
            return offset == stack.offset && size == stack.size;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(offset) * 31 + size;
        }

        @Override
        public String toString() {
            return "stack:" + offset + "/" + size;
        }
    }

    public static final class Temp extends StorageLocation {
        /**
         * The ordinal of the block the temporary belongs to.
         */
        public final int block;
        public final int id;

        private Temp(int block, int id) {
            this.block = block;
            this.id = id;
        }

        @Override
        public VariableKind kind() {
            return VariableKind.TEMPORARY;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Temp)) return false;
            Temp temp = (Temp) o;
            return block == temp.block && id == temp.id;
        }

        @Override
        public int hashCode() {
            return block * 31 + id;
        }

        @Override
        public String toString() {
            return "tmp:" + block + "." + id;
        }
    }
}
