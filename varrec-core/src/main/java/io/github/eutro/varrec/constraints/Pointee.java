package io.github.eutro.varrec.constraints;

/**
 * The operand of {@link Relation#IS_POINTER_TO}.
 * <p>
 * A {@link Region#FRAME} pointee is a stack slot, at a known offset from the frame base. A
 * {@link Region#MEMORY} pointee is an access {@code offset} bytes past the pointer, of {@code accessSize} bytes.
 */
public final class Pointee {
    public enum Region {
        FRAME,
        MEMORY,
    }

    public final Region region;
    public final long offset;
    /**
     * The width of the access through the pointer, or 0 if the pointer was not dereferenced.
     */
    public final int accessSize;

    private Pointee(Region region, long offset, int accessSize) {
        this.region = region;
        this.offset = offset;
        this.accessSize = accessSize;
    }

    public static Pointee frame(long frameOffset) {
        return new Pointee(Region.FRAME, frameOffset, 0);
    }

    public static Pointee memory(long offset, int accessSize) {
        return new Pointee(Region.MEMORY, offset, accessSize);
    }

    public boolean isFrame() {
        return region == Region.FRAME;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pointee)) return false;
        Pointee pointee = (Pointee) o;
        return region == pointee.region && offset == pointee.offset && accessSize == pointee.accessSize;
    }

    @Override
    public int hashCode() {
        return (region.hashCode() * 31 + Long.hashCode(offset)) * 31 + accessSize;
    }

    @Override
    public String toString() {
        return isFrame()
                ? "frame" + (offset >= 0 ? "+" : "") + offset
                : "*(+" + offset + "):" + accessSize;
    }
}
