package io.github.eutro.varrec.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mints {@link SSAVariable}s for a single function's analysis.
 * <p>
 * Every call to {@link #allocate} returns a new, distinct variable; the allocator never deduplicates.
 * Instances must not be shared between functions.
 */
public final class VariableAllocator {
    private final List<SSAVariable> allocated = new ArrayList<>();

    public SSAVariable allocate(StorageLocation location, CodeLocation site, int size, boolean input) {
        SSAVariable var = new SSAVariable(allocated.size(), location, site, size, input);
        allocated.add(var);
        return var;
    }

    /**
     * Get every variable allocated so far, in allocation order.
     *
     * @return An unmodifiable view of the variables.
     */
    public List<SSAVariable> getAllocated() {
        return Collections.unmodifiableList(allocated);
    }

    public int count() {
        return allocated.size();
    }
}
