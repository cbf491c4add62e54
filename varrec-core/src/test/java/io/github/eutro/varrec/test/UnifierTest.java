package io.github.eutro.varrec.test;

import io.github.eutro.varrec.analysis.Binding;
import io.github.eutro.varrec.analysis.CodeLocation;
import io.github.eutro.varrec.analysis.SSAVariable;
import io.github.eutro.varrec.analysis.StorageLocation;
import io.github.eutro.varrec.analysis.VariableAllocator;
import io.github.eutro.varrec.unify.DisjointSet;
import io.github.eutro.varrec.unify.OverlapConflict;
import io.github.eutro.varrec.unify.UnificationResult;
import io.github.eutro.varrec.unify.UnifiedVariable;
import io.github.eutro.varrec.unify.Unifier;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class UnifierTest {
    private final VariableAllocator allocator = new VariableAllocator();

    private SSAVariable stack(long offset, int size, int stmt) {
        return allocator.allocate(StorageLocation.stack(offset, size), CodeLocation.ofStmt(0, stmt), size, false);
    }

    private SSAVariable reg(String name, int block, int stmt) {
        return allocator.allocate(StorageLocation.register(name), CodeLocation.ofStmt(block, stmt), 8, false);
    }

    @Test
    void testRegistersByName() {
        SSAVariable rax1 = reg("rax", 1, 0);
        SSAVariable rax0 = reg("rax", 0, 3);
        SSAVariable rbx = reg("rbx", 0, 0);
        UnificationResult result = Unifier.unify(allocator.getAllocated());

        assertEquals(2, result.size());
        assertSame(result.lookup(rax0), result.lookup(rax1));
        assertNotSame(result.lookup(rax0), result.lookup(rbx));
        assertSame(rax0, result.lookup(rax1).representative);
        assertEquals("r_rbx", result.getUnified().get(0).name());
        assertEquals(0, result.getUnified().get(0).id);
    }

    @Test
    void testTransitiveOverlap() {
        SSAVariable a = stack(-24, 8, 0);
        SSAVariable b = stack(-20, 8, 1);
        SSAVariable c = stack(-14, 8, 2);
        SSAVariable apart = stack(-40, 8, 3);
        UnificationResult result = Unifier.unify(allocator.getAllocated());

        UnifiedVariable uv = result.lookup(a);
        assertSame(uv, result.lookup(b));
        assertSame(uv, result.lookup(c));
        assertNotSame(uv, result.lookup(apart));
        assertEquals(StorageLocation.stack(-24, 18), uv.location);
        // a and c do not overlap each other
        assertEquals(2, uv.getConflicts().size());
        for (OverlapConflict conflict : uv.getConflicts()) {
            assertEquals(OverlapConflict.Kind.PARTIAL_OVERLAP, conflict.kind);
        }
    }

    @Test
    void testAdjacentWindowsStayApart() {
        SSAVariable low = stack(-16, 8, 0);
        SSAVariable high = stack(-8, 8, 1);
        UnificationResult result = Unifier.unify(allocator.getAllocated());
        assertNotSame(result.lookup(low), result.lookup(high));
        assertEquals("var_10", result.lookup(low).name());
        assertEquals("var_8", result.lookup(high).name());
    }

    @Test
    void testSameWindowNoConflict() {
        SSAVariable a = stack(8, 8, 0);
        SSAVariable b = stack(8, 8, 1);
        UnificationResult result = Unifier.unify(allocator.getAllocated());
        UnifiedVariable uv = result.lookup(a);
        assertSame(uv, result.lookup(b));
        assertFalse(uv.hasConflicts());
        assertEquals("arg_8", uv.name());
    }

    @Test
    void testIdempotent() {
        stack(-8, 8, 0);
        stack(-4, 4, 1);
        reg("rax", 0, 2);
        reg("rax", 1, 0);
        stack(-32, 8, 3);

        UnificationResult once = Unifier.unify(allocator.getAllocated());
        List<SSAVariable> shuffled = new ArrayList<>(allocator.getAllocated());
        Collections.reverse(shuffled);
        UnificationResult twice = Unifier.unify(shuffled);

        assertEquals(once.size(), twice.size());
        for (int i = 0; i < once.size(); i++) {
            UnifiedVariable x = once.getUnified().get(i);
            UnifiedVariable y = twice.getUnified().get(i);
            assertEquals(x.getMembers(), y.getMembers());
            assertEquals(x.location, y.location);
            assertSame(x.representative, y.representative);
            assertEquals(x.getConflicts(), y.getConflicts());
        }
    }

    @Test
    void testLookupUnknown() {
        reg("rax", 0, 0);
        UnificationResult result = Unifier.unify(allocator.getAllocated());
        SSAVariable stranger = new VariableAllocator()
                .allocate(StorageLocation.register("rax"), CodeLocation.ofStmt(0, 0), 8, false);
        assertThrows(IllegalArgumentException.class, () -> result.lookup(stranger));
        assertTrue(result.resolve(Binding.unresolved()).isEmpty());
    }

    @Test
    void testDisjointSet() {
        DisjointSet<String> set = new DisjointSet<>();
        for (String s : Arrays.asList("a", "b", "c", "d")) set.add(s);
        set.union("a", "b");
        set.union("c", "d");
        assertTrue(set.sameSet("a", "b"));
        assertFalse(set.sameSet("a", "c"));
        set.union("b", "d");
        assertTrue(set.sameSet("a", "c"));
        assertEquals(1, set.sets().size());
        assertThrows(IllegalArgumentException.class, () -> set.find("e"));
    }

    @Test
    void testWindowAtEndOfAddressSpace() {
        SSAVariable top = stack(Long.MAX_VALUE - 8, 8, 0);
        SSAVariable inner = stack(Long.MAX_VALUE - 4, 4, 1);
        UnificationResult result = Unifier.unify(allocator.getAllocated());

        UnifiedVariable uv = result.lookup(top);
        assertSame(uv, result.lookup(inner));
        assertEquals(StorageLocation.stack(Long.MAX_VALUE - 8, 8), uv.location);
        assertEquals(OverlapConflict.Kind.SIZE_MISMATCH, uv.getConflicts().get(0).kind);

        assertFalse(StorageLocation.Stack.fits(Long.MAX_VALUE - 2, 8));
        assertThrows(IllegalArgumentException.class, () -> StorageLocation.stack(Long.MAX_VALUE - 2, 8));
    }
}
