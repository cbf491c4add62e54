package io.github.eutro.varrec.test;

import io.github.eutro.varrec.analysis.AbstractState;
import io.github.eutro.varrec.analysis.CodeLocation;
import io.github.eutro.varrec.analysis.SSAVariable;
import io.github.eutro.varrec.analysis.StorageLocation;
import io.github.eutro.varrec.analysis.VariableAllocator;
import io.github.eutro.varrec.conf.Conventions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

public class AbstractStateTest {
    private static final StorageLocation RAX = StorageLocation.register("rax");
    private static final StorageLocation RBP = StorageLocation.register("rbp");
    private static final StorageLocation SLOT = StorageLocation.stack(-8, 8);

    private SSAVariable a;
    private SSAVariable b;
    private SSAVariable c;

    @BeforeEach
    void setUp() {
        VariableAllocator allocator = new VariableAllocator();
        a = allocator.allocate(RAX, CodeLocation.ofStmt(0, 0), 8, false);
        b = allocator.allocate(RAX, CodeLocation.ofStmt(1, 0), 8, false);
        c = allocator.allocate(SLOT, CodeLocation.ofStmt(1, 1), 8, false);
    }

    private AbstractState left() {
        AbstractState state = AbstractState.entry(Conventions.SYSV_AMD64);
        state.define(RAX, a);
        state.setFrameOffset(RBP, -8L);
        return state;
    }

    private AbstractState right() {
        AbstractState state = AbstractState.entry(Conventions.SYSV_AMD64);
        state.define(RAX, b);
        state.define(SLOT, c);
        state.setFrameOffset(RBP, -16L);
        return state;
    }

    @Test
    void testJoinUnionsVariables() {
        AbstractState joined = left().join(right());
        assertEquals(new HashSet<>(Arrays.asList(a, b)), joined.lookup(RAX));
        assertEquals(new HashSet<>(Arrays.asList(c)), joined.lookup(SLOT));
    }

    @Test
    void testJoinKeepsAgreedFrameOffsets() {
        AbstractState joined = left().join(right());
        assertNull(joined.frameOffset(RBP));
        assertEquals(0L, joined.stackPointerDelta(Conventions.SYSV_AMD64));
    }

    @Test
    void testJoinLaws() {
        AbstractState l = left();
        AbstractState r = right();
        assertEquals(l.join(r), r.join(l));
        assertEquals(l, l.join(l));
        AbstractState third = AbstractState.empty();
        third.define(RAX, c);
        assertEquals(l.join(r).join(third), l.join(r.join(third)));
    }

    @Test
    void testJoinLeavesOperandsUntouched() {
        AbstractState l = left();
        AbstractState before = l.copy();
        l.join(right());
        assertEquals(before, l);
    }

    @Test
    void testDefineIsStrong() {
        AbstractState state = left().join(right());
        state.define(RAX, c);
        assertEquals(new HashSet<>(Arrays.asList(c)), state.lookup(RAX));
    }

    @Test
    void testDropTemporaries() {
        AbstractState state = AbstractState.empty();
        StorageLocation temp = StorageLocation.temp(0, 3);
        state.define(temp, a);
        state.define(RAX, b);
        state.dropTemporaries();
        assertFalse(state.isBound(temp));
        assertTrue(state.isBound(RAX));
    }

    @Test
    void testKill() {
        AbstractState state = left();
        state.kill(RAX);
        state.kill(RBP);
        assertTrue(state.lookup(RAX).isEmpty());
        assertNull(state.frameOffset(RBP));
    }
}
