package io.github.eutro.varrec.test;

import io.github.eutro.varrec.analysis.CodeLocation;
import io.github.eutro.varrec.analysis.SSAVariable;
import io.github.eutro.varrec.analysis.StorageLocation;
import io.github.eutro.varrec.analysis.VariableAllocator;
import io.github.eutro.varrec.analysis.VariableKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VariableAllocatorTest {
    @Test
    void testFreshIdentities() {
        VariableAllocator allocator = new VariableAllocator();
        CodeLocation site = CodeLocation.ofStmt(0, 0);
        SSAVariable first = allocator.allocate(StorageLocation.register("rax"), site, 8, false);
        SSAVariable second = allocator.allocate(StorageLocation.register("rax"), site, 8, false);
        assertNotSame(first, second);
        assertNotEquals(first, second);
        assertEquals(0, first.id);
        assertEquals(1, second.id);
        assertEquals(2, allocator.count());
    }

    @Test
    void testKindFollowsLocation() {
        VariableAllocator allocator = new VariableAllocator();
        CodeLocation site = new CodeLocation(2, 1, 3);
        assertEquals(VariableKind.REGISTER,
                allocator.allocate(StorageLocation.register("rdi"), site, 8, true).kind());
        assertEquals(VariableKind.STACK,
                allocator.allocate(StorageLocation.stack(16, 8), site, 8, true).kind());
        assertEquals(VariableKind.TEMPORARY,
                allocator.allocate(StorageLocation.temp(2, 4), site, 4, false).kind());
        assertThrows(UnsupportedOperationException.class, () -> allocator.getAllocated().clear());
    }

    @Test
    void testCodeLocationOrder() {
        assertTrue(CodeLocation.ofStmt(0, 5).compareTo(CodeLocation.ofStmt(1, 0)) < 0);
        assertTrue(CodeLocation.ofStmt(1, 0).compareTo(new CodeLocation(1, 0, 1)) < 0);
        assertTrue(new CodeLocation(1, 0, 9).compareTo(CodeLocation.ofStmt(1, 1)) < 0);
        assertEquals("1.2.3", new CodeLocation(1, 2, 3).toString());
        assertEquals("1.2", CodeLocation.ofStmt(1, 2).toString());
    }
}
