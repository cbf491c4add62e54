package io.github.eutro.varrec.test;

import io.github.eutro.varrec.conf.AnalysisOptions;
import io.github.eutro.varrec.conf.Conventions;
import io.github.eutro.varrec.conf.FrameLayout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AnalysisOptionsTest {
    @AfterEach
    void clearProperties() {
        System.clearProperty("varrec.maxBlockVisits");
        System.clearProperty("varrec.parallelism");
    }

    @Test
    void testDefaults() {
        AnalysisOptions options = AnalysisOptions.defaults();
        assertEquals(AnalysisOptions.DEFAULT_MAX_BLOCK_VISITS, options.getMaxBlockVisits());
        assertTrue(options.getParallelism() >= 1);
    }

    @Test
    void testSystemProperties() {
        System.setProperty("varrec.maxBlockVisits", "5");
        System.setProperty("varrec.parallelism", " 3 ");
        AnalysisOptions options = AnalysisOptions.fromEnvironment();
        assertEquals(5, options.getMaxBlockVisits());
        assertEquals(3, options.getParallelism());
    }

    @Test
    void testBadValues() {
        System.setProperty("varrec.maxBlockVisits", "lots");
        assertThrows(IllegalArgumentException.class, AnalysisOptions::fromEnvironment);
        assertThrows(IllegalArgumentException.class, () -> AnalysisOptions.defaults().maxBlockVisits(0));
        assertThrows(IllegalArgumentException.class, () -> AnalysisOptions.defaults().parallelism(-1));
    }

    @Test
    void testConventions() {
        FrameLayout sysv = Conventions.SYSV_AMD64;
        assertEquals("rsp", sysv.stackPointer);
        assertEquals(8, sysv.wordSize);
        assertEquals("rdi", sysv.argumentRegisters.get(0));
        assertTrue(sysv.callerSaved.contains(sysv.returnRegister));
        assertFalse(sysv.callerSaved.contains("rbx"));

        FrameLayout cdecl = Conventions.CDECL_X86;
        assertEquals(4, cdecl.wordSize);
        assertTrue(cdecl.argumentRegisters.isEmpty());
        assertSame(Conventions.SYSV_AMD64, Conventions.DEFAULT_LAYOUT);
    }
}
