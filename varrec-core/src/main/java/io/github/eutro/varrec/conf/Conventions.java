package io.github.eutro.varrec.conf;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

/**
 * Frame layouts for common calling conventions.
 */
public class Conventions {
    /**
     * System V AMD64: six integer argument registers, the rest on the stack.
     */
    public static final FrameLayout SYSV_AMD64 = new FrameLayout(
            "sysv-amd64",
            "rsp",
            "rbp",
            8,
            Arrays.asList("rdi", "rsi", "rdx", "rcx", "r8", "r9"),
            "rax",
            new HashSet<>(Arrays.asList("rax", "rcx", "rdx", "rsi", "rdi", "r8", "r9", "r10", "r11")),
            0
    );

    /**
     * 32-bit cdecl: every argument on the stack.
     */
    public static final FrameLayout CDECL_X86 = new FrameLayout(
            "cdecl-x86",
            "esp",
            "ebp",
            4,
            Collections.emptyList(),
            "eax",
            new HashSet<>(Arrays.asList("eax", "ecx", "edx")),
            0
    );

    public static final FrameLayout DEFAULT_LAYOUT = SYSV_AMD64;
}
