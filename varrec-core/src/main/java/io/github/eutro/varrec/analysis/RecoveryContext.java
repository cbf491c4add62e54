package io.github.eutro.varrec.analysis;

import io.github.eutro.varrec.conf.AnalysisOptions;
import io.github.eutro.varrec.conf.Conventions;
import io.github.eutro.varrec.conf.FrameLayout;
import io.github.eutro.varrec.conf.FunctionSignature;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * The read-only inputs shared by every function analysed in a batch: the frame layout,
 * the signatures of known callees, and the options.
 */
public final class RecoveryContext {
    public final FrameLayout layout;
    private final Map<String, FunctionSignature> signatures;
    public final int maxBlockVisits;

    public RecoveryContext(FrameLayout layout, Map<String, FunctionSignature> signatures, AnalysisOptions options) {
        this.layout = layout;
        this.signatures = Collections.unmodifiableMap(new HashMap<>(signatures));
        this.maxBlockVisits = options.getMaxBlockVisits();
    }

    public RecoveryContext(FrameLayout layout) {
        this(layout, Collections.emptyMap(), AnalysisOptions.defaults());
    }

    public static RecoveryContext defaults() {
        return new RecoveryContext(Conventions.DEFAULT_LAYOUT);
    }

    @Nullable
    public FunctionSignature lookupSignature(@Nullable String callee) {
        return callee == null ? null : signatures.get(callee);
    }
}
