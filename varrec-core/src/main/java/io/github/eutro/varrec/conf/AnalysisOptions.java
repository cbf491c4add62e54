package io.github.eutro.varrec.conf;

import org.jetbrains.annotations.Nullable;

/**
 * Tunables for variable recovery.
 * <p>
 * Defaults can be overridden from the environment ({@code VARREC_MAX_BLOCK_VISITS},
 * {@code VARREC_PARALLELISM}) or with system properties ({@code varrec.maxBlockVisits},
 * {@code varrec.parallelism}), the latter taking precedence.
 */
public final class AnalysisOptions {
    public static final int DEFAULT_MAX_BLOCK_VISITS = 32;

    private int maxBlockVisits = DEFAULT_MAX_BLOCK_VISITS;
    private int parallelism = Runtime.getRuntime().availableProcessors();

    public static AnalysisOptions defaults() {
        return new AnalysisOptions();
    }

    public static AnalysisOptions fromEnvironment() {
        AnalysisOptions options = new AnalysisOptions();
        Integer visits = lookup("varrec.maxBlockVisits", "VARREC_MAX_BLOCK_VISITS");
        if (visits != null) options.maxBlockVisits(visits);
        Integer parallelism = lookup("varrec.parallelism", "VARREC_PARALLELISM");
        if (parallelism != null) options.parallelism(parallelism);
        return options;
    }

    @Nullable
    private static Integer lookup(String property, String env) {
        String value = System.getProperty(property);
        if (value == null) value = System.getenv(env);
        if (value == null) return null;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("%s/%s is not a number: %s", property, env, value), e);
        }
    }

    /**
     * How many times a single block may be evaluated before the function is considered degraded.
     *
     * @return The ceiling.
     */
    public int getMaxBlockVisits() {
        return maxBlockVisits;
    }

    public AnalysisOptions maxBlockVisits(int maxBlockVisits) {
        if (maxBlockVisits < 1) {
            throw new IllegalArgumentException("maxBlockVisits must be at least 1: " + maxBlockVisits);
        }
        this.maxBlockVisits = maxBlockVisits;
        return this;
    }

    public int getParallelism() {
        return parallelism;
    }

    public AnalysisOptions parallelism(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
        }
        this.parallelism = parallelism;
        return this;
    }

    @Override
    public String toString() {
        return "AnalysisOptions{maxBlockVisits=" + maxBlockVisits + ", parallelism=" + parallelism + '}';
    }
}
