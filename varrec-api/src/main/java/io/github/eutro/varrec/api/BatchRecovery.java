package io.github.eutro.varrec.api;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.eutro.varrec.analysis.AnalysisStatus;
import io.github.eutro.varrec.analysis.FunctionRecovery;
import io.github.eutro.varrec.analysis.RecoveryContext;
import io.github.eutro.varrec.api.events.BatchCompleteEvent;
import io.github.eutro.varrec.api.events.EventSupplier;
import io.github.eutro.varrec.api.events.FunctionRecoveredEvent;
import io.github.eutro.varrec.api.events.RecoveryEvent;
import io.github.eutro.varrec.conf.AnalysisOptions;
import io.github.eutro.varrec.conf.FrameLayout;
import io.github.eutro.varrec.conf.FunctionSignature;
import io.github.eutro.varrec.ir.Function;
import io.github.eutro.varrec.passes.IRPass;
import io.github.eutro.varrec.passes.Passes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Recovers the variables of many functions at once, one function per task on a fixed thread pool.
 * <p>
 * The functions, frame layout and signatures are only read, and each task builds its own
 * {@link FunctionRecovery}, so tasks share no mutable state. A task that throws unexpectedly marks
 * only its own function {@link AnalysisStatus#FAILED}.
 * <p>
 * Events are dispatched on the calling thread once every task has finished.
 */
public class BatchRecovery extends EventSupplier<RecoveryEvent> {
    private static final Logger LOGGER = Logger.getLogger(BatchRecovery.class.getName());

    private final RecoveryContext ctx;
    private final int parallelism;
    private final IRPass<Function, FunctionRecovery> pipeline;

    public BatchRecovery(FrameLayout layout, Map<String, FunctionSignature> signatures, AnalysisOptions options) {
        this.ctx = new RecoveryContext(layout, signatures, options);
        this.parallelism = options.getParallelism();
        this.pipeline = Passes.recoverAndUnify(ctx);
    }

    public BatchRecovery(FrameLayout layout) {
        this(layout, Collections.emptyMap(), AnalysisOptions.fromEnvironment());
    }

    public RecoveryContext getContext() {
        return ctx;
    }

    /**
     * Recover every function in a batch.
     *
     * @param functions The functions, which must have distinct names.
     * @return The aggregated results.
     * @throws IllegalArgumentException If two functions share a name.
     */
    public RecoveryResults recover(List<Function> functions) {
        Set<String> names = new HashSet<>();
        for (Function func : functions) {
            if (!names.add(func.name)) {
                throw new IllegalArgumentException(String.format("duplicate function %s in batch", func.name));
            }
        }

        List<FunctionRecovery> recoveries = runAll(functions);
        for (FunctionRecovery recovery : recoveries) {
            dispatch(FunctionRecoveredEvent.class, new FunctionRecoveredEvent(recovery));
        }

        RecoveryResults results = RecoveryResults.aggregate(recoveries);
        LOGGER.info(() -> String.format(
                "recovered %d functions (%d converged, %d degraded, %d failed), %d variables",
                recoveries.size(),
                results.functionsWithStatus(AnalysisStatus.CONVERGED).size(),
                results.functionsWithStatus(AnalysisStatus.DEGRADED).size(),
                results.functionsWithStatus(AnalysisStatus.FAILED).size(),
                results.totalVariables()));
        return dispatch(BatchCompleteEvent.class, new BatchCompleteEvent(results)).results;
    }

    private List<FunctionRecovery> runAll(List<Function> functions) {
        if (functions.isEmpty()) return Collections.emptyList();

        List<Callable<FunctionRecovery>> tasks = new ArrayList<>(functions.size());
        for (Function func : functions) {
            tasks.add(() -> recoverOne(func));
        }

        ExecutorService pool = Executors.newFixedThreadPool(
                Math.min(parallelism, functions.size()),
                new ThreadFactoryBuilder()
                        .setNameFormat("varrec-worker-%d")
                        .setDaemon(true)
                        .build());
        try {
            List<FunctionRecovery> recoveries = new ArrayList<>(functions.size());
            for (Future<FunctionRecovery> future : pool.invokeAll(tasks)) {
                recoveries.add(future.get());
            }
            return recoveries;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while recovering batch", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("recovery task did not complete", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private FunctionRecovery recoverOne(Function func) {
        try {
            return pipeline.run(func);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "unexpected failure recovering " + func.name, e);
            FunctionRecovery failed = new FunctionRecovery(func.name);
            failed.fail(e);
            return failed;
        }
    }
}
