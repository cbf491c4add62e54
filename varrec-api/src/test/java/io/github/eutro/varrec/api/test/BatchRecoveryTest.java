package io.github.eutro.varrec.api.test;

import io.github.eutro.varrec.analysis.AnalysisStatus;
import io.github.eutro.varrec.analysis.Binding;
import io.github.eutro.varrec.analysis.CodeLocation;
import io.github.eutro.varrec.analysis.FunctionRecovery;
import io.github.eutro.varrec.api.BatchRecovery;
import io.github.eutro.varrec.api.RecoveryResults;
import io.github.eutro.varrec.api.events.BatchCompleteEvent;
import io.github.eutro.varrec.api.events.FunctionRecoveredEvent;
import io.github.eutro.varrec.conf.AnalysisOptions;
import io.github.eutro.varrec.conf.Conventions;
import io.github.eutro.varrec.conf.FunctionSignature;
import io.github.eutro.varrec.ir.BasicBlock;
import io.github.eutro.varrec.ir.Expr;
import io.github.eutro.varrec.ir.Function;
import io.github.eutro.varrec.ir.IRBuilder;
import io.github.eutro.varrec.passes.InvalidGraphException;
import io.github.eutro.varrec.unify.UnifiedVariable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class BatchRecoveryTest {
    static Function spill(String name) {
        Function func = new Function(name);
        BasicBlock b0 = func.newBb();
        IRBuilder ib = new IRBuilder(func, b0);
        ib.assign(Expr.reg("rsp", 8), Expr.sub(Expr.reg("rsp", 8), Expr.constant(16, 8)));
        ib.store(Expr.add(Expr.reg("rsp", 8), Expr.constant(8, 8)), Expr.reg("rdi", 8));
        ib.assign(Expr.reg("rax", 8), Expr.load(Expr.add(Expr.reg("rsp", 8), Expr.constant(8, 8)), 8));
        ib.assign(Expr.reg("rsp", 8), Expr.add(Expr.reg("rsp", 8), Expr.constant(16, 8)));
        ib.ret(Expr.reg("rax", 8));
        return func;
    }

    static Function broken(String name) {
        Function func = new Function(name);
        BasicBlock b0 = func.newBb();
        new IRBuilder(func, b0).ret(null);
        b0.successors.add(new Function("elsewhere").newBb());
        return func;
    }

    static Function callsBadSignature(String name) {
        Function func = new Function(name);
        new IRBuilder(func, func.newBb()).call(Expr.constant(0x1000, 8), "bad");
        return func;
    }

    private static BatchRecovery batch(int parallelism) {
        Map<String, FunctionSignature> signatures = new HashMap<>();
        // a null width makes the evaluator throw, which stands in for any unexpected bug
        signatures.put("bad", new FunctionSignature("bad", Arrays.asList(8, null), 8));
        return new BatchRecovery(
                Conventions.SYSV_AMD64,
                signatures,
                AnalysisOptions.defaults().parallelism(parallelism));
    }

    @Test
    void testFailingSiblingsAreIsolated() {
        RecoveryResults results = batch(4).recover(Arrays.asList(
                spill("first"),
                broken("broken"),
                callsBadSignature("buggy"),
                spill("second")));

        assertEquals(AnalysisStatus.CONVERGED, results.get("first").getStatus());
        assertEquals(AnalysisStatus.CONVERGED, results.get("second").getStatus());
        assertEquals(AnalysisStatus.FAILED, results.get("broken").getStatus());
        assertInstanceOf(InvalidGraphException.class, results.get("broken").getFailure());
        assertEquals(AnalysisStatus.FAILED, results.get("buggy").getStatus());
        assertInstanceOf(NullPointerException.class, results.get("buggy").getFailure());

        assertEquals(Arrays.asList("broken", "buggy"), results.functionsWithStatus(AnalysisStatus.FAILED));
        assertTrue(results.bindings("broken").isEmpty());
        assertTrue(results.unifiedVariables("buggy").isEmpty());
    }

    @Test
    void testSlotPastAddressSpaceDoesNotFail() {
        Function func = new Function("far");
        IRBuilder ib = new IRBuilder(func, func.newBb());
        ib.store(Expr.add(Expr.reg("rsp", 8), Expr.constant(Long.MAX_VALUE - 2, 8)), Expr.reg("rdi", 8));
        ib.ret(null);

        RecoveryResults results = batch(1).recover(Collections.singletonList(func));
        assertEquals(AnalysisStatus.CONVERGED, results.get("far").getStatus());
        assertFalse(results.unifiedVariables("far").isEmpty());
    }

    @Test
    void testAggregation() {
        RecoveryResults results = batch(2).recover(Arrays.asList(spill("f"), spill("g")));

        FunctionRecovery f = results.get("f");
        assertNotNull(f);
        assertEquals(f.getVariables().size() * 2, results.totalVariables());
        assertSame(f.getVariables().get(0), results.variable("f", 0));
        assertNotSame(results.variable("f", 0), results.variable("g", 0));

        Binding load = results.bindings("g").get(new CodeLocation(0, 2, 1));
        assertNotNull(load);
        assertEquals(Binding.Kind.USE, load.kind);

        List<String> names = results.unifiedVariables("f").values().stream()
                .map(UnifiedVariable::name)
                .collect(Collectors.toList());
        assertTrue(names.contains("var_8"));
        assertTrue(names.contains("r_rdi"));
        assertTrue(names.contains("r_rax"));
        assertEquals(f.getConstraints(), results.constraints("f"));
        assertEquals(results.getBindings().row("f"), results.bindings("f"));
    }

    @Test
    void testEvents() {
        BatchRecovery recovery = batch(3);
        List<FunctionRecoveredEvent> recovered = recovery.collect(FunctionRecoveredEvent.class);
        List<RecoveryResults> completed = new ArrayList<>();
        recovery.listen(BatchCompleteEvent.class, evt -> {
            assertEquals(3, recovered.size());
            completed.add(evt.results);
        });

        RecoveryResults results = recovery.recover(Arrays.asList(spill("a"), broken("b"), spill("c")));
        assertEquals(
                Arrays.asList("a", "b", "c"),
                recovered.stream().map(evt -> evt.recovery.functionName).collect(Collectors.toList()));
        assertEquals(Collections.singletonList(results), completed);
    }

    @Test
    void testDuplicateNamesRejected() {
        BatchRecovery recovery = batch(1);
        List<FunctionRecoveredEvent> recovered = recovery.collect(FunctionRecoveredEvent.class);
        assertThrows(IllegalArgumentException.class,
                () -> recovery.recover(Arrays.asList(spill("same"), spill("same"))));
        assertTrue(recovered.isEmpty());
    }

    @Test
    void testEmptyBatch() {
        RecoveryResults results = batch(2).recover(Collections.emptyList());
        assertTrue(results.getRecoveries().isEmpty());
        assertEquals(0, results.totalVariables());
    }
}
