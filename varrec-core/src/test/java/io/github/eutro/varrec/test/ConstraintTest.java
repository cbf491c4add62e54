package io.github.eutro.varrec.test;

import io.github.eutro.varrec.analysis.Binding;
import io.github.eutro.varrec.analysis.CodeLocation;
import io.github.eutro.varrec.analysis.FunctionRecovery;
import io.github.eutro.varrec.analysis.SSAVariable;
import io.github.eutro.varrec.analysis.StorageLocation;
import io.github.eutro.varrec.analysis.VariableAllocator;
import io.github.eutro.varrec.constraints.ConstraintEmitter;
import io.github.eutro.varrec.constraints.Operation;
import io.github.eutro.varrec.constraints.Pointee;
import io.github.eutro.varrec.constraints.Relation;
import io.github.eutro.varrec.constraints.TypeConstraint;
import io.github.eutro.varrec.ir.Expr;
import io.github.eutro.varrec.ir.Function;
import io.github.eutro.varrec.ir.IRBuilder;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static io.github.eutro.varrec.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ConstraintTest {
    @Test
    void testEmitterDeduplicates() {
        VariableAllocator allocator = new VariableAllocator();
        SSAVariable a = allocator.allocate(StorageLocation.register("rax"), CodeLocation.ofStmt(0, 0), 8, false);
        SSAVariable b = allocator.allocate(StorageLocation.register("rbx"), CodeLocation.ofStmt(0, 1), 8, false);

        ConstraintEmitter emitter = new ConstraintEmitter();
        emitter.hasSize(a, 8);
        emitter.equalsTypeOf(b, a);
        emitter.hasSize(a, 8);
        emitter.equalsTypeOf(a, a);
        emitter.equalsTypeOf(b, a);
        emitter.hasSize(a, 4);

        List<TypeConstraint<?>> constraints = emitter.getConstraints();
        assertEquals(3, constraints.size());
        assertSame(Relation.HAS_SIZE, constraints.get(0).relation);
        assertSame(Relation.EQUALS_TYPE_OF, constraints.get(1).relation);
        assertEquals(4, Relation.HAS_SIZE.check(constraints.get(2)).get().operand);
        assertFalse(Relation.IS_ARRAY_OF.check(constraints.get(0)).isPresent());
    }

    @Test
    void testOperandTypeIsChecked() {
        VariableAllocator allocator = new VariableAllocator();
        SSAVariable a = allocator.allocate(StorageLocation.register("rax"), CodeLocation.ofStmt(0, 0), 8, false);
        @SuppressWarnings({"unchecked", "rawtypes"})
        Relation<Object> raw = (Relation) Relation.HAS_SIZE;
        assertThrows(ClassCastException.class, () -> new TypeConstraint<>(a, raw, "eight"));
    }

    @Test
    void testArrayAccess() {
        Function func = new Function("index");
        IRBuilder ib = new IRBuilder(func, func.newBb());
        ib.assign(Expr.reg("eax", 4), Expr.load(
                Expr.add(reg("rdi"), Expr.binary(Expr.BinaryOp.MUL, reg("rsi"), imm(4))),
                4));

        FunctionRecovery recovery = recover(func);
        Binding base = recovery.getBindings().get(new CodeLocation(0, 0, 3));
        SSAVariable rdi = base.getVariables().iterator().next();
        assertEquals(StorageLocation.register("rdi"), rdi.location);

        List<TypeConstraint<Integer>> arrays = constraintsOf(recovery, Relation.IS_ARRAY_OF);
        assertEquals(1, arrays.size());
        assertSame(rdi, arrays.get(0).subject);
        assertEquals(4, arrays.get(0).operand);

        List<TypeConstraint<Pointee>> pointers = constraintsOf(recovery, Relation.IS_POINTER_TO);
        assertEquals(1, pointers.size());
        assertEquals(Pointee.memory(0, 4), pointers.get(0).operand);
    }

    @Test
    void testShiftedIndex() {
        Function func = new Function("shifted");
        IRBuilder ib = new IRBuilder(func, func.newBb());
        ib.store(Expr.add(Expr.binary(Expr.BinaryOp.SHL, reg("rcx"), imm(3)), reg("rdx")), reg("rax"));

        FunctionRecovery recovery = recover(func);
        List<TypeConstraint<Integer>> arrays = constraintsOf(recovery, Relation.IS_ARRAY_OF);
        assertEquals(1, arrays.size());
        assertEquals(8, arrays.get(0).operand);
        assertEquals(StorageLocation.register("rdx"), arrays.get(0).subject.location);
    }

    @Test
    void testOperationResults() {
        FunctionRecovery recovery = recover(VariableRecoveryTest.counter());
        SSAVariable incremented = recovery.getBindings().get(CodeLocation.ofStmt(1, 0)).getDefined();
        List<TypeConstraint<Operation>> ops = constraintsOf(recovery, Relation.RESULT_OF_OPERATION);
        assertFalse(ops.isEmpty());
        for (TypeConstraint<Operation> op : ops) {
            assertSame(incremented, op.subject);
            assertEquals("add", op.operand.operator);
            assertEquals(1L, op.operand.constant);
        }
        assertEquals(ops.size(), new HashSet<>(ops).size());
    }

    @Test
    void testCopiesShareTypes() {
        Function func = new Function("copy");
        IRBuilder ib = new IRBuilder(func, func.newBb());
        ib.assign(reg("rax"), reg("rdi"));

        FunctionRecovery recovery = recover(func);
        List<TypeConstraint<SSAVariable>> equal = constraintsOf(recovery, Relation.EQUALS_TYPE_OF);
        assertEquals(1, equal.size());
        assertEquals(StorageLocation.register("rax"), equal.get(0).subject.location);
        assertEquals(StorageLocation.register("rdi"), equal.get(0).operand.location);
        assertEquals(1, constraintsOf(recovery, Relation.HAS_SIZE).size());
    }
}
