package io.github.eutro.varrec.analysis;

import io.github.eutro.varrec.conf.FrameLayout;
import io.github.eutro.varrec.conf.FunctionSignature;
import io.github.eutro.varrec.constraints.ConstraintEmitter;
import io.github.eutro.varrec.constraints.Operation;
import io.github.eutro.varrec.constraints.Pointee;
import io.github.eutro.varrec.constraints.Relation;
import io.github.eutro.varrec.constraints.SignatureSlot;
import io.github.eutro.varrec.ir.BasicBlock;
import io.github.eutro.varrec.ir.Expr;
import io.github.eutro.varrec.ir.Stmt;
import io.github.eutro.varrec.util.Pair;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The transfer function of a single basic block.
 * <p>
 * One evaluator is used for every visit to every block of a function, so that the variable
 * defined (or read as input) at a given site and location is the same on every visit.
 */
final class BlockEvaluator implements Stmt.Visitor<Void>, Expr.Visitor<Value> {
    private final FrameLayout layout;
    private final RecoveryContext ctx;
    private final StorageLocation.Register stackPointer;

    private final VariableAllocator allocator;
    private final VariableBindings bindings;
    private final ConstraintEmitter emitter;
    private final Map<Pair<CodeLocation, StorageLocation>, SSAVariable> sites = new HashMap<>();

    private AbstractState state;
    private int block;
    private CodeLocation stmtLoc;
    private int nextSub;

    BlockEvaluator(RecoveryContext ctx, FunctionRecovery result) {
        this.ctx = ctx;
        this.layout = ctx.layout;
        this.stackPointer = StorageLocation.register(layout.stackPointer);
        this.allocator = result.allocator;
        this.bindings = result.bindings;
        this.emitter = result.emitter;
    }

    /**
     * Evaluate a block.
     *
     * @param bb      The block.
     * @param ordinal The index of the block in its function.
     * @param in      The state at block entry, which is not modified.
     * @return The state at block exit.
     */
    AbstractState evaluate(BasicBlock bb, int ordinal, AbstractState in) {
        state = in.copy();
        block = ordinal;
        List<Stmt> stmts = bb.getStmts();
        for (int i = 0; i < stmts.size(); i++) {
            stmtLoc = CodeLocation.ofStmt(ordinal, i);
            nextSub = CodeLocation.STMT + 1;
            stmts.get(i).accept(this);
        }
        state.dropTemporaries();
        AbstractState out = state;
        state = null;
        return out;
    }

    private CodeLocation enter() {
        return stmtLoc.withSub(nextSub++);
    }

    private SSAVariable variableAt(CodeLocation site, StorageLocation loc, int size, boolean input) {
        return sites.computeIfAbsent(Pair.of(site, loc), $ -> allocator.allocate(loc, site, size, input));
    }

    private Set<SSAVariable> read(StorageLocation loc, CodeLocation at, int size) {
        SSAVariable input = sites.get(Pair.of(at, loc));
        if (input == null && !state.isBound(loc)) {
            input = variableAt(at, loc, size, true);
        }
        if (input != null) {
            state.include(loc, input);
        }
        Set<SSAVariable> vars = new TreeSet<>(state.lookup(loc));
        bindings.bind(at, Binding.use(vars));
        return vars;
    }

    private SSAVariable define(StorageLocation loc, int size, Value src) {
        SSAVariable var = variableAt(stmtLoc, loc, size, false);
        state.define(loc, var);
        state.setFrameOffset(loc, src.frameOffset);
        bindings.bind(stmtLoc, Binding.definition(var));

        emitter.hasSize(var, size);
        for (SSAVariable v : src.vars) {
            emitter.equalsTypeOf(var, v);
        }
        if (src.operation != null) {
            emitter.emit(var, Relation.RESULT_OF_OPERATION, src.operation);
        }
        if (src.frameOffset != null) {
            emitter.emit(var, Relation.IS_POINTER_TO, Pointee.frame(src.frameOffset));
        }
        return var;
    }

    private void dereference(Value addr, int accessSize) {
        for (SSAVariable base : addr.base) {
            emitter.emit(base, Relation.IS_POINTER_TO, Pointee.memory(addr.displacement, accessSize));
            if (addr.arrayScale > 0) {
                emitter.emit(base, Relation.IS_ARRAY_OF, addr.arrayScale);
            }
        }
    }

    private StorageLocation locationOf(Expr.Lvalue lvalue) {
        if (lvalue instanceof Expr.Register) {
            return StorageLocation.register(((Expr.Register) lvalue).name);
        }
        return StorageLocation.temp(block, ((Expr.Temp) lvalue).id);
    }

    @Override
    public Void visitAssign(Stmt.Assign stmt) {
        Value src = stmt.src.accept(this);
        StorageLocation loc = locationOf(stmt.dst);
        if (loc.equals(stackPointer)) {
            state.setFrameOffset(loc, src.frameOffset);
            return null;
        }
        define(loc, stmt.dst.size, src);
        return null;
    }

    @Override
    public Void visitStore(Stmt.Store stmt) {
        Value addr = stmt.addr.accept(this);
        Value value = stmt.value.accept(this);
        StorageLocation.Stack slot = frameSlot(addr.frameOffset, stmt.size());
        if (slot != null) {
            define(slot, stmt.size(), value);
        } else {
            dereference(addr, stmt.size());
        }
        return null;
    }

    @Override
    public Void visitCall(Stmt.Call stmt) {
        stmt.target.accept(this);
        FunctionSignature signature = ctx.lookupSignature(stmt.callee);
        if (signature != null) {
            readArguments(signature);
        } else {
            readBoundArgumentRegisters();
        }

        for (String reg : layout.callerSaved) {
            if (!reg.equals(layout.stackPointer)) {
                state.kill(StorageLocation.register(reg));
            }
        }

        if (signature == null || signature.returnsValue()) {
            int size = signature == null ? layout.wordSize : signature.returnSize;
            SSAVariable ret = define(StorageLocation.register(layout.returnRegister), size, Value.UNKNOWN);
            if (signature != null) {
                emitter.emit(ret, Relation.CALL_SIGNATURE, new SignatureSlot(signature, SignatureSlot.RETURN));
            }
        }
        return null;
    }

    private void readArguments(FunctionSignature signature) {
        int base = nextSub;
        nextSub += signature.parameterSizes.size();
        List<String> argRegs = layout.argumentRegisters;
        for (int i = 0; i < signature.parameterSizes.size(); i++) {
            int size = signature.parameterSizes.get(i);
            StorageLocation loc;
            if (i < argRegs.size()) {
                loc = StorageLocation.register(argRegs.get(i));
            } else {
                Long sp = state.stackPointerDelta(layout);
                if (sp == null) continue;
                loc = frameSlot(
                        signExtend(sp + layout.stackArgumentOffset
                                + (long) (i - argRegs.size()) * layout.wordSize, layout.wordSize),
                        size);
                if (loc == null) continue;
            }
            for (SSAVariable arg : read(loc, stmtLoc.withSub(base + i), size)) {
                emitter.emit(arg, Relation.CALL_SIGNATURE, new SignatureSlot(signature, i));
            }
        }
    }

    private void readBoundArgumentRegisters() {
        int base = nextSub;
        List<String> argRegs = layout.argumentRegisters;
        nextSub += argRegs.size();
        for (int i = 0; i < argRegs.size(); i++) {
            StorageLocation loc = StorageLocation.register(argRegs.get(i));
            if (state.isBound(loc)) {
                read(loc, stmtLoc.withSub(base + i), layout.wordSize);
            }
        }
    }

    @Override
    public Void visitReturn(Stmt.Return stmt) {
        if (stmt.value != null) {
            stmt.value.accept(this);
        }
        return null;
    }

    @Override
    public Void visitBranch(Stmt.Branch stmt) {
        stmt.cond.accept(this);
        return null;
    }

    @Override
    public Void visitOpaque(Stmt.Opaque stmt) {
        bindings.bind(stmtLoc, Binding.unresolved());
        return null;
    }

    @Override
    public Value visitConst(Expr.Const expr) {
        enter();
        return Value.constant(signExtend(expr.value, expr.size));
    }

    @Override
    public Value visitRegister(Expr.Register expr) {
        CodeLocation at = enter();
        StorageLocation loc = StorageLocation.register(expr.name);
        if (loc.equals(stackPointer)) {
            return Value.frame(state.frameOffset(loc));
        }
        return Value.read(read(loc, at, expr.size), state.frameOffset(loc));
    }

    @Override
    public Value visitTemp(Expr.Temp expr) {
        CodeLocation at = enter();
        StorageLocation loc = StorageLocation.temp(block, expr.id);
        return Value.read(read(loc, at, expr.size), state.frameOffset(loc));
    }

    @Override
    public Value visitLoad(Expr.Load expr) {
        CodeLocation at = enter();
        Value addr = expr.addr.accept(this);
        StorageLocation.Stack loc = frameSlot(addr.frameOffset, expr.size);
        if (loc != null) {
            Set<SSAVariable> vars = read(loc, at, expr.size);
            for (SSAVariable var : vars) {
                emitter.hasSize(var, expr.size);
            }
            return Value.read(vars, state.frameOffset(loc));
        }
        dereference(addr, expr.size);
        return Value.UNKNOWN;
    }

    @Override
    public Value visitBinary(Expr.Binary expr) {
        enter();
        Value l = expr.lhs.accept(this);
        Value r = expr.rhs.accept(this);

        Long folded = l.constant != null && r.constant != null
                ? fold(expr.op, l.constant, r.constant)
                : null;
        if (folded != null) {
            return Value.constant(signExtend(folded, expr.size));
        }

        Long frameOffset = null;
        if (expr.op == Expr.BinaryOp.ADD) {
            if (l.frameOffset != null && r.constant != null) frameOffset = l.frameOffset + r.constant;
            else if (r.frameOffset != null && l.constant != null) frameOffset = r.frameOffset + l.constant;
        } else if (expr.op == Expr.BinaryOp.SUB && l.frameOffset != null && r.constant != null) {
            frameOffset = l.frameOffset - r.constant;
        }
        if (frameOffset != null) {
            frameOffset = signExtend(frameOffset, expr.size);
        }

        Set<SSAVariable> base = Collections.emptySet();
        long displacement = 0;
        int arrayScale = 0;
        int indexScale = 0;
        switch (expr.op) {
            case ADD:
                if (!l.base.isEmpty() && r.constant != null) {
                    base = l.base;
                    displacement = l.displacement + r.constant;
                    arrayScale = l.arrayScale;
                } else if (!r.base.isEmpty() && l.constant != null) {
                    base = r.base;
                    displacement = r.displacement + l.constant;
                    arrayScale = r.arrayScale;
                } else if (!l.base.isEmpty() && r.indexScale > 0) {
                    base = l.base;
                    displacement = l.displacement;
                    arrayScale = r.indexScale;
                } else if (!r.base.isEmpty() && l.indexScale > 0) {
                    base = r.base;
                    displacement = r.displacement;
                    arrayScale = l.indexScale;
                }
                break;
            case SUB:
                if (!l.base.isEmpty() && r.constant != null) {
                    base = l.base;
                    displacement = l.displacement - r.constant;
                    arrayScale = l.arrayScale;
                }
                break;
            case MUL:
                if (r.constant != null && r.constant > 0 && r.constant <= MAX_SCALE) {
                    indexScale = (int) (long) r.constant;
                } else if (l.constant != null && l.constant > 0 && l.constant <= MAX_SCALE) {
                    indexScale = (int) (long) l.constant;
                }
                break;
            case SHL:
                if (r.constant != null && r.constant >= 0 && r.constant <= MAX_SHIFT) {
                    indexScale = 1 << r.constant;
                }
                break;
            default:
                break;
        }

        List<SSAVariable> inputs = new ArrayList<>(l.vars);
        inputs.addAll(r.vars);
        Operation operation = new Operation(
                expr.op.name().toLowerCase(),
                inputs,
                r.constant != null ? r.constant : l.constant
        );
        return new Value(Collections.emptySet(), frameOffset, null, base, displacement, arrayScale, indexScale, operation);
    }

    private static final int MAX_SHIFT = 12;
    private static final int MAX_SCALE = 1 << MAX_SHIFT;

    /**
     * Read the low {@code size} bytes of a value as a signed integer.
     * <p>
     * Constants and frame offsets are kept in this form, so {@code esp + 0xfffffff8} and
     * {@code esp - 8} on a 4 byte stack pointer name the same slot.
     */
    static long signExtend(long value, int size) {
        if (size >= Long.BYTES) return value;
        int shift = Long.SIZE - size * Byte.SIZE;
        return (value << shift) >> shift;
    }

    static long zeroExtend(long value, int size) {
        if (size >= Long.BYTES) return value;
        return value & ((1L << (size * Byte.SIZE)) - 1);
    }

    @Nullable
    private StorageLocation.Stack frameSlot(@Nullable Long offset, int size) {
        // a window running past the end of the address space can't be named
        if (offset == null || !StorageLocation.Stack.fits(offset, size)) return null;
        return StorageLocation.stack(offset, size);
    }

    @Nullable
    private static Long fold(Expr.BinaryOp op, long l, long r) {
        switch (op) {
            case ADD:
                return l + r;
            case SUB:
                return l - r;
            case MUL:
                return l * r;
            case AND:
                return l & r;
            case OR:
                return l | r;
            case XOR:
                return l ^ r;
            case SHL:
                return l << r;
            default:
                return null;
        }
    }

    @Override
    public Value visitUnary(Expr.Unary expr) {
        enter();
        Value operand = expr.operand.accept(this);
        if (operand.constant != null) {
            return Value.constant(signExtend(
                    expr.op == Expr.UnaryOp.NEG ? -operand.constant : ~operand.constant,
                    expr.size));
        }
        return Value.result(new Operation(expr.op.name().toLowerCase(), new ArrayList<>(operand.vars), null));
    }

    @Override
    public Value visitConvert(Expr.Convert expr) {
        enter();
        Value operand = expr.operand.accept(this);
        if (operand.constant != null) {
            long value = expr.kind == Expr.ConvertKind.ZERO_EXTEND
                    ? zeroExtend(operand.constant, expr.operand.size)
                    : signExtend(operand.constant, expr.operand.size);
            return Value.constant(signExtend(value, expr.size));
        }
        return Value.result(new Operation(expr.kind.mnemonic, new ArrayList<>(operand.vars), null));
    }

    @Override
    public Value visitOpaque(Expr.Opaque expr) {
        bindings.bind(enter(), Binding.unresolved());
        return Value.UNKNOWN;
    }
}
