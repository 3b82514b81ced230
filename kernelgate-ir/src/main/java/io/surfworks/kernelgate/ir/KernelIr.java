package io.surfworks.kernelgate.ir;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Node classes for the scheduled kernel IR.
 *
 * <p>The tree is immutable and acyclic. Every node is tagged with its kind
 * ({@link StmtKind} or {@link ExprKind}) so passes can dispatch with a plain
 * {@code switch} instead of relying on the node class hierarchy.
 *
 * <p>Example:
 * <pre>{@code
 * Var buf = new Var("A.shared");
 * IterVar tx = IterVar.thread("threadIdx.x");
 *
 * Stmt kernel = new ProducerConsumer("compute", true,
 *     new AttrStmt(tx, AttrKeys.THREAD_EXTENT, IntImm.int32(32),
 *         new AttrStmt(buf, AttrKeys.STORAGE_SCOPE, new StringImm("shared"),
 *             new Allocate(buf, DataType.FLOAT32, List.of(IntImm.int32(1024)), Evaluate.NOP))));
 * }</pre>
 */
public final class KernelIr {

    private KernelIr() {}

    // ==================== Expressions ====================

    /**
     * Base interface for all expressions.
     */
    public sealed interface Expr permits Var, IntImm, FloatImm, StringImm, Binary, Load, Call {
        ExprKind kind();
    }

    /**
     * Target of an {@link AttrStmt}: a plain variable or an iteration variable.
     */
    public sealed interface AttrNode permits Var, IterVar {}

    /**
     * A variable. Compared by identity: two variables sharing a name hint are
     * still distinct buffers.
     */
    public static final class Var implements Expr, AttrNode {
        private final String name;
        private final DataType type;

        public Var(String name) {
            this(name, DataType.HANDLE);
        }

        public Var(String name, DataType type) {
            this.name = Objects.requireNonNull(name, "name");
            this.type = Objects.requireNonNull(type, "type");
        }

        public String name() {
            return name;
        }

        public DataType type() {
            return type;
        }

        @Override
        public ExprKind kind() {
            return ExprKind.VAR;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Integer constant.
     */
    public record IntImm(DataType type, long value) implements Expr {
        public IntImm {
            Objects.requireNonNull(type, "type");
        }

        public static IntImm int32(long value) {
            return new IntImm(DataType.INT32, value);
        }

        public static IntImm int64(long value) {
            return new IntImm(DataType.INT64, value);
        }

        @Override
        public ExprKind kind() {
            return ExprKind.INT_IMM;
        }
    }

    /**
     * Floating-point constant.
     */
    public record FloatImm(DataType type, double value) implements Expr {
        public FloatImm {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public ExprKind kind() {
            return ExprKind.FLOAT_IMM;
        }
    }

    /**
     * String constant, used for storage scopes and pragma values.
     */
    public record StringImm(String value) implements Expr {
        public StringImm {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ExprKind kind() {
            return ExprKind.STRING_IMM;
        }
    }

    public enum BinaryOp {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"), MIN("min"), MAX("max"), LT("<"), EQ("==");

        private final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public record Binary(BinaryOp op, Expr a, Expr b) implements Expr {
        public Binary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(a, "a");
            Objects.requireNonNull(b, "b");
        }

        @Override
        public ExprKind kind() {
            return ExprKind.BINARY;
        }
    }

    /**
     * Read of one element from a buffer.
     */
    public record Load(DataType type, Var bufferVar, Expr index) implements Expr {
        public Load {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(bufferVar, "bufferVar");
            Objects.requireNonNull(index, "index");
        }

        @Override
        public ExprKind kind() {
            return ExprKind.LOAD;
        }
    }

    /**
     * Intrinsic call such as {@code tvm_storage_sync}.
     */
    public record Call(DataType type, String name, List<Expr> args) implements Expr {
        public Call {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(name, "name");
            args = List.copyOf(args);
        }

        @Override
        public ExprKind kind() {
            return ExprKind.CALL;
        }
    }

    /**
     * Iteration variable. Thread axes carry a tag such as {@code threadIdx.x}
     * and their variable is named after it.
     */
    public record IterVar(Var var, Optional<Expr> domExtent, String threadTag) implements AttrNode {
        public IterVar {
            Objects.requireNonNull(var, "var");
            Objects.requireNonNull(domExtent, "domExtent");
            Objects.requireNonNull(threadTag, "threadTag");
        }

        /**
         * Creates a thread axis whose variable and tag are both {@code tag}.
         */
        public static IterVar thread(String tag) {
            return new IterVar(new Var(tag, DataType.INT32), Optional.empty(), tag);
        }
    }

    // ==================== Statements ====================

    /**
     * Base interface for all statements.
     */
    public sealed interface Stmt permits
            ProducerConsumer, AttrStmt, Allocate, For, IfThenElse, LetStmt, Store, Evaluate, Block {
        StmtKind kind();
    }

    /**
     * Kernel region marker. A producer marker opens a new nesting level; a
     * consumer marker is a pass-through.
     */
    public record ProducerConsumer(String func, boolean isProducer, Stmt body) implements Stmt {
        public ProducerConsumer {
            Objects.requireNonNull(func, "func");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public StmtKind kind() {
            return StmtKind.PRODUCER_CONSUMER;
        }
    }

    /**
     * Attaches a keyed attribute to {@code node} for the scope of {@code body}.
     */
    public record AttrStmt(AttrNode node, String key, Expr value, Stmt body) implements Stmt {
        public AttrStmt {
            Objects.requireNonNull(node, "node");
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public StmtKind kind() {
            return StmtKind.ATTR_STMT;
        }
    }

    /**
     * Allocates a buffer of {@code type} with the given extents, live for the
     * scope of {@code body}.
     */
    public record Allocate(Var bufferVar, DataType type, List<Expr> extents, Expr condition, Stmt body)
            implements Stmt {
        public Allocate {
            Objects.requireNonNull(bufferVar, "bufferVar");
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(body, "body");
            extents = List.copyOf(extents);
        }

        public Allocate(Var bufferVar, DataType type, List<Expr> extents, Stmt body) {
            this(bufferVar, type, extents, new IntImm(DataType.BOOL, 1), body);
        }

        /**
         * Returns the element count when every extent is a constant, else 0.
         */
        public long constantAllocationSize() {
            long size = 1;
            for (Expr extent : extents) {
                if (!(extent instanceof IntImm imm)) {
                    return 0;
                }
                size *= imm.value();
            }
            return size;
        }

        @Override
        public StmtKind kind() {
            return StmtKind.ALLOCATE;
        }
    }

    public enum ForType {
        SERIAL, PARALLEL, VECTORIZED, UNROLLED
    }

    public record For(Var loopVar, Expr min, Expr extent, ForType forType, Stmt body) implements Stmt {
        public For {
            Objects.requireNonNull(loopVar, "loopVar");
            Objects.requireNonNull(min, "min");
            Objects.requireNonNull(extent, "extent");
            Objects.requireNonNull(forType, "forType");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public StmtKind kind() {
            return StmtKind.FOR;
        }
    }

    public record IfThenElse(Expr condition, Stmt thenCase, Optional<Stmt> elseCase) implements Stmt {
        public IfThenElse {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(thenCase, "thenCase");
            Objects.requireNonNull(elseCase, "elseCase");
        }

        public IfThenElse(Expr condition, Stmt thenCase) {
            this(condition, thenCase, Optional.empty());
        }

        @Override
        public StmtKind kind() {
            return StmtKind.IF_THEN_ELSE;
        }
    }

    public record LetStmt(Var var, Expr value, Stmt body) implements Stmt {
        public LetStmt {
            Objects.requireNonNull(var, "var");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public StmtKind kind() {
            return StmtKind.LET_STMT;
        }
    }

    /**
     * Write of one element into a buffer.
     */
    public record Store(Var bufferVar, Expr value, Expr index) implements Stmt {
        public Store {
            Objects.requireNonNull(bufferVar, "bufferVar");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(index, "index");
        }

        @Override
        public StmtKind kind() {
            return StmtKind.STORE;
        }
    }

    /**
     * Evaluates an expression for its side effects.
     */
    public record Evaluate(Expr value) implements Stmt {
        public static final Evaluate NOP = new Evaluate(IntImm.int32(0));

        public Evaluate {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public StmtKind kind() {
            return StmtKind.EVALUATE;
        }
    }

    /**
     * Sequence of statements executed in order.
     */
    public record Block(List<Stmt> stmts) implements Stmt {
        public Block {
            stmts = List.copyOf(stmts);
        }

        public static Block of(Stmt... stmts) {
            return new Block(List.of(stmts));
        }

        @Override
        public StmtKind kind() {
            return StmtKind.BLOCK;
        }
    }
}
