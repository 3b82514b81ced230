package io.surfworks.kernelgate.ir;

import io.surfworks.kernelgate.ir.KernelIr.Allocate;
import io.surfworks.kernelgate.ir.KernelIr.AttrNode;
import io.surfworks.kernelgate.ir.KernelIr.AttrStmt;
import io.surfworks.kernelgate.ir.KernelIr.Binary;
import io.surfworks.kernelgate.ir.KernelIr.Block;
import io.surfworks.kernelgate.ir.KernelIr.Call;
import io.surfworks.kernelgate.ir.KernelIr.Evaluate;
import io.surfworks.kernelgate.ir.KernelIr.Expr;
import io.surfworks.kernelgate.ir.KernelIr.FloatImm;
import io.surfworks.kernelgate.ir.KernelIr.For;
import io.surfworks.kernelgate.ir.KernelIr.IfThenElse;
import io.surfworks.kernelgate.ir.KernelIr.IntImm;
import io.surfworks.kernelgate.ir.KernelIr.IterVar;
import io.surfworks.kernelgate.ir.KernelIr.LetStmt;
import io.surfworks.kernelgate.ir.KernelIr.Load;
import io.surfworks.kernelgate.ir.KernelIr.ProducerConsumer;
import io.surfworks.kernelgate.ir.KernelIr.Stmt;
import io.surfworks.kernelgate.ir.KernelIr.Store;
import io.surfworks.kernelgate.ir.KernelIr.StringImm;
import io.surfworks.kernelgate.ir.KernelIr.Var;

/**
 * Renders IR nodes as indented text for diagnostics.
 *
 * <pre>
 * // produce compute {
 *   // attr [iter_var(threadIdx.x)] thread_extent = 32
 *   allocate A.shared[float32 * 1024]
 *   ...
 * }
 * </pre>
 */
public final class IrPrinter {

    private static final String INDENT = "  ";

    private final StringBuilder sb = new StringBuilder();
    private int depth;

    private IrPrinter() {}

    public static String print(Stmt stmt) {
        IrPrinter printer = new IrPrinter();
        printer.printStmt(stmt);
        return printer.sb.toString();
    }

    public static String print(Expr expr) {
        return switch (expr.kind()) {
            case VAR -> ((Var) expr).name();
            case INT_IMM -> {
                IntImm imm = (IntImm) expr;
                yield imm.type().equals(DataType.INT32)
                        ? Long.toString(imm.value())
                        : imm.value() + "(" + imm.type() + ")";
            }
            case FLOAT_IMM -> {
                FloatImm imm = (FloatImm) expr;
                yield imm.value() + "f" + imm.type().bits();
            }
            case STRING_IMM -> "\"" + ((StringImm) expr).value() + "\"";
            case BINARY -> {
                Binary binary = (Binary) expr;
                yield switch (binary.op()) {
                    case MIN, MAX -> binary.op().symbol() + "(" + print(binary.a()) + ", " + print(binary.b()) + ")";
                    default -> "(" + print(binary.a()) + " " + binary.op().symbol() + " " + print(binary.b()) + ")";
                };
            }
            case LOAD -> {
                Load load = (Load) expr;
                yield load.bufferVar().name() + "[" + print(load.index()) + "]";
            }
            case CALL -> {
                Call call = (Call) expr;
                StringBuilder args = new StringBuilder();
                for (int i = 0; i < call.args().size(); i++) {
                    if (i > 0) args.append(", ");
                    args.append(print(call.args().get(i)));
                }
                yield call.name() + "(" + args + ")";
            }
        };
    }

    public static String printNode(AttrNode node) {
        if (node instanceof IterVar iterVar) {
            return "iter_var(" + iterVar.var().name() + ")";
        }
        return ((Var) node).name();
    }

    private void printStmt(Stmt stmt) {
        switch (stmt.kind()) {
            case PRODUCER_CONSUMER -> {
                ProducerConsumer pc = (ProducerConsumer) stmt;
                line("// " + (pc.isProducer() ? "produce " : "consume ") + pc.func() + " {");
                nested(pc.body());
                line("}");
            }
            case ATTR_STMT -> {
                AttrStmt attr = (AttrStmt) stmt;
                line("// attr [" + printNode(attr.node()) + "] " + attr.key() + " = " + print(attr.value()));
                printStmt(attr.body());
            }
            case ALLOCATE -> {
                Allocate alloc = (Allocate) stmt;
                StringBuilder extents = new StringBuilder();
                for (Expr extent : alloc.extents()) {
                    extents.append(" * ").append(print(extent));
                }
                line("allocate " + alloc.bufferVar().name() + "[" + alloc.type() + extents + "]");
                printStmt(alloc.body());
            }
            case FOR -> {
                For loop = (For) stmt;
                line("for (" + loop.loopVar().name() + ", " + print(loop.min()) + ", "
                        + print(loop.extent()) + ") {");
                nested(loop.body());
                line("}");
            }
            case IF_THEN_ELSE -> {
                IfThenElse branch = (IfThenElse) stmt;
                line("if " + print(branch.condition()) + " {");
                nested(branch.thenCase());
                if (branch.elseCase().isPresent()) {
                    line("} else {");
                    nested(branch.elseCase().get());
                }
                line("}");
            }
            case LET_STMT -> {
                LetStmt let = (LetStmt) stmt;
                line("let " + let.var().name() + " = " + print(let.value()));
                printStmt(let.body());
            }
            case STORE -> {
                Store store = (Store) stmt;
                line(store.bufferVar().name() + "[" + print(store.index()) + "] = " + print(store.value()));
            }
            case EVALUATE -> line(print(((Evaluate) stmt).value()));
            case BLOCK -> {
                for (Stmt child : ((Block) stmt).stmts()) {
                    printStmt(child);
                }
            }
        }
    }

    private void nested(Stmt body) {
        depth++;
        printStmt(body);
        depth--;
    }

    private void line(String text) {
        sb.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
