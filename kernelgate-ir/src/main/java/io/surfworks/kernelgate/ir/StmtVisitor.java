package io.surfworks.kernelgate.ir;

import io.surfworks.kernelgate.ir.KernelIr.Allocate;
import io.surfworks.kernelgate.ir.KernelIr.AttrStmt;
import io.surfworks.kernelgate.ir.KernelIr.Binary;
import io.surfworks.kernelgate.ir.KernelIr.Block;
import io.surfworks.kernelgate.ir.KernelIr.Call;
import io.surfworks.kernelgate.ir.KernelIr.Evaluate;
import io.surfworks.kernelgate.ir.KernelIr.Expr;
import io.surfworks.kernelgate.ir.KernelIr.For;
import io.surfworks.kernelgate.ir.KernelIr.IfThenElse;
import io.surfworks.kernelgate.ir.KernelIr.IterVar;
import io.surfworks.kernelgate.ir.KernelIr.LetStmt;
import io.surfworks.kernelgate.ir.KernelIr.Load;
import io.surfworks.kernelgate.ir.KernelIr.ProducerConsumer;
import io.surfworks.kernelgate.ir.KernelIr.Stmt;
import io.surfworks.kernelgate.ir.KernelIr.Store;

/**
 * Read-only depth-first walk over a {@link Stmt} tree.
 *
 * <p>{@link #visit(Stmt)} dispatches on {@link Stmt#kind()} to one
 * {@code visitXxx} hook per statement kind. Every hook defaults to
 * {@link #visitChildren(Stmt)}, so a subclass overrides only the kinds it
 * cares about and decides for those whether and when to recurse by calling
 * the {@code super} hook or {@code visitChildren} itself.
 *
 * <p>Children are visited in lexical order: an attribute's value before its
 * body, an allocation's extents and condition before its body, a loop's
 * bounds before its body.
 */
public abstract class StmtVisitor {

    /**
     * Dispatches {@code stmt} to the hook for its kind.
     */
    public void visit(Stmt stmt) {
        switch (stmt.kind()) {
            case PRODUCER_CONSUMER -> visitProducerConsumer((ProducerConsumer) stmt);
            case ATTR_STMT -> visitAttrStmt((AttrStmt) stmt);
            case ALLOCATE -> visitAllocate((Allocate) stmt);
            case FOR -> visitFor((For) stmt);
            case IF_THEN_ELSE -> visitIfThenElse((IfThenElse) stmt);
            case LET_STMT -> visitLetStmt((LetStmt) stmt);
            case STORE -> visitStore((Store) stmt);
            case EVALUATE -> visitEvaluate((Evaluate) stmt);
            case BLOCK -> visitBlock((Block) stmt);
        }
    }

    /**
     * Visits an expression. Expressions contain no statements, so the default
     * only walks sub-expressions; override to inspect them.
     */
    public void visitExpr(Expr expr) {
        switch (expr.kind()) {
            case BINARY -> {
                Binary binary = (Binary) expr;
                visitExpr(binary.a());
                visitExpr(binary.b());
            }
            case LOAD -> {
                Load load = (Load) expr;
                visitExpr(load.bufferVar());
                visitExpr(load.index());
            }
            case CALL -> {
                for (Expr arg : ((Call) expr).args()) {
                    visitExpr(arg);
                }
            }
            case VAR, INT_IMM, FLOAT_IMM, STRING_IMM -> {
                // leaves
            }
        }
    }

    protected void visitProducerConsumer(ProducerConsumer op) {
        visitChildren(op);
    }

    protected void visitAttrStmt(AttrStmt op) {
        visitChildren(op);
    }

    protected void visitAllocate(Allocate op) {
        visitChildren(op);
    }

    protected void visitFor(For op) {
        visitChildren(op);
    }

    protected void visitIfThenElse(IfThenElse op) {
        visitChildren(op);
    }

    protected void visitLetStmt(LetStmt op) {
        visitChildren(op);
    }

    protected void visitStore(Store op) {
        visitChildren(op);
    }

    protected void visitEvaluate(Evaluate op) {
        visitChildren(op);
    }

    protected void visitBlock(Block op) {
        visitChildren(op);
    }

    /**
     * Visits the direct children of {@code stmt} without any per-kind
     * behaviour of its own.
     */
    protected final void visitChildren(Stmt stmt) {
        switch (stmt.kind()) {
            case PRODUCER_CONSUMER -> visit(((ProducerConsumer) stmt).body());
            case ATTR_STMT -> {
                AttrStmt attr = (AttrStmt) stmt;
                if (attr.node() instanceof IterVar iterVar) {
                    iterVar.domExtent().ifPresent(this::visitExpr);
                }
                visitExpr(attr.value());
                visit(attr.body());
            }
            case ALLOCATE -> {
                Allocate alloc = (Allocate) stmt;
                for (Expr extent : alloc.extents()) {
                    visitExpr(extent);
                }
                visitExpr(alloc.condition());
                visit(alloc.body());
            }
            case FOR -> {
                For loop = (For) stmt;
                visitExpr(loop.min());
                visitExpr(loop.extent());
                visit(loop.body());
            }
            case IF_THEN_ELSE -> {
                IfThenElse branch = (IfThenElse) stmt;
                visitExpr(branch.condition());
                visit(branch.thenCase());
                branch.elseCase().ifPresent(this::visit);
            }
            case LET_STMT -> {
                LetStmt let = (LetStmt) stmt;
                visitExpr(let.value());
                visit(let.body());
            }
            case STORE -> {
                Store store = (Store) stmt;
                visitExpr(store.value());
                visitExpr(store.index());
            }
            case EVALUATE -> visitExpr(((Evaluate) stmt).value());
            case BLOCK -> {
                for (Stmt child : ((Block) stmt).stmts()) {
                    visit(child);
                }
            }
        }
    }
}
