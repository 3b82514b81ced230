package io.surfworks.kernelgate.verify;

import io.surfworks.kernelgate.ir.AttrKeys;
import io.surfworks.kernelgate.ir.IrPrinter;
import io.surfworks.kernelgate.ir.KernelIr.Allocate;
import io.surfworks.kernelgate.ir.KernelIr.AttrStmt;
import io.surfworks.kernelgate.ir.KernelIr.IntImm;
import io.surfworks.kernelgate.ir.KernelIr.IterVar;
import io.surfworks.kernelgate.ir.KernelIr.ProducerConsumer;
import io.surfworks.kernelgate.ir.KernelIr.Stmt;
import io.surfworks.kernelgate.ir.KernelIr.StringImm;
import io.surfworks.kernelgate.ir.KernelIr.Var;
import io.surfworks.kernelgate.ir.MalformedIrException;
import io.surfworks.kernelgate.ir.StmtVisitor;
import io.surfworks.kernelgate.verify.Violation.Resource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Checks that every kernel in a scheduled tree fits the per-block thread and
 * on-chip memory limits of a GPU.
 *
 * <p>A kernel region is the subtree under a {@link ProducerConsumer} reached
 * at nest depth 0. Statistics are reset on entering such a region and checked
 * when leaving it, so sibling kernels each get the full budget:
 * <ul>
 *   <li>the product of the {@code threadIdx.x/y/z} extents, each axis counted
 *       once per region, against the threads-per-block limit</li>
 *   <li>each axis extent against its own limit</li>
 *   <li>bytes of buffers scoped {@code local} and {@code shared}, summed over
 *       the region, against the memory limits</li>
 * </ul>
 *
 * <p>Ordering precondition: a buffer is attributed to a scope only if its
 * {@code storage_scope} attribute has been visited before the buffer's
 * allocation is accounted. Attributes take effect on entry and allocations
 * are accounted after their body, so an attribute enclosing the allocation
 * always qualifies; a scope attached later is never applied retroactively.
 *
 * <p>All counters are unsigned 64-bit quantities. An instance verifies one
 * tree and is then spent.
 */
public final class GpuCodeVerifier extends StmtVisitor {

    private static final Logger LOG = Logger.getLogger(GpuCodeVerifier.class.getName());

    private static final String THREAD_X = "threadIdx.x";
    private static final String THREAD_Y = "threadIdx.y";
    private static final String THREAD_Z = "threadIdx.z";

    /** Region label for thread extents declared outside any kernel marker. */
    static final String TOP_LEVEL = "<top-level>";

    private GpuLimits limits;
    private boolean used;

    private int nestLevel;
    private String region = TOP_LEVEL;

    private final Set<Var> visitedLocalBuffers = new HashSet<>();
    private final Set<Var> visitedSharedBuffers = new HashSet<>();
    private final Set<String> visitedThreads = new HashSet<>();

    private long localMemoryPerBlock;
    private long sharedMemoryPerBlock;
    private long threadPerBlock;

    private boolean valid = true;
    private final List<Violation> violations = new ArrayList<>();

    public GpuCodeVerifier() {}

    /**
     * Verifies {@code stmt} against {@code limits}.
     *
     * @return true if every kernel region satisfies every bound
     * @throws MalformedIrException if a thread extent or storage scope is malformed
     * @throws IllegalStateException if this verifier has already been used
     */
    public boolean verify(Stmt stmt, GpuLimits limits) {
        if (used) {
            throw new IllegalStateException("GpuCodeVerifier instances verify a single tree");
        }
        used = true;
        this.limits = limits;

        reset();
        visit(stmt);
        return valid;
    }

    /**
     * Returns the bounds that failed during {@link #verify}, in traversal order.
     */
    public List<Violation> violations() {
        return List.copyOf(violations);
    }

    @Override
    protected void visitProducerConsumer(ProducerConsumer op) {
        String enclosing = region;
        if (nestLevel == 0) {
            // enter a new kernel
            reset();
            region = op.func();
        }

        if (op.isProducer()) {
            nestLevel++;
            super.visitProducerConsumer(op);
            nestLevel--;
        } else {
            super.visitProducerConsumer(op);
        }

        if (nestLevel == 0) {
            // leave the kernel
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine(String.format("Kernel %s: %s threads/block, %s local bytes, %s shared bytes",
                    region,
                    Long.toUnsignedString(threadPerBlock),
                    Long.toUnsignedString(localMemoryPerBlock),
                    Long.toUnsignedString(sharedMemoryPerBlock)));
            }
            check(Resource.THREADS_PER_BLOCK, threadPerBlock, limits.maxThreadPerBlock());
            check(Resource.LOCAL_MEMORY, localMemoryPerBlock, limits.maxLocalMemoryPerBlock());
            check(Resource.SHARED_MEMORY, sharedMemoryPerBlock, limits.maxSharedMemoryPerBlock());
            region = enclosing;
        }
    }

    @Override
    protected void visitAttrStmt(AttrStmt op) {
        if (AttrKeys.STORAGE_SCOPE.equals(op.key())) {
            recordStorageScope(op);
        } else if (AttrKeys.THREAD_EXTENT.equals(op.key())) {
            recordThreadExtent(op);
        }
        super.visitAttrStmt(op);
    }

    @Override
    protected void visitAllocate(Allocate op) {
        super.visitAllocate(op);

        long bytes = op.constantAllocationSize() * op.type().bytes();
        if (visitedLocalBuffers.contains(op.bufferVar())) {
            localMemoryPerBlock += bytes;
        } else if (visitedSharedBuffers.contains(op.bufferVar())) {
            sharedMemoryPerBlock += bytes;
        }
    }

    private void recordStorageScope(AttrStmt op) {
        if (!(op.value() instanceof StringImm scope)) {
            throw new MalformedIrException(
                "storage_scope value must be a string, got " + IrPrinter.print(op.value()));
        }
        if (!(op.node() instanceof Var buffer)) {
            return;
        }
        if ("local".equals(scope.value())) {
            visitedLocalBuffers.add(buffer);
        } else if ("shared".equals(scope.value())) {
            visitedSharedBuffers.add(buffer);
        }
    }

    private void recordThreadExtent(AttrStmt op) {
        if (!(op.node() instanceof IterVar iterVar)) {
            throw new MalformedIrException(
                "thread_extent must annotate an iteration variable, got " + IrPrinter.printNode(op.node()));
        }
        if (!(op.value() instanceof IntImm extent)) {
            throw new MalformedIrException(
                "thread_extent of " + iterVar.var().name() + " must be an integer constant, got "
                    + IrPrinter.print(op.value()));
        }

        String name = iterVar.var().name();
        if (!isThreadAxis(name) || !visitedThreads.add(name)) {
            return;
        }
        long length = extent.value();
        threadPerBlock *= length;

        switch (name) {
            case THREAD_X -> check(Resource.THREAD_X, length, limits.maxThreadX());
            case THREAD_Y -> check(Resource.THREAD_Y, length, limits.maxThreadY());
            default -> check(Resource.THREAD_Z, length, limits.maxThreadZ());
        }
    }

    private static boolean isThreadAxis(String name) {
        return THREAD_X.equals(name) || THREAD_Y.equals(name) || THREAD_Z.equals(name);
    }

    private void check(Resource resource, long actual, long limit) {
        if (Long.compareUnsigned(actual, limit) <= 0) {
            return;
        }
        valid = false;
        Violation violation = new Violation(region, resource, actual, limit);
        violations.add(violation);
        LOG.fine(() -> "GPU limit violated in " + violation);
    }

    private void reset() {
        visitedLocalBuffers.clear();
        visitedSharedBuffers.clear();
        localMemoryPerBlock = 0;
        sharedMemoryPerBlock = 0;

        visitedThreads.clear();
        threadPerBlock = 1;
    }
}
