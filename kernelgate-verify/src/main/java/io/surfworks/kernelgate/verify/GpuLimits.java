package io.surfworks.kernelgate.verify;

import io.surfworks.kernelgate.ir.IrPrinter;
import io.surfworks.kernelgate.ir.KernelIr.Expr;
import io.surfworks.kernelgate.ir.KernelIr.IntImm;
import io.surfworks.kernelgate.ir.MalformedIrException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Per-block hardware limits checked by {@link GpuCodeVerifier}.
 *
 * <p>Limits are resolved from a constraint map keyed by the names below. A
 * missing key means "no limit" and resolves to {@link Long#MAX_VALUE}.
 *
 * <p>Example:
 * <pre>{@code
 * GpuLimits limits = GpuLimits.builder()
 *     .maxThreadPerBlock(1024)
 *     .maxSharedMemoryPerBlock(48 * 1024)
 *     .build();
 * }</pre>
 *
 * @param maxLocalMemoryPerBlock bytes of local memory summed over a block
 * @param maxSharedMemoryPerBlock bytes of shared memory per block
 * @param maxThreadPerBlock threads per block
 * @param maxThreadX threads along {@code threadIdx.x}
 * @param maxThreadY threads along {@code threadIdx.y}
 * @param maxThreadZ threads along {@code threadIdx.z}
 */
public record GpuLimits(
    long maxLocalMemoryPerBlock,
    long maxSharedMemoryPerBlock,
    long maxThreadPerBlock,
    long maxThreadX,
    long maxThreadY,
    long maxThreadZ
) {

    private static final Logger LOG = Logger.getLogger(GpuLimits.class.getName());

    public static final String MAX_LOCAL_MEMORY_PER_BLOCK = "max_local_memory_per_block";
    public static final String MAX_SHARED_MEMORY_PER_BLOCK = "max_shared_memory_per_block";
    public static final String MAX_THREAD_PER_BLOCK = "max_thread_per_block";
    public static final String MAX_THREAD_X = "max_thread_x";
    public static final String MAX_THREAD_Y = "max_thread_y";
    public static final String MAX_THREAD_Z = "max_thread_z";

    /**
     * The constraint names understood by {@link #fromConstraints(Map)}.
     */
    public static final Set<String> KEYS = Set.of(
        MAX_LOCAL_MEMORY_PER_BLOCK,
        MAX_SHARED_MEMORY_PER_BLOCK,
        MAX_THREAD_PER_BLOCK,
        MAX_THREAD_X,
        MAX_THREAD_Y,
        MAX_THREAD_Z
    );

    private static final GpuLimits UNCONSTRAINED = new GpuLimits(
        Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE,
        Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE);

    /**
     * Returns limits with every bound at {@link Long#MAX_VALUE}.
     */
    public static GpuLimits unconstrained() {
        return UNCONSTRAINED;
    }

    /**
     * Resolves limits from a constraint map.
     *
     * @param constraints limit name to constant integer expression
     * @return the resolved limits, {@link Long#MAX_VALUE} for absent names
     * @throws MalformedIrException if a present value is not an integer constant
     */
    public static GpuLimits fromConstraints(Map<String, ? extends Expr> constraints) {
        for (String key : constraints.keySet()) {
            if (key == null || !KEYS.contains(key)) {
                LOG.fine(() -> "Ignoring unknown GPU constraint '" + key + "'");
            }
        }
        return new GpuLimits(
            getInt(constraints, MAX_LOCAL_MEMORY_PER_BLOCK),
            getInt(constraints, MAX_SHARED_MEMORY_PER_BLOCK),
            getInt(constraints, MAX_THREAD_PER_BLOCK),
            getInt(constraints, MAX_THREAD_X),
            getInt(constraints, MAX_THREAD_Y),
            getInt(constraints, MAX_THREAD_Z)
        );
    }

    private static long getInt(Map<String, ? extends Expr> constraints, String key) {
        Expr value = constraints.get(key);
        if (value == null) {
            return Long.MAX_VALUE;
        }
        if (!(value instanceof IntImm imm)) {
            throw new MalformedIrException(
                "GPU constraint '" + key + "' must be an integer constant, got " + IrPrinter.print(value));
        }
        return imm.value();
    }

    /**
     * Converts back to a constraint map, omitting unconstrained bounds.
     */
    public Map<String, Expr> toConstraints() {
        Map<String, Expr> constraints = new LinkedHashMap<>();
        put(constraints, MAX_LOCAL_MEMORY_PER_BLOCK, maxLocalMemoryPerBlock);
        put(constraints, MAX_SHARED_MEMORY_PER_BLOCK, maxSharedMemoryPerBlock);
        put(constraints, MAX_THREAD_PER_BLOCK, maxThreadPerBlock);
        put(constraints, MAX_THREAD_X, maxThreadX);
        put(constraints, MAX_THREAD_Y, maxThreadY);
        put(constraints, MAX_THREAD_Z, maxThreadZ);
        return constraints;
    }

    private static void put(Map<String, Expr> constraints, String key, long value) {
        if (value != Long.MAX_VALUE) {
            constraints.put(key, IntImm.int64(value));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long maxLocalMemoryPerBlock = Long.MAX_VALUE;
        private long maxSharedMemoryPerBlock = Long.MAX_VALUE;
        private long maxThreadPerBlock = Long.MAX_VALUE;
        private long maxThreadX = Long.MAX_VALUE;
        private long maxThreadY = Long.MAX_VALUE;
        private long maxThreadZ = Long.MAX_VALUE;

        public Builder maxLocalMemoryPerBlock(long bytes) {
            this.maxLocalMemoryPerBlock = bytes;
            return this;
        }

        public Builder maxSharedMemoryPerBlock(long bytes) {
            this.maxSharedMemoryPerBlock = bytes;
            return this;
        }

        public Builder maxThreadPerBlock(long threads) {
            this.maxThreadPerBlock = threads;
            return this;
        }

        public Builder maxThreadX(long threads) {
            this.maxThreadX = threads;
            return this;
        }

        public Builder maxThreadY(long threads) {
            this.maxThreadY = threads;
            return this;
        }

        public Builder maxThreadZ(long threads) {
            this.maxThreadZ = threads;
            return this;
        }

        public GpuLimits build() {
            return new GpuLimits(
                maxLocalMemoryPerBlock,
                maxSharedMemoryPerBlock,
                maxThreadPerBlock,
                maxThreadX,
                maxThreadY,
                maxThreadZ
            );
        }
    }
}
