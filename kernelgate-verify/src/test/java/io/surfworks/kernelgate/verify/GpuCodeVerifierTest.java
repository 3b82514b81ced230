package io.surfworks.kernelgate.verify;

import io.surfworks.kernelgate.ir.AttrKeys;
import io.surfworks.kernelgate.ir.DataType;
import io.surfworks.kernelgate.ir.KernelIr.Allocate;
import io.surfworks.kernelgate.ir.KernelIr.AttrStmt;
import io.surfworks.kernelgate.ir.KernelIr.Block;
import io.surfworks.kernelgate.ir.KernelIr.Evaluate;
import io.surfworks.kernelgate.ir.KernelIr.For;
import io.surfworks.kernelgate.ir.KernelIr.ForType;
import io.surfworks.kernelgate.ir.KernelIr.IntImm;
import io.surfworks.kernelgate.ir.KernelIr.IterVar;
import io.surfworks.kernelgate.ir.KernelIr.ProducerConsumer;
import io.surfworks.kernelgate.ir.KernelIr.Stmt;
import io.surfworks.kernelgate.ir.KernelIr.StringImm;
import io.surfworks.kernelgate.ir.KernelIr.Var;
import io.surfworks.kernelgate.ir.MalformedIrException;
import io.surfworks.kernelgate.verify.Violation.Resource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("GpuCodeVerifier")
class GpuCodeVerifierTest {

    // ==================== Tree helpers ====================

    private static Stmt kernel(String name, Stmt body) {
        return new ProducerConsumer(name, true, body);
    }

    private static Stmt thread(String axis, long extent, Stmt body) {
        return new AttrStmt(IterVar.thread(axis), AttrKeys.THREAD_EXTENT, IntImm.int32(extent), body);
    }

    private static Stmt scope(Var buffer, String scope, Stmt body) {
        return new AttrStmt(buffer, AttrKeys.STORAGE_SCOPE, new StringImm(scope), body);
    }

    private static Stmt alloc(Var buffer, DataType type, long elements, Stmt body) {
        return new Allocate(buffer, type, List.of(IntImm.int32(elements)), body);
    }

    private static Stmt sharedBuffer(String name, long elements) {
        Var buf = new Var(name);
        return scope(buf, "shared", alloc(buf, DataType.FLOAT32, elements, Evaluate.NOP));
    }

    private static boolean verify(Stmt stmt, GpuLimits limits) {
        return new GpuCodeVerifier().verify(stmt, limits);
    }

    private static GpuLimits.Builder limits() {
        return GpuLimits.builder();
    }

    @Nested
    @DisplayName("Without kernel regions")
    class NoRegions {

        @Test
        @DisplayName("a tree without markers is valid")
        void treeWithoutMarkers() {
            Var buf = new Var("A");
            Stmt tree = Block.of(
                    scope(buf, "shared", alloc(buf, DataType.FLOAT32, 1 << 20, Evaluate.NOP)),
                    new For(new Var("i", DataType.INT32), IntImm.int32(0), IntImm.int32(10),
                            ForType.SERIAL, Evaluate.NOP));

            assertTrue(verify(tree, limits().maxSharedMemoryPerBlock(1).maxThreadPerBlock(1).build()));
        }

        @Test
        @DisplayName("per-axis extents are still checked outside markers")
        void axisCheckedOutsideMarkers() {
            GpuCodeVerifier verifier = new GpuCodeVerifier();
            Stmt tree = thread("threadIdx.x", 64, Evaluate.NOP);

            assertFalse(verifier.verify(tree, limits().maxThreadX(32).build()));
            assertEquals(GpuCodeVerifier.TOP_LEVEL, verifier.violations().get(0).region());
        }

        @Test
        @DisplayName("an extent after a kernel is labelled top-level")
        void extentAfterKernelIsTopLevel() {
            GpuCodeVerifier verifier = new GpuCodeVerifier();
            Stmt tree = Block.of(
                    kernel("k1", Evaluate.NOP),
                    thread("threadIdx.x", 64, Evaluate.NOP));

            assertFalse(verifier.verify(tree, limits().maxThreadX(32).build()));
            assertEquals(List.of(new Violation(GpuCodeVerifier.TOP_LEVEL, Resource.THREAD_X, 64, 32)),
                    verifier.violations());
        }
    }

    @Nested
    @DisplayName("Thread extents")
    class ThreadExtents {

        private Stmt twoDimKernel() {
            return kernel("compute",
                    thread("threadIdx.x", 32,
                            thread("threadIdx.y", 8, Evaluate.NOP)));
        }

        @Test
        @DisplayName("32 x 8 threads fit a 256 thread block")
        void productWithinLimit() {
            assertTrue(verify(twoDimKernel(),
                    limits().maxThreadPerBlock(256).maxThreadX(32).maxThreadY(16).build()));
        }

        @Test
        @DisplayName("32 x 8 threads exceed a 255 thread block")
        void productOverLimit() {
            assertFalse(verify(twoDimKernel(),
                    limits().maxThreadPerBlock(255).maxThreadX(32).maxThreadY(16).build()));
        }

        @ParameterizedTest(name = "{0} extent {1} against limit {2}")
        @CsvSource({
            "threadIdx.x, 33, 32, false",
            "threadIdx.x, 32, 32, true",
            "threadIdx.y, 17, 16, false",
            "threadIdx.z, 65, 64, false",
            "threadIdx.z, 64, 64, true"
        })
        void perAxisLimit(String axis, long extent, long limit, boolean expected) {
            GpuLimits bounds = limits().maxThreadX(limit).maxThreadY(limit).maxThreadZ(limit).build();
            assertEquals(expected, verify(kernel("k", thread(axis, extent, Evaluate.NOP)), bounds));
        }

        @Test
        @DisplayName("a repeated axis is counted once")
        void duplicateAxisCountedOnce() {
            Stmt tree = kernel("k",
                    thread("threadIdx.x", 16,
                            thread("threadIdx.x", 16, Evaluate.NOP)));

            assertTrue(verify(tree, limits().maxThreadX(16).maxThreadPerBlock(16).build()));
        }

        @Test
        @DisplayName("a later declaration of a counted axis is ignored")
        void laterDeclarationIgnored() {
            Stmt tree = kernel("k", Block.of(
                    thread("threadIdx.x", 16, Evaluate.NOP),
                    thread("threadIdx.x", 512, Evaluate.NOP)));

            assertTrue(verify(tree, limits().maxThreadX(16).maxThreadPerBlock(16).build()));
        }

        @Test
        @DisplayName("block indices and virtual threads are not counted")
        void nonThreadAxesIgnored() {
            Stmt tree = kernel("k",
                    thread("blockIdx.x", 4096,
                            thread("vthread", 8,
                                    thread("threadIdx.x", 128, Evaluate.NOP))));

            assertTrue(verify(tree, limits().maxThreadPerBlock(128).maxThreadX(128).build()));
        }

        @Test
        @DisplayName("a thread extent on a plain variable is malformed")
        void plainVarTarget() {
            Stmt tree = kernel("k", new AttrStmt(new Var("threadIdx.x"), AttrKeys.THREAD_EXTENT,
                    IntImm.int32(32), Evaluate.NOP));

            assertThrows(MalformedIrException.class, () -> verify(tree, GpuLimits.unconstrained()));
        }

        @Test
        @DisplayName("a symbolic thread extent is malformed")
        void symbolicExtent() {
            Stmt tree = kernel("k", new AttrStmt(IterVar.thread("threadIdx.x"), AttrKeys.THREAD_EXTENT,
                    new Var("n", DataType.INT32), Evaluate.NOP));

            MalformedIrException e = assertThrows(MalformedIrException.class,
                    () -> verify(tree, GpuLimits.unconstrained()));
            assertTrue(e.getMessage().contains("threadIdx.x"), e.getMessage());
        }
    }

    @Nested
    @DisplayName("Memory accounting")
    class MemoryAccounting {

        @Test
        @DisplayName("4096 shared bytes exceed a 4095 byte limit")
        void sharedOverLimit() {
            Stmt tree = kernel("k", sharedBuffer("A.shared", 1024));
            assertFalse(verify(tree, limits().maxSharedMemoryPerBlock(4095).build()));
        }

        @Test
        @DisplayName("4096 shared bytes fit a 4096 byte limit")
        void sharedAtLimit() {
            Stmt tree = kernel("k", sharedBuffer("A.shared", 1024));
            assertTrue(verify(tree, limits().maxSharedMemoryPerBlock(4096).build()));
        }

        @Test
        @DisplayName("shared buffers in one region are summed")
        void sharedSummed() {
            Stmt tree = kernel("k", Block.of(sharedBuffer("A.shared", 512), sharedBuffer("B.shared", 512)));

            assertFalse(verify(tree, limits().maxSharedMemoryPerBlock(4095).build()));
            assertTrue(verify(tree, limits().maxSharedMemoryPerBlock(4096).build()));
        }

        @Test
        @DisplayName("local buffers count against the local limit only")
        void localSeparateFromShared() {
            Var buf = new Var("C.local");
            Stmt tree = kernel("k",
                    scope(buf, "local", alloc(buf, DataType.FLOAT64, 16, Evaluate.NOP)));

            assertTrue(verify(tree, limits().maxSharedMemoryPerBlock(0).maxLocalMemoryPerBlock(128).build()));
            assertFalse(verify(tree, limits().maxLocalMemoryPerBlock(127).build()));
        }

        @Test
        @DisplayName("unclassified allocations are untracked")
        void unclassifiedUntracked() {
            Stmt tree = kernel("k", alloc(new Var("A"), DataType.FLOAT32, 1 << 20, Evaluate.NOP));
            GpuLimits tiny = limits().maxSharedMemoryPerBlock(1).maxLocalMemoryPerBlock(1).build();

            assertTrue(verify(tree, tiny));
        }

        @Test
        @DisplayName("global and other scopes are untracked")
        void otherScopesIgnored() {
            Var global = new Var("A");
            Var warp = new Var("B");
            Stmt tree = kernel("k", Block.of(
                    scope(global, "global", alloc(global, DataType.FLOAT32, 1024, Evaluate.NOP)),
                    scope(warp, "warp", alloc(warp, DataType.FLOAT32, 1024, Evaluate.NOP))));

            assertTrue(verify(tree, limits().maxSharedMemoryPerBlock(1).maxLocalMemoryPerBlock(1).build()));
        }

        @Test
        @DisplayName("classification is tied to the variable, not its name")
        void classificationByIdentity() {
            Var scoped = new Var("A.shared");
            Var sameName = new Var("A.shared");
            Stmt tree = kernel("k",
                    scope(scoped, "shared", alloc(sameName, DataType.FLOAT32, 1024, Evaluate.NOP)));

            assertTrue(verify(tree, limits().maxSharedMemoryPerBlock(1).build()));
        }

        @Test
        @DisplayName("a scope visited after the allocation is not applied retroactively")
        void lateClassificationIgnored() {
            Var buf = new Var("A.shared");
            Stmt tree = kernel("k", Block.of(
                    alloc(buf, DataType.FLOAT32, 1024, Evaluate.NOP),
                    scope(buf, "shared", Evaluate.NOP)));

            assertTrue(verify(tree, limits().maxSharedMemoryPerBlock(1).build()));
        }

        @Test
        @DisplayName("a symbolic allocation contributes nothing")
        void symbolicAllocation() {
            Var buf = new Var("A.shared");
            Stmt tree = kernel("k", scope(buf, "shared",
                    new Allocate(buf, DataType.FLOAT32, List.of(new Var("n", DataType.INT32)), Evaluate.NOP)));

            assertTrue(verify(tree, limits().maxSharedMemoryPerBlock(1).build()));
        }

        @Test
        @DisplayName("a storage scope that is not a string is malformed")
        void nonStringScope() {
            Var buf = new Var("A");
            Stmt tree = kernel("k", new AttrStmt(buf, AttrKeys.STORAGE_SCOPE, IntImm.int32(1),
                    alloc(buf, DataType.FLOAT32, 4, Evaluate.NOP)));

            assertThrows(MalformedIrException.class, () -> verify(tree, GpuLimits.unconstrained()));
        }
    }

    @Nested
    @DisplayName("Kernel regions")
    class KernelRegions {

        @Test
        @DisplayName("one failing sibling fails the whole tree")
        void siblingFailureIsGlobal() {
            Stmt violating = kernel("big", thread("threadIdx.x", 2048, Evaluate.NOP));
            Stmt compliant = kernel("small", thread("threadIdx.x", 64, Evaluate.NOP));
            GpuLimits bounds = limits().maxThreadPerBlock(1024).maxThreadX(1024).build();

            GpuCodeVerifier verifier = new GpuCodeVerifier();
            assertFalse(verifier.verify(Block.of(violating, compliant), bounds));
            assertTrue(verify(compliant, bounds));
            assertTrue(verifier.violations().stream().allMatch(v -> v.region().equals("big")));
        }

        @Test
        @DisplayName("thread counts reset between siblings")
        void threadsResetBetweenSiblings() {
            Stmt first = kernel("a", thread("threadIdx.x", 32, thread("threadIdx.y", 32, Evaluate.NOP)));
            Stmt second = kernel("b", thread("threadIdx.x", 32, thread("threadIdx.y", 32, Evaluate.NOP)));

            assertTrue(verify(Block.of(first, second), limits().maxThreadPerBlock(1024).build()));
        }

        @Test
        @DisplayName("shared memory resets between siblings")
        void memoryResetBetweenSiblings() {
            Stmt tree = Block.of(
                    kernel("a", sharedBuffer("A.shared", 1024)),
                    kernel("b", sharedBuffer("B.shared", 1024)));

            assertTrue(verify(tree, limits().maxSharedMemoryPerBlock(4096).build()));
        }

        @Test
        @DisplayName("classifications do not leak into the next region")
        void classificationDoesNotLeak() {
            Var buf = new Var("A.shared");
            Stmt tree = Block.of(
                    kernel("a", scope(buf, "shared", Evaluate.NOP)),
                    kernel("b", alloc(buf, DataType.FLOAT32, 1024, Evaluate.NOP)));

            assertTrue(verify(tree, limits().maxSharedMemoryPerBlock(1).build()));
        }

        @Test
        @DisplayName("a nested producer does not reset the outer region")
        void nestedProducerAccumulates() {
            Stmt tree = kernel("outer", Block.of(
                    sharedBuffer("A.shared", 1024),
                    kernel("inner", sharedBuffer("B.shared", 1024))));

            assertFalse(verify(tree, limits().maxSharedMemoryPerBlock(4096).build()));
            assertTrue(verify(tree, limits().maxSharedMemoryPerBlock(8192).build()));
        }

        @Test
        @DisplayName("an outer consumer marker is checked at depth zero")
        void consumerMarkerChecked() {
            Stmt tree = new ProducerConsumer("k", false, sharedBuffer("A.shared", 1024));

            assertFalse(verify(tree, limits().maxSharedMemoryPerBlock(4095).build()));
        }

        @Test
        @DisplayName("an outer consumer keeps its name after an inner consumer closes")
        void nestedConsumerRestoresRegion() {
            Stmt tree = new ProducerConsumer("outer", false, Block.of(
                    new ProducerConsumer("inner", false, Evaluate.NOP),
                    sharedBuffer("A.shared", 1024)));

            GpuCodeVerifier verifier = new GpuCodeVerifier();
            assertFalse(verifier.verify(tree, limits().maxSharedMemoryPerBlock(4095).build()));
            assertEquals(List.of(new Violation("outer", Resource.SHARED_MEMORY, 4096, 4095)), verifier.violations());
        }

        @Test
        @DisplayName("a thread axis in a nested region is counted once for the kernel")
        void nestedAxisCountedOnce() {
            Stmt tree = kernel("outer", thread("threadIdx.x", 32,
                    kernel("inner", thread("threadIdx.x", 32, thread("threadIdx.y", 4, Evaluate.NOP)))));

            assertTrue(verify(tree, limits().maxThreadPerBlock(128).build()));
        }
    }

    @Nested
    @DisplayName("Limits and lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("missing limits behave as the largest bound")
        void missingLimitIsMaximal() {
            Stmt tree = kernel("k", thread("threadIdx.x", 1 << 20, sharedBuffer("A.shared", 1L << 30)));

            assertTrue(verify(tree, GpuLimits.unconstrained()));
            assertEquals(verify(tree, GpuLimits.unconstrained()),
                    verify(tree, limits().maxThreadX(Long.MAX_VALUE).build()));
        }

        @Test
        @DisplayName("negative extents compare as huge unsigned values")
        void negativeExtentIsHuge() {
            Stmt tree = kernel("k", thread("threadIdx.x", -1, Evaluate.NOP));

            assertFalse(verify(tree, limits().maxThreadX(1024).build()));
        }

        @Test
        @DisplayName("a verifier cannot be reused")
        void singleUse() {
            GpuCodeVerifier verifier = new GpuCodeVerifier();
            verifier.verify(Evaluate.NOP, GpuLimits.unconstrained());

            assertThrows(IllegalStateException.class,
                    () -> verifier.verify(Evaluate.NOP, GpuLimits.unconstrained()));
        }

        @Test
        @DisplayName("violations name the region and resource")
        void violationsRecorded() {
            Stmt tree = kernel("matmul", thread("threadIdx.x", 64,
                    thread("threadIdx.y", 32, sharedBuffer("A.shared", 2048))));
            GpuLimits bounds = limits().maxThreadPerBlock(1024).maxThreadY(16).maxSharedMemoryPerBlock(4096).build();

            GpuCodeVerifier verifier = new GpuCodeVerifier();
            assertFalse(verifier.verify(tree, bounds));

            assertEquals(List.of(
                    new Violation("matmul", Resource.THREAD_Y, 32, 16),
                    new Violation("matmul", Resource.THREADS_PER_BLOCK, 2048, 1024),
                    new Violation("matmul", Resource.SHARED_MEMORY, 8192, 4096)), verifier.violations());
        }
    }
}
