package io.surfworks.kernelgate.verify;

import io.surfworks.kernelgate.ir.KernelIr.Expr;
import io.surfworks.kernelgate.ir.KernelIr.Stmt;

import java.util.Map;

/**
 * Entry points for GPU resource verification.
 *
 * <p>Example usage:
 * <pre>{@code
 * // Accept or reject a lowered kernel for an NVIDIA target
 * boolean fits = GpuCodeVerification.verifyGpuCode(stmt, GpuConstraints.preset("nvidia"));
 *
 * // Fail compilation with a readable list of exceeded bounds
 * GpuCodeVerification.check(stmt, limits);
 * }</pre>
 */
public final class GpuCodeVerification {

    private GpuCodeVerification() {}

    /**
     * Resolves {@code constraints} and verifies {@code stmt} against them.
     * Missing constraints are unconstrained.
     */
    public static boolean verifyGpuCode(Stmt stmt, Map<String, ? extends Expr> constraints) {
        return verifyGpuCode(stmt, GpuLimits.fromConstraints(constraints));
    }

    public static boolean verifyGpuCode(Stmt stmt, GpuLimits limits) {
        return new GpuCodeVerifier().verify(stmt, limits);
    }

    /**
     * Verifies {@code stmt} and returns the verdict with every failed bound.
     */
    public static VerificationResult analyze(Stmt stmt, GpuLimits limits) {
        GpuCodeVerifier verifier = new GpuCodeVerifier();
        boolean valid = verifier.verify(stmt, limits);
        return new VerificationResult(valid, verifier.violations());
    }

    /**
     * Verifies {@code stmt} and throws if any bound is exceeded.
     *
     * @throws GpuResourceLimitException listing every violation
     */
    public static void check(Stmt stmt, GpuLimits limits) {
        VerificationResult result = analyze(stmt, limits);
        if (!result.valid()) {
            throw new GpuResourceLimitException(result.violations());
        }
    }
}
