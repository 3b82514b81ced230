package io.surfworks.kernelgate.verify;

import java.util.List;

/**
 * Thrown by {@link GpuCodeVerification#check} when a tree exceeds the
 * hardware limits of its target.
 */
public class GpuResourceLimitException extends RuntimeException {

    private final List<Violation> violations;

    public GpuResourceLimitException(List<Violation> violations) {
        super(formatMessage(violations));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> getViolations() {
        return violations;
    }

    private static String formatMessage(List<Violation> violations) {
        StringBuilder sb = new StringBuilder("GPU resource limits exceeded:\n");
        for (Violation violation : violations) {
            sb.append("  - ").append(violation).append("\n");
        }
        return sb.toString();
    }
}
