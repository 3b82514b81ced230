package io.surfworks.kernelgate.verify;

import java.util.List;

/**
 * Verdict of a verification together with the bounds that failed.
 *
 * @param valid true if every kernel region fits its limits
 * @param violations failed checks in traversal order, empty when valid
 */
public record VerificationResult(boolean valid, List<Violation> violations) {

    public VerificationResult {
        violations = List.copyOf(violations);
    }
}
