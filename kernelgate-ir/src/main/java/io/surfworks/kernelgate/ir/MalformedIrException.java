package io.surfworks.kernelgate.ir;

/**
 * Thrown when a tree or its configuration does not have the shape a pass
 * requires, such as a thread extent that is not a constant integer.
 *
 * <p>This is an internal error in the producer of the IR, not a recoverable
 * verification failure.
 */
public class MalformedIrException extends RuntimeException {

    public MalformedIrException(String message) {
        super(message);
    }
}
