package io.surfworks.kernelgate.ir;

/**
 * Tag identifying the variant of a {@link KernelIr.Expr}.
 */
public enum ExprKind {
    VAR,
    INT_IMM,
    FLOAT_IMM,
    STRING_IMM,
    BINARY,
    LOAD,
    CALL
}
