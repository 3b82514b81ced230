package io.surfworks.kernelgate.ir;

/**
 * Tag identifying the variant of a {@link KernelIr.Stmt}.
 */
public enum StmtKind {
    PRODUCER_CONSUMER,
    ATTR_STMT,
    ALLOCATE,
    FOR,
    IF_THEN_ELSE,
    LET_STMT,
    STORE,
    EVALUATE,
    BLOCK
}
