package io.surfworks.kernelgate.ir;

/**
 * Well-known {@link KernelIr.AttrStmt} keys.
 */
public final class AttrKeys {

    private AttrKeys() {}

    /**
     * Memory scope of a buffer variable; the value is a string such as
     * {@code "local"}, {@code "shared"} or {@code "global"}.
     */
    public static final String STORAGE_SCOPE = "storage_scope";

    /**
     * Launch extent of a thread axis; the node is an iteration variable and
     * the value its integer extent.
     */
    public static final String THREAD_EXTENT = "thread_extent";
}
