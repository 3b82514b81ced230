package io.surfworks.kernelgate.ir;

import java.util.Objects;

/**
 * Element type of a buffer or expression: a type code, a bit width and a
 * vector lane count.
 *
 * @param code type class
 * @param bits bits per lane
 * @param lanes number of vector lanes, 1 for scalars
 */
public record DataType(Code code, int bits, int lanes) {

    public enum Code {
        INT("int"), UINT("uint"), FLOAT("float"), HANDLE("handle");

        private final String prefix;

        Code(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    public static final DataType BOOL = new DataType(Code.UINT, 1, 1);
    public static final DataType INT8 = new DataType(Code.INT, 8, 1);
    public static final DataType INT32 = new DataType(Code.INT, 32, 1);
    public static final DataType INT64 = new DataType(Code.INT, 64, 1);
    public static final DataType FLOAT16 = new DataType(Code.FLOAT, 16, 1);
    public static final DataType FLOAT32 = new DataType(Code.FLOAT, 32, 1);
    public static final DataType FLOAT64 = new DataType(Code.FLOAT, 64, 1);
    public static final DataType HANDLE = new DataType(Code.HANDLE, 64, 1);

    public DataType {
        Objects.requireNonNull(code, "code");
        if (bits <= 0) {
            throw new IllegalArgumentException("bits must be positive, got " + bits);
        }
        if (lanes <= 0) {
            throw new IllegalArgumentException("lanes must be positive, got " + lanes);
        }
    }

    /**
     * Returns the vector form of this type with {@code lanes} lanes.
     */
    public DataType withLanes(int lanes) {
        return new DataType(code, bits, lanes);
    }

    /**
     * Storage size in bytes. Sub-byte lanes round up to a whole byte each.
     */
    public int bytes() {
        return ((bits + 7) / 8) * lanes;
    }

    @Override
    public String toString() {
        if (this.equals(BOOL)) {
            return "bool";
        }
        String base = code.prefix() + bits;
        return lanes == 1 ? base : base + "x" + lanes;
    }
}
