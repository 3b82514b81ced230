package io.surfworks.kernelgate.verify;

import java.util.Objects;

/**
 * A single bound exceeded inside one kernel region.
 *
 * @param region name of the outermost producer of the kernel region
 * @param resource the bounded resource
 * @param actual observed value, compared unsigned
 * @param limit configured bound, compared unsigned
 */
public record Violation(String region, Resource resource, long actual, long limit) {

    public enum Resource {
        THREADS_PER_BLOCK("threads per block", "threads"),
        THREAD_X("threadIdx.x extent", "threads"),
        THREAD_Y("threadIdx.y extent", "threads"),
        THREAD_Z("threadIdx.z extent", "threads"),
        LOCAL_MEMORY("local memory per block", "bytes"),
        SHARED_MEMORY("shared memory per block", "bytes");

        private final String description;
        private final String unit;

        Resource(String description, String unit) {
            this.description = description;
            this.unit = unit;
        }

        public String description() {
            return description;
        }

        public String unit() {
            return unit;
        }
    }

    public Violation {
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(resource, "resource");
    }

    @Override
    public String toString() {
        return String.format("%s: %s %s %s exceeds limit %s",
            region, resource.description(),
            Long.toUnsignedString(actual), resource.unit(), Long.toUnsignedString(limit));
    }
}
