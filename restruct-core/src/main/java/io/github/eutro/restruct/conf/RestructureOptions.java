package io.github.eutro.restruct.conf;

import java.nio.file.Paths;

/**
 * Options for restructuring, created with a {@link Builder}.
 */
public final class RestructureOptions {
    /**
     * If set, the default trace sink writes dot dumps under this directory.
     */
    public static final String DUMP_DIR_ENV = "RESTRUCT_DUMP_DIR";

    public static final RestructureOptions DEFAULT = builder().build();

    private final int untangleFactor;
    private final boolean untangle;
    private final TraceSink traceSink;

    private RestructureOptions(Builder builder) {
        untangleFactor = builder.untangleFactor;
        untangle = builder.untangle;
        traceSink = builder.traceSink;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the factor by which one side must outweigh the other for untangling to duplicate code.
     *
     * @return The factor.
     */
    public int getUntangleFactor() {
        return untangleFactor;
    }

    /**
     * Check whether {@code a} is greater than {@code b} for the purposes of untangling.
     *
     * @param a The first weight.
     * @param b The second weight.
     * @return Whether {@code a > factor * b}.
     */
    public boolean isGreater(long a, long b) {
        return a > (long) untangleFactor * b;
    }

    public boolean isUntangleEnabled() {
        return untangle;
    }

    public TraceSink getTraceSink() {
        return traceSink;
    }

    /**
     * A builder for {@link RestructureOptions}.
     */
    public static class Builder {
        private int untangleFactor = 1;
        private boolean untangle = true;
        private TraceSink traceSink = defaultTraceSink();

        private static TraceSink defaultTraceSink() {
            String dir = System.getenv(DUMP_DIR_ENV);
            return dir == null || dir.isEmpty() ? TraceSink.NONE : TraceSink.toDirectory(Paths.get(dir));
        }

        /**
         * Set the untangle factor, at least 1.
         *
         * @param untangleFactor The factor.
         * @return This builder, for convenience.
         * @see #getUntangleFactor()
         */
        public Builder setUntangleFactor(int untangleFactor) {
            if (untangleFactor < 1) {
                throw new IllegalArgumentException("untangle factor must be at least 1, got " + untangleFactor);
            }
            this.untangleFactor = untangleFactor;
            return this;
        }

        /**
         * Set whether inflating runs untangling first.
         *
         * @param untangle Whether to untangle.
         * @return This builder, for convenience.
         */
        public Builder setUntangle(boolean untangle) {
            this.untangle = untangle;
            return this;
        }

        public Builder setTraceSink(TraceSink traceSink) {
            this.traceSink = traceSink;
            return this;
        }

        public RestructureOptions build() {
            return new RestructureOptions(this);
        }
    }
}
