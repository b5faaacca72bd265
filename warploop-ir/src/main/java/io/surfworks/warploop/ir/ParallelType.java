package io.surfworks.warploop.ir;

/**
 * Parallel binding of a loop dimension.
 *
 * <p>Block and thread dimensions are realized implicitly by the hardware index
 * ({@code blockIdx.x}, {@code threadIdx.y}, ...) rather than by an emitted loop.
 */
public enum ParallelType {
    SERIAL("S", null),
    BIDX("blockIdx.x", "blockIdx.x"),
    BIDY("blockIdx.y", "blockIdx.y"),
    BIDZ("blockIdx.z", "blockIdx.z"),
    TIDX("threadIdx.x", "threadIdx.x"),
    TIDY("threadIdx.y", "threadIdx.y"),
    TIDZ("threadIdx.z", "threadIdx.z"),
    VECTORIZE("V", null),
    UNROLL("UR", null);

    private final String shortName;
    private final String indexName;

    ParallelType(String shortName, String indexName) {
        this.shortName = shortName;
        this.indexName = indexName;
    }

    public boolean isBlockDim() {
        return this == BIDX || this == BIDY || this == BIDZ;
    }

    public boolean isThreadDim() {
        return this == TIDX || this == TIDY || this == TIDZ;
    }

    /**
     * True for block and thread bindings, the ones backed by a hardware index.
     */
    public boolean isThread() {
        return isBlockDim() || isThreadDim();
    }

    public String shortName() {
        return shortName;
    }

    /**
     * Returns the name of the hardware index for this binding.
     *
     * @throws IllegalStateException if the binding has no hardware index
     */
    public String indexName() {
        if (indexName == null) {
            throw new IllegalStateException(name() + " has no parallel index");
        }
        return indexName;
    }
}
