package io.surfworks.warploop.ir;

import java.util.Objects;

/**
 * One logical loop dimension of a tensor at some point in its transform history.
 *
 * <p>IterDomains have identity semantics: two domains with the same extent and type
 * are still different nodes. Each domain carries a stable integer handle, its index
 * in the owning {@link Fusion}'s arena, which analyses use as a table key.
 *
 * <p>Domains are created only by the fusion (tensor factories, operations and
 * scheduling transforms). The parallel binding is the one mutable attribute.
 */
public final class IterDomain {

    private final Fusion fusion;
    private final int handle;
    private final Extent extent;
    private final IterType iterType;
    private final boolean rfactorProduct;
    private ParallelType parallelType = ParallelType.SERIAL;
    private IterDomainTransform definition;

    IterDomain(Fusion fusion, int handle, Extent extent, IterType iterType, boolean rfactorProduct) {
        this.fusion = fusion;
        this.handle = handle;
        this.extent = Objects.requireNonNull(extent, "extent cannot be null");
        this.iterType = Objects.requireNonNull(iterType, "iterType cannot be null");
        this.rfactorProduct = rfactorProduct;
    }

    public Fusion fusion() {
        return fusion;
    }

    /**
     * Arena index of this domain in its fusion, dense from zero.
     */
    public int handle() {
        return handle;
    }

    public Extent extent() {
        return extent;
    }

    public IterType iterType() {
        return iterType;
    }

    public boolean isBroadcast() {
        return iterType == IterType.BROADCAST;
    }

    public boolean isReduction() {
        return iterType == IterType.REDUCTION;
    }

    public boolean isGather() {
        return iterType == IterType.GATHER;
    }

    /**
     * A reduction over a dimension of extent one.
     */
    public boolean isTrivialReduction() {
        return isReduction() && extent.isOne();
    }

    /**
     * True if this domain was introduced by a view-like reshape.
     */
    public boolean isRFactorProduct() {
        return rfactorProduct;
    }

    public ParallelType parallelType() {
        return parallelType;
    }

    public boolean isThread() {
        return parallelType.isThread();
    }

    public void parallelize(ParallelType type) {
        this.parallelType = Objects.requireNonNull(type, "type cannot be null");
    }

    /**
     * The transform that produced this domain, or null for root domains.
     */
    public IterDomainTransform definition() {
        return definition;
    }

    void setDefinition(IterDomainTransform definition) {
        if (this.definition != null) {
            throw new IllegalStateException(this + " already has a definition");
        }
        this.definition = definition;
    }

    @Override
    public String toString() {
        return iterType.prefix() + parallelType.shortName() + handle
                + "{" + extent + "}" + (rfactorProduct ? "rf" : "");
    }
}
