package io.surfworks.warploop.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A tensor program: the arena owning every {@link IterDomain}, {@link TensorView}
 * and {@link TensorOp}.
 *
 * <p>Operations are kept in creation order, which is a topological order because an
 * operation can only consume tensors that already exist. IterDomain handles are
 * dense indices into the arena, so analyses can key flat tables on them.
 *
 * <p>Example:
 * <pre>{@code
 * Fusion fusion = new Fusion();
 * TensorView tv0 = fusion.makeSymbolicTensor(2);
 * TensorView tv1 = TensorOps.unary("exp", tv0);
 * TensorView tv2 = TensorOps.sum(tv1, 1);
 *
 * for (TensorOp op : fusion.operations()) {
 *     System.out.println(op.opName() + ": " + op.inputs() + " -> " + op.outputs());
 * }
 * }</pre>
 */
public final class Fusion {

    private final List<IterDomain> iterDomains = new ArrayList<>();
    private final List<TensorView> tensorViews = new ArrayList<>();
    private final List<TensorOp> operations = new ArrayList<>();
    private int nextTransformOrdinal;
    private int nextSymbol;

    public Fusion() {}

    // ==================== Tensor factories ====================

    /**
     * Creates a tensor whose root dimensions all have symbolic extents.
     */
    public TensorView makeSymbolicTensor(int ndims) {
        if (ndims < 0) {
            throw new IllegalArgumentException("ndims must be non-negative: " + ndims);
        }
        List<IterDomain> root = new ArrayList<>(ndims);
        for (int i = 0; i < ndims; i++) {
            root.add(newIterDomain(Extent.symbol("i" + nextSymbol++), IterType.ITERATION, false));
        }
        return newTensorView(new TensorDomain(root));
    }

    /**
     * Creates a tensor with constant extents. A size of one yields a broadcast dimension.
     */
    public TensorView makeConcreteTensor(long... sizes) {
        List<IterDomain> root = new ArrayList<>(sizes.length);
        for (long size : sizes) {
            IterType type = size == 1 ? IterType.BROADCAST : IterType.ITERATION;
            root.add(newIterDomain(Extent.of(size), type, false));
        }
        return newTensorView(new TensorDomain(root));
    }

    /**
     * Registers an operation and makes it the definition of each of its outputs.
     *
     * @throws IllegalArgumentException if an input or output belongs to another fusion
     * @throws IllegalStateException if an output already has a definition
     */
    public <T extends TensorOp> T addOperation(T op) {
        Objects.requireNonNull(op, "op cannot be null");
        for (TensorView tv : op.inputs()) {
            checkOwned(tv);
        }
        for (TensorView tv : op.outputs()) {
            checkOwned(tv);
            tv.setDefinition(op);
        }
        operations.add(op);
        return op;
    }

    // ==================== Queries ====================

    public List<TensorView> allTensorViews() {
        return Collections.unmodifiableList(tensorViews);
    }

    /**
     * Returns every operation in topological order.
     */
    public List<TensorOp> operations() {
        return Collections.unmodifiableList(operations);
    }

    /**
     * Tensors not produced by any operation.
     */
    public List<TensorView> inputs() {
        return tensorViews.stream().filter(tv -> tv.definition() == null).toList();
    }

    public IterDomain iterDomain(int handle) {
        return iterDomains.get(handle);
    }

    /**
     * Number of domains ever created; every handle is below this bound.
     */
    public int iterDomainCount() {
        return iterDomains.size();
    }

    // ==================== Arena (package-private) ====================

    IterDomain newIterDomain(Extent extent, IterType type, boolean rfactorProduct) {
        IterDomain id = new IterDomain(this, iterDomains.size(), extent, type, rfactorProduct);
        iterDomains.add(id);
        return id;
    }

    TensorView newTensorView(TensorDomain domain) {
        TensorView tv = new TensorView(this, tensorViews.size(), domain);
        tensorViews.add(tv);
        return tv;
    }

    IterDomain[] split(IterDomain in, Extent factor, boolean innerSplit, boolean rfactorProduct) {
        Extent remainder = Extent.ceilDiv(in.extent(), factor);
        IterDomain outer = newIterDomain(innerSplit ? remainder : factor, in.iterType(), rfactorProduct);
        IterDomain inner = newIterDomain(innerSplit ? factor : remainder, in.iterType(), rfactorProduct);
        var split = new IterDomainTransform.Split(nextTransformOrdinal++, in, outer, inner, factor, innerSplit);
        outer.setDefinition(split);
        inner.setDefinition(split);
        return new IterDomain[] {outer, inner};
    }

    IterDomain merge(IterDomain outer, IterDomain inner, boolean rfactorProduct) {
        IterDomain out = newIterDomain(
                Extent.mul(outer.extent(), inner.extent()), mergedType(outer, inner), rfactorProduct);
        out.setDefinition(new IterDomainTransform.Merge(nextTransformOrdinal++, outer, inner, out));
        return out;
    }

    private static IterType mergedType(IterDomain outer, IterDomain inner) {
        if (outer.isBroadcast()) {
            return inner.iterType();
        }
        if (inner.isBroadcast() || outer.iterType() == inner.iterType()) {
            return outer.iterType();
        }
        throw new IllegalArgumentException(String.format(
                "Cannot merge %s with %s: iteration types differ", outer, inner));
    }

    private void checkOwned(TensorView tv) {
        if (tv.fusion() != this) {
            throw new IllegalArgumentException(tv.name() + " belongs to a different fusion");
        }
    }

    @Override
    public String toString() {
        return String.format("Fusion[tensors=%d, ops=%d, iterDomains=%d]",
                tensorViews.size(), operations.size(), iterDomains.size());
    }
}
