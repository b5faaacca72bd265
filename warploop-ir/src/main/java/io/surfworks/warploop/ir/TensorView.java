package io.surfworks.warploop.ir;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * A tensor in a {@link Fusion} together with its schedule.
 *
 * <p>The leaf domain is the loop nest generated code iterates. Scheduling rewrites
 * it through {@link #split}, {@link #merge} and {@link #reorder}; the root domain
 * never changes. The compute-at position splits the leaf domain into a prefix whose
 * loops are shared with consumers and a private suffix.
 *
 * <p>Example:
 * <pre>{@code
 * TensorView tv1 = TensorOps.unary("neg", tv0);
 * tv1.merge(0);          // [i0*i1]
 * tv1.split(0, 128);     // [ceilDiv(i0*i1, 128), 128]
 * tv1.setComputeAt(1);   // outer loop shared with consumers
 * tv1.axis(1).parallelize(ParallelType.TIDX);
 * }</pre>
 */
public final class TensorView {

    private final Fusion fusion;
    private final int index;
    private final TensorDomain domain;
    private TensorOp definition;
    private int computeAtPosition;
    private boolean doubleBuffered;

    TensorView(Fusion fusion, int index, TensorDomain domain) {
        this.fusion = fusion;
        this.index = index;
        this.domain = domain;
    }

    public Fusion fusion() {
        return fusion;
    }

    public String name() {
        return "T" + index;
    }

    public TensorDomain domain() {
        return domain;
    }

    public List<IterDomain> rootDomain() {
        return domain.root();
    }

    public List<IterDomain> maybeRFactorDomain() {
        return domain.maybeRFactor();
    }

    public List<IterDomain> leafDomain() {
        return domain.leaf();
    }

    public int nDims() {
        return domain.leaf().size();
    }

    /**
     * Returns the leaf domain at {@code axis}; negative axes count from the end.
     */
    public IterDomain axis(int axis) {
        return domain.leaf().get(normalize(axis, nDims()));
    }

    /**
     * The operation producing this tensor, or null for fusion inputs.
     */
    public TensorOp definition() {
        return definition;
    }

    void setDefinition(TensorOp op) {
        if (definition != null) {
            throw new IllegalStateException(name() + " is already defined by " + definition.opName());
        }
        this.definition = op;
    }

    public int computeAtPosition() {
        return computeAtPosition;
    }

    /**
     * Sets how many outer leaf dimensions share their loops with consumers.
     */
    public TensorView setComputeAt(int position) {
        if (position < 0 || position > nDims()) {
            throw new IllegalArgumentException(String.format(
                    "Compute-at position %d out of range for %s with %d dims", position, name(), nDims()));
        }
        this.computeAtPosition = position;
        return this;
    }

    public boolean isDoubleBuffered() {
        return doubleBuffered;
    }

    public TensorView doubleBuffer() {
        this.doubleBuffered = true;
        return this;
    }

    /**
     * The loop that is double buffered: the innermost leaf left of the compute-at
     * position that is neither thread bound nor broadcast.
     *
     * @throws IllegalStateException if the tensor is not double buffered or has no such axis
     */
    public IterDomain doubleBufferAxis() {
        if (!doubleBuffered) {
            throw new IllegalStateException(name() + " is not double buffered");
        }
        for (int i = computeAtPosition - 1; i >= 0; i--) {
            IterDomain id = axis(i);
            if (!id.isThread() && !id.isBroadcast()) {
                return id;
            }
        }
        throw new IllegalStateException("No double buffer axis found for " + this);
    }

    // ==================== Scheduling ====================

    public TensorView split(int axis, long factor) {
        return split(axis, factor, true);
    }

    /**
     * Splits leaf {@code axis} by a constant factor.
     *
     * @param innerSplit if true the inner output has extent {@code factor}, otherwise the outer one
     */
    public TensorView split(int axis, long factor, boolean innerSplit) {
        int pos = normalize(axis, nDims());
        checkOutsideComputeAt("split", pos);
        List<IterDomain> leaf = domain.mutableLeaf();
        IterDomain[] outputs = fusion.split(leaf.get(pos), Extent.of(factor), innerSplit, false);
        leaf.set(pos, outputs[0]);
        leaf.add(pos + 1, outputs[1]);
        return this;
    }

    /**
     * Merges leaf {@code axis} with the leaf immediately after it.
     */
    public TensorView merge(int axis) {
        int pos = normalize(axis, nDims());
        return merge(pos, pos + 1);
    }

    /**
     * Merges leaf {@code outerAxis} with {@code innerAxis}; the result takes the outer position.
     */
    public TensorView merge(int outerAxis, int innerAxis) {
        int outerPos = normalize(outerAxis, nDims());
        int innerPos = normalize(innerAxis, nDims());
        if (outerPos == innerPos) {
            throw new IllegalArgumentException("Cannot merge axis " + outerPos + " with itself");
        }
        checkOutsideComputeAt("merge", outerPos);
        checkOutsideComputeAt("merge", innerPos);
        List<IterDomain> leaf = domain.mutableLeaf();
        IterDomain merged = fusion.merge(leaf.get(outerPos), leaf.get(innerPos), false);
        leaf.set(outerPos, merged);
        leaf.remove(innerPos);
        return this;
    }

    /**
     * Moves leaf dimensions; {@code oldToNew} maps current positions to new ones.
     * Dimensions not mentioned keep their relative order in the free slots.
     *
     * @throws IllegalArgumentException if an axis is moved twice, two axes land on one
     *         position, or an axis left of the compute-at position is involved
     */
    public TensorView reorder(Map<Integer, Integer> oldToNew) {
        int n = nDims();
        IterDomain[] reordered = new IterDomain[n];
        boolean[] moved = new boolean[n];
        for (Map.Entry<Integer, Integer> entry : oldToNew.entrySet()) {
            int from = normalize(entry.getKey(), n);
            int to = normalize(entry.getValue(), n);
            if (moved[from]) {
                throw new IllegalArgumentException("Reorder moves axis " + from + " twice");
            }
            if (reordered[to] != null) {
                throw new IllegalArgumentException("Reorder maps two axes to position " + to);
            }
            checkOutsideComputeAt("reorder", from);
            checkOutsideComputeAt("reorder", to);
            reordered[to] = axis(from);
            moved[from] = true;
        }
        int slot = 0;
        for (int i = 0; i < n; i++) {
            if (moved[i]) {
                continue;
            }
            while (reordered[slot] != null) {
                slot++;
            }
            reordered[slot] = axis(i);
        }
        List<IterDomain> leaf = domain.mutableLeaf();
        leaf.clear();
        leaf.addAll(Arrays.asList(reordered));
        return this;
    }

    // Loops left of the compute-at position are shared with consumers
    private void checkOutsideComputeAt(String transform, int pos) {
        if (pos < computeAtPosition) {
            throw new IllegalArgumentException(String.format(
                    "Cannot %s axis %d of %s within compute-at position %d",
                    transform, pos, name(), computeAtPosition));
        }
    }

    static int normalize(int axis, int ndims) {
        int pos = axis < 0 ? axis + ndims : axis;
        if (pos < 0 || pos >= ndims) {
            throw new IllegalArgumentException(String.format(
                    "Axis %d out of range for tensor with %d dims", axis, ndims));
        }
        return pos;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name()).append("[");
        List<IterDomain> leaf = domain.leaf();
        for (int i = 0; i < leaf.size(); i++) {
            if (i > 0) sb.append(", ");
            if (i == computeAtPosition && computeAtPosition > 0) sb.append("| ");
            sb.append(leaf.get(i));
        }
        if (computeAtPosition == leaf.size() && computeAtPosition > 0) sb.append(" |");
        return sb.append("]").toString();
    }
}
