package io.surfworks.warploop.ir;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builders for tensor operations. Each builder creates the output tensors with
 * fresh root domains and registers the operation with the inputs' fusion.
 *
 * <p>Example:
 * <pre>{@code
 * TensorView x = fusion.makeSymbolicTensor(1);
 * TensorView xb = TensorOps.broadcast(x, false, true);   // [i0, b]
 * TensorView y = fusion.makeSymbolicTensor(2);
 * TensorView z = TensorOps.binary("add", xb, y);         // [i0, i2]
 * TensorView s = TensorOps.sum(z, 1);                    // [i0, r]
 * }</pre>
 */
public final class TensorOps {

    private TensorOps() {} // Utility class

    // ==================== Pointwise ====================

    public static TensorView unary(String opName, TensorView in) {
        Fusion fusion = in.fusion();
        TensorView out = fusion.newTensorView(new TensorDomain(copyRoot(in)));
        fusion.addOperation(new TensorOp.UnaryOp(opName, out, in));
        return out;
    }

    /**
     * Elementwise binary operation. Inputs must have the same rank; an output
     * dimension is broadcast only where both inputs are broadcast.
     */
    public static TensorView binary(String opName, TensorView lhs, TensorView rhs) {
        checkSameFusion(lhs, rhs);
        List<IterDomain> lhsRoot = TensorDomain.noReductions(lhs.maybeRFactorDomain());
        List<IterDomain> rhsRoot = TensorDomain.noReductions(rhs.maybeRFactorDomain());
        if (lhsRoot.size() != rhsRoot.size()) {
            throw new IllegalArgumentException(String.format(
                    "Rank mismatch in %s: %s has %d dims, %s has %d",
                    opName, lhs.name(), lhsRoot.size(), rhs.name(), rhsRoot.size()));
        }
        Fusion fusion = lhs.fusion();
        List<IterDomain> root = new ArrayList<>();
        for (int i = 0; i < lhsRoot.size(); i++) {
            IterDomain l = lhsRoot.get(i);
            IterDomain r = rhsRoot.get(i);
            IterDomain source = l.isBroadcast() ? r : l;
            root.add(fusion.newIterDomain(source.extent(), source.iterType(), false));
        }
        TensorView out = fusion.newTensorView(new TensorDomain(root));
        fusion.addOperation(new TensorOp.BinaryOp(opName, out, lhs, rhs));
        return out;
    }

    // ==================== Shape ====================

    /**
     * Inserts broadcast dimensions where {@code flags} is true.
     */
    public static TensorView broadcast(TensorView in, boolean... flags) {
        List<IterDomain> inRoot = TensorDomain.noReductions(in.maybeRFactorDomain());
        int kept = 0;
        for (boolean flag : flags) {
            if (!flag) kept++;
        }
        if (kept != inRoot.size()) {
            throw new IllegalArgumentException(String.format(
                    "Broadcast flags keep %d dims but %s has %d", kept, in.name(), inRoot.size()));
        }
        Fusion fusion = in.fusion();
        List<IterDomain> root = new ArrayList<>();
        List<Boolean> flagList = new ArrayList<>();
        int next = 0;
        for (boolean flag : flags) {
            if (flag) {
                root.add(fusion.newIterDomain(Extent.ONE, IterType.BROADCAST, false));
            } else {
                IterDomain id = inRoot.get(next++);
                root.add(fusion.newIterDomain(id.extent(), id.iterType(), false));
            }
            flagList.add(flag);
        }
        TensorView out = fusion.newTensorView(new TensorDomain(root));
        fusion.addOperation(new TensorOp.BroadcastOp(out, in, flagList));
        return out;
    }

    /**
     * View-like reshape merging dimensions {@code start..end} (inclusive) into one.
     */
    public static TensorView flatten(TensorView in, int start, int end) {
        Fusion fusion = in.fusion();
        List<IterDomain> root = copyRoot(in);
        int first = TensorView.normalize(start, root.size());
        int last = TensorView.normalize(end, root.size());
        if (first >= last) {
            throw new IllegalArgumentException(String.format(
                    "flatten needs start < end, got %d and %d", first, last));
        }
        IterDomain merged = root.get(first);
        for (int i = first + 1; i <= last; i++) {
            merged = fusion.merge(merged, root.get(i), true);
        }
        List<IterDomain> rfactor = new ArrayList<>(root.subList(0, first));
        rfactor.add(merged);
        rfactor.addAll(root.subList(last + 1, root.size()));
        return addView(in, root, rfactor);
    }

    /**
     * View-like reshape splitting dimension {@code axis} into
     * {@code [ceilDiv(extent, factor), factor]}.
     */
    public static TensorView unflatten(TensorView in, int axis, long factor) {
        Fusion fusion = in.fusion();
        List<IterDomain> root = copyRoot(in);
        int pos = TensorView.normalize(axis, root.size());
        IterDomain[] split = fusion.split(root.get(pos), Extent.of(factor), true, true);
        List<IterDomain> rfactor = new ArrayList<>(root.subList(0, pos));
        rfactor.add(split[0]);
        rfactor.add(split[1]);
        rfactor.addAll(root.subList(pos + 1, root.size()));
        return addView(in, root, rfactor);
    }

    // ==================== Reductions ====================

    public static TensorView sum(TensorView in, int... axes) {
        TensorView out = reductionOutput(in, axes);
        in.fusion().addOperation(new TensorOp.ReductionOp("sum", out, in, toList(axes)));
        return out;
    }

    /**
     * Welford reduction producing {@code [avg, var, count]}, three tensors with
     * identical root shapes.
     */
    public static List<TensorView> welford(TensorView in, int... axes) {
        TensorView avg = reductionOutput(in, axes);
        TensorView var = reductionOutput(in, axes);
        TensorView count = reductionOutput(in, axes);
        in.fusion().addOperation(new TensorOp.WelfordOp(avg, var, count, in, toList(axes)));
        return List.of(avg, var, count);
    }

    // ==================== Internal Helpers ====================

    private static TensorView reductionOutput(TensorView in, int... axes) {
        List<IterDomain> inRoot = TensorDomain.noReductions(in.maybeRFactorDomain());
        Set<Integer> reduced = new HashSet<>();
        for (int axis : axes) {
            reduced.add(TensorView.normalize(axis, inRoot.size()));
        }
        if (reduced.isEmpty()) {
            throw new IllegalArgumentException("Reduction needs at least one axis");
        }
        Fusion fusion = in.fusion();
        List<IterDomain> root = new ArrayList<>();
        for (int i = 0; i < inRoot.size(); i++) {
            IterDomain id = inRoot.get(i);
            IterType type = reduced.contains(i) ? IterType.REDUCTION : id.iterType();
            root.add(fusion.newIterDomain(id.extent(), type, false));
        }
        return fusion.newTensorView(new TensorDomain(root));
    }

    private static List<IterDomain> copyRoot(TensorView in) {
        Fusion fusion = in.fusion();
        List<IterDomain> root = new ArrayList<>();
        for (IterDomain id : TensorDomain.noReductions(in.maybeRFactorDomain())) {
            root.add(fusion.newIterDomain(id.extent(), id.iterType(), false));
        }
        return root;
    }

    private static TensorView addView(TensorView in, List<IterDomain> root, List<IterDomain> rfactor) {
        Fusion fusion = in.fusion();
        TensorView out = fusion.newTensorView(new TensorDomain(root, rfactor, true));
        fusion.addOperation(new TensorOp.ViewOp(out, in));
        return out;
    }

    private static List<Integer> toList(int... axes) {
        List<Integer> list = new ArrayList<>(axes.length);
        for (int axis : axes) {
            list.add(axis);
        }
        return list;
    }

    private static void checkSameFusion(TensorView a, TensorView b) {
        if (a.fusion() != b.fusion()) {
            throw new IllegalArgumentException(a.name() + " and " + b.name() + " belong to different fusions");
        }
    }
}
