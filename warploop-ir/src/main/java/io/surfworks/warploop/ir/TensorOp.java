package io.surfworks.warploop.ir;

import java.util.List;

/**
 * A tensor operation: one or more producer tensors in, one or more consumer
 * tensors out.
 *
 * <p>The operation kinds differ only in how consumer root dimensions correspond
 * to producer dimensions; see {@link io.surfworks.warploop.ir.transform.PairwiseRootDomainMap}.
 */
public sealed interface TensorOp permits TensorOp.UnaryOp, TensorOp.BinaryOp, TensorOp.BroadcastOp,
        TensorOp.ReductionOp, TensorOp.WelfordOp, TensorOp.ViewOp, TensorOp.OpaqueOp {

    String opName();

    List<TensorView> inputs();

    List<TensorView> outputs();

    // ==================== Pointwise ====================

    record UnaryOp(String opName, TensorView out, TensorView in) implements TensorOp {
        @Override
        public List<TensorView> inputs() {
            return List.of(in);
        }

        @Override
        public List<TensorView> outputs() {
            return List.of(out);
        }
    }

    record BinaryOp(String opName, TensorView out, TensorView lhs, TensorView rhs) implements TensorOp {
        @Override
        public List<TensorView> inputs() {
            return List.of(lhs, rhs);
        }

        @Override
        public List<TensorView> outputs() {
            return List.of(out);
        }
    }

    // ==================== Shape ====================

    /**
     * Inserts new broadcast dimensions. {@code flags.get(i)} is true when output
     * root dimension {@code i} is new and has no producer counterpart.
     */
    record BroadcastOp(TensorView out, TensorView in, List<Boolean> flags) implements TensorOp {
        public BroadcastOp {
            flags = List.copyOf(flags);
        }

        @Override
        public String opName() {
            return "broadcast";
        }

        @Override
        public List<TensorView> inputs() {
            return List.of(in);
        }

        @Override
        public List<TensorView> outputs() {
            return List.of(out);
        }
    }

    /**
     * View-like reshape. The output's root domain mirrors the input and its rfactor
     * domain holds the reshaped dimensions.
     */
    record ViewOp(TensorView out, TensorView in) implements TensorOp {
        @Override
        public String opName() {
            return "view";
        }

        @Override
        public List<TensorView> inputs() {
            return List.of(in);
        }

        @Override
        public List<TensorView> outputs() {
            return List.of(out);
        }
    }

    // ==================== Reductions ====================

    record ReductionOp(String opName, TensorView out, TensorView in, List<Integer> axes) implements TensorOp {
        public ReductionOp {
            axes = List.copyOf(axes);
        }

        @Override
        public List<TensorView> inputs() {
            return List.of(in);
        }

        @Override
        public List<TensorView> outputs() {
            return List.of(out);
        }
    }

    /**
     * Welford mean/variance reduction. The three outputs share an identical root
     * shape and must be scheduled identically.
     */
    record WelfordOp(TensorView avg, TensorView var, TensorView count, TensorView in, List<Integer> axes)
            implements TensorOp {
        public WelfordOp {
            axes = List.copyOf(axes);
        }

        @Override
        public String opName() {
            return "welford";
        }

        @Override
        public List<TensorView> inputs() {
            return List.of(in);
        }

        @Override
        public List<TensorView> outputs() {
            return List.of(avg, var, count);
        }
    }

    // ==================== Other ====================

    /**
     * An operation whose semantics the IR does not model beyond positional root
     * correspondence.
     */
    record OpaqueOp(String opName, List<TensorView> outputs, List<TensorView> inputs) implements TensorOp {
        public OpaqueOp {
            outputs = List.copyOf(outputs);
            inputs = List.copyOf(inputs);
        }
    }
}
