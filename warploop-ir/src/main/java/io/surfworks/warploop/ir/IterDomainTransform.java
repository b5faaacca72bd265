package io.surfworks.warploop.ir;

import java.util.List;

/**
 * A transform in the history of a tensor domain: split or merge.
 *
 * <p>Every transform carries a fusion-wide ordinal assigned at creation; since a
 * transform can only consume domains that already exist, sorting by ordinal is a
 * valid topological order.
 */
public sealed interface IterDomainTransform permits IterDomainTransform.Split, IterDomainTransform.Merge {

    int ordinal();

    List<IterDomain> inputs();

    List<IterDomain> outputs();

    /**
     * True if {@code other} is the same kind of transform with the same parameters.
     * Inputs and outputs are not compared.
     */
    boolean sameTransformAs(IterDomainTransform other);

    /**
     * Splits {@code in} into {@code outer} and {@code inner}. With an inner split the
     * factor is the extent of {@code inner}, otherwise of {@code outer}.
     */
    record Split(int ordinal, IterDomain in, IterDomain outer, IterDomain inner,
                 Extent factor, boolean innerSplit) implements IterDomainTransform {

        @Override
        public List<IterDomain> inputs() {
            return List.of(in);
        }

        @Override
        public List<IterDomain> outputs() {
            return List.of(outer, inner);
        }

        @Override
        public boolean sameTransformAs(IterDomainTransform other) {
            return other instanceof Split s
                    && s.innerSplit == innerSplit
                    && s.factor.equals(factor);
        }

        @Override
        public String toString() {
            return String.format("Split: %s by factor %s -> %s, %s%s",
                    in, factor, outer, inner, innerSplit ? "" : " (outer split)");
        }
    }

    /**
     * Merges {@code outer} and {@code inner} into {@code out}.
     */
    record Merge(int ordinal, IterDomain outer, IterDomain inner, IterDomain out)
            implements IterDomainTransform {

        @Override
        public List<IterDomain> inputs() {
            return List.of(outer, inner);
        }

        @Override
        public List<IterDomain> outputs() {
            return List.of(out);
        }

        @Override
        public boolean sameTransformAs(IterDomainTransform other) {
            return other instanceof Merge;
        }

        @Override
        public String toString() {
            return String.format("Merge: %s and %s -> %s", outer, inner, out);
        }
    }
}
