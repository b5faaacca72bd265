package io.surfworks.warploop.core.resolve;

import io.surfworks.warploop.ir.ParallelType;

/**
 * The symbolic index a generated loop iterates with.
 *
 * <p>Loop indices are identified by a serial number unique within one
 * {@link ConcreteResolver}; two loops share an index only if they share the
 * {@code LoopIndex} instance.
 */
public sealed interface IndexVariable permits IndexVariable.Zero, IndexVariable.ParallelIndex,
        IndexVariable.LoopIndex {

    String name();

    /**
     * Compile-time zero, used for loops over broadcast dimensions only.
     */
    final class Zero implements IndexVariable {

        public static final Zero INSTANCE = new Zero();

        private Zero() {}

        @Override
        public String name() {
            return "0";
        }

        @Override
        public String toString() {
            return name();
        }
    }

    /**
     * The hardware index of a block or thread dimension.
     */
    record ParallelIndex(ParallelType parallelType) implements IndexVariable {
        public ParallelIndex {
            if (!parallelType.isThread()) {
                throw new IllegalArgumentException(parallelType + " has no parallel index");
            }
        }

        @Override
        public String name() {
            return parallelType.indexName();
        }

        @Override
        public String toString() {
            return name();
        }
    }

    /**
     * A fresh serial loop index.
     */
    record LoopIndex(int serial) implements IndexVariable {
        @Override
        public String name() {
            return "i" + serial;
        }

        @Override
        public String toString() {
            return name();
        }
    }
}
