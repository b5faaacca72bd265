package io.surfworks.warploop.ir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the operation builders and the fusion arena.
 */
@DisplayName("TensorOps")
class TensorOpsTest {

    @Nested
    @DisplayName("Pointwise")
    class PointwiseTests {

        @Test
        @DisplayName("unary copies the producer's shape with fresh domains")
        void unaryFreshDomains() {
            Fusion fusion = new Fusion();
            TensorView tv0 = fusion.makeSymbolicTensor(2);

            TensorView tv1 = TensorOps.unary("neg", tv0);

            assertEquals(2, tv1.nDims());
            assertFalse(tv1.rootDomain().contains(tv0.axis(0)));
            assertEquals(tv0.axis(1).extent(), tv1.axis(1).extent());
            assertInstanceOf(TensorOp.UnaryOp.class, tv1.definition());
        }

        @Test
        @DisplayName("binary output is broadcast only where both inputs are")
        void binaryBroadcastResolution() {
            Fusion fusion = new Fusion();
            TensorView lhs = fusion.makeConcreteTensor(4, 1);
            TensorView rhs = fusion.makeConcreteTensor(1, 1);

            TensorView out = TensorOps.binary("add", lhs, rhs);

            assertEquals(IterType.ITERATION, out.axis(0).iterType());
            assertEquals(Extent.of(4), out.axis(0).extent());
            assertTrue(out.axis(1).isBroadcast());
        }

        @Test
        @DisplayName("binary rejects rank mismatch")
        void binaryRankMismatch() {
            Fusion fusion = new Fusion();
            TensorView lhs = fusion.makeSymbolicTensor(2);
            TensorView rhs = fusion.makeSymbolicTensor(1);

            assertThrows(IllegalArgumentException.class, () -> TensorOps.binary("add", lhs, rhs));
        }

        @Test
        @DisplayName("binary rejects tensors from another fusion")
        void binaryForeignFusion() {
            TensorView lhs = new Fusion().makeSymbolicTensor(1);
            TensorView rhs = new Fusion().makeSymbolicTensor(1);

            assertThrows(IllegalArgumentException.class, () -> TensorOps.binary("add", lhs, rhs));
        }
    }

    @Nested
    @DisplayName("Shape")
    class ShapeTests {

        @Test
        @DisplayName("broadcast inserts new broadcast domains at flagged positions")
        void broadcastInserts() {
            Fusion fusion = new Fusion();
            TensorView tv0 = fusion.makeSymbolicTensor(1);

            TensorView tv1 = TensorOps.broadcast(tv0, true, false);

            assertTrue(tv1.axis(0).isBroadcast());
            assertEquals(Extent.ONE, tv1.axis(0).extent());
            assertEquals(tv0.axis(0).extent(), tv1.axis(1).extent());
            var op = (TensorOp.BroadcastOp) tv1.definition();
            assertEquals(List.of(true, false), op.flags());
        }

        @Test
        @DisplayName("broadcast rejects flags that do not keep every input dimension")
        void broadcastFlagMismatch() {
            Fusion fusion = new Fusion();
            TensorView tv0 = fusion.makeSymbolicTensor(2);

            assertThrows(IllegalArgumentException.class, () -> TensorOps.broadcast(tv0, false, true));
        }

        @Test
        @DisplayName("flatten creates a view-like rfactor domain")
        void flatten() {
            Fusion fusion = new Fusion();
            TensorView tv0 = fusion.makeSymbolicTensor(3);

            TensorView tv1 = TensorOps.flatten(tv0, 0, 1);

            assertTrue(tv1.domain().hasViewLikeRFactor());
            assertEquals(3, tv1.rootDomain().size());
            assertEquals(2, tv1.maybeRFactorDomain().size());
            assertTrue(tv1.maybeRFactorDomain().get(0).isRFactorProduct());
            assertFalse(tv1.maybeRFactorDomain().get(1).isRFactorProduct());
            assertEquals(tv1.maybeRFactorDomain(), tv1.leafDomain());
        }

        @Test
        @DisplayName("unflatten splits one dimension into two rfactor products")
        void unflatten() {
            Fusion fusion = new Fusion();
            TensorView tv0 = fusion.makeConcreteTensor(64, 3);

            TensorView tv1 = TensorOps.unflatten(tv0, 0, 8);

            assertEquals(List.of(Extent.of(8), Extent.of(8), Extent.of(3)),
                    tv1.leafDomain().stream().map(IterDomain::extent).toList());
            assertInstanceOf(TensorOp.ViewOp.class, tv1.definition());
        }
    }

    @Nested
    @DisplayName("Reductions")
    class ReductionTests {

        @Test
        @DisplayName("sum marks reduced axes")
        void sumMarksAxes() {
            Fusion fusion = new Fusion();
            TensorView tv0 = fusion.makeSymbolicTensor(2);

            TensorView tv1 = TensorOps.sum(tv0, -1);

            assertFalse(tv1.axis(0).isReduction());
            assertTrue(tv1.axis(1).isReduction());
        }

        @Test
        @DisplayName("reducing a size-one dimension is a trivial reduction")
        void trivialReduction() {
            Fusion fusion = new Fusion();
            TensorView tv0 = fusion.makeConcreteTensor(4, 1);

            TensorView tv1 = TensorOps.sum(tv0, 1);

            assertTrue(tv1.axis(1).isTrivialReduction());
            assertFalse(TensorOps.sum(tv0, 0).axis(0).isTrivialReduction());
        }

        @Test
        @DisplayName("sum needs an axis")
        void sumNeedsAxis() {
            Fusion fusion = new Fusion();
            TensorView tv0 = fusion.makeSymbolicTensor(2);

            assertThrows(IllegalArgumentException.class, () -> TensorOps.sum(tv0));
        }

        @Test
        @DisplayName("welford produces three outputs of one operation")
        void welfordOutputs() {
            Fusion fusion = new Fusion();
            TensorView tv0 = fusion.makeSymbolicTensor(2);

            List<TensorView> outs = TensorOps.welford(tv0, 1);

            assertEquals(3, outs.size());
            assertSame(outs.get(0).definition(), outs.get(2).definition());
            assertEquals(outs, outs.get(1).definition().outputs());
        }
    }

    @Nested
    @DisplayName("Fusion")
    class FusionTests {

        @Test
        @DisplayName("inputs are tensors without a definition")
        void inputs() {
            Fusion fusion = new Fusion();
            TensorView tv0 = fusion.makeSymbolicTensor(1);
            TensorView tv1 = fusion.makeSymbolicTensor(1);
            TensorView tv2 = TensorOps.binary("mul", tv0, tv1);

            assertEquals(List.of(tv0, tv1), fusion.inputs());
            assertNull(tv0.definition());
            assertEquals(1, fusion.operations().size());
            assertSame(tv2.definition(), fusion.operations().get(0));
        }

        @Test
        @DisplayName("handles are dense arena indices")
        void denseHandles() {
            Fusion fusion = new Fusion();
            TensorView tv0 = fusion.makeSymbolicTensor(2);
            tv0.merge(0);

            assertEquals(3, fusion.iterDomainCount());
            for (int h = 0; h < fusion.iterDomainCount(); h++) {
                assertEquals(h, fusion.iterDomain(h).handle());
            }
        }

        @Test
        @DisplayName("an output cannot be defined twice")
        void rejectsSecondDefinition() {
            Fusion fusion = new Fusion();
            TensorView tv0 = fusion.makeSymbolicTensor(1);
            TensorView tv1 = TensorOps.unary("neg", tv0);

            assertThrows(IllegalStateException.class,
                    () -> fusion.addOperation(new TensorOp.OpaqueOp("again", List.of(tv1), List.of(tv0))));
        }

        @Test
        @DisplayName("operations must use tensors of the same fusion")
        void rejectsForeignTensors() {
            Fusion fusion = new Fusion();
            TensorView out = fusion.makeSymbolicTensor(1);
            TensorView foreign = new Fusion().makeSymbolicTensor(1);

            assertThrows(IllegalArgumentException.class,
                    () -> fusion.addOperation(new TensorOp.OpaqueOp("op", List.of(out), List.of(foreign))));
        }
    }
}
