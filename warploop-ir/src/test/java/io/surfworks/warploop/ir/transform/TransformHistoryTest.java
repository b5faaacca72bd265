package io.surfworks.warploop.ir.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.warploop.ir.Fusion;
import io.surfworks.warploop.ir.IterDomain;
import io.surfworks.warploop.ir.IterDomainTransform;
import io.surfworks.warploop.ir.TensorOps;
import io.surfworks.warploop.ir.TensorView;

@DisplayName("TransformHistory")
class TransformHistoryTest {

    @Test
    @DisplayName("transforms come back in creation order")
    void transformsInOrder() {
        Fusion fusion = new Fusion();
        TensorView tv = fusion.makeSymbolicTensor(2);
        tv.merge(0).split(0, 4);

        List<IterDomainTransform> transforms = TransformHistory.transformsOf(tv.leafDomain());

        assertEquals(2, transforms.size());
        assertInstanceOf(IterDomainTransform.Merge.class, transforms.get(0));
        assertInstanceOf(IterDomainTransform.Split.class, transforms.get(1));
    }

    @Test
    @DisplayName("ids between root and leaf include intermediates")
    void idsBetween() {
        Fusion fusion = new Fusion();
        TensorView tv = fusion.makeSymbolicTensor(2);
        tv.merge(0).split(0, 4);

        List<IterDomain> ids = TransformHistory.idsBetween(tv.rootDomain(), tv.leafDomain());

        assertEquals(5, ids.size());
        for (int i = 1; i < ids.size(); i++) {
            assertTrue(ids.get(i - 1).handle() < ids.get(i).handle());
        }
    }

    @Test
    @DisplayName("walk stops at the given roots")
    void stopsAtRoots() {
        Fusion fusion = new Fusion();
        TensorView tv0 = fusion.makeSymbolicTensor(2);
        TensorView tv1 = TensorOps.flatten(tv0, 0, 1);
        tv1.split(0, 8);

        List<IterDomain> ids = TransformHistory.idsBetween(tv1.maybeRFactorDomain(), tv1.leafDomain());

        assertEquals(3, ids.size());
        assertFalse(ids.contains(tv1.rootDomain().get(0)));
    }

    @Test
    @DisplayName("inputs of a leaf are the domains without a definition")
    void inputsOf() {
        Fusion fusion = new Fusion();
        TensorView tv = fusion.makeSymbolicTensor(2);
        tv.merge(0).split(0, 4);

        Set<IterDomain> inputs = TransformHistory.inputsOf(tv.axis(1));

        assertEquals(Set.copyOf(tv.rootDomain()), inputs);
        assertEquals(Set.of(tv.rootDomain().get(0)), TransformHistory.inputsOf(tv.rootDomain().get(0)));
    }
}
