package io.surfworks.warploop.ir.transform;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.warploop.ir.Fusion;
import io.surfworks.warploop.ir.IterDomain;
import io.surfworks.warploop.ir.TensorOps;
import io.surfworks.warploop.ir.TensorView;

@DisplayName("BestEffortReplay")
class BestEffortReplayTest {

    private static Map<IterDomain, IterDomain> replay(TensorView producer, TensorView consumer) {
        var rootMap = new PairwiseRootDomainMap(producer, consumer).mapConsumerToProducer();
        return new BestEffortReplay(producer.leafDomain(), consumer.leafDomain(), rootMap).getReplay();
    }

    @Test
    @DisplayName("maps leaves of identically scheduled tensors")
    void identicalSchedules() {
        Fusion fusion = new Fusion();
        TensorView tv0 = fusion.makeSymbolicTensor(2);
        TensorView tv1 = TensorOps.unary("neg", tv0);
        tv0.merge(0).split(0, 4);
        tv1.merge(0).split(0, 4);

        Map<IterDomain, IterDomain> map = replay(tv0, tv1);

        assertSame(tv0.axis(0), map.get(tv1.axis(0)));
        assertSame(tv0.axis(1), map.get(tv1.axis(1)));
    }

    @Test
    @DisplayName("stops at splits with different factors")
    void differentFactors() {
        Fusion fusion = new Fusion();
        TensorView tv0 = fusion.makeSymbolicTensor(1);
        TensorView tv1 = TensorOps.unary("neg", tv0);
        tv0.split(0, 4);
        tv1.split(0, 8);

        Map<IterDomain, IterDomain> map = replay(tv0, tv1);

        assertNull(map.get(tv1.axis(0)));
        assertSame(tv0.rootDomain().get(0), map.get(tv1.rootDomain().get(0)));
    }

    @Test
    @DisplayName("merges must consume inputs in the same order")
    void mergeOrderMatters() {
        Fusion fusion = new Fusion();
        TensorView tv0 = fusion.makeSymbolicTensor(2);
        TensorView tv1 = TensorOps.unary("neg", tv0);
        tv0.merge(1, 0);
        tv1.merge(0);

        assertNull(replay(tv0, tv1).get(tv1.axis(0)));
    }

    @Test
    @DisplayName("forwards through a merge with a broadcast the producer lacks")
    void forwardsBroadcastMerge() {
        Fusion fusion = new Fusion();
        TensorView tv0 = fusion.makeSymbolicTensor(1);
        TensorView tv1 = TensorOps.broadcast(tv0, false, true);
        tv1.merge(0);
        var rootMap = new PairwiseRootDomainMap(tv0, tv1);

        BestEffortReplay plain = new BestEffortReplay(tv0.leafDomain(), tv1.leafDomain(),
                rootMap.mapConsumerToProducer());
        BestEffortReplay forwarding = BestEffortReplay.replayProducerAsConsumer(tv0, tv1, rootMap);

        assertNull(plain.getReplay().get(tv1.axis(0)));
        assertSame(tv0.axis(0), forwarding.getReplay().get(tv1.axis(0)));
        assertTrue(forwarding.isForwarded(tv1.axis(0)));
        assertFalse(forwarding.isForwarded(tv1.rootDomain().get(0)));
    }

    @Test
    @DisplayName("does not forward through a merge with an unmapped iteration domain")
    void noForwardForIteration() {
        Fusion fusion = new Fusion();
        TensorView tv0 = fusion.makeSymbolicTensor(1);
        TensorView tv1 = TensorOps.broadcast(tv0, false, true);
        TensorView tv2 = fusion.makeSymbolicTensor(2);
        TensorView tv3 = TensorOps.binary("add", tv1, tv2);
        tv3.merge(0);
        Map<IterDomain, IterDomain> exactRoots = new PairwiseRootDomainMap(tv1, tv3, true).mapConsumerToProducer();

        BestEffortReplay replay = new BestEffortReplay(tv1.leafDomain(), tv3.leafDomain(), exactRoots, true);

        assertNull(replay.getReplay().get(tv3.axis(0)));
    }
}
