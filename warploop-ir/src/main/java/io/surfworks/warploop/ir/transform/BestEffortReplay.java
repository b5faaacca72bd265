package io.surfworks.warploop.ir.transform;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.surfworks.warploop.ir.IterDomain;
import io.surfworks.warploop.ir.IterDomainTransform;
import io.surfworks.warploop.ir.TensorView;

/**
 * Propagates a root-level correspondence through two transform histories.
 *
 * <p>The target's transforms are walked in topological order. Whenever every input
 * of a target transform is mapped and the replay side applied a transform of the
 * same kind and parameters to exactly those mapped inputs, the outputs are mapped
 * pairwise. Anything else is left unmapped; the result is the best correspondence
 * the two histories support, not a complete one.
 *
 * <p>With broadcast forwarding, a target merge of a mapped domain with an unmapped
 * broadcast domain maps the merge output to the mapped input's counterpart. This
 * covers consumers that merged in broadcast dimensions their producer never had.
 *
 * <p>Example:
 * <pre>{@code
 * var rootMap = new PairwiseRootDomainMap(producer, consumer).mapConsumerToProducer();
 * var replay = new BestEffortReplay(producer.leafDomain(), consumer.leafDomain(), rootMap);
 * IterDomain producerAxis = replay.getReplay().get(consumer.axis(0));
 * }</pre>
 */
public final class BestEffortReplay {

    private final Map<IterDomain, IterDomain> targetToReplay;
    private final Set<IterDomain> forwardedIds;

    public BestEffortReplay(List<IterDomain> replayDomain, List<IterDomain> targetDomain,
                            Map<IterDomain, IterDomain> targetToReplayRoots) {
        this(replayDomain, targetDomain, targetToReplayRoots, false);
    }

    /**
     * @param replayDomain leaf domain whose history is searched for matching transforms
     * @param targetDomain leaf domain whose history drives the walk
     * @param targetToReplayRoots seed correspondence, usually between root domains
     * @param forwardBroadcastMismatch whether to forward through merges with unmapped broadcasts
     */
    public BestEffortReplay(List<IterDomain> replayDomain, List<IterDomain> targetDomain,
                            Map<IterDomain, IterDomain> targetToReplayRoots,
                            boolean forwardBroadcastMismatch) {
        this.targetToReplay = new LinkedHashMap<>(targetToReplayRoots);
        this.forwardedIds = new HashSet<>();

        Map<IterDomain, IterDomainTransform> replayUses = new HashMap<>();
        for (IterDomainTransform expr : TransformHistory.transformsOf(replayDomain)) {
            for (IterDomain input : expr.inputs()) {
                replayUses.put(input, expr);
            }
        }

        for (IterDomainTransform targetExpr : TransformHistory.transformsOf(targetDomain)) {
            if (forwardBroadcastMismatch && forward(targetExpr)) {
                continue;
            }
            replayOne(targetExpr, replayUses);
        }
    }

    /**
     * Replays the producer's history as the consumer's, forwarding through
     * broadcast mismatches.
     *
     * @return a replay whose {@link #getReplay()} maps consumer domains to producer domains
     */
    public static BestEffortReplay replayProducerAsConsumer(
            TensorView producer, TensorView consumer, PairwiseRootDomainMap rootMap) {
        return new BestEffortReplay(
                producer.leafDomain(), consumer.leafDomain(), rootMap.mapConsumerToProducer(), true);
    }

    /**
     * Returns the target-to-replay correspondence, including the seed entries.
     */
    public Map<IterDomain, IterDomain> getReplay() {
        return Collections.unmodifiableMap(targetToReplay);
    }

    /**
     * True if {@code targetId} was mapped by forwarding through a broadcast merge.
     */
    public boolean isForwarded(IterDomain targetId) {
        return forwardedIds.contains(targetId);
    }

    // ==================== Internal Helpers ====================

    private boolean forward(IterDomainTransform targetExpr) {
        if (!(targetExpr instanceof IterDomainTransform.Merge merge)) {
            return false;
        }
        boolean outerMapped = targetToReplay.containsKey(merge.outer());
        boolean innerMapped = targetToReplay.containsKey(merge.inner());
        if (outerMapped == innerMapped) {
            return false;
        }
        IterDomain mapped = outerMapped ? merge.outer() : merge.inner();
        IterDomain unmapped = outerMapped ? merge.inner() : merge.outer();
        if (!unmapped.isBroadcast()) {
            return false;
        }
        targetToReplay.put(merge.out(), targetToReplay.get(mapped));
        forwardedIds.add(merge.out());
        return true;
    }

    private void replayOne(IterDomainTransform targetExpr, Map<IterDomain, IterDomainTransform> replayUses) {
        List<IterDomain> targetInputs = targetExpr.inputs();
        IterDomain[] replayInputs = new IterDomain[targetInputs.size()];
        for (int i = 0; i < targetInputs.size(); i++) {
            IterDomain replayInput = targetToReplay.get(targetInputs.get(i));
            if (replayInput == null) {
                return;
            }
            replayInputs[i] = replayInput;
        }

        IterDomainTransform replayExpr = replayUses.get(replayInputs[0]);
        if (replayExpr == null || !targetExpr.sameTransformAs(replayExpr)) {
            return;
        }
        List<IterDomain> replayExprInputs = replayExpr.inputs();
        if (replayExprInputs.size() != replayInputs.length) {
            return;
        }
        for (int i = 0; i < replayInputs.length; i++) {
            if (replayExprInputs.get(i) != replayInputs[i]) {
                return;
            }
        }

        List<IterDomain> targetOutputs = targetExpr.outputs();
        List<IterDomain> replayOutputs = replayExpr.outputs();
        for (int i = 0; i < targetOutputs.size(); i++) {
            targetToReplay.put(targetOutputs.get(i), replayOutputs.get(i));
        }
    }

    @Override
    public String toString() {
        return String.format("BestEffortReplay[mapped=%d, forwarded=%d]", targetToReplay.size(), forwardedIds.size());
    }
}
