package io.surfworks.warploop.core.resolve;

import java.util.HashSet;
import java.util.Set;

import io.surfworks.warploop.ir.IterDomain;
import io.surfworks.warploop.ir.transform.TransformHistory;

/**
 * Domains derived only from trivial reductions (reductions of extent one).
 *
 * <p>Such domains iterate once, so concrete-id scoring counts them with broadcasts
 * rather than with real iteration roots.
 */
public final class TrivialReductionInfo {

    private final Set<Integer> derived = new HashSet<>();

    private TrivialReductionInfo() {}

    /**
     * Classifies every given domain.
     */
    public static TrivialReductionInfo build(Iterable<IterDomain> ids) {
        TrivialReductionInfo info = new TrivialReductionInfo();
        for (IterDomain id : ids) {
            Set<IterDomain> inputs = TransformHistory.inputsOf(id);
            if (!inputs.isEmpty() && inputs.stream().allMatch(IterDomain::isTrivialReduction)) {
                info.derived.add(id.handle());
            }
        }
        return info;
    }

    /**
     * True if every root {@code id} derives from is a trivial reduction.
     */
    public boolean isDerived(IterDomain id) {
        return derived.contains(id.handle());
    }

    public int size() {
        return derived.size();
    }
}
