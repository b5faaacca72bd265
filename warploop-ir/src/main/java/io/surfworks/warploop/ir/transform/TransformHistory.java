package io.surfworks.warploop.ir.transform;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import io.surfworks.warploop.ir.IterDomain;
import io.surfworks.warploop.ir.IterDomainTransform;

/**
 * Traversals over the split/merge history of iteration domains.
 *
 * <p>All traversals use explicit worklists so deep transform chains cannot exhaust
 * the call stack.
 */
public final class TransformHistory {

    private TransformHistory() {} // Utility class

    /**
     * Returns every transform that contributed to {@code leaves}, in topological order.
     */
    public static List<IterDomainTransform> transformsOf(Collection<IterDomain> leaves) {
        Set<IterDomainTransform> seen = new HashSet<>();
        Set<IterDomain> visited = new HashSet<>();
        Deque<IterDomain> toVisit = new ArrayDeque<>(leaves);
        while (!toVisit.isEmpty()) {
            IterDomain id = toVisit.pop();
            if (!visited.add(id)) {
                continue;
            }
            IterDomainTransform def = id.definition();
            if (def != null && seen.add(def)) {
                toVisit.addAll(def.inputs());
            }
        }
        List<IterDomainTransform> ordered = new ArrayList<>(seen);
        ordered.sort(Comparator.comparingInt(IterDomainTransform::ordinal));
        return ordered;
    }

    /**
     * Returns the domains on paths from {@code roots} to {@code leaves}, both ends
     * included, sorted by handle. The backward walk from the leaves stops at roots.
     */
    public static List<IterDomain> idsBetween(Collection<IterDomain> roots, Collection<IterDomain> leaves) {
        Set<IterDomain> rootSet = new HashSet<>(roots);
        Set<IterDomain> visited = new HashSet<>();
        Deque<IterDomain> toVisit = new ArrayDeque<>(leaves);
        while (!toVisit.isEmpty()) {
            IterDomain id = toVisit.pop();
            if (!visited.add(id) || rootSet.contains(id)) {
                continue;
            }
            IterDomainTransform def = id.definition();
            if (def != null) {
                toVisit.addAll(def.inputs());
            }
        }
        List<IterDomain> ids = new ArrayList<>(visited);
        ids.sort(Comparator.comparingInt(IterDomain::handle));
        return ids;
    }

    /**
     * Returns the domains without a defining transform that {@code id} derives from.
     */
    public static Set<IterDomain> inputsOf(IterDomain id) {
        Set<IterDomain> inputs = new LinkedHashSet<>();
        Set<IterDomain> visited = new HashSet<>();
        Deque<IterDomain> toVisit = new ArrayDeque<>();
        toVisit.add(id);
        while (!toVisit.isEmpty()) {
            IterDomain current = toVisit.poll();
            if (!visited.add(current)) {
                continue;
            }
            IterDomainTransform def = current.definition();
            if (def == null) {
                inputs.add(current);
            } else {
                toVisit.addAll(def.inputs());
            }
        }
        return inputs;
    }
}
