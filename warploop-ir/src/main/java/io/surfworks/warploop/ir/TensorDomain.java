package io.surfworks.warploop.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The domains of one tensor: root, optional rfactor, and the current leaf (loop)
 * domain. Scheduling transforms only ever replace entries of the leaf domain.
 */
public final class TensorDomain {

    private final List<IterDomain> root;
    private final List<IterDomain> rfactor;
    private final boolean viewLikeRFactor;
    private final List<IterDomain> leaf;

    TensorDomain(List<IterDomain> root) {
        this(root, null, false);
    }

    TensorDomain(List<IterDomain> root, List<IterDomain> rfactor, boolean viewLikeRFactor) {
        this.root = List.copyOf(root);
        this.rfactor = rfactor == null ? null : List.copyOf(rfactor);
        this.viewLikeRFactor = viewLikeRFactor;
        this.leaf = new ArrayList<>(rfactor == null ? root : rfactor);
    }

    public List<IterDomain> root() {
        return root;
    }

    public boolean hasRFactor() {
        return rfactor != null;
    }

    /**
     * True if the rfactor domain was introduced by a view-like reshape.
     */
    public boolean hasViewLikeRFactor() {
        return viewLikeRFactor;
    }

    /**
     * Returns the rfactor domain if present, otherwise the root domain.
     */
    public List<IterDomain> maybeRFactor() {
        return rfactor != null ? rfactor : root;
    }

    public List<IterDomain> leaf() {
        return Collections.unmodifiableList(leaf);
    }

    List<IterDomain> mutableLeaf() {
        return leaf;
    }

    /**
     * Filters reduction domains out of a domain list.
     */
    public static List<IterDomain> noReductions(List<IterDomain> domains) {
        return domains.stream().filter(id -> !id.isReduction()).toList();
    }

    @Override
    public String toString() {
        return "[" + String.join(", ", leaf.stream().map(IterDomain::toString).toList()) + "]";
    }
}
