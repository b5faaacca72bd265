package io.surfworks.warploop.core.resolve;

import io.surfworks.warploop.ir.IterDomain;

/**
 * Tells whether a domain's loop is extended by a halo.
 *
 * <p>Halo-extended parallel loops iterate past the hardware dimension, so they get a
 * serial index variable instead of the hardware index.
 */
@FunctionalInterface
public interface HaloInfo {

    boolean hasHaloExtent(IterDomain id);

    /**
     * No domain has a halo.
     */
    static HaloInfo none() {
        return id -> false;
    }
}
