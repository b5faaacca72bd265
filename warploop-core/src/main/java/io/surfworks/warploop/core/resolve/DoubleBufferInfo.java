package io.surfworks.warploop.core.resolve;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.warploop.core.IdMappingException;
import io.surfworks.warploop.core.IdMappingException.Violation;
import io.surfworks.warploop.core.graph.DomainGraph;
import io.surfworks.warploop.core.graph.IdMappingMode;
import io.surfworks.warploop.ir.IterDomain;
import io.surfworks.warploop.ir.TensorView;

/**
 * Loop classes that carry a double-buffered tensor.
 *
 * <p>A tensor marked double buffered is prefetched one iteration ahead along its
 * double-buffer axis. The loop class containing that axis is split into prologue,
 * main and epilogue loops, each needing its own index.
 */
public final class DoubleBufferInfo {

    private static final Logger LOG = Logger.getLogger(DoubleBufferInfo.class.getName());

    private final DomainGraph graph;
    private final Set<Integer> loopClasses = new LinkedHashSet<>();

    private DoubleBufferInfo(DomainGraph graph) {
        this.graph = graph;
    }

    /**
     * Collects the double-buffer axes of every double-buffered tensor in the graph's fusion.
     *
     * @throws IdMappingException if a double-buffered tensor has no valid axis
     */
    public static DoubleBufferInfo build(DomainGraph graph) {
        DoubleBufferInfo info = new DoubleBufferInfo(graph);
        for (TensorView tv : graph.fusion().allTensorViews()) {
            if (!tv.isDoubleBuffered()) {
                continue;
            }
            IterDomain axis = doubleBufferAxisOf(tv);
            info.loopClasses.add(graph.classKey(axis, IdMappingMode.LOOP));
            LOG.fine(() -> tv.name() + " double buffered along " + axis);
        }
        return info;
    }

    private static IterDomain doubleBufferAxisOf(TensorView tv) {
        try {
            return tv.doubleBufferAxis();
        } catch (IllegalStateException e) {
            throw new IdMappingException(Violation.MISSING_DOUBLE_BUFFER_AXIS, e.getMessage(), e);
        }
    }

    /**
     * True if {@code id} is registered in LOOP and shares its loop with a double-buffer axis.
     */
    public boolean isDoubleBufferedIterDomain(IterDomain id) {
        return graph.isRegistered(id, IdMappingMode.LOOP)
                && loopClasses.contains(graph.classKey(id, IdMappingMode.LOOP));
    }

    public boolean isEmpty() {
        return loopClasses.isEmpty();
    }
}
