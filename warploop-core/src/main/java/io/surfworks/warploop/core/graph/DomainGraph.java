package io.surfworks.warploop.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.warploop.core.IdMappingException;
import io.surfworks.warploop.core.IdMappingException.Violation;
import io.surfworks.warploop.ir.Fusion;
import io.surfworks.warploop.ir.IterDomain;
import io.surfworks.warploop.ir.TensorOp;
import io.surfworks.warploop.ir.TensorView;
import io.surfworks.warploop.ir.transform.BestEffortReplay;
import io.surfworks.warploop.ir.transform.PairwiseRootDomainMap;
import io.surfworks.warploop.ir.transform.TransformHistory;

/**
 * The EXACT, PERMISSIVE and LOOP equivalence relations over every iteration domain
 * of a fusion, plus the producer/consumer and sibling adjacency they were built from.
 *
 * <p>DomainGraph registers every domain between each tensor's root and leaf domain,
 * then walks the operations. For every producer/consumer pair the root
 * correspondence is replayed through the consumer's transform history and the
 * matched pairs are unioned:
 * <ul>
 *   <li>EXACT: pairs from the exact (broadcast-to-broadcast only) replay</li>
 *   <li>PERMISSIVE: pairs from the forwarding replay plus the raw root pairs</li>
 *   <li>LOOP: forwarding-replay pairs whose producer domain lies left of the
 *       producer's compute-at position</li>
 * </ul>
 * Outputs of a multi-output operation are mapped to the first output in all three
 * relations and recorded as siblings.
 *
 * <p>The graph is frozen after construction; every query is read-only.
 *
 * <p>Example:
 * <pre>{@code
 * DomainGraph graph = DomainGraph.build(fusion);
 *
 * boolean sameLoop = graph.areMapped(tv1.axis(0), tv2.axis(0), IdMappingMode.LOOP);
 * IdGroup exactClass = graph.disjointSetOf(tv2.axis(1), IdMappingMode.EXACT);
 * List<IterDomain> producers = graph.producersOf(tv2.axis(0));
 * }</pre>
 */
public final class DomainGraph {

    private static final Logger LOG = Logger.getLogger(DomainGraph.class.getName());

    private final Fusion fusion;
    private final EnumMap<IdMappingMode, DisjointSets> nodes = new EnumMap<>(IdMappingMode.class);
    private final DisjointSets siblingSets;
    private final List<Set<Integer>> consumers;
    private final List<Set<Integer>> producers;
    private final Set<Integer> viewRfactorIds = new LinkedHashSet<>();
    private final List<Integer> allIds = new ArrayList<>();
    private final EnumMap<IdMappingMode, Map<Integer, IdGroup>> groups = new EnumMap<>(IdMappingMode.class);

    private DomainGraph(Fusion fusion) {
        this.fusion = fusion;
        int handles = fusion.iterDomainCount();
        for (IdMappingMode mode : IdMappingMode.values()) {
            nodes.put(mode, new DisjointSets(handles));
        }
        this.siblingSets = new DisjointSets(handles);
        this.consumers = new ArrayList<>(Collections.nCopies(handles, null));
        this.producers = new ArrayList<>(Collections.nCopies(handles, null));
    }

    /**
     * Builds and freezes the graph for a fusion.
     *
     * @param fusion the fusion to analyze
     * @return the frozen graph
     * @throws IdMappingException if the fusion is malformed
     */
    public static DomainGraph build(Fusion fusion) {
        DomainGraph graph = new DomainGraph(fusion);
        for (TensorView tv : fusion.allTensorViews()) {
            graph.initializeTensor(tv);
        }
        for (TensorOp op : fusion.operations()) {
            graph.mapOperation(op);
        }
        graph.freeze();
        LOG.fine(() -> "Built " + graph);
        return graph;
    }

    // ==================== Construction ====================

    private void initializeTensor(TensorView tv) {
        List<IterDomain> leaf = tv.leafDomain();
        boolean viewLike = tv.domain().hasViewLikeRFactor();
        for (IterDomain id : TransformHistory.idsBetween(tv.rootDomain(), leaf)) {
            boolean viewRfactor = viewLike && id.isRFactorProduct() && tv.maybeRFactorDomain().contains(id);
            initializeId(id, viewRfactor, leaf.contains(id));
        }
    }

    private void initializeId(IterDomain id, boolean viewRfactor, boolean leaf) {
        int h = id.handle();
        nodes.get(IdMappingMode.PERMISSIVE).initialize(h);
        nodes.get(IdMappingMode.EXACT).initialize(h);
        if (leaf) {
            nodes.get(IdMappingMode.LOOP).initialize(h);
        }
        siblingSets.initialize(h);
        if (consumers.get(h) == null) {
            consumers.set(h, new LinkedHashSet<>());
            producers.set(h, new LinkedHashSet<>());
            allIds.add(h);
        }
        if (viewRfactor) {
            viewRfactorIds.add(h);
        }
    }

    private void mapOperation(TensorOp op) {
        TensorView first = null;
        for (TensorView consumer : op.outputs()) {
            if (first == null) {
                first = consumer;
            } else {
                mapSiblings(op, first, consumer);
            }
            for (TensorView producer : op.inputs()) {
                mapProducerConsumer(producer, consumer);
            }
        }
    }

    /**
     * Outputs of one operation share their loops, so every replayed pair is mapped,
     * including LOOP for leaves of the first output regardless of compute-at.
     */
    private void mapSiblings(TensorOp op, TensorView first, TensorView other) {
        List<IterDomain> firstRoot = first.rootDomain();
        List<IterDomain> otherRoot = other.rootDomain();
        if (firstRoot.size() != otherRoot.size()) {
            throw new IdMappingException(Violation.MULTI_OUTPUT_RANK_MISMATCH, String.format(
                    "outputs %s (rank %d) and %s (rank %d) of %s must have identical root domains",
                    first.name(), firstRoot.size(), other.name(), otherRoot.size(), op.opName()));
        }
        Map<IterDomain, IterDomain> otherToFirstRoot = new LinkedHashMap<>();
        for (int i = 0; i < firstRoot.size(); i++) {
            otherToFirstRoot.put(otherRoot.get(i), firstRoot.get(i));
        }
        Map<IterDomain, IterDomain> otherToFirst =
                new BestEffortReplay(first.leafDomain(), other.leafDomain(), otherToFirstRoot).getReplay();

        for (Map.Entry<IterDomain, IterDomain> entry : otherToFirst.entrySet()) {
            int o = entry.getKey().handle();
            int f = entry.getValue().handle();
            nodes.get(IdMappingMode.PERMISSIVE).union(f, o);
            nodes.get(IdMappingMode.EXACT).union(f, o);
            if (first.leafDomain().contains(entry.getValue())) {
                nodes.get(IdMappingMode.LOOP).union(f, o);
            }
            siblingSets.union(f, o);
        }
    }

    private void mapProducerConsumer(TensorView producer, TensorView consumer) {
        PairwiseRootDomainMap permissiveRootMap = new PairwiseRootDomainMap(producer, consumer);
        Map<IterDomain, IterDomain> permissiveRoots;
        Map<IterDomain, IterDomain> exactRoots;
        try {
            permissiveRoots = permissiveRootMap.mapConsumerToProducer();
            exactRoots = new PairwiseRootDomainMap(producer, consumer, true).mapConsumerToProducer();
        } catch (IllegalArgumentException e) {
            throw new IdMappingException(Violation.MISSING_ROOT_CORRESPONDENCE, e.getMessage(), e);
        }

        // Replay producer as consumer: the consumer may have merged in broadcasts the
        // producer lacks, which only this direction can forward through
        Map<IterDomain, IterDomain> permissiveReplay =
                BestEffortReplay.replayProducerAsConsumer(producer, consumer, permissiveRootMap).getReplay();
        Map<IterDomain, IterDomain> exactReplay =
                new BestEffortReplay(producer.leafDomain(), consumer.leafDomain(), exactRoots).getReplay();

        if (producer.computeAtPosition() > producer.nDims()) {
            throw new IdMappingException(Violation.INVALID_COMPUTE_AT, String.format(
                    "%s is computed at %d but has only %d leaf dims",
                    producer.name(), producer.computeAtPosition(), producer.nDims()));
        }
        List<IterDomain> sharedLeaves = producer.leafDomain().subList(0, producer.computeAtPosition());

        for (Map.Entry<IterDomain, IterDomain> entry : exactReplay.entrySet()) {
            nodes.get(IdMappingMode.EXACT).union(entry.getKey().handle(), entry.getValue().handle());
            recordAdjacency(entry.getKey(), entry.getValue());
        }

        for (Map.Entry<IterDomain, IterDomain> entry : permissiveReplay.entrySet()) {
            int c = entry.getKey().handle();
            int p = entry.getValue().handle();
            if (sharedLeaves.contains(entry.getValue())) {
                nodes.get(IdMappingMode.LOOP).union(c, p);
            }
            nodes.get(IdMappingMode.PERMISSIVE).union(c, p);
            recordAdjacency(entry.getKey(), entry.getValue());
        }

        // Forwarding can skip root pairs; map them directly
        for (Map.Entry<IterDomain, IterDomain> entry : permissiveRoots.entrySet()) {
            nodes.get(IdMappingMode.PERMISSIVE).union(entry.getKey().handle(), entry.getValue().handle());
            recordAdjacency(entry.getKey(), entry.getValue());
        }
    }

    private void recordAdjacency(IterDomain consumerId, IterDomain producerId) {
        Set<Integer> consumersOfProducer = consumers.get(checkRegistered(producerId));
        Set<Integer> producersOfConsumer = producers.get(checkRegistered(consumerId));
        consumersOfProducer.add(consumerId.handle());
        producersOfConsumer.add(producerId.handle());
    }

    private int checkRegistered(IterDomain id) {
        int h = id.handle();
        if (h >= consumers.size() || consumers.get(h) == null) {
            throw new IdMappingException(Violation.UNREGISTERED_DOMAIN,
                    id + " was never registered in the domain graph");
        }
        return h;
    }

    private void freeze() {
        for (IdMappingMode mode : IdMappingMode.values()) {
            DisjointSets sets = nodes.get(mode);
            sets.freeze();
            Map<Integer, IdGroup> byKey = new LinkedHashMap<>();
            for (int root : sets.classRoots()) {
                byKey.put(root, new IdGroup(mode, root, toDomains(sets.members(root))));
            }
            groups.put(mode, byKey);
        }
        siblingSets.freeze();
    }

    // ==================== Queries ====================

    public Fusion fusion() {
        return fusion;
    }

    public boolean isRegistered(IterDomain id, IdMappingMode mode) {
        return nodes.get(mode).contains(id.handle());
    }

    /**
     * True if both domains are in the same class of {@code mode}.
     *
     * @throws IdMappingException if {@code a} is not registered under {@code mode}
     */
    public boolean areMapped(IterDomain a, IterDomain b, IdMappingMode mode) {
        int classKey = classKey(a, mode);
        DisjointSets sets = nodes.get(mode);
        return sets.contains(b.handle()) && sets.find(b.handle()) == classKey;
    }

    /**
     * Stable key of the class containing {@code id}.
     *
     * @throws IdMappingException if {@code id} is not registered under {@code mode}
     */
    public int classKey(IterDomain id, IdMappingMode mode) {
        DisjointSets sets = nodes.get(mode);
        if (!sets.contains(id.handle())) {
            throw new IdMappingException(Violation.UNREGISTERED_DOMAIN,
                    id + " is not registered in the " + mode + " map");
        }
        return sets.find(id.handle());
    }

    /**
     * Returns the class of {@code mode} containing {@code id}.
     *
     * @throws IdMappingException if {@code id} is not registered under {@code mode}
     */
    public IdGroup disjointSetOf(IterDomain id, IdMappingMode mode) {
        return groups.get(mode).get(classKey(id, mode));
    }

    /**
     * Returns every class of {@code mode}, ordered by each class's smallest handle.
     */
    public List<IdGroup> disjointSets(IdMappingMode mode) {
        return List.copyOf(groups.get(mode).values());
    }

    public List<IterDomain> consumersOf(IterDomain id) {
        return toDomains(consumers.get(checkRegistered(id)));
    }

    public List<IterDomain> producersOf(IterDomain id) {
        return toDomains(producers.get(checkRegistered(id)));
    }

    /**
     * Returns the sibling class of {@code id}; a domain with no siblings is alone in it.
     */
    public List<IterDomain> siblingsOf(IterDomain id) {
        checkRegistered(id);
        return toDomains(siblingSets.members(id.handle()));
    }

    public boolean areSiblings(IterDomain a, IterDomain b) {
        return siblingSets.areMapped(a.handle(), b.handle());
    }

    /**
     * Sibling classes with more than one member.
     */
    public List<List<IterDomain>> siblingGroups() {
        List<List<IterDomain>> result = new ArrayList<>();
        for (int root : siblingSets.classRoots()) {
            List<Integer> members = siblingSets.members(root);
            if (members.size() > 1) {
                result.add(toDomains(members));
            }
        }
        return result;
    }

    public boolean isViewRfactor(IterDomain id) {
        return viewRfactorIds.contains(id.handle());
    }

    public List<IterDomain> viewRfactorIds() {
        return toDomains(viewRfactorIds);
    }

    /**
     * Every registered domain, in registration order.
     */
    public List<IterDomain> allIds() {
        return toDomains(allIds);
    }

    private List<IterDomain> toDomains(Iterable<Integer> handles) {
        List<IterDomain> ids = new ArrayList<>();
        for (int h : handles) {
            ids.add(fusion.iterDomain(h));
        }
        return Collections.unmodifiableList(ids);
    }

    @Override
    public String toString() {
        return String.format("DomainGraph[ids=%d, exact=%d, permissive=%d, loop=%d, viewRfactor=%d]",
                allIds.size(),
                nodes.get(IdMappingMode.EXACT).classCount(),
                nodes.get(IdMappingMode.PERMISSIVE).classCount(),
                nodes.get(IdMappingMode.LOOP).classCount(),
                viewRfactorIds.size());
    }
}
