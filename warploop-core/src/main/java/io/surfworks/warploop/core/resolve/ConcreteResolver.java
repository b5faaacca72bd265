package io.surfworks.warploop.core.resolve;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.warploop.core.IdMappingException;
import io.surfworks.warploop.core.IdMappingException.Violation;
import io.surfworks.warploop.core.LoopMapConfig;
import io.surfworks.warploop.core.graph.DomainGraph;
import io.surfworks.warploop.core.graph.IdGroup;
import io.surfworks.warploop.core.graph.IdMappingMode;
import io.surfworks.warploop.ir.Fusion;
import io.surfworks.warploop.ir.IterDomain;
import io.surfworks.warploop.ir.IterDomainTransform;
import io.surfworks.warploop.ir.ParallelType;

/**
 * Picks one representative (concrete) domain per class of every relation of a
 * {@link DomainGraph}, and assigns loop index variables to LOOP classes.
 *
 * <p>The concrete domain of a class is the one whose extent stands for the whole
 * class in generated code, so it must derive from every real dimension that
 * contributes to the class. Candidates are the class members with no consumer in the
 * same class. Each candidate is traced back through its split/merge history to its
 * roots (view-rfactor domains end the trace early) and scored by its count of
 * iteration roots, then by its count of broadcast or trivial-reduction roots. The
 * first candidate with the highest score wins.
 *
 * <p>LOOP concrete domains are additionally validated: every root reachable from
 * any candidate must be covered by the chosen domain's roots, compared through their
 * EXACT concrete domains.
 *
 * <p>Typical lowering sequence:
 * <pre>{@code
 * ConcreteResolver resolver = ConcreteResolver.build(fusion);
 * resolver.validateAndPropagatePType();
 * resolver.allocateIndexVariables();
 *
 * IterDomain loopExtentSource = resolver.getConcreteMappedID(tv.axis(0), IdMappingMode.LOOP);
 * IndexVariable index = resolver.getIndexVariable(tv.axis(0));
 * }</pre>
 */
public final class ConcreteResolver {

    private static final Logger LOG = Logger.getLogger(ConcreteResolver.class.getName());

    private final DomainGraph graph;
    private final HaloInfo haloInfo;
    private final TrivialReductionInfo trivialReductionInfo;
    private final DoubleBufferInfo doubleBufferInfo;
    private final EnumMap<IdMappingMode, Map<Integer, IterDomain>> concreteIds = new EnumMap<>(IdMappingMode.class);
    private final Map<Integer, IndexVariable> loopIndexVariables = new LinkedHashMap<>();
    private final Map<Integer, Map<DoubleBufferLoopStage, IndexVariable>> doubleBufferedIndexVariables =
            new LinkedHashMap<>();
    private int nextLoopIndex;

    public ConcreteResolver(DomainGraph graph) {
        this(graph, HaloInfo.none());
    }

    /**
     * Resolves concrete domains for every class of {@code graph}.
     *
     * @throws IdMappingException if a class has no valid concrete domain
     */
    public ConcreteResolver(DomainGraph graph, HaloInfo haloInfo) {
        this.graph = graph;
        this.haloInfo = haloInfo;
        this.trivialReductionInfo = TrivialReductionInfo.build(graph.allIds());
        this.doubleBufferInfo = DoubleBufferInfo.build(graph);
        buildConcreteIds();

        LOG.fine(() -> String.format("Resolved concrete ids: permissive=%d, exact=%d, loop=%d",
                concreteIds.get(IdMappingMode.PERMISSIVE).size(),
                concreteIds.get(IdMappingMode.EXACT).size(),
                concreteIds.get(IdMappingMode.LOOP).size()));
        if (LoopMapConfig.isDumpEnabled()) {
            LOG.info(ComputeAtMapPrinter.print(this, LoopMapConfig.getDumpFormat()));
        }
    }

    /**
     * Builds the domain graph of {@code fusion} and resolves it.
     */
    public static ConcreteResolver build(Fusion fusion) {
        return new ConcreteResolver(DomainGraph.build(fusion));
    }

    public DomainGraph idGraph() {
        return graph;
    }

    public TrivialReductionInfo trivialReductionInfo() {
        return trivialReductionInfo;
    }

    public DoubleBufferInfo doubleBufferInfo() {
        return doubleBufferInfo;
    }

    // ==================== Concrete IDs ====================

    // LOOP validation reads EXACT concrete ids, so EXACT must be resolved first
    private void buildConcreteIds() {
        for (IdMappingMode mode : List.of(IdMappingMode.PERMISSIVE, IdMappingMode.EXACT, IdMappingMode.LOOP)) {
            Map<Integer, IterDomain> cache = new HashMap<>();
            concreteIds.put(mode, cache);
            for (IdGroup group : graph.disjointSets(mode)) {
                if (group.size() == 0) {
                    throw new IdMappingException(Violation.EMPTY_CLASS,
                            "empty " + mode + " class with key " + group.key());
                }
                cache.put(group.key(), computeConcreteId(group.front(), mode));
            }
        }
    }

    /**
     * Computes the concrete domain of the class of {@code mode} containing {@code id}.
     *
     * <p>Uses cached EXACT concrete domains when {@code mode} is LOOP. Prefer
     * {@link #getConcreteMappedID} once the resolver is built.
     *
     * @throws IdMappingException if no valid concrete domain exists
     */
    public IterDomain computeConcreteId(IterDomain id, IdMappingMode mode) {
        IdGroup group = graph.disjointSetOf(id, mode);
        if (group.size() == 0) {
            throw new IdMappingException(Violation.EMPTY_CLASS, "empty " + mode + " class for " + id);
        }
        if (group.size() == 1) {
            return group.front();
        }

        // A member whose consumers all fall outside the class sees the whole class
        List<IterDomain> candidates = new ArrayList<>();
        for (IterDomain member : group.members()) {
            boolean terminal = true;
            for (IterDomain consumer : graph.consumersOf(member)) {
                if (graph.areMapped(member, consumer, mode)) {
                    terminal = false;
                    break;
                }
            }
            if (terminal) {
                candidates.add(member);
            }
        }
        if (candidates.isEmpty()) {
            throw new IdMappingException(Violation.NO_TERMINAL_CANDIDATE,
                    "no potential concrete id found in " + group);
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }

        IterDomain concrete = null;
        int maxIterRoots = 0;
        int maxBroadcastRoots = 0;

        // LOOP bookkeeping, all keyed by EXACT concrete id of the root
        Set<IterDomain> rootsOfAllCandidates = new LinkedHashSet<>();
        Set<IterDomain> rootsOfConcrete = new LinkedHashSet<>();
        Map<IterDomain, List<IterDomain>> rootToCandidates = new HashMap<>();

        for (IterDomain candidate : candidates) {
            Set<IterDomain> roots = traceRoots(candidate);

            if (mode == IdMappingMode.LOOP) {
                for (IterDomain root : roots) {
                    IterDomain exactRoot = getConcreteMappedID(root, IdMappingMode.EXACT);
                    rootsOfAllCandidates.add(exactRoot);
                    rootToCandidates.computeIfAbsent(exactRoot, k -> new ArrayList<>()).add(candidate);
                }
            }

            int broadcastRoots = 0;
            for (IterDomain root : roots) {
                if (isBroadcastLike(root)) {
                    broadcastRoots++;
                }
            }
            int iterRoots = roots.size() - broadcastRoots;
            if (iterRoots > maxIterRoots
                    || (iterRoots == maxIterRoots && broadcastRoots > maxBroadcastRoots)) {
                maxIterRoots = iterRoots;
                maxBroadcastRoots = broadcastRoots;
                concrete = candidate;
                if (mode == IdMappingMode.LOOP) {
                    rootsOfConcrete.clear();
                    for (IterDomain root : roots) {
                        rootsOfConcrete.add(getConcreteMappedID(root, IdMappingMode.EXACT));
                    }
                }
            }
        }

        if (concrete == null) {
            throw new IdMappingException(Violation.NO_CONCRETE_ID,
                    "could not find a concrete id among " + candidates + " of " + group);
        }
        if (mode == IdMappingMode.LOOP) {
            validateLoopCompleteness(concrete, group, candidates,
                    rootsOfAllCandidates, rootsOfConcrete, rootToCandidates);
        }
        return concrete;
    }

    /**
     * Returns the domains {@code id} derives from through split/merge history.
     * View-rfactor domains count as roots.
     */
    Set<IterDomain> traceRoots(IterDomain id) {
        Set<IterDomain> roots = new LinkedHashSet<>();
        Deque<IterDomain> toVisit = new ArrayDeque<>();
        toVisit.add(id);
        while (!toVisit.isEmpty()) {
            IterDomain current = toVisit.poll();
            if (graph.isViewRfactor(current)) {
                roots.add(current);
                continue;
            }
            IterDomainTransform def = current.definition();
            if (def == null) {
                roots.add(current);
            } else {
                toVisit.addAll(def.inputs());
            }
        }
        return roots;
    }

    private boolean isBroadcastLike(IterDomain id) {
        return id.isBroadcast() || trivialReductionInfo.isDerived(id);
    }

    /**
     * A root missing from the concrete id is tolerated when it is broadcast-like and
     * permissively mapped to a covered iteration root, or when every candidate that
     * reaches it is exactly mapped to the concrete id.
     */
    private void validateLoopCompleteness(IterDomain concrete, IdGroup group, List<IterDomain> candidates,
                                          Set<IterDomain> rootsOfAllCandidates, Set<IterDomain> rootsOfConcrete,
                                          Map<IterDomain, List<IterDomain>> rootToCandidates) {
        List<IterDomain> missing = new ArrayList<>();
        for (IterDomain root : rootsOfAllCandidates) {
            if (rootsOfConcrete.contains(root)) {
                continue;
            }
            if (isBroadcastLike(root) && coveredByIterationRoot(root, rootsOfConcrete)) {
                continue;
            }
            boolean allExact = true;
            for (IterDomain candidate : rootToCandidates.get(root)) {
                if (!graph.areMapped(concrete, candidate, IdMappingMode.EXACT)) {
                    allExact = false;
                    break;
                }
            }
            if (allExact) {
                continue;
            }
            missing.add(root);
        }
        if (!missing.isEmpty()) {
            throw new IdMappingException(Violation.INCOMPLETE_LOOP_CONCRETE_ID, String.format(
                    "concrete id %s failed to cover all root ids. IDs: %s, maybe concrete IDs: %s, "
                            + "all root IDs: %s, root IDs not found with concrete ID: %s",
                    concrete, group.members(), candidates, rootsOfAllCandidates, missing));
        }
    }

    private boolean coveredByIterationRoot(IterDomain root, Set<IterDomain> rootsOfConcrete) {
        for (IterDomain covered : rootsOfConcrete) {
            if (!isBroadcastLike(covered) && graph.areMapped(root, covered, IdMappingMode.PERMISSIVE)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the cached concrete domain of the class of {@code mode} containing {@code id}.
     *
     * @throws IdMappingException if {@code id} is not registered under {@code mode}
     */
    public IterDomain getConcreteMappedID(IterDomain id, IdMappingMode mode) {
        int key = graph.classKey(id, mode);
        Map<Integer, IterDomain> cache = concreteIds.get(mode);
        IterDomain concrete = cache == null ? null : cache.get(key);
        if (concrete == null) {
            throw new IdMappingException(Violation.MISSING_CONCRETE_ID,
                    "no " + mode + " concrete id computed for " + id);
        }
        return concrete;
    }

    /**
     * True if {@code a} and {@code b} are in the same class of {@code mode}.
     *
     * @throws IdMappingException if {@code a} is not registered under {@code mode}
     */
    public boolean areMapped(IterDomain a, IterDomain b, IdMappingMode mode) {
        return graph.areMapped(a, b, mode);
    }

    public boolean isViewRfactor(IterDomain id) {
        return graph.isViewRfactor(id);
    }

    /**
     * Returns the view-rfactor members of the class of {@code mode} containing {@code id}.
     */
    public List<IterDomain> getViewRfactorDomainsOfIdGroup(IterDomain id, IdMappingMode mode) {
        List<IterDomain> rfactorIds = new ArrayList<>();
        for (IterDomain member : graph.disjointSetOf(id, mode).members()) {
            if (graph.isViewRfactor(member)) {
                rfactorIds.add(member);
            }
        }
        return rfactorIds;
    }

    // ==================== Parallel Types ====================

    /**
     * Checks that every LOOP class carries at most one non-serial binding and applies
     * that binding to every member of the class.
     *
     * @throws IdMappingException if a LOOP class has two different non-serial bindings
     */
    public void validateAndPropagatePType() {
        for (IdGroup group : graph.disjointSets(IdMappingMode.LOOP)) {
            ParallelType common = ParallelType.SERIAL;
            for (IterDomain id : group.members()) {
                ParallelType ptype = id.parallelType();
                if (ptype != common && ptype != ParallelType.SERIAL && common != ParallelType.SERIAL) {
                    throw new IdMappingException(Violation.PARALLEL_TYPE_CONFLICT, String.format(
                            "loop class %s is bound to %s but %s is bound to %s",
                            group.members(), common, id, ptype));
                }
                if (common == ParallelType.SERIAL) {
                    common = ptype;
                }
            }
            if (common == ParallelType.SERIAL) {
                continue;
            }
            for (IterDomain id : group.members()) {
                id.parallelize(common);
            }
        }
    }

    // ==================== Index Variables ====================

    /**
     * Assigns an index variable to every LOOP class. Calling it again discards the
     * previous assignment and restarts loop index numbering.
     */
    public void allocateIndexVariables() {
        loopIndexVariables.clear();
        doubleBufferedIndexVariables.clear();
        nextLoopIndex = 0;

        for (IdGroup group : graph.disjointSets(IdMappingMode.LOOP)) {
            // Parallel loops are realized by the hardware index
            ParallelType ptype = null;
            for (IterDomain id : group.members()) {
                if (id.isThread() && !haloInfo.hasHaloExtent(id)) {
                    ptype = id.parallelType();
                    break;
                }
            }
            if (ptype != null) {
                loopIndexVariables.put(group.key(), new IndexVariable.ParallelIndex(ptype));
                continue;
            }

            if (group.members().stream().allMatch(IterDomain::isBroadcast)) {
                loopIndexVariables.put(group.key(), IndexVariable.Zero.INSTANCE);
                continue;
            }

            IterDomain concrete = concreteIds.get(IdMappingMode.LOOP).get(group.key());
            if (concrete == null) {
                throw new IdMappingException(Violation.MISSING_CONCRETE_ID,
                        "concrete id not computed for loop class " + group.members());
            }
            if (doubleBufferInfo.isDoubleBufferedIterDomain(concrete)) {
                Map<DoubleBufferLoopStage, IndexVariable> stages = new EnumMap<>(DoubleBufferLoopStage.class);
                stages.put(DoubleBufferLoopStage.PROLOGUE, freshLoopIndex());
                stages.put(DoubleBufferLoopStage.MAIN, freshLoopIndex());
                stages.put(DoubleBufferLoopStage.EPILOGUE, freshLoopIndex());
                doubleBufferedIndexVariables.put(group.key(), Collections.unmodifiableMap(stages));
            } else {
                loopIndexVariables.put(group.key(), freshLoopIndex());
            }
        }
        LOG.fine(() -> String.format("Allocated index variables for %d loop classes, %d double buffered",
                loopIndexVariables.size() + doubleBufferedIndexVariables.size(),
                doubleBufferedIndexVariables.size()));
    }

    private IndexVariable freshLoopIndex() {
        return new IndexVariable.LoopIndex(nextLoopIndex++);
    }

    public IndexVariable getIndexVariable(IterDomain id) {
        return getIndexVariable(id, DoubleBufferLoopStage.NOT_APPLICABLE);
    }

    /**
     * Returns the index variable of the LOOP class containing {@code id}.
     *
     * <p>Double-buffered classes have one index per stage. Stages are assigned after
     * loop nests are lowered, so {@link DoubleBufferLoopStage#NOT_APPLICABLE} resolves
     * to the main loop's index.
     *
     * @throws IdMappingException if {@code id} is not in the LOOP relation, or
     *         {@link #allocateIndexVariables()} has not run
     */
    public IndexVariable getIndexVariable(IterDomain id, DoubleBufferLoopStage stage) {
        if (!graph.isRegistered(id, IdMappingMode.LOOP)) {
            throw new IdMappingException(Violation.UNREGISTERED_DOMAIN,
                    "no index variable allocated as " + id + " is not registered in loop map");
        }
        int key = graph.classKey(id, IdMappingMode.LOOP);

        Map<DoubleBufferLoopStage, IndexVariable> stages = doubleBufferedIndexVariables.get(key);
        if (stages != null) {
            DoubleBufferLoopStage effective =
                    stage == DoubleBufferLoopStage.NOT_APPLICABLE ? DoubleBufferLoopStage.MAIN : stage;
            return stages.get(effective);
        }

        IndexVariable variable = loopIndexVariables.get(key);
        if (variable == null) {
            throw new IdMappingException(Violation.MISSING_INDEX_VARIABLE,
                    "no index variable allocated for loop class of " + id);
        }
        return variable;
    }

    /**
     * True if {@link #allocateIndexVariables()} produced a stage triple for the LOOP class of {@code id}.
     */
    public boolean hasDoubleBufferedIndices(IterDomain id) {
        return doubleBufferedIndexVariables.containsKey(graph.classKey(id, IdMappingMode.LOOP));
    }

    @Override
    public String toString() {
        return ComputeAtMapPrinter.print(this, LoopMapConfig.DumpFormat.TEXT);
    }
}
