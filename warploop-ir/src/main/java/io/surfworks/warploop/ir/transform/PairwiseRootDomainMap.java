package io.surfworks.warploop.ir.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.surfworks.warploop.ir.IterDomain;
import io.surfworks.warploop.ir.TensorDomain;
import io.surfworks.warploop.ir.TensorOp;
import io.surfworks.warploop.ir.TensorView;

/**
 * Root-domain correspondence between a producer and one of its direct consumers.
 *
 * <p>The producer's maybe-rfactor domain, with reductions removed, is paired
 * position by position with the consumer's root domain. Consumer dimensions that a
 * broadcast operation introduced have no producer counterpart and are skipped.
 *
 * <p>In exact mode a broadcast dimension is only paired with another broadcast
 * dimension; mismatched pairs are consumed without being recorded. In permissive
 * mode a broadcast pairs with whatever sits at its position.
 */
public final class PairwiseRootDomainMap {

    private final TensorView producer;
    private final TensorView consumer;
    private final boolean exact;
    private Map<IterDomain, IterDomain> consumerToProducer;

    public PairwiseRootDomainMap(TensorView producer, TensorView consumer) {
        this(producer, consumer, false);
    }

    public PairwiseRootDomainMap(TensorView producer, TensorView consumer, boolean exact) {
        this.producer = producer;
        this.consumer = consumer;
        this.exact = exact;
    }

    public TensorView producer() {
        return producer;
    }

    public TensorView consumer() {
        return consumer;
    }

    public boolean isExact() {
        return exact;
    }

    /**
     * Maps consumer root domains to producer maybe-rfactor domains.
     *
     * @throws IllegalArgumentException if the consumer is not defined by an operation
     *         consuming the producer, or the two sides do not line up
     */
    public Map<IterDomain, IterDomain> mapConsumerToProducer() {
        if (consumerToProducer == null) {
            consumerToProducer = Collections.unmodifiableMap(build());
        }
        return consumerToProducer;
    }

    /**
     * Inverse of {@link #mapConsumerToProducer()}.
     */
    public Map<IterDomain, IterDomain> mapProducerToConsumer() {
        Map<IterDomain, IterDomain> inverse = new LinkedHashMap<>();
        mapConsumerToProducer().forEach((c, p) -> inverse.put(p, c));
        return inverse;
    }

    private Map<IterDomain, IterDomain> build() {
        TensorOp def = consumer.definition();
        if (def == null || !def.inputs().contains(producer)) {
            throw new IllegalArgumentException(String.format(
                    "%s is not a direct consumer of %s", consumer.name(), producer.name()));
        }

        List<IterDomain> producerRoot = TensorDomain.noReductions(producer.maybeRFactorDomain());
        List<IterDomain> consumerRoot = consumer.rootDomain();
        List<Boolean> broadcastFlags = def instanceof TensorOp.BroadcastOp b ? b.flags() : List.of();

        Map<IterDomain, IterDomain> map = new LinkedHashMap<>();
        int itc = 0;
        int itp = 0;
        while (itc < consumerRoot.size() && itp < producerRoot.size()) {
            IterDomain producerId = producerRoot.get(itp);
            IterDomain consumerId = consumerRoot.get(itc);

            // A new broadcast dimension has no producer counterpart
            if (!broadcastFlags.isEmpty() && broadcastFlags.get(itc)) {
                itc++;
                continue;
            }

            if (exact && producerId.isBroadcast() != consumerId.isBroadcast()) {
                itc++;
                itp++;
                continue;
            }

            map.put(consumerId, producerId);
            itc++;
            itp++;
        }

        // Trailing new broadcasts are fine; anything else means the ranks disagree
        while (itc < consumerRoot.size() && !broadcastFlags.isEmpty() && broadcastFlags.get(itc)) {
            itc++;
        }
        if (itc != consumerRoot.size() || itp != producerRoot.size()) {
            throw new IllegalArgumentException(String.format(
                    "Root domains of %s and %s do not line up: %s vs %s",
                    producer.name(), consumer.name(), producerRoot, consumerRoot));
        }
        return map;
    }

    @Override
    public String toString() {
        return String.format("PairwiseRootDomainMap[%s -> %s, exact=%s]", producer.name(), consumer.name(), exact);
    }
}
