package io.surfworks.warploop.ir;

/**
 * Iteration kind of an {@link IterDomain}.
 */
public enum IterType {
    /** Ordinary data-parallel dimension. */
    ITERATION("i"),
    /** Dimension reduced away by a reduction operation. */
    REDUCTION("r"),
    /** Size-one dimension that is implicitly expanded by consumers. */
    BROADCAST("b"),
    /** Gather-like dimension (windowed access into a producer). */
    GATHER("g");

    private final String prefix;

    IterType(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Single-letter prefix used when printing domains, e.g. {@code iS3{i0}}.
     */
    public String prefix() {
        return prefix;
    }
}
