package io.surfworks.warploop.core.graph;

/**
 * The three equivalence relations over iteration domains, strictest first.
 */
public enum IdMappingMode {
    /** Same extent; broadcast dimensions never equal non-broadcast ones. */
    EXACT,
    /** Broadcast dimensions may equal whatever they are broadcast against. */
    PERMISSIVE,
    /** Domains iterated by one physical loop in generated code. */
    LOOP
}
