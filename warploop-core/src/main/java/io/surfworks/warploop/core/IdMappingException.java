package io.surfworks.warploop.core;

/**
 * Thrown when the iteration-domain mapping finds its own invariants violated.
 *
 * <p>These failures are never caused by user input: they mean the operation graph
 * handed to the mapper is malformed, or an analysis is being queried for a domain it
 * never saw. Compilation cannot continue.
 *
 * <p>Example:
 * <pre>{@code
 * try {
 *     ConcreteResolver resolver = new ConcreteResolver(DomainGraph.build(fusion));
 * } catch (IdMappingException e) {
 *     if (e.getViolation() == IdMappingException.Violation.MULTI_OUTPUT_RANK_MISMATCH) {
 *         // the fusion has a multi-output operation with unequal output ranks
 *     }
 *     throw e;
 * }
 * }</pre>
 */
public class IdMappingException extends RuntimeException {

    /**
     * The invariant that was violated.
     */
    public enum Violation {
        /** Outputs of one multi-output operation have root domains of different rank. */
        MULTI_OUTPUT_RANK_MISMATCH,
        /** A producer and consumer root domain cannot be put in correspondence. */
        MISSING_ROOT_CORRESPONDENCE,
        /** An equivalence class has no members. */
        EMPTY_CLASS,
        /** No class member is free of consumers inside the class. */
        NO_TERMINAL_CANDIDATE,
        /** Candidates were found but none was selected. */
        NO_CONCRETE_ID,
        /** A loop concrete id does not cover every root of its class. */
        INCOMPLETE_LOOP_CONCRETE_ID,
        /** Two different non-serial parallel bindings in one loop class. */
        PARALLEL_TYPE_CONFLICT,
        /** The domain is not registered in the queried relation. */
        UNREGISTERED_DOMAIN,
        /** No concrete id was computed for the class. */
        MISSING_CONCRETE_ID,
        /** No index variable was allocated for the loop class. */
        MISSING_INDEX_VARIABLE,
        /** A compute-at position lies past the end of the tensor's leaf domain. */
        INVALID_COMPUTE_AT,
        /** A double-buffered tensor has no loop left of its compute-at position to buffer. */
        MISSING_DOUBLE_BUFFER_AXIS
    }

    private final Violation violation;

    public IdMappingException(Violation violation, String message) {
        super(violation + ": " + message);
        this.violation = violation;
    }

    public IdMappingException(Violation violation, String message, Throwable cause) {
        super(violation + ": " + message, cause);
        this.violation = violation;
    }

    public Violation getViolation() {
        return violation;
    }
}
