package io.surfworks.warploop.ir;

import java.util.Objects;

/**
 * Symbolic extent of an iteration domain.
 *
 * <p>Extents are either compile-time constants, named symbols bound at launch
 * time (tensor sizes), or the result of the arithmetic introduced by splits
 * ({@code ceilDiv}) and merges ({@code *}).
 */
public sealed interface Extent permits Extent.Constant, Extent.Symbol, Extent.Binary {

    Extent ONE = new Constant(1);

    static Extent of(long value) {
        return value == 1 ? ONE : new Constant(value);
    }

    static Extent symbol(String name) {
        return new Symbol(name);
    }

    static Extent ceilDiv(Extent numerator, Extent denominator) {
        if (numerator instanceof Constant n && denominator instanceof Constant d) {
            return of((n.value() + d.value() - 1) / d.value());
        }
        return new Binary("ceilDiv", numerator, denominator);
    }

    static Extent mul(Extent lhs, Extent rhs) {
        if (lhs instanceof Constant l && rhs instanceof Constant r) {
            return of(l.value() * r.value());
        }
        if (lhs.isOne()) {
            return rhs;
        }
        if (rhs.isOne()) {
            return lhs;
        }
        return new Binary("*", lhs, rhs);
    }

    /**
     * True if this extent is the constant one.
     */
    default boolean isOne() {
        return this instanceof Constant c && c.value() == 1;
    }

    default boolean isConstant() {
        return this instanceof Constant;
    }

    record Constant(long value) implements Extent {
        public Constant {
            if (value < 1) {
                throw new IllegalArgumentException("Extent must be positive: " + value);
            }
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record Symbol(String name) implements Extent {
        public Symbol {
            Objects.requireNonNull(name, "name cannot be null");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Binary(String op, Extent lhs, Extent rhs) implements Extent {
        @Override
        public String toString() {
            if (op.equals("*")) {
                return "(" + lhs + " * " + rhs + ")";
            }
            return op + "(" + lhs + ", " + rhs + ")";
        }
    }
}
