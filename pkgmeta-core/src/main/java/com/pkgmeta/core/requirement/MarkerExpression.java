package com.pkgmeta.core.requirement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Environment marker expression tree, e.g. {@code python_version < "3.8" and extra == "test"}.
 *
 * <p>Leaves are {@link Comparison} nodes over {@link Variable} and {@link Value}
 * operands; {@link And} and {@link Or} are the internal nodes.
 *
 * @see MarkerParser
 */
public interface MarkerExpression {

    /** Reserved variable naming an optional installation variant. */
    String EXTRA_VARIABLE = "extra";

    /**
     * Operand of a comparison.
     */
    interface Operand {
    }

    /**
     * Environment variable reference.
     *
     * @param name variable name, e.g. {@code python_version}
     */
    record Variable(String name) implements Operand {
        public Variable {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /**
     * Quoted literal.
     *
     * @param value literal text without quotes
     */
    record Value(String value) implements Operand {
        public Value {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /**
     * {@code left operator right} leaf.
     *
     * @param left left operand
     * @param operator comparison operator ({@code ==}, {@code in}, {@code not in}, ...)
     * @param right right operand
     */
    record Comparison(Operand left, String operator, Operand right) implements MarkerExpression {
        public Comparison {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        /**
         * Returns the literal compared for equality with a variable, in either order.
         *
         * @param variable variable name
         * @return literal value, or empty if this is not {@code variable == "literal"}
         */
        public Optional<String> equalityValueOf(String variable) {
            if (!"==".equals(operator)) {
                return Optional.empty();
            }
            if (left instanceof Variable var && var.name().equals(variable) && right instanceof Value val) {
                return Optional.of(val.value());
            }
            if (right instanceof Variable var && var.name().equals(variable) && left instanceof Value val) {
                return Optional.of(val.value());
            }
            return Optional.empty();
        }
    }

    /**
     * Conjunction.
     */
    record And(MarkerExpression left, MarkerExpression right) implements MarkerExpression {
        public And {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    /**
     * Disjunction.
     */
    record Or(MarkerExpression left, MarkerExpression right) implements MarkerExpression {
        public Or {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    /**
     * Lists every equality clause of the tree, left to right.
     *
     * @return {@code ==} comparisons in source order
     */
    default List<Comparison> equalityClauses() {
        List<Comparison> clauses = new ArrayList<>();
        collectEqualities(this, clauses);
        return clauses;
    }

    /**
     * Returns the value the tree binds the {@code extra} variable to, if any.
     *
     * @return first literal compared for equality with {@code extra}
     */
    default Optional<String> extra() {
        for (Comparison clause : equalityClauses()) {
            Optional<String> value = clause.equalityValueOf(EXTRA_VARIABLE);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private static void collectEqualities(MarkerExpression node, List<Comparison> clauses) {
        if (node instanceof Comparison comparison) {
            if ("==".equals(comparison.operator())) {
                clauses.add(comparison);
            }
        } else if (node instanceof And and) {
            collectEqualities(and.left(), clauses);
            collectEqualities(and.right(), clauses);
        } else if (node instanceof Or or) {
            collectEqualities(or.left(), clauses);
            collectEqualities(or.right(), clauses);
        }
    }
}
