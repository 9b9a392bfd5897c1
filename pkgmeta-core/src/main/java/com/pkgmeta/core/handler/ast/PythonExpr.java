package com.pkgmeta.core.handler.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expression nodes for the literal subset of Python that {@code setup.py}
 * readers care about.
 *
 * <p>Only calls, string literals and list/tuple/set/dict displays are modelled.
 * Everything else (names, numbers, attribute access, operators, f-strings,
 * bytes) becomes an {@link Opaque} node that is never evaluated.
 *
 * @see com.pkgmeta.core.handler.impl.util.SetupPyAstParser
 */
public final class PythonExpr {

    private PythonExpr() {
        // Utility class - no instantiation
    }

    /**
     * Any expression node.
     */
    public interface Node {
    }

    /**
     * Kind of a bracketed sequence display.
     */
    public enum SequenceKind {
        LIST, TUPLE, SET
    }

    /**
     * String literal, with adjacent literals already concatenated.
     *
     * @param value decoded text
     */
    public record Str(String value) implements Node {
        public Str {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /**
     * {@code [a, b]}, {@code (a, b)} or {@code {a, b}}.
     *
     * @param kind display kind
     * @param elements element nodes in source order
     */
    public record Sequence(SequenceKind kind, List<Node> elements) implements Node {
        public Sequence {
            Objects.requireNonNull(kind, "kind must not be null");
            elements = elements != null ? List.copyOf(elements) : List.of();
        }
    }

    /**
     * One {@code key: value} pair of a dict display.
     *
     * @param key key node
     * @param value value node
     */
    public record DictEntry(Node key, Node value) {
        public DictEntry {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /**
     * {@code {k: v, ...}}.
     *
     * @param entries entries in source order
     */
    public record Dict(List<DictEntry> entries) implements Node {
        public Dict {
            entries = entries != null ? List.copyOf(entries) : List.of();
        }
    }

    /**
     * Function call.
     *
     * @param function dotted callee name, e.g. {@code setuptools.setup}
     * @param arguments positional arguments
     * @param keywords keyword arguments in source order; {@code **expr} is stored under {@code "**"}
     */
    public record Call(String function, List<Node> arguments, Map<String, Node> keywords) implements Node {
        public Call {
            Objects.requireNonNull(function, "function must not be null");
            arguments = arguments != null ? List.copyOf(arguments) : List.of();
            keywords = keywords != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(keywords))
                : Map.of();
        }

        /**
         * Returns the last segment of the callee name.
         *
         * @return simple function name
         */
        public String simpleName() {
            int dot = function.lastIndexOf('.');
            return dot < 0 ? function : function.substring(dot + 1);
        }
    }

    /**
     * Expression that is not evaluated.
     *
     * @param text source tokens joined by spaces
     */
    public record Opaque(String text) implements Node {
        public Opaque {
            Objects.requireNonNull(text, "text must not be null");
        }
    }
}
