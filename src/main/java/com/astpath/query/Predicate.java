package com.astpath.query;

/**
 * Boolean filter attached to a step. Instances are immutable; {@link #toString()} renders the
 * predicate back in path syntax, without the surrounding brackets.
 */
public sealed interface Predicate {

    enum Operator {
        EQUALS("="),
        NOT_EQUALS("!="),
        TOKEN_CONTAINS("~="),
        LESS_THAN("<"),
        LESS_OR_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_OR_EQUAL(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        static Operator of(TokenType type) {
            return switch (type) {
                case EQUALS -> EQUALS;
                case NOT_EQUALS -> NOT_EQUALS;
                case TOKEN_CONTAINS -> TOKEN_CONTAINS;
                case LESS_THAN -> LESS_THAN;
                case LESS_OR_EQUAL -> LESS_OR_EQUAL;
                case GREATER_THAN -> GREATER_THAN;
                case GREATER_OR_EQUAL -> GREATER_OR_EQUAL;
                default -> throw new IllegalArgumentException("Not a comparison operator: " + type);
            };
        }

        @Override
        public String toString() {
            return symbol;
        }
    }

    enum TextFunction {
        CONTAINS("contains"),
        STARTS_WITH("starts-with"),
        ENDS_WITH("ends-with");

        private final String functionName;

        TextFunction(String functionName) {
            this.functionName = functionName;
        }

        public String functionName() {
            return functionName;
        }

        boolean apply(String text, String argument) {
            return switch (this) {
                case CONTAINS -> text.contains(argument);
                case STARTS_WITH -> text.startsWith(argument);
                case ENDS_WITH -> text.endsWith(argument);
            };
        }
    }

    /** Declared name, exact or with {@code *} / {@code ?} wildcards. */
    record Name(String pattern) implements Predicate {
        @Override
        public String toString() {
            return pattern;
        }
    }

    /** Declared name given as a quoted literal; wildcard characters match themselves. */
    record ExactName(String name) implements Predicate {
        @Override
        public String toString() {
            return PathSyntax.quote(name);
        }
    }

    /**
     * {@code @key} or {@code @key op value}; operator and value are null for the bare form.
     * {@code literal} is set when the value was quoted, which turns off wildcard matching.
     */
    record Attribute(String key, Operator operator, String value, boolean literal) implements Predicate {

        public static Attribute present(String key) {
            return new Attribute(key, null, null, false);
        }

        public boolean isPresenceTest() {
            return operator == null;
        }

        @Override
        public String toString() {
            if (operator == null) {
                return "@" + key;
            }
            return "@" + key + " " + operator + " " + (literal ? PathSyntax.quote(value) : value);
        }
    }

    /** {@code contains('...')} against the node's source text. */
    record Contains(String substring) implements Predicate {
        @Override
        public String toString() {
            return "contains(" + PathSyntax.quote(substring) + ")";
        }
    }

    /** Text function applied to an attribute, or to the source text when {@code key} is null. */
    record TextMatch(TextFunction function, String key, String argument) implements Predicate {
        @Override
        public String toString() {
            String target = key == null ? "" : "@" + key + ", ";
            return function.functionName() + "(" + target + PathSyntax.quote(argument) + ")";
        }
    }

    /**
     * {@code [N]}, {@code last()} or {@code last()-N}. For {@link Kind#INDEX} the value is the
     * 1-based index, for {@link Kind#LAST} it is the distance from the last candidate.
     */
    record Position(Kind kind, int value) implements Predicate {

        public enum Kind { INDEX, LAST }

        public static Position index(int index) {
            return new Position(Kind.INDEX, index);
        }

        public static Position last(int offset) {
            return new Position(Kind.LAST, offset);
        }

        public boolean matches(int position, int size) {
            return switch (kind) {
                case INDEX -> position == value;
                case LAST -> position == size - value;
            };
        }

        @Override
        public String toString() {
            if (kind == Kind.INDEX) {
                return Integer.toString(value);
            }
            return value == 0 ? "last()" : "last()-" + value;
        }
    }

    record And(Predicate left, Predicate right) implements Predicate {
        @Override
        public String toString() {
            return "(" + left + " and " + right + ")";
        }
    }

    record Or(Predicate left, Predicate right) implements Predicate {
        @Override
        public String toString() {
            return "(" + left + " or " + right + ")";
        }
    }

    record Not(Predicate inner) implements Predicate {
        @Override
        public String toString() {
            return "not(" + inner + ")";
        }
    }

    /** A sub-path kept as raw text; it is parsed when first evaluated. */
    record NestedPath(String path) implements Predicate {
        @Override
        public String toString() {
            return path;
        }
    }
}
