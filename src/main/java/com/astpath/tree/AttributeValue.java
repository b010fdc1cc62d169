package com.astpath.tree;

/**
 * A value a tree provider exposes under an attribute key, e.g. {@code async -> true} or
 * {@code modifiers -> "public static"}.
 */
public sealed interface AttributeValue {

    /** Text used when the value takes part in a string comparison. */
    String asText();

    record BooleanValue(boolean value) implements AttributeValue {
        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    record StringValue(String value) implements AttributeValue {
        @Override
        public String asText() {
            return value;
        }
    }

    record NumberValue(double value) implements AttributeValue {
        @Override
        public String asText() {
            // Whole numbers print without the trailing ".0"
            if (value == (long) value && !Double.isInfinite(value)) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }
    }

    static AttributeValue of(boolean value) {
        return new BooleanValue(value);
    }

    static AttributeValue of(String value) {
        return new StringValue(value);
    }

    static AttributeValue of(double value) {
        return new NumberValue(value);
    }

    static AttributeValue of(Object value) {
        if (value instanceof AttributeValue attributeValue) {
            return attributeValue;
        }
        if (value instanceof Boolean b) {
            return of(b.booleanValue());
        }
        if (value instanceof Number n) {
            return of(n.doubleValue());
        }
        if (value instanceof String s) {
            return of(s);
        }
        throw new IllegalArgumentException("Unsupported attribute value: " + value);
    }
}
