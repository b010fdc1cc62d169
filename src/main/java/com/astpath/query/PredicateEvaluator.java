package com.astpath.query;

import com.astpath.tree.AttributeValue;
import com.astpath.tree.SyntaxNode;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Decides whether a candidate satisfies a predicate. Missing names and attributes never
 * raise errors, they simply do not match.
 */
public class PredicateEvaluator {

    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    private final PathEvaluator paths;

    PredicateEvaluator(PathEvaluator paths) {
        this.paths = paths;
    }

    public boolean evaluate(Predicate predicate, EvaluationContext ctx) {
        SyntaxNode candidate = ctx.candidate();
        if (predicate instanceof Predicate.And and) {
            return evaluate(and.left(), ctx) && evaluate(and.right(), ctx);
        }
        if (predicate instanceof Predicate.Or or) {
            return evaluate(or.left(), ctx) || evaluate(or.right(), ctx);
        }
        if (predicate instanceof Predicate.Not not) {
            return !evaluate(not.inner(), ctx);
        }
        if (predicate instanceof Predicate.Name name) {
            return matchesName(candidate.name(), name.pattern());
        }
        if (predicate instanceof Predicate.ExactName exact) {
            return exact.name().equals(candidate.name());
        }
        if (predicate instanceof Predicate.Attribute attribute) {
            return matchesAttribute(candidate, attribute);
        }
        if (predicate instanceof Predicate.Contains contains) {
            return candidate.text() != null && candidate.text().contains(contains.substring());
        }
        if (predicate instanceof Predicate.TextMatch match) {
            String text = match.key() == null ? candidate.text() : attributeText(candidate, match.key());
            return text != null && match.function().apply(text, match.argument());
        }
        if (predicate instanceof Predicate.Position position) {
            return position.matches(ctx.position(), ctx.size());
        }
        if (predicate instanceof Predicate.NestedPath nested) {
            return paths.matchesNested(nested, ctx);
        }
        throw new IllegalStateException("Unhandled predicate: " + predicate);
    }

    static boolean matchesName(String name, String pattern) {
        if (name == null) {
            return false;
        }
        return WildcardPattern.isPattern(pattern) ? WildcardPattern.matches(pattern, name) : pattern.equals(name);
    }

    /**
     * Attribute the provider exposes under {@code key}; {@code kind}, {@code name} and
     * {@code text} fall back to the node's own properties.
     */
    static AttributeValue resolveAttribute(SyntaxNode node, String key) {
        AttributeValue value = node.attribute(key);
        if (value != null) {
            return value;
        }
        switch (key) {
            case "kind":
                return AttributeValue.of(node.kind());
            case "name":
                return node.name() == null ? null : AttributeValue.of(node.name());
            case "text":
                return node.text() == null ? null : AttributeValue.of(node.text());
            default:
                return null;
        }
    }

    private static String attributeText(SyntaxNode node, String key) {
        AttributeValue value = resolveAttribute(node, key);
        return value == null ? null : value.asText();
    }

    private static boolean matchesAttribute(SyntaxNode node, Predicate.Attribute attribute) {
        AttributeValue actual = resolveAttribute(node, attribute.key());
        if (actual == null) {
            return false;
        }
        if (attribute.isPresenceTest()) {
            return isTruthy(actual);
        }
        String expected = attribute.value();
        return switch (attribute.operator()) {
            case EQUALS -> valueEquals(actual, expected, attribute.literal());
            case NOT_EQUALS -> !valueEquals(actual, expected, attribute.literal());
            case TOKEN_CONTAINS -> Arrays.asList(actual.asText().trim().split("\\s+")).contains(expected);
            case LESS_THAN -> compare(actual, expected) < 0;
            case LESS_OR_EQUAL -> compare(actual, expected) <= 0;
            case GREATER_THAN -> compare(actual, expected) > 0;
            case GREATER_OR_EQUAL -> compare(actual, expected) >= 0;
        };
    }

    private static boolean isTruthy(AttributeValue value) {
        if (value instanceof AttributeValue.BooleanValue b) {
            return b.value();
        }
        if (value instanceof AttributeValue.StringValue s) {
            return !s.value().isEmpty() && !"false".equalsIgnoreCase(s.value());
        }
        return true;
    }

    private static boolean valueEquals(AttributeValue actual, String expected, boolean literal) {
        if (actual instanceof AttributeValue.NumberValue n) {
            Double number = toNumber(expected);
            return number != null && number == n.value();
        }
        if (actual instanceof AttributeValue.BooleanValue b) {
            return Boolean.toString(b.value()).equalsIgnoreCase(expected);
        }
        String text = actual.asText();
        if (!literal && WildcardPattern.isPattern(expected)) {
            return WildcardPattern.matches(expected, text);
        }
        return text.equals(expected);
    }

    private static int compare(AttributeValue actual, String expected) {
        Double left = actual instanceof AttributeValue.NumberValue n ? Double.valueOf(n.value()) : toNumber(actual.asText());
        Double right = toNumber(expected);
        if (left != null && right != null) {
            return Double.compare(left, right);
        }
        return actual.asText().compareTo(expected);
    }

    /**
     * Plain decimal notation only; Java suffixes, hex floats, {@code NaN} and {@code Infinity}
     * stay text.
     */
    private static Double toNumber(String text) {
        String trimmed = text.trim();
        if (!DECIMAL.matcher(trimmed).matches()) {
            return null;
        }
        return Double.valueOf(trimmed);
    }
}
