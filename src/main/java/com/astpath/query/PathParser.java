package com.astpath.query;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Recursive descent parser for path strings.
 *
 * <pre>
 * Path      := ("/"|"//")? Step ( ("/"|"//") Step )*
 * Step      := ".." | "." Predicate* | (Axis "::")? NodeTest Predicate*
 * Predicate := "[" OrExpr "]"
 * OrExpr    := AndExpr ("or" AndExpr)*
 * AndExpr   := UnaryExpr ("and" UnaryExpr)*
 * UnaryExpr := "not" "(" OrExpr ")" | "not" Atom | Atom
 * Atom      := "@" key (op value)? | number | function "(" args ")" | nested path
 *            | name | 'quoted name' | "(" OrExpr ")"
 * </pre>
 *
 * A leading {@code //} expands from the start node along {@code descendant-or-self}, an inner
 * {@code //} along {@code descendant}. Nested paths inside predicates are captured as raw text
 * and parsed only when they are first evaluated.
 */
public class PathParser {

    private static final Logger logger = LoggerFactory.getLogger(PathParser.class);

    private static final int MAX_GROUP_DEPTH = 128;

    private static final String FUNCTIONS = "one of last(), first(), contains(), starts-with(), ends-with()";

    public PathExpression parse(String input) {
        Objects.requireNonNull(input, "path must not be null");
        PathExpression expression = new Parse(input, PathLexer.tokenize(input)).path();
        if (logger.isDebugEnabled()) {
            logger.debug("parsed '{}' as {}", input, expression.toCanonicalString());
        }
        return expression;
    }

    private static final class Parse {

        private final String input;
        private final ImmutableList<Token> tokens;
        private int index;
        private int depth;

        Parse(String input, ImmutableList<Token> tokens) {
            this.input = input;
            this.tokens = tokens;
        }

        PathExpression path() {
            MutableList<Step> steps = Lists.mutable.empty();
            boolean absolute = false;
            Axis axis = Axis.CHILD;
            if (current().is(TokenType.SLASH)) {
                absolute = true;
                advance();
                if (current().is(TokenType.EOF)) {
                    // "/" alone selects the root itself
                    steps.add(new Step(Axis.SELF, new NodeTest.AnyKind(), Lists.immutable.empty()));
                    return new PathExpression(input, true, steps.toImmutable());
                }
            } else if (current().is(TokenType.DOUBLE_SLASH)) {
                axis = Axis.DESCENDANT_OR_SELF;
                advance();
            }
            steps.add(step(axis));
            while (true) {
                if (current().is(TokenType.SLASH)) {
                    advance();
                    steps.add(step(Axis.CHILD));
                } else if (current().is(TokenType.DOUBLE_SLASH)) {
                    advance();
                    steps.add(step(Axis.DESCENDANT));
                } else {
                    break;
                }
            }
            expect(TokenType.EOF, "'/', '//', '[' or end of path");
            return new PathExpression(input, absolute, steps.toImmutable());
        }

        private Step step(Axis implicitAxis) {
            Token token = current();
            if (token.is(TokenType.DOT_DOT)) {
                advance();
                return new Step(Axis.PARENT, new NodeTest.AnyKind(), predicates());
            }
            if (token.is(TokenType.DOT)) {
                advance();
                return new Step(Axis.SELF, new NodeTest.AnyKind(), predicates());
            }
            Axis axis = implicitAxis;
            if (token.isWord() && peek(1).is(TokenType.AXIS_SEPARATOR)) {
                axis = Axis.fromName(token.text())
                        .orElseThrow(() -> new ParseException("axis name", token));
                advance();
                advance();
            }
            Token test = current();
            if (!test.isWord()) {
                throw new ParseException("node test", test);
            }
            advance();
            return new Step(axis, NodeTest.of(test.text()), predicates());
        }

        private ImmutableList<Predicate> predicates() {
            MutableList<Predicate> predicates = Lists.mutable.empty();
            while (current().is(TokenType.LEFT_BRACKET)) {
                advance();
                predicates.add(orExpr());
                expect(TokenType.RIGHT_BRACKET, "']'");
            }
            return predicates.toImmutable();
        }

        // every "(" and "not(" passes through here
        private Predicate orExpr() {
            if (++depth > MAX_GROUP_DEPTH) {
                throw new ParseException("at most " + MAX_GROUP_DEPTH + " nested groups", current());
            }
            try {
                Predicate left = andExpr();
                while (current().is(TokenType.OR)) {
                    advance();
                    left = new Predicate.Or(left, andExpr());
                }
                return left;
            } finally {
                depth--;
            }
        }

        private Predicate andExpr() {
            Predicate left = unaryExpr();
            while (current().is(TokenType.AND)) {
                advance();
                left = new Predicate.And(left, unaryExpr());
            }
            return left;
        }

        private Predicate unaryExpr() {
            if (current().is(TokenType.NOT)) {
                advance();
                if (current().is(TokenType.LEFT_PAREN)) {
                    advance();
                    Predicate inner = orExpr();
                    expect(TokenType.RIGHT_PAREN, "')'");
                    return new Predicate.Not(inner);
                }
                return new Predicate.Not(atom());
            }
            return atom();
        }

        private Predicate atom() {
            Token token = current();
            switch (token.type()) {
                case LEFT_PAREN: {
                    advance();
                    Predicate inner = orExpr();
                    expect(TokenType.RIGHT_PAREN, "')'");
                    return inner;
                }
                case AT:
                    return attribute();
                case NUMBER:
                    advance();
                    return Predicate.Position.index(positiveInteger(token));
                case STRING:
                    advance();
                    return new Predicate.ExactName(token.text());
                case DOT:
                case DOT_DOT:
                case SLASH:
                case DOUBLE_SLASH:
                    return nestedPath();
                case IDENTIFIER:
                    if (peek(1).is(TokenType.LEFT_PAREN)) {
                        return function();
                    }
                    if (peek(1).is(TokenType.AXIS_SEPARATOR)) {
                        return nestedPath();
                    }
                    advance();
                    return new Predicate.Name(token.text());
                case PATTERN:
                    advance();
                    return new Predicate.Name(token.text());
                default:
                    throw new ParseException("predicate expression", token);
            }
        }

        private Predicate attribute() {
            expect(TokenType.AT, "'@'");
            Token key = current();
            if (!key.is(TokenType.IDENTIFIER)) {
                throw new ParseException("attribute name", key);
            }
            advance();
            if (!current().type().isComparator()) {
                return Predicate.Attribute.present(key.text());
            }
            Predicate.Operator operator = Predicate.Operator.of(current().type());
            advance();
            Token value = current();
            switch (value.type()) {
                case STRING, NUMBER, IDENTIFIER, PATTERN -> advance();
                default -> throw new ParseException("attribute value", value);
            }
            return new Predicate.Attribute(key.text(), operator, value.text(), value.is(TokenType.STRING));
        }

        private Predicate function() {
            Token name = current();
            advance();
            expect(TokenType.LEFT_PAREN, "'('");
            switch (name.text()) {
                case "last": {
                    expect(TokenType.RIGHT_PAREN, "')'");
                    if (current().is(TokenType.MINUS)) {
                        advance();
                        Token offset = expect(TokenType.NUMBER, "number after 'last()-'");
                        return Predicate.Position.last(nonNegativeInteger(offset));
                    }
                    return Predicate.Position.last(0);
                }
                case "first":
                    expect(TokenType.RIGHT_PAREN, "')'");
                    return Predicate.Position.index(1);
                case "contains":
                    return textFunction(Predicate.TextFunction.CONTAINS);
                case "starts-with":
                    return textFunction(Predicate.TextFunction.STARTS_WITH);
                case "ends-with":
                    return textFunction(Predicate.TextFunction.ENDS_WITH);
                default:
                    throw new ParseException(FUNCTIONS, "function '" + name.text() + "'", name.offset());
            }
        }

        private Predicate textFunction(Predicate.TextFunction function) {
            String key = null;
            if (current().is(TokenType.AT)) {
                advance();
                key = expect(TokenType.IDENTIFIER, "attribute name").text();
                expect(TokenType.COMMA, "','");
            }
            Token argument = current();
            if (!argument.is(TokenType.STRING) && !argument.is(TokenType.NUMBER)) {
                throw new ParseException("string literal", argument);
            }
            advance();
            expect(TokenType.RIGHT_PAREN, "')'");
            if (function == Predicate.TextFunction.CONTAINS && key == null) {
                return new Predicate.Contains(argument.text());
            }
            return new Predicate.TextMatch(function, key, argument.text());
        }

        /**
         * Captures the raw text of a nested path. It ends at the bracket closing the enclosing
         * predicate, at a top level {@code and} / {@code or}, or at an unmatched {@code )}.
         */
        private Predicate nestedPath() {
            int start = current().offset();
            int brackets = 0;
            int parens = 0;
            while (!current().is(TokenType.EOF)) {
                Token token = current();
                if (token.is(TokenType.LEFT_BRACKET)) {
                    brackets++;
                } else if (token.is(TokenType.RIGHT_BRACKET)) {
                    if (brackets == 0) {
                        break;
                    }
                    brackets--;
                } else if (token.is(TokenType.LEFT_PAREN)) {
                    parens++;
                } else if (token.is(TokenType.RIGHT_PAREN)) {
                    if (brackets == 0 && parens == 0) {
                        break;
                    }
                    parens = Math.max(0, parens - 1);
                } else if (brackets == 0 && (token.is(TokenType.AND) || token.is(TokenType.OR))) {
                    break;
                }
                advance();
            }
            if (brackets > 0) {
                throw new ParseException("']'", current());
            }
            return new Predicate.NestedPath(input.substring(start, current().offset()).trim());
        }

        private int positiveInteger(Token token) {
            int value = nonNegativeInteger(token);
            if (value < 1) {
                throw new ParseException("position of 1 or more", token);
            }
            return value;
        }

        private int nonNegativeInteger(Token token) {
            try {
                return Integer.parseInt(token.text());
            } catch (NumberFormatException e) {
                throw new ParseException("whole number", token);
            }
        }

        private Token expect(TokenType type, String expected) {
            Token token = current();
            if (!token.is(type)) {
                throw new ParseException(expected, token);
            }
            advance();
            return token;
        }

        private Token current() {
            return tokens.get(index);
        }

        private Token peek(int ahead) {
            return tokens.get(Math.min(index + ahead, tokens.size() - 1));
        }

        private void advance() {
            if (index < tokens.size() - 1) {
                index++;
            }
        }
    }
}
