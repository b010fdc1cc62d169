package com.astpath.query;

/**
 * Aborts an evaluation. No partial result is ever returned alongside it.
 */
public class EvaluationException extends PathException {

    public enum Reason {
        /** Nested path predicates went deeper than the configured maximum. */
        RECURSION_LIMIT,
        /** The evaluation expanded more nodes than the configured maximum. */
        VISIT_LIMIT,
        /** A nested path predicate could not be parsed when it was first evaluated. */
        MALFORMED_NESTED_PATH
    }

    private final Reason reason;

    public EvaluationException(Reason reason, String message) {
        super(message, -1);
        this.reason = reason;
    }

    public EvaluationException(Reason reason, String message, PathException cause) {
        super(message, cause.getPosition(), cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * True when the query was well formed but too expensive; a narrower path may succeed.
     * False when the path itself has to be fixed.
     */
    public boolean isBudgetExceeded() {
        return reason != Reason.MALFORMED_NESTED_PATH;
    }
}
