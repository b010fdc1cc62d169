package com.astpath.query;

/**
 * Work counter shared by everything one top level evaluation does, nested path predicates
 * included. Not thread-safe; a budget belongs to a single call.
 */
public final class EvaluationBudget {

    private final int maxDepth;
    private final int maxVisits;
    private int visits;

    public EvaluationBudget(int maxDepth, int maxVisits) {
        this.maxDepth = maxDepth;
        this.maxVisits = maxVisits;
    }

    static EvaluationBudget of(EngineOptions options) {
        return new EvaluationBudget(options.maxDepth(), options.maxVisits());
    }

    void visit() {
        if (++visits > maxVisits) {
            throw new EvaluationException(EvaluationException.Reason.VISIT_LIMIT,
                    "Evaluation visited more than " + maxVisits + " nodes");
        }
    }

    void checkDepth(int depth) {
        if (depth > maxDepth) {
            throw new EvaluationException(EvaluationException.Reason.RECURSION_LIMIT,
                    "Nested path predicates exceed the maximum depth of " + maxDepth);
        }
    }

    public int visits() {
        return visits;
    }
}
