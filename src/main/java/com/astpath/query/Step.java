package com.astpath.query;

import org.eclipse.collections.api.list.ImmutableList;

public record Step(Axis axis, NodeTest nodeTest, ImmutableList<Predicate> predicates) {

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(axis.axisName()).append("::").append(nodeTest);
        predicates.each(predicate -> sb.append('[').append(predicate).append(']'));
        return sb.toString();
    }
}
