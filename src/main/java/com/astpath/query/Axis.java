package com.astpath.query;

import java.util.Arrays;
import java.util.Optional;

public enum Axis {

    CHILD("child", false),
    DESCENDANT("descendant", false),
    DESCENDANT_OR_SELF("descendant-or-self", false),
    PARENT("parent", true),
    ANCESTOR("ancestor", true),
    ANCESTOR_OR_SELF("ancestor-or-self", true),
    FOLLOWING_SIBLING("following-sibling", false),
    PRECEDING_SIBLING("preceding-sibling", true),
    FOLLOWING("following", false),
    PRECEDING("preceding", true),
    SELF("self", false);

    private final String axisName;
    private final boolean reverse;

    Axis(String axisName, boolean reverse) {
        this.axisName = axisName;
        this.reverse = reverse;
    }

    public String axisName() {
        return axisName;
    }

    /** Reverse axes list nodes nearest first, so positions count away from the context node. */
    public boolean isReverse() {
        return reverse;
    }

    public static Optional<Axis> fromName(String name) {
        return Arrays.stream(values()).filter(axis -> axis.axisName.equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return axisName;
    }
}
