package com.iimsoft.binassign.model;

public enum ConstraintSense {
    EQUAL,
    LESS_OR_EQUAL;

    public boolean isSatisfied(double lhs, double rhs, double tolerance) {
        if (this == EQUAL) {
            return Math.abs(lhs - rhs) <= tolerance;
        }
        return lhs <= rhs + tolerance;
    }

    public String symbol() {
        return this == EQUAL ? "=" : "<=";
    }
}
