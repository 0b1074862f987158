package com.iimsoft.binassign.model;

import java.util.Collections;
import java.util.List;

/**
 * 容量约束：库位上所有变量的 size 加权和 <= capacity。
 */
public final class CapacityConstraint {

    private final int binIndex;
    private final String binId;
    private final List<AssignmentVariable> variables;
    private final double capacity;

    CapacityConstraint(int binIndex, String binId, List<AssignmentVariable> variables, double capacity) {
        this.binIndex = binIndex;
        this.binId = binId;
        this.variables = Collections.unmodifiableList(variables);
        this.capacity = capacity;
    }

    public int getBinIndex() { return binIndex; }
    public String getBinId() { return binId; }
    public List<AssignmentVariable> getVariables() { return variables; }
    public double getRightHandSide() { return capacity; }
    public ConstraintSense getSense() { return ConstraintSense.LESS_OR_EQUAL; }

    @Override
    public String toString() {
        return "capacity[" + binId + "]: sum(size * x) <= " + capacity;
    }
}
