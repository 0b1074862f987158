package com.iimsoft.binassign.model;

import java.util.Collections;
import java.util.List;

/**
 * 覆盖约束：某物料在所有兼容库位上的变量之和 =1（必须放置）或 <=1（允许不放）。
 */
public final class CoverageConstraint {

    private final int materialIndex;
    private final String materialId;
    private final List<AssignmentVariable> variables;
    private final ConstraintSense sense;

    CoverageConstraint(int materialIndex, String materialId, List<AssignmentVariable> variables, ConstraintSense sense) {
        this.materialIndex = materialIndex;
        this.materialId = materialId;
        this.variables = Collections.unmodifiableList(variables);
        this.sense = sense;
    }

    public int getMaterialIndex() { return materialIndex; }
    public String getMaterialId() { return materialId; }
    /** 按库位标识升序 */
    public List<AssignmentVariable> getVariables() { return variables; }
    public ConstraintSense getSense() { return sense; }
    public double getRightHandSide() { return 1.0; }

    @Override
    public String toString() {
        return "cover[" + materialId + "]: sum(" + variables.size() + " vars) " + sense.symbol() + " 1";
    }
}
