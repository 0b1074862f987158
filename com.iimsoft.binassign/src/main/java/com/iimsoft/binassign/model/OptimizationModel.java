package com.iimsoft.binassign.model;

import com.iimsoft.binassign.compat.CompatibilityMatrix;
import com.iimsoft.binassign.domain.Catalog;

import java.util.Collections;
import java.util.List;

/**
 * 0/1 线性规划模型：变量 + 线性目标（最小化）+ 覆盖约束 + 容量约束。
 * <p>
 * 不兼容组合没有变量，兼容性在结构上成立，不需要显式约束。每次求解构建一次，之后不可变。
 */
public final class OptimizationModel {

    private final Catalog catalog;
    private final CompatibilityMatrix matrix;
    private final boolean allowUnassigned;
    private final List<AssignmentVariable> variables;
    private final List<CoverageConstraint> coverageConstraints;
    private final List<CapacityConstraint> capacityConstraints;

    OptimizationModel(Catalog catalog, CompatibilityMatrix matrix, boolean allowUnassigned,
                      List<AssignmentVariable> variables,
                      List<CoverageConstraint> coverageConstraints,
                      List<CapacityConstraint> capacityConstraints) {
        this.catalog = catalog;
        this.matrix = matrix;
        this.allowUnassigned = allowUnassigned;
        this.variables = Collections.unmodifiableList(variables);
        this.coverageConstraints = Collections.unmodifiableList(coverageConstraints);
        this.capacityConstraints = Collections.unmodifiableList(capacityConstraints);
    }

    public Catalog getCatalog() { return catalog; }
    public CompatibilityMatrix getMatrix() { return matrix; }
    public boolean isAllowUnassigned() { return allowUnassigned; }
    public List<AssignmentVariable> getVariables() { return variables; }
    /** 下标与目录物料下标一致 */
    public List<CoverageConstraint> getCoverageConstraints() { return coverageConstraints; }
    /** 下标与目录库位下标一致 */
    public List<CapacityConstraint> getCapacityConstraints() { return capacityConstraints; }

    public int variableCount() {
        return variables.size();
    }

    public int constraintCount() {
        return coverageConstraints.size() + capacityConstraints.size();
    }

    /**
     * 计算选中变量集合的目标值 sum(frequency * cost)。
     */
    public double objectiveOf(Iterable<AssignmentVariable> selected) {
        double total = 0.0;
        for (AssignmentVariable v : selected) {
            total += v.getObjectiveCoefficient();
        }
        return total;
    }

    @Override
    public String toString() {
        return "OptimizationModel{variables=" + variables.size()
                + ", coverage=" + coverageConstraints.size()
                + ", capacity=" + capacityConstraints.size()
                + ", allowUnassigned=" + allowUnassigned + "}";
    }
}
