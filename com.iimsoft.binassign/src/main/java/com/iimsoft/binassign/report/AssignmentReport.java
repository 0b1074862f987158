package com.iimsoft.binassign.report;

import com.iimsoft.binassign.solver.SolveStatus;
import com.iimsoft.binassign.solver.SolveStrategy;

import java.util.Collections;
import java.util.List;

/**
 * 面向调用方的分配结果，不可变。lines 与 binUtilizations 保持目录顺序。
 */
public final class AssignmentReport {

    private final SolveStatus status;
    private final SolveStrategy strategy;
    private final double objectiveValue;
    private final List<AssignmentLine> lines;
    private final List<String> unassigned;
    private final List<BinUtilization> binUtilizations;
    private final long nodesExplored;
    private final long elapsedMillis;

    AssignmentReport(SolveStatus status, SolveStrategy strategy, double objectiveValue,
                     List<AssignmentLine> lines, List<String> unassigned, List<BinUtilization> binUtilizations,
                     long nodesExplored, long elapsedMillis) {
        this.status = status;
        this.strategy = strategy;
        this.objectiveValue = objectiveValue;
        this.lines = Collections.unmodifiableList(lines);
        this.unassigned = Collections.unmodifiableList(unassigned);
        this.binUtilizations = Collections.unmodifiableList(binUtilizations);
        this.nodesExplored = nodesExplored;
        this.elapsedMillis = elapsedMillis;
    }

    public SolveStatus getStatus() { return status; }
    public SolveStrategy getStrategy() { return strategy; }
    public double getObjectiveValue() { return objectiveValue; }
    public List<AssignmentLine> getLines() { return lines; }
    public List<String> getUnassigned() { return unassigned; }
    public List<BinUtilization> getBinUtilizations() { return binUtilizations; }
    public long getNodesExplored() { return nodesExplored; }
    public long getElapsedMillis() { return elapsedMillis; }

    public AssignmentLine lineOf(String materialId) {
        for (AssignmentLine line : lines) {
            if (line.getMaterialId().equals(materialId)) {
                return line;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "AssignmentReport{status=" + status + ", strategy=" + strategy + ", objective=" + objectiveValue
                + ", lines=" + lines + ", unassigned=" + unassigned + "}";
    }
}
