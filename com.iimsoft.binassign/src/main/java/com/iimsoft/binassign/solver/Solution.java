package com.iimsoft.binassign.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 一次求解的结果，不可变。
 * <p>
 * assignments 只包含已分配的物料（物料标识 -> 库位标识，按物料标识排序）；
 * 未出现在其中的物料即为未分配，见 {@link #getUnassigned()}。
 */
public final class Solution {

    private final SolveStatus status;
    private final SolveStrategy strategy;
    private final Map<String, String> assignments;
    private final List<String> unassigned;
    private final double objectiveValue;
    private final long nodesExplored;
    private final long elapsedMillis;

    private Solution(SolveStatus status, SolveStrategy strategy, Map<String, String> assignments,
                     List<String> unassigned, double objectiveValue, long nodesExplored, long elapsedMillis) {
        this.status = status;
        this.strategy = strategy;
        this.assignments = assignments;
        this.unassigned = unassigned;
        this.objectiveValue = objectiveValue;
        this.nodesExplored = nodesExplored;
        this.elapsedMillis = elapsedMillis;
    }

    /**
     * @param materialIds    全部物料标识（目录下标顺序）
     * @param binIds         全部库位标识（目录下标顺序）
     * @param binOfMaterial  每个物料所在库位下标，-1 表示未分配
     * @param objectiveValue 求解器自行累计的目标值
     */
    public static Solution of(SolveStatus status, SolveStrategy strategy,
                              List<String> materialIds, List<String> binIds, int[] binOfMaterial,
                              double objectiveValue, long nodesExplored, long elapsedMillis) {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(strategy, "strategy");
        if (binOfMaterial.length != materialIds.size()) {
            throw new IllegalArgumentException("binOfMaterial 长度 " + binOfMaterial.length
                    + " 与物料数 " + materialIds.size() + " 不一致");
        }
        Map<String, String> assignments = new TreeMap<>();
        List<String> unassigned = new ArrayList<>();
        for (int i = 0; i < binOfMaterial.length; i++) {
            if (binOfMaterial[i] < 0) {
                unassigned.add(materialIds.get(i));
            } else {
                assignments.put(materialIds.get(i), binIds.get(binOfMaterial[i]));
            }
        }
        Collections.sort(unassigned);
        return new Solution(status, strategy, Collections.unmodifiableMap(assignments),
                Collections.unmodifiableList(unassigned), objectiveValue, nodesExplored, elapsedMillis);
    }

    public SolveStatus getStatus() { return status; }
    public SolveStrategy getStrategy() { return strategy; }
    public Map<String, String> getAssignments() { return assignments; }
    public List<String> getUnassigned() { return unassigned; }
    public double getObjectiveValue() { return objectiveValue; }
    public long getNodesExplored() { return nodesExplored; }
    public long getElapsedMillis() { return elapsedMillis; }

    /**
     * @return 库位标识，未分配时为 null
     */
    public String binOf(String materialId) {
        return assignments.get(materialId);
    }

    public boolean isAssigned(String materialId) {
        return assignments.containsKey(materialId);
    }

    @Override
    public String toString() {
        return "Solution{status=" + status + ", strategy=" + strategy + ", objective=" + objectiveValue
                + ", assigned=" + assignments.size() + ", unassigned=" + unassigned.size() + "}";
    }
}
