package com.iimsoft.binassign.solver;

import com.iimsoft.binassign.domain.Bin;
import com.iimsoft.binassign.domain.Material;
import com.iimsoft.binassign.model.AssignmentVariable;
import com.iimsoft.binassign.model.CoverageConstraint;
import com.iimsoft.binassign.model.OptimizationModel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 模型的数组视图，供搜索算法使用。下标与目录一致；candidates[i] 按库位标识升序。
 */
public final class PlacementProblem {

    /** 容量比较的绝对容差，吸收尺寸逐个累减时的浮点舍入误差 */
    public static final double CAPACITY_EPSILON = 1e-9;

    private final OptimizationModel model;
    private final List<String> materialIds;
    private final List<String> binIds;
    private final int[] frequency;
    private final double[] size;
    private final double[] capacity;
    private final double[] cost;
    private final int[][] candidates;

    private PlacementProblem(OptimizationModel model, List<String> materialIds, List<String> binIds,
                             int[] frequency, double[] size, double[] capacity, double[] cost, int[][] candidates) {
        this.model = model;
        this.materialIds = materialIds;
        this.binIds = binIds;
        this.frequency = frequency;
        this.size = size;
        this.capacity = capacity;
        this.cost = cost;
        this.candidates = candidates;
    }

    public static PlacementProblem of(OptimizationModel model) {
        List<Material> materials = model.getCatalog().getMaterials();
        List<Bin> bins = model.getCatalog().getBins();
        int n = materials.size();
        int m = bins.size();

        List<String> materialIds = new ArrayList<>(n);
        int[] frequency = new int[n];
        double[] size = new double[n];
        for (int i = 0; i < n; i++) {
            Material material = materials.get(i);
            materialIds.add(material.getId());
            frequency[i] = material.getFrequency();
            size[i] = material.getSize();
        }
        List<String> binIds = new ArrayList<>(m);
        double[] capacity = new double[m];
        double[] cost = new double[m];
        for (int j = 0; j < m; j++) {
            Bin bin = bins.get(j);
            binIds.add(bin.getId());
            capacity[j] = bin.getCapacity();
            cost[j] = bin.getCost();
        }
        int[][] candidates = new int[n][];
        for (CoverageConstraint coverage : model.getCoverageConstraints()) {
            List<AssignmentVariable> vars = coverage.getVariables();
            int[] row = new int[vars.size()];
            for (int k = 0; k < vars.size(); k++) {
                row[k] = vars.get(k).getBinIndex();
            }
            candidates[coverage.getMaterialIndex()] = row;
        }
        return new PlacementProblem(model, Collections.unmodifiableList(materialIds),
                Collections.unmodifiableList(binIds), frequency, size, capacity, cost, candidates);
    }

    public OptimizationModel getModel() { return model; }
    public List<String> getMaterialIds() { return materialIds; }
    public List<String> getBinIds() { return binIds; }
    public boolean isAllowUnassigned() { return model.isAllowUnassigned(); }

    public int materialCount() { return frequency.length; }
    public int binCount() { return capacity.length; }

    public int frequency(int material) { return frequency[material]; }
    public double size(int material) { return size[material]; }
    public double capacity(int bin) { return capacity[bin]; }
    public double cost(int bin) { return cost[bin]; }
    public int[] candidates(int material) { return candidates[material]; }

    public double placementCost(int material, int bin) {
        return frequency[material] * cost[bin];
    }

    /**
     * 物料能否放入剩余容量为 remaining 的库位。
     * <p>
     * 判定为 {@code size <= remaining + CAPACITY_EPSILON}：超出剩余容量不到 1e-9 的物料视为放得下，
     * 所以库位装载量最多可比容量大 1e-9。
     * 超出 1e-9 以上的一律拒绝。{@link com.iimsoft.binassign.report.ResultReporter} 使用同一容差复核。
     */
    public static boolean fits(double remaining, double size) {
        return size <= remaining + CAPACITY_EPSILON;
    }

    /**
     * 按分配数组累计目标值。
     */
    public double objectiveOf(int[] binOfMaterial) {
        double total = 0.0;
        for (int i = 0; i < binOfMaterial.length; i++) {
            if (binOfMaterial[i] >= 0) {
                total += placementCost(i, binOfMaterial[i]);
            }
        }
        return total;
    }

    public static int unassignedCount(int[] binOfMaterial) {
        int count = 0;
        for (int b : binOfMaterial) {
            if (b < 0) count++;
        }
        return count;
    }

    public Solution toSolution(SolveStatus status, SolveStrategy strategy, int[] binOfMaterial,
                               double objectiveValue, long nodesExplored, long elapsedMillis) {
        return Solution.of(status, strategy, materialIds, binIds, binOfMaterial, objectiveValue, nodesExplored, elapsedMillis);
    }

    public Solution emptySolution(SolveStatus status, SolveStrategy strategy, long nodesExplored, long elapsedMillis) {
        int[] none = new int[materialCount()];
        Arrays.fill(none, -1);
        return toSolution(status, strategy, none, 0.0, nodesExplored, elapsedMillis);
    }
}
