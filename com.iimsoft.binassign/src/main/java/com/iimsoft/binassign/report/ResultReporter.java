package com.iimsoft.binassign.report;

import com.iimsoft.binassign.compat.CompatibilityMatrix;
import com.iimsoft.binassign.domain.Bin;
import com.iimsoft.binassign.domain.Catalog;
import com.iimsoft.binassign.domain.Material;
import com.iimsoft.binassign.exception.ConsistencyException;
import com.iimsoft.binassign.solver.PlacementProblem;
import com.iimsoft.binassign.solver.Solution;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 把 {@link Solution} 映射回物料 -> 库位报告，并独立复算目标值与各项不变量。
 * <p>
 * 任何不一致都是内部缺陷，抛出 {@link ConsistencyException}。
 */
public class ResultReporter {

    /** 目标值比较容差；目标值大于 1 时按相对误差 */
    public static final double OBJECTIVE_TOLERANCE = 1e-6;

    /** 与求解器放置判定一致：装载量超出容量不超过该值仍视为合法，见 {@link PlacementProblem#fits} */
    private static final double CAPACITY_TOLERANCE = PlacementProblem.CAPACITY_EPSILON;

    public AssignmentReport report(Solution solution, Catalog catalog) {
        return report(solution, catalog, null);
    }

    /**
     * @param matrix 不为 null 时额外校验每个分配的兼容性
     */
    public AssignmentReport report(Solution solution, Catalog catalog, CompatibilityMatrix matrix) {
        Objects.requireNonNull(solution, "solution");
        Objects.requireNonNull(catalog, "catalog");

        for (Map.Entry<String, String> e : solution.getAssignments().entrySet()) {
            if (catalog.findMaterial(e.getKey()) == null) {
                throw new ConsistencyException("结果中的物料 " + e.getKey() + " 不在目录中", e.getKey());
            }
            if (catalog.findBin(e.getValue()) == null) {
                throw new ConsistencyException("物料 " + e.getKey() + " 被分配到未知库位 " + e.getValue(), e.getKey());
            }
        }

        List<Bin> bins = catalog.getBins();
        double[] used = new double[bins.size()];
        int[] counts = new int[bins.size()];
        List<AssignmentLine> lines = new ArrayList<>();
        List<String> unassigned = new ArrayList<>();
        double objective = 0.0;

        List<Material> materials = catalog.getMaterials();
        for (int i = 0; i < materials.size(); i++) {
            Material material = materials.get(i);
            String binId = solution.binOf(material.getId());
            if (binId == null) {
                lines.add(new AssignmentLine(material.getId(), null, 0.0));
                unassigned.add(material.getId());
                continue;
            }
            int j = catalog.indexOfBin(binId);
            if (matrix != null && !matrix.isCompatible(i, j)) {
                throw new ConsistencyException("物料 " + material.getId() + " (类别 " + material.getCategory()
                        + ") 被分配到不兼容库位 " + binId + " (类型 " + bins.get(j).getSlotType() + ")", material.getId());
            }
            double contribution = material.getFrequency() * bins.get(j).getCost();
            objective += contribution;
            used[j] += material.getSize();
            counts[j]++;
            lines.add(new AssignmentLine(material.getId(), binId, contribution));
        }

        if (!sortedCopy(unassigned).equals(sortedCopy(solution.getUnassigned()))) {
            throw new ConsistencyException("未分配列表与分配结果不一致: " + solution.getUnassigned() + " vs " + unassigned, null);
        }

        List<BinUtilization> utilizations = new ArrayList<>(bins.size());
        for (int j = 0; j < bins.size(); j++) {
            Bin bin = bins.get(j);
            if (used[j] > bin.getCapacity() + CAPACITY_TOLERANCE) {
                throw new ConsistencyException("库位 " + bin.getId() + " 超容量: " + used[j] + " > " + bin.getCapacity(), bin.getId());
            }
            utilizations.add(new BinUtilization(bin.getId(), used[j], bin.getCapacity(), counts[j]));
        }

        double reported = solution.getObjectiveValue();
        double tolerance = OBJECTIVE_TOLERANCE * Math.max(1.0, Math.abs(objective));
        if (Double.isNaN(reported) || Math.abs(reported - objective) > tolerance) {
            throw new ConsistencyException("求解器目标值 " + reported + " 与复算值 " + objective + " 不一致", null);
        }

        return new AssignmentReport(solution.getStatus(), solution.getStrategy(), objective, lines, unassigned,
                utilizations, solution.getNodesExplored(), solution.getElapsedMillis());
    }

    private static List<String> sortedCopy(List<String> ids) {
        List<String> copy = new ArrayList<>(ids);
        copy.sort(null);
        return copy;
    }
}
