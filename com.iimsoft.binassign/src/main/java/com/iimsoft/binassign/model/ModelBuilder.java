package com.iimsoft.binassign.model;

import com.iimsoft.binassign.compat.CompatibilityMatrix;
import com.iimsoft.binassign.domain.Bin;
import com.iimsoft.binassign.domain.Catalog;
import com.iimsoft.binassign.domain.Material;
import com.iimsoft.binassign.exception.ModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 把目录 + 兼容矩阵转成 {@link OptimizationModel}。
 * <p>
 * 结构性不可行（空目录；不允许未分配时某物料没有任何兼容库位）在这里以 {@link ModelException} 报出，
 * 不会进入求解器。
 */
public class ModelBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModelBuilder.class);

    private final boolean allowUnassigned;

    public ModelBuilder(boolean allowUnassigned) {
        this.allowUnassigned = allowUnassigned;
    }

    public OptimizationModel build(Catalog catalog, CompatibilityMatrix matrix) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(matrix, "matrix");
        if (catalog.materialCount() == 0) {
            throw new ModelException("目录中没有物料", null);
        }
        if (catalog.binCount() == 0) {
            throw new ModelException("目录中没有库位", null);
        }
        if (matrix.materialCount() != catalog.materialCount() || matrix.binCount() != catalog.binCount()) {
            throw new IllegalArgumentException("兼容矩阵尺寸 " + matrix.materialCount() + "x" + matrix.binCount()
                    + " 与目录 " + catalog.materialCount() + "x" + catalog.binCount() + " 不一致");
        }

        List<Material> materials = catalog.getMaterials();
        List<Bin> bins = catalog.getBins();

        // 库位按标识升序，保证变量顺序与字典序平局规则一致
        List<Integer> binOrder = new ArrayList<>();
        for (int j = 0; j < bins.size(); j++) {
            binOrder.add(j);
        }
        binOrder.sort(Comparator.comparing(j -> bins.get(j).getId()));

        List<AssignmentVariable> variables = new ArrayList<>();
        List<List<AssignmentVariable>> byMaterial = new ArrayList<>();
        List<List<AssignmentVariable>> byBin = new ArrayList<>();
        for (int j = 0; j < bins.size(); j++) {
            byBin.add(new ArrayList<>());
        }

        for (int i = 0; i < materials.size(); i++) {
            Material material = materials.get(i);
            List<AssignmentVariable> row = new ArrayList<>();
            for (int j : binOrder) {
                if (!matrix.isCompatible(i, j)) {
                    continue;
                }
                AssignmentVariable v = new AssignmentVariable(variables.size(), i, j, material, bins.get(j));
                variables.add(v);
                row.add(v);
                byBin.get(j).add(v);
            }
            if (row.isEmpty() && !allowUnassigned) {
                throw new ModelException("物料 " + material.getId() + " (类别 " + material.getCategory()
                        + ") 没有任何兼容库位，且不允许未分配", material.getId());
            }
            byMaterial.add(row);
        }

        ConstraintSense coverageSense = allowUnassigned ? ConstraintSense.LESS_OR_EQUAL : ConstraintSense.EQUAL;
        List<CoverageConstraint> coverage = new ArrayList<>(materials.size());
        for (int i = 0; i < materials.size(); i++) {
            coverage.add(new CoverageConstraint(i, materials.get(i).getId(), byMaterial.get(i), coverageSense));
        }
        List<CapacityConstraint> capacity = new ArrayList<>(bins.size());
        for (int j = 0; j < bins.size(); j++) {
            Bin bin = bins.get(j);
            capacity.add(new CapacityConstraint(j, bin.getId(), byBin.get(j), bin.getCapacity()));
        }

        OptimizationModel model = new OptimizationModel(catalog, matrix, allowUnassigned, variables, coverage, capacity);
        LOGGER.debug("Model built: {} variables (of {} pairs), {} constraints",
                model.variableCount(), (long) materials.size() * bins.size(), model.constraintCount());
        return model;
    }

    public boolean isAllowUnassigned() {
        return allowUnassigned;
    }
}
