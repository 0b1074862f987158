package com.iimsoft.binassign.model;

import com.iimsoft.binassign.domain.Bin;
import com.iimsoft.binassign.domain.Material;

/**
 * 0/1 决策变量：物料是否放入库位。只为兼容的组合创建。
 */
public final class AssignmentVariable {

    private final int index;
    private final int materialIndex;
    private final int binIndex;
    private final Material material;
    private final Bin bin;

    AssignmentVariable(int index, int materialIndex, int binIndex, Material material, Bin bin) {
        this.index = index;
        this.materialIndex = materialIndex;
        this.binIndex = binIndex;
        this.material = material;
        this.bin = bin;
    }

    public int getIndex() { return index; }
    public int getMaterialIndex() { return materialIndex; }
    public int getBinIndex() { return binIndex; }
    public Material getMaterial() { return material; }
    public Bin getBin() { return bin; }

    /**
     * 目标函数系数 frequency * cost。
     */
    public double getObjectiveCoefficient() {
        return material.getFrequency() * bin.getCost();
    }

    /**
     * 容量约束系数 size。
     */
    public double getCapacityCoefficient() {
        return material.getSize();
    }

    @Override
    public String toString() {
        return "x[" + material.getId() + "," + bin.getId() + "]";
    }
}
