package com.iimsoft.binassign.solver.heuristic;

import com.iimsoft.binassign.domain.Bin;
import com.iimsoft.binassign.domain.Material;
import org.optaplanner.core.api.domain.entity.PlanningEntity;
import org.optaplanner.core.api.domain.lookup.PlanningId;
import org.optaplanner.core.api.domain.valuerange.ValueRangeProvider;
import org.optaplanner.core.api.domain.variable.PlanningVariable;

import java.math.BigDecimal;
import java.util.List;

@PlanningEntity
public class MaterialPlacement {

    @PlanningId
    private String id;

    // 固定事实
    private Material material;
    private List<Bin> candidateBins;

    // 规划变量：物料所在库位（可为空=未分配）。值域只含兼容库位
    @PlanningVariable(valueRangeProviderRefs = "binRange", nullable = true)
    private Bin bin;

    public MaterialPlacement() {}

    public MaterialPlacement(Material material, List<Bin> candidateBins, Bin bin) {
        this.id = material.getId();
        this.material = material;
        this.candidateBins = candidateBins;
        this.bin = bin;
    }

    @ValueRangeProvider(id = "binRange")
    public List<Bin> getCandidateBins() { return candidateBins; }

    public String getId() { return id; }
    public Material getMaterial() { return material; }
    public Bin getBin() { return bin; }

    public void setId(String id) { this.id = id; }
    public void setMaterial(Material material) { this.material = material; }
    public void setCandidateBins(List<Bin> candidateBins) { this.candidateBins = candidateBins; }
    public void setBin(Bin bin) { this.bin = bin; }

    // 派生属性
    public BigDecimal getSize() {
        return BigDecimal.valueOf(material.getSize());
    }

    public BigDecimal getPlacementCost() {
        return bin == null ? BigDecimal.ZERO : BigDecimal.valueOf(material.getFrequency() * bin.getCost());
    }

    @Override
    public String toString() {
        return "Placement{" + id + " -> " + (bin == null ? "UNASSIGNED" : bin.getId()) + "}";
    }
}
