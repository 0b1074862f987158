package com.iimsoft.binassign.solver.heuristic;

import com.iimsoft.binassign.domain.Bin;
import org.optaplanner.core.api.domain.solution.PlanningEntityCollectionProperty;
import org.optaplanner.core.api.domain.solution.PlanningScore;
import org.optaplanner.core.api.domain.solution.PlanningSolution;
import org.optaplanner.core.api.domain.solution.ProblemFactCollectionProperty;
import org.optaplanner.core.api.score.buildin.hardmediumsoftbigdecimal.HardMediumSoftBigDecimalScore;

import java.util.List;

/**
 * 局部搜索的工作解：
 * - hard：库位超容量
 * - medium：未分配物料数
 * - soft：sum(frequency * cost)
 */
@PlanningSolution
public class PlacementSolution {

    @ProblemFactCollectionProperty
    private List<Bin> binList;

    @PlanningEntityCollectionProperty
    private List<MaterialPlacement> placementList;

    @PlanningScore
    private HardMediumSoftBigDecimalScore score;

    public PlacementSolution() {}

    public PlacementSolution(List<Bin> binList, List<MaterialPlacement> placementList) {
        this.binList = binList;
        this.placementList = placementList;
    }

    public List<Bin> getBinList() { return binList; }
    public List<MaterialPlacement> getPlacementList() { return placementList; }
    public HardMediumSoftBigDecimalScore getScore() { return score; }

    public void setBinList(List<Bin> binList) { this.binList = binList; }
    public void setPlacementList(List<MaterialPlacement> placementList) { this.placementList = placementList; }
    public void setScore(HardMediumSoftBigDecimalScore score) { this.score = score; }
}
