package com.iimsoft.binassign.solver.heuristic;

import org.optaplanner.core.api.score.buildin.hardmediumsoftbigdecimal.HardMediumSoftBigDecimalScore;
import org.optaplanner.core.api.score.stream.Constraint;
import org.optaplanner.core.api.score.stream.ConstraintCollectors;
import org.optaplanner.core.api.score.stream.ConstraintFactory;
import org.optaplanner.core.api.score.stream.ConstraintProvider;

import java.math.BigDecimal;

/**
 * 库位分配约束。兼容性由实体值域保证，这里不再重复。
 */
public class PlacementConstraintProvider implements ConstraintProvider {

    @Override
    public Constraint[] defineConstraints(ConstraintFactory constraintFactory) {
        return new Constraint[] {
            // 硬约束
            binCapacity(constraintFactory),

            // 中约束
            unassignedMaterial(constraintFactory),

            // 软约束
            placementCost(constraintFactory)
        };
    }

    /**
     * 硬约束：库位内物料 size 之和不超过 capacity，按超出量惩罚
     */
    Constraint binCapacity(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(MaterialPlacement.class)
                .groupBy(MaterialPlacement::getBin, ConstraintCollectors.sumBigDecimal(MaterialPlacement::getSize))
                .filter((bin, used) -> used.compareTo(BigDecimal.valueOf(bin.getCapacity())) > 0)
                .penalizeBigDecimal(HardMediumSoftBigDecimalScore.ONE_HARD,
                        (bin, used) -> used.subtract(BigDecimal.valueOf(bin.getCapacity())))
                .asConstraint("库位容量");
    }

    /**
     * 中约束：每个未分配物料罚 1
     */
    Constraint unassignedMaterial(ConstraintFactory constraintFactory) {
        return constraintFactory.forEachIncludingNullVars(MaterialPlacement.class)
                .filter(placement -> placement.getBin() == null)
                .penalize(HardMediumSoftBigDecimalScore.ONE_MEDIUM)
                .asConstraint("未分配物料");
    }

    /**
     * 软约束：frequency * cost
     */
    Constraint placementCost(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(MaterialPlacement.class)
                .penalizeBigDecimal(HardMediumSoftBigDecimalScore.ONE_SOFT, MaterialPlacement::getPlacementCost)
                .asConstraint("放置成本");
    }
}
