package com.iimsoft.binassign.solver;

import com.iimsoft.binassign.exception.InfeasibleException;

/**
 * 搜索前的必要条件检查，能直接证明不可行的情况不必进入搜索。只在不允许未分配时生效。
 */
public final class InfeasibilityCheck {

    private InfeasibilityCheck() {
    }

    public static void check(PlacementProblem problem) {
        if (problem.isAllowUnassigned()) {
            return;
        }
        boolean[] usable = new boolean[problem.binCount()];
        double demand = 0.0;
        for (int i = 0; i < problem.materialCount(); i++) {
            double size = problem.size(i);
            double largest = 0.0;
            for (int b : problem.candidates(i)) {
                usable[b] = true;
                largest = Math.max(largest, problem.capacity(b));
            }
            if (!PlacementProblem.fits(largest, size)) {
                String id = problem.getMaterialIds().get(i);
                throw new InfeasibleException("物料 " + id + " 的 size " + size
                        + " 超过所有兼容库位的容量（最大 " + largest + "）", id);
            }
            demand += size;
        }
        double supply = 0.0;
        for (int b = 0; b < usable.length; b++) {
            if (usable[b]) {
                supply += problem.capacity(b);
            }
        }
        if (!PlacementProblem.fits(supply, demand)) {
            throw new InfeasibleException("物料总体积 " + demand + " 超过兼容库位总容量 " + supply, null);
        }
    }
}
