package com.iimsoft.binassign.solver;

import com.iimsoft.binassign.solver.exact.BranchAndBoundSolver;
import com.iimsoft.binassign.solver.heuristic.HeuristicAssignmentSolver;

import java.util.Objects;

public final class AssignmentSolvers {

    private AssignmentSolvers() {
    }

    public static AssignmentSolver forStrategy(SolveStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy");
        switch (strategy) {
            case EXACT:
                return new BranchAndBoundSolver();
            case HEURISTIC:
                return new HeuristicAssignmentSolver();
            default:
                throw new IllegalArgumentException("未知求解策略: " + strategy);
        }
    }
}
